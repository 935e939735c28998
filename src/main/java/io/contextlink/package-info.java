/**
 * ContextLink source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.contextlink.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.contextlink.cli.ContextLinkCommand} maps commands to window and client APIs.</li>
 *   <li>{@code io.contextlink.window.WindowProcess} runs election and the Primary or Secondary role.</li>
 *   <li>{@code io.contextlink.client.ContextLinkClient} is the browser-side connection and request surface.</li>
 * </ul>
 */
package io.contextlink;
