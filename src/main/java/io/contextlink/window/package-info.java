/**
 * Multi-window coordination.
 *
 * <p>{@link io.contextlink.window.WindowProcess} owns the role lifecycle: election over the shared
 * port range, Secondary registration, request fan-out and aggregation on the Primary, and
 * re-election when the Primary goes away.
 */
package io.contextlink.window;
