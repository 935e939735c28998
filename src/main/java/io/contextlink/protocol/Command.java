package io.contextlink.protocol;

import java.util.Optional;

public enum Command {
    REGISTER_ACTIVE_TARGET("register_active_target", "response_generic_ack", false, false),
    REGISTER_SECONDARY("register_secondary", "response_generic_ack", false, false),
    UNREGISTER_SECONDARY("unregister_secondary", "response_unregister_secondary_ack", false, false),
    GET_WORKSPACE_DETAILS("get_workspace_details", "response_workspace_details", true, true),
    SEARCH_WORKSPACE("search_workspace", "response_search_workspace", true, true),
    GET_OPEN_FILES("get_open_files", "response_open_files", true, true),
    GET_CONTENTS_FOR_FILES("get_contents_for_files", "response_contents_for_files", true, true),
    GET_ENTIRE_CODEBASE("get_entire_codebase", "response_entire_codebase", true, true),
    GET_FILE_TREE("get_file_tree", "response_file_tree", true, false),
    GET_FILE_CONTENT("get_file_content", "response_file_content", true, false),
    GET_FOLDER_CONTENT("get_folder_content", "response_folder_content", true, false),
    LIST_FOLDER_CONTENTS("list_folder_contents", "response_list_folder_contents", true, false),
    GET_ACTIVE_FILE_INFO("get_active_file_info", "response_active_file_info", true, false);

    private final String wireName;
    private final String responseName;
    private final boolean requiresWorkspace;
    private final boolean aggregated;

    Command(String wireName, String responseName, boolean requiresWorkspace, boolean aggregated) {
        this.wireName = wireName;
        this.responseName = responseName;
        this.requiresWorkspace = requiresWorkspace;
        this.aggregated = aggregated;
    }

    public String wireName() {
        return wireName;
    }

    public String responseName() {
        return responseName == null ? defaultResponseName(wireName) : responseName;
    }

    public boolean requiresWorkspace() {
        return requiresWorkspace;
    }

    public boolean aggregated() {
        return aggregated;
    }

    public static Optional<Command> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (Command value : values()) {
            if (value.wireName.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static String responseNameFor(String wireCommand) {
        return fromWire(wireCommand)
                .map(Command::responseName)
                .orElseGet(() -> defaultResponseName(wireCommand));
    }

    static String defaultResponseName(String wireCommand) {
        return "response_" + wireCommand;
    }
}
