package io.contextlink.window;

public enum WindowRole {
    ELECTING,
    PRIMARY,
    SECONDARY,
    STOPPED
}
