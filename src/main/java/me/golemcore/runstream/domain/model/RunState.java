package me.golemcore.runstream.domain.model;

/**
 * Router state for a single run: {@code STREAMING -> AWAITING_TOOLS ->
 * STREAMING -> TERMINAL}.
 */
public enum RunState {
    STREAMING,
    AWAITING_TOOLS,
    TERMINAL
}
