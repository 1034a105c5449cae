package me.golemcore.runstream.domain.model;

/**
 * Machine-readable classification of tool invocation failures.
 *
 * <p>
 * This exists to avoid relying on string matching in envelope messages.
 */
public enum ToolFailureKind {

    /**
     * No tool with the requested name is registered.
     */
    UNKNOWN_TOOL,

    /**
     * Tool is registered but disabled.
     */
    POLICY_DENIED,

    /**
     * Arguments could not be parsed into a JSON object.
     */
    INVALID_ARGUMENTS,

    /**
     * Tool threw during execution.
     */
    EXECUTION_FAILED,

    /**
     * Tool did not finish within the configured timeout.
     */
    TIMEOUT
}
