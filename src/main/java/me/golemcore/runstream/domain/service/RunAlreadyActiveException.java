package me.golemcore.runstream.domain.service;

/**
 * Thrown when a user message arrives while the conversation still has a run in
 * flight and the busy policy rejects it.
 */
public class RunAlreadyActiveException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String conversationId;

    public RunAlreadyActiveException(String conversationId, String activeRunId) {
        super(activeRunId != null
                ? "Conversation " + conversationId + " already has an active run: " + activeRunId
                : "Conversation " + conversationId + " already has a run in progress");
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
