package me.golemcore.runstream.port.inbound;

/**
 * Inbound port for user input addressed to a conversation.
 */
public interface ConversationInputPort {

    /**
     * Accepts a user message and schedules the run that answers it. Returns as
     * soon as the message is accepted; run output is delivered through the
     * output channels.
     *
     * @throws IllegalArgumentException
     *             if the conversation id or text is invalid
     * @throws me.golemcore.runstream.domain.service.RunAlreadyActiveException
     *             if a run is active and the busy policy rejects
     */
    Submission handleUserMessage(String conversationId, String text);

    /**
     * Requests cancellation of the active run.
     *
     * @return true if a cancellation was sent upstream
     */
    boolean cancelRun(String conversationId);

    enum Submission {
        STARTED, QUEUED
    }
}
