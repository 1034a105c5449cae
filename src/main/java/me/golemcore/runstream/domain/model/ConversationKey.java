package me.golemcore.runstream.domain.model;

/**
 * Identity of a conversation: one agent talking to one user. The string form
 * {@code agentId:userId} is used as the conversation id everywhere outside the
 * domain.
 */
public record ConversationKey(String agentId, String userId) {

    private static final char SEPARATOR = ':';

    public ConversationKey {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        if (agentId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("agentId must not contain '" + SEPARATOR + "'");
        }
    }

    public String conversationId() {
        return agentId + SEPARATOR + userId;
    }

    /**
     * Parses {@code agentId:userId}. A bare user id is accepted when a default
     * agent id is supplied.
     */
    public static ConversationKey parse(String conversationId, String defaultAgentId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is required");
        }
        int separator = conversationId.indexOf(SEPARATOR);
        if (separator < 0) {
            if (defaultAgentId == null || defaultAgentId.isBlank()) {
                throw new IllegalArgumentException(
                        "conversationId must have the form agentId:userId, got: " + conversationId);
            }
            return new ConversationKey(defaultAgentId, conversationId);
        }
        return new ConversationKey(conversationId.substring(0, separator), conversationId.substring(separator + 1));
    }

    public static ConversationKey parse(String conversationId) {
        return parse(conversationId, null);
    }

    @Override
    public String toString() {
        return conversationId();
    }
}
