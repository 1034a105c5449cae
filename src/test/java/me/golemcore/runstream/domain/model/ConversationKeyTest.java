package me.golemcore.runstream.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConversationKeyTest {

    @Test
    void shouldParseAgentAndUser() {
        ConversationKey key = ConversationKey.parse("asst_1:user:with:colons");

        assertEquals("asst_1", key.agentId());
        assertEquals("user:with:colons", key.userId());
        assertEquals("asst_1:user:with:colons", key.conversationId());
    }

    @Test
    void shouldApplyDefaultAgentToBareUserId() {
        ConversationKey key = ConversationKey.parse("user_1", "asst_default");

        assertEquals("asst_default:user_1", key.conversationId());
    }

    @Test
    void shouldRejectBareUserIdWithoutDefaultAgent() {
        assertThrows(IllegalArgumentException.class, () -> ConversationKey.parse("user_1"));
    }

    @Test
    void shouldRejectEmptyParts() {
        assertThrows(IllegalArgumentException.class, () -> ConversationKey.parse(":user_1"));
        assertThrows(IllegalArgumentException.class, () -> ConversationKey.parse("asst_1:"));
        assertThrows(IllegalArgumentException.class, () -> ConversationKey.parse(" "));
    }
}
