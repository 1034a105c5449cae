package me.golemcore.runstream.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationStatusDto {
    private String conversationId;
    private String agentId;
    private String userId;
    private String threadId;
    private String activeRunId;
    private boolean busy;
    private int attachedConsumers;
    private long lastSequenceNo;
    private int retainedEvents;
    private int pendingMessages;
}
