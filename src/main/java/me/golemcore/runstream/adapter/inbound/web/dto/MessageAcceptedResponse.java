package me.golemcore.runstream.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement of an accepted user message. {@code status} is
 * {@code started} or {@code queued}; run output follows on the event stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageAcceptedResponse {
    private String conversationId;
    private String status;
    private String eventsUrl;
}
