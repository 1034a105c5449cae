package me.golemcore.runstream.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.adapter.inbound.web.dto.ConversationStatusDto;
import me.golemcore.runstream.adapter.inbound.web.dto.MessageAcceptedResponse;
import me.golemcore.runstream.adapter.inbound.web.dto.UserMessageRequest;
import me.golemcore.runstream.domain.model.ConversationSession;
import me.golemcore.runstream.domain.service.ConversationRegistry;
import me.golemcore.runstream.port.inbound.ConversationInputPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * User input and conversation status endpoints.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class ConversationsController {

    private final ConversationInputPort conversationInput;
    private final ConversationRegistry registry;

    @GetMapping
    public Mono<ResponseEntity<List<ConversationStatusDto>>> listConversations() {
        List<ConversationStatusDto> dtos = registry.listAll().stream()
                .map(ConversationsController::toStatus)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{conversationId}")
    public Mono<ResponseEntity<ConversationStatusDto>> getConversation(@PathVariable String conversationId) {
        ConversationSession session = registry.find(conversationId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found"));
        return Mono.just(ResponseEntity.ok(toStatus(session)));
    }

    @PostMapping("/{conversationId}/messages")
    public Mono<ResponseEntity<MessageAcceptedResponse>> sendMessage(@PathVariable String conversationId,
            @RequestBody UserMessageRequest request) {
        if (request == null || request.getText() == null || request.getText().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text is required");
        }
        ConversationInputPort.Submission submission = conversationInput.handleUserMessage(conversationId,
                request.getText());
        String resolvedId = registry.resolveKey(conversationId).conversationId();
        MessageAcceptedResponse body = MessageAcceptedResponse.builder()
                .conversationId(resolvedId)
                .status(submission.name().toLowerCase(Locale.ROOT))
                .eventsUrl("/api/conversations/" + resolvedId + "/events")
                .build();
        log.debug("[API] Message for {} {}", resolvedId, body.getStatus());
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(body));
    }

    @DeleteMapping("/{conversationId}/run")
    public Mono<ResponseEntity<Map<String, Object>>> cancelRun(@PathVariable String conversationId) {
        if (registry.find(conversationId).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found");
        }
        boolean requested = conversationInput.cancelRun(conversationId);
        return Mono.just(ResponseEntity.status(requested ? HttpStatus.ACCEPTED : HttpStatus.OK)
                .body(Map.of("cancelRequested", requested)));
    }

    private static ConversationStatusDto toStatus(ConversationSession session) {
        return session.exclusive(() -> ConversationStatusDto.builder()
                .conversationId(session.getConversationId())
                .agentId(session.getKey().agentId())
                .userId(session.getKey().userId())
                .threadId(session.getThreadId())
                .activeRunId(session.getActiveRunId())
                .busy(session.isBusy())
                .attachedConsumers(session.getAttachedConsumers())
                .lastSequenceNo(session.getLastSequenceNo())
                .retainedEvents(session.getHistory().size())
                .pendingMessages(session.pendingCount())
                .build());
    }
}
