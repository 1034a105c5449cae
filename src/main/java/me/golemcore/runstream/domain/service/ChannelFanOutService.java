package me.golemcore.runstream.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runstream.domain.model.PublishOutcome;
import me.golemcore.runstream.domain.model.StreamEvent;
import me.golemcore.runstream.infrastructure.config.RunStreamProperties;
import me.golemcore.runstream.port.outbound.OutputChannelPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Hands every event to each active output channel. A failing channel never
 * affects the others; its fault is logged and reported as an outcome.
 *
 * <p>
 * The active set is fixed at startup from {@code runstream.channels.active},
 * in the configured order.
 *
 * <p>
 * {@link #publishAll} is called while the conversation is held exclusively, so
 * only channels that publish inline run on the caller's thread. Every other
 * channel gets a single-thread dispatcher with a bounded queue: per-channel
 * order is preserved, and a stalled channel only ever fills its own queue.
 */
@Service
@Slf4j
public class ChannelFanOutService {

    private static final long DISPATCH_DRAIN_TIMEOUT_SECONDS = 5;

    private final List<OutputChannelPort> activeChannels;
    private final Map<String, ExecutorService> dispatchers = new LinkedHashMap<>();

    public ChannelFanOutService(List<OutputChannelPort> channels, RunStreamProperties properties) {
        Map<String, OutputChannelPort> byType = new LinkedHashMap<>();
        for (OutputChannelPort channel : channels) {
            byType.put(channel.getChannelType(), channel);
        }
        List<OutputChannelPort> selected = new ArrayList<>();
        for (String name : properties.getChannels().getActive()) {
            String type = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
            if (type.isEmpty()) {
                continue;
            }
            OutputChannelPort channel = byType.get(type);
            if (channel == null) {
                log.warn("[FanOut] Unknown channel '{}' in runstream.channels.active, available: {}", type,
                        byType.keySet());
            } else if (!selected.contains(channel)) {
                selected.add(channel);
            }
        }
        this.activeChannels = Collections.unmodifiableList(selected);
        int queueCapacity = Math.max(1, properties.getChannels().getDispatchQueueCapacity());
        for (OutputChannelPort channel : activeChannels) {
            if (!channel.publishesInline()) {
                dispatchers.put(channel.getChannelType(), newDispatcher(channel.getChannelType(), queueCapacity));
            }
        }
        log.info("[FanOut] Active channels: {}", activeChannels.stream().map(OutputChannelPort::getChannelType)
                .toList());
    }

    public List<OutputChannelPort> getActiveChannels() {
        return activeChannels;
    }

    public List<PublishOutcome> publishAll(StreamEvent event) {
        List<PublishOutcome> outcomes = new ArrayList<>(activeChannels.size());
        for (OutputChannelPort channel : activeChannels) {
            outcomes.add(publishTo(channel, event));
        }
        return outcomes;
    }

    private PublishOutcome publishTo(OutputChannelPort channel, StreamEvent event) {
        String type = channel.getChannelType();
        if (!channel.isRunning()) {
            return PublishOutcome.skipped(type, "channel not running");
        }
        ExecutorService dispatcher = dispatchers.get(type);
        if (dispatcher == null) {
            return deliver(channel, event);
        }
        try {
            dispatcher.execute(() -> deliver(channel, event));
            return PublishOutcome.queued(type);
        } catch (RejectedExecutionException e) {
            log.warn("[FanOut] Dispatch queue of channel '{}' is full or closed, dropping seq {} of {}", type,
                    event.sequenceNo(), event.conversationId());
            return PublishOutcome.failed(type, "dispatch queue full");
        }
    }

    private PublishOutcome deliver(OutputChannelPort channel, StreamEvent event) {
        String type = channel.getChannelType();
        try {
            PublishOutcome outcome = channel.publish(event);
            return outcome != null ? outcome : PublishOutcome.delivered(type);
        } catch (Exception e) { // NOSONAR - channel faults must not reach the router
            log.warn("[FanOut] Channel '{}' failed to publish seq {} of {}: {}", type, event.sequenceNo(),
                    event.conversationId(), e.getMessage(), e);
            return PublishOutcome.failed(type, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    public void startAll() {
        for (OutputChannelPort channel : activeChannels) {
            try {
                channel.start();
                log.info("[FanOut] Started channel: {}", channel.getChannelType());
            } catch (Exception e) {
                log.error("[FanOut] Failed to start channel: {}", channel.getChannelType(), e);
            }
        }
    }

    public void stopAll() {
        for (Map.Entry<String, ExecutorService> entry : dispatchers.entrySet()) {
            ExecutorService dispatcher = entry.getValue();
            dispatcher.shutdown();
            try {
                if (!dispatcher.awaitTermination(DISPATCH_DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("[FanOut] Channel '{}' did not drain in time, {} events dropped", entry.getKey(),
                            dispatcher.shutdownNow().size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                dispatcher.shutdownNow();
            }
        }
        for (OutputChannelPort channel : activeChannels) {
            try {
                channel.stop();
            } catch (Exception e) {
                log.warn("[FanOut] Failed to stop channel: {}", channel.getChannelType(), e);
            }
        }
    }

    private static ExecutorService newDispatcher(String channelType, int queueCapacity) {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "channel-" + channelType);
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
