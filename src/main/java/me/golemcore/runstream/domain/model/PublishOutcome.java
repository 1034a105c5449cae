package me.golemcore.runstream.domain.model;

/**
 * Result of handing one event to one output channel.
 */
public record PublishOutcome(String channelType, Status status, String detail) {

    public enum Status {
        DELIVERED, QUEUED, SKIPPED, FAILED
    }

    public static PublishOutcome delivered(String channelType) {
        return new PublishOutcome(channelType, Status.DELIVERED, null);
    }

    public static PublishOutcome delivered(String channelType, String detail) {
        return new PublishOutcome(channelType, Status.DELIVERED, detail);
    }

    public static PublishOutcome queued(String channelType) {
        return new PublishOutcome(channelType, Status.QUEUED, null);
    }

    public static PublishOutcome skipped(String channelType, String reason) {
        return new PublishOutcome(channelType, Status.SKIPPED, reason);
    }

    public static PublishOutcome failed(String channelType, String error) {
        return new PublishOutcome(channelType, Status.FAILED, error);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
