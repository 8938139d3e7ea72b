package dora.chatsync.shared.dto;

/**
 * Delivery status of a chat message.
 */
public enum MessageStatus {
    /** Composed locally, not yet confirmed by the server. */
    PENDING,
    /** Accepted by the server. */
    SENT,
    /** Delivered to at least one recipient device. */
    DELIVERED,
    /** Read by a recipient. */
    READ,
    /** Rejected by the server or never confirmed. */
    FAILED;

    /**
     * Whether this status reports the message as further along than {@code other}.
     * FAILED is never considered progress.
     */
    public boolean isAfter(MessageStatus other) {
        if (this == FAILED) {
            return false;
        }
        return other == FAILED || ordinal() > other.ordinal();
    }
}
