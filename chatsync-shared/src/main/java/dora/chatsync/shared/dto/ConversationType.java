package dora.chatsync.shared.dto;

public enum ConversationType {
    /** Channel within a community */
    CHANNEL,
    /** Direct message between two users */
    DM
}
