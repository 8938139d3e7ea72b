package dora.chatsync.model;

import java.util.Objects;

/**
 * Direct conversation ids are the two participant user ids, sorted and joined by {@code ':'}.
 */
public final class DirectConversations {

    private static final char SEPARATOR = ':';

    private DirectConversations() {
    }

    public static String idFor(String userA, String userB) {
        Objects.requireNonNull(userA, "userA");
        Objects.requireNonNull(userB, "userB");
        return userA.compareTo(userB) <= 0
                ? userA + SEPARATOR + userB
                : userB + SEPARATOR + userA;
    }

    /**
     * Returns the participant of {@code conversationId} that is not {@code localUserId}.
     *
     * @throws IllegalArgumentException if the id is malformed or does not include the local user
     */
    public static String peerOf(String conversationId, String localUserId) {
        int separator = conversationId.indexOf(SEPARATOR);
        if (separator <= 0 || separator == conversationId.length() - 1) {
            throw new IllegalArgumentException("Malformed direct conversation id: " + conversationId);
        }
        String first = conversationId.substring(0, separator);
        String second = conversationId.substring(separator + 1);
        if (first.equals(localUserId)) {
            return second;
        }
        if (second.equals(localUserId)) {
            return first;
        }
        throw new IllegalArgumentException(
                "User " + localUserId + " is not a participant of conversation " + conversationId);
    }
}
