package dora.chatsync.model;

import lombok.Value;

import java.time.Instant;

@Value
public class TypingUser {
    String userId;
    String username;
    Instant lastSignalTime;
}
