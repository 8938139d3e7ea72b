package dora.chatsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PresenceStatus {
    ONLINE,
    AWAY,
    @JsonProperty("DND")
    DO_NOT_DISTURB,
    INVISIBLE,
    OFFLINE
}
