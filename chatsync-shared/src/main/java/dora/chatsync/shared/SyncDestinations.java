package dora.chatsync.shared;

/**
 * STOMP destinations shared by the messaging server and its clients.
 */
public final class SyncDestinations {

    public static final int PROTOCOL_VERSION = 1;

    // Client -> server
    public static final String AUTHENTICATE = "/app/authenticate";
    public static final String MESSAGE_SEND = "/app/message.send";
    public static final String MESSAGE_ACK = "/app/message.ack";
    public static final String ROOM_JOIN = "/app/room.join";
    public static final String ROOM_LEAVE = "/app/room.leave";
    public static final String TYPING_START = "/app/typing.start";
    public static final String TYPING_STOP = "/app/typing.stop";

    // Server -> client
    public static final String QUEUE_AUTHENTICATED = "/user/queue/authenticated";
    public static final String QUEUE_AUTH_ERROR = "/user/queue/auth-error";
    public static final String QUEUE_MESSAGE_RECEIVED = "/user/queue/message.received";
    public static final String QUEUE_MESSAGE_ACK = "/user/queue/message.ack";
    public static final String QUEUE_MESSAGE_ERROR = "/user/queue/message.error";
    public static final String QUEUE_TYPING_START = "/user/queue/typing.start";
    public static final String QUEUE_TYPING_STOP = "/user/queue/typing.stop";
    public static final String QUEUE_PRESENCE = "/user/queue/presence.update";

    private SyncDestinations() {
    }
}
