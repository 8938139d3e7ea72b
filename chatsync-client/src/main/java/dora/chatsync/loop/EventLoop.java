package dora.chatsync.loop;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executor;

/**
 * The single logical thread every store mutation and connection transition runs on.
 * Work submitted through {@link #execute(Runnable)} runs in submission order, one task at a time.
 */
public interface EventLoop extends Executor {

    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Clock used for message timestamps and typing expiry.
     */
    Instant now();

    void shutdown();
}
