package dora.chatsync.loop;

@FunctionalInterface
public interface Cancellable {

    Cancellable NONE = () -> {
    };

    /**
     * Cancels the task if it has not run yet. Calling it again has no effect.
     */
    void cancel();
}
