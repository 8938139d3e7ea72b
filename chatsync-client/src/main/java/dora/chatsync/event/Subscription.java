package dora.chatsync.event;

@FunctionalInterface
public interface Subscription {

    void cancel();
}
