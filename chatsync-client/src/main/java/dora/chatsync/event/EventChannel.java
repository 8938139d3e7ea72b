package dora.chatsync.event;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Typed fan-out for one kind of event. Subscribers are called in subscription order on the
 * publishing thread, which is always the event loop.
 */
@Slf4j
public class EventChannel<T> {

    private final String name;
    private final List<Consumer<? super T>> subscribers = new CopyOnWriteArrayList<>();

    public EventChannel(String name) {
        this.name = name;
    }

    public Subscription subscribe(Consumer<? super T> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public void publish(T event) {
        for (Consumer<? super T> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.error("Subscriber of '{}' failed on {}", name, event, e);
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
