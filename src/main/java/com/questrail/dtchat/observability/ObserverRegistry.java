package com.questrail.dtchat.observability;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered fan-out of {@link ChatEvent}s.
 *
 * <p>Observers are notified synchronously in registration order. An observer
 * that throws is not shielded: the exception propagates to whoever triggered
 * the notification and later observers are skipped for that event.</p>
 */
public final class ObserverRegistry
{
    private final List<ChatEventObserver> observers = new CopyOnWriteArrayList<>();

    public void add(ChatEventObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer"));
    }

    public boolean remove(ChatEventObserver observer) {
        return observers.remove(observer);
    }

    public void notify(ChatEvent event) {
        Objects.requireNonNull(event, "event");
        for (ChatEventObserver o : observers) {
            o.onEvent(event);
        }
    }

    public int size() {
        return observers.size();
    }
}
