package com.questrail.dtchat.observability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Test-only observer that records every event in arrival order.
 */
public final class RecordingChatEventObserver implements ChatEventObserver
{
    private final List<ChatEvent> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onEvent(ChatEvent event) {
        events.add(event);
    }

    public List<ChatEvent> events() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }

    public List<ChatEvent.Error> errors() {
        return events().stream()
                .filter(e -> e instanceof ChatEvent.Error)
                .map(e -> (ChatEvent.Error) e)
                .toList();
    }

    public List<ChatEvent.Info> infos(ChatEvent.InfoKind kind) {
        return events().stream()
                .filter(e -> e instanceof ChatEvent.Info i && i.kind() == kind)
                .map(e -> (ChatEvent.Info) e)
                .toList();
    }

    public long count(ChatEvent.ErrorKind kind) {
        return errors().stream().filter(e -> e.kind() == kind).count();
    }

    public List<ChatEvent.TransportError> transportErrors() {
        return events().stream()
                .filter(e -> e instanceof ChatEvent.TransportError)
                .map(e -> (ChatEvent.TransportError) e)
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
