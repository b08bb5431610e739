package com.questrail.dtchat.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production observer that emits chat events via SLF4J.
 */
public final class Slf4jChatEventObserver implements ChatEventObserver {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChatEventObserver.class);

    @Override
    public void onEvent(ChatEvent event) {
        if (event instanceof ChatEvent.Info info) {
            if (info.message().isPresent()) {
                var m = info.message().get();
                log.info("{} {} [{}] {}", info.kind(), m.uuid(), m.status(), info.detail());
            } else {
                log.info("{} {}", info.kind(), info.detail());
            }
        } else if (event instanceof ChatEvent.Error error) {
            log.warn("Chat error {}: {}", error.kind(), error.detail());
        } else if (event instanceof ChatEvent.TransportInfo t) {
            log.debug("Transport event: {}", t.event());
        } else if (event instanceof ChatEvent.TransportError t) {
            log.warn("Transport error: {}", t.event());
        }
    }
}
