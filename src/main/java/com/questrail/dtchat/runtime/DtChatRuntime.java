package com.questrail.dtchat.runtime;

import com.questrail.dtchat.codec.impl.ProtobufWireEnvelopeDecoder;
import com.questrail.dtchat.codec.impl.ProtobufWireEnvelopeEncoder;
import com.questrail.dtchat.config.ChatConfig;
import com.questrail.dtchat.engine.ChatProtocolEngine;
import com.questrail.dtchat.observability.ChatEventObserver;
import com.questrail.dtchat.observability.Slf4jChatEventObserver;
import com.questrail.dtchat.prediction.ContactPlanOracle;
import com.questrail.dtchat.prediction.PredictionState;
import com.questrail.dtchat.store.ChatStore;
import com.questrail.dtchat.store.InMemoryChatStore;
import com.questrail.dtchat.time.SystemWallClock;
import com.questrail.dtchat.time.WallClock;
import com.questrail.dtchat.transport.TransportEngine;
import com.questrail.dtchat.transport.netty.NettyTransportEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DtChatRuntime
 * =============================================================================
 * Composition root and lifecycle owner for one chat node.
 *
 * <pre>
 *   ChatConfig
 *     → InMemoryChatStore
 *     → PredictionState (ContactPlanOracle when a contact plan is configured)
 *     → ChatProtocolEngine ← observers (SLF4J + caller supplied)
 *     → TransportEngine (Netty TCP/UDP unless overridden)
 * </pre>
 */
public final class DtChatRuntime {
    private static final Logger log = LoggerFactory.getLogger(DtChatRuntime.class);

    private final ChatProtocolEngine engine;
    private final ChatStore store;
    private final TransportEngine transport;

    private DtChatRuntime(ChatProtocolEngine engine, ChatStore store, TransportEngine transport) {
        this.engine = engine;
        this.store = store;
        this.transport = transport;
    }

    public void start() {
        engine.start(transport);
    }

    public void stop() {
        transport.stop();
    }

    public ChatProtocolEngine engine() {
        return engine;
    }

    public ChatStore store() {
        return store;
    }

    /**
     * Loads the contact plan if one is configured. A plan that cannot be read
     * yields {@link PredictionState.Error} rather than failing startup.
     */
    static PredictionState predictionFor(Optional<Path> contactPlan, WallClock clock) {
        if (contactPlan.isEmpty()) {
            return PredictionState.disabled();
        }
        try {
            return new PredictionState.Enabled(ContactPlanOracle.load(contactPlan.get(), clock));
        } catch (IOException e) {
            log.warn("Prediction unavailable, contact plan {} could not be loaded", contactPlan.get(), e);
            return new PredictionState.Error("Cannot load contact plan " + contactPlan.get() + ": " + e.getMessage());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ChatConfig config;
        private TransportEngine transport;
        private WallClock clock = SystemWallClock.INSTANCE;
        private final List<ChatEventObserver> observers = new ArrayList<>();

        public Builder withConfig(ChatConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransport(TransportEngine transport) {
            this.transport = transport;
            return this;
        }

        public Builder withClock(WallClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withObserver(ChatEventObserver observer) {
            this.observers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public DtChatRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");

            // 1. Store seeded from configuration
            ChatStore store = new InMemoryChatStore(config.localPeer(), config.otherPeers(), config.rooms());

            // 2. Prediction is fixed for the lifetime of the engine
            PredictionState prediction = predictionFor(config.contactPlan(), clock);

            // 3. Engine and observers
            ChatProtocolEngine engine = new ChatProtocolEngine(
                store,
                prediction,
                new ProtobufWireEnvelopeEncoder(),
                new ProtobufWireEnvelopeDecoder(),
                clock
            );
            engine.addObserver(new Slf4jChatEventObserver());
            observers.forEach(engine::addObserver);

            // 4. Transport
            TransportEngine effectiveTransport = transport != null ? transport : new NettyTransportEngine();

            return new DtChatRuntime(engine, store, effectiveTransport);
        }
    }
}
