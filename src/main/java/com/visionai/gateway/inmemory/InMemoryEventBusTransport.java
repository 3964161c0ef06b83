package com.visionai.gateway.inmemory;

import com.visionai.gateway.core.bus.ChannelDispatcher;
import com.visionai.gateway.core.bus.EventBusNotConnectedException;
import com.visionai.gateway.core.bus.EventBusTransport;
import com.visionai.gateway.core.bus.EventCallback;
import com.visionai.gateway.core.bus.MessageCodec;
import com.visionai.gateway.core.bus.TransportStatus;
import com.visionai.gateway.core.channel.Channels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-process transport: a publish is encoded to text, decoded again and handed to the local listener
 * of the channel. It has no wire, so every role reports the same ready flag.
 *
 * <p>The encode/decode step keeps behavior identical to the networked transport: listeners receive a
 * fresh copy, and a string that is not a JSON object arrives unparsed.</p>
 */
public class InMemoryEventBusTransport implements EventBusTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBusTransport.class);

    private final MessageCodec codec;
    private final ChannelDispatcher dispatcher;
    private final AtomicBoolean connected = new AtomicBoolean(false);

    public InMemoryEventBusTransport(MessageCodec codec, ChannelDispatcher dispatcher) {
        this.codec = codec;
        this.dispatcher = dispatcher;
    }

    @Override
    public Mono<Void> connect() {
        return Mono.fromRunnable(() -> {
            connected.set(true);
            log.info("Event bus (in-memory) connected");
        });
    }

    @Override
    public Mono<Void> publish(String channel, Object data) {
        return Mono.fromRunnable(() -> {
            Channels.requireValid(channel);
            if (!connected.get()) {
                throw new EventBusNotConnectedException("publish", channel);
            }
            String text = codec.encode(data);
            dispatcher.deliver(codec.decode(channel, text));
            log.debug("Published to channel={} bytes={}", channel, text.length());
        });
    }

    @Override
    public Mono<Void> subscribe(String channel, EventCallback callback) {
        return Mono.fromRunnable(() -> {
            Channels.requireValid(channel);
            if (!connected.get()) {
                throw new EventBusNotConnectedException("subscribe", channel);
            }
            dispatcher.bind(channel, callback);
            log.debug("Subscribed to channel={}", channel);
        });
    }

    @Override
    public Mono<Void> unsubscribe(String channel) {
        return Mono.fromRunnable(() -> {
            dispatcher.unbind(channel);
            log.debug("Unsubscribed from channel={}", channel);
        });
    }

    @Override
    public Mono<Void> disconnect() {
        return Mono.fromRunnable(() -> {
            dispatcher.clear();
            connected.set(false);
            log.info("Event bus (in-memory) disconnected");
        });
    }

    @Override
    public TransportStatus getConnectionStatus() {
        boolean up = connected.get();
        return new TransportStatus(up, up, up, up);
    }
}
