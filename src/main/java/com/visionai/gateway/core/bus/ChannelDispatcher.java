package com.visionai.gateway.core.bus;

import com.visionai.gateway.core.model.BusMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local listener table used by the transports: one lane per channel, one callback per lane.
 *
 * <h2>Threading / ordering</h2>
 * <ul>
 *   <li>{@link #deliver} only enqueues; the callback runs later on the {@link Scheduler}, so a callback that
 *       publishes again never grows the caller's stack.</li>
 *   <li>Each lane drains with {@code concatMap}: messages of one channel are handled one at a time, in
 *       arrival order. Lanes are independent of each other.</li>
 * </ul>
 *
 * <h2>Failure isolation</h2>
 * A callback that throws or errors is logged and the lane keeps draining.
 */
public class ChannelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChannelDispatcher.class);

    private final Scheduler scheduler;
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();

    public ChannelDispatcher(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Binds {@code callback} to {@code channel}, replacing (and stopping) any previous lane.
     */
    public void bind(String channel, EventCallback callback) {
        Lane lane = new Lane(channel, callback);
        Lane previous = lanes.put(channel, lane);
        if (previous != null) {
            previous.dispose();
            log.debug("Replaced callback for channel={}", channel);
        }
    }

    public boolean unbind(String channel) {
        Lane lane = lanes.remove(channel);
        if (lane == null) {
            return false;
        }
        lane.dispose();
        return true;
    }

    public void clear() {
        lanes.keySet().forEach(this::unbind);
    }

    public boolean isBound(String channel) {
        return lanes.containsKey(channel);
    }

    public Set<String> channels() {
        return Set.copyOf(lanes.keySet());
    }

    /**
     * Queues {@code message} for its channel's callback.
     *
     * @return {@code false} when nothing is bound to the channel (message dropped)
     */
    public boolean deliver(BusMessage message) {
        Lane lane = lanes.get(message.channel());
        if (lane == null) {
            log.debug("No listener for channel={}, message dropped", message.channel());
            return false;
        }
        return lane.offer(message);
    }

    private final class Lane {

        private final String channel;
        private final EventCallback callback;
        private final Sinks.Many<BusMessage> queue = Sinks.many().unicast().onBackpressureBuffer();
        private final Disposable drain;

        Lane(String channel, EventCallback callback) {
            this.channel = channel;
            this.callback = callback;
            this.drain = queue.asFlux()
                    .publishOn(scheduler)
                    .concatMap(this::invoke)
                    .subscribe(
                            v -> { },
                            err -> log.error("Dispatch lane for channel={} terminated: {}", channel, err.toString(), err));
        }

        private Mono<Void> invoke(BusMessage message) {
            return Mono.defer(() -> {
                        Mono<Void> result = callback.onMessage(message);
                        return result == null ? Mono.<Void>empty() : result;
                    })
                    .onErrorResume(err -> {
                        log.warn("Listener failed on channel={} err={}", channel, err.toString(), err);
                        return Mono.empty();
                    });
        }

        // tryEmitNext must not be called concurrently on a unicast sink
        synchronized boolean offer(BusMessage message) {
            Sinks.EmitResult result = queue.tryEmitNext(message);
            if (result.isFailure()) {
                log.warn("Failed to queue message for channel={} result={}", channel, result);
                return false;
            }
            return true;
        }

        synchronized void dispose() {
            queue.tryEmitComplete();
            drain.dispose();
        }
    }
}
