package com.visionai.gateway.core.bus;

import com.visionai.gateway.core.model.BusMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelDispatcherTest {

    private final Scheduler scheduler = Schedulers.newBoundedElastic(4, 100, "dispatch-test");
    private final ChannelDispatcher dispatcher = new ChannelDispatcher(scheduler);

    @AfterEach
    void tearDown() {
        dispatcher.clear();
        scheduler.dispose();
    }

    @Test
    void shouldDeliverInArrivalOrderPerChannel() {
        Sinks.Many<String> seen = Sinks.many().replay().all();
        dispatcher.bind("orders", msg -> {
            seen.tryEmitNext(msg.raw());
            return Mono.empty();
        });

        List<String> sent = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            sent.add("m" + i);
            dispatcher.deliver(BusMessage.unparsed("orders", "m" + i));
        }

        StepVerifier.create(seen.asFlux().take(50).collectList())
                .assertNext(list -> assertThat(list).containsExactlyElementsOf(sent))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void failingCallbackShouldNotStopTheLane() {
        Sinks.Many<String> seen = Sinks.many().replay().all();
        dispatcher.bind("c", msg -> {
            if (msg.raw().equals("boom")) {
                throw new IllegalStateException("listener bug");
            }
            seen.tryEmitNext(msg.raw());
            return Mono.empty();
        });

        dispatcher.deliver(BusMessage.unparsed("c", "boom"));
        dispatcher.deliver(BusMessage.unparsed("c", "after"));

        StepVerifier.create(seen.asFlux())
                .expectNext("after")
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void rebindingShouldReplaceTheCallback() {
        Sinks.Many<String> seen = Sinks.many().replay().all();
        dispatcher.bind("c", msg -> {
            seen.tryEmitNext("first:" + msg.raw());
            return Mono.empty();
        });
        dispatcher.bind("c", msg -> {
            seen.tryEmitNext("second:" + msg.raw());
            return Mono.empty();
        });

        dispatcher.deliver(BusMessage.unparsed("c", "x"));

        StepVerifier.create(seen.asFlux())
                .expectNext("second:x")
                .thenCancel()
                .verify(Duration.ofSeconds(5));
        assertThat(dispatcher.channels()).containsExactly("c");
    }

    @Test
    void deliverWithoutListenerShouldReportDrop() {
        assertThat(dispatcher.deliver(BusMessage.unparsed("nobody", "x"))).isFalse();
        dispatcher.bind("c", msg -> Mono.empty());
        assertThat(dispatcher.unbind("c")).isTrue();
        assertThat(dispatcher.isBound("c")).isFalse();
    }
}
