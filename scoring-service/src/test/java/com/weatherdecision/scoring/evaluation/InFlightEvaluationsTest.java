package com.weatherdecision.scoring.evaluation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InFlightEvaluationsTest {

    private final InFlightEvaluations inFlight = new InFlightEvaluations();

    @Test
    @DisplayName("a newer request for the same session cancels the older one, which completes empty")
    void newerSupersedesOlder() {
        AtomicBoolean superseded = new AtomicBoolean();
        AtomicBoolean olderCancelled = new AtomicBoolean();
        AtomicReference<String> newer = new AtomicReference<>();

        Mono<String> older = inFlight.runExclusive("u@loc",
            Mono.<String>never().doOnCancel(() -> olderCancelled.set(true)),
            () -> superseded.set(true));

        StepVerifier.create(older)
            .then(() -> inFlight.runExclusive("u@loc", Mono.just("fresh"), () -> { }).subscribe(newer::set))
            .verifyComplete();

        assertTrue(superseded.get());
        assertTrue(olderCancelled.get());
        assertEquals("fresh", newer.get());
        assertEquals(0, inFlight.size());
    }

    @Test
    @DisplayName("a result that arrives after being superseded is discarded")
    void lateResultDiscarded() {
        Sinks.One<String> olderWork = Sinks.one();
        AtomicReference<String> olderResult = new AtomicReference<>();

        inFlight.runExclusive("u@loc", olderWork.asMono(), () -> { }).subscribe(olderResult::set);
        inFlight.runExclusive("u@loc", Mono.<String>never(), () -> { }).subscribe();
        olderWork.tryEmitValue("stale");

        assertNull(olderResult.get());
    }

    @Test
    @DisplayName("different sessions do not interfere")
    void sessionsIndependent() {
        Sinks.One<String> first = Sinks.one();
        AtomicReference<String> firstResult = new AtomicReference<>();

        inFlight.runExclusive("u@vigo", first.asMono(), () -> { }).subscribe(firstResult::set);
        StepVerifier.create(inFlight.runExclusive("u@lugo", Mono.just("lugo"), () -> { }))
            .expectNext("lugo")
            .verifyComplete();
        first.tryEmitValue("vigo");

        assertEquals("vigo", firstResult.get());
    }

    @Test
    @DisplayName("session is released once the evaluation finishes")
    void released() {
        StepVerifier.create(inFlight.runExclusive("u@loc", Mono.just(1), () -> { }))
            .expectNext(1)
            .verifyComplete();
        assertFalse(inFlight.isInFlight("u@loc"));
    }
}
