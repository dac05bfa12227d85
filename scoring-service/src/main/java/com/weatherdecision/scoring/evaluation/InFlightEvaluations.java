package com.weatherdecision.scoring.evaluation;

import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;

/**
 * One live evaluation per session.
 *
 * <p>Starting an evaluation for a session signals the previous one's cancel token. The
 * previous pipeline is cancelled and completes empty; if it already produced its report
 * in the same instant, the ownership check drops it anyway. Sessions never see each
 * other's tokens.
 */
@Component
public class InFlightEvaluations {

    private final ConcurrentHashMap<String, Sinks.One<Boolean>> inFlight = new ConcurrentHashMap<>();

    /**
     * @param onSuperseded runs when this evaluation is dropped in favour of a newer one
     */
    public <T> Mono<T> runExclusive(String sessionKey, Mono<T> work, Runnable onSuperseded) {
        return Mono.defer(() -> {
            Sinks.One<Boolean> token = Sinks.one();
            Sinks.One<Boolean> previous = inFlight.put(sessionKey, token);
            if (previous != null) {
                previous.tryEmitValue(Boolean.TRUE);
            }
            return work
                .takeUntilOther(token.asMono())
                .filter(result -> inFlight.get(sessionKey) == token)
                .switchIfEmpty(Mono.fromRunnable(onSuperseded))
                .doFinally(signal -> inFlight.remove(sessionKey, token));
        });
    }

    public boolean isInFlight(String sessionKey) {
        return inFlight.containsKey(sessionKey);
    }

    public int size() {
        return inFlight.size();
    }
}
