package com.kgagent.model;

import java.util.concurrent.atomic.AtomicBoolean;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A single cancellation signal for one pipeline run. Once cancelled, no new step is started and
 * in-flight queries subscribed with {@link #whenCancelled()} are aborted.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.One<Boolean> signal = Sinks.one();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Emits once when {@link #cancel()} is called. Suitable for {@code takeUntilOther}.
     */
    public Mono<Boolean> whenCancelled() {
        return signal.asMono();
    }
}
