package com.cvrfplatform.belief.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Signal;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Carries the request's userId to service log lines.
 *
 * <p>The service writes the userId into the Reactor Context once per call with
 * {@link #of(String)}. The {@code doOnEach} consumers below read it back from the
 * signal and expose it as the {@code userId} MDC entry only while the log action
 * runs, whichever thread delivers the signal.
 */
public final class UserLogContext {

    public static final String USER_ID_KEY = "userId";

    private UserLogContext() {}

    public static Context of(String userId) {
        return Context.of(USER_ID_KEY, userId);
    }

    /** Runs {@code logAction} for the value of an {@code onNext} signal. */
    public static <T> Consumer<Signal<T>> onValue(Consumer<T> logAction) {
        return signal -> {
            if (signal.isOnNext()) {
                inMdc(signal.getContextView(), () -> logAction.accept(signal.get()));
            }
        };
    }

    /** Runs {@code logAction} for the error of an {@code onError} signal. */
    public static <T> Consumer<Signal<T>> onError(Consumer<Throwable> logAction) {
        return signal -> {
            if (signal.isOnError()) {
                inMdc(signal.getContextView(), () -> logAction.accept(signal.getThrowable()));
            }
        };
    }

    static void inMdc(ContextView ctx, Runnable logAction) {
        Optional<String> userId = ctx.getOrEmpty(USER_ID_KEY);
        if (userId.isEmpty()) {
            logAction.run();
            return;
        }
        MDC.put(USER_ID_KEY, userId.get());
        try {
            logAction.run();
        } finally {
            MDC.remove(USER_ID_KEY);
        }
    }
}
