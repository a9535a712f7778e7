package com.ryuqq.retrier.testkit.contract;

import com.ryuqq.retrier.core.attempt.Attempt;
import com.ryuqq.retrier.core.attempt.AttemptResult;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Attempt test double driven by a script of results per invocation number.
 *
 * <p>Records how many times it was invoked, when each invocation started, and the highest
 * number of invocations that were ever running at the same time.</p>
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class ScriptedAttempt implements Attempt {

    private final IntFunction<AttemptResult> script;
    private final AtomicInteger invocations = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private final List<Long> startNanos = new CopyOnWriteArrayList<>();

    private ScriptedAttempt(IntFunction<AttemptResult> script) {
        this.script = script;
    }

    /**
     * Fails with an ordinary "whoops" error for the first {@code failures} invocations, then succeeds.
     *
     * @param failures number of retriable failures before success
     * @return a new scripted attempt
     */
    public static ScriptedAttempt failingTimes(int failures) {
        return new ScriptedAttempt(n -> n <= failures
            ? AttemptResult.retriable(new IOException("whoops"))
            : AttemptResult.success());
    }

    /**
     * Always fails with an ordinary "whoops" error.
     *
     * @return a new scripted attempt
     */
    public static ScriptedAttempt alwaysFailing() {
        return new ScriptedAttempt(n -> AttemptResult.retriable(new IOException("whoops")));
    }

    /**
     * Fails with an ordinary error {@code failures} times, then signals a terminal failure.
     *
     * @param failures number of retriable failures before the terminal one
     * @param message message of the terminal cause
     * @return a new scripted attempt
     */
    public static ScriptedAttempt terminalAfter(int failures, String message) {
        return new ScriptedAttempt(n -> n <= failures
            ? AttemptResult.retriable(new IOException("whoops"))
            : AttemptResult.terminal(new IOException(message)));
    }

    @Override
    public AttemptResult attempt() {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        startNanos.add(System.nanoTime());
        try {
            return script.apply(invocations.incrementAndGet());
        } finally {
            inFlight.decrementAndGet();
        }
    }

    public int invocationCount() {
        return invocations.get();
    }

    public int maxConcurrentInvocations() {
        return maxInFlight.get();
    }

    public List<Long> startNanos() {
        return List.copyOf(startNanos);
    }
}
