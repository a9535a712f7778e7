package com.ryuqq.retrier.testkit.contract;

import com.ryuqq.retrier.core.spi.AttemptLogSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory AttemptLogSink that keeps every message for later assertions.
 *
 * @author Retrier Team
 * @since 1.0.0
 */
public final class RecordingLogSink implements AttemptLogSink {

    private final List<String> messages = new CopyOnWriteArrayList<>();

    @Override
    public void log(String message) {
        messages.add(message);
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }

    public void clear() {
        messages.clear();
    }
}
