package com.ryuqq.result.testkit.contract;

import com.ryuqq.result.core.panic.PanicHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of PanicHandler for testing purposes.
 *
 * <p>Records every panic message instead of logging or terminating the process, so tests can
 * assert that the fatal path was taken rather than asserting a return value.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Thread-safe message recording (CopyOnWriteArrayList)</li>
 *   <li>Snapshot access to recorded messages</li>
 *   <li>Clear between tests</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
public class RecordingPanicHandler implements PanicHandler {

    private final List<String> messages = new CopyOnWriteArrayList<>();

    @Override
    public void onPanic(String message) {
        messages.add(message);
    }

    /**
     * Returns a snapshot of all recorded panic messages in invocation order.
     *
     * @return recorded messages
     */
    public List<String> messages() {
        return new ArrayList<>(messages);
    }

    /**
     * Returns the number of recorded panics.
     *
     * @return panic count
     */
    public int count() {
        return messages.size();
    }

    /**
     * Returns the most recent panic message.
     *
     * @return last message
     * @throws IllegalStateException if no panic has been recorded
     */
    public String lastMessage() {
        if (messages.isEmpty()) {
            throw new IllegalStateException("No panic has been recorded");
        }
        return messages.get(messages.size() - 1);
    }

    /**
     * Clears all recorded messages.
     */
    public void clear() {
        messages.clear();
    }
}
