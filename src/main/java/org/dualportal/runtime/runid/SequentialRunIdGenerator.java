package org.dualportal.runtime.runid;

import org.dualportal.runtime.spi.IRunIdGenerator;

/**
 * Deterministic run identifiers {@code run_000001}, {@code run_000002}, ...
 * <p>
 * Not thread-safe; a controller is single-threaded.
 */
public class SequentialRunIdGenerator implements IRunIdGenerator {

    private long counter;

    public SequentialRunIdGenerator() {
        this(0L);
    }

    /**
     * @param start The counter value before the first call; the first id is {@code start + 1}.
     */
    public SequentialRunIdGenerator(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("start must be non-negative, got " + start);
        }
        this.counter = start;
    }

    @Override
    public String nextRunId() {
        counter++;
        return String.format("run_%06d", counter);
    }
}
