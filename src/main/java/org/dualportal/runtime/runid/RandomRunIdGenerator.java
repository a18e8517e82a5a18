package org.dualportal.runtime.runid;

import java.util.Random;

import org.dualportal.runtime.spi.IRunIdGenerator;

/**
 * Draws run identifiers of the form {@code run_<n>} with {@code n} uniform in
 * {@code [0, 1_000_000)}.
 */
public class RandomRunIdGenerator implements IRunIdGenerator {

    static final int ID_SPACE = 1_000_000;

    private final Random random;

    public RandomRunIdGenerator() {
        this(new Random());
    }

    /**
     * @param random The source of randomness. Pass a seeded instance for reproducible runs.
     */
    public RandomRunIdGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }
        this.random = random;
    }

    @Override
    public String nextRunId() {
        return "run_" + random.nextInt(ID_SPACE);
    }
}
