package org.dualportal.runtime.spi;

/**
 * Source of run identifiers.
 * <p>
 * Run identifiers are opaque labels for audit output and must never influence any
 * physical computation.
 */
@FunctionalInterface
public interface IRunIdGenerator {

    /**
     * @return A new run identifier, never {@code null}.
     */
    String nextRunId();
}
