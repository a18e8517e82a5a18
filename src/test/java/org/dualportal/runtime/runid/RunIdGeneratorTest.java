package org.dualportal.runtime.runid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Random;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class RunIdGeneratorTest {

    @Test
    void sequentialIdsAreReproducible() {
        SequentialRunIdGenerator first = new SequentialRunIdGenerator();
        SequentialRunIdGenerator second = new SequentialRunIdGenerator();

        assertThat(first.nextRunId()).isEqualTo("run_000001");
        assertThat(first.nextRunId()).isEqualTo("run_000002");
        assertThat(second.nextRunId()).isEqualTo("run_000001");
    }

    @Test
    void sequentialIdsContinueFromStart() {
        assertThat(new SequentialRunIdGenerator(41).nextRunId()).isEqualTo("run_000042");
        assertThatThrownBy(() -> new SequentialRunIdGenerator(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void seededRandomIdsAreReproducible() {
        RandomRunIdGenerator first = new RandomRunIdGenerator(new Random(42L));
        RandomRunIdGenerator second = new RandomRunIdGenerator(new Random(42L));

        for (int i = 0; i < 5; i++) {
            assertThat(first.nextRunId()).isEqualTo(second.nextRunId());
        }
    }

    @Test
    void randomIdsStayWithinTheIdSpace() {
        RandomRunIdGenerator generator = new RandomRunIdGenerator(new Random(7L));

        for (int i = 0; i < 100; i++) {
            String id = generator.nextRunId();
            assertThat(id).startsWith("run_");
            assertThat(Integer.parseInt(id.substring(4))).isBetween(0, RandomRunIdGenerator.ID_SPACE - 1);
        }
    }
}
