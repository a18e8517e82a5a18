package org.dualportal.runtime.sweep;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import org.dualportal.runtime.BridgeSettings;

/**
 * Result of a {@link ParameterSweep}.
 * <p>
 * A sweep is approved when its best configuration reaches the minimum transfer strength
 * and a transfer across it actually succeeded.
 *
 * @param points The evaluated configurations, detune-major in evaluation order.
 */
public record SweepReport(List<SweepPoint> points) {

    public static final double MIN_ACCEPTABLE_STRENGTH = 0.5;

    public SweepReport {
        if (points == null || points.isEmpty()) {
            throw new IllegalArgumentException("A sweep report needs at least one point");
        }
        points = List.copyOf(points);
    }

    /**
     * @return The configuration with the highest bridge strength; the first one wins ties.
     */
    public SweepPoint optimal() {
        SweepPoint best = points.get(0);
        for (SweepPoint point : points) {
            if (point.bridgeStrength() > best.bridgeStrength()) {
                best = point;
            }
        }
        return best;
    }

    public double averageStrength() {
        return points.stream().mapToDouble(SweepPoint::bridgeStrength).average().orElse(0.0);
    }

    public long transferableCount() {
        return points.stream().filter(SweepPoint::transferable).count();
    }

    public boolean isApproved() {
        SweepPoint optimal = optimal();
        return optimal.bridgeStrength() >= MIN_ACCEPTABLE_STRENGTH && optimal.transferable();
    }

    /**
     * Applies the optimal detune to the given settings.
     *
     * @param base The settings the sweep started from.
     * @return {@code base} with the detune of the optimal point.
     * @throws IllegalStateException if the sweep is not approved.
     */
    public BridgeSettings optimalSettings(BridgeSettings base) {
        if (!isApproved()) {
            throw new IllegalStateException(String.format(Locale.ROOT,
                    "Cannot apply parameters - sweep not approved (optimal strength %.3f, transferable: %s, minimum %.1f)",
                    optimal().bridgeStrength(), optimal().transferable(), MIN_ACCEPTABLE_STRENGTH));
        }
        return base.withDetune(optimal().detune());
    }

    /**
     * @return The points ordered by descending bridge strength.
     */
    public List<SweepPoint> ranked() {
        return points.stream()
                .sorted(Comparator.comparingDouble(SweepPoint::bridgeStrength).reversed())
                .toList();
    }

    public String summary() {
        return String.format(Locale.ROOT,
                "Sweep evaluated %d configurations. Transferable: %d. Average strength: %.3f. Optimal: %.3f. %s",
                points.size(), transferableCount(), averageStrength(), optimal().bridgeStrength(),
                isApproved() ? "APPROVED" : "REJECTED");
    }
}
