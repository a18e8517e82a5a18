package org.dualportal.runtime.model;

/**
 * A payload sitting in a portal. Either reading may be absent.
 *
 * @param volume The volume in cubic metres, or {@code null} if not measured.
 * @param mass   The mass in kilograms, or {@code null} if not measured.
 */
public record Payload(Double volume, Double mass) {
}
