package ca.gc.cra.match.domain.scoring;

/**
 * Composite compatibility of one profile/record pair with its sub-scores.
 *
 * @param composite weighted composite in {@code [0, 1]}
 * @param age age proximity sub-score in {@code [0, 1]}
 * @param socio socio-economic sub-score in {@code [0, 1]}
 * @param dimensionsCompared number of demographic dimensions present on both sides
 * @param neutralAge whether the age sub-score fell back to the neutral value
 * @since 0.1.0
 */
public record CompatibilityScore(
    double composite, double age, double socio, int dimensionsCompared, boolean neutralAge) {}
