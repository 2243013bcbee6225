package uk.gegc.mathassessment.shared.util;

import java.util.List;

/**
 * Single randomness stream shared by topic sampling and the deterministic generators.
 * Injected so tests can seed or stub it.
 */
public interface RandomSource {

    /**
     * Uniform integer draw.
     *
     * @param minInclusive lower bound
     * @param maxInclusive upper bound, not lower than {@code minInclusive}
     * @return a value in {@code [minInclusive, maxInclusive]}
     */
    int nextInt(int minInclusive, int maxInclusive);

    /**
     * Draws {@code count} distinct positions of {@code population}, preserving draw order.
     *
     * @throws IllegalArgumentException if {@code count} exceeds the population size
     */
    <T> List<T> sample(List<T> population, int count);

    /**
     * Uniform pick of a single element.
     */
    <T> T choice(List<T> population);

    /**
     * Shuffles the given mutable list in place.
     */
    void shuffle(List<?> values);
}
