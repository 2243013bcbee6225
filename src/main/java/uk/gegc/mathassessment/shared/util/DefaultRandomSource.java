package uk.gegc.mathassessment.shared.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * {@link RandomSource} backed by a {@link Random} instance.
 */
public class DefaultRandomSource implements RandomSource {

    private final Random random;

    public DefaultRandomSource(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Random cannot be null");
        }
        this.random = random;
    }

    public static DefaultRandomSource seeded(long seed) {
        return new DefaultRandomSource(new Random(seed));
    }

    @Override
    public int nextInt(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException(
                    String.format("Empty range [%d, %d]", minInclusive, maxInclusive));
        }
        return minInclusive + random.nextInt(maxInclusive - minInclusive + 1);
    }

    @Override
    public <T> List<T> sample(List<T> population, int count) {
        if (count < 0 || count > population.size()) {
            throw new IllegalArgumentException(
                    String.format("Sample size %d out of range for population of %d", count, population.size()));
        }
        List<T> pool = new ArrayList<>(population);
        List<T> picked = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            picked.add(pool.remove(random.nextInt(pool.size())));
        }
        return picked;
    }

    @Override
    public <T> T choice(List<T> population) {
        if (population.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty population");
        }
        return population.get(random.nextInt(population.size()));
    }

    @Override
    public void shuffle(List<?> values) {
        Collections.shuffle(values, random);
    }
}
