package com.gnovoa.gridiron.sim;

import java.util.List;

/**
 * Source of randomness for every stage of the engine.
 *
 * <p>Implementations decide reproducibility: {@link SeededRandomSource} replays the same sequence
 * for the same seed, {@link LocalRandomSource} does not.
 */
public interface RandomSource {

    int nextIntInclusive(int fromInclusive, int toInclusive);

    /** Uniform in [0, 1). */
    double nextDouble();

    default boolean chance(double probability) {
        return nextDouble() < probability;
    }

    /** Normal deviate via Box-Muller, consuming exactly two uniforms. */
    default double nextGaussian(double mean, double stdDev) {
        double u1 = 1.0 - nextDouble();
        double u2 = nextDouble();
        double z = Math.sqrt(-2.0 * Math.log(u1)) * Math.cos(2.0 * Math.PI * u2);
        return mean + z * stdDev;
    }

    default <T> T pick(List<T> items) {
        if (items.isEmpty()) throw new IllegalArgumentException("Cannot pick from an empty list");
        return items.get(nextIntInclusive(0, items.size() - 1));
    }

    /** In-place Fisher-Yates shuffle. */
    default <T> void shuffle(List<T> items) {
        for (int i = items.size() - 1; i > 0; i--) {
            int j = nextIntInclusive(0, i);
            T tmp = items.get(i);
            items.set(i, items.get(j));
            items.set(j, tmp);
        }
    }
}
