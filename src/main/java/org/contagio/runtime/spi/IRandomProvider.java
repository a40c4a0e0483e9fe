package org.contagio.runtime.spi;

import java.util.Random;

/**
 * Provides deterministic randomness scoped to a single trial.
 * Implementations should be pure with respect to the provided seed and
 * support derivation of child providers for independent sub-streams.
 * <p>
 * Every stochastic decision of a model (network generation, seeding, partner draws,
 * teacher selection, adoption and drop draws) consumes this stream, so two trials built
 * from equal seeds follow identical trajectories.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be &gt; 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Provides access to an underlying {@link Random} instance for APIs that require it
     * (e.g., {@code Collections.shuffle}).
     *
     * @return the Random instance
     */
    Random asJavaRandom();

    /**
     * Creates a derived provider that is deterministically based on this provider's seed and
     * the given scope/key. Use this to create independent sub-streams (e.g., per parameter
     * combination and per replicate).
     *
     * @param scope a stable, descriptive scope name (e.g., "combination", "replicate")
     * @param key a stable numeric key (e.g., combination index, replicate index)
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
