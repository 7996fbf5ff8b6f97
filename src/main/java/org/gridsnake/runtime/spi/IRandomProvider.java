package org.gridsnake.runtime.spi;

/**
 * Deterministic randomness for a game. Two providers created from the same seed return the same
 * sequence, and child providers derived for different scopes draw independent streams.
 */
public interface IRandomProvider {

    /**
     * Returns a random integer in the range [0, bound).
     *
     * @param bound exclusive upper bound, must be > 0
     * @return the random int
     */
    int nextInt(int bound);

    /**
     * Creates a child provider whose seed depends only on this provider's seed, the scope and the key.
     *
     * @param scope a stable scope name such as "food"
     * @param key   a stable numeric key within the scope
     * @return the derived provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
