package io.github.panghy.roundengine.random;

import java.util.List;

/**
 * Source of uniformly distributed draws for the round engines.
 *
 * <p>Every engine is bound to exactly one source and consumes draws from it in
 * a fixed order, so a source seeded identically reproduces identical rounds.
 * Implementations are not thread-safe: each draw mutates internal state, and
 * one session must own one source.</p>
 *
 * @see DeterministicRandomSource
 */
public interface RandomSource {

  /**
   * Advances the source and returns the next draw.
   *
   * @return A double in {@code [0, 1)}
   */
  double next();

  /**
   * Returns true with probability {@code p}. Always consumes exactly one draw,
   * so {@code p <= 0} is always false and {@code p >= 1} is always true without
   * changing how many draws later operations see.
   *
   * @param p The probability of returning true
   * @return {@code next() < p}
   */
  boolean chance(double p);

  /**
   * Picks a uniformly random element.
   *
   * @param items The candidates, must not be empty
   * @param <T>   The element type
   * @return {@code items.get(floor(next() * items.size()))}
   * @throws io.github.panghy.roundengine.error.InvalidArgumentException if items is null or empty
   */
  <T> T pick(List<T> items);

  /**
   * Returns a uniformly random integer in {@code [min, max]} (both inclusive).
   *
   * @param min The lower bound
   * @param max The upper bound
   * @return A value between min and max
   * @throws io.github.panghy.roundengine.error.InvalidArgumentException if {@code max < min}
   */
  int nextInt(int min, int max);

  /**
   * Gets the unsigned 32-bit seed this source was created with.
   *
   * @return The seed, in {@code [0, 2^32)}
   */
  long getSeed();

  /**
   * Gets the seed as eight upper-case hex digits, suitable for showing to a
   * player or operator so a session can be replayed.
   *
   * @return The seed in hex, e.g. {@code "0000002A"}
   */
  String getSeedHex();

  /**
   * Creates a child source with independent draws. The child seed is derived
   * from this source's seed and the name only, so children are reproducible
   * and do not disturb this source's sequence.
   *
   * @param name A unique name for the child source
   * @return A new RandomSource
   */
  RandomSource createChild(String name);
}
