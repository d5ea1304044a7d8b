package io.github.panghy.roundengine.random;

import io.github.panghy.roundengine.error.InvalidArgumentException;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Seeded Mulberry32 implementation of {@link RandomSource}.
 *
 * <p>The generator uses 32-bit integer arithmetic only; the single floating
 * point operation is the final division by 2<sup>32</sup>, which is exact in
 * IEEE-754 double. The output sequence for a given seed is therefore identical
 * across platforms and across ports of the generator to other languages.</p>
 *
 * <p>Usage:</p>
 * <pre>{@code
 * RandomSource rng = new DeterministicRandomSource(0x5EEDC0DEL);
 * double r = rng.next();
 * boolean rare = rng.chance(0.14);
 * }</pre>
 */
public class DeterministicRandomSource implements RandomSource {

  private static final int INCREMENT = 0x6D2B79F5;
  private static final double TWO_POW_32 = 4294967296.0;

  private final int seed;
  private int state;

  /**
   * Creates a source with a process-supplied random seed. Callers should
   * surface {@link #getSeedHex()} so the session can be reproduced.
   */
  public DeterministicRandomSource() {
    this(ThreadLocalRandom.current().nextInt());
  }

  /**
   * Creates a source with the given seed. Only the low 32 bits are used.
   *
   * @param seed The seed
   */
  public DeterministicRandomSource(long seed) {
    this.seed = (int) seed;
    this.state = this.seed;
  }

  @Override
  public double next() {
    state += INCREMENT;
    int t = (state ^ (state >>> 15)) * (1 | state);
    t = (t + (t ^ (t >>> 7)) * (61 | t)) ^ t;
    return ((t ^ (t >>> 14)) & 0xFFFFFFFFL) / TWO_POW_32;
  }

  @Override
  public boolean chance(double p) {
    return next() < p;
  }

  @Override
  public <T> T pick(List<T> items) {
    if (items == null || items.isEmpty()) {
      throw new InvalidArgumentException("items", "Cannot pick from an empty collection");
    }
    return items.get((int) Math.floor(next() * items.size()));
  }

  @Override
  public int nextInt(int min, int max) {
    if (max < min) {
      throw new InvalidArgumentException("max",
          String.format("Invalid range [%d, %d]: max is below min", min, max));
    }
    long span = (long) max - min + 1;
    return (int) (min + (long) Math.floor(next() * span));
  }

  @Override
  public long getSeed() {
    return Integer.toUnsignedLong(seed);
  }

  @Override
  public String getSeedHex() {
    return String.format(Locale.ROOT, "%08X", seed);
  }

  @Override
  public RandomSource createChild(String name) {
    if (name == null) {
      throw new InvalidArgumentException("name", "Child name cannot be null");
    }
    // Derived from the seed, not the state, so children do not depend on draw history
    int childSeed = seed;
    for (char c : name.toCharArray()) {
      childSeed = childSeed * 31 + c;
    }
    return new DeterministicRandomSource(childSeed);
  }

  @Override
  public String toString() {
    return "DeterministicRandomSource{seed=" + getSeedHex() + "}";
  }
}
