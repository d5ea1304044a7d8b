package io.github.panghy.roundengine.hazard;

import java.util.EnumMap;
import java.util.Map;

/**
 * The complete probability table of the incremental hazard model.
 *
 * <p>For a step index {@code i} the raw hazard is
 * {@code baseProbability(runType) + growthRate(runType) * i}. A losing streak of
 * {@link #getStreakThreshold()} rounds multiplies it by the mercy factor, a
 * winning streak by the correction factor, and the result is always clamped
 * into {@code [minProbability, maxProbability]}.</p>
 *
 * <p>Instances are immutable. Example usage:</p>
 * <pre>{@code
 * HazardTuning tuning = HazardTuning.builder()
 *     .runType(RunType.SHORT, 0.20, 0.05)
 *     .clamp(0.05, 0.35)
 *     .build();
 * }</pre>
 */
public final class HazardTuning {

  public static final double DEFAULT_SHORT_THRESHOLD = 0.30;
  public static final double DEFAULT_MEDIUM_THRESHOLD = 0.80;
  public static final int DEFAULT_STREAK_THRESHOLD = 3;
  public static final double DEFAULT_MERCY_FACTOR = 0.80;
  public static final double DEFAULT_CORRECTION_FACTOR = 1.10;
  public static final double DEFAULT_MIN_PROBABILITY = 0.04;
  public static final double DEFAULT_MAX_PROBABILITY = 0.30;

  /**
   * Default payout growth per safe step.
   */
  public static final double DEFAULT_MULTIPLIER_STEP = 1.1;

  private final Map<RunType, Double> baseProbability;
  private final Map<RunType, Double> growthRate;
  private final double shortThreshold;
  private final double mediumThreshold;
  private final int streakThreshold;
  private final double mercyFactor;
  private final double correctionFactor;
  private final double minProbability;
  private final double maxProbability;
  private final double multiplierStep;

  private HazardTuning(Builder builder) {
    this.baseProbability = new EnumMap<>(builder.baseProbability);
    this.growthRate = new EnumMap<>(builder.growthRate);
    this.shortThreshold = builder.shortThreshold;
    this.mediumThreshold = builder.mediumThreshold;
    this.streakThreshold = builder.streakThreshold;
    this.mercyFactor = builder.mercyFactor;
    this.correctionFactor = builder.correctionFactor;
    this.minProbability = builder.minProbability;
    this.maxProbability = builder.maxProbability;
    this.multiplierStep = builder.multiplierStep;
  }

  /**
   * Creates a new builder initialised with the default table.
   *
   * @return A new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the default table.
   *
   * @return The default tuning
   */
  public static HazardTuning defaults() {
    return builder().build();
  }

  /**
   * Gets the hazard at step zero for a run type.
   *
   * @param runType The run type
   * @return The base probability
   */
  public double getBaseProbability(RunType runType) {
    return baseProbability.get(runType);
  }

  /**
   * Gets the hazard added per step for a run type.
   *
   * @param runType The run type
   * @return The growth rate
   */
  public double getGrowthRate(RunType runType) {
    return growthRate.get(runType);
  }

  /**
   * Gets the exclusive upper bound of the draws that select {@link RunType#SHORT}.
   *
   * @return The short threshold
   */
  public double getShortThreshold() {
    return shortThreshold;
  }

  /**
   * Gets the exclusive upper bound of the draws that select {@link RunType#MEDIUM}.
   * Draws at or above it select {@link RunType#LONG}.
   *
   * @return The medium threshold
   */
  public double getMediumThreshold() {
    return mediumThreshold;
  }

  public int getStreakThreshold() {
    return streakThreshold;
  }

  public double getMercyFactor() {
    return mercyFactor;
  }

  public double getCorrectionFactor() {
    return correctionFactor;
  }

  public double getMinProbability() {
    return minProbability;
  }

  public double getMaxProbability() {
    return maxProbability;
  }

  public double getMultiplierStep() {
    return multiplierStep;
  }

  /**
   * Maps a draw in {@code [0, 1)} to a run type.
   *
   * @param draw The draw
   * @return SHORT below the short threshold, MEDIUM below the medium threshold, LONG otherwise
   */
  public RunType runTypeFor(double draw) {
    if (draw < shortThreshold) {
      return RunType.SHORT;
    }
    if (draw < mediumThreshold) {
      return RunType.MEDIUM;
    }
    return RunType.LONG;
  }

  /**
   * Clamps a probability into {@code [minProbability, maxProbability]}.
   *
   * @param probability The raw probability
   * @return The clamped probability
   */
  public double clamp(double probability) {
    return Math.min(maxProbability, Math.max(minProbability, probability));
  }

  @Override
  public String toString() {
    return "HazardTuning{" +
        "baseProbability=" + baseProbability +
        ", growthRate=" + growthRate +
        ", shortThreshold=" + shortThreshold +
        ", mediumThreshold=" + mediumThreshold +
        ", streakThreshold=" + streakThreshold +
        ", mercyFactor=" + mercyFactor +
        ", correctionFactor=" + correctionFactor +
        ", minProbability=" + minProbability +
        ", maxProbability=" + maxProbability +
        ", multiplierStep=" + multiplierStep +
        '}';
  }

  /**
   * Builder for HazardTuning.
   */
  public static class Builder {
    private final Map<RunType, Double> baseProbability = new EnumMap<>(RunType.class);
    private final Map<RunType, Double> growthRate = new EnumMap<>(RunType.class);
    private double shortThreshold = DEFAULT_SHORT_THRESHOLD;
    private double mediumThreshold = DEFAULT_MEDIUM_THRESHOLD;
    private int streakThreshold = DEFAULT_STREAK_THRESHOLD;
    private double mercyFactor = DEFAULT_MERCY_FACTOR;
    private double correctionFactor = DEFAULT_CORRECTION_FACTOR;
    private double minProbability = DEFAULT_MIN_PROBABILITY;
    private double maxProbability = DEFAULT_MAX_PROBABILITY;
    private double multiplierStep = DEFAULT_MULTIPLIER_STEP;

    private Builder() {
      runType(RunType.SHORT, 0.25, 0.06);
      runType(RunType.MEDIUM, 0.14, 0.03);
      runType(RunType.LONG, 0.08, 0.015);
    }

    /**
     * Sets the escalation curve of a run type.
     *
     * @param runType         The run type
     * @param baseProbability The hazard at step zero
     * @param growthRate      The hazard added per step (non-negative)
     * @return This builder for chaining
     * @throws IllegalArgumentException if runType is null
     */
    public Builder runType(RunType runType, double baseProbability, double growthRate) {
      if (runType == null) {
        throw new IllegalArgumentException("Run type cannot be null");
      }
      this.baseProbability.put(runType, baseProbability);
      this.growthRate.put(runType, growthRate);
      return this;
    }

    /**
     * Sets the partition of {@code [0, 1)} used to choose run types.
     *
     * @param shortThreshold  Upper bound of SHORT draws
     * @param mediumThreshold Upper bound of MEDIUM draws
     * @return This builder for chaining
     */
    public Builder runTypeThresholds(double shortThreshold, double mediumThreshold) {
      this.shortThreshold = shortThreshold;
      this.mediumThreshold = mediumThreshold;
      return this;
    }

    /**
     * Sets the streak modulation.
     *
     * @param streakThreshold  Consecutive results needed to activate a factor
     * @param mercyFactor      Factor after a losing streak, in (0, 1]
     * @param correctionFactor Factor after a winning streak, at least 1
     * @return This builder for chaining
     */
    public Builder streak(int streakThreshold, double mercyFactor, double correctionFactor) {
      this.streakThreshold = streakThreshold;
      this.mercyFactor = mercyFactor;
      this.correctionFactor = correctionFactor;
      return this;
    }

    /**
     * Sets the safety band every hazard probability is clamped into.
     *
     * @param minProbability The lower bound
     * @param maxProbability The upper bound
     * @return This builder for chaining
     */
    public Builder clamp(double minProbability, double maxProbability) {
      this.minProbability = minProbability;
      this.maxProbability = maxProbability;
      return this;
    }

    public Builder multiplierStep(double multiplierStep) {
      this.multiplierStep = multiplierStep;
      return this;
    }

    /**
     * Builds the tuning table.
     *
     * @return A new immutable HazardTuning
     * @throws IllegalArgumentException if any value is out of range
     */
    public HazardTuning build() {
      for (RunType runType : RunType.values()) {
        double base = baseProbability.get(runType);
        double growth = growthRate.get(runType);
        if (!(base >= 0 && base <= 1)) {
          throw new IllegalArgumentException("Base probability of " + runType + " must be within [0, 1]: " + base);
        }
        if (!(growth >= 0) || Double.isInfinite(growth)) {
          throw new IllegalArgumentException("Growth rate of " + runType + " must be non-negative: " + growth);
        }
      }
      if (!(shortThreshold >= 0 && shortThreshold <= mediumThreshold && mediumThreshold <= 1)) {
        throw new IllegalArgumentException(String.format(
            "Run type thresholds must satisfy 0 <= short <= medium <= 1: short=%s, medium=%s",
            shortThreshold, mediumThreshold));
      }
      if (streakThreshold < 1) {
        throw new IllegalArgumentException("Streak threshold must be at least 1: " + streakThreshold);
      }
      if (!(mercyFactor > 0 && mercyFactor <= 1)) {
        throw new IllegalArgumentException("Mercy factor must be within (0, 1]: " + mercyFactor);
      }
      if (!(correctionFactor >= 1) || Double.isInfinite(correctionFactor)) {
        throw new IllegalArgumentException("Correction factor must be at least 1: " + correctionFactor);
      }
      if (!(minProbability >= 0 && minProbability <= maxProbability && maxProbability <= 1)) {
        throw new IllegalArgumentException(String.format(
            "Clamp band must satisfy 0 <= min <= max <= 1: min=%s, max=%s", minProbability, maxProbability));
      }
      if (!(multiplierStep >= 1) || Double.isInfinite(multiplierStep)) {
        throw new IllegalArgumentException("Multiplier step must be at least 1: " + multiplierStep);
      }
      return new HazardTuning(this);
    }
  }
}
