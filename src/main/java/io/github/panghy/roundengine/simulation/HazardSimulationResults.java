package io.github.panghy.roundengine.simulation;

import io.github.panghy.roundengine.error.InvalidArgumentException;
import io.github.panghy.roundengine.hazard.RunType;

import java.util.Locale;

/**
 * Aggregate counts of a hazard-model simulation run in which the simulated
 * player cashes out after a fixed number of safe steps.
 *
 * @param trials            Rounds simulated
 * @param wins              Rounds cashed out without a danger event
 * @param stepsPlayed       Steps drawn across all rounds
 * @param shortRounds       Rounds of type {@link RunType#SHORT}
 * @param mediumRounds      Rounds of type {@link RunType#MEDIUM}
 * @param longRounds        Rounds of type {@link RunType#LONG}
 * @param totalPayout       Sum of payout multiples of won rounds, per unit stake
 * @param cashOutAfterSteps Safe steps after which the player cashes out
 */
public record HazardSimulationResults(long trials,
                                      long wins,
                                      long stepsPlayed,
                                      long shortRounds,
                                      long mediumRounds,
                                      long longRounds,
                                      double totalPayout,
                                      int cashOutAfterSteps) {

  public HazardSimulationResults {
    if (trials <= 0) {
      throw new IllegalArgumentException("trials must be positive: " + trials);
    }
    if (wins < 0 || wins > trials) {
      throw new IllegalArgumentException("wins must be within [0, trials]: " + wins);
    }
    if (stepsPlayed < 0) {
      throw new IllegalArgumentException("stepsPlayed cannot be negative: " + stepsPlayed);
    }
    if (shortRounds < 0 || mediumRounds < 0 || longRounds < 0) {
      throw new IllegalArgumentException(String.format(
          "Run type counts cannot be negative: short=%d, medium=%d, long=%d", shortRounds, mediumRounds, longRounds));
    }
    if (!(totalPayout >= 0) || Double.isInfinite(totalPayout)) {
      throw new IllegalArgumentException("totalPayout must be finite and non-negative: " + totalPayout);
    }
    if (cashOutAfterSteps < 0) {
      throw new IllegalArgumentException("cashOutAfterSteps cannot be negative: " + cashOutAfterSteps);
    }
  }

  public long losses() {
    return trials - wins;
  }

  public double winRate() {
    return (double) wins / trials;
  }

  public double lossRate() {
    return (double) losses() / trials;
  }

  /**
   * Gets the measured return per unit staked.
   *
   * @return totalPayout / trials
   */
  public double effectiveRtp() {
    return totalPayout / trials;
  }

  /**
   * Gets the mean number of steps drawn per round, the losing step included.
   *
   * @return stepsPlayed / trials
   */
  public double averageSteps() {
    return (double) stepsPlayed / trials;
  }

  /**
   * Gets how many rounds were of a run type.
   *
   * @param runType The run type
   * @return The round count
   */
  public long runTypeCount(RunType runType) {
    switch (runType) {
      case SHORT:
        return shortRounds;
      case MEDIUM:
        return mediumRounds;
      case LONG:
        return longRounds;
      default:
        throw new IllegalStateException("Unhandled run type: " + runType);
    }
  }

  public double runTypeFrequency(RunType runType) {
    return (double) runTypeCount(runType) / trials;
  }

  /**
   * Combines the counts of two independent runs.
   *
   * @param other Results of a run with the same cash-out step
   * @return Results holding the summed counts
   * @throws InvalidArgumentException if the cash-out steps differ
   */
  public HazardSimulationResults merge(HazardSimulationResults other) {
    if (cashOutAfterSteps != other.cashOutAfterSteps) {
      throw new InvalidArgumentException("other", String.format(
          "Cannot merge results with different cash-out steps: %d vs %d", cashOutAfterSteps, other.cashOutAfterSteps));
    }
    return new HazardSimulationResults(
        trials + other.trials,
        wins + other.wins,
        stepsPlayed + other.stepsPlayed,
        shortRounds + other.shortRounds,
        mediumRounds + other.mediumRounds,
        longRounds + other.longRounds,
        totalPayout + other.totalPayout,
        cashOutAfterSteps);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT,
        "HazardSimulationResults{trials=%d, cashOutAfterSteps=%d, winRate=%.4f, effectiveRtp=%.4f, "
            + "averageSteps=%.3f, short=%.4f, medium=%.4f, long=%.4f}",
        trials, cashOutAfterSteps, winRate(), effectiveRtp(), averageSteps(),
        runTypeFrequency(RunType.SHORT), runTypeFrequency(RunType.MEDIUM), runTypeFrequency(RunType.LONG));
  }
}
