package io.github.panghy.roundengine.simulation;

import io.github.panghy.roundengine.error.InvalidArgumentException;
import io.github.panghy.roundengine.outcome.OutcomeEvent;

import java.util.Locale;

/**
 * Aggregate counts of a discrete-model simulation run.
 *
 * <p>Only counts are stored; every rate is derived from them. Results of
 * independent runs are combined with {@link #merge(SimulationResults)}, which
 * sums the counts, so merged rates are weighted by trial count rather than
 * naively averaged.</p>
 *
 * <p>Event counts include every weighted draw, second events as well as first
 * events, so {@code hitA + hitB + miss == trials + secondEvents}.</p>
 *
 * @param trials         Rounds simulated
 * @param wins           Rounds in which the selected side survived
 * @param hitA           Draws of {@link OutcomeEvent#HIT_A}
 * @param hitB           Draws of {@link OutcomeEvent#HIT_B}
 * @param miss           Draws of {@link OutcomeEvent#MISS}
 * @param rareEvents     Rounds in which the rare event triggered
 * @param secondEvents   Rounds in which a second event was drawn
 * @param payoutMultiple Payout per unit staked on a win
 */
public record SimulationResults(long trials,
                                long wins,
                                long hitA,
                                long hitB,
                                long miss,
                                long rareEvents,
                                long secondEvents,
                                double payoutMultiple) {

  public SimulationResults {
    if (trials <= 0) {
      throw new IllegalArgumentException("trials must be positive: " + trials);
    }
    if (wins < 0 || wins > trials) {
      throw new IllegalArgumentException("wins must be within [0, trials]: " + wins);
    }
    if (hitA < 0 || hitB < 0 || miss < 0) {
      throw new IllegalArgumentException(String.format(
          "Event counts cannot be negative: hitA=%d, hitB=%d, miss=%d", hitA, hitB, miss));
    }
    if (rareEvents < 0 || rareEvents > trials) {
      throw new IllegalArgumentException("rareEvents must be within [0, trials]: " + rareEvents);
    }
    if (secondEvents < 0 || secondEvents > trials) {
      throw new IllegalArgumentException("secondEvents must be within [0, trials]: " + secondEvents);
    }
    if (!(payoutMultiple >= 0) || Double.isInfinite(payoutMultiple)) {
      throw new IllegalArgumentException("payoutMultiple must be finite and non-negative: " + payoutMultiple);
    }
  }

  /**
   * Gets the fraction of rounds won.
   *
   * @return wins / trials
   */
  public double winRate() {
    return (double) wins / trials;
  }

  /**
   * Gets the measured return per unit staked.
   *
   * @return winRate * payoutMultiple
   */
  public double effectiveRtp() {
    return winRate() * payoutMultiple;
  }

  /**
   * Gets how many times an event was drawn.
   *
   * @param event The event
   * @return The draw count
   */
  public long eventCount(OutcomeEvent event) {
    switch (event) {
      case HIT_A:
        return hitA;
      case HIT_B:
        return hitB;
      case MISS:
        return miss;
      default:
        throw new IllegalStateException("Unhandled event: " + event);
    }
  }

  /**
   * Gets how often an event was drawn per round.
   *
   * @param event The event
   * @return eventCount(event) / trials
   */
  public double eventFrequency(OutcomeEvent event) {
    return (double) eventCount(event) / trials;
  }

  public double rareEventRate() {
    return (double) rareEvents / trials;
  }

  public double secondEventRate() {
    return (double) secondEvents / trials;
  }

  /**
   * Combines the counts of two independent runs.
   *
   * @param other Results of a run with the same payout multiple
   * @return Results holding the summed counts
   * @throws InvalidArgumentException if the payout multiples differ
   */
  public SimulationResults merge(SimulationResults other) {
    if (Double.compare(payoutMultiple, other.payoutMultiple) != 0) {
      throw new InvalidArgumentException("other", String.format(
          "Cannot merge results with different payout multiples: %s vs %s", payoutMultiple, other.payoutMultiple));
    }
    return new SimulationResults(
        trials + other.trials,
        wins + other.wins,
        hitA + other.hitA,
        hitB + other.hitB,
        miss + other.miss,
        rareEvents + other.rareEvents,
        secondEvents + other.secondEvents,
        payoutMultiple);
  }

  @Override
  public String toString() {
    return String.format(Locale.ROOT,
        "SimulationResults{trials=%d, winRate=%.4f, effectiveRtp=%.4f, hitA=%.4f, hitB=%.4f, miss=%.4f, "
            + "secondEvent=%.4f, rareEvent=%.4f}",
        trials, winRate(), effectiveRtp(), eventFrequency(OutcomeEvent.HIT_A), eventFrequency(OutcomeEvent.HIT_B),
        eventFrequency(OutcomeEvent.MISS), secondEventRate(), rareEventRate());
  }
}
