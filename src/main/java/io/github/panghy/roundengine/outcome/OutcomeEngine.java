package io.github.panghy.roundengine.outcome;

import io.github.panghy.roundengine.error.InvalidArgumentException;
import io.github.panghy.roundengine.random.RandomSource;

import java.util.Locale;
import java.util.logging.Logger;

import static io.github.panghy.roundengine.util.LoggingUtil.debug;
import static io.github.panghy.roundengine.util.LoggingUtil.warn;

/**
 * Resolves rounds of the discrete multi-event model.
 *
 * <p>Each round consumes draws from the bound {@link RandomSource} in a fixed
 * order:</p>
 * <ol>
 *   <li>the rare event, and its target if it triggers;</li>
 *   <li>the first weighted event;</li>
 *   <li>only after a miss, whether a second event happens, and that event.</li>
 * </ol>
 * <p>The order is part of the contract: two engines bound to equally seeded
 * sources resolve identical rounds. A round consumes at most four draws.</p>
 *
 * <p>An engine is not thread-safe. Each round mutates the source's state, so a
 * single engine must have at most one {@link #resolveRound(Side)} in flight;
 * sessions that run concurrently need one engine and one source each.</p>
 */
public class OutcomeEngine {

  private static final Logger LOGGER = Logger.getLogger(OutcomeEngine.class.getName());

  /**
   * Largest gap between the exact RTP of a tuning table and its target that
   * is accepted without a warning.
   */
  static final double RTP_WARNING_TOLERANCE = 0.005;

  private final RandomSource random;
  private final OutcomeTuning tuning;

  // Cumulative thresholds of the weighted draw, fixed for the tuning table
  private final double hitAWeight;
  private final double hitABWeight;
  private final double totalWeight;

  /**
   * Creates an engine with the default tuning table.
   *
   * @param random The source to draw from
   */
  public OutcomeEngine(RandomSource random) {
    this(random, OutcomeTuning.defaults());
  }

  /**
   * Creates an engine with a custom tuning table. A table whose exact RTP is
   * more than {@value #RTP_WARNING_TOLERANCE} away from its target is accepted
   * but logged as a warning.
   *
   * @param random The source to draw from
   * @param tuning The tuning table
   */
  public OutcomeEngine(RandomSource random, OutcomeTuning tuning) {
    if (random == null) {
      throw new NullPointerException("RandomSource cannot be null");
    }
    if (tuning == null) {
      throw new NullPointerException("OutcomeTuning cannot be null");
    }
    this.random = random;
    this.tuning = tuning;
    this.hitAWeight = tuning.weight(OutcomeEvent.HIT_A);
    this.hitABWeight = hitAWeight + tuning.weight(OutcomeEvent.HIT_B);
    this.totalWeight = tuning.totalWeight();

    double expectedRtp = tuning.expectedRtp();
    if (Math.abs(expectedRtp - tuning.getTargetRtp()) > RTP_WARNING_TOLERANCE) {
      warn(LOGGER, String.format(Locale.ROOT, "Tuning table pays %.4f against a target RTP of %.4f: %s",
          expectedRtp, tuning.getTargetRtp(), tuning));
    }
  }

  /**
   * Resolves one round for the side the player backed.
   *
   * @param selectedSide The selected side
   * @return The immutable record of the round
   * @throws InvalidArgumentException if selectedSide is null
   */
  public RoundResolution resolveRound(Side selectedSide) {
    if (selectedSide == null) {
      throw new InvalidArgumentException("selectedSide", "Selected side cannot be null");
    }

    Side rareEventTarget = null;
    if (random.chance(tuning.effectiveRareProbability())) {
      rareEventTarget = random.chance(0.5) ? Side.A : Side.B;
    }

    OutcomeEvent firstEvent = drawEvent();
    OutcomeEvent secondEvent = null;
    if (firstEvent == OutcomeEvent.MISS
        && random.chance(tuning.getBaseSecondEventOnMissProbability())) {
      secondEvent = drawEvent();
    }

    RoundResolution resolution = new RoundResolution(selectedSide, firstEvent, secondEvent, rareEventTarget);
    debug(LOGGER, () -> "Resolved round for side " + selectedSide + ": " + resolution
        + " (wins=" + resolution.selectedSideWins() + ")");
    return resolution;
  }

  /**
   * Resolves one round for a side given by its code.
   *
   * @param selectedSide The side code, {@code "A"} or {@code "B"}
   * @return The immutable record of the round
   * @throws InvalidArgumentException if the code names no side
   */
  public RoundResolution resolveRound(String selectedSide) {
    return resolveRound(Side.fromCode(selectedSide));
  }

  /**
   * Gets the tuning table this engine draws with.
   *
   * @return The tuning table
   */
  public OutcomeTuning getTuning() {
    return tuning;
  }

  private OutcomeEvent drawEvent() {
    double r = random.next() * totalWeight;
    // Thresholds are exclusive upper bounds: r == hitAWeight is a hit on B
    if (r < hitAWeight) {
      return OutcomeEvent.HIT_A;
    }
    if (r < hitABWeight) {
      return OutcomeEvent.HIT_B;
    }
    return OutcomeEvent.MISS;
  }
}
