package io.github.panghy.roundengine.hazard;

import io.github.panghy.roundengine.error.ContractViolationException;
import io.github.panghy.roundengine.error.InvalidArgumentException;
import io.github.panghy.roundengine.random.RandomSource;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.logging.Logger;

import static io.github.panghy.roundengine.util.LoggingUtil.debug;

/**
 * Drives rounds of the incremental hazard model.
 *
 * <p>A round is a sequence of steps. The caller supplies the zero-based step
 * index; the engine keeps no step counter, so
 * {@link #hazardProbability(int)} is a pure function of the step index and the
 * session state.</p>
 *
 * <p>Call protocol per round:</p>
 * <pre>{@code
 * engine.startRound();
 * int step = 0;
 * while (playerContinues && !engine.isDanger(step)) {
 *   step++;
 * }
 * if (dangerHit) engine.onRoundLost(); else engine.onRoundWon();
 * }</pre>
 *
 * <p>Exactly one of {@link #onRoundWon()} and {@link #onRoundLost()} must be
 * called per started round; any other sequence raises
 * {@link ContractViolationException}. An engine is not thread-safe and must be
 * driven by one session at a time.</p>
 */
public class HazardEngine {

  private static final Logger LOGGER = Logger.getLogger(HazardEngine.class.getName());

  private final RandomSource random;
  private final HazardTuning tuning;
  private final HazardState state;

  /**
   * Creates an engine for a fresh session with the default tuning table.
   *
   * @param random The source to draw from
   */
  public HazardEngine(RandomSource random) {
    this(random, HazardTuning.defaults(), new HazardState());
  }

  /**
   * Creates an engine for a fresh session with a custom tuning table.
   *
   * @param random The source to draw from
   * @param tuning The tuning table
   */
  public HazardEngine(RandomSource random, HazardTuning tuning) {
    this(random, tuning, new HazardState());
  }

  /**
   * Creates an engine that takes ownership of an existing session state.
   *
   * @param random The source to draw from
   * @param tuning The tuning table
   * @param state  The session state, which must not be shared with another engine
   */
  public HazardEngine(RandomSource random, HazardTuning tuning, HazardState state) {
    if (random == null) {
      throw new NullPointerException("RandomSource cannot be null");
    }
    if (tuning == null) {
      throw new NullPointerException("HazardTuning cannot be null");
    }
    if (state == null) {
      throw new NullPointerException("HazardState cannot be null");
    }
    this.random = random;
    this.tuning = tuning;
    this.state = state;
  }

  /**
   * Starts a round: draws the run type and increments the round number.
   * Streak counters are left untouched.
   *
   * @return The run type of the new round
   * @throws ContractViolationException if the previous round was never settled
   */
  public RunType startRound() {
    if (state.isRoundActive()) {
      throw new ContractViolationException("startRound",
          "Round " + state.getRoundNumber() + " was started but never settled");
    }
    RunType runType = tuning.runTypeFor(random.next());
    state.beginRound(runType);
    debug(LOGGER, () -> "Started round " + state.getRoundNumber() + " as " + runType
        + " (wins=" + state.getConsecutiveWins() + ", losses=" + state.getConsecutiveLosses() + ")");
    return runType;
  }

  /**
   * Gets the danger probability of a step in the current round. The streak
   * factor is applied before clamping, so when the raw value already exceeds
   * the upper bound of the band a mercy factor may not lower the result.
   *
   * @param stepIndex The zero-based step index
   * @return A probability within {@code [minProbability, maxProbability]}
   * @throws InvalidArgumentException if stepIndex is negative
   */
  public double hazardProbability(int stepIndex) {
    if (stepIndex < 0) {
      throw new InvalidArgumentException("stepIndex", "Step index cannot be negative: " + stepIndex);
    }
    RunType runType = state.getRunType();
    double probability = tuning.getBaseProbability(runType) + tuning.getGrowthRate(runType) * stepIndex;
    if (state.getConsecutiveLosses() >= tuning.getStreakThreshold()) {
      probability *= tuning.getMercyFactor();
    } else if (state.getConsecutiveWins() >= tuning.getStreakThreshold()) {
      probability *= tuning.getCorrectionFactor();
    }
    return tuning.clamp(probability);
  }

  /**
   * Draws whether a step ends the round. Consumes exactly one draw.
   *
   * @param stepIndex The zero-based step index
   * @return true if the danger event occurs on this step
   * @throws InvalidArgumentException if stepIndex is negative
   */
  public boolean isDanger(int stepIndex) {
    double probability = hazardProbability(stepIndex);
    boolean danger = random.chance(probability);
    if (danger) {
      debug(LOGGER, () -> "Danger on step " + stepIndex + " of round " + state.getRoundNumber()
          + " at p=" + probability);
    }
    return danger;
  }

  /**
   * Settles the current round as won.
   *
   * @throws ContractViolationException if no round is active
   */
  public void onRoundWon() {
    requireActiveRound("onRoundWon");
    state.recordWin();
  }

  /**
   * Settles the current round as lost.
   *
   * @throws ContractViolationException if no round is active
   */
  public void onRoundLost() {
    requireActiveRound("onRoundLost");
    state.recordLoss();
  }

  /**
   * Gets the payout multiple after a number of safe steps,
   * {@code multiplierStep ^ safeSteps} rounded half-up to four decimals.
   *
   * @param safeSteps Steps survived before cashing out
   * @return The payout per unit staked
   * @throws InvalidArgumentException if safeSteps is negative
   */
  public double payoutMultiple(int safeSteps) {
    if (safeSteps < 0) {
      throw new InvalidArgumentException("safeSteps", "Safe steps cannot be negative: " + safeSteps);
    }
    double multiple = Math.pow(tuning.getMultiplierStep(), safeSteps);
    return BigDecimal.valueOf(multiple).setScale(4, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * Gets the run type of the current (or, between rounds, the last) round.
   *
   * @return The run type
   */
  public RunType currentRunType() {
    return state.getRunType();
  }

  public HazardState getState() {
    return state;
  }

  public HazardTuning getTuning() {
    return tuning;
  }

  private void requireActiveRound(String operation) {
    if (!state.isRoundActive()) {
      throw new ContractViolationException(operation, state.getRoundNumber() == 0
          ? operation + " called before any round was started"
          : operation + " called but round " + state.getRoundNumber() + " is already settled");
    }
  }
}
