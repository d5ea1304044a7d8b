package io.github.panghy.roundengine.hazard;

import io.github.panghy.roundengine.error.InvalidArgumentException;

/**
 * Session-scoped state of the hazard model, owned by exactly one {@link HazardEngine}.
 *
 * <p>Streak counters persist across rounds; the run type is re-rolled at the
 * start of every round. At most one of {@link #getConsecutiveWins()} and
 * {@link #getConsecutiveLosses()} is nonzero; both are zero only until the
 * first round is settled.</p>
 *
 * <p>Only the owning engine (same package) mutates the state. Callers can read
 * it, or construct one in a given streak to resume a session.</p>
 */
public final class HazardState {

  private RunType runType;
  private int consecutiveWins;
  private int consecutiveLosses;
  private long roundNumber;
  private boolean roundActive;

  /**
   * Creates the state of a fresh session: MEDIUM run type, no streak, no rounds.
   */
  public HazardState() {
    this(RunType.MEDIUM, 0, 0);
  }

  /**
   * Creates a state in a given run type and streak, with no active round.
   *
   * @param runType           The current run type
   * @param consecutiveWins   Length of the current winning streak
   * @param consecutiveLosses Length of the current losing streak
   * @throws InvalidArgumentException if a counter is negative or both are nonzero
   */
  public HazardState(RunType runType, int consecutiveWins, int consecutiveLosses) {
    if (runType == null) {
      throw new InvalidArgumentException("runType", "Run type cannot be null");
    }
    if (consecutiveWins < 0 || consecutiveLosses < 0) {
      throw new InvalidArgumentException("consecutiveWins",
          "Streak counters cannot be negative: wins=" + consecutiveWins + ", losses=" + consecutiveLosses);
    }
    if (consecutiveWins > 0 && consecutiveLosses > 0) {
      throw new InvalidArgumentException("consecutiveLosses",
          "A session cannot be on a winning and a losing streak at once: wins="
              + consecutiveWins + ", losses=" + consecutiveLosses);
    }
    this.runType = runType;
    this.consecutiveWins = consecutiveWins;
    this.consecutiveLosses = consecutiveLosses;
  }

  public RunType getRunType() {
    return runType;
  }

  public int getConsecutiveWins() {
    return consecutiveWins;
  }

  public int getConsecutiveLosses() {
    return consecutiveLosses;
  }

  /**
   * Gets the number of rounds started in this session.
   *
   * @return The round counter
   */
  public long getRoundNumber() {
    return roundNumber;
  }

  /**
   * Checks whether a round has been started and not yet settled.
   *
   * @return true between startRound and onRoundWon/onRoundLost
   */
  public boolean isRoundActive() {
    return roundActive;
  }

  void beginRound(RunType runType) {
    this.runType = runType;
    this.roundNumber++;
    this.roundActive = true;
  }

  void recordWin() {
    consecutiveWins++;
    consecutiveLosses = 0;
    roundActive = false;
  }

  void recordLoss() {
    consecutiveLosses++;
    consecutiveWins = 0;
    roundActive = false;
  }

  @Override
  public String toString() {
    return "HazardState{" +
        "runType=" + runType +
        ", consecutiveWins=" + consecutiveWins +
        ", consecutiveLosses=" + consecutiveLosses +
        ", roundNumber=" + roundNumber +
        ", roundActive=" + roundActive +
        '}';
  }
}
