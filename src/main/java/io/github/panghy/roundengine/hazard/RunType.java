package io.github.panghy.roundengine.hazard;

/**
 * Per-round category controlling how fast the hazard escalates over steps.
 * Chosen once by {@link HazardEngine#startRound()} and fixed for the round.
 */
public enum RunType {
  /**
   * High initial hazard that grows quickly; danger likely within the first few steps.
   */
  SHORT,

  /**
   * Moderate hazard; danger likely after four to six steps.
   */
  MEDIUM,

  /**
   * Low initial hazard that grows slowly; rounds often survive seven or more steps.
   */
  LONG
}
