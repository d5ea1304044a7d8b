package io.github.panghy.roundengine.outcome;

/**
 * Result of a single three-way weighted draw in the discrete model.
 */
public enum OutcomeEvent {
  HIT_A(Side.A),
  HIT_B(Side.B),
  MISS(null);

  private final Side target;

  OutcomeEvent(Side target) {
    this.target = target;
  }

  /**
   * Gets the side this event destroys.
   *
   * @return The side hit, or null for {@link #MISS}
   */
  public Side target() {
    return target;
  }

  /**
   * Checks whether this event destroys the given side.
   *
   * @param side The side to check
   * @return true if this event is a hit on that side
   */
  public boolean hits(Side side) {
    return target != null && target == side;
  }
}
