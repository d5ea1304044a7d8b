package io.github.panghy.roundengine.outcome;

import java.util.EnumSet;
import java.util.Set;

/**
 * Complete, immutable record of one discrete round.
 *
 * <p>Only the raw draws are stored. Which sides are destroyed and whether the
 * selected side wins are derived from them on every call, so a resolution can
 * never carry a verdict that disagrees with its draws.</p>
 *
 * @param selectedSide    The side the player backed
 * @param firstEvent      The primary weighted draw
 * @param secondEvent     The secondary draw, or null if none was triggered
 * @param rareEventTarget The side hit by the rare event, or null if it did not trigger
 */
public record RoundResolution(Side selectedSide,
                              OutcomeEvent firstEvent,
                              OutcomeEvent secondEvent,
                              Side rareEventTarget) {

  public RoundResolution {
    if (selectedSide == null) {
      throw new NullPointerException("selectedSide cannot be null");
    }
    if (firstEvent == null) {
      throw new NullPointerException("firstEvent cannot be null");
    }
    if (secondEvent != null && firstEvent != OutcomeEvent.MISS) {
      throw new IllegalArgumentException("A second event can only follow a miss, first event was " + firstEvent);
    }
  }

  /**
   * Checks whether the secondary draw happened.
   *
   * @return true if a second event was drawn
   */
  public boolean secondEventTriggered() {
    return secondEvent != null;
  }

  /**
   * Checks whether the rare event happened.
   *
   * @return true if the rare event hit a side
   */
  public boolean rareEventTriggered() {
    return rareEventTarget != null;
  }

  /**
   * Checks whether a side was destroyed by any event this round.
   *
   * @param side The side to check
   * @return true if the first event, the second event or the rare event names the side
   */
  public boolean isDestroyed(Side side) {
    return firstEvent.hits(side)
        || (secondEvent != null && secondEvent.hits(side))
        || rareEventTarget == side;
  }

  /**
   * Checks whether a side is still standing.
   *
   * @param side The side to check
   * @return the negation of {@link #isDestroyed(Side)}
   */
  public boolean survives(Side side) {
    return !isDestroyed(side);
  }

  /**
   * Gets every destroyed side.
   *
   * @return A fresh set of destroyed sides, possibly empty
   */
  public Set<Side> destroyedSides() {
    EnumSet<Side> destroyed = EnumSet.noneOf(Side.class);
    for (Side side : Side.values()) {
      if (isDestroyed(side)) {
        destroyed.add(side);
      }
    }
    return destroyed;
  }

  /**
   * Gets the verdict for the player.
   *
   * @return true if the selected side survived
   */
  public boolean selectedSideWins() {
    return survives(selectedSide);
  }
}
