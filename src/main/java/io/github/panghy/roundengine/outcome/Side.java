package io.github.panghy.roundengine.outcome;

import io.github.panghy.roundengine.error.InvalidArgumentException;

import java.util.Locale;

/**
 * One of the two targets a player can back in the discrete model.
 */
public enum Side {
  A,
  B;

  /**
   * Parses a side code, ignoring case and surrounding whitespace.
   *
   * @param code The code, {@code "A"} or {@code "B"}
   * @return The matching side
   * @throws InvalidArgumentException if the code names no side
   */
  public static Side fromCode(String code) {
    if (code != null) {
      String normalized = code.trim().toUpperCase(Locale.ROOT);
      for (Side side : values()) {
        if (side.name().equals(normalized)) {
          return side;
        }
      }
    }
    throw new InvalidArgumentException("selectedSide", "Unknown side: " + code);
  }
}
