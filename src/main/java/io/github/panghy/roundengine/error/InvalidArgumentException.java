package io.github.panghy.roundengine.error;

/**
 * Exception thrown when an engine operation receives an argument outside its domain.
 *
 * <p>This exception is thrown in the following scenarios:</p>
 * <ul>
 *   <li>A side code that is neither {@code A} nor {@code B}, or a null side</li>
 *   <li>{@code pick} called with an empty collection</li>
 *   <li>A negative step index passed to the hazard engine</li>
 *   <li>Non-positive trial counts or empty seed lists passed to the simulation harness</li>
 * </ul>
 */
public class InvalidArgumentException extends RoundEngineException {

  private final String argumentName;

  /**
   * Creates a new InvalidArgumentException.
   *
   * @param argumentName The name of the offending argument
   * @param message      The error message
   */
  public InvalidArgumentException(String argumentName, String message) {
    super(ErrorCode.INVALID_ARGUMENT, message);
    this.argumentName = argumentName;
  }

  /**
   * Gets the name of the argument that was rejected.
   *
   * @return The argument name
   */
  public String getArgumentName() {
    return argumentName;
  }
}
