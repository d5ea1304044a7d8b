package io.github.panghy.roundengine.error;

/**
 * Base exception class for errors raised by the round-outcome engines.
 *
 * <p>The engines perform no I/O, so every error in this hierarchy signals a
 * programming error in the caller rather than a transient condition. Nothing
 * is retried internally; the exception is always surfaced synchronously.</p>
 *
 * <p>Each exception carries an {@link ErrorCode} so callers can branch on the
 * failure class without inspecting messages.</p>
 */
public class RoundEngineException extends RuntimeException {

  /**
   * Enumeration of error codes for engine exceptions.
   */
  public enum ErrorCode {
    /**
     * Unknown or unspecified error.
     */
    UNKNOWN(2000),

    /**
     * An argument was outside the domain of the operation (unknown side,
     * empty pick list, negative step index).
     */
    INVALID_ARGUMENT(2001),

    /**
     * A stateful call sequence was broken (hazard round settled twice,
     * settled without being started, or restarted while unsettled).
     */
    CONTRACT_VIOLATION(2002);

    private final int code;

    ErrorCode(int code) {
      this.code = code;
    }

    /**
     * Gets the numeric code for this error.
     *
     * @return The error code
     */
    public int getCode() {
      return code;
    }

    /**
     * Gets an ErrorCode from its numeric value.
     *
     * @param code The numeric error code
     * @return The corresponding ErrorCode, or UNKNOWN if not found
     */
    public static ErrorCode fromCode(int code) {
      for (ErrorCode errorCode : values()) {
        if (errorCode.code == code) {
          return errorCode;
        }
      }
      return UNKNOWN;
    }
  }

  private final ErrorCode errorCode;

  /**
   * Creates a new engine exception with the specified error code and message.
   *
   * @param errorCode The error code
   * @param message   The error message
   */
  public RoundEngineException(ErrorCode errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  /**
   * Creates a new engine exception with the specified error code, message, and cause.
   *
   * @param errorCode The error code
   * @param message   The error message
   * @param cause     The underlying cause
   */
  public RoundEngineException(ErrorCode errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }

  /**
   * Gets the error code for this exception.
   *
   * @return The error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Gets the numeric value of the error code.
   *
   * @return The numeric error code
   */
  public int getErrorCodeValue() {
    return errorCode.getCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" +
        "errorCode=" + errorCode +
        ", message='" + getMessage() + '\'' +
        '}';
  }
}
