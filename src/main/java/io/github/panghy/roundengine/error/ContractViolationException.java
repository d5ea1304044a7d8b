package io.github.panghy.roundengine.error;

/**
 * Exception thrown when a caller breaks the per-round call protocol of a stateful engine.
 *
 * <p>A correct caller never sees this exception. It is raised unconditionally
 * (not only when assertions are enabled) so that a broken game controller
 * fails fast instead of silently corrupting streak state.</p>
 */
public class ContractViolationException extends RoundEngineException {

  private final String operation;

  /**
   * Creates a new ContractViolationException.
   *
   * @param operation The operation that was called out of order
   * @param message   The error message
   */
  public ContractViolationException(String operation, String message) {
    super(ErrorCode.CONTRACT_VIOLATION, message);
    this.operation = operation;
  }

  /**
   * Gets the name of the operation that violated the contract.
   *
   * @return The operation name
   */
  public String getOperation() {
    return operation;
  }
}
