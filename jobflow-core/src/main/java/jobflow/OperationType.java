package jobflow;

/**
 * Kind of work a job performs. Handlers are registered per operation type.
 *
 * <p>Implement with an enum for a fixed set of operations:
 * <pre>{@code
 * enum DocumentOps implements OperationType { INVOICE_EXTRACTION, INVOICE_VALIDATION }
 * }</pre>
 * or use {@link StringOperationType} when types are only known at runtime.
 */
public interface OperationType {

  /**
   * Returns the name stored in the {@code operation_type} column.
   */
  String name();
}
