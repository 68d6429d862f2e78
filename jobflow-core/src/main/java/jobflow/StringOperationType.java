package jobflow;

import java.util.Objects;

/**
 * Operation type backed by a plain string.
 *
 * <pre>{@code
 * OperationType type = StringOperationType.of("INVOICE_EXTRACTION");
 * }</pre>
 */
public final class StringOperationType implements OperationType {

  private final String name;

  private StringOperationType(String name) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Operation type name cannot be empty");
    }
  }

  /**
   * Creates an operation type from a string.
   *
   * @throws NullPointerException if name is null
   * @throws IllegalArgumentException if name is empty
   */
  public static StringOperationType of(String name) {
    return new StringOperationType(name);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof StringOperationType)) return false;
    return name.equals(((StringOperationType) o).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
