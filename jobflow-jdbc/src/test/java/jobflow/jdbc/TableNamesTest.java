package jobflow.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void acceptsPlainIdentifiers() {
    assertEquals("jobflow_job", TableNames.validate("jobflow_job"));
    assertEquals("_Jobs2", TableNames.validate("_Jobs2"));
  }

  @Test
  void rejectsInvalidIdentifiers() {
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("2jobs"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("jobs;--"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("schema.jobs"));
  }

  @Test
  void dependencyTableUsesSuffix() {
    assertEquals("jobflow_job_dependency", TableNames.dependencyTable(TableNames.DEFAULT_TABLE));
  }
}
