package jobflow.connectors.csv;

import java.nio.file.Path;

/**
 * Snapshot of the files a {@link CsvConnector} has produced in its output directory.
 *
 * @param currentFile     file receiving rows now, or {@code null} before the first write
 * @param currentRowCount rows written to {@code currentFile} by this connector
 */
public record CsvExportStats(
    Path outputDir,
    int fileCount,
    long totalRows,
    long totalSizeBytes,
    Path currentFile,
    long currentRowCount) {
}
