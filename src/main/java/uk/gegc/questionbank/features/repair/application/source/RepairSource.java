package uk.gegc.questionbank.features.repair.application.source;

import uk.gegc.questionbank.features.repair.domain.model.RepairTable;

/**
 * Reads a primary-store table in id order for rebuilding.
 */
public interface RepairSource {

    RepairTable supportedTable();

    /**
     * @param cursor id of the last row already processed, or {@code null} to start from the beginning
     */
    ScanPage scan(String cursor, int pageSize);

    /**
     * Same as {@link #scan} restricted to the rows of one user.
     *
     * @throws UnsupportedOperationException if the table has no per-user rows
     */
    default ScanPage scanUser(String userId, String cursor, int pageSize) {
        throw new UnsupportedOperationException("Table " + supportedTable() + " cannot be scanned per user");
    }
}
