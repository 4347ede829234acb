package com.tradeingest.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Running row counts for one batch. Duplicates are tracked apart from successes and errors so the
 * batch invariant {@code totalRecords >= successCount + errorCount} holds.
 */
public class ImportTally {

    private final int totalRecords;
    private int successCount;
    private int errorCount;
    private int duplicateCount;
    private final List<String> errors = new ArrayList<>();

    public ImportTally(int totalRecords) {
        this.totalRecords = totalRecords;
    }

    public void success() {
        successCount++;
    }

    public void duplicate() {
        duplicateCount++;
    }

    public void error(String message) {
        errorCount++;
        errors.add(message);
    }

    public void rowError(int rowNumber, String reason) {
        error("Row " + rowNumber + ": " + reason);
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getDuplicateCount() {
        return duplicateCount;
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /** Every record failed, including the degenerate case of a file with no importable records. */
    public boolean allFailed() {
        return errorCount == totalRecords;
    }
}
