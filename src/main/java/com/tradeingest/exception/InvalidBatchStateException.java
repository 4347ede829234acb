package com.tradeingest.exception;

import com.tradeingest.domain.enums.ImportBatchStatus;
import java.util.Map;

/** An action or transition that the batch's current lifecycle state does not allow. */
public class InvalidBatchStateException extends BaseException {

    public InvalidBatchStateException(String batchId, ImportBatchStatus current, String attempted) {
        super(
                ErrorCode.CONFLICT,
                "Import batch " + batchId + " is " + current + "; cannot " + attempted,
                Map.of("batchId", String.valueOf(batchId), "status", String.valueOf(current)));
    }
}
