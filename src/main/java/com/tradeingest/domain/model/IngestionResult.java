package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.ImportType;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured outcome of one ingest call. Every failure category except validation ends up here. */
@Getter
@Builder
public class IngestionResult {

    private final boolean success;
    private final String importBatchId;
    private final ImportType importType;
    private final int totalRecords;
    private final int successCount;
    private final int errorCount;

    /** Rows skipped because the same order was already imported; counted as neither success nor error. */
    private final int duplicateCount;

    @Builder.Default
    private final List<String> errors = new ArrayList<>();

    private final boolean requiresUserReview;
    private final boolean requiresBrokerSelection;
    private final MappingResult mappingResult;
    private final String brokerFormatUsed;

    /** Strategy label chosen by the decision policy, for diagnostics. */
    private final String strategy;
}
