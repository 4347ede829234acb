package com.tradeingest.ingest;

import com.tradeingest.ai.AiMappingAdapter;
import com.tradeingest.config.IngestionProperties;
import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.enums.ImportBatchStatus;
import com.tradeingest.domain.enums.ImportType;
import com.tradeingest.domain.enums.OrderSection;
import com.tradeingest.domain.enums.ParseMethod;
import com.tradeingest.domain.enums.ReviewStatus;
import com.tradeingest.domain.enums.UploadStatus;
import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.FormatDetectionResult;
import com.tradeingest.domain.model.ImportBatch;
import com.tradeingest.domain.model.IngestionResult;
import com.tradeingest.domain.model.MappingProposal;
import com.tradeingest.domain.model.MappingResult;
import com.tradeingest.domain.model.ParsedCsv;
import com.tradeingest.domain.model.SectionedExport;
import com.tradeingest.domain.model.ValidationResult;
import com.tradeingest.exception.AiMappingException;
import com.tradeingest.exception.FileTooLargeException;
import com.tradeingest.exception.InvalidBatchStateException;
import com.tradeingest.format.FormatDetector;
import com.tradeingest.format.FormatFactory;
import com.tradeingest.format.FormatRepository;
import com.tradeingest.format.SeededFormats;
import com.tradeingest.format.StandardSchema;
import com.tradeingest.mapping.MappingDecision;
import com.tradeingest.mapping.MappingResolver;
import com.tradeingest.mapping.MappingStrategy;
import com.tradeingest.mapping.ReviewPolicy;
import com.tradeingest.parser.FileSizeTier;
import com.tradeingest.parser.RawCsvParser;
import com.tradeingest.parser.SectionedExportParser;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for CSV trade imports.
 *
 * <p>An upload is parsed, routed by {@link MappingResolver} and then either imported right away
 * (sectioned export, standard schema, registry and user mappings) or parked as a PENDING batch that
 * keeps the raw file until the user selects a broker or approves the AI-proposed mapping. Validation
 * problems are thrown as {@code CsvValidationException}; every later failure is reported in the
 * returned {@link IngestionResult}.
 *
 * <p>Rows are stored one at a time, so there is no transaction around a whole import. A crash mid-way
 * leaves the rows written so far, and a re-run skips them as duplicates.
 */
@Service
public class CsvIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CsvIngestionService.class);

    static final String AI_UNAVAILABLE_MESSAGE =
            "AI mapping service unavailable: %s. The upload was kept and can be retried.";
    static final String REPORTED_ERROR_MESSAGE = "User reported error with AI-generated mappings";
    static final String CANCELLED_MESSAGE = "User cancelled import during mapping review";
    static final String REMOVE_MAPPING = "none";
    static final int CORRECTION_PRIORITY = 2;

    private final RawCsvParser rawCsvParser;
    private final SectionedExportParser sectionedExportParser;
    private final FormatDetector formatDetector;
    private final FormatRepository formatRepository;
    private final MappingResolver mappingResolver;
    private final ReviewPolicy reviewPolicy;
    private final AiMappingAdapter aiMappingAdapter;
    private final RowImporter rowImporter;
    private final ImportBatchService importBatchService;
    private final UploadLogService uploadLogService;
    private final PendingReviewService pendingReviewService;
    private final IngestionProperties ingestionProperties;

    public CsvIngestionService(
            RawCsvParser rawCsvParser,
            SectionedExportParser sectionedExportParser,
            FormatDetector formatDetector,
            FormatRepository formatRepository,
            MappingResolver mappingResolver,
            ReviewPolicy reviewPolicy,
            AiMappingAdapter aiMappingAdapter,
            RowImporter rowImporter,
            ImportBatchService importBatchService,
            UploadLogService uploadLogService,
            PendingReviewService pendingReviewService,
            IngestionProperties ingestionProperties) {
        this.rawCsvParser = rawCsvParser;
        this.sectionedExportParser = sectionedExportParser;
        this.formatDetector = formatDetector;
        this.formatRepository = formatRepository;
        this.mappingResolver = mappingResolver;
        this.reviewPolicy = reviewPolicy;
        this.aiMappingAdapter = aiMappingAdapter;
        this.rowImporter = rowImporter;
        this.importBatchService = importBatchService;
        this.uploadLogService = uploadLogService;
        this.pendingReviewService = pendingReviewService;
        this.ingestionProperties = ingestionProperties;
    }

    /** Rejects uploads too large to handle within a request. Larger tiers belong to a background worker. */
    public FileSizeTier ensureProcessableInRequest(long fileSize) {
        FileSizeTier tier = FileSizeTier.classify(fileSize, ingestionProperties);
        if (tier == FileSizeTier.BATCH || tier == FileSizeTier.REJECTED) {
            throw new FileTooLargeException(
                    fileSize,
                    ingestionProperties.getBackgroundLimitBytes(),
                    tier == FileSizeTier.BATCH
                            ? "Submit the file through the batch import worker"
                            : "Split the file into parts under " + ingestionProperties.getMaxFileBytes() + " bytes");
        }
        return tier;
    }

    /** Parses and detects without writing anything. */
    public ValidationResult validate(String content) {
        long fileSize = rawCsvParser.checkSize(content);
        FileSizeTier tier = FileSizeTier.classify(fileSize, ingestionProperties);

        if (SectionedExportParser.matchesSignature(content)) {
            SectionedExport export = sectionedExportParser.parse(content);
            return ValidationResult.builder()
                    .headers(List.of())
                    .sampleRows(List.of())
                    .rowCount(export.getTotalRecords())
                    .fileSize(fileSize)
                    .sizeTier(tier)
                    .sectionedExport(true)
                    .detectedFormatId(SeededFormats.SCHWAB_TODAYS_TRADES)
                    .detectedFormatName(formatRepository.findById(SeededFormats.SCHWAB_TODAYS_TRADES)
                            .map(BrokerFormat::getName)
                            .orElse(null))
                    .confidence(1.0)
                    .reasoning(List.of("Multi-section trade activity export signature found"))
                    .build();
        }

        ParsedCsv parsed = rawCsvParser.parse(content);
        boolean standard = StandardSchema.matches(parsed.getHeaders());
        FormatDetectionResult detection = formatDetector.detect(parsed.getHeaders(), parsed.getSampleRows(), content);
        return ValidationResult.builder()
                .headers(parsed.getHeaders())
                .sampleRows(parsed.getSampleRows())
                .rowCount(parsed.getRowCount())
                .fileSize(fileSize)
                .sizeTier(tier)
                .standardSchema(standard)
                .detectedFormatId(detection.getMatchedFormat().map(BrokerFormat::getId).orElse(null))
                .detectedFormatName(detection.getMatchedFormat().map(BrokerFormat::getName).orElse(null))
                .confidence(standard ? 1.0 : detection.getConfidence())
                .reasoning(detection.getReasoning())
                .build();
    }

    /**
     * Imports one upload.
     *
     * @param userMappings caller-supplied mappings; when present, detection is skipped entirely
     * @param brokerNameHint optional broker name used for AI mapping and for naming learned formats
     */
    public IngestionResult ingest(
            String content,
            String filename,
            String userId,
            List<String> accountTags,
            List<ColumnMapping> userMappings,
            String brokerNameHint) {
        long fileSize = rawCsvParser.checkSize(content);
        boolean hasUserMappings = userMappings != null && !userMappings.isEmpty();
        boolean sectioned = !hasUserMappings && SectionedExportParser.matchesSignature(content);

        ParsedCsv parsed = sectioned ? null : rawCsvParser.parse(content);
        List<String> headers = parsed != null ? parsed.getHeaders() : List.of();
        List<Map<String, String>> sampleRows = parsed != null ? parsed.getSampleRows() : List.of();

        MappingDecision decision = mappingResolver.resolve(content, headers, sampleRows, userMappings, brokerNameHint);

        ImportBatch draft = ImportBatch.builder()
                .userId(userId)
                .filename(filename)
                .fileSize(fileSize)
                .brokerNameHint(decision.getBrokerNameHint())
                .brokerType(BrokerType.fromBrokerName(decision.getBrokerNameHint()))
                .importType(ImportType.CUSTOM)
                .accountTags(joinTags(accountTags))
                .build();

        if (decision.getStrategy().usesRegistryFormat()) {
            return importWithFormat(parsed, draft, decision);
        }
        switch (decision.getStrategy()) {
            case SECTIONED_EXPORT:
                return importSectioned(content, draft, decision);
            case STANDARD_SCHEMA:
                return importStandard(parsed, draft, decision);
            case USER_MAPPINGS:
                return importWithUserMappings(parsed, draft, decision);
            default:
                return mapWithAi(content, parsed, draft, decision);
        }
    }

    /**
     * Supplies the broker for a batch parked without one, or retries a batch whose AI mapping call
     * failed. Runs the mapping service again with the broker as hint.
     */
    public IngestionResult processWithBroker(String batchId, String userId, String brokerName) {
        ImportBatch batch = importBatchService.get(batchId, userId);
        if (batch.getStatus() != ImportBatchStatus.PENDING || batch.getRawContent() == null) {
            throw new InvalidBatchStateException(batchId, batch.getStatus(), "select a broker");
        }
        String broker = brokerName.trim();
        batch.setBrokerNameHint(broker);
        batch.setBrokerType(BrokerType.fromBrokerName(broker));
        batch.setRequiresBrokerSelection(false);

        ParsedCsv parsed = rawCsvParser.parse(batch.getRawContent());
        MappingDecision decision = MappingDecision.builder()
                .strategy(MappingStrategy.AI_WITH_HINT)
                .brokerNameHint(broker)
                .reasoning(List.of("Broker selected by user: " + broker))
                .build();
        String uploadLogId = uploadLogService.findIdByBatch(batchId).orElse(null);
        log.info("Broker {} selected for batch {}", broker, batchId);
        return requestProposal(batch, parsed, decision, uploadLogId);
    }

    /**
     * Applies the user's decision on an AI-proposed mapping.
     *
     * @param corrections source column to canonical field name; {@code "none"} or blank removes the column
     */
    public IngestionResult finalizeMappings(
            String batchId, String userId, Map<String, String> corrections, boolean approved, boolean reportError) {
        ImportBatch batch = importBatchService.get(batchId, userId);
        if (batch.getStatus() != ImportBatchStatus.PENDING
                || !batch.isUserReviewRequired()
                || batch.isRequiresBrokerSelection()
                || batch.getRawContent() == null) {
            throw new InvalidBatchStateException(batchId, batch.getStatus(), "finalize mappings");
        }
        String uploadLogId = uploadLogService.findIdByBatch(batchId).orElse(null);

        if (reportError || !approved) {
            String reason = reportError ? REPORTED_ERROR_MESSAGE : CANCELLED_MESSAGE;
            importBatchService.fail(batch, reason);
            pendingReviewService.resolve(batchId, ReviewStatus.REJECTED);
            uploadLogService.update(uploadLogId, UploadStatus.FAILED, null, null, reason);
            return result(batch, null, null, null, 0, false);
        }

        Map<String, String> changes = corrections != null ? corrections : Map.of();
        List<ColumnMapping> mappings = applyCorrections(batch.getColumnMappings(), changes);
        ParsedCsv parsed = rawCsvParser.parse(batch.getRawContent());
        double confidence = changes.isEmpty() && batch.getMappingConfidence() != null
                ? batch.getMappingConfidence()
                : 1.0;

        BrokerFormat format = learnFormat(batch.getBrokerNameHint(), mappings, parsed, confidence, userId);
        batch.setColumnMappings(mappings);
        batch.setBrokerFormatId(format.getId());
        batch.setUserReviewRequired(false);
        if (!changes.isEmpty()) {
            batch.setMappingConfidence(1.0);
        }

        ImportTally tally = new ImportTally(parsed.getRowCount());
        runImport(batch, tally, context -> rowImporter.importMappedRows(context, parsed.getRows(), mappings, tally));
        boolean success = batch.getStatus() == ImportBatchStatus.COMPLETED;
        formatRepository.recordUsage(format.getId(), success);
        pendingReviewService.resolve(batchId, ReviewStatus.APPROVED);
        ParseMethod method = changes.isEmpty() ? ParseMethod.AI_MAPPED : ParseMethod.USER_CORRECTED;
        uploadLogService.update(uploadLogId, success ? UploadStatus.IMPORTED : UploadStatus.FAILED, method, null, null);

        MappingResult mappingResult = MappingResult.builder()
                .mappings(mappings)
                .overallConfidence(confidence)
                .unmappedFields(List.of())
                .build();
        return result(batch, MappingStrategy.AI_WITH_HINT, mappingResult, format.getName(),
                tally.getDuplicateCount(), success);
    }

    public ImportBatch getImportStatus(String batchId, String userId) {
        return importBatchService.get(batchId, userId);
    }

    public List<ImportBatch> listBatches(String userId) {
        return importBatchService.list(userId);
    }

    private IngestionResult importSectioned(String content, ImportBatch draft, MappingDecision decision) {
        SectionedExport export = sectionedExportParser.parse(content);
        String uploadLogId = uploadLogService.recordUpload(
                draft.getUserId(), draft.getFilename(), draft.getFileSize(), List.of(), export.getTotalRecords());
        uploadLogService.update(uploadLogId, UploadStatus.PARSING, ParseMethod.STANDARD, null, null);

        draft.setBrokerType(BrokerType.CHARLES_SCHWAB);
        draft.setMappingConfidence(1.0);
        draft.setBrokerFormatId(SeededFormats.SCHWAB_TODAYS_TRADES);
        draft.setTotalRecords(export.getTotalRecords());
        ImportBatch batch = importBatchService.create(draft);

        ImportTally tally = new ImportTally(export.getTotalRecords());
        export.getErrors().forEach(tally::error);
        runImport(batch, tally, context -> {
            for (OrderSection section : OrderSection.values()) {
                rowImporter.importOrders(context, export.getOrders(section), section.getMarker(), tally);
            }
        });
        return completeDirectImport(batch, decision, uploadLogId, ParseMethod.STANDARD, tally,
                SeededFormats.SCHWAB_TODAYS_TRADES, List.of());
    }

    private IngestionResult importStandard(ParsedCsv parsed, ImportBatch draft, MappingDecision decision) {
        String uploadLogId = logParsedUpload(draft, parsed);
        draft.setImportType(ImportType.STANDARD);
        draft.setMappingConfidence(1.0);
        draft.setTotalRecords(parsed.getRowCount());
        ImportBatch batch = importBatchService.create(draft);

        ImportTally tally = new ImportTally(parsed.getRowCount());
        runImport(batch, tally, context -> rowImporter.importStandardTrades(context, parsed.getRows(), tally));
        return completeDirectImport(batch, decision, uploadLogId, ParseMethod.STANDARD, tally, null, List.of());
    }

    private IngestionResult importWithFormat(ParsedCsv parsed, ImportBatch draft, MappingDecision decision) {
        String uploadLogId = logParsedUpload(draft, parsed);
        BrokerFormat format = decision.getFormat();
        if (draft.getBrokerNameHint() == null) {
            draft.setBrokerType(format.getBrokerType());
        }
        draft.setMappingConfidence(decision.getConfidence());
        draft.setColumnMappings(new ArrayList<>(decision.getMappings()));
        draft.setBrokerFormatId(format.getId());
        draft.setTotalRecords(parsed.getRowCount());
        ImportBatch batch = importBatchService.create(draft);

        ImportTally tally = new ImportTally(parsed.getRowCount());
        runImport(batch, tally,
                context -> rowImporter.importMappedRows(context, parsed.getRows(), decision.getMappings(), tally));
        return completeDirectImport(batch, decision, uploadLogId, ParseMethod.STANDARD, tally, format.getId(),
                decision.getMappings());
    }

    private IngestionResult importWithUserMappings(ParsedCsv parsed, ImportBatch draft, MappingDecision decision) {
        String uploadLogId = logParsedUpload(draft, parsed);
        draft.setMappingConfidence(1.0);
        draft.setColumnMappings(new ArrayList<>(decision.getMappings()));
        draft.setTotalRecords(parsed.getRowCount());

        BrokerFormat format = learnFormat(
                decision.getBrokerNameHint(), decision.getMappings(), parsed, 1.0, draft.getUserId());
        draft.setBrokerFormatId(format.getId());
        ImportBatch batch = importBatchService.create(draft);

        ImportTally tally = new ImportTally(parsed.getRowCount());
        runImport(batch, tally,
                context -> rowImporter.importMappedRows(context, parsed.getRows(), decision.getMappings(), tally));
        return completeDirectImport(batch, decision, uploadLogId, ParseMethod.USER_CORRECTED, tally, format.getId(),
                decision.getMappings());
    }

    private IngestionResult mapWithAi(String content, ParsedCsv parsed, ImportBatch draft, MappingDecision decision) {
        String uploadLogId = logParsedUpload(draft, parsed);
        draft.setAiMappingUsed(true);
        draft.setRawContent(content);
        draft.setTotalRecords(parsed.getRowCount());
        draft.setRequiresBrokerSelection(reviewPolicy.requiresBrokerSelection(decision.getStrategy()));
        ImportBatch batch = importBatchService.create(draft);
        uploadLogService.update(uploadLogId, null, null, batch.getId(), null);
        return requestProposal(batch, parsed, decision, uploadLogId);
    }

    /**
     * Asks the adapter for a mapping and either parks the batch for the user or, when the review policy
     * allows, imports straight away. An adapter failure keeps the batch and its upload for a retry.
     */
    private IngestionResult requestProposal(
            ImportBatch batch, ParsedCsv parsed, MappingDecision decision, String uploadLogId) {
        MappingProposal proposal;
        try {
            proposal = aiMappingAdapter.proposeMapping(
                    parsed.getHeaders(), parsed.getSampleRows(), decision.getBrokerNameHint());
        } catch (AiMappingException e) {
            log.warn("AI mapping failed for batch {}: {}", batch.getId(), e.getMessage());
            String message = String.format(AI_UNAVAILABLE_MESSAGE, e.getMessage());
            importBatchService.recordAiFailure(batch, message);
            uploadLogService.update(uploadLogId, null, null, null, message);
            return IngestionResult.builder()
                    .success(false)
                    .importBatchId(batch.getId())
                    .importType(batch.getImportType())
                    .totalRecords(batch.getTotalRecords())
                    .errors(new ArrayList<>(batch.getErrors()))
                    .requiresBrokerSelection(decision.getBrokerNameHint() == null)
                    .strategy(decision.getStrategy().name())
                    .build();
        }

        List<ColumnMapping> mappings = proposal.toColumnMappings();
        MappingResult mappingResult = MappingResult.builder()
                .mappings(mappings)
                .overallConfidence(proposal.getOverallConfidence())
                .unmappedFields(proposal.getUnmappedFields())
                .build();
        batch.setColumnMappings(mappings);
        batch.setMappingConfidence(proposal.getOverallConfidence());
        batch.setUserReviewRequired(
                reviewPolicy.requiresReview(decision.getStrategy(), proposal.getOverallConfidence()));

        if (batch.isUserReviewRequired() || batch.isRequiresBrokerSelection()) {
            importBatchService.park(batch);
            pendingReviewService.open(batch, uploadLogId, decision.getBrokerNameHint(), proposal);
            uploadLogService.update(uploadLogId, UploadStatus.MAPPED, ParseMethod.AI_MAPPED, batch.getId(), null);
            return result(batch, decision.getStrategy(), mappingResult, null, 0, true);
        }

        BrokerFormat format = learnFormat(
                decision.getBrokerNameHint(), mappings, parsed, proposal.getOverallConfidence(), batch.getUserId());
        batch.setBrokerFormatId(format.getId());
        ImportTally tally = new ImportTally(parsed.getRowCount());
        runImport(batch, tally, context -> rowImporter.importMappedRows(context, parsed.getRows(), mappings, tally));
        return completeDirectImport(batch, decision, uploadLogId, ParseMethod.AI_MAPPED, tally, format.getId(),
                mappings);
    }

    /**
     * Returns the stored format whose fingerprint matches the mapped columns, learning a new one only
     * when none exists. Repeat uploads of one layout therefore share a single format.
     */
    private BrokerFormat learnFormat(
            String brokerName, List<ColumnMapping> mappings, ParsedCsv parsed, double confidence, String userId) {
        BrokerFormat candidate = FormatFactory.fromMapping(
                FormatFactory.nextFormatName(brokerName, formatRepository.list()),
                brokerName,
                mappings,
                parsed.getSampleRows(),
                confidence,
                userId);
        Optional<BrokerFormat> existing = formatRepository.findByFingerprint(candidate.getFingerprint());
        if (existing.isPresent()) {
            log.info("Reusing format {} for fingerprint {}", existing.get().getName(), candidate.getFingerprint());
            return existing.get();
        }
        return formatRepository.add(candidate);
    }

    /** Moves the batch through PROCESSING; an unexpected failure mid-import fails the batch instead of escaping. */
    private void runImport(ImportBatch batch, ImportTally tally, Consumer<ImportContext> rows) {
        importBatchService.startProcessing(batch);
        ImportContext context = new ImportContext(
                batch.getUserId(), batch.getId(), batch.getBrokerType(), splitTags(batch.getAccountTags()));
        try {
            rows.accept(context);
        } catch (RuntimeException e) {
            log.error("Import of batch {} aborted", batch.getId(), e);
            batch.setSuccessCount(tally.getSuccessCount());
            batch.setErrorCount(tally.getErrorCount());
            batch.getErrors().addAll(tally.getErrors());
            importBatchService.fail(batch, "Import aborted: " + e.getMessage());
            return;
        }
        importBatchService.finish(batch, tally);
    }

    private IngestionResult completeDirectImport(
            ImportBatch batch,
            MappingDecision decision,
            String uploadLogId,
            ParseMethod parseMethod,
            ImportTally tally,
            String formatId,
            List<ColumnMapping> mappings) {
        boolean success = batch.getStatus() == ImportBatchStatus.COMPLETED;
        if (formatId != null) {
            formatRepository.recordUsage(formatId, success);
        }
        uploadLogService.update(
                uploadLogId,
                success ? UploadStatus.IMPORTED : UploadStatus.FAILED,
                parseMethod,
                batch.getId(),
                success ? null : String.join("; ", batch.getErrors()));

        String formatName = formatId == null
                ? null
                : formatRepository.findById(formatId).map(BrokerFormat::getName).orElse(null);
        MappingResult mappingResult = MappingResult.builder()
                .mappings(mappings)
                .overallConfidence(decision.getConfidence())
                .unmappedFields(List.of())
                .build();
        return result(batch, decision.getStrategy(), mappingResult, formatName, tally.getDuplicateCount(), success);
    }

    private String logParsedUpload(ImportBatch draft, ParsedCsv parsed) {
        String uploadLogId = uploadLogService.recordUpload(
                draft.getUserId(), draft.getFilename(), draft.getFileSize(), parsed.getHeaders(), parsed.getRowCount());
        uploadLogService.update(uploadLogId, UploadStatus.PARSING, null, null, null);
        return uploadLogId;
    }

    /** Applies review corrections on top of the proposed mappings. Corrected columns win any conflict. */
    static List<ColumnMapping> applyCorrections(List<ColumnMapping> proposed, Map<String, String> corrections) {
        List<ColumnMapping> mappings = new ArrayList<>();
        for (ColumnMapping mapping : proposed) {
            mappings.add(mapping.toBuilder().build());
        }
        corrections.forEach((column, field) -> {
            mappings.removeIf(m -> m.getSourceColumn().equalsIgnoreCase(column));
            if (field == null || field.isBlank() || REMOVE_MAPPING.equalsIgnoreCase(field.trim())) {
                return;
            }
            String target = field.trim();
            mappings.add(ColumnMapping.builder()
                    .sourceColumn(column)
                    .targetColumn(target)
                    .confidence(1.0)
                    .priority(CORRECTION_PRIORITY)
                    .dataType(CanonicalField.fromFieldName(target)
                            .map(CanonicalField::getDataType)
                            .orElse(FieldDataType.STRING))
                    .build());
        });
        return mappings;
    }

    private static IngestionResult result(
            ImportBatch batch,
            MappingStrategy strategy,
            MappingResult mappingResult,
            String formatName,
            int duplicates,
            boolean success) {
        return IngestionResult.builder()
                .success(success)
                .importBatchId(batch.getId())
                .importType(batch.getImportType())
                .totalRecords(batch.getTotalRecords())
                .successCount(batch.getSuccessCount())
                .errorCount(batch.getErrorCount())
                .duplicateCount(duplicates)
                .errors(new ArrayList<>(batch.getErrors()))
                .requiresUserReview(batch.isUserReviewRequired())
                .requiresBrokerSelection(batch.isRequiresBrokerSelection())
                .mappingResult(mappingResult)
                .brokerFormatUsed(formatName)
                .strategy(strategy != null ? strategy.name() : null)
                .build();
    }

    private static String joinTags(List<String> accountTags) {
        if (accountTags == null || accountTags.isEmpty()) {
            return null;
        }
        return accountTags.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::trim)
                .collect(Collectors.joining(","));
    }

    private static List<String> splitTags(String accountTags) {
        if (accountTags == null || accountTags.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(accountTags.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toList());
    }
}
