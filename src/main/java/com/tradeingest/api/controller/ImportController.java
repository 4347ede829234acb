package com.tradeingest.api.controller;

import com.tradeingest.api.dto.request.BrokerSelectionRequest;
import com.tradeingest.api.dto.request.FinalizeMappingsRequest;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.ImportBatch;
import com.tradeingest.domain.model.IngestionResult;
import com.tradeingest.domain.model.ValidationResult;
import com.tradeingest.exception.CsvValidationException;
import com.tradeingest.ingest.CsvIngestionService;
import com.tradeingest.mapper.JsonHelper;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for CSV trade imports. The caller is identified by the {@code X-User-Id} header; batches
 * of other users are reported as not found.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/imports} -- upload and import a CSV file</li>
 *   <li>{@code POST /api/imports/validate} -- parse and detect without importing</li>
 *   <li>{@code POST /api/imports/{id}/broker} -- select the broker for a parked batch, or retry AI mapping</li>
 *   <li>{@code POST /api/imports/{id}/finalize} -- approve, correct or reject an AI-proposed mapping</li>
 *   <li>{@code GET /api/imports/{id}} -- batch status</li>
 *   <li>{@code GET /api/imports} -- the caller's batches, newest first</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/imports")
public class ImportController {

    private static final Logger log = LoggerFactory.getLogger(ImportController.class);

    static final String USER_HEADER = "X-User-Id";

    private final CsvIngestionService csvIngestionService;

    public ImportController(CsvIngestionService csvIngestionService) {
        this.csvIngestionService = csvIngestionService;
    }

    /**
     * @param accountTags comma-separated tags added to every imported row
     * @param mappings optional JSON array of column mappings; when given, format detection is skipped
     */
    @PostMapping
    public IngestionResult upload(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String accountTags,
            @RequestParam(required = false) String brokerName,
            @RequestParam(required = false) String mappings) {
        String content = readCsv(file);
        List<ColumnMapping> userMappings = parseMappings(mappings);
        log.info("Import upload: userId={}, file={}, size={}", userId, file.getOriginalFilename(), file.getSize());
        return csvIngestionService.ingest(
                content, file.getOriginalFilename(), userId, splitTags(accountTags), userMappings, brokerName);
    }

    @PostMapping("/validate")
    public ValidationResult validate(@RequestParam("file") MultipartFile file) {
        return csvIngestionService.validate(readCsv(file));
    }

    @PostMapping("/{id}/broker")
    public IngestionResult selectBroker(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String id,
            @RequestBody @Valid BrokerSelectionRequest request) {
        return csvIngestionService.processWithBroker(id, userId, request.getBrokerName());
    }

    @PostMapping("/{id}/finalize")
    public IngestionResult finalizeMappings(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String id,
            @RequestBody FinalizeMappingsRequest request) {
        return csvIngestionService.finalizeMappings(
                id, userId, request.getCorrections(), request.isApproved(), request.isReportError());
    }

    @GetMapping("/{id}")
    public ImportBatch getStatus(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return csvIngestionService.getImportStatus(id, userId);
    }

    @GetMapping
    public List<ImportBatch> list(@RequestHeader(USER_HEADER) String userId) {
        return csvIngestionService.listBatches(userId);
    }

    private String readCsv(MultipartFile file) {
        String name = file.getOriginalFilename();
        if (name == null || !name.toLowerCase(Locale.ROOT).endsWith(".csv")) {
            throw new CsvValidationException("Only .csv files are accepted");
        }
        csvIngestionService.ensureProcessableInRequest(file.getSize());
        try {
            return new String(file.getBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CsvValidationException("Could not read upload: " + e.getMessage());
        }
    }

    private static List<ColumnMapping> parseMappings(String mappings) {
        try {
            return JsonHelper.fromJsonList(mappings, ColumnMapping.class);
        } catch (IllegalStateException e) {
            throw new CsvValidationException("Column mappings are not a valid JSON array of mappings");
        }
    }

    private static List<String> splitTags(String accountTags) {
        if (accountTags == null || accountTags.isBlank()) {
            return List.of();
        }
        return Arrays.stream(accountTags.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toList());
    }
}
