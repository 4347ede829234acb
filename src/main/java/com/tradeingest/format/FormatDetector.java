package com.tradeingest.format;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.DetectionPatterns;
import com.tradeingest.domain.model.FormatDetectionResult;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores every registry format against an upload and reports the best candidate.
 *
 * <p>Flat formats are scored on three weighted terms, normalised by the weight of the terms that
 * apply:
 * <ul>
 *   <li>headers (0.6): share of the format's required headers contained, case-insensitively, in some
 *       uploaded header</li>
 *   <li>value patterns (0.3): share of patterned columns where at least 80% of sampled values match;
 *       only counted when the format declares patterns and the upload has data rows</li>
 *   <li>exact headers (0.1): share of uploaded headers that equal a mapped column name</li>
 * </ul>
 * A format is rejected outright when the upload has more than two headers beyond its mapped columns.
 *
 * <p>Multi-section exports are scored on the whole file instead: 0.8 when the signature matches plus
 * up to 0.2 for the section markers present.
 *
 * <p>Scoring is deterministic: ties keep registry order.
 */
@Component
public class FormatDetector {

    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    static final double HEADER_WEIGHT = 0.6;
    static final double PATTERN_WEIGHT = 0.3;
    static final double EXACT_WEIGHT = 0.1;
    static final double SIGNATURE_WEIGHT = 0.8;
    static final double SECTION_WEIGHT = 0.2;
    static final double PATTERN_MATCH_RATIO = 0.8;
    static final int MAX_EXTRA_HEADERS = 2;
    static final int MAX_SAMPLE_ROWS = 5;

    private final FormatRepository formatRepository;

    public FormatDetector(FormatRepository formatRepository) {
        this.formatRepository = formatRepository;
    }

    /** Scored candidate; the reasoning line is user-facing. */
    public record FormatScore(BrokerFormat format, double confidence, String reasoning) {}

    /**
     * @param content whole file text, needed only to score multi-section formats; may be null
     */
    public FormatDetectionResult detect(List<String> headers, List<Map<String, String>> sampleRows, String content) {
        List<BrokerFormat> formats = formatRepository.list();
        if (formats.isEmpty()) {
            return FormatDetectionResult.none(List.of("Format registry is empty"));
        }

        List<FormatScore> scores = formats.stream()
                .map(format -> score(format, headers, sampleRows, content))
                .sorted(Comparator.comparingDouble(FormatScore::confidence).reversed())
                .collect(Collectors.toList());

        List<String> reasoning = scores.stream().map(FormatScore::reasoning).collect(Collectors.toList());
        FormatScore best = scores.get(0);
        boolean matched = ConfidenceTier.ACCEPT.isMetBy(best.confidence());
        if (matched) {
            reasoning.add(String.format(Locale.ROOT, "Matched %s with confidence %.2f",
                    best.format().getName(), best.confidence()));
        } else {
            reasoning.add(String.format(Locale.ROOT, "No format matched: best was %s at %.2f, below %.2f",
                    best.format().getName(), best.confidence(), ConfidenceTier.ACCEPT.getThreshold()));
        }
        log.debug("Format detection: best={} confidence={} matched={}",
                best.format().getId(), best.confidence(), matched);

        return FormatDetectionResult.builder()
                .candidate(best.format())
                .confidence(best.confidence())
                .matched(matched)
                .reasoning(reasoning)
                .build();
    }

    public FormatScore score(
            BrokerFormat format, List<String> headers, List<Map<String, String>> sampleRows, String content) {
        if (format.isSectionedExport()) {
            return scoreSectioned(format, content);
        }
        return scoreFlat(format, headers, sampleRows == null ? List.of() : sampleRows);
    }

    private FormatScore scoreFlat(BrokerFormat format, List<String> headers, List<Map<String, String>> sampleRows) {
        int mappable = format.getFieldMappings().size();
        if (headers.size() > mappable + MAX_EXTRA_HEADERS) {
            return new FormatScore(format, 0.0, String.format(Locale.ROOT,
                    "%s: rejected, %d headers exceed its %d mapped columns by more than %d",
                    format.getName(), headers.size(), mappable, MAX_EXTRA_HEADERS));
        }

        DetectionPatterns patterns = format.getDetectionPatterns() != null
                ? format.getDetectionPatterns()
                : new DetectionPatterns();
        List<String> required = patterns.getRequiredHeaders().isEmpty()
                ? new ArrayList<>(format.getFieldMappings().keySet())
                : patterns.getRequiredHeaders();

        List<String> lowerHeaders = headers.stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        long headersFound = required.stream()
                .map(r -> r.toLowerCase(Locale.ROOT))
                .filter(r -> lowerHeaders.stream().anyMatch(h -> h.contains(r)))
                .count();
        double headerFraction = required.isEmpty() ? 0.0 : (double) headersFound / required.size();

        double score = HEADER_WEIGHT * headerFraction;
        double maxScore = HEADER_WEIGHT;

        String patternNote = "patterns n/a";
        Map<String, String> valuePatterns = patterns.getValuePatterns();
        if (!valuePatterns.isEmpty() && !sampleRows.isEmpty()) {
            List<Map<String, String>> samples = sampleRows.subList(0, Math.min(MAX_SAMPLE_ROWS, sampleRows.size()));
            long columnsMatched = valuePatterns.entrySet().stream()
                    .filter(e -> columnMatches(e.getKey(), e.getValue(), samples))
                    .count();
            score += PATTERN_WEIGHT * columnsMatched / valuePatterns.size();
            maxScore += PATTERN_WEIGHT;
            patternNote = "patterns " + columnsMatched + "/" + valuePatterns.size();
        }

        Set<String> mappedColumns = format.getFieldMappings().keySet();
        long exact = headers.stream().filter(mappedColumns::contains).count();
        double exactFraction = headers.isEmpty() ? 0.0 : (double) exact / headers.size();
        score += EXACT_WEIGHT * exactFraction;
        maxScore += EXACT_WEIGHT;

        double confidence = score / maxScore;
        return new FormatScore(format, confidence, String.format(Locale.ROOT,
                "%s: headers %d/%d, %s, exact %d/%d -> %.2f",
                format.getName(), headersFound, required.size(), patternNote, exact, headers.size(), confidence));
    }

    private FormatScore scoreSectioned(BrokerFormat format, String content) {
        if (content == null || content.isBlank()) {
            return new FormatScore(format, 0.0, format.getName() + ": needs the whole file to score");
        }
        DetectionPatterns patterns = format.getDetectionPatterns();
        boolean signature = safeFind(patterns.getFileSignature(), content);

        List<String> markers = patterns.getSectionMarkers();
        Set<String> lines = Arrays.stream(content.split("\\R"))
                .map(line -> line.replaceAll(",+$", "").trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        long sectionsFound = markers.stream()
                .filter(m -> lines.contains(m.toLowerCase(Locale.ROOT)))
                .count();

        double confidence = (signature ? SIGNATURE_WEIGHT : 0.0)
                + (markers.isEmpty() ? 0.0 : SECTION_WEIGHT * sectionsFound / markers.size());
        return new FormatScore(format, confidence, String.format(Locale.ROOT,
                "%s: signature %s, sections %d/%d -> %.2f",
                format.getName(), signature ? "matched" : "absent", sectionsFound, markers.size(), confidence));
    }

    private static boolean columnMatches(String column, String regex, List<Map<String, String>> samples) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid value pattern for column {}: {}", column, regex);
            return false;
        }
        List<String> values = samples.stream()
                .map(row -> row.get(column))
                .filter(v -> v != null && !v.isBlank())
                .collect(Collectors.toList());
        if (values.isEmpty()) {
            return false;
        }
        long hits = values.stream().filter(v -> pattern.matcher(v.trim()).find()).count();
        return hits >= PATTERN_MATCH_RATIO * values.size();
    }

    private static boolean safeFind(String regex, String content) {
        if (regex == null) {
            return false;
        }
        try {
            return Pattern.compile(regex).matcher(content).find();
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring invalid file signature: {}", regex);
            return false;
        }
    }
}
