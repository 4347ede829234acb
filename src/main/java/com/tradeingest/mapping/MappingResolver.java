package com.tradeingest.mapping;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.FormatDetectionResult;
import com.tradeingest.format.ConfidenceTier;
import com.tradeingest.format.FormatDetector;
import com.tradeingest.format.LearnedFormatMatcher;
import com.tradeingest.format.StandardSchema;
import com.tradeingest.parser.SectionedExportParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ordered strategy selector. The first applicable step wins:
 * <ol>
 *   <li>multi-section export signature</li>
 *   <li>canonical upload layout</li>
 *   <li>registry format at or above {@link ConfidenceTier#HIGH}</li>
 *   <li>registry format at or above {@link ConfidenceTier#MEDIUM}</li>
 *   <li>learned format at or above {@link ConfidenceTier#ACCEPT}</li>
 *   <li>AI mapping with the caller's broker hint</li>
 *   <li>AI mapping without a hint (broker selection needed before anything is stored)</li>
 *   <li>caller-supplied mappings</li>
 * </ol>
 * Caller-supplied mappings bypass every detection step. The resolver never calls the AI adapter.
 */
@Component
public class MappingResolver {

    private static final Logger log = LoggerFactory.getLogger(MappingResolver.class);

    private final FormatDetector formatDetector;
    private final LearnedFormatMatcher learnedFormatMatcher;

    public MappingResolver(FormatDetector formatDetector, LearnedFormatMatcher learnedFormatMatcher) {
        this.formatDetector = formatDetector;
        this.learnedFormatMatcher = learnedFormatMatcher;
    }

    public MappingDecision resolve(
            String content,
            List<String> headers,
            List<Map<String, String>> sampleRows,
            List<ColumnMapping> userMappings,
            String brokerNameHint) {
        String hint = brokerNameHint == null || brokerNameHint.isBlank() ? null : brokerNameHint.trim();
        MappingDecision decision = userMappings != null && !userMappings.isEmpty()
                ? userDecision(userMappings, hint)
                : detect(content, headers, sampleRows, hint);
        log.info("Mapping strategy chosen: strategy={} format={} confidence={}",
                decision.getStrategy(),
                decision.getFormat() != null ? decision.getFormat().getId() : null,
                String.format(Locale.ROOT, "%.2f", decision.getConfidence()));
        return decision;
    }

    private MappingDecision detect(
            String content, List<String> headers, List<Map<String, String>> sampleRows, String hint) {
        if (SectionedExportParser.matchesSignature(content)) {
            return MappingDecision.builder()
                    .strategy(MappingStrategy.SECTIONED_EXPORT)
                    .confidence(1.0)
                    .brokerNameHint(hint)
                    .reasoning(List.of("Multi-section trade activity export signature found"))
                    .build();
        }
        if (StandardSchema.matches(headers)) {
            return MappingDecision.builder()
                    .strategy(MappingStrategy.STANDARD_SCHEMA)
                    .confidence(1.0)
                    .brokerNameHint(hint)
                    .reasoning(List.of("Headers follow the standard upload layout"))
                    .build();
        }

        FormatDetectionResult detection = formatDetector.detect(headers, sampleRows, content);
        List<String> reasoning = new ArrayList<>(detection.getReasoning());
        BrokerFormat candidate = detection.getCandidate();
        if (candidate != null && !candidate.isSectionedExport()) {
            if (ConfidenceTier.HIGH.isMetBy(detection.getConfidence())) {
                return registryDecision(MappingStrategy.REGISTRY_HIGH, candidate, detection.getConfidence(),
                        detection, hint, reasoning);
            }
            if (ConfidenceTier.MEDIUM.isMetBy(detection.getConfidence())) {
                return registryDecision(MappingStrategy.REGISTRY_MEDIUM, candidate, detection.getConfidence(),
                        detection, hint, reasoning);
            }
        }

        Optional<LearnedFormatMatcher.LearnedMatch> learned = learnedFormatMatcher.match(headers);
        if (learned.isPresent()) {
            reasoning.add(String.format(Locale.ROOT, "Learned format %s matched with similarity %.2f",
                    learned.get().format().getName(), learned.get().score()));
            return registryDecision(MappingStrategy.LEGACY_MATCH, learned.get().format(), learned.get().score(),
                    detection, hint, reasoning);
        }

        if (hint != null) {
            reasoning.add("No stored format fits; asking the mapping service with broker hint " + hint);
            return MappingDecision.builder()
                    .strategy(MappingStrategy.AI_WITH_HINT)
                    .detection(detection)
                    .brokerNameHint(hint)
                    .reasoning(reasoning)
                    .build();
        }
        reasoning.add("No stored format fits and no broker was named; broker selection required");
        return MappingDecision.builder()
                .strategy(MappingStrategy.AI_WITHOUT_HINT)
                .detection(detection)
                .reasoning(reasoning)
                .build();
    }

    private static MappingDecision registryDecision(
            MappingStrategy strategy,
            BrokerFormat format,
            double confidence,
            FormatDetectionResult detection,
            String hint,
            List<String> reasoning) {
        return MappingDecision.builder()
                .strategy(strategy)
                .format(format)
                .confidence(confidence)
                .mappings(format.toColumnMappings())
                .detection(detection)
                .brokerNameHint(hint)
                .reasoning(reasoning)
                .build();
    }

    private static MappingDecision userDecision(List<ColumnMapping> userMappings, String hint) {
        return MappingDecision.builder()
                .strategy(MappingStrategy.USER_MAPPINGS)
                .confidence(1.0)
                .mappings(new ArrayList<>(userMappings))
                .brokerNameHint(hint)
                .reasoning(List.of("Caller supplied " + userMappings.size() + " column mappings"))
                .build();
    }
}
