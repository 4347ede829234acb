package com.tradeingest.ai;

import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.model.MappingProposal.ProposedField;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Confidence arithmetic shared by the mapping adapters.
 *
 * <p>Overall confidence is the weighted mean of the per-column confidences, where columns landing on a
 * critical field weigh double. Side-channel ({@code brokerMetadata}) entries are not scored.
 */
public final class ProposalScoring {

    static final double CRITICAL_WEIGHT = 2.0;

    /** Each group is satisfied by any one of its fields; the first name is reported when missing. */
    static final List<List<String>> CRITICAL_GROUPS = List.of(
            List.of(CanonicalField.SYMBOL.getFieldName()),
            List.of(CanonicalField.SIDE.getFieldName()),
            List.of(CanonicalField.ORDER_QUANTITY.getFieldName(), CanonicalField.QUANTITY.getFieldName()),
            List.of(
                    CanonicalField.ORDER_EXECUTED_TIME.getFieldName(),
                    CanonicalField.ORDER_PLACED_TIME.getFieldName(),
                    CanonicalField.DATE.getFieldName()));

    private static final Set<String> CRITICAL_FIELDS =
            CRITICAL_GROUPS.stream().flatMap(List::stream).collect(Collectors.toSet());

    private ProposalScoring() {}

    public static double overallConfidence(Map<String, ProposedField> mappings) {
        double weighted = 0.0;
        double weights = 0.0;
        for (ProposedField proposed : mappings.values()) {
            if (proposed == null || proposed.getField() == null || isMetadata(proposed.getField())) {
                continue;
            }
            double weight = CRITICAL_FIELDS.contains(proposed.getField()) ? CRITICAL_WEIGHT : 1.0;
            weighted += weight * clamp(proposed.getConfidence());
            weights += weight;
        }
        return weights == 0.0 ? 0.0 : weighted / weights;
    }

    public static List<String> unmappedCriticalFields(Collection<ProposedField> proposed) {
        Set<String> mapped = proposed.stream()
                .filter(p -> p != null && p.getField() != null)
                .map(ProposedField::getField)
                .collect(Collectors.toSet());
        List<String> unmapped = new ArrayList<>();
        for (List<String> group : CRITICAL_GROUPS) {
            if (group.stream().noneMatch(mapped::contains)) {
                unmapped.add(group.get(0));
            }
        }
        return unmapped;
    }

    static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static boolean isMetadata(String field) {
        return CanonicalField.BROKER_METADATA.getFieldName().equalsIgnoreCase(field);
    }
}
