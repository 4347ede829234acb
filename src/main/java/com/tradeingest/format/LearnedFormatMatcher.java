package com.tradeingest.format;

import com.tradeingest.domain.model.BrokerFormat;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Fallback matcher over learned formats: an identical fingerprint scores 1.0, otherwise the Jaccard
 * similarity between the uploaded header set and the format's mapped columns.
 */
@Component
public class LearnedFormatMatcher {

    private final FormatRepository formatRepository;

    public LearnedFormatMatcher(FormatRepository formatRepository) {
        this.formatRepository = formatRepository;
    }

    public record LearnedMatch(BrokerFormat format, double score) {}

    /** Best learned format meeting the acceptance tier, if any. */
    public Optional<LearnedMatch> match(List<String> headers) {
        String fingerprint = FormatFactory.fingerprint(headers);
        Set<String> uploaded = normalize(headers);

        LearnedMatch best = null;
        for (BrokerFormat format : formatRepository.list()) {
            if (format.isSeeded() || format.isSectionedExport()) {
                continue;
            }
            double score = fingerprint.equals(format.getFingerprint())
                    ? 1.0
                    : jaccard(uploaded, normalize(format.getFieldMappings().keySet()));
            if (best == null || score > best.score()) {
                best = new LearnedMatch(format, score);
            }
        }
        if (best == null || !ConfidenceTier.ACCEPT.isMetBy(best.score())) {
            return Optional.empty();
        }
        return Optional.of(best);
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> normalize(Collection<String> columns) {
        return columns.stream()
                .map(c -> c.trim().toLowerCase(Locale.ROOT))
                .filter(c -> !c.isEmpty())
                .collect(Collectors.toSet());
    }
}
