package com.tradeingest.ai;

import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.model.MappingProposal;
import com.tradeingest.domain.model.MappingProposal.ProposedField;
import com.tradeingest.transform.TemporalParser;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline mapping adapter driven by header keywords and sample-value checks. Active whenever the
 * remote mapping service is disabled.
 *
 * <p>Rules are tried in declaration order and each canonical field is assigned at most once. A rule
 * fires when a header keyword matches and at least half of the sampled values pass the rule's value
 * check; confidence grows with that share. Headers no rule claims go to {@code brokerMetadata}.
 */
@Component
@ConditionalOnProperty(prefix = "tradeingest.ai", name = "enabled", havingValue = "false", matchIfMissing = true)
public class HeuristicMappingAdapter implements AiMappingAdapter {

    private static final Logger log = LoggerFactory.getLogger(HeuristicMappingAdapter.class);

    static final double METADATA_CONFIDENCE = 0.5;
    static final double MIN_VALUE_SHARE = 0.5;

    private static final Pattern SYMBOL = Pattern.compile("^[A-Za-z][A-Za-z0-9./ -]{0,20}$");

    private record Rule(CanonicalField field, Predicate<String> header, Predicate<String> value) {}

    private static final List<Rule> RULES = List.of(
            new Rule(CanonicalField.ORDER_EXECUTED_TIME,
                    h -> containsAny(h, "exec", "fill", "trade") && containsAny(h, "time", "date"),
                    HeuristicMappingAdapter::isDateTime),
            new Rule(CanonicalField.ORDER_PLACED_TIME,
                    h -> containsAny(h, "placed", "entered", "submitted") && containsAny(h, "time", "date"),
                    HeuristicMappingAdapter::isDateTime),
            new Rule(CanonicalField.ORDER_ID,
                    h -> containsAny(h, "order id", "orderid", "order #", "order no"),
                    v -> true),
            new Rule(CanonicalField.DATE,
                    h -> containsAny(h, "date", "day", "when", "timestamp"),
                    HeuristicMappingAdapter::isDateTime),
            new Rule(CanonicalField.TIME,
                    h -> h.contains("time"),
                    v -> TemporalParser.parseTime(v).isPresent()),
            new Rule(CanonicalField.SYMBOL,
                    h -> containsAny(h, "symbol", "ticker", "symb", "instrument", "security", "stock"),
                    v -> SYMBOL.matcher(v).matches()),
            new Rule(CanonicalField.SIDE,
                    h -> containsAny(h, "side", "buy", "sell", "action", "b/s", "direction"),
                    v -> OrderSide.normalize(v).isPresent()),
            new Rule(CanonicalField.QUANTITY,
                    h -> containsAny(h, "qty", "quantity", "shares", "size", "volume"),
                    HeuristicMappingAdapter::isNumber),
            new Rule(CanonicalField.COMMISSION,
                    h -> h.contains("comm"),
                    HeuristicMappingAdapter::isNumber),
            new Rule(CanonicalField.FEES,
                    h -> h.contains("fee"),
                    HeuristicMappingAdapter::isNumber),
            new Rule(CanonicalField.PRICE,
                    h -> containsAny(h, "price", "cost", "rate"),
                    HeuristicMappingAdapter::isNumber),
            new Rule(CanonicalField.ACCOUNT,
                    h -> containsAny(h, "account", "acct"),
                    v -> true));

    @Override
    public MappingProposal proposeMapping(
            List<String> headers, List<Map<String, String>> sampleRows, String brokerNameHint) {
        Map<String, ProposedField> mappings = new LinkedHashMap<>();
        Set<CanonicalField> taken = new HashSet<>();

        for (String header : headers) {
            String lower = header.toLowerCase(Locale.ROOT);
            List<String> values = sampleRows.stream()
                    .map(row -> row.get(header))
                    .filter(v -> v != null && !v.isBlank())
                    .map(String::trim)
                    .collect(Collectors.toList());

            ProposedField proposed = null;
            for (Rule rule : RULES) {
                if (taken.contains(rule.field()) || !rule.header().test(lower)) {
                    continue;
                }
                double share = values.isEmpty()
                        ? MIN_VALUE_SHARE
                        : (double) values.stream().filter(rule.value()).count() / values.size();
                if (share >= MIN_VALUE_SHARE) {
                    proposed = new ProposedField(rule.field().getFieldName(), 0.5 + 0.5 * share);
                    taken.add(rule.field());
                    break;
                }
            }
            mappings.put(header, proposed != null
                    ? proposed
                    : new ProposedField(CanonicalField.BROKER_METADATA.getFieldName(), METADATA_CONFIDENCE));
        }

        MappingProposal proposal = MappingProposal.builder()
                .mappings(mappings)
                .overallConfidence(ProposalScoring.overallConfidence(mappings))
                .unmappedFields(ProposalScoring.unmappedCriticalFields(mappings.values()))
                .build();
        log.info("Heuristic mapping proposed: columns={} confidence={} unmapped={} hint={}",
                headers.size(), proposal.getOverallConfidence(), proposal.getUnmappedFields(), brokerNameHint);
        return proposal;
    }

    private static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDateTime(String value) {
        return TemporalParser.parseDateTime(value).isPresent();
    }

    private static boolean isNumber(String value) {
        try {
            new BigDecimal(value.replaceAll("[$,\\s]", ""));
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
