package com.tradeingest.transform;

import com.tradeingest.domain.enums.CanonicalField;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Derives {@code orderExecutedTime} for a mapped row.
 *
 * <p>Order of precedence:
 * <ol>
 *   <li>a timestamp whose source header is execution-specific ("exec", "fill" or "trade" together
 *       with "time" or "date")</li>
 *   <li>{@code orderPlacedTime}</li>
 *   <li>a timestamp mapped to {@code orderExecutedTime} from a generic header</li>
 *   <li>{@code date} combined with {@code time} when both are present</li>
 *   <li>the current time</li>
 * </ol>
 */
@Component
public class ExecutionTimeResolver {

    private final Clock clock;

    public ExecutionTimeResolver() {
        this(Clock.systemDefaultZone());
    }

    public ExecutionTimeResolver(Clock clock) {
        this.clock = clock;
    }

    public LocalDateTime resolve(MappedRow row) {
        Optional<LocalDateTime> explicit = explicitExecutionTime(row);
        if (explicit.isPresent()) {
            return explicit.get();
        }
        Optional<LocalDateTime> placed = row.getDateTime(CanonicalField.ORDER_PLACED_TIME.getFieldName());
        if (placed.isPresent()) {
            return placed.get();
        }
        Optional<LocalDateTime> executed = row.getDateTime(CanonicalField.ORDER_EXECUTED_TIME.getFieldName());
        if (executed.isPresent()) {
            return executed.get();
        }
        Optional<LocalDateTime> tradeDate = row.getDateTime(CanonicalField.DATE.getFieldName());
        if (tradeDate.isPresent()) {
            LocalDate date = tradeDate.get().toLocalDate();
            LocalTime time = row.getString(CanonicalField.TIME.getFieldName())
                    .flatMap(TemporalParser::parseTime)
                    .orElse(tradeDate.get().toLocalTime());
            return date.atTime(time);
        }
        return LocalDateTime.now(clock);
    }

    public static boolean isExecutionSpecificHeader(String header) {
        if (header == null) {
            return false;
        }
        String lower = header.toLowerCase(Locale.ROOT);
        boolean executionWord = lower.contains("exec") || lower.contains("fill") || lower.contains("trade");
        boolean temporalWord = lower.contains("time") || lower.contains("date");
        return executionWord && temporalWord;
    }

    private Optional<LocalDateTime> explicitExecutionTime(MappedRow row) {
        String executedField = CanonicalField.ORDER_EXECUTED_TIME.getFieldName();
        if (row.getSourceColumn(executedField).filter(ExecutionTimeResolver::isExecutionSpecificHeader).isPresent()) {
            Optional<LocalDateTime> executed = row.getDateTime(executedField);
            if (executed.isPresent()) {
                return executed;
            }
        }
        for (Map.Entry<String, Object> entry : row.getValues().entrySet()) {
            if (entry.getValue() instanceof LocalDateTime
                    && row.getSourceColumn(entry.getKey())
                            .filter(ExecutionTimeResolver::isExecutionSpecificHeader)
                            .isPresent()) {
                return Optional.of((LocalDateTime) entry.getValue());
            }
        }
        return Optional.empty();
    }
}
