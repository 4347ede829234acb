package com.tradeingest.mapping;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.FormatDetectionResult;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of the decision policy. For registry and user paths {@code mappings} is ready to apply;
 * for AI paths it is empty until the adapter has proposed something.
 */
@Getter
@Builder
public class MappingDecision {

    private final MappingStrategy strategy;

    /** Format applied by registry and legacy paths; null otherwise. */
    private final BrokerFormat format;

    private final double confidence;

    @Builder.Default
    private final List<ColumnMapping> mappings = new ArrayList<>();

    /** Detector output, when detection ran. */
    private final FormatDetectionResult detection;

    private final String brokerNameHint;

    @Builder.Default
    private final List<String> reasoning = new ArrayList<>();
}
