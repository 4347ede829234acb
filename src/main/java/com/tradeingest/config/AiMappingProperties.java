package com.tradeingest.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the OpenAI-compatible mapping service. When {@code enabled} is false the
 * keyword heuristic adapter proposes mappings instead.
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradeingest.ai")
public class AiMappingProperties {

    private boolean enabled = false;
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey;
    private String model = "gpt-4o-mini";
    private Duration timeout = Duration.ofSeconds(30);
    private int maxSampleRows = 5;
}
