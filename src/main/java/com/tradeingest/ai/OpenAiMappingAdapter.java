package com.tradeingest.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeingest.config.AiMappingProperties;
import com.tradeingest.domain.enums.CanonicalField;
import com.tradeingest.domain.model.MappingProposal;
import com.tradeingest.domain.model.MappingProposal.ProposedField;
import com.tradeingest.exception.AiMappingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Mapping adapter backed by an OpenAI-compatible chat-completions endpoint.
 *
 * <p>Each call is guarded by Resilience4j:
 * <ul>
 *   <li><b>Circuit breaker</b> ({@code aiMapping}): an open circuit short-circuits straight to the
 *       fallback, which reports the failure as {@link AiMappingException}</li>
 *   <li><b>Retry</b> ({@code aiMapping}): one extra attempt for transient transport errors</li>
 * </ul>
 *
 * <p>The model replies with {@code {"mappings": {"<column>": {"field": "...", "confidence": 0.9}}}}.
 * Fields outside the canonical catalogue are kept as {@code brokerMetadata}; a null field leaves the
 * column unmapped.
 */
@Component
@ConditionalOnProperty(prefix = "tradeingest.ai", name = "enabled", havingValue = "true")
public class OpenAiMappingAdapter implements AiMappingAdapter {

    private static final Logger log = LoggerFactory.getLogger(OpenAiMappingAdapter.class);

    static final String SYSTEM_PROMPT = "You map columns of brokerage trade exports onto a canonical order schema. "
            + "Reply with a single JSON object of the form "
            + "{\"mappings\":{\"<column>\":{\"field\":\"<canonical field or null>\",\"confidence\":<0..1>}}}. "
            + "Use brokerMetadata for columns that carry useful data but have no canonical field.";

    private final AiMappingProperties aiMappingProperties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OpenAiMappingAdapter(
            AiMappingProperties aiMappingProperties,
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper) {
        this.aiMappingProperties = aiMappingProperties;
        this.objectMapper = objectMapper;
        this.restTemplate = restTemplateBuilder
                .rootUri(aiMappingProperties.getBaseUrl())
                .connectTimeout(aiMappingProperties.getTimeout())
                .readTimeout(aiMappingProperties.getTimeout())
                .build();
    }

    @Override
    @CircuitBreaker(name = "aiMapping", fallbackMethod = "proposeMappingFallback")
    @Retry(name = "aiMapping")
    public MappingProposal proposeMapping(
            List<String> headers, List<Map<String, String>> sampleRows, String brokerNameHint) {
        HttpHeaders httpHeaders = new HttpHeaders();
        httpHeaders.setContentType(MediaType.APPLICATION_JSON);
        httpHeaders.setBearerAuth(aiMappingProperties.getApiKey() == null ? "" : aiMappingProperties.getApiKey());

        Map<String, Object> payload = Map.of(
                "model", aiMappingProperties.getModel(),
                "temperature", 0.1,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", buildPrompt(headers, sampleRows, brokerNameHint))));

        try {
            String body = restTemplate.postForObject("/chat/completions", new HttpEntity<>(payload, httpHeaders),
                    String.class);
            MappingProposal proposal = parseCompletion(body, headers);
            log.info("AI mapping proposed: columns={} confidence={} unmapped={}",
                    headers.size(), proposal.getOverallConfidence(), proposal.getUnmappedFields());
            return proposal;
        } catch (RestClientException e) {
            throw new AiMappingException("Mapping service call failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new AiMappingException("Mapping service returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Circuit-breaker fallback; also receives CallNotPermittedException while the circuit is open. */
    MappingProposal proposeMappingFallback(
            List<String> headers, List<Map<String, String>> sampleRows, String brokerNameHint, Throwable cause) {
        log.warn("AI mapping unavailable: {}", cause.getMessage());
        if (cause instanceof AiMappingException aiMappingException) {
            throw aiMappingException;
        }
        throw new AiMappingException(cause.getMessage(), cause);
    }

    String buildPrompt(List<String> headers, List<Map<String, String>> sampleRows, String brokerNameHint) {
        String fields = Arrays.stream(CanonicalField.values())
                .map(CanonicalField::getFieldName)
                .collect(Collectors.joining(", "));
        StringBuilder prompt = new StringBuilder();
        if (brokerNameHint != null) {
            prompt.append("Broker: ").append(brokerNameHint).append('\n');
        }
        prompt.append("Canonical fields: ").append(fields).append('\n');
        prompt.append("Columns: ").append(String.join(", ", headers)).append('\n');
        int limit = Math.min(aiMappingProperties.getMaxSampleRows(), sampleRows.size());
        for (int i = 0; i < limit; i++) {
            Map<String, String> row = sampleRows.get(i);
            prompt.append("Row ").append(i + 1).append(": ");
            prompt.append(headers.stream()
                    .map(h -> h + "=\"" + row.getOrDefault(h, "") + "\"")
                    .collect(Collectors.joining(", ")));
            prompt.append('\n');
        }
        return prompt.toString();
    }

    MappingProposal parseCompletion(String body, List<String> headers) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            throw new AiMappingException("Mapping service returned an empty response");
        }
        JsonNode content = objectMapper.readTree(body).path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            throw new AiMappingException("Mapping service response has no message content");
        }
        JsonNode mappingsNode = objectMapper.readTree(content.asText()).path("mappings");

        Map<String, ProposedField> mappings = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = mappingsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String column = entry.getKey();
            if (!headers.contains(column)) {
                continue;
            }
            JsonNode fieldNode = entry.getValue().path("field");
            if (fieldNode.isNull() || fieldNode.isMissingNode() || fieldNode.asText().isBlank()) {
                continue;
            }
            double confidence = ProposalScoring.clamp(entry.getValue().path("confidence").asDouble(0.0));
            String field = CanonicalField.fromFieldName(fieldNode.asText())
                    .map(CanonicalField::getFieldName)
                    .orElse(CanonicalField.BROKER_METADATA.getFieldName());
            mappings.put(column, new ProposedField(field, confidence));
        }

        return MappingProposal.builder()
                .mappings(mappings)
                .overallConfidence(ProposalScoring.overallConfidence(mappings))
                .unmappedFields(ProposalScoring.unmappedCriticalFields(mappings.values()))
                .build();
    }
}
