package com.tradeingest.unit.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeingest.ai.OpenAiMappingAdapter;
import com.tradeingest.config.AiMappingProperties;
import com.tradeingest.domain.model.MappingProposal;
import com.tradeingest.exception.AiMappingException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.web.client.MockServerRestTemplateCustomizer;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

/** Unit tests for the chat-completions adapter against a mocked HTTP endpoint. */
class OpenAiMappingAdapterTest {

    private static final String ENDPOINT = "http://ai.test/v1/chat/completions";
    private static final List<String> HEADERS = List.of("Ticker", "Qty", "Side", "Venue");
    private static final List<Map<String, String>> ROWS =
            List.of(Map.of("Ticker", "AAPL", "Qty", "10", "Side", "B", "Venue", "ARCA"));

    private MockRestServiceServer server;
    private OpenAiMappingAdapter adapter;

    @BeforeEach
    void setUp() {
        AiMappingProperties properties = new AiMappingProperties();
        properties.setEnabled(true);
        properties.setBaseUrl("http://ai.test/v1");
        properties.setApiKey("test-key");

        MockServerRestTemplateCustomizer customizer = new MockServerRestTemplateCustomizer();
        adapter = new OpenAiMappingAdapter(properties, new RestTemplateBuilder(customizer), new ObjectMapper());
        server = customizer.getServer();
    }

    @Test
    @DisplayName("Parses the completion, keeps known columns and folds unknown fields into metadata")
    void parsesCompletion() {
        String content = "{\\\"mappings\\\":{"
                + "\\\"Ticker\\\":{\\\"field\\\":\\\"symbol\\\",\\\"confidence\\\":0.95},"
                + "\\\"Qty\\\":{\\\"field\\\":\\\"quantity\\\",\\\"confidence\\\":0.9},"
                + "\\\"Side\\\":{\\\"field\\\":null,\\\"confidence\\\":0.2},"
                + "\\\"Venue\\\":{\\\"field\\\":\\\"exchangeCode\\\",\\\"confidence\\\":0.7},"
                + "\\\"Ghost\\\":{\\\"field\\\":\\\"price\\\",\\\"confidence\\\":0.9}}}";
        String body = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"" + content + "\"}}]}";
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        MappingProposal proposal = adapter.proposeMapping(HEADERS, ROWS, "Acme Securities");

        server.verify();
        assertThat(proposal.getMappings()).containsOnlyKeys("Ticker", "Qty", "Venue");
        assertThat(proposal.getMappings().get("Venue").getField()).isEqualTo("brokerMetadata");
        assertThat(proposal.getUnmappedFields()).containsExactly("side", "orderExecutedTime");
        assertThat(proposal.getOverallConfidence()).isBetween(0.9, 0.95);
    }

    @Test
    @DisplayName("Transport failures surface as AiMappingException")
    void serverError() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThatThrownBy(() -> adapter.proposeMapping(HEADERS, ROWS, null))
                .isInstanceOf(AiMappingException.class)
                .hasMessageContaining("Mapping service call failed");
    }

    @Test
    @DisplayName("A reply without message content is rejected")
    void missingContent() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> adapter.proposeMapping(HEADERS, ROWS, null))
                .isInstanceOf(AiMappingException.class)
                .hasMessage("Mapping service response has no message content");
    }
}
