package com.findly.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {

    private static final String URL = "http://embed.local/v1/embeddings";
    private static final String VECTOR_BODY =
        "{\"model\":\"m\",\"data\":[{\"index\":0,\"embedding\":[0.1,0.2,0.3]}]}";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private EmbeddingProperties properties;
    private EmbeddingGateway gateway;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new EmbeddingProperties();
        properties.setBaseUrl("http://embed.local/");
        properties.setApiKey("secret");
        properties.setModel("m");
        properties.setDimension(3);
        properties.setRetryCount(1);
        properties.setRetryBackoffMs(0);
        gateway = new EmbeddingGateway(restTemplate, properties);
    }

    @Test
    void sendsModelAndInputWithBearerToken() {
        server.expect(once(), requestTo(URL))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer secret"))
            .andExpect(header("x-trace-id", "trace-1"))
            .andExpect(jsonPath("$.model").value("m"))
            .andExpect(jsonPath("$.input[0]").value("rode sneakers"))
            .andRespond(withSuccess(VECTOR_BODY, MediaType.APPLICATION_JSON));

        List<Double> vector = gateway.embed("rode sneakers", null, "trace-1", "req-1");

        server.verify();
        assertThat(vector).containsExactly(0.1, 0.2, 0.3);
    }

    @Test
    void budgetWithinTimeoutStillUsesSharedClient() {
        server.expect(once(), requestTo(URL)).andRespond(withSuccess(VECTOR_BODY, MediaType.APPLICATION_JSON));

        List<Double> vector = gateway.embed("jas", properties.getTimeoutMs() + 500, null, null);

        server.verify();
        assertThat(vector).hasSize(3);
    }

    @Test
    void tightBudgetBypassesSharedClient() {
        properties.setBaseUrl("http://127.0.0.1:1");
        properties.setRetryCount(0);

        assertThatThrownBy(() -> gateway.embed("jas", 50, null, null))
            .isInstanceOf(EmbeddingUnavailableException.class);
        server.verify();
    }

    @Test
    void retriesServerErrorsOnce() {
        server.expect(once(), requestTo(URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(once(), requestTo(URL)).andRespond(withSuccess(VECTOR_BODY, MediaType.APPLICATION_JSON));

        List<Double> vector = gateway.embed("jas", null, null, null);

        server.verify();
        assertThat(vector).hasSize(3);
    }

    @Test
    void givesUpAfterRetriesAreExhausted() {
        server.expect(once(), requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));
        server.expect(once(), requestTo(URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> gateway.embed("jas", null, null, null))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_502");
        server.verify();
    }

    @Test
    void clientErrorsAreNotRetried() {
        server.expect(once(), requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> gateway.embed("jas", null, null, null))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_401");
        server.verify();
    }

    @Test
    void rejectsVectorsOfTheWrongDimension() {
        server.expect(once(), requestTo(URL)).andRespond(
            withSuccess("{\"data\":[{\"index\":0,\"embedding\":[0.1,0.2]}]}", MediaType.APPLICATION_JSON)
        );

        assertThatThrownBy(() -> gateway.embed("jas", null, null, null))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_dimension_mismatch");
    }

    @Test
    void emptyDataIsAnError() {
        server.expect(once(), requestTo(URL)).andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embed("jas", null, null, null))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_empty_response");
    }

    @Test
    void blankTextAndMissingUrlFailFast() {
        assertThatThrownBy(() -> gateway.embed("  ", null, null, null)).hasMessage("embed_empty_text");

        properties.setBaseUrl(null);
        assertThatThrownBy(() -> gateway.embed("jas", null, null, null)).hasMessage("embed_base_url_missing");
    }
}
