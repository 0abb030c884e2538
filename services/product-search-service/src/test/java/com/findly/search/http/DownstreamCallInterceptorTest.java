package com.findly.search.http;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class DownstreamCallInterceptorTest {

    @Test
    void setsServiceUserAgent() {
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setInterceptors(List.of(new DownstreamCallInterceptor("opensearch")));
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();

        server.expect(requestTo("http://localhost:9200/_cluster/health"))
            .andExpect(header("User-Agent", DownstreamCallInterceptor.USER_AGENT))
            .andRespond(withSuccess("{\"status\":\"green\"}", MediaType.APPLICATION_JSON));

        String body = restTemplate.getForObject("http://localhost:9200/_cluster/health", String.class);

        server.verify();
        assertThat(body).contains("green");
    }
}
