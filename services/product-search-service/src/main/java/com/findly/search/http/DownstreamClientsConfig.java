package com.findly.search.http;

import com.findly.search.embed.EmbeddingProperties;
import com.findly.search.llm.LlmProperties;
import com.findly.search.opensearch.OpenSearchProperties;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One {@link RestTemplate} per downstream so that each carries its own timeouts. Calls with a
 * per-request time budget build a dedicated client instead.
 */
@Configuration
@EnableConfigurationProperties({EmbeddingProperties.class, OpenSearchProperties.class, LlmProperties.class})
public class DownstreamClientsConfig {

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingProperties properties) {
        return client(builder, "embedding", properties.getTimeoutMs(), properties.getTimeoutMs());
    }

    @Bean
    public RestTemplate openSearchRestTemplate(RestTemplateBuilder builder, OpenSearchProperties properties) {
        return client(builder, "opensearch", properties.getConnectTimeoutMs(), properties.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate llmRestTemplate(RestTemplateBuilder builder, LlmProperties properties) {
        return client(builder, "llm", properties.getTimeoutMs(), properties.getTimeoutMs());
    }

    private RestTemplate client(RestTemplateBuilder builder, String downstream, int connectTimeoutMs, int readTimeoutMs) {
        return builder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
            .setReadTimeout(Duration.ofMillis(readTimeoutMs))
            .additionalInterceptors(new DownstreamCallInterceptor(downstream))
            .build();
    }
}
