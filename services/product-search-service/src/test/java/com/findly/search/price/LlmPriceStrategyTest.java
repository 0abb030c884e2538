package com.findly.search.price;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.findly.search.config.SearchConfigSnapshot;
import com.findly.search.llm.LlmGateway;
import com.findly.search.llm.LlmProperties;
import com.findly.search.llm.LlmUnavailableException;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LlmPriceStrategyTest {

    private LlmGateway llmGateway;
    private LlmProperties llmProperties;
    private PriceIntentProperties properties;
    private ExecutorService executor;
    private LlmPriceStrategy strategy;

    @BeforeEach
    void setUp() {
        llmGateway = mock(LlmGateway.class);
        llmProperties = new LlmProperties();
        llmProperties.setTimeoutMs(500);
        properties = new PriceIntentProperties();
        executor = Executors.newSingleThreadExecutor();
        strategy = new LlmPriceStrategy(llmGateway, llmProperties, properties, new ObjectMapper(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void parsesFencedJson() {
        Optional<PriceSignal> signal = strategy.parse("```json\n{\"min_price\": null, \"max_price\": 75}\n```", "q");

        assertThat(signal).isPresent();
        assertThat(signal.get().getMinPrice()).isNull();
        assertThat(signal.get().getMaxPrice()).isEqualTo(75.0);
        assertThat(signal.get().getConfidence()).isEqualTo(0.6);
        assertThat(signal.get().getSource()).isEqualTo(PriceIntentSource.LLM_INFERENCE);
    }

    @Test
    void swapsInvertedBounds() {
        Optional<PriceSignal> signal = strategy.parse("{\"min_price\": \"120\", \"max_price\": 40}", "q");

        assertThat(signal).isPresent();
        assertThat(signal.get().getMinPrice()).isEqualTo(40.0);
        assertThat(signal.get().getMaxPrice()).isEqualTo(120.0);
    }

    @Test
    void ignoresEmptyOrMalformedAnswers() {
        assertThat(strategy.parse("{\"min_price\": null, \"max_price\": null}", "q")).isEmpty();
        assertThat(strategy.parse("{\"min_price\": -5}", "q")).isEmpty();
        assertThat(strategy.parse("I think about 50 euro", "q")).isEmpty();
        assertThat(strategy.parse("[1, 2]", "q")).isEmpty();
        assertThat(strategy.parse("  ", "q")).isEmpty();
    }

    @Test
    void inferReturnsParsedSignal() {
        when(llmGateway.isConfigured()).thenReturn(true);
        when(llmGateway.complete(anyString(), anyString())).thenReturn("{\"min_price\": 20, \"max_price\": 60}");

        Optional<PriceSignal> signal = strategy.infer("schoenen maat 42", SearchConfigSnapshot.defaults());

        assertThat(signal).isPresent();
        assertThat(signal.get().getMinPrice()).isEqualTo(20.0);
        assertThat(signal.get().getMaxPrice()).isEqualTo(60.0);
    }

    @Test
    void inferGivesUpAfterTimeout() {
        llmProperties.setTimeoutMs(50);
        when(llmGateway.isConfigured()).thenReturn(true);
        when(llmGateway.complete(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return "{\"max_price\": 10}";
        });

        assertThat(strategy.infer("schoenen maat 42", SearchConfigSnapshot.defaults())).isEmpty();
    }

    @Test
    void timedOutCallIsInterrupted() throws Exception {
        llmProperties.setTimeoutMs(50);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(llmGateway.isConfigured()).thenReturn(true);
        when(llmGateway.complete(anyString(), anyString())).thenAnswer(invocation -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "{\"max_price\": 10}";
        });

        assertThat(strategy.infer("schoenen maat 42", SearchConfigSnapshot.defaults())).isEmpty();
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void saturatedExecutorSkipsInference() {
        when(llmGateway.isConfigured()).thenReturn(true);
        executor.shutdownNow();

        assertThat(strategy.infer("schoenen maat 42", SearchConfigSnapshot.defaults())).isEmpty();
        verify(llmGateway, never()).complete(anyString(), anyString());
    }

    @Test
    void inferSwallowsGatewayFailure() {
        when(llmGateway.isConfigured()).thenReturn(true);
        when(llmGateway.complete(anyString(), anyString())).thenThrow(new LlmUnavailableException("llm_http_500"));

        assertThat(strategy.infer("schoenen maat 42", SearchConfigSnapshot.defaults())).isEmpty();
    }

    @Test
    void inferSkipsCallWhenDisabled() {
        properties.setLlmEnabled(false);
        when(llmGateway.isConfigured()).thenReturn(true);

        assertThat(strategy.infer("schoenen maat 42", SearchConfigSnapshot.defaults())).isEmpty();
        verify(llmGateway, never()).complete(anyString(), anyString());
    }
}
