package com.findly.search.http;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

/**
 * Tags outgoing calls with the service user agent and logs status and latency per downstream.
 */
public class DownstreamCallInterceptor implements ClientHttpRequestInterceptor {
    static final String USER_AGENT = "findly-product-search";

    private static final Logger log = LoggerFactory.getLogger(DownstreamCallInterceptor.class);

    private final String downstream;

    public DownstreamCallInterceptor(String downstream) {
        this.downstream = downstream;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution)
        throws IOException {
        request.getHeaders().set(HttpHeaders.USER_AGENT, USER_AGENT);
        long started = System.nanoTime();
        try {
            ClientHttpResponse response = execution.execute(request, body);
            log.debug(
                "downstream call downstream={} method={} path={} status={} took_ms={}",
                downstream,
                request.getMethod(),
                request.getURI().getPath(),
                response.getStatusCode().value(),
                (System.nanoTime() - started) / 1_000_000L
            );
            return response;
        } catch (IOException e) {
            log.debug(
                "downstream call failed downstream={} path={} took_ms={} reason={}",
                downstream,
                request.getURI().getPath(),
                (System.nanoTime() - started) / 1_000_000L,
                e.getMessage()
            );
            throw e;
        }
    }
}
