package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.BackendTier;
import com.phillippitts.hazardscan.exception.BackendExceptionBuilder;
import com.phillippitts.hazardscan.exception.BackendTimeoutException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;

/**
 * {@link CloudVisionClient} over HTTPS: posts the base64 image and prompt as JSON and parses the
 * JSON reply with {@link CloudResponseParser}.
 *
 * <p>Connect and read deadlines are fixed at construction. A read timeout surfaces as
 * {@link BackendTimeoutException}; non-2xx replies as a failure carrying the status code.
 */
public class HttpCloudVisionClient implements CloudVisionClient {

    static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);

    private final RestClient restClient;
    private final URI endpoint;
    private final Duration timeout;

    public HttpCloudVisionClient(RestClient.Builder restClientBuilder, String endpoint, Duration timeout) {
        this(restClientBuilder.requestFactory(requestFactory(timeout)).build(), URI.create(endpoint), timeout);
    }

    HttpCloudVisionClient(RestClient restClient, URI endpoint, Duration timeout) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) CONNECT_TIMEOUT.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }

    @Override
    public BackendResponse analyze(byte[] image, String prompt, String apiKey) {
        long t0 = System.nanoTime();
        String body;
        try {
            body = restClient.post()
                    .uri(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(buildRequestBody(image, prompt))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw BackendExceptionBuilder.create("Cloud vision request failed")
                    .tier(BackendTier.CLOUD)
                    .statusCode(e.getStatusCode().value())
                    .durationMs((System.nanoTime() - t0) / 1_000_000L)
                    .metadata("endpoint", endpoint.getHost())
                    .build();
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw new BackendTimeoutException(BackendTier.CLOUD, timeout, e);
            }
            throw BackendExceptionBuilder.create("Cloud vision endpoint unreachable")
                    .tier(BackendTier.CLOUD)
                    .cause(e)
                    .durationMs((System.nanoTime() - t0) / 1_000_000L)
                    .metadata("endpoint", endpoint.getHost())
                    .build();
        }
        if (body == null || body.isBlank()) {
            throw BackendExceptionBuilder.create("Cloud vision response is empty")
                    .tier(BackendTier.CLOUD)
                    .build();
        }
        return CloudResponseParser.parse(body);
    }

    private static boolean isTimeout(ResourceAccessException e) {
        for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    static String buildRequestBody(byte[] image, String prompt) {
        JSONObject json = new JSONObject();
        json.put("image", Base64.getEncoder().encodeToString(image));
        json.put("prompt", prompt);
        return json.toString();
    }
}
