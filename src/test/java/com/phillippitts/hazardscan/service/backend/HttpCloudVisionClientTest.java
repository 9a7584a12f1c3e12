package com.phillippitts.hazardscan.service.backend;

import com.phillippitts.hazardscan.domain.HazardType;
import com.phillippitts.hazardscan.exception.BackendFailureException;
import com.phillippitts.hazardscan.exception.BackendTimeoutException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpCloudVisionClientTest {

    private static final URI ENDPOINT = URI.create("https://vision.test/v1/analyze");

    private MockRestServiceServer server;
    private HttpCloudVisionClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpCloudVisionClient(builder.build(), ENDPOINT, Duration.ofSeconds(2));
    }

    @Test
    void shouldPostImageAndPromptWithBearerKey() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer k-123"))
                .andExpect(content().string(containsString("\"prompt\":\"look for edges\"")))
                .andRespond(withSuccess("""
                        {"confidence": 0.9, "hazards": [{"type": "ELECTRICAL", "confidence": 0.9}]}
                        """, MediaType.APPLICATION_JSON));

        BackendResponse response = client.analyze(new byte[]{1, 2, 3}, "look for edges", "k-123");

        assertThat(response.confidence()).isEqualTo(0.9);
        assertThat(response.hazards()).extracting(h -> h.type()).containsExactly(HazardType.ELECTRICAL);
        server.verify();
    }

    @Test
    void shouldReportStatusCodeOnErrorReply() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> client.analyze(new byte[]{1}, "p", "k"))
                .isInstanceOf(BackendFailureException.class)
                .hasMessageContaining("statusCode=429");
    }

    @Test
    void shouldMapReadTimeoutToBackendTimeout() {
        server.expect(requestTo(ENDPOINT)).andRespond(request -> {
            throw new SocketTimeoutException("Read timed out");
        });

        assertThatThrownBy(() -> client.analyze(new byte[]{1}, "p", "k"))
                .isInstanceOf(BackendTimeoutException.class)
                .satisfies(e -> assertThat(((BackendTimeoutException) e).getTimeout())
                        .isEqualTo(Duration.ofSeconds(2)));
    }

    @Test
    void shouldFailOnEmptyBody() {
        server.expect(requestTo(ENDPOINT)).andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.analyze(new byte[]{1}, "p", "k"))
                .isInstanceOf(BackendFailureException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void shouldEncodeImageAndPromptAsJson() {
        JSONObject body = new JSONObject(HttpCloudVisionClient.buildRequestBody(new byte[]{1, 2, 3}, "look"));

        assertThat(body.getString("image")).isEqualTo("AQID");
        assertThat(body.getString("prompt")).isEqualTo("look");
    }
}
