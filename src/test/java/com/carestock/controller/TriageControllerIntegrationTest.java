package com.carestock.controller;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class TriageControllerIntegrationTest {

    private static WireMockServer wireMock;

    @Autowired TestRestTemplate restTemplate;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9090));
        wireMock.start();
        WireMock.configureFor("localhost", 9090);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @Test
    void triage_returnsAssessmentWithTier() {
        stubFor(post(urlEqualTo("/triage")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{\"urgency_level\": \"Moderate\", \"recommended_actions\": [\"Order tests\"]}")));

        HttpHeaders headers = new HttpHeaders();
        headers.set("X-Request-ID", "triage-req-1");
        ResponseEntity<Map> resp = restTemplate.exchange("/api/v1/triage/P-42", HttpMethod.GET,
            new HttpEntity<>(headers), Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(resp.getBody().get("patientId")).isEqualTo("P-42");
        assertThat(resp.getBody().get("tier")).isEqualTo("HIGH");
        assertThat(resp.getHeaders().getFirst("X-Request-ID")).isEqualTo("triage-req-1");
        verify(postRequestedFor(urlEqualTo("/triage")).withHeader("X-Request-ID", equalTo("triage-req-1")));
    }

    @Test
    void triage_upstreamDown_returns503() {
        stubFor(post(urlEqualTo("/triage")).willReturn(aResponse().withStatus(503).withBody("maintenance")));

        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/triage/P-42", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(resp.getBody().get("code")).isEqualTo("TRIAGE_UNAVAILABLE");
    }

    @Test
    void triage_malformedUpstreamResponse_returns502() {
        stubFor(post(urlEqualTo("/triage")).willReturn(aResponse()
            .withHeader("Content-Type", "application/json")
            .withBody("{}")));

        ResponseEntity<Map> resp = restTemplate.getForEntity("/api/v1/triage/P-42", Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(resp.getBody().get("code")).isEqualTo("TRIAGE_ERROR");
    }
}
