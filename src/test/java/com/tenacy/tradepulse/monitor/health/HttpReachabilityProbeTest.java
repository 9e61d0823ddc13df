package com.tenacy.tradepulse.monitor.health;

import com.tenacy.tradepulse.domain.ComponentHealthSnapshot;
import com.tenacy.tradepulse.domain.HealthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class HttpReachabilityProbeTest {

    private static final String URL = "http://localhost:3000";

    private MockRestServiceServer server;
    private HttpReachabilityProbe probe;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
        probe = new HttpReachabilityProbe("frontend", URL, restTemplate, clock);
    }

    @Test
    @DisplayName("200 응답은 healthy")
    void check_ShouldBeHealthyOn200() {
        server.expect(requestTo(URL)).andRespond(withSuccess("<html></html>", MediaType.TEXT_HTML));

        ComponentHealthSnapshot snapshot = probe.check();

        assertEquals(HealthStatus.HEALTHY, snapshot.getStatus());
        assertEquals(200, snapshot.getDetails().get("statusCode"));
    }

    @Test
    @DisplayName("200 이 아닌 2xx 응답은 warning")
    void check_ShouldBeWarningOnOther2xx() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NO_CONTENT));

        ComponentHealthSnapshot snapshot = probe.check();

        assertEquals(HealthStatus.WARNING, snapshot.getStatus());
        assertEquals(204, snapshot.getDetails().get("statusCode"));
    }

    @Test
    @DisplayName("4xx 응답은 critical")
    void check_ShouldBeCriticalOnClientError() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        ComponentHealthSnapshot snapshot = probe.check();

        assertEquals(HealthStatus.CRITICAL, snapshot.getStatus());
        assertTrue(snapshot.getDetails().containsKey("error"));
    }
}
