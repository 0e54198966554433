package com.kraken.trading;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"trading.auto-start=false", "trading.sandbox=true"})
class TradingApplicationSmokeTest {

    @LocalServerPort
    int port;

    TestRestTemplate rest = new TestRestTemplate();

    @Test
    void healthAndStatusRespond() {
        ResponseEntity<Map> health = rest.getForEntity("http://localhost:" + port + "/health", Map.class);
        assertEquals(200, health.getStatusCode().value());
        assertEquals("healthy", health.getBody().get("status"));

        ResponseEntity<Map> status = rest.getForEntity("http://localhost:" + port + "/api/status", Map.class);
        assertEquals(200, status.getStatusCode().value());
        assertEquals(Boolean.FALSE, status.getBody().get("running"));
        assertEquals("XBTUSD", status.getBody().get("pair"));
        assertEquals(0, status.getBody().get("totalTrades"));
    }
}
