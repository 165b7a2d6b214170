package com.jcmt.hetitc;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpStatus;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "server.port=0",
                "logging.level.com.jcmt.hetitc=DEBUG"
        }
)
class SmokeTest {

    @LocalServerPort int port;

    @Autowired TestRestTemplate http;

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private static Map<String, Object> a3Grid() {
        Map<String, Object> body = new HashMap<>();
        body.put("receiver", "A3");
        body.put("mapMode", "GRID");
        body.put("switchingMode", "PSSW");
        body.put("freq", 233.0);
        body.put("freqRes", 0.0192);
        body.put("tau225", 0.23);
        body.put("zenithAngle", 25.0);
        body.put("pointCount", 25);
        return body;
    }

    @Test
    @SuppressWarnings("unchecked")
    void time_endpoint_solves_grid_scenario() {
        Map<String, Object> body = a3Grid();
        body.put("rms", 0.6);

        var resp = http.postForEntity(url("/calculate/time"), body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> json = resp.getBody();
        assertThat(json).containsEntry("solved", "ELAPSED_TIME");
        assertThat(((Number) json.get("value")).doubleValue()).isCloseTo(5187.88, within(0.1));
        assertThat(((Number) json.get("intTime")).doubleValue()).isCloseTo(77.10, within(0.01));
    }

    @Test
    @SuppressWarnings("unchecked")
    void engine_failure_is_unprocessable() {
        Map<String, Object> body = a3Grid();
        body.put("intTime", 0.05);

        var resp = http.postForEntity(url("/calculate/rms-for-int-time"), body, Map.class);

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(resp.getBody()).containsEntry("kind", "BELOW_MINIMUM_SAMPLE_TIME");
    }

    @Test
    @SuppressWarnings("unchecked")
    void receivers_are_listed_in_catalog_order() {
        var resp = http.getForEntity(url("/receivers"), List.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        List<Map<String, Object>> receivers = resp.getBody();
        assertThat(receivers).extracting(r -> r.get("name")).containsExactly("A3", "HARP", "WD", "UU", "AWEOWEO");

        assertThat(http.getForEntity(url("/receivers/HARP"), String.class).getBody()).contains("Nyquist");
        assertThat(http.getForEntity(url("/receivers/NOPE"), String.class).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void health_reports_catalog() {
        var resp = http.getForEntity(url("/actuator/health"), String.class);

        assertThat(resp.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(resp.getBody()).contains("\"UP\"").contains("opacityTables");
    }
}
