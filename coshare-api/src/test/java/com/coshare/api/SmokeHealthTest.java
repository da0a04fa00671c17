package com.coshare.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class SmokeHealthTest {
  @LocalServerPort int port;
  @Autowired TestRestTemplate rest;

  @Test void actuatorHealthIsUp() {
    var r = rest.getForEntity("http://localhost:" + port + "/actuator/health", String.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
  }

  @Test void serviceHealthReportsRegistry() {
    var r = rest.getForEntity("http://localhost:" + port + "/api/v1/health", Map.class);
    assertThat(r.getStatusCode().is2xxSuccessful()).isTrue();
    assertThat(r.getBody()).containsEntry("service", "coshare-api").containsEntry("registryInitialized", true);
  }

  @Test void requestIdIsEchoed() {
    var headers = new HttpHeaders();
    headers.set("X-Request-Id", "req-42");
    var r = rest.exchange("http://localhost:" + port + "/api/v1/health",
        HttpMethod.GET, new HttpEntity<>(headers), String.class);
    assertThat(r.getHeaders().getFirst("X-Request-Id")).isEqualTo("req-42");
  }
}
