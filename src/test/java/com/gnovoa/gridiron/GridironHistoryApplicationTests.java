package com.gnovoa.gridiron;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

/** Basic integration tests */
@ActiveProfiles("integrationTest")
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class GridironHistoryApplicationTests {

  @Autowired private TestRestTemplate rest;

  @Test
  @DisplayName("Should verify health endpoint returns UP")
  void healthEndpointReturnsUp() {
    ResponseEntity<JsonNode> response = rest.getForEntity("/actuator/health", JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().path("status").asText()).isEqualTo("UP");
  }

  @Test
  @DisplayName("Should verify Swagger UI HTML page loads")
  void swaggerUiIsReachable() {
    ResponseEntity<String> response = rest.getForEntity("/swagger-ui/index.html", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_HTML)).isTrue();
    assertThat(response.getBody()).isNotNull().containsIgnoringCase("swagger ui");
  }

  @Test
  @DisplayName("Should verify OpenAPI JSON spec is available")
  void openApiSpecShouldBeAvailable() {
    ResponseEntity<JsonNode> response = rest.getForEntity("/v3/api-docs", JsonNode.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().has("openapi")).isTrue();
    assertThat(response.getBody().path("info").path("title").asText()).isNotEmpty();
    assertThat(response.getBody().path("paths").has("/api/history/runs")).isTrue();
  }

  @Test
  void apiDocsYamlOk() {
    ResponseEntity<String> response = rest.getForEntity("/v3/api-docs.yaml", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    String yamlBody = response.getBody();
    assertThat(yamlBody).isNotNull();
    // Check for key YAML markers
    assertThat(yamlBody).contains("openapi: 3.");
    assertThat(yamlBody).contains("paths:");
  }

  @Test
  @DisplayName("Should run a seeded history and serve its seasons, schedule and teams")
  void historyRunCompletes() throws InterruptedException {
    ResponseEntity<JsonNode> started =
        rest.postForEntity("/api/history/runs", Map.of("years", 2, "seed", 42), JsonNode.class);
    assertThat(started.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
    String runId = started.getBody().path("runId").asText();
    assertThat(started.getBody().path("ws").path("progress").asText()).endsWith(runId);

    JsonNode status = awaitFinished(runId);
    assertThat(status.path("state").asText()).isEqualTo("DONE");
    assertThat(status.path("currentYear").asInt()).isEqualTo(2025);

    JsonNode seasons = rest.getForObject("/api/history/runs/" + runId + "/seasons", JsonNode.class);
    assertThat(seasons.size()).isEqualTo(2);
    assertThat(seasons.get(0).path("year").asInt()).isEqualTo(2023);
    assertThat(seasons.get(1).path("championName").asText()).isNotBlank();

    JsonNode schedule = rest.getForObject("/api/history/runs/" + runId + "/schedule", JsonNode.class);
    assertThat(schedule.path("year").asInt()).isEqualTo(2025);
    assertThat(schedule.path("weeks").size()).isEqualTo(18);

    JsonNode teams = rest.getForObject("/api/history/runs/" + runId + "/teams", JsonNode.class);
    assertThat(teams.path("teams").size()).isEqualTo(32);
    assertThat(teams.path("teams").get(0).path("rosterSize").asInt()).isEqualTo(53);
  }

  @Test
  @DisplayName("Should answer 404 for unknown runs")
  void unknownRunIsNotFound() {
    ResponseEntity<String> response = rest.getForEntity("/api/history/runs/run-missing", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  @DisplayName("Should reject invalid year counts with 400")
  void invalidYearsAreRejected() {
    ResponseEntity<String> zero =
        rest.postForEntity("/api/history/runs", Map.of("years", 0), String.class);
    ResponseEntity<String> tooMany =
        rest.postForEntity("/api/history/runs", Map.of("years", 1000), String.class);

    assertThat(zero.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(tooMany.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  @DisplayName("Should answer 409 for the history of a cancelled run")
  void cancelledRunHasNoHistory() throws InterruptedException {
    JsonNode started =
        rest.postForObject("/api/history/runs", Map.of("years", 10, "seed", 7), JsonNode.class);
    String runId = started.path("runId").asText();

    ResponseEntity<JsonNode> cancel =
        rest.postForEntity("/api/history/runs/" + runId + "/cancel", null, JsonNode.class);
    assertThat(cancel.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

    JsonNode status = awaitFinished(runId);
    assertThat(status.path("state").asText()).isEqualTo("CANCELLED");
    assertThat(rest.getForEntity("/api/history/runs/" + runId + "/seasons", String.class).getStatusCode())
        .isEqualTo(HttpStatus.CONFLICT);
  }

  private JsonNode awaitFinished(String runId) throws InterruptedException {
    Instant deadline = Instant.now().plus(Duration.ofSeconds(90));
    JsonNode status = rest.getForObject("/api/history/runs/" + runId, JsonNode.class);
    while (isRunning(status) && Instant.now().isBefore(deadline)) {
      Thread.sleep(100);
      status = rest.getForObject("/api/history/runs/" + runId, JsonNode.class);
    }
    return status;
  }

  private static boolean isRunning(JsonNode status) {
    String state = status.path("state").asText();
    return state.equals("IDLE") || state.startsWith("RUNNING");
  }
}
