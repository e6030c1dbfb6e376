package com.storagegateway.worker.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storagegateway.infra.queue.engine.JobContext;
import com.storagegateway.infra.queue.engine.QueueEventHandler;
import com.storagegateway.infra.queue.engine.WorkerOptions;
import com.storagegateway.infra.queue.store.Job;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Delivers storage events to the configured webhook endpoint. */
public class WebhookHandler implements QueueEventHandler {
  public static final String QUEUE_NAME = "webhooks";
  private static final Logger log = LoggerFactory.getLogger(WebhookHandler.class);
  private static final int IO_FAILURE_STATUS = -1;

  private final WebhookProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;
  private final Clock clock;

  public WebhookHandler(WebhookProperties properties, ObjectMapper objectMapper) {
    this(
        properties,
        objectMapper,
        HttpClient.newBuilder().connectTimeout(Duration.ofMillis(properties.getTimeoutMs())).build(),
        Clock.systemUTC());
  }

  WebhookHandler(WebhookProperties properties, ObjectMapper objectMapper, HttpClient httpClient, Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient = httpClient;
    this.clock = clock;
  }

  @Override
  public String queueName() {
    return QUEUE_NAME;
  }

  @Override
  public WorkerOptions workerOptions() {
    return new WorkerOptions(
        properties.getConcurrency(), properties.getBatchSize(), Duration.ofMillis(properties.getPollIntervalMs()));
  }

  @Override
  public void handle(Job job, JobContext context) {
    String url = properties.getUrl();
    if (url == null || url.isBlank()) {
      log.info("Webhook skipped, no url configured job_id={}", job.id());
      return;
    }

    JsonNode data = job.data();
    JsonNode event = data.path("event");
    JsonNode tenant = data.path("tenant");
    String eventType = event.path("type").asText("unknown");
    String objectPath = objectPath(tenant, event.path("payload"));

    ObjectNode body = objectMapper.createObjectNode();
    body.put("type", "Webhook");
    body.set("event", event);
    body.put("sentAt", clock.instant().toString());
    body.set("tenant", tenant);

    HttpRequest.Builder request =
        HttpRequest.newBuilder(URI.create(url))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(write(body), StandardCharsets.UTF_8));
    String apiKey = properties.getApiKey();
    if (apiKey != null && !apiKey.isBlank()) {
      request.header("Authorization", "Bearer " + apiKey);
    }

    int status = send(request.build(), eventType, objectPath, job);
    log.info(
        "Webhook delivered event_type={} object_path={} tenant_id={} job_id={} status={}",
        eventType,
        objectPath,
        tenant.path("ref").asText(""),
        job.id(),
        status);
  }

  private int send(HttpRequest request, String eventType, String objectPath, Job job) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new WebhookDeliveryException("Webhook delivery interrupted", IO_FAILURE_STATUS, ex);
    } catch (IOException ex) {
      log.error(
          "Webhook delivery failed event_type={} object_path={} job_id={} error={}",
          eventType,
          objectPath,
          job.id(),
          ex.getMessage());
      throw new WebhookDeliveryException("Failed to call webhook endpoint", IO_FAILURE_STATUS, ex);
    }
    if (response.statusCode() >= 200 && response.statusCode() < 300) {
      return response.statusCode();
    }
    log.error(
        "Webhook delivery rejected event_type={} object_path={} job_id={} status={}",
        eventType,
        objectPath,
        job.id(),
        response.statusCode());
    throw new WebhookDeliveryException(
        "Webhook endpoint returned status=" + response.statusCode(), response.statusCode());
  }

  private String write(JsonNode body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize webhook body", ex);
    }
  }

  private static String objectPath(JsonNode tenant, JsonNode payload) {
    return tenant.path("ref").asText("")
        + "/"
        + payload.path("bucketId").asText("")
        + "/"
        + payload.path("name").asText("");
  }
}
