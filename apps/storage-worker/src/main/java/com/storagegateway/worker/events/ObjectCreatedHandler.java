package com.storagegateway.worker.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storagegateway.infra.queue.engine.JobContext;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.engine.QueueEventHandler;
import com.storagegateway.infra.queue.store.Job;
import com.storagegateway.infra.queue.store.JobInsert;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns an object-created event into a webhook delivery job. */
public class ObjectCreatedHandler implements QueueEventHandler {
  public static final String QUEUE_NAME = "object-created";
  static final String DEFAULT_EVENT_TYPE = "ObjectCreated:Put";
  private static final Logger log = LoggerFactory.getLogger(ObjectCreatedHandler.class);

  private final JobQueue jobQueue;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ObjectCreatedHandler(JobQueue jobQueue, ObjectMapper objectMapper) {
    this(jobQueue, objectMapper, Clock.systemUTC());
  }

  ObjectCreatedHandler(JobQueue jobQueue, ObjectMapper objectMapper, Clock clock) {
    this.jobQueue = jobQueue;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  @Override
  public String queueName() {
    return QUEUE_NAME;
  }

  @Override
  public void handle(Job job, JobContext context) {
    JsonNode data = job.data();
    ObjectNode payload = data.deepCopy();
    payload.remove("tenant");
    payload.remove("eventType");
    payload.remove("$version");

    ObjectNode event = objectMapper.createObjectNode();
    event.put("$version", data.path("$version").asText("v1"));
    event.put("type", data.path("eventType").asText(DEFAULT_EVENT_TYPE));
    event.set("payload", payload);
    event.put("applyTime", clock.millis());

    ObjectNode webhook = objectMapper.createObjectNode();
    webhook.set("event", event);
    webhook.set("tenant", data.path("tenant").deepCopy());

    jobQueue.send(JobInsert.of(WebhookHandler.QUEUE_NAME, webhook));
    log.debug(
        "Object created event forwarded to webhook tenant_id={} bucket_id={} name={}",
        data.path("tenant").path("ref").asText(""),
        payload.path("bucketId").asText(""),
        payload.path("name").asText(""));
  }
}
