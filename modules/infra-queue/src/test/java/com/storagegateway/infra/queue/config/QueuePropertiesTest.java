package com.storagegateway.infra.queue.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class QueuePropertiesTest {
  @Test
  void shouldPreferDedicatedQueueUrl() {
    QueueProperties properties = new QueueProperties();
    properties.setConnectionUrl("postgresql://queue-db/postgres");
    properties.setDatabaseUrl("postgresql://db/postgres");

    assertEquals("postgresql://queue-db/postgres", properties.resolveConnectionUrl());
  }

  @Test
  void shouldFallBackToDatabaseUrlInSingleTenantMode() {
    QueueProperties properties = new QueueProperties();
    properties.setDatabaseUrl("postgresql://db/postgres");

    assertEquals("postgresql://db/postgres", properties.resolveConnectionUrl());
  }

  @Test
  void shouldUseMultitenantDatabaseUrlInMultitenantMode() {
    QueueProperties properties = new QueueProperties();
    properties.setMultitenant(true);
    properties.setDatabaseUrl("postgresql://ignored/postgres");
    properties.setMultitenantDatabaseUrl("postgresql://control/postgres");

    assertEquals("postgresql://control/postgres", properties.resolveConnectionUrl());
  }

  @Test
  void shouldRejectMissingUrls() {
    QueueProperties multitenant = new QueueProperties();
    multitenant.setMultitenant(true);

    assertThrows(IllegalStateException.class, multitenant::resolveConnectionUrl);
    assertThrows(IllegalStateException.class, new QueueProperties()::resolveConnectionUrl);
  }

  @Test
  void shouldExposeHealthDefaults() {
    QueueProperties properties = new QueueProperties();

    assertEquals(10, properties.getHealth().getMaxConsecutiveErrors());
    assertEquals(120000L, properties.getHealth().getUnhealthyTimeoutMs());
    assertEquals(20000L, properties.getStopTimeoutMs());
  }
}
