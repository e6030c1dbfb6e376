package com.storagegateway.worker.eventlog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EventNotifierTest {
  @Mock private TenantLeaseRepository leaseRepository;

  private EventLogPublisherProperties properties;
  private EventNotifier notifier;

  @BeforeEach
  void setUp() {
    properties = new EventLogPublisherProperties();
    properties.setMultitenant(true);
    notifier = new EventNotifier(leaseRepository, properties);
  }

  @Test
  void shouldRegisterEachTenantOncePerFlush() {
    notifier.notify("tenant-a");
    notifier.notify("tenant-a");
    notifier.notify("tenant-b");

    notifier.flush();
    notifier.flush();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
    verify(leaseRepository, times(1)).register(captor.capture());
    assertEquals(Set.of("tenant-a", "tenant-b"), new HashSet<>(captor.getValue()));
    assertEquals(0, notifier.pendingCount());
  }

  @Test
  void shouldSplitLargeFlushIntoChunks() {
    for (int i = 0; i < EventNotifier.CHUNK_SIZE + 20; i++) {
      notifier.notify("tenant-" + i);
    }

    notifier.flush();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
    verify(leaseRepository, times(2)).register(captor.capture());
    List<Integer> sizes = new ArrayList<>();
    captor.getAllValues().forEach(batch -> sizes.add(batch.size()));
    assertEquals(List.of(EventNotifier.CHUNK_SIZE, 20), sizes);
  }

  @Test
  void shouldIgnoreNotificationsInSingleTenantMode() {
    properties.setMultitenant(false);

    notifier.notify("tenant-a");
    notifier.flush();

    verify(leaseRepository, never()).register(anyList());
  }

  @Test
  void shouldSwallowRegisterFailureAndKeepGoing() {
    doThrow(new IllegalStateException("control plane down")).when(leaseRepository).register(anyList());
    notifier.notify("tenant-a");

    notifier.flush();
    notifier.notify("tenant-b");
    notifier.flush();

    verify(leaseRepository, times(2)).register(anyList());
  }
}
