package com.storagegateway.infra.database.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.benmanes.caffeine.cache.Scheduler;
import com.storagegateway.infra.database.connection.DatabaseUser;
import com.storagegateway.infra.database.connection.TenantConnectionOptions;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;

class ConnectionPoolManagerTest {
  private static final DatabaseUser ANON = new DatabaseUser("jwt", null);

  private final AtomicLong nanos = new AtomicLong();
  private final RecordingPoolFactory poolFactory = new RecordingPoolFactory();
  private final ConnectionPoolManager manager =
      new ConnectionPoolManager(
          poolFactory,
          new PoolDefaults(8, Duration.ofSeconds(3), null),
          Duration.ofSeconds(10),
          nanos::get,
          Runnable::run,
          Scheduler.disabledScheduler());

  @Test
  void shouldReturnSamePoolForSameUrl() {
    TenantPool first = manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    TenantPool second = manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    TenantPool other = manager.acquirePool(options("tenant-b", "postgres://db-b/postgres"));

    assertSame(first, second);
    assertNotSame(first, other);
    assertEquals(2, poolFactory.created.size());
    assertEquals(2, manager.activePoolCount());
  }

  @Test
  void shouldKeepPoolAliveWhileAccessedWithinIdleTtl() {
    TenantPool first = manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    advance(Duration.ofSeconds(6));
    manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    advance(Duration.ofSeconds(6));
    TenantPool third = manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));

    assertSame(first, third);
    assertEquals(0, ((FakePool) first).destroyCalls.get());
  }

  @Test
  void shouldDestroyIdlePoolExactlyOnceAndCreateFreshOne() {
    FakePool first = (FakePool) manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));

    advance(Duration.ofSeconds(11));
    manager.cleanUp();
    FakePool second = (FakePool) manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    manager.cleanUp();

    assertNotSame(first, second);
    assertEquals(1, first.destroyCalls.get());
    assertEquals(0, second.destroyCalls.get());
  }

  @Test
  void shouldWaitForCheckedOutConnectionsBeforeDestroyingIdlePool() throws Exception {
    ConnectionPoolManager draining = managerWithDrainTimeout(Duration.ofSeconds(5));
    FakePool pool = (FakePool) draining.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    pool.inUse.set(1);
    Thread release =
        new Thread(
            () -> {
              try {
                Thread.sleep(200L);
              } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
              }
              pool.inUse.set(0);
            });
    release.start();

    advance(Duration.ofSeconds(11));
    draining.cleanUp();
    release.join();

    assertEquals(1, pool.destroyCalls.get());
    assertEquals(0, pool.inUseAtDestroy.get());
  }

  @Test
  void shouldDestroyPoolWhenDrainTimesOut() {
    ConnectionPoolManager draining = managerWithDrainTimeout(Duration.ofMillis(100));
    FakePool pool = (FakePool) draining.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    pool.inUse.set(2);

    advance(Duration.ofSeconds(11));
    draining.cleanUp();

    assertEquals(1, pool.destroyCalls.get());
    assertEquals(2, pool.inUseAtDestroy.get());
  }

  @Test
  void shouldDestroyOnExplicitEvict() {
    FakePool pool = (FakePool) manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));

    manager.evict("postgres://db-a/postgres");

    assertEquals(1, pool.destroyCalls.get());
    assertEquals(0, manager.activePoolCount());
  }

  @Test
  void shouldDestroyAllPoolsOnStopEvenWhenOneFails() {
    FakePool failing = (FakePool) manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    FakePool healthy = (FakePool) manager.acquirePool(options("tenant-b", "postgres://db-b/postgres"));
    failing.failOnDestroy = true;

    manager.stop();
    manager.stop();

    assertEquals(1, failing.destroyCalls.get());
    assertEquals(1, healthy.destroyCalls.get());
    assertTrue(manager.isStopped());
    assertThrows(
        IllegalStateException.class,
        () -> manager.acquirePool(options("tenant-a", "postgres://db-a/postgres")));
  }

  @Test
  void shouldSizeExternalPoolsFromOptions() {
    manager.acquirePool(options("tenant-a", "postgres://db-a/postgres"));
    manager.acquirePool(options("tenant-b", "postgres://pooler/postgres").asExternalPool(3));

    assertEquals(8, poolFactory.created.get(0).maxConnections());
    assertEquals(3, poolFactory.created.get(1).maxConnections());
    assertTrue(poolFactory.created.get(1).external());
    assertEquals(PoolDefaults.BASE_SEARCH_PATH, poolFactory.created.get(0).searchPath());
  }

  private ConnectionPoolManager managerWithDrainTimeout(Duration drainTimeout) {
    return new ConnectionPoolManager(
        poolFactory,
        new PoolDefaults(8, Duration.ofSeconds(3), null),
        Duration.ofSeconds(10),
        nanos::get,
        Runnable::run,
        Scheduler.disabledScheduler(),
        drainTimeout);
  }

  private void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  private static TenantConnectionOptions options(String tenantId, String dbUrl) {
    return TenantConnectionOptions.of(tenantId, dbUrl, ANON, ANON);
  }

  private static final class RecordingPoolFactory implements TenantPoolFactory {
    private final List<PoolSettings> created = new ArrayList<>();

    @Override
    public TenantPool create(PoolSettings settings) {
      created.add(settings);
      return new FakePool(settings);
    }
  }

  private static final class FakePool implements TenantPool {
    private final PoolSettings settings;
    private final AtomicInteger destroyCalls = new AtomicInteger();
    private final AtomicInteger inUse = new AtomicInteger();
    private final AtomicInteger inUseAtDestroy = new AtomicInteger(-1);
    private volatile boolean failOnDestroy;

    private FakePool(PoolSettings settings) {
      this.settings = settings;
    }

    @Override
    public String dbUrl() {
      return settings.dbUrl();
    }

    @Override
    public DataSource dataSource() {
      throw new UnsupportedOperationException();
    }

    @Override
    public boolean isExternal() {
      return settings.external();
    }

    @Override
    public List<String> searchPath() {
      return settings.searchPath();
    }

    @Override
    public int inUseConnections() {
      return inUse.get();
    }

    @Override
    public void destroy() {
      inUseAtDestroy.set(inUse.get());
      destroyCalls.incrementAndGet();
      if (failOnDestroy) {
        throw new IllegalStateException("pool already terminated");
      }
    }

    @Override
    public boolean isDestroyed() {
      return destroyCalls.get() > 0;
    }
  }
}
