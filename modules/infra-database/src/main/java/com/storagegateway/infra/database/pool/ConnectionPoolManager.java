package com.storagegateway.infra.database.pool;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import com.storagegateway.infra.database.connection.TenantConnectionOptions;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One live pool per database URL. Pools idle for longer than the configured TTL are evicted, and
 * the removal listener is the only place a pool is destroyed.
 */
public class ConnectionPoolManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);
  private static final Duration DISPOSAL_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(20);
  private static final Duration DRAIN_POLL_INTERVAL = Duration.ofMillis(50);

  private final TenantPoolFactory poolFactory;
  private final PoolDefaults defaults;
  private final Cache<String, TenantPool> pools;
  private final ScheduledExecutorService evictionTimer;
  private final ExecutorService disposalExecutor;
  private final Duration drainTimeout;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  public ConnectionPoolManager(TenantPoolFactory poolFactory, PoolDefaults defaults, Duration idleTtl) {
    this(poolFactory, defaults, idleTtl, newEvictionTimer(), newDisposalExecutor());
  }

  private ConnectionPoolManager(
      TenantPoolFactory poolFactory,
      PoolDefaults defaults,
      Duration idleTtl,
      ScheduledExecutorService evictionTimer,
      ExecutorService disposalExecutor) {
    this(
        poolFactory,
        defaults,
        idleTtl,
        Ticker.systemTicker(),
        disposalExecutor,
        Scheduler.forScheduledExecutorService(evictionTimer),
        evictionTimer,
        disposalExecutor,
        DRAIN_TIMEOUT);
  }

  ConnectionPoolManager(
      TenantPoolFactory poolFactory,
      PoolDefaults defaults,
      Duration idleTtl,
      Ticker ticker,
      Executor executor,
      Scheduler scheduler) {
    this(poolFactory, defaults, idleTtl, ticker, executor, scheduler, DRAIN_TIMEOUT);
  }

  ConnectionPoolManager(
      TenantPoolFactory poolFactory,
      PoolDefaults defaults,
      Duration idleTtl,
      Ticker ticker,
      Executor executor,
      Scheduler scheduler,
      Duration drainTimeout) {
    this(poolFactory, defaults, idleTtl, ticker, executor, scheduler, null, null, drainTimeout);
  }

  private ConnectionPoolManager(
      TenantPoolFactory poolFactory,
      PoolDefaults defaults,
      Duration idleTtl,
      Ticker ticker,
      Executor executor,
      Scheduler scheduler,
      ScheduledExecutorService evictionTimer,
      ExecutorService disposalExecutor,
      Duration drainTimeout) {
    this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory must not be null");
    this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
    this.evictionTimer = evictionTimer;
    this.disposalExecutor = disposalExecutor;
    this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");

    Caffeine<Object, Object> builder =
        Caffeine.newBuilder().ticker(ticker).executor(executor).scheduler(scheduler);
    if (idleTtl != null && !idleTtl.isZero() && !idleTtl.isNegative()) {
      builder.expireAfterAccess(idleTtl);
    }
    this.pools =
        builder
            .<String, TenantPool>removalListener((dbUrl, pool, cause) -> dispose(pool, cause))
            .build();
  }

  public TenantPool acquirePool(TenantConnectionOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    if (stopped.get()) {
      throw new IllegalStateException("Connection pool manager is stopped");
    }
    return pools.get(options.dbUrl(), dbUrl -> createPool(options));
  }

  public void evict(String dbUrl) {
    pools.invalidate(dbUrl);
  }

  public int activePoolCount() {
    return pools.asMap().size();
  }

  /** Destroys every live pool concurrently. Individual failures are logged and skipped. */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    if (evictionTimer != null) {
      evictionTimer.shutdownNow();
    }
    int live = activePoolCount();
    pools.invalidateAll();
    pools.cleanUp();
    if (disposalExecutor != null) {
      disposalExecutor.shutdown();
      try {
        if (!disposalExecutor.awaitTermination(DISPOSAL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Pool disposal did not finish timeout_ms={}", DISPOSAL_TIMEOUT.toMillis());
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    log.info("Connection pool manager stopped pools_destroyed={}", live);
  }

  public boolean isStopped() {
    return stopped.get();
  }

  void cleanUp() {
    pools.cleanUp();
  }

  private TenantPool createPool(TenantConnectionOptions options) {
    int maxConnections =
        options.externalPool() && options.maxConnections() != null
            ? options.maxConnections()
            : defaults.maxConnections();
    PoolSettings settings =
        new PoolSettings(
            options.dbUrl(),
            options.externalPool(),
            maxConnections,
            defaults.connectionTimeout(),
            defaults.searchPath());
    TenantPool pool = poolFactory.create(settings);
    log.info(
        "Tenant pool created tenant_id={} external={} max_connections={}",
        options.tenantId(),
        options.externalPool(),
        maxConnections);
    return pool;
  }

  private void dispose(TenantPool pool, RemovalCause cause) {
    if (pool == null) {
      return;
    }
    try {
      awaitDrained(pool, cause);
      pool.destroy();
      log.debug("Tenant pool destroyed cause={}", cause);
    } catch (Exception ex) {
      log.error("Tenant pool destroy failed cause={} error={}", cause, ex.getMessage(), ex);
    }
  }

  // connections still checked out are returned before the pool closes
  private void awaitDrained(TenantPool pool, RemovalCause cause) {
    long deadline = System.nanoTime() + drainTimeout.toNanos();
    int inUse = pool.inUseConnections();
    while (inUse > 0) {
      if (System.nanoTime() >= deadline) {
        log.warn(
            "Tenant pool drain timed out cause={} in_use={} timeout_ms={}",
            cause,
            inUse,
            drainTimeout.toMillis());
        return;
      }
      try {
        Thread.sleep(DRAIN_POLL_INTERVAL.toMillis());
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        return;
      }
      inUse = pool.inUseConnections();
    }
  }

  private static ScheduledExecutorService newEvictionTimer() {
    return Executors.newSingleThreadScheduledExecutor(daemonThreads("pool-eviction-"));
  }

  private static ExecutorService newDisposalExecutor() {
    return Executors.newFixedThreadPool(4, daemonThreads("pool-disposal-"));
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
