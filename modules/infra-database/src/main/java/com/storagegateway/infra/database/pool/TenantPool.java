package com.storagegateway.infra.database.pool;

import java.util.List;
import javax.sql.DataSource;

public interface TenantPool {
  String dbUrl();

  DataSource dataSource();

  boolean isExternal();

  List<String> searchPath();

  /** Connections checked out plus callers waiting for one. */
  int inUseConnections();

  /** Closes the physical pool. Calling it again has no effect. */
  void destroy();

  boolean isDestroyed();
}
