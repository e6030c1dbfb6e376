package com.storagegateway.infra.database.pool;

@FunctionalInterface
public interface TenantPoolFactory {
  TenantPool create(PoolSettings settings);
}
