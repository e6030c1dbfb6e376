package com.storagegateway.domain.storage.tenant;

@FunctionalInterface
public interface TenantConfigResolver {
  TenantDatabaseConfig resolve(String tenantId);
}
