package com.storagegateway.infra.database.connection;

import java.util.Map;
import java.util.Objects;

public record DatabaseUser(String jwt, Map<String, Object> claims) {
  public static final String ANON_ROLE = "anon";
  public static final String SERVICE_ROLE = "service_role";

  public DatabaseUser {
    jwt = Objects.requireNonNullElse(jwt, "");
    claims = claims == null ? Map.of() : Map.copyOf(claims);
  }

  public static DatabaseUser serviceRole(String jwt) {
    return new DatabaseUser(jwt, Map.of("role", SERVICE_ROLE));
  }

  public String role() {
    Object role = claims.get("role");
    if (role == null || role.toString().isBlank()) {
      return ANON_ROLE;
    }
    return role.toString();
  }

  public String subject() {
    Object sub = claims.get("sub");
    return sub == null ? "" : sub.toString();
  }
}
