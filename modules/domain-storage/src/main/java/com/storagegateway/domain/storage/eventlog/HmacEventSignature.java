package com.storagegateway.domain.storage.eventlog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * HMAC-SHA256 signature over {@code event_name.payload.send_options}, where both JSON documents
 * are written with sorted keys so a round trip through {@code jsonb} does not change the digest.
 */
public class HmacEventSignature implements EventSignatureVerifier {
  private static final String ALGORITHM = "HmacSHA256";

  private final byte[] signingKey;
  private final ObjectMapper canonicalMapper;

  public HmacEventSignature(String signingKey, ObjectMapper objectMapper) {
    Objects.requireNonNull(signingKey, "signingKey must not be null");
    if (signingKey.isBlank()) {
      throw new IllegalArgumentException("signingKey must not be blank");
    }
    this.signingKey = signingKey.getBytes(StandardCharsets.UTF_8);
    this.canonicalMapper =
        Objects.requireNonNull(objectMapper, "objectMapper must not be null")
            .copy()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
  }

  public String sign(String eventName, JsonNode payload, JsonNode sendOptions) {
    Objects.requireNonNull(eventName, "eventName must not be null");
    String message =
        eventName + "." + canonical(payload) + "." + (isAbsent(sendOptions) ? "" : canonical(sendOptions));
    return hmacSha256Hex(message);
  }

  @Override
  public boolean verify(String eventName, JsonNode payload, JsonNode sendOptions, String signature) {
    if (eventName == null || signature == null || signature.isBlank()) {
      return false;
    }
    byte[] expected = sign(eventName, payload, sendOptions).getBytes(StandardCharsets.UTF_8);
    byte[] actual = signature.getBytes(StandardCharsets.UTF_8);
    if (expected.length != actual.length) {
      return false;
    }
    return MessageDigest.isEqual(expected, actual);
  }

  private String canonical(JsonNode node) {
    if (node == null || node.isMissingNode()) {
      return "null";
    }
    try {
      Object tree = canonicalMapper.treeToValue(node, Object.class);
      return canonicalMapper.writeValueAsString(tree);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize event log document", ex);
    }
  }

  private String hmacSha256Hex(String message) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(signingKey, ALGORITHM));
      byte[] signatureBytes = mac.doFinal(message.getBytes(StandardCharsets.UTF_8));
      StringBuilder hex = new StringBuilder(signatureBytes.length * 2);
      for (byte b : signatureBytes) {
        hex.append(Character.forDigit((b >> 4) & 0xF, 16));
        hex.append(Character.forDigit(b & 0xF, 16));
      }
      return hex.toString();
    } catch (Exception ex) {
      throw new IllegalStateException("Failed to sign event log entry", ex);
    }
  }

  private static boolean isAbsent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }
}
