package com.storagegateway.domain.storage.backend;

import java.io.InputStream;
import java.util.List;

public interface StorageBackendAdapter {
  ObjectContent read(String bucket, String key, String version);

  ObjectMetadata save(
      String bucket,
      String key,
      String version,
      InputStream body,
      String contentType,
      String cacheControl);

  void delete(String bucket, String key, String version);

  CopyResult copy(
      String bucket,
      String sourceKey,
      String sourceVersion,
      String destinationKey,
      String destinationVersion);

  void deleteMany(String bucket, List<String> keys);

  ObjectMetadata metadata(String bucket, String key, String version);

  String createMultipartUpload(
      String bucket, String key, String version, String contentType, String cacheControl);

  UploadedPart uploadPart(
      String bucket,
      String key,
      String version,
      String uploadId,
      int partNumber,
      InputStream body,
      long contentLength);

  CompletedUpload completeMultipartUpload(
      String bucket, String key, String uploadId, String version, List<UploadedPart> parts);

  void abortMultipartUpload(String bucket, String key, String uploadId);
}
