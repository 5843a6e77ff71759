package com.gentoro.jobwatch.model;

/** Aggregate outcome carried by the single terminal notification of an operation. */
public record OperationSummary(
    int successCount, int failureCount, int totalCount, RemoteStatus status, String message) {

  public boolean isFullySuccessful() {
    return status == RemoteStatus.COMPLETED && failureCount == 0 && successCount == totalCount;
  }
}
