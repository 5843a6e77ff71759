package com.gentoro.jobwatch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Backend view of one item at one poll instant. {@code progress} and {@code stage} are {@code
 * null} when the backend omitted them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemSnapshot(ItemStatus status, Integer progress, String stage) {

  public static ItemSnapshot of(ItemStatus status, int progress, String stage) {
    return new ItemSnapshot(status, progress, stage);
  }
}
