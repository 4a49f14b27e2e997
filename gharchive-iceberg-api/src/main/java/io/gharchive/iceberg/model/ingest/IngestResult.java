/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.gharchive.iceberg.model.ingest;

import java.time.Duration;
import java.time.Instant;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import io.gharchive.iceberg.model.ArchiveKey;

/**
 * Result of ingesting one archive hour.
 *
 * <p>On success {@link #getRowCount()} is the number of rows committed for the hour, on error
 * {@link #getErrorDetails()} tells whether the hour can be retried.
 */
@Value
@Builder(toBuilder = true)
public class IngestResult {
  @NonNull ArchiveKey archiveKey;
  @NonNull IngestStatusCode statusCode;
  long rowCount;
  // malformed lines dropped while reading the archive
  long skippedLines;
  int filesWritten;
  Long snapshotId;
  Instant startTime;
  Duration duration;
  ErrorDetails errorDetails;

  public boolean isSuccess() {
    return statusCode == IngestStatusCode.SUCCESS;
  }

  public static IngestResult skipped(ArchiveKey archiveKey) {
    return IngestResult.builder()
        .archiveKey(archiveKey)
        .statusCode(IngestStatusCode.SKIPPED)
        .build();
  }
}
