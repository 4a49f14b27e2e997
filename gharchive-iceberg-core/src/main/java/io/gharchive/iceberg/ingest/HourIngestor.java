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

package io.gharchive.iceberg.ingest;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.NormalizedRow;
import io.gharchive.iceberg.model.exception.ErrorCode;
import io.gharchive.iceberg.model.exception.InternalException;
import io.gharchive.iceberg.model.ingest.CommitSummary;
import io.gharchive.iceberg.model.ingest.ErrorDetails;
import io.gharchive.iceberg.model.ingest.IngestResult;
import io.gharchive.iceberg.model.ingest.IngestStatusCode;
import io.gharchive.iceberg.normalize.EventNormalizer;
import io.gharchive.iceberg.spi.ArchiveReader;
import io.gharchive.iceberg.spi.ArchiveSource;
import io.gharchive.iceberg.spi.EventTableWriter;

/**
 * Ingests exactly one archive hour: fetch, decode and normalize every event, then commit the rows
 * in a single snapshot. Failures of the hour are reported in the {@link IngestResult}, the table is
 * left as it was.
 */
@Log4j2
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class HourIngestor {
  private final ArchiveSource archiveSource;
  private final EventNormalizer normalizer;
  private final EventTableWriter tableWriter;
  private final Clock clock;

  public static HourIngestor of(ArchiveSource archiveSource, EventTableWriter tableWriter) {
    return new HourIngestor(
        archiveSource, EventNormalizer.getInstance(), tableWriter, Clock.systemUTC());
  }

  public IngestResult ingestHour(ArchiveKey archiveKey) {
    Instant startTime = clock.instant();
    log.info("Ingesting {} from {}", archiveKey, archiveSource.locationOf(archiveKey));
    IngestResult.IngestResultBuilder result =
        IngestResult.builder().archiveKey(archiveKey).startTime(startTime);
    try (ArchiveReader reader = archiveSource.open(archiveKey)) {
      List<NormalizedRow> rows =
          reader
              .events()
              .map(event -> normalizer.normalize(event, archiveKey))
              .collect(Collectors.toList());
      long skippedLines = reader.getSkippedLines();
      if (skippedLines > 0) {
        log.warn("Skipped {} malformed lines in {}", skippedLines, archiveKey);
      }
      CommitSummary summary = tableWriter.commit(archiveKey, rows, skippedLines);
      result
          .statusCode(IngestStatusCode.SUCCESS)
          .rowCount(summary.getRowCount())
          .skippedLines(skippedLines)
          .filesWritten(summary.getFilesWritten())
          .snapshotId(summary.getSnapshotId());
    } catch (InternalException e) {
      log.error("Failed to ingest {}", archiveKey, e);
      result
          .statusCode(IngestStatusCode.ERROR)
          .errorDetails(ErrorDetails.create(e, "Failed to ingest archive hour " + archiveKey));
    } catch (RuntimeException e) {
      log.error("Unexpected failure while ingesting {}", archiveKey, e);
      InternalException unexpected =
          new InternalException(ErrorCode.UNEXPECTED_ERROR, String.valueOf(e.getMessage()), e);
      result
          .statusCode(IngestStatusCode.ERROR)
          .errorDetails(
              ErrorDetails.create(unexpected, "Failed to ingest archive hour " + archiveKey));
    }
    IngestResult ingestResult =
        result.duration(Duration.between(startTime, clock.instant())).build();
    if (ingestResult.isSuccess()) {
      log.info(
          "Ingested {} rows of {} in {}",
          ingestResult.getRowCount(),
          archiveKey,
          ingestResult.getDuration());
    }
    return ingestResult;
  }
}
