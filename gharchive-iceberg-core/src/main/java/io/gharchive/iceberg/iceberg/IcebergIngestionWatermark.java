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

package io.gharchive.iceberg.iceberg;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

import org.apache.hadoop.conf.Configuration;

import org.apache.iceberg.FileScanTask;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.Table;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.types.Conversions;
import org.apache.iceberg.types.Types;

import com.google.common.annotations.VisibleForTesting;

import io.gharchive.iceberg.model.exception.ReadException;
import io.gharchive.iceberg.model.metadata.IngestCommitMetadata;
import io.gharchive.iceberg.spi.IngestionWatermark;

/**
 * Latest {@code created_at} committed to the event table, read from the upper bounds of the live
 * data files. Tables whose files carry no bounds for the column fall back to the end of the latest
 * archive hour recorded in the snapshot summaries.
 */
@Log4j2
public class IcebergIngestionWatermark implements IngestionWatermark {
  private final EventTableConfig tableConfig;
  private final IcebergTableManager tableManager;

  public static IcebergIngestionWatermark of(
      EventTableConfig tableConfig, Configuration hadoopConf) {
    return new IcebergIngestionWatermark(tableConfig, IcebergTableManager.of(hadoopConf));
  }

  @VisibleForTesting
  IcebergIngestionWatermark(EventTableConfig tableConfig, IcebergTableManager tableManager) {
    this.tableConfig = tableConfig;
    this.tableManager = tableManager;
  }

  @Override
  public Optional<Instant> latestIngestedTimestamp() {
    if (!tableManager.tableExists(tableConfig)) {
      return Optional.empty();
    }
    Table table = tableManager.getTable(tableConfig);
    if (table.currentSnapshot() == null) {
      return Optional.empty();
    }
    Optional<Instant> fromMetrics = maxCreatedAt(table);
    if (fromMetrics.isPresent()) {
      return fromMetrics;
    }
    return latestArchiveKeyEnd(table);
  }

  private Optional<Instant> maxCreatedAt(Table table) {
    Types.NestedField createdAt = table.schema().findField(EventTableSchema.CREATED_AT);
    if (createdAt == null) {
      return Optional.empty();
    }
    Long maxMicros = null;
    try (CloseableIterable<FileScanTask> tasks =
        table.newScan().includeColumnStats().planFiles()) {
      for (FileScanTask task : tasks) {
        if (task.file().upperBounds() == null) {
          continue;
        }
        ByteBuffer upper = task.file().upperBounds().get(createdAt.fieldId());
        if (upper != null) {
          Long micros = Conversions.fromByteBuffer(createdAt.type(), upper);
          if (maxMicros == null || micros > maxMicros) {
            maxMicros = micros;
          }
        }
      }
    } catch (IOException e) {
      throw new ReadException("Failed to read data files of " + tableConfig.getBasePath(), e);
    }
    if (maxMicros == null) {
      return Optional.empty();
    }
    return Optional.of(Instant.EPOCH.plus(maxMicros, ChronoUnit.MICROS));
  }

  private static Optional<Instant> latestArchiveKeyEnd(Table table) {
    Instant latest = null;
    for (Snapshot snapshot : table.snapshots()) {
      Optional<IngestCommitMetadata> metadata =
          IngestCommitMetadata.fromJson(
              snapshot.summary().get(IngestCommitMetadata.INGEST_METADATA));
      if (metadata.isPresent()) {
        // last instant inside the hour
        Instant end = metadata.get().archiveKey().endInstant().minusMillis(1);
        if (latest == null || end.isAfter(latest)) {
          latest = end;
        }
      }
    }
    log.debug("No created_at bounds in {}, using snapshot summaries", table.name());
    return Optional.ofNullable(latest);
  }
}
