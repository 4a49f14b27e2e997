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

import static org.apache.iceberg.expressions.Expressions.and;
import static org.apache.iceberg.expressions.Expressions.equal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import org.apache.hadoop.conf.Configuration;

import org.apache.iceberg.DataFile;
import org.apache.iceberg.FileFormat;
import org.apache.iceberg.MetricsConfig;
import org.apache.iceberg.OverwriteFiles;
import org.apache.iceberg.PartitionKey;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.Table;
import org.apache.iceberg.Transaction;
import org.apache.iceberg.data.InternalRecordWrapper;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.data.parquet.GenericParquetWriter;
import org.apache.iceberg.exceptions.CommitFailedException;
import org.apache.iceberg.exceptions.CommitStateUnknownException;
import org.apache.iceberg.expressions.Expression;
import org.apache.iceberg.io.DataWriter;
import org.apache.iceberg.io.OutputFile;
import org.apache.iceberg.parquet.Parquet;

import com.google.common.annotations.VisibleForTesting;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.NormalizedRow;
import io.gharchive.iceberg.model.exception.ErrorCode;
import io.gharchive.iceberg.model.exception.WriteException;
import io.gharchive.iceberg.model.ingest.CommitSummary;
import io.gharchive.iceberg.model.metadata.IngestCommitMetadata;
import io.gharchive.iceberg.spi.EventTableWriter;

/**
 * Writes the rows of one archive hour as Parquet data files and commits them in a single Iceberg
 * snapshot. The snapshot replaces every file previously committed for the same {@link ArchiveKey},
 * so ingesting an hour twice leaves the table with one copy of its rows.
 *
 * <p>Data files written by a failed attempt are deleted before the failure is reported. When the
 * outcome of the commit is unknown the files are kept since the snapshot may reference them.
 */
@Log4j2
public class IcebergEventTableWriter implements EventTableWriter {
  @Getter private final EventTableConfig tableConfig;
  private final IcebergTableManager tableManager;
  private final IcebergSchemaSync schemaSync;
  private final IcebergPartitionSpecSync partitionSpecSync;
  private final Clock clock;

  public static IcebergEventTableWriter of(EventTableConfig tableConfig, Configuration hadoopConf) {
    return new IcebergEventTableWriter(
        tableConfig, IcebergTableManager.of(hadoopConf), Clock.systemUTC());
  }

  @VisibleForTesting
  IcebergEventTableWriter(
      EventTableConfig tableConfig, IcebergTableManager tableManager, Clock clock) {
    this.tableConfig = tableConfig;
    this.tableManager = tableManager;
    this.schemaSync = IcebergSchemaSync.getInstance();
    this.partitionSpecSync = IcebergPartitionSpecSync.getInstance();
    this.clock = clock;
  }

  /** Loads the table, creating it or bringing its schema and partitioning up to date first. */
  public Table loadTable() {
    Schema latestSchema = EventTableSchema.schema();
    PartitionSpec latestSpec =
        EventTableSchema.partitionSpec(latestSchema, tableConfig.getPartitionGranularity());
    Map<String, String> properties = new LinkedHashMap<>(EventTableSchema.defaultTableProperties());
    properties.putAll(tableConfig.getTableProperties());
    Table table = tableManager.getOrCreateTable(tableConfig, latestSchema, latestSpec, properties);
    boolean schemaChanged = schemaSync.needsSync(table.schema(), latestSchema);
    boolean specChanged = partitionSpecSync.needsSync(table.spec(), latestSpec);
    if (schemaChanged || specChanged) {
      Transaction transaction = table.newTransaction();
      schemaSync.sync(table.schema(), latestSchema, transaction);
      partitionSpecSync.sync(table.spec(), latestSpec, transaction);
      transaction.commitTransaction();
      table.refresh();
    }
    return table;
  }

  @Override
  public CommitSummary commit(ArchiveKey archiveKey, List<NormalizedRow> rows, long skippedLines) {
    if (rows.isEmpty()) {
      log.info("No rows for {}, nothing to commit", archiveKey);
      return CommitSummary.empty(archiveKey);
    }
    List<DataFile> dataFiles = new ArrayList<>();
    Table table;
    try {
      table = loadTable();
    } catch (RuntimeException e) {
      throw new WriteException(archiveKey, "Failed to load table " + tableConfig.getBasePath(), e);
    }
    try {
      Map<PartitionKey, List<Record>> partitions = groupByPartition(table, rows);
      for (Map.Entry<PartitionKey, List<Record>> partition : partitions.entrySet()) {
        dataFiles.add(writeDataFile(table, archiveKey, partition.getKey(), partition.getValue()));
      }
      Transaction transaction = table.newTransaction();
      OverwriteFiles overwrite =
          transaction
              .newOverwrite()
              .overwriteByRowFilter(archiveKeyFilter(archiveKey))
              .validateAddedFilesMatchOverwriteFilter();
      dataFiles.forEach(overwrite::addFile);
      overwrite.set(
          IngestCommitMetadata.INGEST_METADATA,
          IngestCommitMetadata.of(archiveKey, rows.size(), skippedLines, clock.instant()).toJson());
      overwrite.commit();
      transaction.commitTransaction();
      Snapshot snapshot = transaction.table().currentSnapshot();
      log.info(
          "Committed {} rows of {} in {} files, snapshot {}",
          rows.size(),
          archiveKey,
          dataFiles.size(),
          snapshot.snapshotId());
      return CommitSummary.builder()
          .archiveKey(archiveKey)
          .rowCount(rows.size())
          .filesWritten(dataFiles.size())
          .partitionsWritten(partitions.size())
          .snapshotId(snapshot.snapshotId())
          .build();
    } catch (CommitStateUnknownException e) {
      throw new WriteException(
          archiveKey,
          ErrorCode.COMMIT_CONFLICT,
          "Commit state of " + archiveKey + " is unknown, written files are kept",
          e);
    } catch (CommitFailedException e) {
      deleteFiles(table, dataFiles);
      throw new WriteException(
          archiveKey, ErrorCode.COMMIT_CONFLICT, "Failed to commit " + archiveKey, e);
    } catch (IOException | RuntimeException e) {
      deleteFiles(table, dataFiles);
      throw new WriteException(archiveKey, "Failed to write " + archiveKey, e);
    }
  }

  @VisibleForTesting
  static Expression archiveKeyFilter(ArchiveKey archiveKey) {
    return and(
        equal(EventTableSchema.ARCHIVE_DATE, archiveKey.dateString()),
        equal(EventTableSchema.ARCHIVE_HOUR, archiveKey.getHour()));
  }

  private static Map<PartitionKey, List<Record>> groupByPartition(
      Table table, List<NormalizedRow> rows) {
    Schema schema = table.schema();
    PartitionKey partitionKey = new PartitionKey(table.spec(), schema);
    InternalRecordWrapper wrapper = new InternalRecordWrapper(schema.asStruct());
    Map<PartitionKey, List<Record>> partitions = new LinkedHashMap<>();
    for (NormalizedRow row : rows) {
      Record record = EventTableSchema.toRecord(row, schema);
      partitionKey.partition(wrapper.wrap(record));
      partitions.computeIfAbsent(partitionKey.copy(), key -> new ArrayList<>()).add(record);
    }
    return partitions;
  }

  private static DataFile writeDataFile(
      Table table, ArchiveKey archiveKey, PartitionKey partition, List<Record> records)
      throws IOException {
    PartitionSpec spec = table.spec();
    String fileName = FileFormat.PARQUET.addExtension(archiveKey + "-" + UUID.randomUUID());
    String location =
        spec.isUnpartitioned()
            ? table.locationProvider().newDataLocation(fileName)
            : table.locationProvider().newDataLocation(spec, partition, fileName);
    OutputFile outputFile = table.io().newOutputFile(location);
    DataWriter<Record> writer =
        Parquet.writeData(outputFile)
            .schema(table.schema())
            .createWriterFunc(GenericParquetWriter::buildWriter)
            .setAll(table.properties())
            .metricsConfig(MetricsConfig.forTable(table))
            .withSpec(spec)
            .withPartition(partition)
            .overwrite()
            .build();
    try (DataWriter<Record> closing = writer) {
      for (Record record : records) {
        closing.write(record);
      }
    } catch (IOException | RuntimeException e) {
      table.io().deleteFile(location);
      throw e;
    }
    log.debug("Wrote {} rows to {}", records.size(), location);
    return writer.toDataFile();
  }

  private static void deleteFiles(Table table, List<DataFile> dataFiles) {
    for (DataFile dataFile : dataFiles) {
      try {
        table.io().deleteFile(dataFile.path().toString());
      } catch (UncheckedIOException e) {
        log.warn("Failed to delete uncommitted data file {}", dataFile.path(), e);
      }
    }
  }
}
