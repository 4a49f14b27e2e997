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

import static io.gharchive.iceberg.ArchiveFixtures.FEBRUARY_KEY;
import static io.gharchive.iceberg.ArchiveFixtures.KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.apache.iceberg.FileScanTask;
import org.apache.iceberg.Schema;
import org.apache.iceberg.Snapshot;
import org.apache.iceberg.Table;
import org.apache.iceberg.Transaction;
import org.apache.iceberg.data.IcebergGenerics;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.exceptions.CommitFailedException;
import org.apache.iceberg.exceptions.CommitStateUnknownException;
import org.apache.iceberg.expressions.Expression;
import org.apache.iceberg.expressions.Expressions;
import org.apache.iceberg.hadoop.HadoopTables;
import org.apache.iceberg.io.CloseableIterable;
import org.apache.iceberg.types.Types;

import com.google.common.collect.Lists;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.NormalizedRow;
import io.gharchive.iceberg.model.exception.ErrorCode;
import io.gharchive.iceberg.model.exception.WriteException;
import io.gharchive.iceberg.model.ingest.CommitSummary;
import io.gharchive.iceberg.model.metadata.IngestCommitMetadata;

public class TestIcebergEventTableWriter {
  private static final Configuration CONFIGURATION = new Configuration();
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path warehouse;
  private EventTableConfig tableConfig;
  private IcebergEventTableWriter writer;

  @BeforeEach
  void setUp() {
    tableConfig = EventTableConfig.builder().warehousePath(warehouse.toString()).build();
    writer = writer(tableConfig, IcebergTableManager.of(CONFIGURATION));
  }

  @Test
  void createsTableAndCommitsOneSnapshot() throws IOException {
    List<NormalizedRow> rows =
        Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z"), row(KEY, "2", "2020-01-01T05:10:00Z"));
    CommitSummary summary = writer.commit(KEY, rows, 1);

    Table table = loadTable();
    assertEquals(2, summary.getRowCount());
    assertEquals(1, summary.getFilesWritten());
    assertEquals(1, summary.getPartitionsWritten());
    assertEquals(table.currentSnapshot().snapshotId(), summary.getSnapshotId());
    assertEquals(1, Lists.newArrayList(table.snapshots()).size());
    assertEquals(Arrays.asList("1", "2"), ids(table, Expressions.alwaysTrue()));
    assertEquals(EventTableSchema.schema().columns().size(), table.schema().columns().size());
    assertEquals("created_at_month", table.spec().fields().get(0).name());

    IngestCommitMetadata metadata =
        IngestCommitMetadata.fromJson(
                table.currentSnapshot().summary().get(IngestCommitMetadata.INGEST_METADATA))
            .get();
    assertEquals(KEY, metadata.archiveKey());
    assertEquals(2, metadata.getRecordCount());
    assertEquals(1, metadata.getSkippedLines());
    assertEquals(NOW, metadata.getIngestedAt());
  }

  @Test
  void writesTypedColumns() throws IOException {
    NormalizedRow row =
        row(KEY, "1", "2020-01-01T05:00:01Z").toBuilder()
            .labels(Arrays.asList("bug", "help wanted"))
            .number(42L)
            .merged(true)
            .build();
    writer.commit(KEY, Collections.singletonList(row), 0);

    try (CloseableIterable<Record> records = IcebergGenerics.read(loadTable()).build()) {
      Record record = records.iterator().next();
      assertEquals(Arrays.asList("bug", "help wanted"), record.getField("labels"));
      assertEquals(42L, record.getField("number"));
      assertEquals(true, record.getField("merged"));
      assertEquals(5, record.getField("archive_hour"));
      assertEquals(
          OffsetDateTime.parse("2020-01-01T05:00:01Z"), record.getField("created_at"));
    }
  }

  @Test
  void reingestingAnHourReplacesItsRows() throws IOException {
    writer.commit(KEY, Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z")), 0);
    writer.commit(
        FEBRUARY_KEY, Arrays.asList(row(FEBRUARY_KEY, "100", "2020-02-01T00:30:00Z")), 0);
    List<NormalizedRow> rows =
        Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z"), row(KEY, "2", "2020-01-01T05:10:00Z"));
    writer.commit(KEY, rows, 0);
    writer.commit(KEY, rows, 0);

    Table table = loadTable();
    assertEquals(4, Lists.newArrayList(table.snapshots()).size());
    assertEquals(Arrays.asList("1", "100", "2"), ids(table, Expressions.alwaysTrue()));
    // one live file per hour
    assertEquals(2, liveFiles(table, Expressions.alwaysTrue()).size());
  }

  @Test
  void emptyBatchCommitsNothing() {
    CommitSummary summary = writer.commit(KEY, Collections.emptyList(), 3);
    assertNull(summary.getSnapshotId());
    assertEquals(0, summary.getRowCount());
    assertFalse(new HadoopTables(CONFIGURATION).exists(tableConfig.getBasePath()));
  }

  @Test
  void partitionsByMonthOfCreatedAt() throws IOException {
    writer.commit(KEY, Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z")), 0);
    writer.commit(
        FEBRUARY_KEY,
        Arrays.asList(
            row(FEBRUARY_KEY, "100", "2020-02-01T00:30:00Z"),
            // late event of the previous month in the same archive hour
            row(FEBRUARY_KEY, "99", "2020-01-31T23:59:59Z")),
        0);

    Table table = loadTable();
    Expression february =
        Expressions.greaterThanOrEqual(
            EventTableSchema.CREATED_AT, micros(Instant.parse("2020-02-01T00:00:00Z")));
    assertEquals(Collections.singletonList("100"), ids(table, february));
    // the pruned scan only touches the february partition
    assertEquals(1, liveFiles(table, february).size());
    assertEquals(3, liveFiles(table, Expressions.alwaysTrue()).size());
    Expression january =
        Expressions.lessThan(
            EventTableSchema.CREATED_AT, micros(Instant.parse("2020-02-01T00:00:00Z")));
    assertEquals(Arrays.asList("1", "99"), ids(table, january));
  }

  @Test
  void failedCommitLeavesTableAndStorageUnchanged() throws IOException {
    writer.commit(KEY, Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z")), 0);
    Table table = loadTable();
    Snapshot before = table.currentSnapshot();
    long filesBefore = parquetFilesOnDisk();

    IcebergEventTableWriter failingWriter =
        writer(tableConfig, failingTableManager(table, new CommitFailedException("conflict")));
    WriteException exception =
        assertThrows(
            WriteException.class,
            () ->
                failingWriter.commit(
                    FEBRUARY_KEY,
                    Arrays.asList(row(FEBRUARY_KEY, "100", "2020-02-01T00:30:00Z")),
                    0));
    assertEquals(ErrorCode.COMMIT_CONFLICT, exception.getErrorCode());
    assertTrue(exception.isRetryable());
    assertEquals(FEBRUARY_KEY, exception.getArchiveKey());

    table.refresh();
    assertEquals(before.snapshotId(), table.currentSnapshot().snapshotId());
    assertEquals(Collections.singletonList("1"), ids(table, Expressions.alwaysTrue()));
    assertEquals(filesBefore, parquetFilesOnDisk());
  }

  @Test
  void unknownCommitStateKeepsWrittenFiles() throws IOException {
    writer.commit(KEY, Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z")), 0);
    Table table = loadTable();
    long filesBefore = parquetFilesOnDisk();

    IcebergEventTableWriter failingWriter =
        writer(
            tableConfig,
            failingTableManager(
                table, new CommitStateUnknownException(new RuntimeException("lost"))));
    assertThrows(
        WriteException.class,
        () ->
            failingWriter.commit(
                FEBRUARY_KEY, Arrays.asList(row(FEBRUARY_KEY, "100", "2020-02-01T00:30:00Z")), 0));
    assertEquals(filesBefore + 1, parquetFilesOnDisk());
  }

  @Test
  void addsMissingColumnsToOlderTable() throws IOException {
    Schema current = EventTableSchema.schema();
    Schema older =
        new Schema(
            current.columns().stream()
                .filter(column -> !column.name().startsWith("release_"))
                .collect(Collectors.toList()));
    new HadoopTables(CONFIGURATION)
        .create(
            older,
            EventTableSchema.partitionSpec(older, PartitionGranularity.MONTH),
            Collections.emptyMap(),
            tableConfig.getBasePath());

    writer.commit(
        KEY,
        Arrays.asList(
            row(KEY, "1", "2020-01-01T05:00:01Z").toBuilder().releaseTagName("v1.0").build()),
        0);

    Table table = loadTable();
    Types.NestedField tagName = table.schema().findField("release_tag_name");
    assertNotNull(tagName);
    assertTrue(tagName.isOptional());
    assertNotNull(table.schema().findField("release_name"));
    try (CloseableIterable<Record> records = IcebergGenerics.read(table).build()) {
      assertEquals("v1.0", records.iterator().next().getField("release_tag_name"));
    }
  }

  @Test
  void evolvesPartitionGranularity() throws IOException {
    writer.commit(KEY, Arrays.asList(row(KEY, "1", "2020-01-01T05:00:01Z")), 0);
    EventTableConfig daily =
        tableConfig.toBuilder().partitionGranularity(PartitionGranularity.DAY).build();
    writer(daily, IcebergTableManager.of(CONFIGURATION))
        .commit(
            FEBRUARY_KEY, Arrays.asList(row(FEBRUARY_KEY, "100", "2020-02-01T00:30:00Z")), 0);

    Table table = loadTable();
    assertEquals(
        Collections.singletonList("created_at_day"),
        table.spec().fields().stream().map(field -> field.name()).collect(Collectors.toList()));
    assertEquals(Arrays.asList("1", "100"), ids(table, Expressions.alwaysTrue()));
  }

  @Test
  void archiveKeyFilter() {
    assertEquals(
        Expressions.and(
                Expressions.equal("archive_date", "2020-01-01"),
                Expressions.equal("archive_hour", 5))
            .toString(),
        IcebergEventTableWriter.archiveKeyFilter(KEY).toString());
  }

  private IcebergEventTableWriter writer(EventTableConfig config, IcebergTableManager manager) {
    return new IcebergEventTableWriter(config, manager, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  /** Serves the real table but fails the commit of every new transaction. */
  private static IcebergTableManager failingTableManager(Table table, RuntimeException failure) {
    Table spiedTable = spy(table);
    doAnswer(
            invocation -> {
              Transaction transaction = spy((Transaction) invocation.callRealMethod());
              doThrow(failure).when(transaction).commitTransaction();
              return transaction;
            })
        .when(spiedTable)
        .newTransaction();
    IcebergTableManager tableManager = mock(IcebergTableManager.class);
    when(tableManager.getOrCreateTable(any(), any(), any(), any())).thenReturn(spiedTable);
    return tableManager;
  }

  private Table loadTable() {
    return new HadoopTables(CONFIGURATION).load(tableConfig.getBasePath());
  }

  private long parquetFilesOnDisk() throws IOException {
    try (Stream<Path> files = Files.walk(Paths.get(tableConfig.getBasePath()))) {
      return files
          .map(path -> path.getFileName().toString())
          .filter(name -> name.endsWith(".parquet") && !name.startsWith("."))
          .count();
    }
  }

  static NormalizedRow row(ArchiveKey key, String id, String createdAt) {
    return NormalizedRow.builder()
        .id(id)
        .eventType("WatchEvent")
        .createdAt(OffsetDateTime.parse(createdAt))
        .archiveDate(key.dateString())
        .archiveHour(key.getHour())
        .fileTime(OffsetDateTime.ofInstant(key.startInstant(), ZoneOffset.UTC))
        .build();
  }

  static List<String> ids(Table table, Expression filter) throws IOException {
    List<String> ids = new ArrayList<>();
    try (CloseableIterable<Record> records = IcebergGenerics.read(table).where(filter).build()) {
      for (Record record : records) {
        ids.add((String) record.getField(EventTableSchema.ID));
      }
    }
    Collections.sort(ids);
    return ids;
  }

  private static List<FileScanTask> liveFiles(Table table, Expression filter) throws IOException {
    try (CloseableIterable<FileScanTask> tasks = table.newScan().filter(filter).planFiles()) {
      return Lists.newArrayList(tasks);
    }
  }

  private static long micros(Instant instant) {
    return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
  }
}
