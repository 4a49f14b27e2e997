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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.apache.iceberg.BaseTable;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;
import org.apache.iceberg.Table;
import org.apache.iceberg.TableMetadata;
import org.apache.iceberg.TableOperations;
import org.apache.iceberg.catalog.Catalog;
import org.apache.iceberg.catalog.Namespace;
import org.apache.iceberg.catalog.TableIdentifier;
import org.apache.iceberg.exceptions.AlreadyExistsException;

public class TestIcebergTableManager {
  private static final String WAREHOUSE_PATH = "file:///warehouse";
  private static final String BASE_PATH = "file:///warehouse/database1/table1";
  private static final Map<String, String> OPTIONS = Collections.singletonMap("key", "value");
  private static final TableIdentifier IDENTIFIER = TableIdentifier.of("database1", "table1");
  private static final Configuration CONFIGURATION = new Configuration();
  private static final Schema SCHEMA = EventTableSchema.schema();
  private static final PartitionSpec PARTITION_SPEC =
      EventTableSchema.partitionSpec(SCHEMA, PartitionGranularity.MONTH);
  private final Catalog mockCatalog = mock(Catalog.class);

  @Test
  void catalogGetTable() {
    EventTableConfig tableConfig = catalogTableConfig("catalog1");
    Table mockTable = mock(Table.class);
    when(mockCatalog.loadTable(IDENTIFIER)).thenReturn(mockTable);

    IcebergTableManager tableManager = IcebergTableManager.of(CONFIGURATION);
    Table actual = tableManager.getTable(tableConfig);
    assertEquals(mockTable, actual);
    verify(mockCatalog).initialize("catalog1", OPTIONS);
  }

  @Test
  void catalogGetOrCreateWithExistingTable() {
    EventTableConfig tableConfig = catalogTableConfig("catalog2");
    Table mockTable = mock(Table.class);
    when(mockCatalog.tableExists(IDENTIFIER)).thenReturn(true);
    when(mockCatalog.loadTable(IDENTIFIER)).thenReturn(mockTable);

    IcebergTableManager tableManager = IcebergTableManager.of(CONFIGURATION);
    Table actual =
        tableManager.getOrCreateTable(
            tableConfig, SCHEMA, PARTITION_SPEC, EventTableSchema.defaultTableProperties());
    assertEquals(mockTable, actual);
    verify(mockCatalog).initialize("catalog2", OPTIONS);
    verify(mockCatalog, never()).createTable(any(), any(), any(), any(), any());
  }

  @Test
  void catalogGetOrCreateWithNewTable() {
    EventTableConfig tableConfig = catalogTableConfig("catalog3");
    when(mockCatalog.tableExists(IDENTIFIER)).thenReturn(false);
    TableMetadata emptyMetadata =
        TableMetadata.newTableMetadata(
            new Schema(), PartitionSpec.unpartitioned(), BASE_PATH, Collections.emptyMap());
    TableOperations mockOperations = mock(TableOperations.class);
    when(mockOperations.current()).thenReturn(emptyMetadata);
    BaseTable createdTable = mock(BaseTable.class);
    when(createdTable.operations()).thenReturn(mockOperations);
    when(mockCatalog.createTable(
            eq(IDENTIFIER),
            any(Schema.class),
            eq(PartitionSpec.unpartitioned()),
            eq(BASE_PATH),
            eq(Collections.emptyMap())))
        .thenReturn(createdTable);
    Table loadedTable = mock(Table.class);
    when(mockCatalog.loadTable(IDENTIFIER)).thenReturn(loadedTable);

    IcebergTableManager tableManager = IcebergTableManager.of(CONFIGURATION);
    Table actual =
        tableManager.getOrCreateTable(
            tableConfig, SCHEMA, PARTITION_SPEC, EventTableSchema.defaultTableProperties());

    assertEquals(loadedTable, actual);
    verify(mockCatalog).initialize("catalog3", OPTIONS);
    verify(mockOperations).commit(eq(emptyMetadata), any(TableMetadata.class));
  }

  @Test
  void catalogGetOrCreateWithRaceConditionOnCreation() {
    EventTableConfig tableConfig = catalogTableConfig("catalog4");
    Table mockTable = mock(Table.class);
    when(mockCatalog.tableExists(IDENTIFIER)).thenReturn(false);
    when(mockCatalog.createTable(
            eq(IDENTIFIER),
            any(Schema.class),
            eq(PartitionSpec.unpartitioned()),
            eq(BASE_PATH),
            eq(Collections.emptyMap())))
        .thenThrow(new AlreadyExistsException("Table already exists"));
    when(mockCatalog.loadTable(IDENTIFIER)).thenReturn(mockTable);

    IcebergTableManager tableManager = IcebergTableManager.of(CONFIGURATION);
    Table actual =
        tableManager.getOrCreateTable(
            tableConfig, SCHEMA, PARTITION_SPEC, EventTableSchema.defaultTableProperties());
    assertEquals(mockTable, actual);
    verify(mockCatalog).initialize("catalog4", OPTIONS);
  }

  @Test
  void hadoopTableKeepsFieldIdsAndProperties(@TempDir Path warehouse) {
    EventTableConfig tableConfig =
        EventTableConfig.builder().warehousePath(warehouse.toUri().toString()).build();
    IcebergTableManager tableManager = IcebergTableManager.of(CONFIGURATION);
    assertFalse(tableManager.tableExists(tableConfig));

    Table table =
        tableManager.getOrCreateTable(
            tableConfig, SCHEMA, PARTITION_SPEC, EventTableSchema.defaultTableProperties());

    assertTrue(tableManager.tableExists(tableConfig));
    assertTrue(SCHEMA.sameSchema(table.schema()));
    assertEquals(
        SCHEMA.findField(EventTableSchema.CREATED_AT).fieldId(),
        table.schema().findField(EventTableSchema.CREATED_AT).fieldId());
    assertEquals(1, table.spec().fields().size());
    assertEquals("created_at_month", table.spec().fields().get(0).name());
    assertEquals("full", table.properties().get("write.metadata.metrics.column.created_at"));

    // a second call loads the table created by the first
    Table reloaded =
        tableManager.getOrCreateTable(
            tableConfig, SCHEMA, PARTITION_SPEC, Collections.emptyMap());
    assertEquals(table.location(), reloaded.location());
    assertEquals("full", reloaded.properties().get("write.metadata.metrics.column.created_at"));
  }

  private EventTableConfig catalogTableConfig(String catalogName) {
    RegisteredCatalog.CATALOGS.put(catalogName, mockCatalog);
    IcebergCatalogConfig catalogConfig =
        IcebergCatalogConfig.builder()
            .catalogImpl(RegisteredCatalog.class.getName())
            .catalogName(catalogName)
            .catalogOptions(OPTIONS)
            .build();
    return EventTableConfig.builder()
        .warehousePath(WAREHOUSE_PATH)
        .database("database1")
        .tableName("table1")
        .catalogConfig(catalogConfig)
        .build();
  }

  /**
   * Instantiated by class name from the catalog config, forwards every call to the mock registered
   * under the catalog's name.
   */
  public static class RegisteredCatalog implements Catalog {
    static final Map<String, Catalog> CATALOGS = new ConcurrentHashMap<>();
    private Catalog delegate;

    @Override
    public void initialize(String name, Map<String, String> properties) {
      delegate = CATALOGS.get(name);
      delegate.initialize(name, properties);
    }

    @Override
    public List<TableIdentifier> listTables(Namespace namespace) {
      return delegate.listTables(namespace);
    }

    @Override
    public boolean dropTable(TableIdentifier identifier, boolean purge) {
      return delegate.dropTable(identifier, purge);
    }

    @Override
    public void renameTable(TableIdentifier from, TableIdentifier to) {
      delegate.renameTable(from, to);
    }

    @Override
    public boolean tableExists(TableIdentifier identifier) {
      return delegate.tableExists(identifier);
    }

    @Override
    public Table createTable(
        TableIdentifier identifier,
        Schema schema,
        PartitionSpec spec,
        String location,
        Map<String, String> properties) {
      return delegate.createTable(identifier, schema, spec, location, properties);
    }

    @Override
    public Table loadTable(TableIdentifier identifier) {
      return delegate.loadTable(identifier);
    }
  }
}
