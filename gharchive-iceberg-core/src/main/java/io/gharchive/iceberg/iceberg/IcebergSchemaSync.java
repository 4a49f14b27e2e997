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

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.iceberg.Schema;
import org.apache.iceberg.Transaction;
import org.apache.iceberg.UpdateSchema;
import org.apache.iceberg.types.Types;

/**
 * Brings the schema of an existing table up to date. Columns missing from the table are added as
 * optional columns in the order of the latest schema, rows committed before the change read them
 * as null. Columns the table has and the latest schema lacks are kept.
 */
@Log4j2
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class IcebergSchemaSync {
  private static final IcebergSchemaSync INSTANCE = new IcebergSchemaSync();

  public static IcebergSchemaSync getInstance() {
    return INSTANCE;
  }

  public boolean needsSync(Schema current, Schema latest) {
    return !missingColumns(current, latest).isEmpty();
  }

  public void sync(Schema current, Schema latest, Transaction transaction) {
    List<Types.NestedField> missing = missingColumns(current, latest);
    if (missing.isEmpty()) {
      return;
    }
    UpdateSchema updateSchema = transaction.updateSchema();
    for (Types.NestedField column : missing) {
      log.info("Adding column {} of type {}", column.name(), column.type());
      updateSchema.addColumn(column.name(), column.type(), column.doc());
    }
    updateSchema.commit();
  }

  private static List<Types.NestedField> missingColumns(Schema current, Schema latest) {
    return latest.columns().stream()
        .filter(column -> current.findField(column.name()) == null)
        // execute updates in order
        .sorted(Comparator.comparingInt(Types.NestedField::fieldId))
        .collect(Collectors.toList());
  }
}
