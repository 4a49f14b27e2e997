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

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

import org.apache.iceberg.PartitionField;
import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Transaction;
import org.apache.iceberg.UpdatePartitionSpec;
import org.apache.iceberg.expressions.Expressions;

/** Evolves the partition spec of an existing table, e.g. from monthly to daily partitions. */
@Log4j2
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class IcebergPartitionSpecSync {
  private static final IcebergPartitionSpecSync INSTANCE = new IcebergPartitionSpecSync();

  public static IcebergPartitionSpecSync getInstance() {
    return INSTANCE;
  }

  public boolean needsSync(PartitionSpec current, PartitionSpec latest) {
    return !fieldNames(current.fields()).equals(fieldNames(latest.fields()));
  }

  public void sync(PartitionSpec current, PartitionSpec latest, Transaction transaction) {
    if (!needsSync(current, latest)) {
      return;
    }
    log.info("Evolving partition spec from {} to {}", current, latest);
    UpdatePartitionSpec updateSpec = transaction.updateSpec();
    Set<String> currentFieldNames = fieldNames(current.fields());
    Set<String> latestFieldNames = fieldNames(latest.fields());
    for (PartitionField field : current.fields()) {
      if (!latestFieldNames.contains(field.name())) {
        updateSpec.removeField(field.name());
      }
    }
    for (PartitionField field : latest.fields()) {
      if (!currentFieldNames.contains(field.name())) {
        String sourceName = latest.schema().findColumnName(field.sourceId());
        updateSpec.addField(field.name(), Expressions.transform(sourceName, field.transform()));
      }
    }
    updateSpec.commit();
  }

  private static Set<String> fieldNames(List<PartitionField> fields) {
    return fields.stream().map(PartitionField::name).collect(Collectors.toSet());
  }
}
