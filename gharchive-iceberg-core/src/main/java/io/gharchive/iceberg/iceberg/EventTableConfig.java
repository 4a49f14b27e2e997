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

import java.util.Collections;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import org.apache.iceberg.catalog.Namespace;
import org.apache.iceberg.catalog.TableIdentifier;

/** Location and layout of the event table. */
@Value
@Builder(toBuilder = true)
public class EventTableConfig {
  public static final String DEFAULT_DATABASE = "db";
  public static final String DEFAULT_TABLE_NAME = "github_events";

  // root of the warehouse, e.g. s3a://bucket/iceberg or file:///tmp/warehouse
  @NonNull String warehousePath;
  @NonNull @Builder.Default String database = DEFAULT_DATABASE;
  @NonNull @Builder.Default String tableName = DEFAULT_TABLE_NAME;
  @NonNull @Builder.Default PartitionGranularity partitionGranularity = PartitionGranularity.MONTH;
  // optional, the table is a Hadoop table at getBasePath() when absent
  IcebergCatalogConfig catalogConfig;
  // applied when the table is created
  @NonNull @Builder.Default Map<String, String> tableProperties = Collections.emptyMap();

  public TableIdentifier getTableIdentifier() {
    return TableIdentifier.of(Namespace.of(database), tableName);
  }

  /** Same layout as a Hadoop catalog rooted at the warehouse. */
  public String getBasePath() {
    String root =
        warehousePath.endsWith("/")
            ? warehousePath.substring(0, warehousePath.length() - 1)
            : warehousePath;
    return root + "/" + database + "/" + tableName;
  }
}
