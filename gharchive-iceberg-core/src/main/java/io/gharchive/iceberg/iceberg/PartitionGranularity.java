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

import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;

/** Granularity of the {@code created_at} partitions of the event table. */
public enum PartitionGranularity {
  MONTH {
    @Override
    PartitionSpec.Builder apply(PartitionSpec.Builder builder, String column) {
      return builder.month(column);
    }
  },
  DAY {
    @Override
    PartitionSpec.Builder apply(PartitionSpec.Builder builder, String column) {
      return builder.day(column);
    }
  },
  HOUR {
    @Override
    PartitionSpec.Builder apply(PartitionSpec.Builder builder, String column) {
      return builder.hour(column);
    }
  };

  abstract PartitionSpec.Builder apply(PartitionSpec.Builder builder, String column);

  public PartitionSpec partitionSpec(Schema schema, String column) {
    return apply(PartitionSpec.builderFor(schema), column).build();
  }
}
