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

import lombok.Builder;
import lombok.Value;

/** Options of one {@link IngestionController} run. */
@Value
@Builder
public class IngestionRunConfig {
  // only report the hours that would be ingested
  @Builder.Default boolean dryRun = false;
  // number of hours ingested concurrently
  @Builder.Default int parallelism = 1;
  // stop at the first failed hour so that the watermark never skips a gap
  @Builder.Default boolean stopOnFailure = true;

  public static IngestionRunConfig defaults() {
    return IngestionRunConfig.builder().build();
  }
}
