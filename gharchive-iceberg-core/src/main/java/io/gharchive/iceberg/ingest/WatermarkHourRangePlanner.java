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

import java.time.Instant;
import java.util.Optional;

import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.spi.HourRangePlanner;
import io.gharchive.iceberg.spi.IngestionWatermark;

/**
 * Resumes after the hour that holds the latest ingested event. An empty table starts at the
 * configured key.
 */
@Log4j2
@AllArgsConstructor(staticName = "of")
public class WatermarkHourRangePlanner implements HourRangePlanner {
  private final IngestionWatermark watermark;
  private final ArchiveKey startKey;

  @Override
  public ArchiveKey nextUnprocessedHour() {
    Optional<Instant> latest = watermark.latestIngestedTimestamp();
    if (!latest.isPresent()) {
      log.info("Table holds no events, starting at {}", startKey);
      return startKey;
    }
    ArchiveKey next = ArchiveKey.containing(latest.get()).next();
    log.info("Latest ingested event at {}, resuming at {}", latest.get(), next);
    return next;
  }
}
