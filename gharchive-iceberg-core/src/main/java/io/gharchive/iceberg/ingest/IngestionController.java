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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import lombok.AllArgsConstructor;
import lombok.extern.log4j.Log4j2;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.ingest.IngestResult;
import io.gharchive.iceberg.spi.HourRangePlanner;

/**
 * Drives {@link HourIngestor} over a range of archive hours. The range starts at the planner's next
 * unprocessed hour and ends before {@code endKey}. Hours are processed in order, in batches of the
 * configured parallelism, and the run stops after the batch holding the first failure unless
 * configured otherwise.
 */
@Log4j2
@AllArgsConstructor(staticName = "of")
public class IngestionController {
  private final HourIngestor hourIngestor;

  public List<IngestResult> run(
      HourRangePlanner planner, ArchiveKey endKey, IngestionRunConfig config) {
    Preconditions.checkArgument(config.getParallelism() > 0, "parallelism must be positive");
    List<ArchiveKey> keys = plan(planner, endKey);
    if (keys.isEmpty()) {
      log.info("Nothing to ingest before {}", endKey);
      return new ArrayList<>();
    }
    log.info("Planned {} hours from {} to {} (exclusive)", keys.size(), keys.get(0), endKey);
    if (config.isDryRun()) {
      keys.forEach(key -> log.info("Dry run, would ingest {}", key));
      return keys.stream().map(IngestResult::skipped).collect(Collectors.toList());
    }
    List<IngestResult> results =
        config.getParallelism() == 1
            ? runSequentially(keys, config.isStopOnFailure())
            : runInParallel(keys, config);
    long failed = results.stream().filter(result -> !result.isSuccess()).count();
    if (failed > 0) {
      log.error("{} of {} ingested hours failed", failed, results.size());
    } else {
      log.info("Ingested {} hours", results.size());
    }
    return results;
  }

  /** Ingests the 24 hours of the given day. */
  public List<IngestResult> ingestDay(LocalDate date, IngestionRunConfig config) {
    ArchiveKey start = ArchiveKey.of(date, 0);
    return run(FixedHourRangePlanner.of(start), ArchiveKey.of(date.plusDays(1), 0), config);
  }

  static List<ArchiveKey> plan(HourRangePlanner planner, ArchiveKey endKey) {
    List<ArchiveKey> keys = new ArrayList<>();
    ArchiveKey key = planner.nextUnprocessedHour();
    while (planner.isBeforeEnd(key, endKey)) {
      keys.add(key);
      key = key.next();
    }
    return keys;
  }

  private List<IngestResult> runSequentially(List<ArchiveKey> keys, boolean stopOnFailure) {
    List<IngestResult> results = new ArrayList<>();
    for (ArchiveKey key : keys) {
      IngestResult result = hourIngestor.ingestHour(key);
      results.add(result);
      if (!result.isSuccess() && stopOnFailure) {
        log.warn("Stopping at failed hour {}", key);
        break;
      }
    }
    return results;
  }

  private List<IngestResult> runInParallel(List<ArchiveKey> keys, IngestionRunConfig config) {
    ExecutorService executor =
        Executors.newFixedThreadPool(
            config.getParallelism(),
            new ThreadFactoryBuilder().setNameFormat("ingest-hour-%d").setDaemon(true).build());
    List<IngestResult> results = new ArrayList<>();
    try {
      for (int from = 0; from < keys.size(); from += config.getParallelism()) {
        List<Future<IngestResult>> batch = new ArrayList<>();
        int to = Math.min(keys.size(), from + config.getParallelism());
        for (ArchiveKey key : keys.subList(from, to)) {
          batch.add(executor.submit(() -> hourIngestor.ingestHour(key)));
        }
        boolean batchFailed = false;
        for (Future<IngestResult> future : batch) {
          IngestResult result = await(future);
          results.add(result);
          batchFailed |= !result.isSuccess();
        }
        if (batchFailed && config.isStopOnFailure()) {
          log.warn("Stopping after failed batch ending at {}", keys.get(to - 1));
          break;
        }
      }
    } finally {
      executor.shutdownNow();
    }
    return results;
  }

  private static IngestResult await(Future<IngestResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while ingesting", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Unexpected failure while ingesting", e.getCause());
    }
  }
}
