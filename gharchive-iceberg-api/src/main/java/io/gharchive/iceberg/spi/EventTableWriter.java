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

package io.gharchive.iceberg.spi;

import java.util.List;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.NormalizedRow;
import io.gharchive.iceberg.model.ingest.CommitSummary;

/** Commits the rows of one archive hour to the target table. */
public interface EventTableWriter {

  /**
   * Commits the batch atomically: after a successful return all rows are visible in the table's
   * latest snapshot, after an exception none are. Committing the same key again replaces the rows
   * previously committed for it.
   *
   * @throws io.gharchive.iceberg.model.exception.WriteException if the commit was rejected
   */
  CommitSummary commit(ArchiveKey archiveKey, List<NormalizedRow> rows, long skippedLines);
}
