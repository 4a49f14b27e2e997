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

import io.gharchive.iceberg.model.ArchiveKey;

/** Retrieves hourly archives and decodes them into raw events. */
public interface ArchiveSource {

  /**
   * Opens the archive of the given hour. The returned reader must be closed by the caller.
   *
   * @throws io.gharchive.iceberg.model.exception.FetchException if the hour does not exist or the
   *     transfer failed
   * @throws io.gharchive.iceberg.model.exception.DecodeException if the archive is not a valid
   *     compressed stream
   */
  ArchiveReader open(ArchiveKey archiveKey);

  /** Human readable location of the archive, used in logs and error messages. */
  String locationOf(ArchiveKey archiveKey);
}
