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

import java.io.Closeable;
import java.util.stream.Stream;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.RawEvent;

/** An opened archive hour. */
public interface ArchiveReader extends Closeable {

  ArchiveKey getArchiveKey();

  /**
   * The events of the archive in file order. The stream is lazy and can be consumed only once.
   * Malformed lines are skipped and counted in {@link #getSkippedLines()}.
   *
   * @throws io.gharchive.iceberg.model.exception.DecodeException from the terminal operation if
   *     the compressed stream is corrupt
   */
  Stream<RawEvent> events();

  /** Number of malformed lines dropped so far. */
  long getSkippedLines();

  @Override
  void close();
}
