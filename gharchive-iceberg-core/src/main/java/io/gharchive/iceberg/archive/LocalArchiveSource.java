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

package io.gharchive.iceberg.archive;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.NonNull;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.exception.FetchException;
import io.gharchive.iceberg.spi.ArchiveReader;
import io.gharchive.iceberg.spi.ArchiveSource;

/** Reads archives from a local directory that mirrors the archive's file names. */
@AllArgsConstructor(staticName = "of")
public class LocalArchiveSource implements ArchiveSource {
  @NonNull private final Path directory;

  @Override
  public ArchiveReader open(ArchiveKey archiveKey) {
    Path file = directory.resolve(archiveKey.fileName());
    InputStream inputStream;
    try {
      inputStream = Files.newInputStream(file);
    } catch (NoSuchFileException e) {
      throw FetchException.notFound(archiveKey, file.toString());
    } catch (IOException e) {
      throw new FetchException(archiveKey, "Failed to open archive " + file, e);
    }
    return new ArchiveLineReader(archiveKey, file.toString(), inputStream, () -> {});
  }

  @Override
  public String locationOf(ArchiveKey archiveKey) {
    return directory.resolve(archiveKey.fileName()).toString();
  }
}
