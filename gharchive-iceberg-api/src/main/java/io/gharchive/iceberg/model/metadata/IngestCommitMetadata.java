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

package io.gharchive.iceberg.model.metadata;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.exception.ParseException;

/**
 * Metadata describing the ingestion that produced a snapshot. This metadata is stored in the
 * summary of every snapshot committed by the writer and lets operators trace a snapshot back to the
 * archive hour it came from.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IngestCommitMetadata {
  private static final int CURRENT_VERSION = 0;
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
          .setSerializationInclusion(JsonInclude.Include.NON_NULL);

  /** Property name of the metadata in the snapshot summary. */
  public static final String INGEST_METADATA = "GHARCHIVE_INGEST_METADATA";

  String archiveKey;
  long recordCount;
  long skippedLines;
  Instant ingestedAt;
  int version;

  // for jackson
  private IngestCommitMetadata() {
    this(null, 0L, 0L, null, CURRENT_VERSION);
  }

  public static IngestCommitMetadata of(
      ArchiveKey archiveKey, long recordCount, long skippedLines, Instant ingestedAt) {
    return new IngestCommitMetadata(
        archiveKey.toString(), recordCount, skippedLines, ingestedAt, CURRENT_VERSION);
  }

  public ArchiveKey archiveKey() {
    return ArchiveKey.parse(archiveKey);
  }

  public String toJson() {
    try {
      return MAPPER.writeValueAsString(this);
    } catch (IOException e) {
      throw new ParseException("Failed to serialize IngestCommitMetadata", e);
    }
  }

  public static Optional<IngestCommitMetadata> fromJson(String metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return Optional.empty();
    }
    try {
      IngestCommitMetadata parsed = MAPPER.readValue(metadata, IngestCommitMetadata.class);
      if (parsed.getArchiveKey() == null) {
        throw new ParseException("archiveKey is required in IngestCommitMetadata");
      }
      if (parsed.getVersion() > CURRENT_VERSION) {
        throw new ParseException(
            "Unable handle metadata version: "
                + parsed.getVersion()
                + " max supported version: "
                + CURRENT_VERSION);
      }
      return Optional.of(parsed);
    } catch (IOException e) {
      throw new ParseException("Failed to deserialize IngestCommitMetadata", e);
    }
  }
}
