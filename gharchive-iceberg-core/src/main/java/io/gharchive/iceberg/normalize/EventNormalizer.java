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

package io.gharchive.iceberg.normalize;

import static io.gharchive.iceberg.normalize.JsonFields.isPresent;
import static io.gharchive.iceberg.normalize.JsonFields.json;
import static io.gharchive.iceberg.normalize.JsonFields.text;
import static io.gharchive.iceberg.normalize.JsonFields.timestamp;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.log4j.Log4j2;

import com.fasterxml.jackson.databind.JsonNode;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.EventKind;
import io.gharchive.iceberg.model.NormalizedRow;
import io.gharchive.iceberg.model.RawEvent;

/**
 * Maps raw events of any kind onto {@link NormalizedRow}. Identity fields are read the same way for
 * every kind, including the pre-2015 archive layout; the kind specific fields come from the kind's
 * {@link PayloadExtractor}. Normalization never fails, events of kinds without a mapping keep all
 * kind specific fields at their defaults.
 */
@Log4j2
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class EventNormalizer {
  private static final EventNormalizer INSTANCE = new EventNormalizer();

  public static EventNormalizer getInstance() {
    return INSTANCE;
  }

  public NormalizedRow normalize(RawEvent event, ArchiveKey archiveKey) {
    EventKind kind = event.getKind();
    if (kind == EventKind.UNKNOWN) {
      log.debug(
          "No payload mapping for event type {} on line {}",
          event.getType(),
          event.getLineNumber());
    }
    try {
      NormalizedRow.NormalizedRowBuilder row = identity(event, archiveKey);
      PayloadExtractors.forKind(kind).extract(event, row);
      return row.build();
    } catch (RuntimeException e) {
      log.warn(
          "Failed to map {} on line {}, keeping defaults",
          event.getType(),
          event.getLineNumber(),
          e);
      return bookkeeping(event, archiveKey).build();
    }
  }

  /** Fields that are read without interpreting the event, they can not fail. */
  private static NormalizedRow.NormalizedRowBuilder bookkeeping(
      RawEvent event, ArchiveKey archiveKey) {
    String type = event.getType();
    return NormalizedRow.builder()
        .id(text(event.at("/id")))
        .eventType(type == null || type.isEmpty() ? NormalizedRow.UNKNOWN : type)
        .archiveDate(archiveKey.dateString())
        .archiveHour(archiveKey.getHour())
        .fileTime(OffsetDateTime.ofInstant(archiveKey.startInstant(), ZoneOffset.UTC))
        .payload(json(event.at("/payload")));
  }

  private static NormalizedRow.NormalizedRowBuilder identity(
      RawEvent event, ArchiveKey archiveKey) {
    return bookkeeping(event, archiveKey)
        .actorLogin(actorLogin(event))
        .repoName(repoName(event))
        .createdAt(timestamp(event.at("/created_at")));
  }

  private static String actorLogin(RawEvent event) {
    JsonNode actor = event.at("/actor");
    if (actor.isObject()) {
      return text(actor.get("login"));
    }
    if (isPresent(actor)) {
      // archive layout before 2015, the actor is a plain login
      return text(actor);
    }
    return text(event.at("/actor_attributes/login"));
  }

  private static String repoName(RawEvent event) {
    String name = text(event.at("/repo/name"));
    if (!name.isEmpty()) {
      return name;
    }
    JsonNode repository = event.at("/repository");
    String owner = text(repository.at("/owner"));
    String repositoryName = text(repository.at("/name"));
    if (!owner.isEmpty() && !repositoryName.isEmpty()) {
      return owner + "/" + repositoryName;
    }
    return repositoryName;
  }
}
