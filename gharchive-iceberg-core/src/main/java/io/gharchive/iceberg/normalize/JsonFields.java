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

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.databind.JsonNode;

import io.gharchive.iceberg.model.NormalizedRow;

/**
 * Lenient typed reads from loosely typed JSON. Every method returns the schema default for its type
 * when the node is missing, null or of an unexpected type, none of them throws.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class JsonFields {
  // 2012/03/10 14:23:54 -0800, used by the archive until 2014
  private static final DateTimeFormatter LEGACY_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss Z");

  private static final List<DateTimeFormatter> TIMESTAMP_FORMATS =
      Arrays.asList(DateTimeFormatter.ISO_OFFSET_DATE_TIME, LEGACY_TIMESTAMP);

  // timestamps are stored as microseconds since the epoch in a long
  private static final long MAX_EPOCH_SECOND = Long.MAX_VALUE / 1_000_000L - 1;

  static boolean isPresent(JsonNode node) {
    return node != null && !node.isMissingNode() && !node.isNull();
  }

  static String text(JsonNode node) {
    if (!isPresent(node) || node.isContainerNode()) {
      return "";
    }
    return node.asText();
  }

  /** Text of an enumerated attribute such as an action or a state. */
  static String enumText(JsonNode node) {
    String value = text(node);
    return value.isEmpty() ? NormalizedRow.UNKNOWN : value;
  }

  static long longValue(JsonNode node) {
    if (!isPresent(node)) {
      return 0L;
    }
    if (node.isNumber()) {
      return node.asLong();
    }
    if (node.isTextual()) {
      try {
        return Long.parseLong(node.asText().trim());
      } catch (NumberFormatException e) {
        return 0L;
      }
    }
    return 0L;
  }

  static int intValue(JsonNode node) {
    long value = longValue(node);
    if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
      return 0;
    }
    return (int) value;
  }

  static boolean bool(JsonNode node) {
    if (!isPresent(node)) {
      return false;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isNumber()) {
      return node.asLong() != 0L;
    }
    return node.isTextual() && Boolean.parseBoolean(node.asText().trim());
  }

  /**
   * Reads ISO-8601 timestamps with an offset, the legacy archive format and epoch seconds. The
   * result is in UTC with millisecond precision. Values the table can not store as microseconds
   * are treated like unparseable ones.
   */
  static OffsetDateTime timestamp(JsonNode node) {
    if (!isPresent(node)) {
      return NormalizedRow.EPOCH;
    }
    if (node.isNumber()) {
      if (!node.canConvertToLong() || !isStorable(node.asLong())) {
        return NormalizedRow.EPOCH;
      }
      return toUtcMillis(Instant.ofEpochSecond(node.asLong()));
    }
    if (!node.isTextual()) {
      return NormalizedRow.EPOCH;
    }
    String value = node.asText().trim();
    for (DateTimeFormatter format : TIMESTAMP_FORMATS) {
      OffsetDateTime parsed = parse(value, format);
      if (parsed != null) {
        return isStorable(parsed.toEpochSecond()) ? toUtcMillis(parsed) : NormalizedRow.EPOCH;
      }
    }
    return NormalizedRow.EPOCH;
  }

  /** Collects a text attribute of every element of an array, e.g. the names of labels. */
  static List<String> textList(JsonNode array, String attribute) {
    if (!isPresent(array) || !array.isArray() || array.size() == 0) {
      return Collections.emptyList();
    }
    List<String> values = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      String value = element.isObject() ? text(element.get(attribute)) : text(element);
      if (!value.isEmpty()) {
        values.add(value);
      }
    }
    return Collections.unmodifiableList(values);
  }

  static String json(JsonNode node) {
    return isPresent(node) ? node.toString() : "";
  }

  private static OffsetDateTime parse(String value, DateTimeFormatter format) {
    try {
      return OffsetDateTime.parse(value, format);
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static boolean isStorable(long epochSecond) {
    return epochSecond >= -MAX_EPOCH_SECOND && epochSecond <= MAX_EPOCH_SECOND;
  }

  private static OffsetDateTime toUtcMillis(Instant instant) {
    return OffsetDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MILLIS), ZoneOffset.UTC);
  }

  private static OffsetDateTime toUtcMillis(OffsetDateTime dateTime) {
    return toUtcMillis(dateTime.toInstant());
  }
}
