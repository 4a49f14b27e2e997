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

package io.gharchive.iceberg.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifies exactly one hourly archive file, e.g. {@code 2020-01-01-5}. The key is the unit of
 * ingestion and the idempotency key of the table writer.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ArchiveKey implements Comparable<ArchiveKey> {
  private static final Comparator<ArchiveKey> ORDER =
      Comparator.comparing(ArchiveKey::getDate).thenComparingInt(ArchiveKey::getHour);
  public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
  public static final String FILE_SUFFIX = ".json.gz";

  @NonNull LocalDate date;
  int hour;

  public static ArchiveKey of(LocalDate date, int hour) {
    if (hour < 0 || hour > 23) {
      throw new IllegalArgumentException("Hour must be between 0 and 23, got " + hour);
    }
    return new ArchiveKey(date, hour);
  }

  /** Parses the archive's own notation {@code yyyy-MM-dd-H}. */
  public static ArchiveKey parse(String value) {
    int separator = value == null ? -1 : value.lastIndexOf('-');
    if (separator != 10) {
      throw new IllegalArgumentException("Invalid archive key: " + value);
    }
    try {
      return of(
          LocalDate.parse(value.substring(0, separator), DATE_FORMAT),
          Integer.parseInt(value.substring(separator + 1)));
    } catch (DateTimeParseException | NumberFormatException e) {
      throw new IllegalArgumentException("Invalid archive key: " + value, e);
    }
  }

  /** The key of the archive hour that contains the given instant (UTC). */
  public static ArchiveKey containing(Instant instant) {
    LocalDateTime utc = LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    return of(utc.toLocalDate(), utc.getHour());
  }

  public ArchiveKey next() {
    return hour == 23 ? of(date.plusDays(1), 0) : of(date, hour + 1);
  }

  public ArchiveKey previous() {
    return hour == 0 ? of(date.minusDays(1), 23) : of(date, hour - 1);
  }

  public Instant startInstant() {
    return date.atTime(hour, 0).toInstant(ZoneOffset.UTC);
  }

  public Instant endInstant() {
    return startInstant().plus(1, ChronoUnit.HOURS);
  }

  public String dateString() {
    return DATE_FORMAT.format(date);
  }

  /** File name in the archive, the hour is written without a leading zero. */
  public String fileName() {
    return this + FILE_SUFFIX;
  }

  @Override
  public int compareTo(ArchiveKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return dateString() + "-" + hour;
  }
}
