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

import static io.gharchive.iceberg.ArchiveFixtures.KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.zip.GZIPInputStream;

import org.junit.jupiter.api.Test;

import io.gharchive.iceberg.ArchiveFixtures;
import io.gharchive.iceberg.model.EventKind;
import io.gharchive.iceberg.model.RawEvent;
import io.gharchive.iceberg.model.exception.DecodeException;

public class TestArchiveLineReader {

  @Test
  void skipsMalformedLines() {
    ArchiveLineReader reader = reader(ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines()));
    List<RawEvent> events = reader.events().collect(Collectors.toList());
    assertEquals(2, events.size());
    assertEquals(EventKind.WATCH, events.get(0).getKind());
    assertEquals(1, events.get(0).getLineNumber());
    assertEquals(EventKind.PUSH, events.get(1).getKind());
    assertEquals(1, reader.getSkippedLines());
  }

  @Test
  void skipsBlankLinesAndNonObjects() {
    byte[] archive =
        ArchiveFixtures.gzip(
            Arrays.asList("", ArchiveFixtures.WATCH_EVENT, "   ", "[1,2]", "\"text\""));
    ArchiveLineReader reader = reader(archive);
    List<RawEvent> events = reader.events().collect(Collectors.toList());
    assertEquals(1, events.size());
    assertEquals(2, events.get(0).getLineNumber());
    assertEquals(2, reader.getSkippedLines());
  }

  @Test
  void emptyArchive() {
    ArchiveLineReader reader = reader(ArchiveFixtures.gzip(Arrays.asList()));
    assertEquals(0, reader.events().count());
    assertEquals(0, reader.getSkippedLines());
  }

  @Test
  void truncatedArchiveKeepsEventsReadSoFar() {
    byte[] archive =
        ArchiveFixtures.gzip(
            Arrays.asList(ArchiveFixtures.WATCH_EVENT, ArchiveFixtures.PUSH_EVENT));
    // drop the trailer
    byte[] truncated = Arrays.copyOf(archive, archive.length - 4);
    ArchiveLineReader reader = reader(truncated);
    assertEquals(2, reader.events().count());
    assertEquals(0, reader.getSkippedLines());
  }

  @Test
  void archiveCutMidStreamKeepsEveryCompleteLine() throws IOException {
    List<String> lines =
        IntStream.range(0, 2000)
            .mapToObj(i -> ArchiveFixtures.WATCH_EVENT.replace("11000000001", "1100000" + i))
            .collect(Collectors.toList());
    byte[] archive = ArchiveFixtures.gzip(lines);
    byte[] truncated = Arrays.copyOf(archive, archive.length * 2 / 3);
    long completeLines = completeLinesBeforeCut(truncated);

    ArchiveLineReader reader = reader(truncated);
    List<RawEvent> events = reader.events().collect(Collectors.toList());
    assertTrue(completeLines > 0 && completeLines < lines.size());
    assertEquals(completeLines, events.size());
    assertEquals(completeLines, events.get(events.size() - 1).getLineNumber());
    assertTrue(reader.getSkippedLines() <= 1);
  }

  @Test
  void corruptArchiveFails() {
    byte[] archive = ArchiveFixtures.gzip(Arrays.asList(ArchiveFixtures.WATCH_EVENT));
    // the crc is the first word of the trailer
    archive[archive.length - 8] ^= 0xFF;
    ArchiveLineReader reader = reader(archive);
    DecodeException exception =
        assertThrows(DecodeException.class, () -> reader.events().count());
    assertEquals(KEY, exception.getArchiveKey());
  }

  @Test
  void notGzip() {
    byte[] plain = ArchiveFixtures.WATCH_EVENT.getBytes(StandardCharsets.UTF_8);
    AtomicInteger closed = new AtomicInteger();
    assertThrows(
        DecodeException.class,
        () ->
            new ArchiveLineReader(
                KEY, "memory", new ByteArrayInputStream(plain), closed::incrementAndGet));
    assertEquals(1, closed.get());
  }

  @Test
  void eventsCanOnlyBeReadOnce() {
    ArchiveLineReader reader = reader(ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines()));
    reader.events().count();
    assertThrows(IllegalStateException.class, reader::events);
  }

  @Test
  void closeRunsCleanupOnce() {
    AtomicInteger closed = new AtomicInteger();
    ArchiveLineReader reader =
        new ArchiveLineReader(
            KEY,
            "memory",
            new ByteArrayInputStream(ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines())),
            closed::incrementAndGet);
    reader.events().close();
    reader.close();
    assertEquals(1, closed.get());
  }

  @Test
  void parsesLazily() {
    ArchiveLineReader reader = reader(ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines()));
    assertTrue(reader.events().findFirst().isPresent());
    // the malformed third line was never reached
    assertEquals(0, reader.getSkippedLines());
  }

  private static long completeLinesBeforeCut(byte[] truncated) throws IOException {
    long newlines = 0;
    byte[] buffer = new byte[4096];
    try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(truncated))) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        for (int i = 0; i < read; i++) {
          if (buffer[i] == '\n') {
            newlines++;
          }
        }
      }
    } catch (EOFException e) {
      // expected, the archive is cut off
    }
    return newlines;
  }

  private static ArchiveLineReader reader(byte[] archive) {
    return new ArchiveLineReader(KEY, "memory", new ByteArrayInputStream(archive), () -> {});
  }
}
