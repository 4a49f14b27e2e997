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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.gharchive.iceberg.ArchiveFixtures;
import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.exception.ErrorCode;
import io.gharchive.iceberg.model.exception.FetchException;
import io.gharchive.iceberg.spi.ArchiveReader;

public class TestHttpArchiveSource {
  // one day after KEY, long past its publication delay
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2020-01-02T05:00:00Z"), ZoneOffset.UTC);

  @TempDir Path downloadDirectory;
  private HttpServer server;
  private final Map<String, byte[]> archives = new ConcurrentHashMap<>();
  private final AtomicInteger failuresBeforeSuccess = new AtomicInteger();
  private final AtomicInteger requests = new AtomicInteger();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::handle);
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void downloadsAndDecodesArchive() throws IOException {
    archives.put("/" + KEY.fileName(), ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines()));
    HttpArchiveSource source = source(CLOCK);
    assertEquals(baseUrl() + "/2020-01-01-5.json.gz", source.locationOf(KEY));
    try (ArchiveReader reader = source.open(KEY)) {
      assertEquals(2, reader.events().count());
      assertEquals(1, reader.getSkippedLines());
      assertEquals(1, countDownloads());
    }
    assertEquals(0, countDownloads());
  }

  @Test
  void retriesServerErrors() throws IOException {
    archives.put("/" + KEY.fileName(), ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines()));
    failuresBeforeSuccess.set(2);
    try (ArchiveReader reader = source(CLOCK).open(KEY)) {
      assertEquals(2, reader.events().count());
    }
    assertEquals(3, requests.get());
  }

  @Test
  void givesUpAfterMaxRetries() throws IOException {
    archives.put("/" + KEY.fileName(), ArchiveFixtures.gzip(ArchiveFixtures.firstHourLines()));
    failuresBeforeSuccess.set(5);
    FetchException exception = assertThrows(FetchException.class, () -> source(CLOCK).open(KEY));
    assertEquals(ErrorCode.FETCH_EXCEPTION, exception.getErrorCode());
    assertTrue(exception.isRetryable());
    assertEquals(3, requests.get());
    assertEquals(0, countDownloads());
  }

  @Test
  void missingPastArchive() throws IOException {
    FetchException exception = assertThrows(FetchException.class, () -> source(CLOCK).open(KEY));
    assertFalse(exception.isNotYetPublished());
    assertEquals(ErrorCode.FETCH_EXCEPTION, exception.getErrorCode());
    assertEquals(1, requests.get());
    assertEquals(0, countDownloads());
  }

  @Test
  void missingRecentArchiveIsNotYetPublished() {
    Clock shortlyAfter = Clock.fixed(KEY.endInstant().plusSeconds(600), ZoneOffset.UTC);
    FetchException exception =
        assertThrows(FetchException.class, () -> source(shortlyAfter).open(KEY));
    assertTrue(exception.isNotYetPublished());
    assertEquals(ErrorCode.ARCHIVE_NOT_PUBLISHED, exception.getErrorCode());
  }

  @Test
  void publicationDelay() {
    HttpArchiveSource source =
        HttpArchiveSource.builder()
            .publicationDelay(Duration.ofHours(2))
            .clock(Clock.fixed(Instant.parse("2020-01-01T07:30:00Z"), ZoneOffset.UTC))
            .build();
    assertTrue(source.isRecent(KEY));
    assertTrue(source.isRecent(ArchiveKey.parse("2020-01-01-6")));
    assertFalse(source.isRecent(ArchiveKey.parse("2020-01-01-4")));
  }

  private HttpArchiveSource source(Clock clock) {
    return HttpArchiveSource.builder()
        .baseUrl(baseUrl() + "/")
        .retryDelay(Duration.ofMillis(1))
        .maxRetries(3)
        .downloadDirectory(downloadDirectory)
        .clock(clock)
        .build();
  }

  private String baseUrl() {
    return "http://localhost:" + server.getAddress().getPort();
  }

  private long countDownloads() throws IOException {
    try (Stream<Path> files = Files.list(downloadDirectory)) {
      return files.count();
    }
  }

  private void handle(HttpExchange exchange) throws IOException {
    requests.incrementAndGet();
    byte[] body = archives.get(exchange.getRequestURI().getPath());
    if (body == null) {
      exchange.sendResponseHeaders(404, -1);
    } else if (failuresBeforeSuccess.getAndDecrement() > 0) {
      exchange.sendResponseHeaders(503, -1);
    } else {
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    }
    exchange.close();
  }
}
