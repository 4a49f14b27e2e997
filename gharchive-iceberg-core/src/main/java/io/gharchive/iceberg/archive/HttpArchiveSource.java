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
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;

import lombok.Builder;
import lombok.NonNull;
import lombok.extern.log4j.Log4j2;

import com.google.common.annotations.VisibleForTesting;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.exception.FetchException;
import io.gharchive.iceberg.spi.ArchiveReader;
import io.gharchive.iceberg.spi.ArchiveSource;

/**
 * Downloads archives from the public GH Archive endpoint, {@code
 * https://data.gharchive.org/2020-01-01-5.json.gz}. Each hour is downloaded into a temporary file
 * first so that a failed transfer is never mistaken for a corrupt archive; the file is deleted when
 * the reader is closed.
 */
@Log4j2
public class HttpArchiveSource implements ArchiveSource {
  public static final String DEFAULT_BASE_URL = "https://data.gharchive.org";

  private final HttpClient httpClient;
  private final String baseUrl;
  private final Duration requestTimeout;
  private final Duration publicationDelay;
  private final int maxRetries;
  private final Duration retryDelay;
  private final Path downloadDirectory;
  private final Clock clock;

  @Builder
  private HttpArchiveSource(
      HttpClient httpClient,
      String baseUrl,
      Duration connectTimeout,
      Duration requestTimeout,
      Duration publicationDelay,
      Integer maxRetries,
      Duration retryDelay,
      Path downloadDirectory,
      Clock clock) {
    this.httpClient =
        httpClient != null
            ? httpClient
            : HttpClient.newBuilder()
                .connectTimeout(connectTimeout != null ? connectTimeout : Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    String url = baseUrl != null ? baseUrl : DEFAULT_BASE_URL;
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofMinutes(5);
    this.publicationDelay = publicationDelay != null ? publicationDelay : Duration.ofHours(2);
    this.maxRetries = maxRetries != null ? Math.max(1, maxRetries) : 3;
    this.retryDelay = retryDelay != null ? retryDelay : Duration.ofSeconds(2);
    this.downloadDirectory = downloadDirectory;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  @Override
  public String locationOf(ArchiveKey archiveKey) {
    return baseUrl + "/" + archiveKey.fileName();
  }

  @Override
  public ArchiveReader open(@NonNull ArchiveKey archiveKey) {
    String location = locationOf(archiveKey);
    Path download = createDownloadFile(archiveKey);
    boolean handedOver = false;
    try {
      int statusCode = download(archiveKey, location, download);
      if (statusCode == 404) {
        throw isRecent(archiveKey)
            ? FetchException.notYetPublished(archiveKey, location)
            : FetchException.notFound(archiveKey, location);
      }
      if (statusCode != 200) {
        throw FetchException.failed(
            archiveKey, "Unexpected HTTP status " + statusCode + " for " + location);
      }
      log.info("Downloaded {} ({} bytes)", location, Files.size(download));
      InputStream inputStream = Files.newInputStream(download);
      handedOver = true;
      return new ArchiveLineReader(archiveKey, location, inputStream, () -> delete(download));
    } catch (IOException e) {
      throw new FetchException(archiveKey, "Failed to read downloaded archive " + location, e);
    } finally {
      if (!handedOver) {
        delete(download);
      }
    }
  }

  private int download(ArchiveKey archiveKey, String location, Path target) {
    HttpRequest request =
        HttpRequest.newBuilder().uri(URI.create(location)).timeout(requestTimeout).GET().build();
    for (int attempt = 1; ; attempt++) {
      try {
        log.debug("Downloading {} (attempt {}/{})", location, attempt, maxRetries);
        HttpResponse<Path> response =
            httpClient.send(
                request,
                HttpResponse.BodyHandlers.ofFile(
                    target,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING));
        int statusCode = response.statusCode();
        if ((statusCode == 429 || statusCode >= 500) && attempt < maxRetries) {
          log.warn(
              "Download of {} failed with status {} - retrying (attempt {}/{})",
              location,
              statusCode,
              attempt,
              maxRetries);
          backOff(archiveKey, attempt);
          continue;
        }
        return statusCode;
      } catch (IOException e) {
        if (attempt >= maxRetries) {
          throw new FetchException(archiveKey, "Failed to download " + location, e);
        }
        log.warn(
            "Download of {} failed: {} - retrying (attempt {}/{})",
            location,
            e.getMessage(),
            attempt,
            maxRetries);
        backOff(archiveKey, attempt);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FetchException(archiveKey, "Interrupted while downloading " + location, e);
      }
    }
  }

  private void backOff(ArchiveKey archiveKey, int attempt) {
    try {
      Thread.sleep(retryDelay.toMillis() * (1L << (attempt - 1)));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(archiveKey, "Interrupted while waiting to retry", e);
    }
  }

  @VisibleForTesting
  boolean isRecent(ArchiveKey archiveKey) {
    return archiveKey.endInstant().plus(publicationDelay).isAfter(clock.instant());
  }

  private Path createDownloadFile(ArchiveKey archiveKey) {
    try {
      String prefix = "gharchive-" + archiveKey + "-";
      return downloadDirectory == null
          ? Files.createTempFile(prefix, ArchiveKey.FILE_SUFFIX)
          : Files.createTempFile(downloadDirectory, prefix, ArchiveKey.FILE_SUFFIX);
    } catch (IOException e) {
      throw new FetchException(archiveKey, "Failed to create a download file", e);
    }
  }

  private static void delete(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Failed to delete downloaded archive {}", file, e);
    }
  }
}
