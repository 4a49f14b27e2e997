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

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import java.util.zip.GZIPInputStream;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;

import io.gharchive.iceberg.model.ArchiveKey;
import io.gharchive.iceberg.model.RawEvent;
import io.gharchive.iceberg.model.exception.DecodeException;
import io.gharchive.iceberg.spi.ArchiveReader;

/**
 * Decompresses a gzip archive and parses it as newline delimited JSON, one event per line.
 *
 * <p>Lines that are not a JSON object are logged and skipped. A compressed stream that ends
 * prematurely is read up to the point where it was cut: every complete line is kept and an
 * incomplete last line is skipped like any other malformed line. Any other decompression failure
 * raises {@link DecodeException}.
 */
@Log4j2
public class ArchiveLineReader implements ArchiveReader {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Getter private final ArchiveKey archiveKey;
  private final String location;
  private final BufferedReader reader;
  private final TruncationTolerantStream decompressed;
  private final Runnable onClose;
  @Getter private long skippedLines;
  private boolean consumed;
  private boolean closed;

  /**
   * @param archiveKey the hour the stream belongs to
   * @param location location of the stream for logging
   * @param compressed the gzip compressed archive, owned by this reader from now on
   * @param onClose cleanup to run after the stream was closed
   */
  public ArchiveLineReader(
      ArchiveKey archiveKey, String location, InputStream compressed, Runnable onClose) {
    this.archiveKey = archiveKey;
    this.location = location;
    this.onClose = onClose;
    try {
      this.decompressed = new TruncationTolerantStream(new GZIPInputStream(compressed));
      this.reader =
          new BufferedReader(new InputStreamReader(decompressed, StandardCharsets.UTF_8));
    } catch (IOException e) {
      closeQuietly(compressed);
      onClose.run();
      throw new DecodeException(archiveKey, "Archive " + location + " is not a gzip stream", e);
    }
  }

  @Override
  public Stream<RawEvent> events() {
    Preconditions.checkState(!consumed, "Events of %s were already consumed", archiveKey);
    consumed = true;
    return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(
                new EventIterator(), Spliterator.ORDERED | Spliterator.NONNULL),
            false)
        .onClose(this::close);
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      reader.close();
    } catch (IOException e) {
      log.warn("Failed to close archive {}", location, e);
    } finally {
      onClose.run();
    }
  }

  private RawEvent parse(String line, long lineNumber) {
    try {
      JsonNode node = MAPPER.readTree(line);
      if (node instanceof ObjectNode) {
        return RawEvent.of((ObjectNode) node, lineNumber);
      }
      log.warn("Skipping line {} of {}: not a JSON object", lineNumber, location);
    } catch (JsonProcessingException e) {
      log.warn(
          "Skipping malformed line {} of {}: {}", lineNumber, location, e.getOriginalMessage());
    }
    skippedLines++;
    return null;
  }

  private class EventIterator implements Iterator<RawEvent> {
    private long lineNumber;
    private RawEvent next;
    private boolean done;

    @Override
    public boolean hasNext() {
      while (next == null && !done) {
        String line = readLine();
        if (line == null) {
          done = true;
          if (decompressed.truncated) {
            log.warn("Archive {} ends prematurely after line {}", location, lineNumber);
          }
        } else {
          lineNumber++;
          if (!line.trim().isEmpty()) {
            next = parse(line, lineNumber);
          }
        }
      }
      return next != null;
    }

    @Override
    public RawEvent next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      RawEvent event = next;
      next = null;
      return event;
    }

    private String readLine() {
      try {
        return reader.readLine();
      } catch (IOException e) {
        throw new DecodeException(
            archiveKey, "Failed to decompress " + location + " after line " + lineNumber, e);
      }
    }
  }

  /** Reports the end of the stream where the compressed input was cut off. */
  private static class TruncationTolerantStream extends FilterInputStream {
    private boolean truncated;

    TruncationTolerantStream(InputStream in) {
      super(in);
    }

    @Override
    public int read() throws IOException {
      if (truncated) {
        return -1;
      }
      try {
        return super.read();
      } catch (EOFException e) {
        truncated = true;
        return -1;
      }
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
      if (truncated) {
        return -1;
      }
      try {
        return super.read(buffer, offset, length);
      } catch (EOFException e) {
        truncated = true;
        return -1;
      }
    }
  }

  private static void closeQuietly(InputStream inputStream) {
    try {
      inputStream.close();
    } catch (IOException e) {
      log.debug("Failed to close input stream", e);
    }
  }
}
