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

package io.gharchive.iceberg.model.exception;

import lombok.Getter;

import io.gharchive.iceberg.model.ArchiveKey;

/**
 * The archive hour could not be retrieved: it does not exist (yet) or the transfer failed. Always
 * retryable, an hour that is not published yet is expected to appear later.
 */
@Getter
public class FetchException extends InternalException {
  private final ArchiveKey archiveKey;
  private final boolean notYetPublished;

  public FetchException(ArchiveKey archiveKey, String message, Throwable e) {
    super(ErrorCode.FETCH_EXCEPTION, message, e);
    this.archiveKey = archiveKey;
    this.notYetPublished = false;
  }

  private FetchException(ArchiveKey archiveKey, ErrorCode errorCode, String message) {
    super(errorCode, message);
    this.archiveKey = archiveKey;
    this.notYetPublished = errorCode == ErrorCode.ARCHIVE_NOT_PUBLISHED;
  }

  public static FetchException notFound(ArchiveKey archiveKey, String location) {
    return new FetchException(
        archiveKey, ErrorCode.FETCH_EXCEPTION, "Archive " + location + " does not exist");
  }

  public static FetchException notYetPublished(ArchiveKey archiveKey, String location) {
    return new FetchException(
        archiveKey,
        ErrorCode.ARCHIVE_NOT_PUBLISHED,
        "Archive " + location + " is not published yet");
  }

  public static FetchException failed(ArchiveKey archiveKey, String message) {
    return new FetchException(archiveKey, ErrorCode.FETCH_EXCEPTION, message);
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
