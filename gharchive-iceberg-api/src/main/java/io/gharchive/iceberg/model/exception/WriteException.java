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
 * The batch of an archive hour could not be committed. Nothing of the batch is visible in the
 * table; the whole hour has to be retried.
 */
@Getter
public class WriteException extends InternalException {
  private final ArchiveKey archiveKey;

  public WriteException(ArchiveKey archiveKey, String message, Throwable e) {
    super(ErrorCode.WRITE_EXCEPTION, message, e);
    this.archiveKey = archiveKey;
  }

  public WriteException(ArchiveKey archiveKey, ErrorCode errorCode, String message, Throwable e) {
    super(errorCode, message, e);
    this.archiveKey = archiveKey;
  }

  @Override
  public boolean isRetryable() {
    return true;
  }
}
