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
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * The fixed wide row every event is normalized into. The row is a superset of the fields of all
 * event kinds; a field that does not apply to the event's kind carries its default so that every
 * file written to the table has the same, fully populated schema.
 *
 * <p>Defaults: numbers {@code 0}, text {@code ""}, enumerated text {@value #UNKNOWN}, flags {@code
 * false}, lists empty and timestamps {@link #EPOCH}.
 */
@Value
@Builder(toBuilder = true)
public class NormalizedRow {
  public static final String UNKNOWN = "unknown";
  public static final OffsetDateTime EPOCH =
      OffsetDateTime.ofInstant(Instant.EPOCH, ZoneOffset.UTC);

  // identity
  @NonNull @Builder.Default String id = "";
  @NonNull String eventType;
  @NonNull @Builder.Default String actorLogin = "";
  @NonNull @Builder.Default String repoName = "";
  @NonNull @Builder.Default OffsetDateTime createdAt = EPOCH;
  @NonNull @Builder.Default OffsetDateTime updatedAt = EPOCH;

  // archive the row was ingested from
  @NonNull @Builder.Default String archiveDate = "";
  @Builder.Default int archiveHour = 0;
  @NonNull @Builder.Default OffsetDateTime fileTime = EPOCH;

  @NonNull @Builder.Default String action = UNKNOWN;

  // comments
  @Builder.Default long commentId = 0L;
  @NonNull @Builder.Default String body = "";
  @NonNull @Builder.Default String path = "";
  @Builder.Default int position = 0;
  @Builder.Default int line = 0;

  // refs
  @NonNull @Builder.Default String ref = "";
  @NonNull @Builder.Default String refType = UNKNOWN;
  @NonNull @Builder.Default String creatorUserLogin = "";

  // issues and pull requests
  @Builder.Default long number = 0L;
  @NonNull @Builder.Default String title = "";
  @NonNull @Builder.Default List<String> labels = Collections.emptyList();
  @NonNull @Builder.Default String state = UNKNOWN;
  @Builder.Default boolean locked = false;
  @NonNull @Builder.Default String assignee = "";
  @NonNull @Builder.Default List<String> assignees = Collections.emptyList();
  @Builder.Default int comments = 0;
  @NonNull @Builder.Default String authorAssociation = UNKNOWN;
  @NonNull @Builder.Default OffsetDateTime closedAt = EPOCH;
  @NonNull @Builder.Default OffsetDateTime mergedAt = EPOCH;
  @NonNull @Builder.Default String mergeCommitSha = "";
  @NonNull @Builder.Default String headRef = "";
  @NonNull @Builder.Default String headSha = "";
  @NonNull @Builder.Default String baseRef = "";
  @NonNull @Builder.Default String baseSha = "";
  @Builder.Default boolean merged = false;
  @Builder.Default boolean mergeable = false;
  @NonNull @Builder.Default String mergedBy = "";
  @Builder.Default int reviewComments = 0;
  @Builder.Default boolean maintainerCanModify = false;
  @Builder.Default int commits = 0;
  @Builder.Default int additions = 0;
  @Builder.Default int deletions = 0;
  @Builder.Default int changedFiles = 0;

  // review comments
  @NonNull @Builder.Default String diffHunk = "";
  @Builder.Default int originalPosition = 0;
  @NonNull @Builder.Default String commitId = "";
  @NonNull @Builder.Default String originalCommitId = "";
  @NonNull @Builder.Default String reviewState = UNKNOWN;

  // pushes
  @Builder.Default int pushSize = 0;
  @Builder.Default int pushDistinctSize = 0;

  @NonNull @Builder.Default String memberLogin = "";
  @NonNull @Builder.Default String releaseTagName = "";
  @NonNull @Builder.Default String releaseName = "";

  // raw payload as JSON, keeps kinds without a dedicated mapping recoverable
  @NonNull @Builder.Default String payload = "";
}
