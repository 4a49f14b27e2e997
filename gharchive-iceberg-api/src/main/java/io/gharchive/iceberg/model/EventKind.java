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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The closed set of event kinds the normalizer knows how to map. Anything else the archive may
 * publish is {@link #UNKNOWN} and is still ingested with its kind-specific columns defaulted.
 */
public enum EventKind {
  COMMIT_COMMENT("CommitCommentEvent"),
  CREATE("CreateEvent"),
  DELETE("DeleteEvent"),
  FORK("ForkEvent"),
  GOLLUM("GollumEvent"),
  ISSUE_COMMENT("IssueCommentEvent"),
  ISSUES("IssuesEvent"),
  MEMBER("MemberEvent"),
  PUBLIC("PublicEvent"),
  PULL_REQUEST("PullRequestEvent"),
  PULL_REQUEST_REVIEW("PullRequestReviewEvent"),
  PULL_REQUEST_REVIEW_COMMENT("PullRequestReviewCommentEvent"),
  PUSH("PushEvent"),
  RELEASE("ReleaseEvent"),
  WATCH("WatchEvent"),
  UNKNOWN("UnknownEvent");

  private static final Map<String, EventKind> BY_TYPE =
      Collections.unmodifiableMap(
          Arrays.stream(values())
              .filter(kind -> kind != UNKNOWN)
              .collect(Collectors.toMap(EventKind::getTypeName, Function.identity())));

  /** Value of the {@code type} attribute in the archive. */
  @Getter private final String typeName;

  EventKind(String typeName) {
    this.typeName = typeName;
  }

  public static EventKind fromType(String type) {
    if (type == null) {
      return UNKNOWN;
    }
    return BY_TYPE.getOrDefault(type, UNKNOWN);
  }
}
