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

import static io.gharchive.iceberg.normalize.JsonFields.bool;
import static io.gharchive.iceberg.normalize.JsonFields.enumText;
import static io.gharchive.iceberg.normalize.JsonFields.intValue;
import static io.gharchive.iceberg.normalize.JsonFields.isPresent;
import static io.gharchive.iceberg.normalize.JsonFields.longValue;
import static io.gharchive.iceberg.normalize.JsonFields.text;
import static io.gharchive.iceberg.normalize.JsonFields.textList;
import static io.gharchive.iceberg.normalize.JsonFields.timestamp;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import com.fasterxml.jackson.databind.JsonNode;

import io.gharchive.iceberg.model.EventKind;
import io.gharchive.iceberg.model.NormalizedRow.NormalizedRowBuilder;
import io.gharchive.iceberg.model.RawEvent;

/**
 * The mapping from every {@link EventKind} to its {@link PayloadExtractor}. JSON pointers below are
 * relative to the event root.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class PayloadExtractors {
  private static final Map<EventKind, PayloadExtractor> EXTRACTORS = new EnumMap<>(EventKind.class);

  static {
    EXTRACTORS.put(EventKind.COMMIT_COMMENT, PayloadExtractors::commitComment);
    EXTRACTORS.put(EventKind.CREATE, PayloadExtractors::createOrDelete);
    EXTRACTORS.put(EventKind.DELETE, PayloadExtractors::createOrDelete);
    EXTRACTORS.put(EventKind.FORK, PayloadExtractors::fork);
    EXTRACTORS.put(EventKind.GOLLUM, PayloadExtractors::gollum);
    EXTRACTORS.put(EventKind.ISSUE_COMMENT, PayloadExtractors::issueComment);
    EXTRACTORS.put(EventKind.ISSUES, PayloadExtractors::issues);
    EXTRACTORS.put(EventKind.MEMBER, PayloadExtractors::member);
    EXTRACTORS.put(EventKind.PUBLIC, PayloadExtractor.NONE);
    EXTRACTORS.put(EventKind.PULL_REQUEST, PayloadExtractors::pullRequest);
    EXTRACTORS.put(EventKind.PULL_REQUEST_REVIEW, PayloadExtractors::pullRequestReview);
    EXTRACTORS.put(
        EventKind.PULL_REQUEST_REVIEW_COMMENT, PayloadExtractors::pullRequestReviewComment);
    EXTRACTORS.put(EventKind.PUSH, PayloadExtractors::push);
    EXTRACTORS.put(EventKind.RELEASE, PayloadExtractors::release);
    EXTRACTORS.put(EventKind.WATCH, PayloadExtractors::action);
    EXTRACTORS.put(EventKind.UNKNOWN, PayloadExtractor.NONE);

    Set<EventKind> unmapped =
        Arrays.stream(EventKind.values())
            .filter(kind -> !EXTRACTORS.containsKey(kind))
            .collect(Collectors.toSet());
    if (!unmapped.isEmpty()) {
      throw new IllegalStateException("No payload extractor for " + unmapped);
    }
  }

  static PayloadExtractor forKind(EventKind kind) {
    return EXTRACTORS.get(kind);
  }

  static Map<EventKind, PayloadExtractor> all() {
    return Collections.unmodifiableMap(EXTRACTORS);
  }

  private static void action(RawEvent event, NormalizedRowBuilder row) {
    row.action(enumText(event.at("/payload/action")));
  }

  private static void commitComment(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    commentFields(event.at("/payload/comment"), row);
  }

  private static void createOrDelete(RawEvent event, NormalizedRowBuilder row) {
    row.ref(text(event.at("/payload/ref")))
        .refType(enumText(event.at("/payload/ref_type")))
        .title(text(event.at("/payload/description")));
  }

  private static void fork(RawEvent event, NormalizedRowBuilder row) {
    JsonNode forkee = event.at("/payload/forkee");
    row.creatorUserLogin(text(forkee.at("/owner/login")))
        .updatedAt(timestamp(forkee.at("/updated_at")));
  }

  private static void gollum(RawEvent event, NormalizedRowBuilder row) {
    // only the first page is kept, events touching several pages are rare
    JsonNode page = event.at("/payload/pages/0");
    row.action(enumText(page.at("/action"))).title(text(page.at("/title")));
  }

  private static void issueComment(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    issueFields(event.at("/payload/issue"), row);
    commentFields(event.at("/payload/comment"), row);
  }

  private static void issues(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    JsonNode issue = event.at("/payload/issue");
    issueFields(issue, row);
    row.body(text(issue.at("/body")))
        .authorAssociation(enumText(issue.at("/author_association")))
        .updatedAt(timestamp(issue.at("/updated_at")));
  }

  private static void member(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    row.memberLogin(text(event.at("/payload/member/login")));
  }

  private static void pullRequest(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    JsonNode pullRequest = event.at("/payload/pull_request");
    pullRequestFields(pullRequest, row);
    row.body(text(pullRequest.at("/body")))
        .authorAssociation(enumText(pullRequest.at("/author_association")))
        .updatedAt(timestamp(pullRequest.at("/updated_at")));
    JsonNode number = event.at("/payload/number");
    if (isPresent(number)) {
      row.number(longValue(number));
    }
  }

  private static void pullRequestReview(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    pullRequestFields(event.at("/payload/pull_request"), row);
    JsonNode review = event.at("/payload/review");
    row.reviewState(enumText(review.at("/state")))
        .body(text(review.at("/body")))
        .commitId(text(review.at("/commit_id")))
        .authorAssociation(enumText(review.at("/author_association")))
        .updatedAt(timestamp(review.at("/submitted_at")));
  }

  private static void pullRequestReviewComment(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    pullRequestFields(event.at("/payload/pull_request"), row);
    JsonNode comment = event.at("/payload/comment");
    commentFields(comment, row);
    row.originalPosition(intValue(comment.at("/original_position")))
        .diffHunk(text(comment.at("/diff_hunk")))
        .originalCommitId(text(comment.at("/original_commit_id")));
  }

  private static void push(RawEvent event, NormalizedRowBuilder row) {
    JsonNode payload = event.at("/payload");
    row.ref(text(payload.at("/ref")))
        .headSha(text(payload.at("/head")))
        .baseSha(text(payload.at("/before")))
        .pushSize(intValue(payload.at("/size")))
        .pushDistinctSize(intValue(payload.at("/distinct_size")));
  }

  private static void release(RawEvent event, NormalizedRowBuilder row) {
    action(event, row);
    JsonNode release = event.at("/payload/release");
    row.releaseTagName(text(release.at("/tag_name")))
        .releaseName(text(release.at("/name")))
        .body(text(release.at("/body")))
        .creatorUserLogin(text(release.at("/author/login")))
        .updatedAt(timestamp(release.at("/published_at")));
  }

  private static void commentFields(JsonNode comment, NormalizedRowBuilder row) {
    row.commentId(longValue(comment.at("/id")))
        .body(text(comment.at("/body")))
        .path(text(comment.at("/path")))
        .position(intValue(comment.at("/position")))
        .line(intValue(comment.at("/line")))
        .commitId(text(comment.at("/commit_id")))
        .authorAssociation(enumText(comment.at("/author_association")))
        .updatedAt(timestamp(comment.at("/updated_at")));
  }

  private static void issueFields(JsonNode issue, NormalizedRowBuilder row) {
    row.number(longValue(issue.at("/number")))
        .title(text(issue.at("/title")))
        .state(enumText(issue.at("/state")))
        .locked(bool(issue.at("/locked")))
        .labels(textList(issue.at("/labels"), "name"))
        .assignee(text(issue.at("/assignee/login")))
        .assignees(textList(issue.at("/assignees"), "login"))
        .comments(intValue(issue.at("/comments")))
        .closedAt(timestamp(issue.at("/closed_at")))
        .creatorUserLogin(text(issue.at("/user/login")));
  }

  private static void pullRequestFields(JsonNode pullRequest, NormalizedRowBuilder row) {
    issueFields(pullRequest, row);
    row.reviewComments(intValue(pullRequest.at("/review_comments")))
        .mergedAt(timestamp(pullRequest.at("/merged_at")))
        .mergeCommitSha(text(pullRequest.at("/merge_commit_sha")))
        .headRef(text(pullRequest.at("/head/ref")))
        .headSha(text(pullRequest.at("/head/sha")))
        .baseRef(text(pullRequest.at("/base/ref")))
        .baseSha(text(pullRequest.at("/base/sha")))
        .merged(bool(pullRequest.at("/merged")))
        .mergeable(bool(pullRequest.at("/mergeable")))
        .mergedBy(text(pullRequest.at("/merged_by/login")))
        .maintainerCanModify(bool(pullRequest.at("/maintainer_can_modify")))
        .commits(intValue(pullRequest.at("/commits")))
        .additions(intValue(pullRequest.at("/additions")))
        .deletions(intValue(pullRequest.at("/deletions")))
        .changedFiles(intValue(pullRequest.at("/changed_files")));
  }
}
