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

package io.gharchive.iceberg.iceberg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import org.apache.iceberg.PartitionSpec;
import org.apache.iceberg.Schema;
import org.apache.iceberg.TableProperties;
import org.apache.iceberg.data.GenericRecord;
import org.apache.iceberg.data.Record;
import org.apache.iceberg.types.Type;
import org.apache.iceberg.types.Types;

import io.gharchive.iceberg.model.NormalizedRow;

/**
 * Iceberg layout of {@link NormalizedRow}: one required column per row field, partitioned by a
 * transform of {@code created_at}. The column list is the single place that ties a row field to its
 * column name and type.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class EventTableSchema {
  public static final String ID = "id";
  public static final String EVENT_TYPE = "event_type";
  public static final String CREATED_AT = "created_at";
  public static final String ARCHIVE_DATE = "archive_date";
  public static final String ARCHIVE_HOUR = "archive_hour";

  private static final int FIRST_ELEMENT_ID = 500;
  private static final List<Column> COLUMNS = new ArrayList<>();

  static {
    // bookkeeping columns first so they always get full metrics
    add(ARCHIVE_DATE, Types.StringType.get(), NormalizedRow::getArchiveDate);
    add(ARCHIVE_HOUR, Types.IntegerType.get(), NormalizedRow::getArchiveHour);
    add("file_time", Types.TimestampType.withZone(), NormalizedRow::getFileTime);
    add(ID, Types.StringType.get(), NormalizedRow::getId);
    add(EVENT_TYPE, Types.StringType.get(), NormalizedRow::getEventType);
    add("actor_login", Types.StringType.get(), NormalizedRow::getActorLogin);
    add("repo_name", Types.StringType.get(), NormalizedRow::getRepoName);
    add(CREATED_AT, Types.TimestampType.withZone(), NormalizedRow::getCreatedAt);
    add("updated_at", Types.TimestampType.withZone(), NormalizedRow::getUpdatedAt);
    add("action", Types.StringType.get(), NormalizedRow::getAction);
    add("comment_id", Types.LongType.get(), NormalizedRow::getCommentId);
    add("body", Types.StringType.get(), NormalizedRow::getBody);
    add("path", Types.StringType.get(), NormalizedRow::getPath);
    add("position", Types.IntegerType.get(), NormalizedRow::getPosition);
    add("line", Types.IntegerType.get(), NormalizedRow::getLine);
    add("ref", Types.StringType.get(), NormalizedRow::getRef);
    add("ref_type", Types.StringType.get(), NormalizedRow::getRefType);
    add("creator_user_login", Types.StringType.get(), NormalizedRow::getCreatorUserLogin);
    add("number", Types.LongType.get(), NormalizedRow::getNumber);
    add("title", Types.StringType.get(), NormalizedRow::getTitle);
    addList("labels", NormalizedRow::getLabels);
    add("state", Types.StringType.get(), NormalizedRow::getState);
    add("locked", Types.BooleanType.get(), NormalizedRow::isLocked);
    add("assignee", Types.StringType.get(), NormalizedRow::getAssignee);
    addList("assignees", NormalizedRow::getAssignees);
    add("comments", Types.IntegerType.get(), NormalizedRow::getComments);
    add("author_association", Types.StringType.get(), NormalizedRow::getAuthorAssociation);
    add("closed_at", Types.TimestampType.withZone(), NormalizedRow::getClosedAt);
    add("merged_at", Types.TimestampType.withZone(), NormalizedRow::getMergedAt);
    add("merge_commit_sha", Types.StringType.get(), NormalizedRow::getMergeCommitSha);
    add("head_ref", Types.StringType.get(), NormalizedRow::getHeadRef);
    add("head_sha", Types.StringType.get(), NormalizedRow::getHeadSha);
    add("base_ref", Types.StringType.get(), NormalizedRow::getBaseRef);
    add("base_sha", Types.StringType.get(), NormalizedRow::getBaseSha);
    add("merged", Types.BooleanType.get(), NormalizedRow::isMerged);
    add("mergeable", Types.BooleanType.get(), NormalizedRow::isMergeable);
    add("merged_by", Types.StringType.get(), NormalizedRow::getMergedBy);
    add("review_comments", Types.IntegerType.get(), NormalizedRow::getReviewComments);
    add("maintainer_can_modify", Types.BooleanType.get(), NormalizedRow::isMaintainerCanModify);
    add("commits", Types.IntegerType.get(), NormalizedRow::getCommits);
    add("additions", Types.IntegerType.get(), NormalizedRow::getAdditions);
    add("deletions", Types.IntegerType.get(), NormalizedRow::getDeletions);
    add("changed_files", Types.IntegerType.get(), NormalizedRow::getChangedFiles);
    add("diff_hunk", Types.StringType.get(), NormalizedRow::getDiffHunk);
    add("original_position", Types.IntegerType.get(), NormalizedRow::getOriginalPosition);
    add("commit_id", Types.StringType.get(), NormalizedRow::getCommitId);
    add("original_commit_id", Types.StringType.get(), NormalizedRow::getOriginalCommitId);
    add("review_state", Types.StringType.get(), NormalizedRow::getReviewState);
    add("push_size", Types.IntegerType.get(), NormalizedRow::getPushSize);
    add("push_distinct_size", Types.IntegerType.get(), NormalizedRow::getPushDistinctSize);
    add("member_login", Types.StringType.get(), NormalizedRow::getMemberLogin);
    add("release_tag_name", Types.StringType.get(), NormalizedRow::getReleaseTagName);
    add("release_name", Types.StringType.get(), NormalizedRow::getReleaseName);
    add("payload", Types.StringType.get(), NormalizedRow::getPayload);
  }

  private static final Schema SCHEMA =
      new Schema(
          COLUMNS.stream()
              .map(column -> Types.NestedField.required(column.id, column.name, column.type))
              .collect(Collectors.toList()));

  /** The schema new tables are created with, and that existing tables are reconciled to. */
  public static Schema schema() {
    return SCHEMA;
  }

  public static PartitionSpec partitionSpec(Schema schema, PartitionGranularity granularity) {
    return granularity.partitionSpec(schema, CREATED_AT);
  }

  /** Properties of new tables. */
  public static Map<String, String> defaultTableProperties() {
    Map<String, String> properties = new HashMap<>();
    // exact bounds are required to replace the files of an archive hour by row filter
    properties.put(TableProperties.METRICS_MODE_COLUMN_CONF_PREFIX + ARCHIVE_DATE, "full");
    properties.put(TableProperties.METRICS_MODE_COLUMN_CONF_PREFIX + ARCHIVE_HOUR, "full");
    properties.put(TableProperties.METRICS_MODE_COLUMN_CONF_PREFIX + CREATED_AT, "full");
    return Collections.unmodifiableMap(properties);
  }

  /**
   * Converts a row to a record of the given table schema. Columns of the table that are not part of
   * {@link #schema()} stay null.
   */
  public static Record toRecord(NormalizedRow row, Schema tableSchema) {
    GenericRecord record = GenericRecord.create(tableSchema);
    for (Column column : COLUMNS) {
      if (tableSchema.findField(column.name) != null) {
        record.setField(column.name, column.accessor.apply(row));
      }
    }
    return record;
  }

  private static void add(String name, Type type, Function<NormalizedRow, Object> accessor) {
    COLUMNS.add(new Column(COLUMNS.size() + 1, name, type, accessor));
  }

  private static void addList(String name, Function<NormalizedRow, Object> accessor) {
    int elementId = FIRST_ELEMENT_ID + COLUMNS.size();
    add(name, Types.ListType.ofRequired(elementId, Types.StringType.get()), accessor);
  }

  @Getter
  @AllArgsConstructor(access = AccessLevel.PRIVATE)
  private static class Column {
    private final int id;
    private final String name;
    private final Type type;
    private final Function<NormalizedRow, Object> accessor;
  }
}
