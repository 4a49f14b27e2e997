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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One event object as read from an archive line. The shape of {@link #getNode()} depends on the
 * event type and on the era of the archive, nothing about it is validated here.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RawEvent {
  @NonNull ObjectNode node;
  // 1-based line in the decompressed archive file
  long lineNumber;

  public static RawEvent of(ObjectNode node, long lineNumber) {
    return new RawEvent(node, lineNumber);
  }

  /** The {@code type} discriminator, or null when the event carries none. */
  public String getType() {
    JsonNode type = node.get("type");
    return type == null || !type.isTextual() ? null : type.asText();
  }

  public EventKind getKind() {
    return EventKind.fromType(getType());
  }

  /**
   * Resolves a JSON pointer such as {@code /payload/pull_request/number}. Never null, absent
   * values resolve to a missing node.
   */
  public JsonNode at(String pointer) {
    return node.at(pointer);
  }
}
