/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.sieve.index;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import io.sieve.SortDirection;
import io.sieve.util.JsonUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

public class IndexDefinitionParser {

  static final String INDEX_TYPE = "index-type";
  static final String ENTRIES = "entries";
  static final String ORDINAL = "ordinal";
  static final String DIRECTION = "direction";
  static final String ORDINALS = "ordinals";

  private IndexDefinitionParser() {}

  public static String toJson(IndexDefinition definition) {
    return JsonUtil.generate(gen -> toJson(definition, gen), false);
  }

  public static void toJson(IndexDefinition definition, JsonGenerator generator)
      throws IOException {
    generator.writeStartObject();
    writeFields(definition, generator);
    generator.writeEndObject();
  }

  /** Writes the fields of a definition into an object that the caller has already started. */
  public static void writeFields(IndexDefinition definition, JsonGenerator generator)
      throws IOException {
    generator.writeStringField(INDEX_TYPE, definition.type().typeName());
    try {
      definition.accept(
          new IndexDefinition.Visitor<Void>() {
            @Override
            public Void btree(BTreeIndex index) {
              try {
                generator.writeArrayFieldStart(ENTRIES);
                for (BTreeEntry entry : index.entries()) {
                  generator.writeStartObject();
                  generator.writeNumberField(ORDINAL, entry.ordinal());
                  generator.writeStringField(
                      DIRECTION, entry.direction().name().toLowerCase(Locale.ROOT));
                  generator.writeEndObject();
                }
                generator.writeEndArray();
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
              return null;
            }

            @Override
            public Void bitmap(BitmapIndex index) {
              try {
                JsonUtil.writeIntegerArray(ORDINALS, index.ordinals(), generator);
              } catch (IOException e) {
                throw new UncheckedIOException(e);
              }
              return null;
            }
          });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  public static IndexDefinition fromJson(String json) {
    return JsonUtil.parse(json, IndexDefinitionParser::fromJson);
  }

  public static IndexDefinition fromJson(JsonNode json) {
    Preconditions.checkArgument(json != null, "Cannot parse index definition from null object");
    Preconditions.checkArgument(
        json.isObject(), "Cannot parse index definition from non-object: %s", json);

    IndexType type = IndexType.fromString(JsonUtil.getString(INDEX_TYPE, json));
    switch (type) {
      case BTREE:
        return btreeFromJson(json);
      case BITMAP:
        return new BitmapIndex(JsonUtil.getIntegerList(ORDINALS, json));
      default:
        throw new UnsupportedOperationException("Unknown index type: " + type);
    }
  }

  private static BTreeIndex btreeFromJson(JsonNode json) {
    List<BTreeEntry> entries = Lists.newArrayList();
    Iterator<JsonNode> elements = JsonUtil.getArrayElements(ENTRIES, json);
    while (elements.hasNext()) {
      JsonNode entry = elements.next();
      Preconditions.checkArgument(
          entry.isObject(), "Cannot parse B-tree entry from non-object: %s", entry);
      String direction = JsonUtil.getString(DIRECTION, entry);
      entries.add(
          new BTreeEntry(
              JsonUtil.getInt(ORDINAL, entry),
              SortDirection.valueOf(direction.toUpperCase(Locale.ROOT))));
    }

    return new BTreeIndex(entries);
  }
}
