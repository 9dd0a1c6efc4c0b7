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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.collect.ImmutableList;
import io.sieve.SortDirection;
import io.sieve.TestTables;
import io.sieve.exceptions.ColumnNotFoundException;
import org.junit.jupiter.api.Test;

public class TestIndexDefinitions {

  @Test
  public void testResolveBTree() {
    IndexDefinition definition =
        IndexDefinitions.resolve(
            IndexType.BTREE,
            ImmutableList.of(IndexColumn.asc("score"), IndexColumn.desc("id")),
            TestTables.SCHEMA);

    assertThat(definition).isEqualTo(BTreeIndex.of(BTreeEntry.asc(2), BTreeEntry.desc(0)));
    assertThat(IndexDefinitions.directions(definition))
        .containsExactly(SortDirection.ASC, SortDirection.DESC);
    assertThat(IndexDefinitions.keySchema(definition, TestTables.SCHEMA).columns())
        .extracting(field -> field.name())
        .containsExactly("score", "id");
  }

  @Test
  public void testResolveBitmapIgnoresDirection() {
    IndexDefinition definition =
        IndexDefinitions.resolve(
            IndexType.BITMAP, ImmutableList.of(IndexColumn.desc("name")), TestTables.SCHEMA);

    assertThat(definition).isEqualTo(BitmapIndex.of(1));
    assertThat(IndexDefinitions.directions(definition)).containsExactly(SortDirection.ASC);
  }

  @Test
  public void testToIndexColumns() {
    assertThat(
            IndexDefinitions.toIndexColumns(
                BTreeIndex.of(BTreeEntry.desc(1), BTreeEntry.asc(2)), TestTables.SCHEMA))
        .containsExactly(IndexColumn.desc("name"), IndexColumn.asc("score"));
    assertThat(IndexDefinitions.toIndexColumns(BitmapIndex.of(0), TestTables.SCHEMA))
        .containsExactly(IndexColumn.asc("id"));
  }

  @Test
  public void testUnknownColumn() {
    assertThatThrownBy(
            () ->
                IndexDefinitions.resolve(
                    IndexType.BTREE,
                    ImmutableList.of(IndexColumn.asc("id"), IndexColumn.asc("missing")),
                    TestTables.SCHEMA))
        .isInstanceOf(ColumnNotFoundException.class)
        .hasMessageStartingWith("Cannot find column missing in schema");
  }

  @Test
  public void testNoColumns() {
    assertThatThrownBy(
            () -> IndexDefinitions.resolve(IndexType.BITMAP, ImmutableList.of(), TestTables.SCHEMA))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot define an index without key columns");
  }

  @Test
  public void testValidateName() {
    IndexDefinitions.validateName("by_name");

    assertThatThrownBy(() -> IndexDefinitions.validateName(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid index name: null or empty");
    assertThatThrownBy(() -> IndexDefinitions.validateName(null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid index name: null or empty");
    assertThatThrownBy(() -> IndexDefinitions.validateName("a/b"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid index name a/b: must not contain '.' or '/'");
  }

  @Test
  public void testParserRoundTrip() {
    IndexDefinition btree = BTreeIndex.of(BTreeEntry.asc(2), BTreeEntry.desc(0));
    String json = IndexDefinitionParser.toJson(btree);
    assertThat(json)
        .isEqualTo(
            "{\"index-type\":\"btree\",\"entries\":["
                + "{\"ordinal\":2,\"direction\":\"asc\"},{\"ordinal\":0,\"direction\":\"desc\"}]}");
    assertThat(IndexDefinitionParser.fromJson(json)).isEqualTo(btree);

    IndexDefinition bitmap = BitmapIndex.of(1, 0);
    assertThat(IndexDefinitionParser.toJson(bitmap))
        .isEqualTo("{\"index-type\":\"bitmap\",\"ordinals\":[1,0]}");
    assertThat(IndexDefinitionParser.fromJson(IndexDefinitionParser.toJson(bitmap)))
        .isEqualTo(bitmap);
  }

  @Test
  public void testParserMissingFields() {
    assertThatThrownBy(() -> IndexDefinitionParser.fromJson("{\"index-type\":\"bitmap\"}"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse missing list: ordinals");
    assertThatThrownBy(() -> IndexDefinitionParser.fromJson("[]"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot parse index definition from non-object: []");
  }

  @Test
  public void testSegmentLocations() {
    assertThat(IndexFiles.segmentName("/t/p=1/part-0.csv", "by_id"))
        .isEqualTo("part-0.by_id.index");
    assertThat(IndexFiles.segmentName("/t/p=1/noext", "by_id")).isEqualTo("noext.by_id.index");
    assertThat(IndexFiles.segmentLocation("/t/p=1/part-0.csv", "by_id"))
        .isEqualTo("/t/p=1/part-0.by_id.index");
    assertThat(IndexFiles.stagedSegmentLocation("job-1", "/t/p=1/part-0.csv", "by_id"))
        .isEqualTo("/t/p=1/_temporary/job-1/part-0.by_id.index");
    assertThat(IndexFiles.isSegmentOf("/t/p=1/part-0.by_id.index", "by_id")).isTrue();
    assertThat(IndexFiles.isSegmentOf("/t/p=1/part-0.xby_id.index", "by_id")).isFalse();
    assertThat(IndexFiles.isSegment("/t/p=1/part-0.csv")).isFalse();
  }
}
