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
import io.sieve.exceptions.UnsupportedIndexTypeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class TestIndexDefinition {

  @ParameterizedTest
  @EnumSource(IndexType.class)
  public void testIndexTypeNames(IndexType type) {
    assertThat(IndexType.fromString(type.typeName())).isSameAs(type);
    assertThat(IndexType.fromString(type.label())).isSameAs(type);
  }

  @Test
  public void testUnknownIndexType() {
    assertThatThrownBy(() -> IndexType.fromString("hash"))
        .isInstanceOf(UnsupportedIndexTypeException.class)
        .hasMessage("Unsupported index type: hash");
    assertThatThrownBy(() -> IndexType.fromString(null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid index type: null");
  }

  @Test
  public void testBTreeIndex() {
    BTreeIndex index = BTreeIndex.of(BTreeEntry.asc(2), BTreeEntry.desc(0));
    assertThat(index.type()).isEqualTo(IndexType.BTREE);
    assertThat(index.ordinals()).containsExactly(2, 0);
    assertThat(index.entries())
        .extracting(BTreeEntry::direction)
        .containsExactly(SortDirection.ASC, SortDirection.DESC);
    assertThat(index)
        .isEqualTo(new BTreeIndex(ImmutableList.of(BTreeEntry.asc(2), BTreeEntry.desc(0))))
        .isNotEqualTo(BTreeIndex.of(BTreeEntry.asc(2), BTreeEntry.asc(0)));
  }

  @Test
  public void testBitmapIndex() {
    BitmapIndex index = BitmapIndex.of(1, 3);
    assertThat(index.type()).isEqualTo(IndexType.BITMAP);
    assertThat(index.ordinals()).containsExactly(1, 3);
    assertThat(index).isEqualTo(BitmapIndex.of(1, 3)).isNotEqualTo(BitmapIndex.of(3, 1));
  }

  @Test
  public void testInvalidDefinitions() {
    assertThatThrownBy(() -> new BTreeIndex(ImmutableList.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid B-tree index: no key columns");
    assertThatThrownBy(() -> new BitmapIndex(ImmutableList.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid bitmap index: no key columns");
    assertThatThrownBy(() -> BTreeEntry.asc(-1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid column ordinal: -1");
    assertThatThrownBy(() -> BitmapIndex.of(0, -2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid column ordinal: -2");
  }

  @Test
  public void testVisitor() {
    IndexDefinition.Visitor<String> describe =
        new IndexDefinition.Visitor<String>() {
          @Override
          public String btree(BTreeIndex index) {
            return "btree:" + index.entries().size();
          }

          @Override
          public String bitmap(BitmapIndex index) {
            return "bitmap:" + index.ordinals().size();
          }
        };

    assertThat(BTreeIndex.of(BTreeEntry.asc(0)).accept(describe)).isEqualTo("btree:1");
    assertThat(BitmapIndex.of(0, 1).accept(describe)).isEqualTo("bitmap:2");
  }

  @Test
  public void testIndexColumn() {
    assertThat(IndexColumn.asc("id").ascending()).isTrue();
    assertThat(IndexColumn.desc("id").ascending()).isFalse();
    assertThat(ImmutableIndexColumn.builder().columnName("id").build().ascending()).isTrue();
    assertThatThrownBy(() -> IndexColumn.asc(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid column name: (empty)");
  }
}
