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
package io.sieve.commands;

import com.google.common.collect.ImmutableList;
import io.sieve.IndexMeta;
import io.sieve.Schema;
import io.sieve.SortDirection;
import io.sieve.StructLike;
import io.sieve.catalog.Relation;
import io.sieve.data.GenericRow;
import io.sieve.index.BTreeEntry;
import io.sieve.index.BTreeIndex;
import io.sieve.index.BitmapIndex;
import io.sieve.index.IndexDefinition;
import io.sieve.session.SieveSession;
import io.sieve.types.Types;
import java.util.Comparator;
import java.util.List;

/** Lists the key columns of every index on a relation, one row per index column. */
public class ShowIndex extends BaseIndexCommand {
  public static final Schema OUTPUT =
      new Schema(
          Types.NestedField.optional("table", Types.StringType.get()),
          Types.NestedField.required("key_name", Types.StringType.get()),
          Types.NestedField.required("seq_in_index", Types.IntegerType.get()),
          Types.NestedField.required("column_name", Types.StringType.get()),
          Types.NestedField.optional("collation", Types.StringType.get()),
          Types.NestedField.required("index_type", Types.StringType.get()));

  public ShowIndex(Relation relation) {
    super(relation);
  }

  @Override
  public Schema output() {
    return OUTPUT;
  }

  @Override
  public List<StructLike> run(SieveSession session) {
    readerClassName("show");
    ImmutableList.Builder<StructLike> rows = ImmutableList.builder();
    allIndexes(loadMetadata(session, nonEmptyPartitions())).values().stream()
        .sorted(Comparator.comparing(IndexMeta::name))
        .forEach(indexMeta -> rows.addAll(describe(indexMeta)));
    return rows.build();
  }

  private List<StructLike> describe(IndexMeta indexMeta) {
    Schema schema = relation().schema();
    String indexType = indexMeta.definition().type().label();
    return indexMeta
        .definition()
        .accept(
            new IndexDefinition.Visitor<List<StructLike>>() {
              @Override
              public List<StructLike> btree(BTreeIndex index) {
                ImmutableList.Builder<StructLike> rows = ImmutableList.builder();
                List<BTreeEntry> entries = index.entries();
                for (int seq = 0; seq < entries.size(); seq += 1) {
                  BTreeEntry entry = entries.get(seq);
                  String collation = entry.direction() == SortDirection.ASC ? "A" : "D";
                  String column = schema.column(entry.ordinal()).name();
                  rows.add(row(indexMeta.name(), seq, column, collation, indexType));
                }
                return rows.build();
              }

              @Override
              public List<StructLike> bitmap(BitmapIndex index) {
                ImmutableList.Builder<StructLike> rows = ImmutableList.builder();
                List<Integer> ordinals = index.ordinals();
                for (int seq = 0; seq < ordinals.size(); seq += 1) {
                  String column = schema.column(ordinals.get(seq)).name();
                  rows.add(row(indexMeta.name(), seq, column, null, indexType));
                }
                return rows.build();
              }
            });
  }

  private StructLike row(
      String keyName, int seq, String columnName, String collation, String indexType) {
    return GenericRow.of(
        OUTPUT.asStruct(), relation().name(), keyName, seq, columnName, collation, indexType);
  }
}
