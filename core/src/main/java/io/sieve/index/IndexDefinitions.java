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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.sieve.Schema;
import io.sieve.SortDirection;
import io.sieve.exceptions.ColumnNotFoundException;
import java.util.List;
import java.util.stream.Collectors;

/** Resolves requested index columns against a schema, and back. */
public class IndexDefinitions {

  private IndexDefinitions() {}

  /**
   * Resolves index columns by name against the live schema of a relation.
   *
   * @param type the kind of index to define
   * @param columns requested key columns, in key order
   * @param schema the live schema
   * @return a definition whose ordinals refer to {@code schema}
   * @throws ColumnNotFoundException if a column is not in the schema
   */
  public static IndexDefinition resolve(IndexType type, List<IndexColumn> columns, Schema schema) {
    Preconditions.checkArgument(type != null, "Invalid index type: null");
    Preconditions.checkArgument(
        columns != null && !columns.isEmpty(), "Cannot define an index without key columns");

    switch (type) {
      case BTREE:
        return new BTreeIndex(
            columns.stream()
                .map(
                    column ->
                        new BTreeEntry(
                            ordinal(column, schema),
                            column.ascending() ? SortDirection.ASC : SortDirection.DESC))
                .collect(Collectors.toList()));
      case BITMAP:
        return new BitmapIndex(
            columns.stream().map(column -> ordinal(column, schema)).collect(Collectors.toList()));
      default:
        throw new UnsupportedOperationException("Unknown index type: " + type);
    }
  }

  private static int ordinal(IndexColumn column, Schema schema) {
    Integer ordinal = schema.ordinal(column.columnName());
    if (ordinal == null) {
      throw new ColumnNotFoundException(
          "Cannot find column %s in schema %s", column.columnName(), schema.asStruct());
    }

    return ordinal;
  }

  /** Returns the columns of a definition by name, as they would be requested to recreate it. */
  public static List<IndexColumn> toIndexColumns(IndexDefinition definition, Schema schema) {
    return definition.accept(
        new IndexDefinition.Visitor<List<IndexColumn>>() {
          @Override
          public List<IndexColumn> btree(BTreeIndex index) {
            ImmutableList.Builder<IndexColumn> columns = ImmutableList.builder();
            for (BTreeEntry entry : index.entries()) {
              String name = schema.column(entry.ordinal()).name();
              columns.add(
                  entry.direction() == SortDirection.ASC
                      ? IndexColumn.asc(name)
                      : IndexColumn.desc(name));
            }
            return columns.build();
          }

          @Override
          public List<IndexColumn> bitmap(BitmapIndex index) {
            return index.ordinals().stream()
                .map(ordinal -> IndexColumn.asc(schema.column(ordinal).name()))
                .collect(ImmutableList.toImmutableList());
          }
        });
  }

  /** Returns the schema of the index key: the key columns of {@code schema}, in key order. */
  public static Schema keySchema(IndexDefinition definition, Schema schema) {
    return schema.select(definition.ordinals());
  }

  /** Returns the per-field sort directions of the index key. */
  public static List<SortDirection> directions(IndexDefinition definition) {
    return definition.accept(
        new IndexDefinition.Visitor<List<SortDirection>>() {
          @Override
          public List<SortDirection> btree(BTreeIndex index) {
            return index.entries().stream()
                .map(BTreeEntry::direction)
                .collect(ImmutableList.toImmutableList());
          }

          @Override
          public List<SortDirection> bitmap(BitmapIndex index) {
            return index.ordinals().stream()
                .map(ordinal -> SortDirection.ASC)
                .collect(ImmutableList.toImmutableList());
          }
        });
  }

  /**
   * Checks that an index name can be embedded in segment file names.
   *
   * @throws IllegalArgumentException if the name is empty or contains '.' or '/'
   */
  public static void validateName(String name) {
    Preconditions.checkArgument(
        name != null && !name.isEmpty(), "Invalid index name: null or empty");
    Preconditions.checkArgument(
        name.indexOf('.') < 0 && name.indexOf('/') < 0,
        "Invalid index name %s: must not contain '.' or '/'",
        name);
  }
}
