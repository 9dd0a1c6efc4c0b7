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
package io.sieve;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.sieve.types.Type;
import io.sieve.types.Types.NestedField;
import io.sieve.types.Types.StructType;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The schema of a relation or of a partition directory.
 *
 * <p>Columns are addressed by ordinal: index definitions store the position of each key column in
 * the schema that was live when the index was built.
 */
public class Schema implements Serializable {
  private static final Joiner NEWLINE = Joiner.on('\n');

  private final StructType struct;

  // lazy values
  private transient Map<String, Integer> nameToOrdinal = null;

  public Schema(List<NestedField> columns) {
    Preconditions.checkArgument(columns != null, "Invalid columns: null");
    this.struct = StructType.of(columns);
    // validates name uniqueness
    lazyNameToOrdinal();
  }

  public Schema(NestedField... columns) {
    this(Arrays.asList(columns));
  }

  /**
   * Returns the underlying {@link StructType struct type} for this schema.
   *
   * @return the StructType version of this schema.
   */
  public StructType asStruct() {
    return struct;
  }

  /** Returns a List of the {@link NestedField columns} in this Schema. */
  public List<NestedField> columns() {
    return struct.fields();
  }

  public int size() {
    return struct.fields().size();
  }

  /**
   * Returns a top-level column by name.
   *
   * @param name a column name
   * @return the column or null if it is not found
   */
  public NestedField findField(String name) {
    Integer ordinal = ordinal(name);
    return ordinal != null ? columns().get(ordinal) : null;
  }

  /**
   * Returns the {@link Type} of a column identified by name.
   *
   * @param name a column name
   * @return a Type for the column or null if it is not found
   */
  public Type findType(String name) {
    NestedField field = findField(name);
    return field != null ? field.type() : null;
  }

  /**
   * Returns the position of a column in this schema.
   *
   * @param name a column name
   * @return the column's ordinal or null if it is not found
   */
  public Integer ordinal(String name) {
    Preconditions.checkArgument(!name.isEmpty(), "Invalid column name: (empty)");
    return lazyNameToOrdinal().get(name);
  }

  /** Returns the column at the given position. */
  public NestedField column(int ordinal) {
    Preconditions.checkElementIndex(ordinal, size(), "Invalid column ordinal");
    return columns().get(ordinal);
  }

  /**
   * Creates a projection schema for the columns at the given positions, in the given order.
   *
   * @param ordinals column positions
   * @return a projection schema
   */
  public Schema select(List<Integer> ordinals) {
    return new Schema(
        ordinals.stream().map(this::column).collect(ImmutableList.toImmutableList()));
  }

  /**
   * Creates a projection schema for a subset of columns, selected by name, in the given order.
   *
   * @param names column names
   * @return a projection schema
   */
  public Schema selectByName(Collection<String> names) {
    ImmutableList.Builder<NestedField> selected = ImmutableList.builder();
    for (String name : names) {
      NestedField field = findField(name);
      Preconditions.checkArgument(field != null, "Cannot find column: %s", name);
      selected.add(field);
    }

    return new Schema(selected.build());
  }

  /**
   * Returns true when both schemas have the same columns in the same order.
   *
   * @param anotherSchema another schema
   * @return true if this schema and the other have the same columns
   */
  public boolean sameSchema(Schema anotherSchema) {
    return asStruct().equals(anotherSchema.asStruct());
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof Schema)) {
      return false;
    }

    return sameSchema((Schema) other);
  }

  @Override
  public int hashCode() {
    return struct.hashCode();
  }

  private Map<String, Integer> lazyNameToOrdinal() {
    if (nameToOrdinal == null) {
      ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
      List<NestedField> fields = struct.fields();
      for (int pos = 0; pos < fields.size(); pos += 1) {
        builder.put(fields.get(pos).name(), pos);
      }

      try {
        this.nameToOrdinal = builder.buildOrThrow();
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid schema: duplicate column names", e);
      }
    }

    return nameToOrdinal;
  }

  @Override
  public String toString() {
    return String.format(
        "table {\n%s\n}",
        NEWLINE.join(
            struct.fields().stream().map(field -> "  " + field).collect(Collectors.toList())));
  }
}
