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
package io.sieve.data;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import io.sieve.Schema;
import io.sieve.StructLike;
import io.sieve.types.Types;
import io.sieve.types.Types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * A mutable row backed by an object array.
 *
 * <p>Used for rows handed to build tasks, for index keys, and for command output.
 */
public class GenericRow implements StructLike {
  private static final LoadingCache<StructType, Map<String, Integer>> NAME_MAP_CACHE =
      Caffeine.newBuilder()
          .weakKeys()
          .build(
              struct -> {
                Map<String, Integer> nameToPos = Maps.newHashMap();
                List<Types.NestedField> fields = struct.fields();
                for (int i = 0; i < fields.size(); i += 1) {
                  nameToPos.put(fields.get(i).name(), i);
                }
                return nameToPos;
              });

  public static GenericRow create(Schema schema) {
    return new GenericRow(schema.asStruct());
  }

  public static GenericRow create(StructType struct) {
    return new GenericRow(struct);
  }

  /** Creates a row with the given values, in field order. */
  public static GenericRow of(StructType struct, Object... values) {
    Preconditions.checkArgument(
        values.length == struct.fields().size(),
        "Invalid number of values for %s: %s",
        struct,
        values.length);
    GenericRow row = new GenericRow(struct);
    System.arraycopy(values, 0, row.values, 0, values.length);
    return row;
  }

  private final StructType struct;
  private final int size;
  private final Object[] values;
  private final Map<String, Integer> nameToPos;

  private GenericRow(StructType struct) {
    this.struct = struct;
    this.size = struct.fields().size();
    this.values = new Object[size];
    this.nameToPos = NAME_MAP_CACHE.get(struct);
  }

  private GenericRow(GenericRow toCopy) {
    this.struct = toCopy.struct;
    this.size = toCopy.size;
    this.values = Arrays.copyOf(toCopy.values, toCopy.values.length);
    this.nameToPos = toCopy.nameToPos;
  }

  public StructType struct() {
    return struct;
  }

  public Object getField(String name) {
    Integer pos = nameToPos.get(name);
    if (pos != null) {
      return values[pos];
    }

    return null;
  }

  public void setField(String name, Object value) {
    Integer pos = nameToPos.get(name);
    Preconditions.checkArgument(pos != null, "Cannot set unknown field named: %s", name);
    values[pos] = value;
  }

  @Override
  public int size() {
    return size;
  }

  public Object get(int pos) {
    return values[pos];
  }

  @Override
  public <T> T get(int pos, Class<T> javaClass) {
    Object value = get(pos);
    if (value == null || javaClass.isInstance(value)) {
      return javaClass.cast(value);
    } else {
      throw new IllegalStateException("Not an instance of " + javaClass.getName() + ": " + value);
    }
  }

  @Override
  public <T> void set(int pos, T value) {
    values[pos] = value;
  }

  public GenericRow copy() {
    return new GenericRow(this);
  }

  /**
   * Returns a new row holding the values of {@code row} at the given positions.
   *
   * @param row a source row
   * @param projected the struct type of the result
   * @param ordinals positions in {@code row}, one per field of {@code projected}
   * @return a projected copy
   */
  public static GenericRow project(StructLike row, StructType projected, List<Integer> ordinals) {
    Preconditions.checkArgument(
        projected.fields().size() == ordinals.size(),
        "Cannot project %s ordinals into %s",
        ordinals.size(),
        projected);
    GenericRow result = new GenericRow(projected);
    for (int i = 0; i < ordinals.size(); i += 1) {
      result.values[i] = row.get(ordinals.get(i), Object.class);
    }
    return result;
  }

  /** Returns a copy of any {@link StructLike} as a row of {@code struct}. */
  public static GenericRow copyOf(StructType struct, StructLike row) {
    if (row instanceof GenericRow) {
      return ((GenericRow) row).copy();
    }

    GenericRow result = new GenericRow(struct);
    for (int i = 0; i < result.size; i += 1) {
      result.values[i] = row.get(i, Object.class);
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("Row(");
    for (int i = 0; i < values.length; i += 1) {
      if (i != 0) {
        sb.append(", ");
      }
      sb.append(values[i]);
    }
    sb.append(")");
    return sb.toString();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    } else if (!(other instanceof GenericRow)) {
      return false;
    }

    GenericRow that = (GenericRow) other;
    return Arrays.deepEquals(this.values, that.values);
  }

  @Override
  public int hashCode() {
    return 17 * Arrays.deepHashCode(values);
  }
}
