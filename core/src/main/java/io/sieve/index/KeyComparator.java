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
import io.sieve.SortDirection;
import io.sieve.StructLike;
import io.sieve.types.Comparators;
import io.sieve.types.Type;
import io.sieve.types.Types;
import java.util.Comparator;
import java.util.List;

/**
 * Orders index keys by the natural ordering of their fields, nulls first.
 *
 * <p>A bound may have fewer fields than the key type. Only the leading fields present on both
 * sides are compared, so a one-field bound over a two-field key matches every key that shares its
 * first field.
 */
public class KeyComparator implements Comparator<StructLike> {
  private final Comparator<Object>[] comparators;
  private final Class<?>[] classes;

  public KeyComparator(Types.StructType keyType) {
    this(keyType, null);
  }

  /**
   * Creates a comparator that orders each field in the given direction.
   *
   * <p>A descending field reverses the whole field ordering, so its nulls sort last.
   *
   * @param keyType the key type
   * @param directions one direction per key field, or null for all ascending
   */
  @SuppressWarnings("unchecked")
  public KeyComparator(Types.StructType keyType, List<SortDirection> directions) {
    List<Types.NestedField> fields = keyType.fields();
    Preconditions.checkArgument(
        directions == null || directions.size() == fields.size(),
        "Invalid directions for %s: %s",
        keyType,
        directions);
    this.comparators = new Comparator[fields.size()];
    this.classes = new Class<?>[fields.size()];
    for (int pos = 0; pos < fields.size(); pos += 1) {
      Type type = fields.get(pos).type();
      Comparator<Object> valueComparator = Comparators.forType(type.asPrimitiveType());
      Comparator<Object> fieldComparator = Comparator.nullsFirst(valueComparator);
      if (directions != null && directions.get(pos) == SortDirection.DESC) {
        fieldComparator = fieldComparator.reversed();
      }

      this.comparators[pos] = fieldComparator;
      this.classes[pos] = type.typeId().javaClass();
    }
  }

  @Override
  public int compare(StructLike left, StructLike right) {
    if (left == right) {
      return 0;
    }

    int len = Math.min(comparators.length, Math.min(left.size(), right.size()));
    for (int pos = 0; pos < len; pos += 1) {
      int cmp = comparators[pos].compare(left.get(pos, classes[pos]), right.get(pos, classes[pos]));
      if (cmp != 0) {
        return cmp;
      }
    }

    return 0;
  }
}
