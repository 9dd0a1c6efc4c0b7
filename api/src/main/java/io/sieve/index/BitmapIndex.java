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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;

public class BitmapIndex implements IndexDefinition {
  private static final Joiner COMMA = Joiner.on(", ");

  private final List<Integer> ordinals;

  public static BitmapIndex of(Integer... ordinals) {
    return new BitmapIndex(Arrays.asList(ordinals));
  }

  public BitmapIndex(List<Integer> ordinals) {
    Preconditions.checkArgument(
        ordinals != null && !ordinals.isEmpty(), "Invalid bitmap index: no key columns");
    for (Integer ordinal : ordinals) {
      Preconditions.checkArgument(
          ordinal != null && ordinal >= 0, "Invalid column ordinal: %s", ordinal);
    }

    this.ordinals = ImmutableList.copyOf(ordinals);
  }

  @Override
  public IndexType type() {
    return IndexType.BITMAP;
  }

  @Override
  public List<Integer> ordinals() {
    return ordinals;
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.bitmap(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof BitmapIndex)) {
      return false;
    }

    return ordinals.equals(((BitmapIndex) o).ordinals);
  }

  @Override
  public int hashCode() {
    return ordinals.hashCode();
  }

  @Override
  public String toString() {
    return "bitmap(" + COMMA.join(ordinals) + ")";
  }
}
