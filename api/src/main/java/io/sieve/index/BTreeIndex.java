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

public class BTreeIndex implements IndexDefinition {
  private static final Joiner COMMA = Joiner.on(", ");

  private final List<BTreeEntry> entries;

  public static BTreeIndex of(BTreeEntry... entries) {
    return new BTreeIndex(Arrays.asList(entries));
  }

  public BTreeIndex(List<BTreeEntry> entries) {
    Preconditions.checkArgument(
        entries != null && !entries.isEmpty(), "Invalid B-tree index: no key columns");
    this.entries = ImmutableList.copyOf(entries);
  }

  public List<BTreeEntry> entries() {
    return entries;
  }

  @Override
  public IndexType type() {
    return IndexType.BTREE;
  }

  @Override
  public List<Integer> ordinals() {
    return entries.stream().map(BTreeEntry::ordinal).collect(ImmutableList.toImmutableList());
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.btree(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof BTreeIndex)) {
      return false;
    }

    return entries.equals(((BTreeIndex) o).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return "btree(" + COMMA.join(entries) + ")";
  }
}
