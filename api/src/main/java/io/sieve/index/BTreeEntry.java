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
import java.io.Serializable;
import java.util.Objects;

/** One key column of a {@link BTreeIndex}. */
public class BTreeEntry implements Serializable {
  private final int ordinal;
  private final SortDirection direction;

  public static BTreeEntry asc(int ordinal) {
    return new BTreeEntry(ordinal, SortDirection.ASC);
  }

  public static BTreeEntry desc(int ordinal) {
    return new BTreeEntry(ordinal, SortDirection.DESC);
  }

  public BTreeEntry(int ordinal, SortDirection direction) {
    Preconditions.checkArgument(ordinal >= 0, "Invalid column ordinal: %s", ordinal);
    Preconditions.checkArgument(direction != null, "Invalid sort direction: null");
    this.ordinal = ordinal;
    this.direction = direction;
  }

  public int ordinal() {
    return ordinal;
  }

  public SortDirection direction() {
    return direction;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof BTreeEntry)) {
      return false;
    }

    BTreeEntry that = (BTreeEntry) o;
    return ordinal == that.ordinal && direction == that.direction;
  }

  @Override
  public int hashCode() {
    return Objects.hash(ordinal, direction);
  }

  @Override
  public String toString() {
    return ordinal + " " + direction;
  }
}
