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
package io.sieve.expressions;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.sieve.StructLike;
import java.io.Serializable;
import java.util.Objects;

/**
 * A contiguous range over an index key.
 *
 * <p>A missing bound ({@code null}) is unbounded on that side; its inclusive flag is ignored. A
 * query is a union of intervals: a row matches when its key falls in at least one of them.
 */
public class RangeInterval implements Serializable {
  private static final RangeInterval ALL = new RangeInterval(null, true, null, true);

  public static RangeInterval all() {
    return ALL;
  }

  public static RangeInterval point(StructLike key) {
    Preconditions.checkArgument(key != null, "Invalid point: null");
    return new RangeInterval(key, true, key, true);
  }

  public static RangeInterval atLeast(StructLike start) {
    return new RangeInterval(requireBound(start), true, null, true);
  }

  public static RangeInterval greaterThan(StructLike start) {
    return new RangeInterval(requireBound(start), false, null, true);
  }

  public static RangeInterval atMost(StructLike end) {
    return new RangeInterval(null, true, requireBound(end), true);
  }

  public static RangeInterval lessThan(StructLike end) {
    return new RangeInterval(null, true, requireBound(end), false);
  }

  public static RangeInterval between(
      StructLike start, boolean startInclusive, StructLike end, boolean endInclusive) {
    return new RangeInterval(requireBound(start), startInclusive, requireBound(end), endInclusive);
  }

  public static RangeInterval of(
      StructLike start, boolean startInclusive, StructLike end, boolean endInclusive) {
    return new RangeInterval(start, startInclusive, end, endInclusive);
  }

  private static StructLike requireBound(StructLike bound) {
    Preconditions.checkArgument(bound != null, "Invalid bound: null");
    return bound;
  }

  private final StructLike start;
  private final boolean startInclusive;
  private final StructLike end;
  private final boolean endInclusive;

  private RangeInterval(
      StructLike start, boolean startInclusive, StructLike end, boolean endInclusive) {
    this.start = start;
    this.startInclusive = startInclusive;
    this.end = end;
    this.endInclusive = endInclusive;
  }

  /** Returns the lower bound, or null if the interval is unbounded below. */
  public StructLike start() {
    return start;
  }

  public boolean startInclusive() {
    return startInclusive;
  }

  /** Returns the upper bound, or null if the interval is unbounded above. */
  public StructLike end() {
    return end;
  }

  public boolean endInclusive() {
    return endInclusive;
  }

  public boolean hasStart() {
    return start != null;
  }

  public boolean hasEnd() {
    return end != null;
  }

  /** Returns true if this interval is bounded on both sides by the same inclusive key. */
  public boolean isPoint() {
    return start != null && startInclusive && endInclusive && start.equals(end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof RangeInterval)) {
      return false;
    }

    RangeInterval that = (RangeInterval) o;
    return startInclusive == that.startInclusive
        && endInclusive == that.endInclusive
        && Objects.equals(start, that.start)
        && Objects.equals(end, that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, startInclusive, end, endInclusive);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("start", start == null ? "-inf" : start)
        .add("startInclusive", startInclusive)
        .add("end", end == null ? "+inf" : end)
        .add("endInclusive", endInclusive)
        .toString();
  }
}
