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
package io.sieve.statistics;

import io.sieve.StructLike;
import io.sieve.data.GenericRow;
import io.sieve.exceptions.CorruptStatisticsException;
import io.sieve.expressions.RangeInterval;
import io.sieve.index.KeyCodec;
import io.sieve.index.KeyComparator;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Tracks the smallest and largest key of a segment.
 *
 * <p>Payload: {@code [min length: int][min key][max length: int][max key]}, keys encoded with
 * {@link KeyCodec}.
 */
public class MinMaxStatistics extends BaseStatistics {
  private KeyComparator comparator = null;
  private StructLike min = null;
  private StructLike max = null;

  @Override
  public StatisticsType type() {
    return StatisticsType.MIN_MAX;
  }

  @Override
  protected void reset() {
    this.comparator = new KeyComparator(keyType());
    this.min = null;
    this.max = null;
  }

  @Override
  public void observe(StructLike key) {
    if (min == null) {
      this.min = GenericRow.copyOf(keyType(), key);
      this.max = min;
      return;
    }

    if (comparator.compare(key, min) < 0) {
      this.min = GenericRow.copyOf(keyType(), key);
    }

    if (comparator.compare(key, max) > 0) {
      this.max = GenericRow.copyOf(keyType(), key);
    }
  }

  /** Returns the smallest observed key, or null if no key was observed. */
  public StructLike min() {
    return min;
  }

  /** Returns the largest observed key, or null if no key was observed. */
  public StructLike max() {
    return max;
  }

  @Override
  protected ByteBuffer payload() {
    if (min == null) {
      return ByteBuffer.allocate(0);
    }

    ByteBuffer minBytes = KeyCodec.encode(keyType(), min);
    ByteBuffer maxBytes = KeyCodec.encode(keyType(), max);
    ByteBuffer payload =
        ByteBuffer.allocate(2 * Integer.BYTES + minBytes.remaining() + maxBytes.remaining())
            .order(ByteOrder.LITTLE_ENDIAN);
    payload.putInt(minBytes.remaining()).put(minBytes);
    payload.putInt(maxBytes.remaining()).put(maxBytes);
    payload.flip();
    return payload;
  }

  @Override
  protected void readPayload(ByteBuffer payload) {
    if (!payload.hasRemaining()) {
      return;
    }

    this.min = KeyCodec.decode(keyType(), readKeyBytes(payload, "min"));
    this.max = KeyCodec.decode(keyType(), readKeyBytes(payload, "max"));
    if (payload.hasRemaining()) {
      throw new CorruptStatisticsException(
          "Invalid min/max statistics: %s trailing bytes", payload.remaining());
    }
  }

  private static ByteBuffer readKeyBytes(ByteBuffer payload, String bound) {
    if (payload.remaining() < Integer.BYTES) {
      throw new CorruptStatisticsException(
          "Truncated min/max statistics: missing %s length", bound);
    }

    int length = payload.getInt();
    if (length < 0 || length > payload.remaining()) {
      throw new CorruptStatisticsException(
          "Invalid %s key length %s: %s bytes remaining", bound, length, payload.remaining());
    }

    ByteBuffer key = payload.slice();
    key.limit(length);
    payload.position(payload.position() + length);
    return key;
  }

  @Override
  public StatisticsResult prune(List<RangeInterval> intervals) {
    if (min == null || intervals.isEmpty()) {
      return StatisticsResult.USE_INDEX;
    }

    for (RangeInterval interval : intervals) {
      if (mightMatch(interval)) {
        return StatisticsResult.USE_INDEX;
      }
    }

    return StatisticsResult.SKIP;
  }

  private boolean mightMatch(RangeInterval interval) {
    if (interval.hasStart()) {
      // every key is at most max: nothing can be at or above a start past max
      int cmp = comparator.compare(interval.start(), max);
      if (cmp > 0 || (cmp == 0 && !interval.startInclusive())) {
        return false;
      }
    }

    if (interval.hasEnd()) {
      // every key is at least min: nothing can be at or below an end before min
      int cmp = comparator.compare(interval.end(), min);
      if (cmp < 0 || (cmp == 0 && !interval.endInclusive())) {
        return false;
      }
    }

    return true;
  }
}
