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

import com.google.common.base.Preconditions;
import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import io.sieve.StructLike;
import io.sieve.exceptions.CorruptStatisticsException;
import io.sieve.expressions.RangeInterval;
import io.sieve.index.KeyCodec;
import io.sieve.index.KeyComparator;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Approximate membership of the keys in a segment.
 *
 * <p>Only point lookups can be pruned: the segment is skipped when every interval is a single
 * full key that the filter reports as absent. Payload is the filter in Guava's {@link
 * BloomFilter#writeTo} format.
 */
public class BloomFilterStatistics extends BaseStatistics {
  public static final int DEFAULT_EXPECTED_KEYS = 10000;
  public static final double DEFAULT_FPP = 0.01;

  private final int expectedKeys;
  private final double fpp;
  private BloomFilter<byte[]> filter = null;
  private boolean empty = true;

  public BloomFilterStatistics() {
    this(DEFAULT_EXPECTED_KEYS, DEFAULT_FPP);
  }

  public BloomFilterStatistics(int expectedKeys, double fpp) {
    Preconditions.checkArgument(expectedKeys > 0, "Invalid expected keys: %s", expectedKeys);
    Preconditions.checkArgument(fpp > 0.0 && fpp < 1.0, "Invalid false positive rate: %s", fpp);
    this.expectedKeys = expectedKeys;
    this.fpp = fpp;
  }

  @Override
  public StatisticsType type() {
    return StatisticsType.BLOOM_FILTER;
  }

  @Override
  protected void reset() {
    this.filter = BloomFilter.create(Funnels.byteArrayFunnel(), expectedKeys, fpp);
    this.empty = true;
  }

  @Override
  public void observe(StructLike key) {
    filter.put(KeyCodec.toBytes(keyType(), key));
    this.empty = false;
  }

  /** Returns true if the key may have been observed, false if it definitely was not. */
  public boolean mightContain(StructLike key) {
    return !empty && filter.mightContain(KeyCodec.toBytes(keyType(), key));
  }

  @Override
  protected ByteBuffer payload() {
    if (empty) {
      return ByteBuffer.allocate(0);
    }

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      filter.writeTo(out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize bloom filter", e);
    }

    return ByteBuffer.wrap(out.toByteArray());
  }

  @Override
  protected void readPayload(ByteBuffer payload) {
    if (!payload.hasRemaining()) {
      return;
    }

    byte[] bytes = new byte[payload.remaining()];
    payload.get(bytes);
    try {
      this.filter =
          BloomFilter.readFrom(new ByteArrayInputStream(bytes), Funnels.byteArrayFunnel());
      this.empty = false;
    } catch (IOException | RuntimeException e) {
      throw new CorruptStatisticsException(
          e, "Invalid bloom filter payload (%s bytes)", bytes.length);
    }
  }

  @Override
  public StatisticsResult prune(List<RangeInterval> intervals) {
    if (empty || intervals.isEmpty()) {
      return StatisticsResult.USE_INDEX;
    }

    KeyComparator comparator = new KeyComparator(keyType());
    int keySize = keyType().fields().size();
    for (RangeInterval interval : intervals) {
      if (!isFullKeyPoint(interval, comparator, keySize) || mightContain(interval.start())) {
        return StatisticsResult.USE_INDEX;
      }
    }

    return StatisticsResult.SKIP;
  }

  private static boolean isFullKeyPoint(
      RangeInterval interval, KeyComparator comparator, int keySize) {
    return interval.hasStart()
        && interval.hasEnd()
        && interval.startInclusive()
        && interval.endInclusive()
        && interval.start().size() == keySize
        && interval.end().size() == keySize
        && comparator.compare(interval.start(), interval.end()) == 0;
  }
}
