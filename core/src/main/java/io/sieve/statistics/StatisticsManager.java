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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.sieve.StructLike;
import io.sieve.exceptions.CorruptStatisticsException;
import io.sieve.expressions.RangeInterval;
import io.sieve.types.Types;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Keeps every configured statistics kind for one index segment.
 *
 * <p>The statistics block of a segment is {@code [record count: int]} followed by one record per
 * kind, in configuration order. When reading, each record's id selects the kind.
 */
public class StatisticsManager {
  private final StatisticsOptions options;
  private List<Statistics> statistics = ImmutableList.of();
  private long observed = 0L;

  public StatisticsManager(StatisticsOptions options) {
    Preconditions.checkArgument(options != null, "Invalid statistics options: null");
    this.options = options;
  }

  /** Creates fresh statistics of every configured kind for keys of {@code keyType}. */
  public void initialize(Types.StructType keyType) {
    List<Statistics> fresh = Lists.newArrayList();
    for (StatisticsType type : options.types()) {
      Statistics stats = options.newStatistics(type);
      stats.initialize(keyType);
      fresh.add(stats);
    }

    this.statistics = ImmutableList.copyOf(fresh);
    this.observed = 0L;
  }

  public void observe(StructLike key) {
    for (Statistics stats : statistics) {
      stats.observe(key);
    }
    observed += 1;
  }

  /** Returns the number of keys observed since the last {@link #initialize}. */
  public long observedCount() {
    return observed;
  }

  public List<Statistics> statistics() {
    return statistics;
  }

  public ByteBuffer serialize() {
    List<ByteBuffer> records = Lists.newArrayList();
    int size = Integer.BYTES;
    for (Statistics stats : statistics) {
      ByteBuffer record = stats.serialize();
      records.add(record);
      size += record.remaining();
    }

    ByteBuffer block = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    block.putInt(records.size());
    for (ByteBuffer record : records) {
      block.put(record);
    }

    block.flip();
    return block;
  }

  /**
   * Reads a statistics block written by {@link #serialize()}.
   *
   * @throws CorruptStatisticsException if the block is truncated or holds an unknown record id
   */
  public static StatisticsManager read(Types.StructType keyType, ByteBuffer block) {
    ByteBuffer in = block.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    if (in.remaining() < Integer.BYTES) {
      throw new CorruptStatisticsException("Truncated statistics block: missing record count");
    }

    int count = in.getInt();
    if (count < 0) {
      throw new CorruptStatisticsException("Invalid statistics record count: %s", count);
    }

    StatisticsOptions readOptions = StatisticsOptions.defaults();
    List<Statistics> loaded = Lists.newArrayList();
    List<StatisticsType> types = Lists.newArrayList();
    int offset = in.position();
    for (int i = 0; i < count; i += 1) {
      if (in.limit() - offset < Integer.BYTES) {
        throw new CorruptStatisticsException(
            "Truncated statistics block: missing record %s of %s", i + 1, count);
      }

      int id = in.getInt(offset);
      StatisticsType type = StatisticsType.fromId(id);
      if (type == null) {
        throw new CorruptStatisticsException("Unknown statistics record id: %s", id);
      }

      Statistics stats = readOptions.newStatistics(type);
      stats.initialize(keyType);
      offset += stats.deserialize(in, offset);
      loaded.add(stats);
      types.add(type);
    }

    StatisticsManager manager =
        new StatisticsManager(
            new StatisticsOptions(
                types, readOptions.bloomFilterExpectedKeys(), readOptions.bloomFilterFpp()));
    manager.statistics = ImmutableList.copyOf(loaded);
    return manager;
  }

  /**
   * Returns {@link StatisticsResult#SKIP} if any statistics kind proves the segment cannot match.
   */
  public StatisticsResult prune(List<RangeInterval> intervals) {
    for (Statistics stats : statistics) {
      if (stats.prune(intervals) == StatisticsResult.SKIP) {
        return StatisticsResult.SKIP;
      }
    }

    return StatisticsResult.USE_INDEX;
  }
}
