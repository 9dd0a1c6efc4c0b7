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
import io.sieve.expressions.RangeInterval;
import io.sieve.types.Types;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * A summary of the keys written to one index segment.
 *
 * <p>An instance is used either to build a summary ({@link #initialize}, then {@link #observe} for
 * every key, then {@link #serialize}) or to query one ({@link #initialize}, then {@link
 * #deserialize}, then {@link #prune}). Instances are not thread-safe; every build task creates its
 * own.
 *
 * <p>Serialized statistics are a record: {@code [record id: int][payload length: int][payload]},
 * little-endian. An empty payload means no key was observed.
 */
public interface Statistics {

  StatisticsType type();

  /** Resets all state and sets the key type used to compare and encode keys. */
  void initialize(Types.StructType keyType);

  /** Adds one key to the summary. */
  void observe(StructLike key);

  /** Returns the serialized record, positioned at zero. */
  ByteBuffer serialize();

  /**
   * Reads a record written by {@link #serialize()} starting at {@code offset}.
   *
   * @return the number of bytes consumed
   * @throws io.sieve.exceptions.CorruptStatisticsException if the record id does not match this
   *     kind or a length runs past the end of the buffer
   */
  int deserialize(ByteBuffer bytes, int offset);

  /**
   * Decides whether the segment can be skipped for a union of key intervals.
   *
   * <p>Must only return {@link StatisticsResult#SKIP} when no key in the segment can fall in any of
   * the intervals. A summary with no observed keys never skips.
   */
  StatisticsResult prune(List<RangeInterval> intervals);
}
