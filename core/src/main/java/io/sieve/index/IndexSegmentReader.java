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

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import io.sieve.StructLike;
import io.sieve.exceptions.CorruptIndexException;
import io.sieve.exceptions.CorruptStatisticsException;
import io.sieve.expressions.RangeInterval;
import io.sieve.io.InputFile;
import io.sieve.io.SeekableInputStream;
import io.sieve.statistics.StatisticsManager;
import io.sieve.statistics.StatisticsResult;
import io.sieve.types.Types;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import org.roaringbitmap.InvalidRoaringFormat;
import org.roaringbitmap.RoaringBitmap;

/** Reads an index segment written by {@link IndexSegmentWriter}. */
public class IndexSegmentReader {
  private static final byte[] MAGIC = IndexSegmentFormat.getMagic();

  private final IndexType type;
  private final List<StructLike> keys;
  private final List<RoaringBitmap> positions;
  private final StatisticsManager statistics;
  private final KeyComparator comparator;

  private IndexSegmentReader(
      IndexType type,
      Types.StructType keyType,
      List<StructLike> keys,
      List<RoaringBitmap> positions,
      StatisticsManager statistics) {
    this.type = type;
    this.keys = keys;
    this.positions = positions;
    this.statistics = statistics;
    this.comparator = new KeyComparator(keyType);
  }

  /**
   * Reads a segment file.
   *
   * @param file a segment file
   * @param keyType the key type of the index
   * @return a reader over the segment's keys
   * @throws CorruptIndexException if the segment framing is invalid
   * @throws CorruptStatisticsException if the statistics block is invalid
   */
  public static IndexSegmentReader read(InputFile file, Types.StructType keyType) {
    byte[] bytes;
    try (SeekableInputStream in = file.newStream()) {
      bytes = ByteStreams.toByteArray(in);
    } catch (IOException e) {
      throw new UncheckedIOException(
          String.format("Failed to read index segment: %s", file.location()), e);
    }

    return read(ByteBuffer.wrap(bytes), keyType);
  }

  static IndexSegmentReader read(ByteBuffer segment, Types.StructType keyType) {
    ByteBuffer in = segment.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    int base = in.position();
    int length = in.remaining();
    if (length < IndexSegmentFormat.HEADER_LENGTH + IndexSegmentFormat.FOOTER_LENGTH) {
      throw new CorruptIndexException("Truncated index segment: %s bytes", length);
    }

    checkMagic(in, base, "header");
    checkMagic(in, in.limit() - MAGIC.length, "footer");

    long statisticsOffset = in.getLong(in.limit() - IndexSegmentFormat.FOOTER_LENGTH);
    long statisticsEnd = length - IndexSegmentFormat.FOOTER_LENGTH;
    if (statisticsOffset < IndexSegmentFormat.HEADER_LENGTH || statisticsOffset > statisticsEnd) {
      throw new CorruptIndexException("Invalid statistics offset: %s", statisticsOffset);
    }

    in.position(base + MAGIC.length);
    IndexType type = IndexSegmentFormat.fromTypeId(in.get());
    int keyCount = in.getInt();
    if (keyCount < 0) {
      throw new CorruptIndexException("Invalid key count: %s", keyCount);
    }

    ImmutableList.Builder<StructLike> keys = ImmutableList.builder();
    ImmutableList.Builder<RoaringBitmap> positions = ImmutableList.builder();
    ByteBuffer entries = in.slice().order(ByteOrder.LITTLE_ENDIAN);
    entries.limit((int) statisticsOffset - IndexSegmentFormat.HEADER_LENGTH);
    for (int i = 0; i < keyCount; i += 1) {
      keys.add(KeyCodec.decode(keyType, readBytes(entries, "key")));
      positions.add(readPositions(type, entries));
    }

    if (entries.hasRemaining()) {
      throw new CorruptIndexException(
          "Invalid index segment: %s unread bytes before statistics", entries.remaining());
    }

    ByteBuffer block = in.duplicate();
    block.position(base + (int) statisticsOffset);
    block.limit(base + (int) statisticsEnd);
    StatisticsManager statistics = StatisticsManager.read(keyType, block.slice());

    return new IndexSegmentReader(type, keyType, keys.build(), positions.build(), statistics);
  }

  private static void checkMagic(ByteBuffer in, int offset, String where) {
    byte[] magic = new byte[MAGIC.length];
    for (int i = 0; i < MAGIC.length; i += 1) {
      magic[i] = in.get(offset + i);
    }

    if (!Arrays.equals(MAGIC, magic)) {
      throw new CorruptIndexException(
          "Invalid index segment %s magic: %s", where, Arrays.toString(magic));
    }
  }

  private static ByteBuffer readBytes(ByteBuffer in, String what) {
    if (in.remaining() < Integer.BYTES) {
      throw new CorruptIndexException("Truncated index segment: missing %s length", what);
    }

    int length = in.getInt();
    if (length < 0 || length > in.remaining()) {
      throw new CorruptIndexException(
          "Invalid %s length %s: %s bytes remaining", what, length, in.remaining());
    }

    ByteBuffer bytes = in.slice();
    bytes.limit(length);
    in.position(in.position() + length);
    return bytes;
  }

  private static RoaringBitmap readPositions(IndexType type, ByteBuffer in) {
    switch (type) {
      case BTREE:
        if (in.remaining() < Integer.BYTES) {
          throw new CorruptIndexException("Truncated index segment: missing position count");
        }

        int count = in.getInt();
        if (count < 0 || (long) count * Integer.BYTES > in.remaining()) {
          throw new CorruptIndexException("Invalid position count: %s", count);
        }

        RoaringBitmap rows = new RoaringBitmap();
        for (int i = 0; i < count; i += 1) {
          rows.add(in.getInt());
        }
        return rows;

      case BITMAP:
        ByteBuffer serialized = readBytes(in, "bitmap");
        byte[] bitmapBytes = new byte[serialized.remaining()];
        serialized.get(bitmapBytes);
        RoaringBitmap bitmap = new RoaringBitmap();
        try {
          bitmap.deserialize(ByteStreams.newDataInput(bitmapBytes));
        } catch (IOException | InvalidRoaringFormat e) {
          throw new CorruptIndexException(e, "Invalid bitmap of row positions");
        }
        return bitmap;

      default:
        throw new UnsupportedOperationException("Unsupported index type: " + type);
    }
  }

  public IndexType type() {
    return type;
  }

  /** Returns the distinct keys of the segment, in the order they were written. */
  public List<StructLike> keys() {
    return keys;
  }

  public int keyCount() {
    return keys.size();
  }

  /** Returns the row positions of the key at {@code index} in {@link #keys()}. */
  public RoaringBitmap positions(int index) {
    return positions.get(index).clone();
  }

  public StatisticsManager statistics() {
    return statistics;
  }

  public StatisticsResult prune(List<RangeInterval> intervals) {
    return statistics.prune(intervals);
  }

  /**
   * Returns the row positions whose key falls in at least one of the intervals.
   *
   * <p>An empty interval list places no restriction and returns every row.
   */
  public RoaringBitmap lookup(List<RangeInterval> intervals) {
    RoaringBitmap result = new RoaringBitmap();
    for (int i = 0; i < keys.size(); i += 1) {
      if (intervals.isEmpty() || matchesAny(keys.get(i), intervals)) {
        result.or(positions.get(i));
      }
    }

    return result;
  }

  private boolean matchesAny(StructLike key, List<RangeInterval> intervals) {
    for (RangeInterval interval : intervals) {
      if (contains(interval, key)) {
        return true;
      }
    }

    return false;
  }

  private boolean contains(RangeInterval interval, StructLike key) {
    if (interval.hasStart()) {
      int cmp = comparator.compare(key, interval.start());
      if (cmp < 0 || (cmp == 0 && !interval.startInclusive())) {
        return false;
      }
    }

    if (interval.hasEnd()) {
      int cmp = comparator.compare(key, interval.end());
      if (cmp > 0 || (cmp == 0 && !interval.endInclusive())) {
        return false;
      }
    }

    return true;
  }
}
