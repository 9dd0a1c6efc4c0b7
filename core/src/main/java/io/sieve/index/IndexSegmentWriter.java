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
import com.google.common.collect.Maps;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import com.google.common.io.LittleEndianDataOutputStream;
import io.sieve.StructLike;
import io.sieve.data.GenericRow;
import io.sieve.io.OutputFile;
import io.sieve.io.PositionOutputStream;
import io.sieve.statistics.StatisticsManager;
import io.sieve.types.Types;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.NavigableMap;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;

/**
 * Collects the keys of one data file and writes them as an index segment.
 *
 * <p>B-tree segments keep keys in the index sort order, honoring each column's direction. Bitmap
 * segments keep distinct keys in ascending order. Every added key is also observed by the
 * segment's statistics.
 */
public class IndexSegmentWriter {
  private static final byte[] MAGIC = IndexSegmentFormat.getMagic();

  private final IndexType type;
  private final Types.StructType keyType;
  private final StatisticsManager statistics;
  private final NavigableMap<StructLike, RoaringBitmap> positionsByKey;
  private long rowCount = 0L;

  public IndexSegmentWriter(
      IndexDefinition definition, Types.StructType keyType, StatisticsManager statistics) {
    Preconditions.checkArgument(definition != null, "Invalid index definition: null");
    Preconditions.checkArgument(statistics != null, "Invalid statistics: null");
    Preconditions.checkArgument(
        definition.ordinals().size() == keyType.fields().size(),
        "Invalid key type %s for %s",
        keyType,
        definition);
    this.type = definition.type();
    this.keyType = keyType;
    this.statistics = statistics;
    this.positionsByKey =
        Maps.newTreeMap(new KeyComparator(keyType, IndexDefinitions.directions(definition)));
    statistics.initialize(keyType);
  }

  /** Adds the key of the row at {@code position} in the data file. */
  public void add(StructLike key, int position) {
    RoaringBitmap positions = positionsByKey.get(key);
    if (positions == null) {
      positions = new RoaringBitmap();
      positionsByKey.put(GenericRow.copyOf(keyType, key), positions);
    }

    positions.add(position);
    statistics.observe(key);
    rowCount += 1;
  }

  public long rowCount() {
    return rowCount;
  }

  public int keyCount() {
    return positionsByKey.size();
  }

  /**
   * Writes the segment to a file.
   *
   * @param outputFile the segment location, replaced if it exists
   * @return the length of the written file
   */
  public long write(OutputFile outputFile) {
    try (PositionOutputStream stream = outputFile.createOrOverwrite()) {
      LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(stream);
      out.write(MAGIC);
      out.writeByte(IndexSegmentFormat.typeId(type));
      out.writeInt(positionsByKey.size());
      for (Map.Entry<StructLike, RoaringBitmap> entry : positionsByKey.entrySet()) {
        byte[] key = KeyCodec.toBytes(keyType, entry.getKey());
        out.writeInt(key.length);
        out.write(key);
        writePositions(out, entry.getValue());
      }

      out.flush();
      long statisticsOffset = stream.getPos();
      ByteBuffer block = statistics.serialize();
      out.write(block.array(), block.arrayOffset() + block.position(), block.remaining());
      out.writeLong(statisticsOffset);
      out.write(MAGIC);
      out.flush();
      return stream.getPos();
    } catch (IOException e) {
      throw new UncheckedIOException(
          String.format("Failed to write index segment: %s", outputFile.location()), e);
    }
  }

  private void writePositions(LittleEndianDataOutputStream out, RoaringBitmap positions)
      throws IOException {
    switch (type) {
      case BTREE:
        out.writeInt(positions.getCardinality());
        IntIterator iter = positions.getIntIterator();
        while (iter.hasNext()) {
          out.writeInt(iter.next());
        }
        break;
      case BITMAP:
        positions.runOptimize();
        ByteArrayDataOutput bytes = ByteStreams.newDataOutput(positions.serializedSizeInBytes());
        positions.serialize(bytes);
        byte[] serialized = bytes.toByteArray();
        out.writeInt(serialized.length);
        out.write(serialized);
        break;
      default:
        throw new UnsupportedOperationException("Unsupported index type: " + type);
    }
  }
}
