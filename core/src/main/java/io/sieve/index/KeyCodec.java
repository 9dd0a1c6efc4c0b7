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
import com.google.common.collect.Lists;
import io.sieve.StructLike;
import io.sieve.data.GenericRow;
import io.sieve.exceptions.CorruptStatisticsException;
import io.sieve.types.Conversions;
import io.sieve.types.Type;
import io.sieve.types.Types;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

/**
 * Binary encoding of index keys.
 *
 * <p>A key is written field by field as a little-endian int length followed by the single-value
 * encoding of the field from {@link Conversions}. A null field is written as length {@code -1}
 * with no bytes.
 */
public class KeyCodec {
  private static final int NULL_LENGTH = -1;

  private KeyCodec() {}

  public static ByteBuffer encode(Types.StructType keyType, StructLike key) {
    List<Types.NestedField> fields = keyType.fields();
    Preconditions.checkArgument(
        key.size() == fields.size(),
        "Invalid key for %s: expected %s fields, got %s",
        keyType,
        fields.size(),
        key.size());

    List<ByteBuffer> encoded = Lists.newArrayListWithCapacity(fields.size());
    int totalSize = 0;
    for (int pos = 0; pos < fields.size(); pos += 1) {
      Type type = fields.get(pos).type();
      Object value = key.get(pos, type.typeId().javaClass());
      ByteBuffer bytes = Conversions.toByteBuffer(type, value);
      encoded.add(bytes);
      totalSize += Integer.BYTES + (bytes != null ? bytes.remaining() : 0);
    }

    ByteBuffer result = ByteBuffer.allocate(totalSize).order(ByteOrder.LITTLE_ENDIAN);
    for (ByteBuffer bytes : encoded) {
      if (bytes == null) {
        result.putInt(NULL_LENGTH);
      } else {
        result.putInt(bytes.remaining());
        result.put(bytes.duplicate());
      }
    }

    result.flip();
    return result;
  }

  public static byte[] toBytes(Types.StructType keyType, StructLike key) {
    ByteBuffer buffer = encode(keyType, key);
    byte[] bytes = new byte[buffer.remaining()];
    buffer.get(bytes);
    return bytes;
  }

  /**
   * Decodes a key that fills the remaining bytes of {@code buffer}.
   *
   * @throws CorruptStatisticsException if a field length runs past the end of the buffer
   */
  public static GenericRow decode(Types.StructType keyType, ByteBuffer buffer) {
    ByteBuffer in = buffer.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    List<Types.NestedField> fields = keyType.fields();
    GenericRow key = GenericRow.create(keyType);
    for (int pos = 0; pos < fields.size(); pos += 1) {
      if (in.remaining() < Integer.BYTES) {
        throw new CorruptStatisticsException(
            "Truncated key: missing length of field %s", fields.get(pos).name());
      }

      int length = in.getInt();
      if (length == NULL_LENGTH) {
        key.set(pos, null);
        continue;
      }

      if (length < 0 || length > in.remaining()) {
        throw new CorruptStatisticsException(
            "Invalid key field length %s for %s (%s bytes remaining)",
            length,
            fields.get(pos).name(),
            in.remaining());
      }

      ByteBuffer value = in.slice();
      value.limit(length);
      in.position(in.position() + length);
      key.set(pos, Conversions.fromByteBuffer(fields.get(pos).type(), copy(value)));
    }

    if (in.hasRemaining()) {
      throw new CorruptStatisticsException(
          "Invalid key for %s: %s trailing bytes", keyType, in.remaining());
    }

    return key;
  }

  private static ByteBuffer copy(ByteBuffer value) {
    ByteBuffer copy = ByteBuffer.allocate(value.remaining());
    copy.put(value.duplicate());
    copy.flip();
    return copy;
  }
}
