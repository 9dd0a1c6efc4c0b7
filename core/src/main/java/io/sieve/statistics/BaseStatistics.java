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
import io.sieve.exceptions.CorruptStatisticsException;
import io.sieve.types.Types;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Record framing shared by all statistics kinds. */
abstract class BaseStatistics implements Statistics {
  static final int HEADER_LENGTH = 2 * Integer.BYTES;

  private Types.StructType keyType = null;

  @Override
  public void initialize(Types.StructType newKeyType) {
    Preconditions.checkArgument(newKeyType != null, "Invalid key type: null");
    this.keyType = newKeyType;
    reset();
  }

  protected Types.StructType keyType() {
    Preconditions.checkState(keyType != null, "Statistics are not initialized");
    return keyType;
  }

  /** Clears any observed or deserialized state. */
  protected abstract void reset();

  /** Returns the payload, or an empty buffer when nothing was observed. */
  protected abstract ByteBuffer payload();

  /** Reads a payload of exactly the remaining bytes of {@code payload}. */
  protected abstract void readPayload(ByteBuffer payload);

  @Override
  public ByteBuffer serialize() {
    ByteBuffer payload = payload();
    ByteBuffer record =
        ByteBuffer.allocate(HEADER_LENGTH + payload.remaining()).order(ByteOrder.LITTLE_ENDIAN);
    record.putInt(type().id());
    record.putInt(payload.remaining());
    record.put(payload.duplicate());
    record.flip();
    return record;
  }

  @Override
  public int deserialize(ByteBuffer bytes, int offset) {
    keyType();
    ByteBuffer in = bytes.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    if (offset < 0 || offset > in.limit() || in.limit() - offset < HEADER_LENGTH) {
      throw new CorruptStatisticsException(
          "Cannot read %s statistics header at offset %s: buffer length %s",
          type().typeName(),
          offset,
          in.limit());
    }

    in.position(offset);
    int id = in.getInt();
    if (id != type().id()) {
      throw new CorruptStatisticsException(
          "Invalid record id for %s statistics: expected %s, found %s",
          type().typeName(),
          type().id(),
          id);
    }

    int length = in.getInt();
    if (length < 0 || length > in.remaining()) {
      throw new CorruptStatisticsException(
          "Invalid %s statistics length %s: %s bytes remaining",
          type().typeName(),
          length,
          in.remaining());
    }

    ByteBuffer payload = in.slice().order(ByteOrder.LITTLE_ENDIAN);
    payload.limit(length);
    reset();
    readPayload(payload);
    return HEADER_LENGTH + length;
  }
}
