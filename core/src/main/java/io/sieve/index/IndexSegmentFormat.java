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

import io.sieve.exceptions.CorruptIndexException;

/**
 * Layout constants of index segment files.
 *
 * <pre>
 * MAGIC | type: byte | key count: int
 *       | { key length: int | key | positions }*
 *       | statistics block | statistics offset: long | MAGIC
 * </pre>
 *
 * <p>All integers are little-endian. B-tree positions are a count followed by that many ints;
 * bitmap positions are a length followed by a serialized Roaring bitmap.
 */
final class IndexSegmentFormat {
  private IndexSegmentFormat() {}

  static final int HEADER_LENGTH = getMagic().length + 1 + Integer.BYTES;
  static final int FOOTER_LENGTH = Long.BYTES + getMagic().length;

  static final byte BTREE_TYPE_ID = 0;
  static final byte BITMAP_TYPE_ID = 1;

  static byte[] getMagic() {
    return new byte[] {'S', 'V', 'X', '1'};
  }

  static byte typeId(IndexType type) {
    switch (type) {
      case BTREE:
        return BTREE_TYPE_ID;
      case BITMAP:
        return BITMAP_TYPE_ID;
    }

    throw new UnsupportedOperationException("Unsupported index type: " + type);
  }

  static IndexType fromTypeId(byte typeId) {
    switch (typeId) {
      case BTREE_TYPE_ID:
        return IndexType.BTREE;
      case BITMAP_TYPE_ID:
        return IndexType.BITMAP;
      default:
        throw new CorruptIndexException("Unknown index segment type: %s", typeId);
    }
  }
}
