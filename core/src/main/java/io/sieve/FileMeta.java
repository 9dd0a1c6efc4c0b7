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
package io.sieve;

import java.io.Serializable;
import java.nio.ByteBuffer;
import org.immutables.value.Value;

/** A data file tracked by a partition directory's metadata. */
@Value.Immutable
public interface FileMeta extends Serializable {

  /** Returns the content fingerprint computed when the file was indexed. */
  ByteBuffer fingerprint();

  /** Returns the number of rows read from the file. */
  long rowCount();

  /** Returns the file location. */
  String path();

  static FileMeta of(ByteBuffer fingerprint, long rowCount, String path) {
    return ImmutableFileMeta.builder()
        .fingerprint(fingerprint)
        .rowCount(rowCount)
        .path(path)
        .build();
  }
}
