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
package io.sieve.catalog;

import java.io.Serializable;
import org.immutables.value.Value;

/** A data file in a partition directory. */
@Value.Immutable
public interface DataFile extends Serializable {

  /** Returns the file location. */
  String path();

  /** Returns the location of the partition directory that holds the file. */
  String parent();

  /** Returns the file size in bytes. */
  long length();

  static DataFile of(String path, String parent, long length) {
    return ImmutableDataFile.builder().path(path).parent(parent).length(length).build();
  }
}
