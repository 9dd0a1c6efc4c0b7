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

import java.util.List;

/** Lists the partition directories of a relation. */
public interface FileCatalog {

  /** Returns the root location of the relation. */
  String location();

  /**
   * Returns the partition directories, each with the data files it holds.
   *
   * <p>Implementations may cache the listing until {@link #refresh()} is called.
   */
  List<PartitionDirectory> partitions();

  /** Drops any cached listing so the next call to {@link #partitions()} sees new files. */
  void refresh();
}
