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
package io.sieve.io;

/**
 * Extension for FileIO implementations that can move a file atomically.
 *
 * <p>Sidecar metadata commits and index segment publication both rely on this: a reader observes
 * either the old file or the complete new one, never a partial write.
 */
public interface SupportsRenameOperations extends FileIO {

  /**
   * Atomically move a file.
   *
   * @param source location of an existing file
   * @param target destination location
   * @param overwrite whether to replace an existing file at {@code target}
   * @throws io.sieve.exceptions.AlreadyExistsException if {@code target} exists and overwrite is
   *     false
   * @throws io.sieve.exceptions.NotFoundException if {@code source} does not exist
   */
  void rename(String source, String target, boolean overwrite);
}
