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

/**
 * Interface for accessing data by position in a schema.
 *
 * <p>This interface supports accessing data in top-level fields, not in nested fields. Rows handed
 * out by the execution engine and index keys both implement it.
 */
public interface StructLike {
  int size();

  <T> T get(int pos, Class<T> javaClass);

  <T> void set(int pos, T value);
}
