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

import java.io.Serializable;
import java.util.List;

/**
 * The shape of a secondary index: which columns form the key, and how.
 *
 * <p>The set of implementations is closed: {@link BTreeIndex} and {@link BitmapIndex}. Code that
 * needs kind-specific behavior goes through {@link #accept(Visitor)} so that adding a kind is a
 * compile error at every consumer.
 */
public interface IndexDefinition extends Serializable {

  IndexType type();

  /** Returns the schema positions of the key columns, in key order. */
  List<Integer> ordinals();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R btree(BTreeIndex index);

    R bitmap(BitmapIndex index);
  }
}
