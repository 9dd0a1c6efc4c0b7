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

import io.sieve.index.IndexDefinition;
import io.sieve.index.IndexDefinitions;
import java.io.Serializable;
import org.immutables.value.Value;

/** A named index defined on a partition directory. */
@Value.Immutable
public interface IndexMeta extends Serializable {

  String name();

  IndexDefinition definition();

  @Value.Check
  default void check() {
    IndexDefinitions.validateName(name());
  }

  static IndexMeta of(String name, IndexDefinition definition) {
    return ImmutableIndexMeta.builder().name(name).definition(definition).build();
  }
}
