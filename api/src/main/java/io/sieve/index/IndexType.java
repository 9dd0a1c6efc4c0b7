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
import io.sieve.exceptions.UnsupportedIndexTypeException;
import java.util.Locale;

/** Kinds of secondary index that can be built over a partition directory. */
public enum IndexType {
  /** Ordered index; every key column carries a sort direction. */
  BTREE("btree", "BTREE"),
  /** Set-membership index; one bitmap of row positions per distinct key. */
  BITMAP("bitmap", "BITMAP");

  private final String name;
  private final String label;

  IndexType(String name, String label) {
    this.name = name;
    this.label = label;
  }

  /** Returns the lower-case name used in sidecar metadata and commands. */
  public String typeName() {
    return name;
  }

  /** Returns the label shown when listing indexes. */
  public String label() {
    return label;
  }

  public static IndexType fromString(String typeName) {
    Preconditions.checkArgument(typeName != null, "Invalid index type: null");
    String lower = typeName.toLowerCase(Locale.ROOT);
    for (IndexType type : values()) {
      if (type.name.equals(lower)) {
        return type;
      }
    }

    throw new UnsupportedIndexTypeException("Unsupported index type: %s", typeName);
  }
}
