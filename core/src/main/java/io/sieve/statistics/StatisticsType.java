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
import java.util.Locale;

/** Kinds of statistics that can be kept for an index segment, keyed by a stable record id. */
public enum StatisticsType {
  MIN_MAX(0, "minmax"),
  BLOOM_FILTER(1, "bloomfilter");

  private final int id;
  private final String typeName;

  StatisticsType(int id, String typeName) {
    this.id = id;
    this.typeName = typeName;
  }

  /** Returns the record id written in front of serialized statistics of this kind. */
  public int id() {
    return id;
  }

  public String typeName() {
    return typeName;
  }

  public static StatisticsType fromId(int id) {
    for (StatisticsType type : values()) {
      if (type.id == id) {
        return type;
      }
    }

    return null;
  }

  public static StatisticsType fromName(String name) {
    Preconditions.checkArgument(name != null, "Invalid statistics type: null");
    String lower = name.toLowerCase(Locale.ROOT);
    for (StatisticsType type : values()) {
      if (type.typeName.equals(lower)) {
        return type;
      }
    }

    throw new IllegalArgumentException(String.format("Unknown statistics type: %s", name));
  }
}
