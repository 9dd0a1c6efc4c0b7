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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.sieve.SieveProperties;
import io.sieve.util.PropertyUtil;
import java.io.Serializable;
import java.util.List;
import java.util.Map;

/** Which statistics to keep for new index segments, and how to size them. */
public class StatisticsOptions implements Serializable {
  private final List<StatisticsType> types;
  private final int bloomFilterExpectedKeys;
  private final double bloomFilterFpp;

  public static StatisticsOptions defaults() {
    return new StatisticsOptions(
        ImmutableList.of(StatisticsType.MIN_MAX),
        SieveProperties.BLOOM_FILTER_EXPECTED_KEYS_DEFAULT,
        SieveProperties.BLOOM_FILTER_FPP_DEFAULT);
  }

  public static StatisticsOptions fromProperties(Map<String, String> properties) {
    List<StatisticsType> types =
        PropertyUtil.propertyAsList(
                properties,
                SieveProperties.STATISTICS_TYPES,
                SieveProperties.STATISTICS_TYPES_DEFAULT)
            .stream()
            .map(StatisticsType::fromName)
            .distinct()
            .collect(ImmutableList.toImmutableList());
    int expectedKeys =
        PropertyUtil.propertyAsInt(
            properties,
            SieveProperties.BLOOM_FILTER_EXPECTED_KEYS,
            SieveProperties.BLOOM_FILTER_EXPECTED_KEYS_DEFAULT);
    double fpp =
        PropertyUtil.propertyAsDouble(
            properties, SieveProperties.BLOOM_FILTER_FPP, SieveProperties.BLOOM_FILTER_FPP_DEFAULT);
    return new StatisticsOptions(types, expectedKeys, fpp);
  }

  public StatisticsOptions(
      List<StatisticsType> types, int bloomFilterExpectedKeys, double bloomFilterFpp) {
    Preconditions.checkArgument(types != null, "Invalid statistics types: null");
    this.types = ImmutableList.copyOf(types);
    this.bloomFilterExpectedKeys = bloomFilterExpectedKeys;
    this.bloomFilterFpp = bloomFilterFpp;
  }

  public List<StatisticsType> types() {
    return types;
  }

  public int bloomFilterExpectedKeys() {
    return bloomFilterExpectedKeys;
  }

  public double bloomFilterFpp() {
    return bloomFilterFpp;
  }

  /** Creates an uninitialized statistics instance of the given kind. */
  public Statistics newStatistics(StatisticsType type) {
    switch (type) {
      case MIN_MAX:
        return new MinMaxStatistics();
      case BLOOM_FILTER:
        return new BloomFilterStatistics(bloomFilterExpectedKeys, bloomFilterFpp);
      default:
        throw new UnsupportedOperationException("Unsupported statistics type: " + type);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("types", types)
        .add("bloomFilterExpectedKeys", bloomFilterExpectedKeys)
        .add("bloomFilterFpp", bloomFilterFpp)
        .toString();
  }
}
