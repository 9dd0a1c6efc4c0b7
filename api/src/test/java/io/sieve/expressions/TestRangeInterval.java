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
package io.sieve.expressions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sieve.TestHelpers.Row;
import org.junit.jupiter.api.Test;

public class TestRangeInterval {

  @Test
  public void testUnbounded() {
    RangeInterval all = RangeInterval.all();
    assertThat(all.hasStart()).isFalse();
    assertThat(all.hasEnd()).isFalse();
    assertThat(all.isPoint()).isFalse();
  }

  @Test
  public void testPoint() {
    RangeInterval point = RangeInterval.point(Row.of(5));
    assertThat(point.isPoint()).isTrue();
    assertThat(point.startInclusive()).isTrue();
    assertThat(point.endInclusive()).isTrue();
    assertThat(point.start()).isEqualTo(Row.of(5));
    assertThat(point.end()).isEqualTo(Row.of(5));

    assertThat(RangeInterval.between(Row.of(5), true, Row.of(5), false).isPoint()).isFalse();
    assertThat(RangeInterval.between(Row.of(5), true, Row.of(6), true).isPoint()).isFalse();
  }

  @Test
  public void testHalfOpenBounds() {
    RangeInterval atLeast = RangeInterval.atLeast(Row.of(3));
    assertThat(atLeast.hasStart()).isTrue();
    assertThat(atLeast.startInclusive()).isTrue();
    assertThat(atLeast.hasEnd()).isFalse();

    RangeInterval greaterThan = RangeInterval.greaterThan(Row.of(3));
    assertThat(greaterThan.startInclusive()).isFalse();

    RangeInterval atMost = RangeInterval.atMost(Row.of(9));
    assertThat(atMost.hasStart()).isFalse();
    assertThat(atMost.endInclusive()).isTrue();

    RangeInterval lessThan = RangeInterval.lessThan(Row.of(9));
    assertThat(lessThan.endInclusive()).isFalse();
  }

  @Test
  public void testNullBounds() {
    assertThatThrownBy(() -> RangeInterval.point(null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid point: null");
    assertThatThrownBy(() -> RangeInterval.between(null, true, Row.of(1), true))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid bound: null");
  }

  @Test
  public void testEquality() {
    assertThat(RangeInterval.between(Row.of(1), true, Row.of(4), false))
        .isEqualTo(RangeInterval.of(Row.of(1), true, Row.of(4), false))
        .isNotEqualTo(RangeInterval.of(Row.of(1), true, Row.of(4), true));
    assertThat(RangeInterval.atLeast(Row.of(1)))
        .isEqualTo(RangeInterval.of(Row.of(1), true, null, true));
  }
}
