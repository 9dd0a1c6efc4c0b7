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
package io.sieve.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

public class TestLocationUtil {

  @Test
  public void testStripTrailingSlash() {
    assertThat(LocationUtil.stripTrailingSlash("s3://bucket/t//")).isEqualTo("s3://bucket/t");
    assertThat(LocationUtil.stripTrailingSlash("/")).isEqualTo("/");
    assertThatThrownBy(() -> LocationUtil.stripTrailingSlash(""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("path must not be null or empty");
  }

  @Test
  public void testJoin() {
    assertThat(LocationUtil.join("/t/p=1/", ".sieve.meta")).isEqualTo("/t/p=1/.sieve.meta");
    assertThat(LocationUtil.join("/", "a.csv")).isEqualTo("/a.csv");
    assertThatThrownBy(() -> LocationUtil.join("/t", ""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid name: null or empty");
  }

  @Test
  public void testFileNameAndParent() {
    assertThat(LocationUtil.fileName("hdfs://nn/t/p=1/a.csv")).isEqualTo("a.csv");
    assertThat(LocationUtil.parent("hdfs://nn/t/p=1/a.csv")).isEqualTo("hdfs://nn/t/p=1");
    assertThat(LocationUtil.parent("/a.csv")).isEqualTo("/");
    assertThat(LocationUtil.parent("a.csv")).isNull();
  }
}
