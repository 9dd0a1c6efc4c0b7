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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.sieve.index.BTreeEntry;
import io.sieve.index.BTreeIndex;
import io.sieve.index.BitmapIndex;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class TestPartitionMetadata {
  static final String READER = "io.sieve.data.SieveDataFile";

  static PartitionMetadata sample() {
    return PartitionMetadata.builder()
        .withSchema(TestTables.SCHEMA)
        .withReaderClassName(READER)
        .addFileMeta(FileMeta.of(fingerprint("a"), 3L, "/t/p=1/a.csv"))
        .addFileMeta(FileMeta.of(fingerprint("b"), 0L, "/t/p=1/b.csv"))
        .addIndexMeta(
            IndexMeta.of("by_name", BTreeIndex.of(BTreeEntry.asc(1), BTreeEntry.desc(2))))
        .addIndexMeta(IndexMeta.of("by_id", BitmapIndex.of(0)))
        .build();
  }

  static ByteBuffer fingerprint(String value) {
    return ByteBuffer.wrap(value.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  public void testLookups() {
    PartitionMetadata metadata = sample();
    assertThat(metadata.formatVersion()).isEqualTo(PartitionMetadata.DEFAULT_FORMAT_VERSION);
    assertThat(metadata.containsFileMeta("/t/p=1/a.csv")).isTrue();
    assertThat(metadata.fileMeta("/t/p=1/b.csv").rowCount()).isEqualTo(0L);
    assertThat(metadata.fileMeta("/t/p=1/c.csv")).isNull();
    assertThat(metadata.containsIndexMeta("by_id")).isTrue();
    assertThat(metadata.indexMeta("by_name").definition().ordinals()).containsExactly(1, 2);
    assertThat(metadata.indexMeta("missing")).isNull();
  }

  @Test
  public void testInsertionOrder() {
    PartitionMetadata metadata = sample();
    assertThat(metadata.fileMetas())
        .extracting(FileMeta::path)
        .containsExactly("/t/p=1/a.csv", "/t/p=1/b.csv");
    assertThat(metadata.indexMetas())
        .extracting(IndexMeta::name)
        .containsExactly("by_name", "by_id");
  }

  @Test
  public void testValueEquality() {
    assertThat(sample()).isEqualTo(sample()).hasSameHashCodeAs(sample());
    assertThat(PartitionMetadata.buildFrom(sample()).removeIndexMeta("by_id").build())
        .isNotEqualTo(sample());
  }

  @Test
  public void testDuplicateFileMeta() {
    PartitionMetadata.Builder builder = PartitionMetadata.buildFrom(sample());
    FileMeta duplicate = FileMeta.of(fingerprint("x"), 1L, "/t/p=1/a.csv");
    assertThatThrownBy(() -> builder.addFileMeta(duplicate))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot add file meta: /t/p=1/a.csv is already tracked");
  }

  @Test
  public void testDuplicateIndexMeta() {
    PartitionMetadata.Builder builder = PartitionMetadata.buildFrom(sample());
    assertThatThrownBy(() -> builder.addIndexMeta(IndexMeta.of("by_id", BitmapIndex.of(1))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot add index by_id: an index with that name already exists");
  }

  @Test
  public void testRemoveIndexMeta() {
    PartitionMetadata removed =
        PartitionMetadata.buildFrom(sample())
            .removeIndexMeta("by_name")
            .removeIndexMeta("missing")
            .build();
    assertThat(removed.indexMetas()).extracting(IndexMeta::name).containsExactly("by_id");
    assertThat(removed.fileMetas()).isEqualTo(sample().fileMetas());
  }

  @Test
  public void testMissingRequiredFields() {
    assertThatThrownBy(() -> PartitionMetadata.builder().withReaderClassName(READER).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot build partition metadata: no schema");
    assertThatThrownBy(() -> PartitionMetadata.builder().withSchema(TestTables.SCHEMA).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Cannot build partition metadata: no reader class name");
  }

  @Test
  public void testUnsupportedFormatVersion() {
    assertThatThrownBy(() -> PartitionMetadata.buildFrom(sample()).withFormatVersion(2).build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unsupported format version: 2");
  }

  @Test
  public void testIndexOrdinalOutsideSchema() {
    assertThatThrownBy(
            () ->
                PartitionMetadata.buildFrom(sample())
                    .addIndexMeta(IndexMeta.of("wide", BitmapIndex.of(0, 3)))
                    .build())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Invalid index wide: column ordinal 3 is not in schema");
  }

  @Test
  public void testInvalidIndexName() {
    assertThatThrownBy(() -> IndexMeta.of("by.name", BitmapIndex.of(0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid index name by.name: must not contain '.' or '/'");
  }
}
