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
package io.sieve.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.google.common.collect.ImmutableList;
import io.sieve.TestTables;
import io.sieve.io.FileIO;
import io.sieve.io.LocalFileIO;
import java.io.File;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestDirectoryFileCatalog {
  @TempDir private File root;

  private DirectoryFileCatalog catalog;

  @BeforeEach
  public void before() {
    this.catalog = new DirectoryFileCatalog(new LocalFileIO(), root.getPath() + "/");
  }

  @Test
  public void testGroupsFilesByDirectory() throws IOException {
    String fileA = TestTables.writeCsv(root, "p=1/a.csv", "1,a,1");
    String fileB = TestTables.writeCsv(root, "p=1/b.csv", "2,b,2", "3,c,3");
    String fileC = TestTables.writeCsv(root, "p=2/q=x/c.csv", "4,d,4");

    List<PartitionDirectory> partitions = catalog.partitions();
    assertThat(catalog.location()).isEqualTo(root.getPath());
    assertThat(partitions)
        .extracting(PartitionDirectory::location)
        .containsExactly(new File(root, "p=1").getPath(), new File(root, "p=2/q=x").getPath());
    assertThat(partitions.get(0).files())
        .extracting(DataFile::path)
        .containsExactly(fileA, fileB);
    assertThat(partitions.get(0).files().get(1).length()).isEqualTo(new File(fileB).length());
    assertThat(partitions.get(1).files())
        .singleElement()
        .satisfies(
            file -> {
              assertThat(file.path()).isEqualTo(fileC);
              assertThat(file.parent()).isEqualTo(new File(root, "p=2/q=x").getPath());
            });
  }

  @Test
  public void testHiddenFilesAndSegmentsAreSkipped() throws IOException {
    String data = TestTables.writeCsv(root, "p=1/a.csv", "1,a,1");
    TestTables.writeCsv(root, "p=1/.sieve.meta", "metadata");
    TestTables.writeCsv(root, "p=1/_SUCCESS");
    TestTables.writeCsv(root, "p=1/a.by_id.index", "segment");
    TestTables.writeCsv(root, "_temporary/job/p=1/a.by_id.index", "staged");
    TestTables.writeCsv(root, ".hidden/p=3/d.csv", "4,d,4");
    TestTables.writeCsv(root, "p=4/.sieve.meta", "metadata only");

    assertThat(catalog.partitions())
        .singleElement()
        .isEqualTo(
            PartitionDirectory.of(
                new File(root, "p=1").getPath(),
                ImmutableList.of(
                    DataFile.of(data, new File(root, "p=1").getPath(), new File(data).length()))));
  }

  @Test
  public void testListingIsCachedUntilRefresh() throws IOException {
    TestTables.writeCsv(root, "p=1/a.csv", "1,a,1");
    assertThat(catalog.partitions()).hasSize(1);

    TestTables.writeCsv(root, "p=2/b.csv", "2,b,2");
    assertThat(catalog.partitions()).hasSize(1);

    catalog.refresh();
    assertThat(catalog.partitions()).hasSize(2);
  }

  @Test
  public void testMissingLocation() {
    DirectoryFileCatalog missing =
        new DirectoryFileCatalog(new LocalFileIO(), new File(root, "missing").getPath());
    assertThat(missing.partitions()).isEmpty();
  }

  @Test
  public void testRequiresPrefixListing() {
    FileIO io = mock(FileIO.class);
    assertThatThrownBy(() -> new DirectoryFileCatalog(io, root.getPath()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageStartingWith("Cannot list " + root.getPath())
        .hasMessageContaining("does not support prefix listing");
  }
}
