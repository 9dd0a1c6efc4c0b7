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
package io.sieve.hadoop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.sieve.TestTables;
import io.sieve.exceptions.AlreadyExistsException;
import io.sieve.exceptions.NotFoundException;
import io.sieve.io.FileInfo;
import io.sieve.io.InputFile;
import io.sieve.io.PositionOutputStream;
import io.sieve.io.SeekableInputStream;
import io.sieve.util.LocationUtil;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestHadoopFileIO {
  @TempDir private File root;

  private HadoopFileIO io;

  @BeforeEach
  public void before() {
    this.io = new HadoopFileIO(new Configuration());
  }

  private static String uri(String path) {
    return new File(path).toURI().toString();
  }

  private static String read(File file) throws IOException {
    return new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
  }

  @Test
  public void testRename() throws IOException {
    String source = TestTables.writeCsv(root, "_temporary/job-1/a.csv", "staged");
    File target = new File(root, "p=1/a.csv");

    io.rename(uri(source), uri(target.getPath()), false);

    assertThat(new File(source)).doesNotExist();
    assertThat(read(target)).isEqualTo("staged\n");
  }

  @Test
  public void testRenameOverwrite() throws IOException {
    String source = TestTables.writeCsv(root, "new.csv", "new");
    String target = TestTables.writeCsv(root, "old.csv", "old");

    assertThatThrownBy(() -> io.rename(uri(source), uri(target), false))
        .isInstanceOf(AlreadyExistsException.class)
        .hasMessageStartingWith("Cannot rename");
    assertThat(read(new File(target))).isEqualTo("old\n");

    io.rename(uri(source), uri(target), true);
    assertThat(read(new File(target))).isEqualTo("new\n");
  }

  @Test
  public void testRenameMissingSource() {
    String source = uri(new File(root, "missing.csv").getPath());
    assertThatThrownBy(() -> io.rename(source, uri(new File(root, "b.csv").getPath()), true))
        .isInstanceOf(NotFoundException.class)
        .hasMessage("Cannot rename missing file: %s", source);
  }

  @Test
  public void testListPrefix() throws IOException {
    TestTables.writeCsv(root, "t/p=1/a.csv", "1");
    TestTables.writeCsv(root, "t/p=2/b.csv", "22");

    assertThat(io.listPrefix(uri(new File(root, "t").getPath())))
        .extracting(file -> LocationUtil.fileName(file.location()), FileInfo::size)
        .containsExactlyInAnyOrder(
            tuple("a.csv", 2L),
            tuple("b.csv", 3L));
    assertThat(io.listPrefix(uri(new File(root, "missing").getPath()))).isEmpty();
  }

  @Test
  public void testWriteAndRead() throws IOException {
    String location = uri(new File(root, "p=1/a.by_id.index").getPath());
    try (PositionOutputStream out = io.newOutputFile(location).create()) {
      out.write(new byte[] {1, 2, 3, 4, 5});
      assertThat(out.getPos()).isEqualTo(5L);
    }

    InputFile input = io.newInputFile(location);
    assertThat(input.exists()).isTrue();
    assertThat(input.getLength()).isEqualTo(5L);
    try (SeekableInputStream in = input.newStream()) {
      in.seek(3);
      assertThat(in.read()).isEqualTo(4);
      assertThat(in.getPos()).isEqualTo(4L);
    }

    assertThatThrownBy(() -> io.newOutputFile(location).create())
        .isInstanceOf(AlreadyExistsException.class);

    io.deleteFile(location);
    assertThat(io.newInputFile(location).exists()).isFalse();
  }
}
