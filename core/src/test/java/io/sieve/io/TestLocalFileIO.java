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
package io.sieve.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.sieve.TestTables;
import io.sieve.exceptions.AlreadyExistsException;
import io.sieve.exceptions.NotFoundException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestLocalFileIO {
  @TempDir private File root;

  private final LocalFileIO io = new LocalFileIO();

  private static String read(String path) throws IOException {
    return new String(Files.readAllBytes(new File(path).toPath()), StandardCharsets.UTF_8);
  }

  @Test
  public void testRenameCreatesParent() throws IOException {
    String source = TestTables.writeCsv(root, "_temporary/job-1/a.csv", "staged");
    String target = new File(root, "p=1/a.csv").getPath();

    io.rename(source, target, false);

    assertThat(new File(source)).doesNotExist();
    assertThat(read(target)).isEqualTo("staged\n");
  }

  @Test
  public void testRenameWithoutOverwrite() throws IOException {
    String source = TestTables.writeCsv(root, "new.csv", "new");
    String target = TestTables.writeCsv(root, "old.csv", "old");

    assertThatThrownBy(() -> io.rename(source, target, false))
        .isInstanceOf(AlreadyExistsException.class)
        .hasMessage("Cannot rename %s: %s already exists", source, target);
    assertThat(read(target)).isEqualTo("old\n");

    io.rename(source, target, true);
    assertThat(read(target)).isEqualTo("new\n");
    assertThat(new File(source)).doesNotExist();
  }

  @Test
  public void testRenameMissingSource() {
    String source = new File(root, "missing.csv").getPath();
    assertThatThrownBy(() -> io.rename(source, new File(root, "b.csv").getPath(), true))
        .isInstanceOf(NotFoundException.class)
        .hasMessage("Cannot rename missing file: %s", source);
  }

  @Test
  public void testListAndDeletePrefix() throws IOException {
    String fileA = TestTables.writeCsv(root, "t/p=1/a.csv", "1");
    String fileB = TestTables.writeCsv(root, "t/p=2/b.csv", "22");
    TestTables.writeCsv(root, "other/c.csv", "3");
    String prefix = new File(root, "t").getPath();

    assertThat(io.listPrefix(prefix))
        .extracting(FileInfo::location, FileInfo::size)
        .containsExactly(
            tuple(fileA, 2L),
            tuple(fileB, 3L));
    assertThat(io.listPrefix(new File(root, "missing").getPath())).isEmpty();

    io.deletePrefix(prefix);
    assertThat(new File(prefix)).doesNotExist();
    assertThat(TestTables.listFiles(root)).containsExactly("other/c.csv");
    io.deletePrefix(prefix);
  }

  @Test
  public void testFileSchemeLocations() throws IOException {
    String path = TestTables.writeCsv(root, "a.csv", "1,a,1");
    InputFile input = io.newInputFile(new File(path).toURI().toString());
    assertThat(input.exists()).isTrue();
    assertThat(input.getLength()).isEqualTo(6L);

    io.deleteFile(new File(path).toURI().toString());
    assertThat(new File(path)).doesNotExist();
  }

  @Test
  public void testCreateRefusesExistingFile() throws IOException {
    String path = TestTables.writeCsv(root, "a.csv", "1");
    assertThatThrownBy(() -> io.newOutputFile(path).create())
        .isInstanceOf(AlreadyExistsException.class)
        .hasMessageStartingWith("File already exists");

    try (PositionOutputStream out = io.newOutputFile(path).createOrOverwrite()) {
      out.write(new byte[] {'x', 'y'});
      assertThat(out.getPos()).isEqualTo(2L);
    }

    assertThat(read(path)).isEqualTo("xy");
  }
}
