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

import static io.sieve.types.Types.NestedField.optional;
import static io.sieve.types.Types.NestedField.required;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import io.sieve.catalog.DirectoryFileCatalog;
import io.sieve.catalog.FileCatalog;
import io.sieve.catalog.FileFormat;
import io.sieve.catalog.Relation;
import io.sieve.data.GenericRow;
import io.sieve.exec.RowReader;
import io.sieve.io.CloseableIterable;
import io.sieve.io.FileIO;
import io.sieve.io.InputFile;
import io.sieve.io.SeekableInputStream;
import io.sieve.session.SieveSession;
import io.sieve.types.Conversions;
import io.sieve.types.Types;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Small comma-separated tables on the local file system for index command tests. */
public class TestTables {
  public static final String TABLE_NAME = "events";

  public static final Schema SCHEMA =
      new Schema(
          required("id", Types.IntegerType.get()),
          optional("name", Types.StringType.get()),
          optional("score", Types.LongType.get()));

  public static final RowReader CSV = new CsvRowReader();

  private TestTables() {}

  /** Writes a data file of comma-separated rows; an empty value is null. */
  public static String writeCsv(File dir, String name, String... lines) throws IOException {
    File file = new File(dir, name);
    Files.createDirectories(file.getParentFile().toPath());
    Files.write(file.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
    return file.getPath();
  }

  public static Relation relation(FileIO io, File location) {
    return relation(FileFormat.SIEVE, new DirectoryFileCatalog(io, location.getPath()));
  }

  public static Relation relation(FileFormat format, FileCatalog catalog) {
    return Relation.of(TABLE_NAME, SCHEMA, format, catalog);
  }

  public static SieveSession session(RowReader reader) {
    return SieveSession.builder()
        .withRowReader(reader)
        .withProperty(SieveProperties.WORKER_THREADS, "2")
        .build();
  }

  /** Returns every regular file under {@code root}, relative to it. */
  public static List<String> listFiles(File root) throws IOException {
    Path rootPath = root.toPath();
    try (Stream<Path> paths = Files.walk(rootPath)) {
      return paths
          .filter(Files::isRegularFile)
          .map(path -> rootPath.relativize(path).toString())
          .sorted()
          .collect(Collectors.toList());
    }
  }

  static class CsvRowReader implements RowReader {
    private static final Splitter COMMA = Splitter.on(',');

    @Override
    public CloseableIterable<StructLike> read(InputFile file, Schema schema) {
      String content;
      try (SeekableInputStream in = file.newStream()) {
        content = CharStreams.toString(new InputStreamReader(in, StandardCharsets.UTF_8));
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }

      ImmutableList.Builder<StructLike> rows = ImmutableList.builder();
      for (String line : Splitter.on('\n').omitEmptyStrings().split(content)) {
        List<String> values = COMMA.splitToList(line);
        GenericRow row = GenericRow.create(schema);
        for (int pos = 0; pos < schema.size(); pos += 1) {
          String value = pos < values.size() ? values.get(pos) : "";
          row.set(
              pos,
              Conversions.fromString(
                  schema.column(pos).type(), value.isEmpty() ? null : value));
        }
        rows.add(row);
      }

      return CloseableIterable.withNoopClose(rows.build());
    }
  }
}
