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

import io.sieve.exceptions.NotFoundException;
import io.sieve.io.InputFile;
import io.sieve.io.SeekableInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

/** {@link InputFile} implementation using the Hadoop {@link FileSystem} API. */
public class HadoopInputFile implements InputFile {
  private final FileSystem fs;
  private final Path path;
  private FileStatus stat = null;
  private Long length = null;

  static HadoopInputFile fromPath(Path path, FileSystem fs) {
    return new HadoopInputFile(fs, path, null);
  }

  static HadoopInputFile fromPath(Path path, long length, FileSystem fs) {
    return new HadoopInputFile(fs, path, length >= 0 ? length : null);
  }

  private HadoopInputFile(FileSystem fs, Path path, Long length) {
    this.fs = fs;
    this.path = path;
    this.length = length;
  }

  private FileStatus lazyStat() {
    if (stat == null) {
      try {
        this.stat = fs.getFileStatus(path);
      } catch (FileNotFoundException e) {
        throw new NotFoundException(e, "File does not exist: %s", path);
      } catch (IOException e) {
        throw new UncheckedIOException(String.format("Failed to get status for file: %s", path), e);
      }
    }
    return stat;
  }

  @Override
  public long getLength() {
    if (length == null) {
      this.length = lazyStat().getLen();
    }
    return length;
  }

  @Override
  public SeekableInputStream newStream() {
    try {
      return HadoopStreams.wrap(fs.open(path));
    } catch (FileNotFoundException e) {
      throw new NotFoundException(e, "Failed to open input stream for file: %s", path);
    } catch (IOException e) {
      throw new UncheckedIOException(
          String.format("Failed to open input stream for file: %s", path), e);
    }
  }

  public Path getPath() {
    return path;
  }

  @Override
  public String location() {
    return path.toString();
  }

  @Override
  public boolean exists() {
    try {
      return lazyStat() != null;
    } catch (NotFoundException e) {
      return false;
    }
  }

  @Override
  public String toString() {
    return path.toString();
  }
}
