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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import io.sieve.exceptions.AlreadyExistsException;
import io.sieve.exceptions.NotFoundException;
import io.sieve.exceptions.RuntimeIOException;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.net.URI;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FileIO} over the local file system.
 *
 * <p>Locations are plain paths or {@code file:} URIs. Renames use {@link
 * StandardCopyOption#ATOMIC_MOVE}, so a reader sees either the old or the new content of the
 * target.
 */
public class LocalFileIO implements SupportsPrefixOperations, SupportsRenameOperations {
  private static final Logger LOG = LoggerFactory.getLogger(LocalFileIO.class);
  private static final String FILE_SCHEME = "file:";

  private Map<String, String> properties = ImmutableMap.of();

  @Override
  public void initialize(Map<String, String> props) {
    this.properties = ImmutableMap.copyOf(props);
  }

  @Override
  public Map<String, String> properties() {
    return properties;
  }

  @Override
  public InputFile newInputFile(String path) {
    return new LocalInputFile(toFile(path), -1L);
  }

  @Override
  public InputFile newInputFile(String path, long length) {
    return new LocalInputFile(toFile(path), length);
  }

  @Override
  public OutputFile newOutputFile(String path) {
    return new LocalOutputFile(toFile(path));
  }

  @Override
  public void deleteFile(String path) {
    try {
      Files.deleteIfExists(toPath(path));
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to delete file: %s", path);
    }
  }

  @Override
  public Iterable<FileInfo> listPrefix(String prefix) {
    Path root = toPath(prefix);
    if (!Files.isDirectory(root)) {
      return Lists.newArrayList();
    }

    try (Stream<Path> paths = Files.walk(root)) {
      return paths
          .filter(Files::isRegularFile)
          .sorted()
          .map(LocalFileIO::toFileInfo)
          .collect(Collectors.toList());
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to list prefix: %s", prefix);
    }
  }

  @Override
  public void deletePrefix(String prefix) {
    Path root = toPath(prefix);
    if (!Files.exists(root)) {
      return;
    }

    try (Stream<Path> paths = Files.walk(root)) {
      List<Path> toDelete = paths.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
      for (Path path : toDelete) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to delete prefix: %s", prefix);
    }

    LOG.debug("Deleted prefix {}", prefix);
  }

  @Override
  public void rename(String source, String target, boolean overwrite) {
    Path sourcePath = toPath(source);
    Path targetPath = toPath(target);
    if (!overwrite && Files.exists(targetPath)) {
      throw new AlreadyExistsException("Cannot rename %s: %s already exists", source, target);
    }

    try {
      Path parent = targetPath.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }

      Files.move(
          sourcePath,
          targetPath,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (NoSuchFileException e) {
      throw new NotFoundException(e, "Cannot rename missing file: %s", source);
    } catch (FileAlreadyExistsException e) {
      throw new AlreadyExistsException(e, "Cannot rename %s: %s already exists", source, target);
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to rename %s to %s", source, target);
    }
  }

  private static FileInfo toFileInfo(Path path) {
    File file = path.toFile();
    return new FileInfo(file.getPath(), file.length());
  }

  private static Path toPath(String location) {
    return toFile(location).toPath();
  }

  private static File toFile(String location) {
    if (location.startsWith(FILE_SCHEME)) {
      return Paths.get(URI.create(location)).toFile();
    }
    return new File(location);
  }

  private static class LocalOutputFile implements OutputFile {
    private final File file;

    private LocalOutputFile(File file) {
      this.file = file;
    }

    @Override
    public PositionOutputStream create() {
      if (file.exists()) {
        throw new AlreadyExistsException("File already exists: %s", file);
      }

      File parent = file.getAbsoluteFile().getParentFile();
      if (!parent.isDirectory() && !parent.mkdirs()) {
        throw new RuntimeIOException(
            "Failed to create the file's directory at %s.", parent.getAbsolutePath());
      }

      try {
        return new PositionFileOutputStream(file, new RandomAccessFile(file, "rw"));
      } catch (FileNotFoundException e) {
        throw new NotFoundException(e, "Failed to create file: %s", file);
      }
    }

    @Override
    public PositionOutputStream createOrOverwrite() {
      if (file.exists()) {
        if (!file.delete()) {
          throw new RuntimeIOException("Failed to delete: %s", file);
        }
      }
      return create();
    }

    @Override
    public String location() {
      return file.getPath();
    }

    @Override
    public InputFile toInputFile() {
      return new LocalInputFile(file, -1L);
    }

    @Override
    public String toString() {
      return location();
    }
  }

  private static class LocalInputFile implements InputFile {
    private final File file;
    private final long fileLength;

    private LocalInputFile(File file, long length) {
      this.file = file;
      this.fileLength = length;
    }

    @Override
    public long getLength() {
      if (fileLength >= 0) {
        return fileLength;
      } else {
        return file.length();
      }
    }

    @Override
    public SeekableInputStream newStream() {
      try {
        return new SeekableFileInputStream(new RandomAccessFile(file, "r"));
      } catch (FileNotFoundException e) {
        throw new NotFoundException(e, "Failed to read file: %s", file);
      }
    }

    @Override
    public String location() {
      return file.getPath();
    }

    @Override
    public boolean exists() {
      return file.exists();
    }

    @Override
    public String toString() {
      return location();
    }
  }

  private static class SeekableFileInputStream extends SeekableInputStream {
    private final RandomAccessFile stream;

    private SeekableFileInputStream(RandomAccessFile stream) {
      this.stream = stream;
    }

    @Override
    public long getPos() throws IOException {
      return stream.getFilePointer();
    }

    @Override
    public void seek(long newPos) throws IOException {
      stream.seek(newPos);
    }

    @Override
    public int read() throws IOException {
      return stream.read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return stream.read(b, off, len);
    }

    @Override
    public long skip(long n) throws IOException {
      if (n > Integer.MAX_VALUE) {
        return stream.skipBytes(Integer.MAX_VALUE);
      } else {
        return stream.skipBytes((int) n);
      }
    }

    @Override
    public void close() throws IOException {
      stream.close();
    }
  }

  private static class PositionFileOutputStream extends PositionOutputStream {
    private final File file;
    private final RandomAccessFile stream;
    private boolean isClosed = false;

    private PositionFileOutputStream(File file, RandomAccessFile stream) {
      this.file = file;
      this.stream = stream;
    }

    @Override
    public long getPos() throws IOException {
      if (isClosed) {
        return file.length();
      }
      return stream.getFilePointer();
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      stream.write(b, off, len);
    }

    @Override
    public void write(int b) throws IOException {
      stream.write(b);
    }

    @Override
    public void close() throws IOException {
      stream.close();
      this.isClosed = true;
    }
  }
}
