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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Streams;
import io.sieve.exceptions.AlreadyExistsException;
import io.sieve.exceptions.NotFoundException;
import io.sieve.exceptions.RuntimeIOException;
import io.sieve.io.FileInfo;
import io.sieve.io.InputFile;
import io.sieve.io.OutputFile;
import io.sieve.io.SupportsPrefixOperations;
import io.sieve.io.SupportsRenameOperations;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FileAlreadyExistsException;
import org.apache.hadoop.fs.FileContext;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Options;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.fs.RemoteIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link io.sieve.io.FileIO} over any Hadoop {@link FileSystem}.
 *
 * <p>Renames go through {@link FileContext#rename(Path, Path, Options.Rename...)}, which is atomic
 * on HDFS and on the local file system.
 */
public class HadoopFileIO implements SupportsPrefixOperations, SupportsRenameOperations {
  private static final Logger LOG = LoggerFactory.getLogger(HadoopFileIO.class);

  private final SerializableConfiguration hadoopConf;
  private Map<String, String> properties = ImmutableMap.of();

  public HadoopFileIO() {
    this(new Configuration());
  }

  public HadoopFileIO(Configuration hadoopConf) {
    this.hadoopConf = new SerializableConfiguration(hadoopConf);
  }

  public Configuration conf() {
    return hadoopConf.get();
  }

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
    Path hadoopPath = new Path(path);
    return HadoopInputFile.fromPath(hadoopPath, getFs(hadoopPath));
  }

  @Override
  public InputFile newInputFile(String path, long length) {
    Path hadoopPath = new Path(path);
    return HadoopInputFile.fromPath(hadoopPath, length, getFs(hadoopPath));
  }

  @Override
  public OutputFile newOutputFile(String path) {
    Path hadoopPath = new Path(path);
    return HadoopOutputFile.fromPath(hadoopPath, getFs(hadoopPath));
  }

  @Override
  public void deleteFile(String path) {
    Path toDelete = new Path(path);
    FileSystem fs = getFs(toDelete);
    try {
      fs.delete(toDelete, false /* not recursive */);
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to delete file: %s", path);
    }
  }

  @Override
  public Iterable<FileInfo> listPrefix(String prefix) {
    Path prefixToList = new Path(prefix);
    FileSystem fs = getFs(prefixToList);

    return () -> {
      try {
        return Streams.stream(
                new AdaptingIterator<>(fs.listFiles(prefixToList, true /* recursive */)))
            .map(
                fileStatus ->
                    new FileInfo(fileStatus.getPath().toString(), fileStatus.getLen()))
            .iterator();
      } catch (FileNotFoundException e) {
        return Collections.emptyIterator();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    };
  }

  @Override
  public void deletePrefix(String prefix) {
    Path prefixToDelete = new Path(prefix);
    FileSystem fs = getFs(prefixToDelete);

    try {
      fs.delete(prefixToDelete, true /* recursive */);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void rename(String source, String target, boolean overwrite) {
    Path src = new Path(source);
    Path dst = new Path(target);
    try {
      FileSystem fs = getFs(dst);
      Path parent = dst.getParent();
      if (parent != null && !fs.exists(parent)) {
        fs.mkdirs(parent);
      }

      FileContext context = FileContext.getFileContext(dst.toUri(), conf());
      if (overwrite) {
        context.rename(src, dst, Options.Rename.OVERWRITE);
      } else {
        context.rename(src, dst, Options.Rename.NONE);
      }

      LOG.debug("Renamed {} to {}", source, target);
    } catch (FileAlreadyExistsException e) {
      throw new AlreadyExistsException(e, "Cannot rename %s: %s already exists", source, target);
    } catch (FileNotFoundException e) {
      throw new NotFoundException(e, "Cannot rename missing file: %s", source);
    } catch (IOException e) {
      throw new RuntimeIOException(e, "Failed to rename %s to %s", source, target);
    }
  }

  private FileSystem getFs(Path path) {
    try {
      return path.getFileSystem(conf());
    } catch (IOException e) {
      throw new UncheckedIOException(
          String.format("Failed to get file system for path: %s", path), e);
    }
  }

  /**
   * This class is a simple adaptor to allow for using Hadoop's RemoteIterator as an Iterator.
   *
   * @param <E> element type
   */
  private static class AdaptingIterator<E> implements Iterator<E>, RemoteIterator<E> {
    private final RemoteIterator<E> delegate;

    AdaptingIterator(RemoteIterator<E> delegate) {
      this.delegate = delegate;
    }

    @Override
    public boolean hasNext() {
      try {
        return delegate.hasNext();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }

    @Override
    public E next() {
      try {
        return delegate.next();
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
