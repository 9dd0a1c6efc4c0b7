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
package io.sieve.session;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import io.sieve.MetadataStore;
import io.sieve.SieveProperties;
import io.sieve.exec.ExecutionEngine;
import io.sieve.exec.LocalExecutionEngine;
import io.sieve.exec.RowReader;
import io.sieve.io.FileIO;
import io.sieve.statistics.StatisticsOptions;
import io.sieve.util.PropertyUtil;
import io.sieve.util.ThreadPools;
import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import org.apache.hadoop.conf.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything an index command needs to run: configuration, storage, and an execution engine.
 *
 * <p>Sessions are built explicitly and passed to each command. A session owns the FileIO and the
 * worker pool it creates, and releases both on {@link #close()}.
 */
public class SieveSession implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(SieveSession.class);

  private final Map<String, String> properties;
  private final SessionBackend backend;
  private final FileIO io;
  private final ExecutorService workerPool;
  private final ExecutionEngine engine;
  private final StatisticsOptions statisticsOptions;
  private final MetadataStore metadataStore;

  private SieveSession(
      Map<String, String> properties,
      SessionBackend backend,
      FileIO io,
      ExecutorService workerPool,
      ExecutionEngine engine) {
    this.properties = properties;
    this.backend = backend;
    this.io = io;
    this.workerPool = workerPool;
    this.engine = engine;
    this.statisticsOptions = StatisticsOptions.fromProperties(properties);
    this.metadataStore = new MetadataStore(io);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, String> properties() {
    return properties;
  }

  public SessionBackend backend() {
    return backend;
  }

  public FileIO io() {
    return io;
  }

  public ExecutionEngine engine() {
    return engine;
  }

  public StatisticsOptions statisticsOptions() {
    return statisticsOptions;
  }

  public MetadataStore metadataStore() {
    return metadataStore;
  }

  @Override
  public void close() {
    if (workerPool != null) {
      workerPool.shutdown();
    }

    io.close();
    LOG.debug("Closed session ({} backend)", backend.backendName());
  }

  public static class Builder {
    private final Map<String, String> properties = Maps.newHashMap();
    private Configuration hadoopConf = null;
    private RowReader rowReader = null;
    private FileIO io = null;
    private ExecutionEngine engine = null;

    private Builder() {}

    public Builder withProperty(String key, String value) {
      Preconditions.checkArgument(key != null, "Invalid property key: null");
      properties.put(key, value);
      return this;
    }

    public Builder withProperties(Map<String, String> newProperties) {
      Preconditions.checkArgument(newProperties != null, "Invalid properties: null");
      properties.putAll(newProperties);
      return this;
    }

    /** Sets the Hadoop configuration used by the {@link SessionBackend#EXTENDED} backend. */
    public Builder withHadoopConf(Configuration conf) {
      this.hadoopConf = conf;
      return this;
    }

    /** Sets the reader that decodes data files for the local execution engine. */
    public Builder withRowReader(RowReader reader) {
      this.rowReader = reader;
      return this;
    }

    /** Uses the given FileIO instead of the backend's. The session still closes it. */
    public Builder withFileIO(FileIO fileIO) {
      this.io = fileIO;
      return this;
    }

    /** Uses the given engine instead of a local one; no worker pool is created. */
    public Builder withExecutionEngine(ExecutionEngine executionEngine) {
      this.engine = executionEngine;
      return this;
    }

    public SieveSession build() {
      Map<String, String> props = ImmutableMap.copyOf(properties);
      SessionBackend backend = SessionBackends.resolve(props);
      FileIO fileIO = io != null ? io : SessionBackends.newFileIO(backend, props, hadoopConf);

      if (engine != null) {
        return new SieveSession(props, backend, fileIO, null, engine);
      }

      Preconditions.checkArgument(
          rowReader != null, "Cannot build a session without a row reader or execution engine");
      int threads =
          PropertyUtil.propertyAsInt(
              props, SieveProperties.WORKER_THREADS, ThreadPools.DEFAULT_WORKER_THREAD_POOL_SIZE);
      int retries =
          PropertyUtil.propertyAsInt(
              props, SieveProperties.TASK_RETRIES, SieveProperties.TASK_RETRIES_DEFAULT);
      ExecutorService pool = ThreadPools.newFixedThreadPool("sieve-worker", threads);
      LOG.info("Starting session: {} backend, {} worker threads", backend.backendName(), threads);
      return new SieveSession(
          props, backend, fileIO, pool, new LocalExecutionEngine(fileIO, rowReader, pool, retries));
    }
  }
}
