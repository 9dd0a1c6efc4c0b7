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
import io.sieve.SieveProperties;
import io.sieve.hadoop.HadoopFileIO;
import io.sieve.io.FileIO;
import io.sieve.io.LocalFileIO;
import io.sieve.util.PropertyUtil;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;

/** Maps each {@link SessionBackend} to the {@link FileIO} it runs on. */
public class SessionBackends {

  @FunctionalInterface
  interface FileIOFactory {
    FileIO create(Configuration hadoopConf);
  }

  private static final Map<SessionBackend, FileIOFactory> FACTORIES =
      ImmutableMap.of(
          SessionBackend.DEFAULT, conf -> new LocalFileIO(),
          SessionBackend.EXTENDED,
          conf -> conf != null ? new HadoopFileIO(conf) : new HadoopFileIO());

  private SessionBackends() {}

  /** Returns the backend selected by {@link SieveProperties#SESSION_BACKEND}. */
  public static SessionBackend resolve(Map<String, String> properties) {
    return SessionBackend.fromName(
        PropertyUtil.propertyAsString(
            properties,
            SieveProperties.SESSION_BACKEND,
            SieveProperties.SESSION_BACKEND_DEFAULT));
  }

  /**
   * Creates and initializes the FileIO of a backend.
   *
   * @param backend a session backend
   * @param properties session properties, passed to the FileIO
   * @param hadoopConf Hadoop configuration for the extended backend, or null for the default
   * @return an initialized FileIO
   */
  public static FileIO newFileIO(
      SessionBackend backend, Map<String, String> properties, Configuration hadoopConf) {
    FileIOFactory factory = FACTORIES.get(backend);
    Preconditions.checkArgument(factory != null, "No FileIO registered for backend: %s", backend);
    FileIO io = factory.create(hadoopConf);
    io.initialize(properties);
    return io;
  }
}
