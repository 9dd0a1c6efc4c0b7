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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteStreams;
import io.sieve.exceptions.CorruptMetadataException;
import io.sieve.exceptions.UnsupportedIndexTypeException;
import io.sieve.index.IndexDefinitionParser;
import io.sieve.io.InputFile;
import io.sieve.io.OutputFile;
import io.sieve.io.SeekableInputStream;
import io.sieve.util.JsonUtil;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Iterator;

/**
 * Reads and writes {@link PartitionMetadata} sidecar files.
 *
 * <p>A sidecar is framed as {@code MAGIC | JSON payload | payload length | MAGIC}, where the magic
 * is the four bytes {@code SVM1} and the length is a little-endian int. The payload is UTF-8 JSON.
 */
public class PartitionMetadataParser {

  static final byte[] MAGIC = new byte[] {'S', 'V', 'M', '1'};
  static final int FOOTER_LENGTH = Integer.BYTES + MAGIC.length;

  static final String FORMAT_VERSION = "format-version";
  static final String SCHEMA = "schema";
  static final String READER_CLASS_NAME = "reader-class-name";
  static final String FILE_METAS = "file-metas";
  static final String PATH = "path";
  static final String ROW_COUNT = "row-count";
  static final String FINGERPRINT = "fingerprint";
  static final String INDEX_METAS = "index-metas";
  static final String NAME = "name";

  private PartitionMetadataParser() {}

  public static String toJson(PartitionMetadata metadata) {
    return toJson(metadata, false);
  }

  public static String toJson(PartitionMetadata metadata, boolean pretty) {
    return JsonUtil.generate(gen -> toJson(metadata, gen), pretty);
  }

  public static void toJson(PartitionMetadata metadata, JsonGenerator gen) throws IOException {
    Preconditions.checkArgument(null != metadata, "Invalid partition metadata: null");

    gen.writeStartObject();

    gen.writeNumberField(FORMAT_VERSION, metadata.formatVersion());
    gen.writeFieldName(SCHEMA);
    SchemaParser.toJson(metadata.schema(), gen);
    gen.writeStringField(READER_CLASS_NAME, metadata.readerClassName());

    gen.writeArrayFieldStart(FILE_METAS);
    for (FileMeta fileMeta : metadata.fileMetas()) {
      gen.writeStartObject();
      gen.writeStringField(PATH, fileMeta.path());
      gen.writeNumberField(ROW_COUNT, fileMeta.rowCount());
      JsonUtil.writeByteBuffer(FINGERPRINT, fileMeta.fingerprint(), gen);
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeArrayFieldStart(INDEX_METAS);
    for (IndexMeta indexMeta : metadata.indexMetas()) {
      gen.writeStartObject();
      gen.writeStringField(NAME, indexMeta.name());
      IndexDefinitionParser.writeFields(indexMeta.definition(), gen);
      gen.writeEndObject();
    }
    gen.writeEndArray();

    gen.writeEndObject();
  }

  public static PartitionMetadata fromJson(String json) {
    Preconditions.checkArgument(json != null, "Cannot parse partition metadata from null string");
    return JsonUtil.parse(json, PartitionMetadataParser::fromJson);
  }

  public static PartitionMetadata fromJson(JsonNode json) {
    Preconditions.checkArgument(json != null, "Cannot parse partition metadata from null object");
    Preconditions.checkArgument(
        json.isObject(), "Cannot parse partition metadata from non-object: %s", json);

    int formatVersion = JsonUtil.getInt(FORMAT_VERSION, json);
    Preconditions.checkArgument(
        formatVersion > 0 && formatVersion <= PartitionMetadata.SUPPORTED_FORMAT_VERSION,
        "Cannot read unsupported version %s",
        formatVersion);

    PartitionMetadata.Builder builder =
        PartitionMetadata.builder()
            .withFormatVersion(formatVersion)
            .withSchema(SchemaParser.fromJson(JsonUtil.get(SCHEMA, json)))
            .withReaderClassName(JsonUtil.getString(READER_CLASS_NAME, json));

    Iterator<JsonNode> files = JsonUtil.getArrayElements(FILE_METAS, json);
    while (files.hasNext()) {
      JsonNode file = files.next();
      Preconditions.checkArgument(
          file.isObject(), "Cannot parse file meta from non-object: %s", file);
      builder.addFileMeta(
          FileMeta.of(
              JsonUtil.getByteBuffer(FINGERPRINT, file),
              JsonUtil.getLong(ROW_COUNT, file),
              JsonUtil.getString(PATH, file)));
    }

    Iterator<JsonNode> indexes = JsonUtil.getArrayElements(INDEX_METAS, json);
    while (indexes.hasNext()) {
      JsonNode index = indexes.next();
      builder.addIndexMeta(
          IndexMeta.of(JsonUtil.getString(NAME, index), IndexDefinitionParser.fromJson(index)));
    }

    return builder.build();
  }

  /** Returns the framed sidecar bytes for the given metadata. */
  public static ByteBuffer toBytes(PartitionMetadata metadata) {
    byte[] payload = toJson(metadata).getBytes(StandardCharsets.UTF_8);
    ByteBuffer buffer =
        ByteBuffer.allocate(MAGIC.length + payload.length + FOOTER_LENGTH)
            .order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(MAGIC);
    buffer.put(payload);
    buffer.putInt(payload.length);
    buffer.put(MAGIC);
    buffer.flip();
    return buffer;
  }

  /**
   * Parses framed sidecar bytes.
   *
   * @throws CorruptMetadataException if the framing or the payload is invalid
   */
  public static PartitionMetadata fromBytes(ByteBuffer bytes) {
    ByteBuffer in = bytes.duplicate().order(ByteOrder.LITTLE_ENDIAN);
    int length = in.remaining();
    if (length < MAGIC.length + FOOTER_LENGTH) {
      throw new CorruptMetadataException("Truncated sidecar: %s bytes", length);
    }

    int start = in.position();
    checkMagic(in, start, "header");
    checkMagic(in, in.limit() - MAGIC.length, "footer");

    int payloadLength = in.getInt(in.limit() - FOOTER_LENGTH);
    int expected = length - MAGIC.length - FOOTER_LENGTH;
    if (payloadLength != expected) {
      throw new CorruptMetadataException(
          "Invalid sidecar payload length: %s, expected %s", payloadLength, expected);
    }

    byte[] payload = new byte[payloadLength];
    in.position(start + MAGIC.length);
    in.get(payload);

    try {
      return fromJson(new String(payload, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException
        | IllegalStateException
        | UncheckedIOException
        | UnsupportedIndexTypeException e) {
      throw new CorruptMetadataException(e, "Invalid sidecar payload: %s", e.getMessage());
    }
  }

  private static void checkMagic(ByteBuffer in, int offset, String where) {
    byte[] magic = new byte[MAGIC.length];
    for (int i = 0; i < MAGIC.length; i += 1) {
      magic[i] = in.get(offset + i);
    }

    if (!Arrays.equals(MAGIC, magic)) {
      throw new CorruptMetadataException(
          "Invalid sidecar %s magic: %s", where, Arrays.toString(magic));
    }
  }

  public static void write(PartitionMetadata metadata, OutputFile outputFile) {
    ByteBuffer bytes = toBytes(metadata);
    try (OutputStream stream = outputFile.create()) {
      stream.write(bytes.array(), bytes.arrayOffset() + bytes.position(), bytes.remaining());
    } catch (IOException e) {
      throw new UncheckedIOException(
          String.format("Failed to write json to file: %s", outputFile.location()), e);
    }
  }

  public static PartitionMetadata read(InputFile file) {
    try (SeekableInputStream is = file.newStream()) {
      return fromBytes(ByteBuffer.wrap(ByteStreams.toByteArray(is)));
    } catch (IOException e) {
      throw new UncheckedIOException(
          String.format("Failed to read file: %s", file.location()), e);
    }
  }
}
