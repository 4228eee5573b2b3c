/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.multiscan.exec.store.multifile;

import java.nio.charset.StandardCharsets;

import org.multiscan.common.exceptions.UserException;
import org.multiscan.common.util.JacksonUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

/**
 * Writes and reads the plan state of a multi-file scan, the options and the
 * bind data, as JSON. Every object carries a {@code version} property and
 * named properties only; properties written by a newer version are skipped
 * on read.
 */
public final class MultiFilePersistence {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MultiFilePersistence.class);

  private static final ObjectMapper MAPPER = JacksonUtils.createObjectMapper();

  private MultiFilePersistence() {
  }

  public static String serializeOptions(MultiFileOptions options) {
    return write(options);
  }

  public static byte[] serializeOptionsToBytes(MultiFileOptions options) {
    return serializeOptions(options).getBytes(StandardCharsets.UTF_8);
  }

  public static MultiFileOptions deserializeOptions(String json) {
    return read(json, MultiFileOptions.class);
  }

  public static MultiFileOptions deserializeOptions(byte[] json) {
    Preconditions.checkNotNull(json, "json");
    return deserializeOptions(new String(json, StandardCharsets.UTF_8));
  }

  public static String serializeBindData(MultiFileBindData bindData) {
    return write(bindData);
  }

  public static byte[] serializeBindDataToBytes(MultiFileBindData bindData) {
    return serializeBindData(bindData).getBytes(StandardCharsets.UTF_8);
  }

  public static MultiFileBindData deserializeBindData(String json) {
    return read(json, MultiFileBindData.class);
  }

  public static MultiFileBindData deserializeBindData(byte[] json) {
    Preconditions.checkNotNull(json, "json");
    return deserializeBindData(new String(json, StandardCharsets.UTF_8));
  }

  /**
   * Rejects state written by a version this code does not know how to read.
   * Called from the JSON creators, so the failure surfaces as a mapping error.
   */
  static void checkVersion(int version, Class<?> type) {
    if (version < 1 || version > currentVersion(type)) {
      throw new IllegalArgumentException(String.format(
          "Unsupported %s version %d, expected at most %d", type.getSimpleName(), version, currentVersion(type)));
    }
  }

  private static int currentVersion(Class<?> type) {
    if (type == MultiFileOptions.class) {
      return MultiFileOptions.CURRENT_VERSION;
    } else if (type == MultiFileBindData.class) {
      return MultiFileBindData.CURRENT_VERSION;
    }
    throw new IllegalArgumentException("Not a persisted type: " + type.getName());
  }

  private static String write(Object value) {
    Preconditions.checkNotNull(value, "value");
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw UserException.internalError(e)
          .message("Failed to serialize %s", value.getClass().getSimpleName())
          .build(logger);
    }
  }

  private static <T> T read(String json, Class<T> type) {
    Preconditions.checkNotNull(json, "json");
    final T value;
    try {
      value = MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw UserException.parseError(e)
          .message("Failed to deserialize %s: %s", type.getSimpleName(), e.getOriginalMessage())
          .build(logger);
    }
    if (value == null) {
      throw UserException.parseError()
          .message("Failed to deserialize %s: no value found", type.getSimpleName())
          .build(logger);
    }
    return value;
  }
}
