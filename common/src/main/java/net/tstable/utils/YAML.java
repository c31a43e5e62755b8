// This file is part of TSTable.
// Copyright (C) 2026 The TSTable Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tstable.utils;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import net.tstable.exceptions.SerdesException;

/**
 * The YAML twin of {@link JSON}: a shared, pre-configured mapper with
 * thin parsing wrappers. Table definitions and store configs use the same
 * Jackson builders in both formats.
 *
 * @since 1.0
 */
public final class YAML {
  /**
   * Jackson de/serializer initialized, configured and shared
   */
  private static final ObjectMapper MAPPER =
      new ObjectMapper(new YAMLFactory());
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }

  private YAML() {
  }

  /**
   * Deserializes a YAML formatted string to a specific class type
   * @param yaml The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws SerdesException if the data could not be read
   * @param <T> The type of object to parse to.
   */
  public static final <T> T parseToObject(final String yaml,
                                          final Class<T> pojo) {
    if (yaml == null || yaml.isEmpty())
      throw new IllegalArgumentException("Incoming data was null or empty");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");

    try {
      return MAPPER.readValue(yaml, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new SerdesException("Failed to parse YAML", e);
    }
  }

  /**
   * Deserializes a YAML formatted input stream to a specific class type
   * @param stream The stream to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws SerdesException if the data could not be read
   * @param <T> The type of object to parse to.
   */
  public static final <T> T parseToObject(final InputStream stream,
                                          final Class<T> pojo) {
    if (stream == null)
      throw new IllegalArgumentException("Incoming data was null");
    if (pojo == null)
      throw new IllegalArgumentException("Missing class type");
    try {
      return MAPPER.readValue(stream, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new SerdesException("Failed to read YAML stream", e);
    }
  }
}
