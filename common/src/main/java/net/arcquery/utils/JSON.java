// This file is part of ArcQuery.
// Copyright (C) 2026  The ArcQuery Authors.
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
package net.arcquery.utils;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static initialization and configuration of the Jackson ObjectMapper shared
 * throughout the project. The mapper is thread safe and expensive to build
 * so there is exactly one.
 * <p>
 * For streaming large bodies, use {@link #getMapper()} directly.
 * @since 1.0
 */
public final class JSON {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER = new ObjectMapper();
  static {
    // Arc may emit NaN and Infinity for float columns.
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
  
  private JSON() { }

  /**
   * Parses a JSON string into a tree.
   * @param json The string to parse.
   * @return The root node.
   * @throws IllegalArgumentException if the data was null, empty or not JSON.
   */
  public static JsonNode parseToNode(final String json) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    }
  }
  
  /**
   * Parses a JSON stream into a tree. The stream is not closed.
   * @param json The stream to parse.
   * @return The root node, a missing node if the stream was empty.
   * @throws IllegalArgumentException if the stream was null or not JSON.
   * @throws JSONException if reading the stream failed.
   */
  public static JsonNode parseToNode(final InputStream json) {
    if (json == null) {
      throw new IllegalArgumentException("Incoming data was null");
    }
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize.
   * @return A JSON formatted string.
   * @throws IllegalArgumentException if the object was null.
   * @throws JSONException if the object could not be serialized.
   */
  public static String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return MAPPER.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }
  
  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
