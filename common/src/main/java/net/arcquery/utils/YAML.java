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

import java.io.File;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * The YAML flavored twin of {@link JSON}, used for reading configuration 
 * files.
 * @since 1.0
 */
public final class YAML {
  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper MAPPER = 
      new ObjectMapper(new YAMLFactory());
  static {
    MAPPER.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    MAPPER.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
  }
  
  private YAML() { }

  /**
   * Deserializes a YAML formatted string into a tree.
   * @param yaml The string to deserialize.
   * @return The root node.
   * @throws IllegalArgumentException if the data was null, empty or 
   * malformed.
   * @throws JSONException if the data could not be read.
   */
  public static JsonNode parseToNode(final String yaml) {
    if (yaml == null || yaml.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    try {
      return MAPPER.readTree(yaml);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }
  
  /**
   * Reads a YAML file into a tree.
   * @param file The non-null file to read.
   * @return The root node.
   * @throws IllegalArgumentException if the file was null or malformed.
   * @throws JSONException if the file could not be read.
   */
  public static JsonNode parseToNode(final File file) {
    if (file == null) {
      throw new IllegalArgumentException("File cannot be null.");
    }
    try {
      return MAPPER.readTree(file);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException("Unable to read " + file, e);
    }
  }
  
  /** @return The shared mapper. */
  public static ObjectMapper getMapper() {
    return MAPPER;
  }
}
