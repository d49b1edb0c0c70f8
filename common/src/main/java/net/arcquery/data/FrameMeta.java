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
package net.arcquery.data;

import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Maps;

/**
 * Metadata attached to a frame: its classification, the SQL that produced 
 * it and free-form values such as timings.
 * 
 * @since 1.0
 */
public class FrameMeta {
  private FrameType type;
  private String executed_query;
  private VisualizationType preferred_visualization;
  private final Map<String, Object> custom;
  
  public FrameMeta() {
    custom = Maps.newLinkedHashMap();
  }
  
  /** @return The frame type, may be null if not classified yet. */
  public FrameType getType() {
    return type;
  }
  
  public void setType(final FrameType type) {
    this.type = type;
  }
  
  /** @return The SQL sent to the engine, may be null. */
  public String getExecutedQueryString() {
    return executed_query;
  }
  
  public void setExecutedQueryString(final String executed_query) {
    this.executed_query = executed_query;
  }
  
  /** @return The preferred visualization, may be null. */
  public VisualizationType getPreferredVisualization() {
    return preferred_visualization;
  }
  
  public void setPreferredVisualization(
      final VisualizationType preferred_visualization) {
    this.preferred_visualization = preferred_visualization;
  }
  
  /** @return An unmodifiable view of the custom values. */
  public Map<String, Object> getCustom() {
    return Collections.unmodifiableMap(custom);
  }
  
  /**
   * Sets a custom value, replacing any existing one.
   * @param key A non-null key.
   * @param value The value.
   */
  public void putCustom(final String key, final Object value) {
    custom.put(key, value);
  }
  
  /**
   * Overwrites this metadata with the values of another frame's.
   * @param other The non-null metadata to copy.
   */
  public void copyFrom(final FrameMeta other) {
    type = other.type;
    executed_query = other.executed_query;
    preferred_visualization = other.preferred_visualization;
    custom.clear();
    custom.putAll(other.custom);
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("type=")
        .append(type)
        .append(", executedQueryString=")
        .append(executed_query)
        .append(", preferredVisualization=")
        .append(preferred_visualization)
        .append(", custom=")
        .append(custom)
        .toString();
  }
}
