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
package net.arcquery.configuration;

import java.io.File;
import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.arcquery.utils.JSON;
import net.arcquery.utils.YAML;

/**
 * The immutable connection and execution settings for an Arc data source.
 * Instances are parsed from the host's JSON settings document plus its map
 * of secure values, or from a YAML file, and are safe to share across
 * threads. Use {@link #withDatabase(String)} for per-query overrides.
 * <p>
 * Keys and defaults:
 * <ul>
 * <li>{@code url}: Required base URL of the Arc API.</li>
 * <li>{@code apiKey}: Required, read from the secure values.</li>
 * <li>{@code database}: {@value #DEFAULT_DATABASE}</li>
 * <li>{@code timeout}: {@value #DEFAULT_TIMEOUT} seconds per request.</li>
 * <li>{@code useArrow}: false</li>
 * <li>{@code splitDuration}: {@value #DEFAULT_SPLIT_DURATION}</li>
 * <li>{@code maxConcurrency}: {@value #DEFAULT_MAX_CONCURRENCY} chunks in 
 * flight per query.</li>
 * <li>{@code timestampUnitCorrection}: true</li>
 * </ul>
 * 
 * @since 1.0
 */
public final class ArcSettings {
  public static final String API_KEY = "apiKey";
  public static final String DEFAULT_DATABASE = "default";
  public static final int DEFAULT_TIMEOUT = 30;
  public static final String DEFAULT_SPLIT_DURATION = "auto";
  public static final int DEFAULT_MAX_CONCURRENCY = 4;
  
  private final String url;
  private final String api_key;
  private final String database;
  private final int timeout;
  private final boolean use_arrow;
  private final String split_duration;
  private final int max_concurrency;
  private final boolean timestamp_unit_correction;
  
  /**
   * Private ctor, use the builder.
   * @param builder The non-null builder.
   */
  private ArcSettings(final Builder builder) {
    url = builder.url;
    api_key = builder.apiKey;
    database = builder.database;
    timeout = builder.timeout;
    use_arrow = builder.useArrow;
    split_duration = builder.splitDuration;
    max_concurrency = builder.maxConcurrency;
    timestamp_unit_correction = builder.timestampUnitCorrection;
  }
  
  /** @return The base URL without a trailing slash. */
  public String url() {
    return url;
  }
  
  /** @return The API key sent as a bearer token. */
  public String apiKey() {
    return api_key;
  }
  
  /** @return The database sent in the database header. */
  public String database() {
    return database;
  }
  
  /** @return The per-request timeout in seconds. */
  public int timeout() {
    return timeout;
  }
  
  /** @return Whether or not to use the Arrow endpoint. */
  public boolean useArrow() {
    return use_arrow;
  }
  
  /** @return The default split duration for queries that don't set one. */
  public String splitDuration() {
    return split_duration;
  }
  
  /** @return The maximum number of chunks in flight per query. */
  public int maxConcurrency() {
    return max_concurrency;
  }
  
  /** @return Whether or not implausible micro or nanosecond timestamps are
   * reinterpreted as seconds. */
  public boolean timestampUnitCorrection() {
    return timestamp_unit_correction;
  }
  
  /**
   * Returns settings with a different database, leaving this instance 
   * untouched.
   * @param database The database to use. If null or empty, this instance
   * is returned.
   * @return The settings to use for the query.
   */
  public ArcSettings withDatabase(final String database) {
    if (Strings.isNullOrEmpty(database) || database.equals(this.database)) {
      return this;
    }
    return toBuilder().setDatabase(database).build();
  }
  
  /** @return A builder initialized with these values. */
  public Builder toBuilder() {
    return newBuilder()
        .setUrl(url)
        .setApiKey(api_key)
        .setDatabase(database)
        .setTimeout(timeout)
        .setUseArrow(use_arrow)
        .setSplitDuration(split_duration)
        .setMaxConcurrency(max_concurrency)
        .setTimestampUnitCorrection(timestamp_unit_correction);
  }
  
  /**
   * Parses the host's settings document.
   * @param json_data The JSON settings, may be null.
   * @param secure The decrypted secure values, may be null.
   * @return The validated settings.
   * @throws IllegalArgumentException if the document was malformed or a 
   * required value was missing.
   */
  public static ArcSettings parse(final JsonNode json_data, 
                                  final Map<String, String> secure) {
    final JsonNode node = json_data == null || json_data.isNull() || 
        json_data.isMissingNode() ? 
            JsonNodeFactory.instance.objectNode() : json_data;
    final Builder builder;
    try {
      builder = JSON.getMapper().treeToValue(node, Builder.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to parse settings: " 
          + e.getOriginalMessage(), e);
    }
    final Map<String, String> secrets = secure == null ? 
        Collections.<String, String>emptyMap() : secure;
    return builder.setApiKey(secrets.get(API_KEY)).build();
  }
  
  /**
   * Loads settings from a YAML file. The API key is read from the file's
   * {@code apiKey} entry.
   * @param file The non-null file.
   * @return The validated settings.
   * @throws IllegalArgumentException if the file was malformed or a required
   * value was missing.
   */
  public static ArcSettings load(final File file) {
    final JsonNode root = YAML.parseToNode(file);
    final JsonNode key = root.get(API_KEY);
    return parse(root, key == null || key.isNull() ? null : 
      Collections.singletonMap(API_KEY, key.asText()));
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ArcSettings other = (ArcSettings) o;
    return Objects.equal(url, other.url)
        && Objects.equal(api_key, other.api_key)
        && Objects.equal(database, other.database)
        && timeout == other.timeout
        && use_arrow == other.use_arrow
        && Objects.equal(split_duration, other.split_duration)
        && max_concurrency == other.max_concurrency
        && timestamp_unit_correction == other.timestamp_unit_correction;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(url, api_key, database, timeout, use_arrow, 
        split_duration, max_concurrency, timestamp_unit_correction);
  }
  
  @Override
  public String toString() {
    // never print the key
    return new StringBuilder()
        .append("url=")
        .append(url)
        .append(", database=")
        .append(database)
        .append(", timeout=")
        .append(timeout)
        .append(", useArrow=")
        .append(use_arrow)
        .append(", splitDuration=")
        .append(split_duration)
        .append(", maxConcurrency=")
        .append(max_concurrency)
        .append(", timestampUnitCorrection=")
        .append(timestamp_unit_correction)
        .toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static final class Builder {
    @JsonProperty
    private String url;
    private String apiKey;
    @JsonProperty
    private String database;
    @JsonProperty
    private int timeout;
    @JsonProperty
    private boolean useArrow;
    @JsonProperty
    private String splitDuration;
    @JsonProperty
    private int maxConcurrency;
    @JsonProperty
    private boolean timestampUnitCorrection = true;
    
    public Builder setUrl(final String url) {
      this.url = url;
      return this;
    }
    
    public Builder setApiKey(final String apiKey) {
      this.apiKey = apiKey;
      return this;
    }
    
    public Builder setDatabase(final String database) {
      this.database = database;
      return this;
    }
    
    /**
     * @param timeout The per-request timeout in seconds. 0 or less uses the
     * default.
     * @return The builder.
     */
    public Builder setTimeout(final int timeout) {
      this.timeout = timeout;
      return this;
    }
    
    public Builder setUseArrow(final boolean useArrow) {
      this.useArrow = useArrow;
      return this;
    }
    
    public Builder setSplitDuration(final String splitDuration) {
      this.splitDuration = splitDuration;
      return this;
    }
    
    /**
     * @param maxConcurrency The number of chunks in flight per query. 0 or 
     * less uses the default.
     * @return The builder.
     */
    public Builder setMaxConcurrency(final int maxConcurrency) {
      this.maxConcurrency = maxConcurrency;
      return this;
    }
    
    public Builder setTimestampUnitCorrection(
        final boolean timestampUnitCorrection) {
      this.timestampUnitCorrection = timestampUnitCorrection;
      return this;
    }
    
    /**
     * Applies defaults and validates.
     * @return The settings.
     * @throws IllegalArgumentException if the URL or API key was missing.
     */
    public ArcSettings build() {
      if (Strings.isNullOrEmpty(url) || url.trim().isEmpty()) {
        throw new IllegalArgumentException("URL is required");
      }
      if (Strings.isNullOrEmpty(apiKey)) {
        throw new IllegalArgumentException("API key is required");
      }
      String trimmed = url.trim();
      while (trimmed.endsWith("/")) {
        trimmed = trimmed.substring(0, trimmed.length() - 1);
      }
      url = trimmed;
      if (Strings.isNullOrEmpty(database)) {
        database = DEFAULT_DATABASE;
      }
      if (timeout <= 0) {
        timeout = DEFAULT_TIMEOUT;
      }
      if (Strings.isNullOrEmpty(splitDuration)) {
        splitDuration = DEFAULT_SPLIT_DURATION;
      }
      if (maxConcurrency <= 0) {
        maxConcurrency = DEFAULT_MAX_CONCURRENCY;
      }
      return new ArcSettings(this);
    }
  }
}
