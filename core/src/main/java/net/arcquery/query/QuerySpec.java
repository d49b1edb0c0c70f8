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
package net.arcquery.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Objects;
import com.google.common.base.Strings;

import net.arcquery.utils.JSON;

/**
 * A single query from the host: a reference ID, the SQL template with macros
 * and the options that control formatting and splitting.
 * 
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = QuerySpec.Builder.class)
public class QuerySpec {
  /** The reference ID the response is keyed on. */
  private final String ref_id;
  
  /** The SQL template. */
  private final String sql;
  
  /** SQL from dashboards migrated off other SQL sources. */
  private final String raw_sql;
  
  /** The result format. */
  private final QueryFormat format;
  
  /** An optional split duration override. */
  private final String split_duration;
  
  /** An optional database override. */
  private final String database;
  
  /** Accepted for compatibility, not used. */
  private final int max_data_points;
  
  protected QuerySpec(final Builder builder) {
    ref_id = builder.refId;
    sql = builder.sql;
    raw_sql = builder.rawSql;
    format = builder.format == null ? QueryFormat.UNSPECIFIED : builder.format;
    split_duration = builder.splitDuration;
    database = builder.database;
    max_data_points = builder.maxDataPoints;
  }
  
  /** @return The reference ID, may be null. */
  public String getRefId() {
    return ref_id;
  }
  
  /** @return The SQL template as given, may be null. */
  public String getSql() {
    return sql;
  }
  
  /** @return The legacy raw SQL, may be null. */
  public String getRawSql() {
    return raw_sql;
  }
  
  /** @return The SQL to run: {@link #getSql()} or, when that is empty, 
   * {@link #getRawSql()}. Never null. */
  public String effectiveSql() {
    if (!Strings.isNullOrEmpty(sql)) {
      return sql;
    }
    return Strings.nullToEmpty(raw_sql);
  }
  
  /** @return The result format. */
  public QueryFormat getFormat() {
    return format;
  }
  
  /** @return The split duration override, may be null or empty. */
  public String getSplitDuration() {
    return split_duration;
  }
  
  /** @return The database override, may be null or empty. */
  public String getDatabase() {
    return database;
  }
  
  /** @return The max data points hint. */
  public int getMaxDataPoints() {
    return max_data_points;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final QuerySpec other = (QuerySpec) o;
    return Objects.equal(ref_id, other.ref_id)
        && Objects.equal(sql, other.sql)
        && Objects.equal(raw_sql, other.raw_sql)
        && Objects.equal(format, other.format)
        && Objects.equal(split_duration, other.split_duration)
        && Objects.equal(database, other.database)
        && max_data_points == other.max_data_points;
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(ref_id, sql, raw_sql, format, split_duration, 
        database, max_data_points);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("refId=")
        .append(ref_id)
        .append(", sql=")
        .append(effectiveSql())
        .append(", format=")
        .append(format)
        .append(", splitDuration=")
        .append(split_duration)
        .append(", database=")
        .append(database)
        .toString();
  }
  
  /**
   * Parses the host's query model. The reference ID is always taken from 
   * the argument.
   * @param ref_id The reference ID of the query.
   * @param model The non-null JSON model.
   * @return The parsed query.
   * @throws IllegalArgumentException if the model was not an object or 
   * could not be mapped.
   */
  public static QuerySpec parse(final String ref_id, final JsonNode model) {
    if (model == null || !model.isObject()) {
      throw new IllegalArgumentException("Query model must be a JSON object "
          + "but was " + (model == null ? "null" : model.getNodeType()));
    }
    try {
      return JSON.getMapper().treeToValue(model, Builder.class)
          .setRefId(ref_id)
          .build();
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to parse query model: " 
          + e.getOriginalMessage(), e);
    }
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static final class Builder {
    @JsonProperty
    private String refId;
    @JsonProperty
    private String sql;
    @JsonProperty
    private String rawSql;
    @JsonProperty
    private QueryFormat format;
    @JsonProperty
    private String splitDuration;
    @JsonProperty
    private String database;
    @JsonProperty
    private int maxDataPoints;
    
    public Builder setRefId(final String refId) {
      this.refId = refId;
      return this;
    }
    
    public Builder setSql(final String sql) {
      this.sql = sql;
      return this;
    }
    
    public Builder setRawSql(final String rawSql) {
      this.rawSql = rawSql;
      return this;
    }
    
    public Builder setFormat(final QueryFormat format) {
      this.format = format;
      return this;
    }
    
    public Builder setSplitDuration(final String splitDuration) {
      this.splitDuration = splitDuration;
      return this;
    }
    
    public Builder setDatabase(final String database) {
      this.database = database;
      return this;
    }
    
    public Builder setMaxDataPoints(final int maxDataPoints) {
      this.maxDataPoints = maxDataPoints;
      return this;
    }
    
    public QuerySpec build() {
      return new QuerySpec(this);
    }
  }
}
