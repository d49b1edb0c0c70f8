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
package net.arcquery.data.decode;

import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import net.arcquery.data.Column;
import net.arcquery.data.ColumnType;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.FrameDecodeException;
import net.arcquery.utils.DateTime;
import net.arcquery.utils.JSON;
import net.arcquery.utils.JSONException;

/**
 * Decodes the JSON response document:
 * <pre>
 * {"columns": ["time", "host", "value"],
 *  "data": [["2026-02-18T10:00:00Z", "web01", 1.5], ...]}
 * </pre>
 * Each column's type is inferred from its first non-null value: numbers are
 * float64, strings in a column named like a time column or that parse as a
 * timestamp are timestamps, booleans are booleans and anything else is a 
 * string. All columns are nullable.
 * 
 * @since 1.0
 */
public class JsonFrameDecoder implements FrameDecoder {
  private static final Logger LOG = 
      LoggerFactory.getLogger(JsonFrameDecoder.class);
  
  /** Column names that always hold timestamps when the values are strings. */
  public static final Set<String> TIME_COLUMN_NAMES = 
      ImmutableSet.of("time", "timestamp", "_time");
  
  /** Numeric timestamps above this are milliseconds, else seconds. */
  public static final double MILLISECOND_THRESHOLD = 1e12;
  
  @Override
  public DataFrame decode(final InputStream stream) {
    final JsonNode root;
    try {
      root = JSON.parseToNode(stream);
    } catch (IllegalArgumentException e) {
      throw new FrameDecodeException("Invalid JSON response: " 
          + rootMessage(e), e);
    } catch (JSONException e) {
      throw new FrameDecodeException("Failed to read JSON response: " 
          + rootMessage(e), e);
    }
    return decode(root);
  }
  
  /**
   * Decodes an already parsed document.
   * @param root The document root.
   * @return The frame, without columns if there were no rows.
   * @throws FrameDecodeException if the document didn't have the expected
   * shape.
   */
  public DataFrame decode(final JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new FrameDecodeException("Expected a JSON object response but got " 
          + (root == null ? "nothing" : root.getNodeType()));
    }
    final JsonNode columns = requireArray(root, "columns");
    final JsonNode data = requireArray(root, "data");
    
    final DataFrame frame = new DataFrame("");
    if (data.size() == 0) {
      return frame;
    }
    
    final List<String> names = Lists.newArrayListWithCapacity(columns.size());
    for (final JsonNode name : columns) {
      names.add(name.asText());
    }
    for (int r = 0; r < data.size(); r++) {
      final JsonNode row = data.get(r);
      if (!row.isArray()) {
        throw new FrameDecodeException("Row " + r + " must be an array but was " 
            + row.getNodeType());
      }
      if (row.size() != names.size()) {
        throw new FrameDecodeException("Row " + r + " has " + row.size() 
            + " values but there are " + names.size() + " columns");
      }
    }
    
    for (int c = 0; c < names.size(); c++) {
      final String name = names.get(c);
      final ColumnType type = inferType(name, data, c);
      final Column column = new Column(name, type, true);
      int unparsed = 0;
      for (int r = 0; r < data.size(); r++) {
        final JsonNode cell = data.get(r).get(c);
        final Object value = coerce(column, cell, r);
        if (value == null && type == ColumnType.TIMESTAMP 
            && cell != null && !cell.isNull()) {
          unparsed++;
        }
        column.append(value);
      }
      if (unparsed > 0) {
        LOG.warn("Unable to parse " + unparsed + " timestamps in column [" 
            + name + "], they were set to null");
      }
      frame.addColumn(column);
    }
    return frame;
  }
  
  /**
   * Infers the column type from the first non-null value.
   * @param name The column name.
   * @param data The rows.
   * @param index The column index.
   * @return The type, {@link ColumnType#STRING} if all values were null.
   */
  static ColumnType inferType(final String name, 
                              final JsonNode data, 
                              final int index) {
    for (final JsonNode row : data) {
      final JsonNode cell = row.get(index);
      if (cell == null || cell.isNull()) {
        continue;
      }
      if (cell.isNumber()) {
        return ColumnType.FLOAT64;
      }
      if (cell.isTextual()) {
        if (TIME_COLUMN_NAMES.contains(name.toLowerCase()) 
            || DateTime.parseTimestamp(cell.asText()) != null) {
          return ColumnType.TIMESTAMP;
        }
        return ColumnType.STRING;
      }
      if (cell.isBoolean()) {
        return ColumnType.BOOL;
      }
      return ColumnType.STRING;
    }
    return ColumnType.STRING;
  }
  
  /**
   * Converts a cell to the column's value class.
   * @return The value or null.
   * @throws FrameDecodeException if the cell can't be represented.
   */
  static Object coerce(final Column column, final JsonNode cell, final int row) {
    if (cell == null || cell.isNull()) {
      return null;
    }
    switch (column.type()) {
    case FLOAT64:
      if (cell.isNumber()) {
        return cell.doubleValue();
      }
      if (cell.isTextual()) {
        try {
          return Double.parseDouble(cell.asText().trim());
        } catch (NumberFormatException e) {
          throw mismatch(column, cell, row, e);
        }
      }
      throw mismatch(column, cell, row, null);
    case TIMESTAMP:
      if (cell.isNumber()) {
        return fromEpoch(cell.doubleValue());
      }
      if (cell.isTextual()) {
        return DateTime.parseTimestamp(cell.asText());
      }
      throw mismatch(column, cell, row, null);
    case BOOL:
      if (cell.isBoolean()) {
        return cell.booleanValue();
      }
      if (cell.isTextual() && (cell.asText().equalsIgnoreCase("true") 
          || cell.asText().equalsIgnoreCase("false"))) {
        return Boolean.parseBoolean(cell.asText());
      }
      throw mismatch(column, cell, row, null);
    default:
      return cell.isValueNode() ? cell.asText() : cell.toString();
    }
  }
  
  /**
   * @param epoch Seconds or milliseconds since the Unix epoch.
   * @return The instant at millisecond resolution.
   */
  static Instant fromEpoch(final double epoch) {
    if (epoch > MILLISECOND_THRESHOLD) {
      return Instant.ofEpochMilli((long) epoch);
    }
    return Instant.ofEpochMilli(Math.round(epoch * 1000));
  }
  
  private static FrameDecodeException mismatch(final Column column, 
                                               final JsonNode cell, 
                                               final int row,
                                               final Exception cause) {
    final String msg = "Column [" + column.name() + "] expects " 
        + column.type() + " but row " + row + " holds a " 
        + cell.getNodeType() + ": " + cell;
    return cause == null ? new FrameDecodeException(msg) : 
      new FrameDecodeException(msg, cause);
  }
  
  private static JsonNode requireArray(final JsonNode root, final String field) {
    final JsonNode node = root.get(field);
    if (node == null || node.isNull()) {
      throw new FrameDecodeException("Missing '" + field 
          + "' field in response");
    }
    if (!node.isArray()) {
      throw new FrameDecodeException("Field '" + field 
          + "' must be an array but was " + node.getNodeType());
    }
    return node;
  }
  
  private static String rootMessage(final Throwable t) {
    Throwable cause = t;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
    }
    return cause.getMessage();
  }
}
