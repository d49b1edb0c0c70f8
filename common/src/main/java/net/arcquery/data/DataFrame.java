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
import java.util.List;

import com.google.common.base.Strings;
import com.google.common.collect.Lists;

/**
 * A named, ordered collection of equally sized {@link Column}s plus 
 * {@link FrameMeta}. Frames are built by the decoders, may be replaced by the
 * merger, sorter and pivot and are never modified once returned to the 
 * caller.
 * 
 * @since 1.0
 */
public class DataFrame {
  /** The frame name, usually the query's reference ID. */
  private String name;
  
  /** The reference ID of the query this frame answers. */
  private String ref_id;
  
  /** The columns in order. */
  private final List<Column> columns;
  
  /** The metadata. */
  private final FrameMeta meta;
  
  /**
   * Ctor for an empty frame.
   * @param name An optional name.
   */
  public DataFrame(final String name) {
    this.name = Strings.nullToEmpty(name);
    columns = Lists.newArrayList();
    meta = new FrameMeta();
  }
  
  /**
   * Ctor with columns.
   * @param name An optional name.
   * @param columns The columns, all of the same length.
   * @throws IllegalArgumentException if the columns differ in length.
   */
  public DataFrame(final String name, final List<Column> columns) {
    this(name);
    for (final Column column : columns) {
      addColumn(column);
    }
  }
  
  /**
   * Adds a column to the end of the frame.
   * @param column A non-null column.
   * @return This frame for chaining.
   * @throws IllegalArgumentException if the column was null or its length
   * differed from existing columns.
   */
  public DataFrame addColumn(final Column column) {
    if (column == null) {
      throw new IllegalArgumentException("Column cannot be null.");
    }
    if (!columns.isEmpty() && columns.get(0).size() != column.size()) {
      throw new IllegalArgumentException("Column [" + column.name() 
          + "] has " + column.size() + " rows but the frame has " 
          + columns.get(0).size());
    }
    columns.add(column);
    return this;
  }
  
  /**
   * Replaces the column at the given index.
   * @param index The column index.
   * @param column A non-null column with as many rows as the one replaced.
   * @throws IllegalArgumentException if the column was null or its length
   * differed from the replaced column.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public void setColumn(final int index, final Column column) {
    if (column == null) {
      throw new IllegalArgumentException("Column cannot be null.");
    }
    final Column existing = columns.get(index);
    if (existing.size() != column.size()) {
      throw new IllegalArgumentException("Column [" + column.name()
          + "] has " + column.size() + " rows but the frame has "
          + existing.size());
    }
    columns.set(index, column);
  }

  /** @return An unmodifiable list of the columns. */
  public List<Column> columns() {
    return Collections.unmodifiableList(columns);
  }
  
  /**
   * @param index The column index.
   * @return The column at the index.
   */
  public Column column(final int index) {
    return columns.get(index);
  }
  
  /** @return The number of columns. */
  public int columnCount() {
    return columns.size();
  }
  
  /**
   * @return The number of rows, 0 for a frame without columns.
   * @throws IllegalStateException if the columns differ in length.
   */
  public int rowCount() {
    if (columns.isEmpty()) {
      return 0;
    }
    final int rows = columns.get(0).size();
    for (int i = 1; i < columns.size(); i++) {
      if (columns.get(i).size() != rows) {
        throw new IllegalStateException("Frame [" + name + "] column " 
            + columns.get(i).name() + " has " + columns.get(i).size() 
            + " rows but column " + columns.get(0).name() + " has " + rows);
      }
    }
    return rows;
  }
  
  /** @return True if there aren't any columns or rows. */
  public boolean isEmpty() {
    return columns.isEmpty() || columns.get(0).size() == 0;
  }
  
  /** @return The frame name. */
  public String name() {
    return name;
  }
  
  public void setName(final String name) {
    this.name = Strings.nullToEmpty(name);
  }
  
  /** @return The reference ID, may be null. */
  public String refId() {
    return ref_id;
  }
  
  public void setRefId(final String ref_id) {
    this.ref_id = ref_id;
  }
  
  /** @return The metadata. */
  public FrameMeta meta() {
    return meta;
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("name=")
        .append(name)
        .append(", refId=")
        .append(ref_id)
        .append(", columns=[");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      buf.append(columns.get(i).name())
         .append(":")
         .append(columns.get(i).type());
    }
    return buf.append("], meta={")
        .append(meta)
        .append("}")
        .toString();
  }
}
