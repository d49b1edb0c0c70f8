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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

/**
 * A named, typed, growable column of a {@link DataFrame}. Values are boxed 
 * and validated against {@link ColumnType#valueClass()} on every write. A 
 * null is only accepted by nullable columns and means the value is absent.
 * 
 * @since 1.0
 */
public class Column {
  /** The column name. */
  private final String name;
  
  /** The value type. */
  private final ColumnType type;
  
  /** Whether or not nulls are allowed. */
  private final boolean nullable;
  
  /** Labels identifying the series, set when pivoting. */
  private final Map<String, String> labels;
  
  /** The values. */
  private final ArrayList<Object> values;
  
  /**
   * Ctor for a column without labels.
   * @param name A non-null name. May be empty.
   * @param type A non-null type.
   * @param nullable Whether or not nulls are allowed.
   */
  public Column(final String name, 
                final ColumnType type, 
                final boolean nullable) {
    this(name, type, nullable, null);
  }
  
  /**
   * Full ctor.
   * @param name A non-null name. May be empty.
   * @param type A non-null type.
   * @param nullable Whether or not nulls are allowed.
   * @param labels An optional map of labels.
   */
  public Column(final String name, 
                final ColumnType type, 
                final boolean nullable,
                final Map<String, String> labels) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    this.name = Strings.nullToEmpty(name);
    this.type = type;
    this.nullable = nullable;
    this.labels = labels == null || labels.isEmpty() ? 
        Collections.<String, String>emptyMap() : ImmutableMap.copyOf(labels);
    values = new ArrayList<Object>();
  }
  
  /** @return The column name. */
  public String name() {
    return name;
  }
  
  /** @return The value type. */
  public ColumnType type() {
    return type;
  }
  
  /** @return Whether or not nulls are allowed. */
  public boolean isNullable() {
    return nullable;
  }
  
  /** @return The labels, possibly empty. Never null. */
  public Map<String, String> labels() {
    return labels;
  }
  
  /** @return The number of values. */
  public int size() {
    return values.size();
  }
  
  /**
   * @param index The row index.
   * @return The value at the index, may be null for nullable columns.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public Object get(final int index) {
    return values.get(index);
  }
  
  /**
   * @param index The row index.
   * @return The timestamp at the index, may be null.
   * @throws IllegalStateException if this is not a {@link ColumnType#TIMESTAMP}
   * column.
   */
  public Instant getInstant(final int index) {
    if (type != ColumnType.TIMESTAMP) {
      throw new IllegalStateException("Column " + name + " is of type " 
          + type + ", not a timestamp.");
    }
    return (Instant) values.get(index);
  }
  
  /** @return An unmodifiable view of the values. */
  public List<Object> values() {
    return Collections.unmodifiableList(values);
  }
  
  /**
   * Appends a value.
   * @param value The value, may be null if the column is nullable.
   * @return This column for chaining.
   * @throws IllegalArgumentException if the value didn't match the type or 
   * was null for a non-nullable column.
   */
  public Column append(final Object value) {
    validate(value);
    values.add(value);
    return this;
  }
  
  /**
   * Overwrites the value at the given index.
   * @param index The row index.
   * @param value The value, may be null if the column is nullable.
   * @throws IllegalArgumentException if the value didn't match the type or 
   * was null for a non-nullable column.
   * @throws IndexOutOfBoundsException if the index was out of range.
   */
  public void set(final int index, final Object value) {
    validate(value);
    values.set(index, value);
  }
  
  /**
   * Grows the column by the given number of empty slots that must be
   * filled with {@link #set(int, Object)} afterwards.
   * @param count The number of slots to add, zero or more.
   */
  public void extend(final int count) {
    if (count < 0) {
      throw new IllegalArgumentException("Count cannot be negative: " + count);
    }
    values.ensureCapacity(values.size() + count);
    for (int i = 0; i < count; i++) {
      values.add(null);
    }
  }
  
  /** @return A column with the same name, type, nullability and labels but 
   * no values. */
  public Column emptyCopy() {
    return new Column(name, type, nullable, labels);
  }
  
  /** @return True if the column has no values or only nulls. */
  public boolean isAllNull() {
    for (final Object value : values) {
      if (value != null) {
        return false;
      }
    }
    return true;
  }

  /**
   * Builds a nullable copy of this column with another type. Only a column
   * holding nothing but nulls can change type.
   * @param new_type The non-null type of the copy.
   * @return The copy with the same name, labels and number of nulls.
   * @throws IllegalStateException if the column held a value.
   */
  public Column withType(final ColumnType new_type) {
    if (!isAllNull()) {
      throw new IllegalStateException("Column [" + name
          + "] holds values and cannot change from " + type + " to "
          + new_type);
    }
    final Column copy = new Column(name, new_type, true, labels);
    copy.extend(values.size());
    return copy;
  }

  /**
   * Builds a new column with the values picked in the given order.
   * @param order The source row index for each row of the new column.
   * @return The reordered copy.
   */
  public Column reorder(final int[] order) {
    final Column copy = emptyCopy();
    copy.values.ensureCapacity(order.length);
    for (final int idx : order) {
      copy.values.add(values.get(idx));
    }
    return copy;
  }
  
  private void validate(final Object value) {
    if (value == null) {
      if (!nullable) {
        throw new IllegalArgumentException("Column [" + name 
            + "] is not nullable.");
      }
      return;
    }
    if (!type.valueClass().isInstance(value)) {
      throw new IllegalArgumentException("Column [" + name + "] of type " 
          + type + " cannot hold a " + value.getClass().getSimpleName());
    }
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("name=")
        .append(name)
        .append(", type=")
        .append(type)
        .append(", nullable=")
        .append(nullable)
        .append(", labels=")
        .append(labels)
        .append(", size=")
        .append(values.size())
        .toString();
  }
}
