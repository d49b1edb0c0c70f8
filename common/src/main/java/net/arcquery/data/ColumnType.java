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

import com.google.common.primitives.UnsignedLong;

/**
 * The closed set of column types a frame can carry. Each type fixes the Java
 * class of its values so appends can be validated without reflection on the
 * decoder side.
 * <p>
 * Unsigned integers are widened to the next signed type, except 
 * {@link #UINT64} which uses Guava's {@link UnsignedLong}. Timestamps are 
 * {@link Instant}s at millisecond resolution.
 * 
 * @since 1.0
 */
public enum ColumnType {
  BOOL(Boolean.class, false),
  INT8(Byte.class, true),
  INT16(Short.class, true),
  INT32(Integer.class, true),
  INT64(Long.class, true),
  UINT8(Short.class, true),
  UINT16(Integer.class, true),
  UINT32(Long.class, true),
  UINT64(UnsignedLong.class, true),
  FLOAT32(Float.class, true),
  FLOAT64(Double.class, true),
  STRING(String.class, false),
  TIMESTAMP(Instant.class, false);
  
  private final Class<?> value_class;
  private final boolean numeric;
  
  ColumnType(final Class<?> value_class, final boolean numeric) {
    this.value_class = value_class;
    this.numeric = numeric;
  }
  
  /** @return The class every non-null value must be an instance of. */
  public Class<?> valueClass() {
    return value_class;
  }
  
  /** @return Whether or not the type holds numbers. */
  public boolean isNumeric() {
    return numeric;
  }
}
