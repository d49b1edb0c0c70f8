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

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DurationVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Maps;
import com.google.common.primitives.UnsignedLong;

import net.arcquery.data.Column;
import net.arcquery.data.ColumnType;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.FrameDecodeException;

/**
 * Decodes an Arrow IPC stream batch by batch as it arrives. Columns are 
 * created from the schema seen with the first batch and each batch is 
 * appended through a per-type reader. Arrow types without a frame 
 * counterpart are rendered as nullable strings; durations become int64 in 
 * their declared unit.
 * <p>
 * Timestamps declared as micro or nanoseconds whose first non-null value is
 * below {@link #SECONDS_THRESHOLD} are read as seconds when unit correction
 * is enabled, as some writers mislabel epoch seconds.
 * 
 * @since 1.0
 */
public class ArrowFrameDecoder implements FrameDecoder {
  private static final Logger LOG = 
      LoggerFactory.getLogger(ArrowFrameDecoder.class);
  
  /** Raw values below this are implausible as micro or nanoseconds. */
  public static final long SECONDS_THRESHOLD = 1_000_000_000_000L;
  
  /** Appends {@code rows} values of a vector to a column. */
  interface ColumnReader {
    void read(final FieldVector vector, final int rows, final Column column);
  }
  
  /** Stateless readers keyed on the column type. */
  private static final Map<ColumnType, ColumnReader> READERS = 
      Maps.newEnumMap(ColumnType.class);
  static {
    READERS.put(ColumnType.BOOL, (vector, rows, column) -> {
      final BitVector v = (BitVector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i) != 0);
      }
    });
    READERS.put(ColumnType.INT8, (vector, rows, column) -> {
      final TinyIntVector v = (TinyIntVector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i));
      }
    });
    READERS.put(ColumnType.INT16, (vector, rows, column) -> {
      final SmallIntVector v = (SmallIntVector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i));
      }
    });
    READERS.put(ColumnType.INT32, (vector, rows, column) -> {
      final IntVector v = (IntVector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i));
      }
    });
    READERS.put(ColumnType.INT64, (vector, rows, column) -> {
      final BigIntVector v = (BigIntVector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i));
      }
    });
    READERS.put(ColumnType.UINT8, (vector, rows, column) -> {
      final UInt1Vector v = (UInt1Vector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : (short) (v.get(i) & 0xFF));
      }
    });
    READERS.put(ColumnType.UINT16, (vector, rows, column) -> {
      final UInt2Vector v = (UInt2Vector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : (int) v.get(i));
      }
    });
    READERS.put(ColumnType.UINT32, (vector, rows, column) -> {
      final UInt4Vector v = (UInt4Vector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : Integer.toUnsignedLong(v.get(i)));
      }
    });
    READERS.put(ColumnType.UINT64, (vector, rows, column) -> {
      final UInt8Vector v = (UInt8Vector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : UnsignedLong.fromLongBits(v.get(i)));
      }
    });
    READERS.put(ColumnType.FLOAT32, (vector, rows, column) -> {
      final Float4Vector v = (Float4Vector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i));
      }
    });
    READERS.put(ColumnType.FLOAT64, (vector, rows, column) -> {
      final Float8Vector v = (Float8Vector) vector;
      for (int i = 0; i < rows; i++) {
        column.append(v.isNull(i) ? null : v.get(i));
      }
    });
    READERS.put(ColumnType.STRING, ArrowFrameDecoder::readAsStrings);
  }
  
  /** Durations are int64 in the declared unit. */
  private static final ColumnReader DURATION_READER = (vector, rows, column) -> {
    final DurationVector v = (DurationVector) vector;
    for (int i = 0; i < rows; i++) {
      column.append(v.isNull(i) ? null : 
        DurationVector.get(v.getDataBuffer(), i));
    }
  };
  
  /** The allocator to carve a child allocator from per stream. */
  private final BufferAllocator allocator;
  
  /** Whether or not to correct implausible timestamp units. */
  private final boolean unit_correction;
  
  /**
   * Default ctor.
   * @param allocator A non-null allocator owned by the caller.
   * @param unit_correction Whether or not to correct implausible timestamp
   * units.
   */
  public ArrowFrameDecoder(final BufferAllocator allocator, 
                           final boolean unit_correction) {
    if (allocator == null) {
      throw new IllegalArgumentException("Allocator cannot be null.");
    }
    this.allocator = allocator;
    this.unit_correction = unit_correction;
  }
  
  @Override
  public DataFrame decode(final InputStream stream) {
    try (final BufferAllocator child = 
            allocator.newChildAllocator("arrow-decode", 0, Long.MAX_VALUE);
         final ArrowStreamReader reader = new ArrowStreamReader(stream, child)) {
      final VectorSchemaRoot root = reader.getVectorSchemaRoot();
      final DataFrame frame = new DataFrame("");
      if (!reader.loadNextBatch()) {
        return frame;
      }
      
      final List<Field> fields = root.getSchema().getFields();
      final ColumnReader[] readers = new ColumnReader[fields.size()];
      for (int i = 0; i < fields.size(); i++) {
        final Field field = fields.get(i);
        final ColumnType type = columnType(field.getType());
        if (type == null) {
          LOG.debug("Reading column [{}] of unsupported type {} as strings", 
              field.getName(), field.getType());
          frame.addColumn(new Column(field.getName(), ColumnType.STRING, true));
          readers[i] = ArrowFrameDecoder::readAsStrings;
        } else {
          frame.addColumn(new Column(field.getName(), type, field.isNullable()));
          readers[i] = readerFor(field, type);
        }
      }
      
      int batches = 0;
      do {
        final int rows = root.getRowCount();
        for (int i = 0; i < readers.length; i++) {
          final Column column = frame.column(i);
          try {
            readers[i].read(root.getVector(i), rows, column);
          } catch (IllegalArgumentException | ClassCastException e) {
            throw new FrameDecodeException("Unable to read column [" 
                + column.name() + "] of type " + column.type() + " in batch " 
                + batches + ": " + e.getMessage(), e);
          }
        }
        batches++;
      } while (reader.loadNextBatch());
      
      if (LOG.isDebugEnabled()) {
        LOG.debug("Decoded " + batches + " Arrow batches into " 
            + frame.rowCount() + " rows and " + frame.columnCount() 
            + " columns");
      }
      return frame;
    } catch (IOException e) {
      throw new FrameDecodeException("Failed to read Arrow stream: " 
          + e.getMessage(), e);
    }
  }
  
  /**
   * Maps an Arrow type to the frame type.
   * @param type A non-null Arrow type.
   * @return The column type or null if there isn't a counterpart.
   */
  @VisibleForTesting
  static ColumnType columnType(final ArrowType type) {
    switch (type.getTypeID()) {
    case Bool:
      return ColumnType.BOOL;
    case Int:
      final ArrowType.Int integer = (ArrowType.Int) type;
      switch (integer.getBitWidth()) {
      case 8:
        return integer.getIsSigned() ? ColumnType.INT8 : ColumnType.UINT8;
      case 16:
        return integer.getIsSigned() ? ColumnType.INT16 : ColumnType.UINT16;
      case 32:
        return integer.getIsSigned() ? ColumnType.INT32 : ColumnType.UINT32;
      case 64:
        return integer.getIsSigned() ? ColumnType.INT64 : ColumnType.UINT64;
      default:
        return null;
      }
    case FloatingPoint:
      final FloatingPointPrecision precision = 
          ((ArrowType.FloatingPoint) type).getPrecision();
      if (precision == FloatingPointPrecision.SINGLE) {
        return ColumnType.FLOAT32;
      }
      return precision == FloatingPointPrecision.DOUBLE ? 
          ColumnType.FLOAT64 : null;
    case Utf8:
    case LargeUtf8:
      return ColumnType.STRING;
    case Timestamp:
      return ColumnType.TIMESTAMP;
    case Duration:
      return ColumnType.INT64;
    default:
      return null;
    }
  }
  
  private ColumnReader readerFor(final Field field, final ColumnType type) {
    if (type == ColumnType.TIMESTAMP) {
      return new TimestampReader(
          ((ArrowType.Timestamp) field.getType()).getUnit(), unit_correction);
    }
    if (field.getType().getTypeID() == ArrowType.ArrowTypeID.Duration) {
      return DURATION_READER;
    }
    return READERS.get(type);
  }
  
  private static void readAsStrings(final FieldVector vector, 
                                    final int rows, 
                                    final Column column) {
    for (int i = 0; i < rows; i++) {
      final Object value = vector.getObject(i);
      column.append(value == null ? null : value.toString());
    }
  }
  
  /**
   * Converts raw timestamps to millisecond instants. The unit correction is
   * decided once per column, on the first non-null value.
   */
  static class TimestampReader implements ColumnReader {
    private final TimeUnit declared;
    private final boolean correction;
    private TimeUnit unit;
    
    TimestampReader(final TimeUnit declared, final boolean correction) {
      this.declared = declared;
      this.correction = correction;
    }
    
    @Override
    public void read(final FieldVector vector, 
                     final int rows, 
                     final Column column) {
      final TimeStampVector v = (TimeStampVector) vector;
      for (int i = 0; i < rows; i++) {
        if (v.isNull(i)) {
          column.append(null);
          continue;
        }
        final long raw = v.get(i);
        if (unit == null) {
          unit = resolveUnit(column.name(), raw);
        }
        column.append(toInstant(raw, unit));
      }
    }
    
    private TimeUnit resolveUnit(final String name, final long raw) {
      if (correction 
          && (declared == TimeUnit.MICROSECOND || declared == TimeUnit.NANOSECOND)
          && Math.abs(raw) < SECONDS_THRESHOLD) {
        LOG.warn("Timestamp column [" + name + "] is declared in " + declared 
            + " but its first value " + raw + " looks like seconds, reading "
            + "it as seconds");
        return TimeUnit.SECOND;
      }
      return declared;
    }
  }
  
  /**
   * @param raw The raw value.
   * @param unit The unit of the raw value.
   * @return The instant truncated to milliseconds.
   */
  static Instant toInstant(final long raw, final TimeUnit unit) {
    switch (unit) {
    case SECOND:
      return Instant.ofEpochMilli(raw * 1000);
    case MILLISECOND:
      return Instant.ofEpochMilli(raw);
    case MICROSECOND:
      return Instant.ofEpochMilli(Math.floorDiv(raw, 1000L));
    default:
      return Instant.ofEpochMilli(Math.floorDiv(raw, 1_000_000L));
    }
  }
}
