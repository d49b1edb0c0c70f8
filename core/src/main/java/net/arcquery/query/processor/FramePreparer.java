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
package net.arcquery.query.processor;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.arcquery.data.DataFrame;
import net.arcquery.data.FrameType;
import net.arcquery.data.VisualizationType;
import net.arcquery.query.QueryFormat;
import net.arcquery.query.QuerySpec;

/**
 * Final shaping of a query's frame before it goes back to the caller: names
 * it, tags its type and preferred visualization and turns long time series
 * into wide ones.
 * 
 * @since 1.0
 */
public final class FramePreparer {
  private static final Logger LOG = LoggerFactory.getLogger(FramePreparer.class);
  
  private FramePreparer() { }
  
  /**
   * Prepares the frame.
   * @param frame The frame, may be null.
   * @param spec The non-null query.
   * @return The frames to return, empty if the frame was null.
   */
  public static List<DataFrame> prepare(final DataFrame frame, 
                                        final QuerySpec spec) {
    if (frame == null) {
      return Collections.emptyList();
    }
    frame.setName(spec.getRefId());
    frame.setRefId(spec.getRefId());
    
    if (spec.getFormat() == QueryFormat.TABLE) {
      frame.meta().setType(FrameType.TABLE);
      frame.meta().setPreferredVisualization(VisualizationType.TABLE);
      return Collections.singletonList(frame);
    }
    frame.meta().setPreferredVisualization(VisualizationType.GRAPH);
    
    final TimeSeriesSchema schema = TimeSeriesSchema.of(frame);
    switch (schema.kind()) {
    case WIDE:
      frame.meta().setType(FrameType.TIME_SERIES_WIDE);
      if (LOG.isDebugEnabled()) {
        LOG.debug("Frame " + spec.getRefId() + " is a wide time series with " 
            + frame.rowCount() + " rows");
      }
      return Collections.singletonList(frame);
    case LONG:
      frame.meta().setType(FrameType.TIME_SERIES_LONG);
      final DataFrame sorted = 
          TimeSorter.ensureAscending(frame, schema.timeIndex());
      try {
        final DataFrame wide = LongToWidePivot.pivot(sorted, schema);
        wide.setName(spec.getRefId());
        wide.meta().setType(FrameType.TIME_SERIES_WIDE);
        if (LOG.isDebugEnabled()) {
          LOG.debug("Converted frame " + spec.getRefId() + " from " 
              + sorted.rowCount() + " long rows to " + wide.rowCount() 
              + " wide rows with " + wide.columnCount() + " columns");
        }
        return Collections.singletonList(wide);
      } catch (IllegalArgumentException e) {
        LOG.warn("Long to wide conversion failed for " + spec.getRefId() 
            + ", returning the long frame", e);
        return Collections.singletonList(sorted);
      }
    default:
      frame.meta().setType(FrameType.UNKNOWN);
      return Collections.singletonList(frame);
    }
  }
}
