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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.QueryExecutionException;

/**
 * The outcome of one {@link DataQuery}: frames or an error, never both. An
 * empty frame list means the query ran but returned nothing.
 * 
 * @since 1.0
 */
public final class DataResponse {
  private final List<DataFrame> frames;
  private final QueryExecutionException error;
  
  private DataResponse(final List<DataFrame> frames, 
                       final QueryExecutionException error) {
    this.frames = frames;
    this.error = error;
  }
  
  /**
   * @param frames The non-null frames, may be empty.
   * @return A successful response.
   */
  public static DataResponse ofFrames(final List<DataFrame> frames) {
    return new DataResponse(ImmutableList.copyOf(frames), null);
  }
  
  /** @return A successful response without data. */
  public static DataResponse empty() {
    return new DataResponse(Collections.<DataFrame>emptyList(), null);
  }
  
  /**
   * @param error The non-null error.
   * @return A failed response.
   */
  public static DataResponse ofError(final QueryExecutionException error) {
    if (error == null) {
      throw new IllegalArgumentException("Error cannot be null.");
    }
    return new DataResponse(Collections.<DataFrame>emptyList(), error);
  }
  
  /** @return The frames, empty on error. */
  public List<DataFrame> frames() {
    return frames;
  }
  
  /** @return The error or null if successful. */
  public QueryExecutionException error() {
    return error;
  }
  
  /** @return True if this response holds an error. */
  public boolean hasError() {
    return error != null;
  }
  
  @Override
  public String toString() {
    return hasError() ? "error=" + error : "frames=" + frames;
  }
}
