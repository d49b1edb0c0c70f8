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
package net.arcquery.exceptions;

/**
 * Thrown when a response body could not be turned into a frame, e.g. a
 * required field was missing or a cell did not match its column.
 * 
 * @since 1.0
 */
public class FrameDecodeException extends QueryExecutionException {
  private static final long serialVersionUID = 1994417535071281034L;

  /**
   * Default ctor.
   * @param msg A non-null message describing the shape problem.
   */
  public FrameDecodeException(final String msg) {
    super(msg, 500);
  }
  
  /**
   * Ctor with a cause.
   * @param msg A non-null message describing the shape problem.
   * @param t The underlying parser or IO exception.
   */
  public FrameDecodeException(final String msg, final Throwable t) {
    super(msg, 500, t);
  }
}
