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

/**
 * How the consumer should interpret a frame.
 * 
 * @since 1.0
 */
public enum FrameType {
  /** Plain rows and columns. */
  TABLE,
  
  /** One time column and one column per series. */
  TIME_SERIES_WIDE,
  
  /** One time column, value columns and string label columns per row. */
  TIME_SERIES_LONG,
  
  /** Couldn't be classified. */
  UNKNOWN
}
