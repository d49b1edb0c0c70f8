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

import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.FrameDecodeException;

/**
 * Turns a response body into a frame.
 * 
 * @since 1.0
 */
public interface FrameDecoder {

  /**
   * Decodes the stream. The stream is read to the end but not closed.
   * @param stream A non-null stream.
   * @return A non-null frame, possibly without columns.
   * @throws FrameDecodeException if the body was malformed.
   */
  public DataFrame decode(final InputStream stream);
}
