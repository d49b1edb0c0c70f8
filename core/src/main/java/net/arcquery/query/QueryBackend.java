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

import net.arcquery.configuration.ArcSettings;
import net.arcquery.data.DataFrame;
import net.arcquery.exceptions.QueryExecutionException;

/**
 * Runs fully expanded SQL against the engine and returns the decoded frame.
 * Implementations must be thread safe as chunks of a split query call in
 * concurrently.
 * 
 * @since 1.0
 */
public interface QueryBackend {

  /**
   * Executes the SQL.
   * @param settings The non-null settings for this query.
   * @param sql The non-null SQL without macros.
   * @param context The non-null context. Implementations should abort the
   * remote call when it's canceled.
   * @return The non-null frame, with {@code executedQueryString} and the
   * {@code executionTime} custom value set.
   * @throws QueryExecutionException if the call or decoding failed.
   */
  public DataFrame execute(final ArcSettings settings, 
                           final String sql, 
                           final QueryContext context);
}
