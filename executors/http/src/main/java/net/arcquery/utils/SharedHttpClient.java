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
package net.arcquery.utils;

import org.apache.http.impl.client.CloseableHttpClient;

import com.stumbleupon.async.Deferred;

/**
 * A shared, pooled HTTP client for making calls to the Arc engine. One 
 * instance is shared by every query of a datasource.
 * 
 * @since 1.0
 */
public interface SharedHttpClient {

  /**
   * Creates the underlying client.
   * @return A deferred resolving to null when the client is ready.
   */
  public Deferred<Object> initialize();
  
  /**
   * Closes the client and its connection pool.
   * @return A deferred resolving to null once closed.
   */
  public Deferred<Object> shutdown();
  
  /**
   * NOTE: Do not close it.
   * @return The client, null if not initialized.
   */
  public CloseableHttpClient getClient();
}
