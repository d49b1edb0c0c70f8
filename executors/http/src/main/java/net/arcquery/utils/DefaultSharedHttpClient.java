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

import java.io.IOException;

import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.stumbleupon.async.Deferred;

/**
 * The default shared client: a blocking, pooled Apache client. Blocking
 * keeps Arrow responses streaming straight from the socket into the decoder.
 * 
 * @since 1.0
 */
public class DefaultSharedHttpClient implements SharedHttpClient {
  private static final Logger LOG = LoggerFactory.getLogger(
      DefaultSharedHttpClient.class);
  
  public static final int MAX_CONNECTIONS = 200;
  public static final int MAX_CONNECTIONS_PER_ROUTE = 25;
  
  /** The client. */
  protected volatile CloseableHttpClient client;
  
  @Override
  public Deferred<Object> initialize() {
    client = buildClient();
    LOG.info("Initialized shared HTTP client.");
    return Deferred.fromResult(null);
  }
  
  @Override
  public Deferred<Object> shutdown() {
    if (client != null) {
      try {
        client.close();
      } catch (IOException e) {
        LOG.error("Failed to close HTTPClient", e);
      }
    }
    return Deferred.fromResult(null);
  }
  
  @Override
  public CloseableHttpClient getClient() {
    return client;
  }
  
  /** @return A new pooled client. Compressed responses are decoded by the
   * client. */
  @VisibleForTesting
  protected CloseableHttpClient buildClient() {
    return HttpClients.custom()
        .setMaxConnTotal(MAX_CONNECTIONS)
        .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
        .useSystemProperties()
        .build();
  }
}
