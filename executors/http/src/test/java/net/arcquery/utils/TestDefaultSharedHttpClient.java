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

import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;

import org.apache.http.impl.client.CloseableHttpClient;
import org.junit.Before;
import org.junit.Test;

public class TestDefaultSharedHttpClient {

  private CloseableHttpClient client;
  
  @Before
  public void before() throws Exception {
    client = mock(CloseableHttpClient.class);
  }
  
  @Test
  public void initializeAndShutdown() throws Exception {
    final DefaultSharedHttpClient shared = new MockedClient();
    assertNull(shared.getClient());
    assertNull(shared.initialize().join(250));
    assertSame(client, shared.getClient());
    assertNull(shared.shutdown().join(250));
    verify(client, times(1)).close();
  }
  
  @Test
  public void shutdownCloseFailure() throws Exception {
    doThrow(new IOException("Boo!")).when(client).close();
    final DefaultSharedHttpClient shared = new MockedClient();
    shared.initialize().join(250);
    assertNull(shared.shutdown().join(250));
    verify(client, times(1)).close();
  }
  
  @Test
  public void shutdownBeforeInitialize() throws Exception {
    final DefaultSharedHttpClient shared = new MockedClient();
    assertNull(shared.shutdown().join(250));
    verify(client, times(0)).close();
  }
  
  @Test
  public void buildClient() throws Exception {
    final DefaultSharedHttpClient shared = new DefaultSharedHttpClient();
    shared.initialize().join(250);
    assertNotNull(shared.getClient());
    shared.shutdown().join(250);
  }
  
  class MockedClient extends DefaultSharedHttpClient {
    @Override
    protected CloseableHttpClient buildClient() {
      return TestDefaultSharedHttpClient.this.client;
    }
  }
}
