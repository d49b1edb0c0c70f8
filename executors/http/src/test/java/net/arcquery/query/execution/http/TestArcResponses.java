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
package net.arcquery.query.execution.http;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.entity.StringEntity;
import org.junit.Test;

import com.google.common.base.Strings;

public class TestArcResponses {

  @Test
  public void errorMessageJson() throws Exception {
    assertEquals("Arc error (HTTP 400): table not found: cpu", 
        ArcResponses.errorMessage(400, 
            "{\"error\":\"table not found: cpu\"}"));
    assertEquals("Arc error (HTTP 500): oops", 
        ArcResponses.errorMessage(500, "  {\"error\": \"oops\", \"code\": 9}\n"));
  }
  
  @Test
  public void errorMessageJsonWithoutError() throws Exception {
    assertEquals("Arc error (HTTP 400): {\"message\":\"nope\"}", 
        ArcResponses.errorMessage(400, "{\"message\":\"nope\"}"));
    assertEquals("Arc error (HTTP 400): {\"error\":\"\"}", 
        ArcResponses.errorMessage(400, "{\"error\":\"\"}"));
    assertEquals("Arc error (HTTP 400): {\"error\":42}", 
        ArcResponses.errorMessage(400, "{\"error\":42}"));
  }
  
  @Test
  public void errorMessageNotJson() throws Exception {
    assertEquals("Arc error (HTTP 502): Bad Gateway", 
        ArcResponses.errorMessage(502, "  Bad Gateway\n"));
    assertEquals("Arc error (HTTP 400): {not json", 
        ArcResponses.errorMessage(400, "{not json"));
  }
  
  @Test
  public void errorMessageEmpty() throws Exception {
    assertEquals("Arc returned HTTP 503 with no error message", 
        ArcResponses.errorMessage(503, ""));
    assertEquals("Arc returned HTTP 503 with no error message", 
        ArcResponses.errorMessage(503, "   "));
    assertEquals("Arc returned HTTP 401 with no error message", 
        ArcResponses.errorMessage(401, null));
  }
  
  @Test
  public void errorMessageTruncated() throws Exception {
    final String body = Strings.repeat("x", 600);
    final String message = ArcResponses.errorMessage(500, body);
    assertEquals("Arc error (HTTP 500): " + Strings.repeat("x", 500) + "...", 
        message);
    assertTrue(message.endsWith("x..."));
    
    final String exact = Strings.repeat("y", 500);
    assertEquals("Arc error (HTTP 500): " + exact, 
        ArcResponses.errorMessage(500, exact));
  }
  
  @Test
  public void readBody() throws Exception {
    final HttpResponse response = mock(HttpResponse.class);
    assertEquals("", ArcResponses.readBody(response));
    
    when(response.getEntity()).thenReturn(new StringEntity("Boo!"));
    assertEquals("Boo!", ArcResponses.readBody(response));
    
    final HttpEntity entity = mock(HttpEntity.class);
    when(entity.getContent()).thenThrow(new IOException("Boo!"));
    when(response.getEntity()).thenReturn(entity);
    assertEquals("", ArcResponses.readBody(response));
  }
}
