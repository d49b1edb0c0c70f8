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

import java.io.IOException;

import org.apache.http.HttpResponse;
import org.apache.http.ParseException;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Strings;

import net.arcquery.utils.JSON;

/**
 * Helpers for reading error responses from Arc.
 * 
 * @since 1.0
 */
public final class ArcResponses {
  private static final Logger LOG = LoggerFactory.getLogger(ArcResponses.class);
  
  /** The longest raw body echoed in an error message. */
  public static final int MAX_BODY_LENGTH = 500;
  
  private ArcResponses() { }
  
  /**
   * Builds the message for a non-200 response. Arc's {@code {"error": ".."}}
   * documents are preferred, then the trimmed raw body, truncated to 
   * {@link #MAX_BODY_LENGTH} characters.
   * @param status_code The HTTP status.
   * @param body The body, may be null.
   * @return A non-null message.
   */
  public static String errorMessage(final int status_code, final String body) {
    final String content = Strings.nullToEmpty(body).trim();
    if (content.startsWith("{")) {
      try {
        final JsonNode root = JSON.parseToNode(content);
        final JsonNode error = root.get("error");
        if (error != null && error.isTextual() 
            && !error.asText().isEmpty()) {
          return String.format("Arc error (HTTP %d): %s", status_code, 
              error.asText());
        }
      } catch (IllegalArgumentException e) {
        LOG.debug("Error body was not JSON: {}", content);
      }
    }
    if (content.isEmpty()) {
      return String.format("Arc returned HTTP %d with no error message", 
          status_code);
    }
    final String text = content.length() > MAX_BODY_LENGTH ? 
        content.substring(0, MAX_BODY_LENGTH) + "..." : content;
    return String.format("Arc error (HTTP %d): %s", status_code, text);
  }
  
  /**
   * Reads the body of a response as a string.
   * @param response The non-null response.
   * @return The body, empty if there wasn't one or it couldn't be read.
   */
  public static String readBody(final HttpResponse response) {
    if (response.getEntity() == null) {
      return "";
    }
    try {
      return Strings.nullToEmpty(EntityUtils.toString(response.getEntity()));
    } catch (ParseException | IOException e) {
      LOG.warn("Failed to read the error body from Arc: " + e.getMessage());
      return "";
    }
  }
}
