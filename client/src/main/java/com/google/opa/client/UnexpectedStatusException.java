/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.opa.client;

/**
 * Thrown when the policy service answered with a status other than the expected one. The full
 * response is kept so callers can inspect what the service sent back.
 */
public class UnexpectedStatusException extends PermissionQueryException {

  private final int expectedStatusCode;
  private final HttpUtil.RawResponse response;

  UnexpectedStatusException(int expectedStatusCode, HttpUtil.RawResponse response) {
    super(
        String.format(
            "Got unexpected response status code: %d. Expected: %d",
            response.getStatusCode(), expectedStatusCode));
    this.expectedStatusCode = expectedStatusCode;
    this.response = response;
  }

  public int getStatusCode() {
    return response.getStatusCode();
  }

  public int getExpectedStatusCode() {
    return expectedStatusCode;
  }

  public HttpUtil.RawResponse getResponse() {
    return response;
  }

  public String getResponseBody() {
    return response.getBodyAsString();
  }
}
