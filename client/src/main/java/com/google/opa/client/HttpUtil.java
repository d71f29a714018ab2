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

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.StatusLine;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.cookie.Cookie;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-shot HTTP transport. Each call sends exactly one request, reads the whole response body
 * and releases the response; retrying is left to the callers.
 */
public class HttpUtil {

  private static final Logger logger = LoggerFactory.getLogger(HttpUtil.class);

  /** Passing this as the expected status code disables the status check. */
  public static final int ANY_STATUS = 0;

  private static final CharMatcher METHOD_CHARS = CharMatcher.inRange('A', 'Z');

  private HttpUtil() {}

  /**
   * Sends one request and returns the fully read response.
   *
   * @param expectedStatusCode the status the response must have, or {@link #ANY_STATUS}.
   * @param requestConfig per-request timeouts; null to use the client defaults.
   * @throws IllegalArgumentException if the request cannot be built from the method and URL.
   * @throws UnexpectedStatusException if the status differs from {@code expectedStatusCode}; the
   *     exception carries the response.
   * @throws PermissionQueryException if the request could not be sent or the body not be read.
   */
  public static RawResponse sendHttpRequest(
      CloseableHttpClient httpClient,
      String method,
      String requestUrl,
      @Nullable byte[] body,
      Map<String, String> headers,
      List<Cookie> cookies,
      int expectedStatusCode,
      @Nullable RequestConfig requestConfig)
      throws PermissionQueryException {
    return execute(
        httpClient,
        buildRequest(method, requestUrl, body, headers, cookies, requestConfig),
        expectedStatusCode);
  }

  /**
   * Sends a request built by {@link #buildRequest}. Failures are thrown without being logged; the
   * caller decides whether a failure is worth an error in the log.
   */
  static RawResponse execute(
      CloseableHttpClient httpClient, HttpUriRequest request, int expectedStatusCode)
      throws PermissionQueryException {
    String requestUrl = request.getURI().toString();
    CloseableHttpResponse response;
    try {
      response = httpClient.execute(request);
    } catch (IOException e) {
      logger.debug("Failed to send HTTP request to {}", requestUrl, e);
      throw new PermissionQueryException(
          String.format("Failed to send HTTP request to %s", requestUrl), e);
    }

    RawResponse rawResponse;
    try {
      HttpEntity entity = response.getEntity();
      byte[] responseBody = entity == null ? null : EntityUtils.toByteArray(entity);
      rawResponse =
          new RawResponse(
              response.getStatusLine(),
              response.getAllHeaders(),
              responseBody == null ? new byte[0] : responseBody);
    } catch (IOException e) {
      logger.debug("Failed to read response body from {}", requestUrl, e);
      throw new PermissionQueryException("Failed to read response body", e);
    } finally {
      closeResponse(response);
    }

    if (expectedStatusCode != ANY_STATUS && rawResponse.getStatusCode() != expectedStatusCode) {
      logger.debug(
          "Unexpected status in request {} {}; status {}",
          request.getMethod(),
          requestUrl,
          rawResponse.getStatusLine());
      throw new UnexpectedStatusException(expectedStatusCode, rawResponse);
    }
    return rawResponse;
  }

  /**
   * Builds the request without sending it; the returned request can be aborted from another
   * thread while {@link #execute} runs.
   */
  static HttpUriRequest buildRequest(
      String method,
      String requestUrl,
      @Nullable byte[] body,
      Map<String, String> headers,
      List<Cookie> cookies,
      @Nullable RequestConfig requestConfig) {
    if (Strings.isNullOrEmpty(method) || !METHOD_CHARS.matchesAllOf(method)) {
      throw ExceptionUtil.logAndCreateIllegalArgument(
          logger, "Failed to create http request; invalid method " + method, null);
    }
    RequestBuilder builder = RequestBuilder.create(method);
    builder.setUri(parseUri(requestUrl));
    if (body != null) {
      builder.setEntity(new ByteArrayEntity(body));
    }
    for (Map.Entry<String, String> header : headers.entrySet()) {
      builder.setHeader(header.getKey(), header.getValue());
    }
    if (!cookies.isEmpty()) {
      List<String> pairs = Lists.newArrayList();
      for (Cookie cookie : cookies) {
        pairs.add(cookie.getName() + "=" + cookie.getValue());
      }
      builder.addHeader("Cookie", Joiner.on("; ").join(pairs));
    }
    if (requestConfig != null) {
      builder.setConfig(requestConfig);
    }
    return builder.build();
  }

  private static URI parseUri(String requestUrl) {
    try {
      URI uri = new URIBuilder(requestUrl).build();
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw ExceptionUtil.logAndCreateIllegalArgument(
            logger, "Failed to create http request; no scheme or host in " + requestUrl, null);
      }
      return uri;
    } catch (URISyntaxException e) {
      throw ExceptionUtil.logAndCreateIllegalArgument(
          logger, "Failed to create http request; malformed URL " + requestUrl, e);
    }
  }

  private static void closeResponse(CloseableHttpResponse response) {
    try {
      response.close();
    } catch (IOException e) {
      // The body is already read at this point; a failed close only affects the connection.
      logger.warn("Failed to close HTTP response", e);
    }
  }

  /** A response whose body has been read completely; the connection is already released. */
  public static final class RawResponse {
    private final StatusLine statusLine;
    private final ImmutableList<Header> headers;
    private final byte[] body;

    RawResponse(StatusLine statusLine, Header[] headers, byte[] body) {
      this.statusLine = statusLine;
      this.headers = headers == null ? ImmutableList.of() : ImmutableList.copyOf(headers);
      this.body = body;
    }

    public int getStatusCode() {
      return statusLine.getStatusCode();
    }

    public StatusLine getStatusLine() {
      return statusLine;
    }

    public ImmutableList<Header> getHeaders() {
      return headers;
    }

    public byte[] getBody() {
      return body.clone();
    }

    public String getBodyAsString() {
      return new String(body, StandardCharsets.UTF_8);
    }
  }
}
