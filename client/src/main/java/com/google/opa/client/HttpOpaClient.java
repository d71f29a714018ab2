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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.opa.client.interfaces.Action;
import com.google.opa.client.interfaces.OpaClient;
import com.google.opa.client.interfaces.PermissionOptions;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.cookie.Cookie;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The production {@link OpaClient}; sends permission queries to an OPA server over HTTP.
 *
 * <p>Callers presenting the configured override value skip the policy check altogether. All state
 * is fixed at construction and the underlying HTTP client is thread-safe, so one instance can serve
 * concurrent callers.
 */
public class HttpOpaClient implements OpaClient, Closeable {

  private static final Logger logger = LoggerFactory.getLogger(HttpOpaClient.class);

  private static final int MAX_CONNECTIONS_PER_ROUTE = 32;

  private final String address;
  private final String permissionQueryPath;
  private final String permissionFilterPath;
  private final Duration requestTimeout;
  private final boolean verbose;
  @Nullable private final String overrideHeaderValue;
  private final Map<String, String> headers;
  private final List<Cookie> cookies;
  private final CloseableHttpClient httpClient;
  // Aborts requests that outlive their timeout or the caller's deadline.
  private final ScheduledThreadPoolExecutor abortScheduler;
  private final Gson gson = new Gson();

  public HttpOpaClient(OpaClientConfig config) {
    this(config, createHttpClient(config.getRequestTimeout()));
  }

  @VisibleForTesting
  HttpOpaClient(OpaClientConfig config, CloseableHttpClient httpClient) {
    Preconditions.checkArgument(config.getAddress() != null, "Address not set!");
    this.address = CharMatcher.is('/').trimTrailingFrom(config.getAddress());
    this.permissionQueryPath = withLeadingSlash(config.getPermissionQueryPath());
    this.permissionFilterPath = withLeadingSlash(config.getPermissionFilterPath());
    this.requestTimeout = config.getRequestTimeout();
    this.verbose = config.isVerbose();
    this.overrideHeaderValue = config.getOverrideHeaderValue();
    this.headers =
        ImmutableMap.<String, String>builder()
            .putAll(config.getHeaders())
            .put(HttpHeaders.CONTENT_TYPE, OpaConstants.JSON_CONTENT.getMimeType())
            .buildKeepingLast();
    this.cookies = config.getCookies();
    this.httpClient = httpClient;
    this.abortScheduler =
        new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("opa-request-abort-%d")
                .build());
    this.abortScheduler.setRemoveOnCancelPolicy(true);
    logger.info(
        "Initialized OPA client for {} (query path {}, filter path {}, timeout {})",
        address,
        permissionQueryPath,
        permissionFilterPath,
        requestTimeout);
  }

  private static CloseableHttpClient createHttpClient(Duration requestTimeout) {
    return HttpClients.custom()
        .setDefaultRequestConfig(timeoutConfig(requestTimeout))
        .setMaxConnPerRoute(MAX_CONNECTIONS_PER_ROUTE)
        .setMaxConnTotal(MAX_CONNECTIONS_PER_ROUTE)
        .build();
  }

  private static String withLeadingSlash(String path) {
    return path.startsWith("/") ? path : "/" + path;
  }

  @Override
  public boolean queryPermissions(String resource, Action action, PermissionOptions options)
      throws IOException {
    Preconditions.checkNotNull(resource, "resource");
    Preconditions.checkNotNull(action, "action");
    Preconditions.checkNotNull(options, "options");
    if (isOverridden(options)) {
      if (verbose) {
        logger.info("Override value matched; allowing {} on {} without a query", action, resource);
      }
      return true;
    }

    PermissionQueryRequest request =
        new PermissionQueryRequest(resource, action, options.getMemberIds());
    PermissionQueryResponse response =
        post(permissionQueryPath, request, options, PermissionQueryResponse.class);
    boolean allowed = response.isResult();
    if (verbose) {
      logger.info(
          "Permission query decision for resource {} action {} members {}: {}",
          resource,
          action,
          options.getMemberIds(),
          allowed);
    }
    return allowed;
  }

  @Override
  public List<Boolean> queryPermissionsMultiResources(
      List<String> resources, Action action, PermissionOptions options) throws IOException {
    Preconditions.checkNotNull(resources, "resources");
    Preconditions.checkNotNull(action, "action");
    Preconditions.checkNotNull(options, "options");
    if (isOverridden(options)) {
      if (verbose) {
        logger.info(
            "Override value matched; allowing {} on {} resources without a query",
            action,
            resources.size());
      }
      return ImmutableList.copyOf(Collections.nCopies(resources.size(), true));
    }
    if (resources.isEmpty()) {
      return ImmutableList.of();
    }
    Preconditions.checkArgument(
        !Iterables.any(resources, Objects::isNull), "resources must not contain null");

    PermissionFilterRequest request =
        new PermissionFilterRequest(resources, action, options.getMemberIds());
    PermissionFilterResponse response =
        post(permissionFilterPath, request, options, PermissionFilterResponse.class);

    // The filter answer is a set of allowed names with no positional correspondence to the input;
    // duplicates in the input get the same answer.
    Set<String> allowedResources = Sets.newHashSet();
    if (response.getResult() != null) {
      allowedResources.addAll(response.getResult());
    }
    ImmutableList.Builder<Boolean> permissions =
        ImmutableList.builderWithExpectedSize(resources.size());
    for (String resource : resources) {
      permissions.add(allowedResources.contains(resource));
    }
    ImmutableList<Boolean> result = permissions.build();
    if (verbose) {
      logger.info(
          "Permission filter decision for resources {} action {} members {}: {}",
          resources,
          action,
          options.getMemberIds(),
          result);
    }
    return result;
  }

  /**
   * Blocks until the OPA server reports healthy, polling every {@code interval}.
   *
   * @throws TimeoutException if the server did not become healthy within {@code timeout}.
   */
  public void waitUntilReady(Duration timeout, Duration interval) throws TimeoutException {
    String healthUrl = address + OpaConstants.HEALTH_PATH;
    RetryUtil.retryUntilSuccessful(
        timeout,
        interval,
        () -> {
          try {
            HttpUtil.RawResponse response =
                send(
                    HttpGet.METHOD_NAME,
                    healthUrl,
                    null,
                    HttpUtil.ANY_STATUS,
                    new RequestBudget(requestTimeout, false));
            if (response.getStatusCode() == HttpStatus.SC_OK) {
              return true;
            }
            logger.info(
                "OPA server at {} is not ready yet; status {}", address, response.getStatusLine());
            return false;
          } catch (PermissionQueryException e) {
            logger.info("OPA server at {} is not ready yet: {}", address, e.getMessage());
            return false;
          }
        });
    logger.info("OPA server at {} is ready", address);
  }

  @Override
  public void close() throws IOException {
    abortScheduler.shutdownNow();
    httpClient.close();
  }

  @VisibleForTesting
  boolean isOverridden(PermissionOptions options) {
    if (!options.hasOverrideHeaderValue() || overrideHeaderValue == null) {
      return false;
    }
    return MessageDigest.isEqual(
        options.getOverrideHeaderValue().getBytes(StandardCharsets.UTF_8),
        overrideHeaderValue.getBytes(StandardCharsets.UTF_8));
  }

  private <T> T post(String path, Object request, PermissionOptions options, Class<T> responseType)
      throws PermissionQueryException {
    RequestBudget budget = budgetFor(options);
    String requestUrl = address + path;
    String requestBody = gson.toJson(request);
    if (verbose) {
      logger.info("Sending permission request to {}: {}", requestUrl, requestBody);
    }
    HttpUtil.RawResponse response;
    try {
      response =
          send(
              HttpPost.METHOD_NAME,
              requestUrl,
              requestBody.getBytes(StandardCharsets.UTF_8),
              HttpStatus.SC_OK,
              budget);
    } catch (PermissionQueryException e) {
      logger.error("Permission request to {} failed", requestUrl, e);
      throw e;
    }
    return decode(response, responseType);
  }

  /**
   * Sends one request and aborts it once {@code budget} is used up, wherever the request is at
   * that point (connecting, waiting for the status line, or reading the body).
   */
  private HttpUtil.RawResponse send(
      String method,
      String requestUrl,
      @Nullable byte[] body,
      int expectedStatusCode,
      RequestBudget budget)
      throws PermissionQueryException {
    HttpUriRequest request =
        HttpUtil.buildRequest(
            method, requestUrl, body, headers, cookies, timeoutConfig(budget.timeout));
    AtomicBoolean aborted = new AtomicBoolean();
    Stopwatch stopwatch = Stopwatch.createStarted();
    ScheduledFuture<?> abortTask =
        abortScheduler.schedule(
            () -> {
              aborted.set(true);
              request.abort();
            },
            budget.timeout.toMillis(),
            TimeUnit.MILLISECONDS);
    try {
      return HttpUtil.execute(httpClient, request, expectedStatusCode);
    } catch (UnexpectedStatusException e) {
      throw e;
    } catch (PermissionQueryException e) {
      // A socket timeout can beat the abort task by a few milliseconds; both mean time is up.
      boolean expired = aborted.get() || stopwatch.elapsed().compareTo(budget.timeout) >= 0;
      if (!expired) {
        throw e;
      }
      if (budget.deadlineBound) {
        throw new QueryCancelledException(
            "Permission query cancelled; caller deadline passed after " + budget.timeout, e);
      }
      throw new PermissionQueryException(
          String.format("Request to %s timed out after %s", requestUrl, budget.timeout), e);
    } finally {
      abortTask.cancel(false);
    }
  }

  private <T> T decode(HttpUtil.RawResponse response, Class<T> responseType)
      throws PermissionQueryException {
    T decoded;
    try {
      decoded = gson.fromJson(response.getBodyAsString(), responseType);
    } catch (JsonParseException e) {
      throw ExceptionUtil.logAndCreateQueryException(
          logger, "Failed to decode permission response: " + response.getBodyAsString(), e);
    }
    if (decoded == null) {
      throw ExceptionUtil.logAndCreateQueryException(
          logger, "Empty permission response from " + address, null);
    }
    return decoded;
  }

  private RequestBudget budgetFor(PermissionOptions options) throws QueryCancelledException {
    if (Thread.currentThread().isInterrupted()) {
      throw new QueryCancelledException("Permission query cancelled; the thread is interrupted");
    }
    Instant deadline = options.getDeadline();
    if (deadline == null) {
      return new RequestBudget(requestTimeout, false);
    }
    Duration remaining = Duration.between(Instant.now(), deadline);
    if (remaining.isNegative() || remaining.isZero()) {
      throw new QueryCancelledException("Permission query cancelled; deadline " + deadline);
    }
    return remaining.compareTo(requestTimeout) < 0
        ? new RequestBudget(remaining, true)
        : new RequestBudget(requestTimeout, false);
  }

  private static RequestConfig timeoutConfig(Duration timeout) {
    // A zero timeout means "infinite" for Apache HttpClient.
    int millis = Math.max(1, Ints.saturatedCast(timeout.toMillis()));
    return RequestConfig.custom()
        .setConnectTimeout(millis)
        .setConnectionRequestTimeout(millis)
        .setSocketTimeout(millis)
        .build();
  }

  /** The total time one request may take, and whether the caller's deadline set that limit. */
  private static final class RequestBudget {
    private final Duration timeout;
    private final boolean deadlineBound;

    RequestBudget(Duration timeout, boolean deadlineBound) {
      this.timeout = timeout;
      this.deadlineBound = deadlineBound;
    }
  }
}
