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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.time.Duration;
import javax.annotation.Nullable;
import org.apache.http.cookie.Cookie;

/**
 * Everything needed to build an {@link com.google.opa.client.interfaces.OpaClient}. Immutable once
 * built; use {@link OpaClientConfig#builder()}.
 */
public final class OpaClientConfig {

  private final ClientKind clientKind;
  @Nullable private final String address;
  private final String permissionQueryPath;
  private final String permissionFilterPath;
  private final Duration requestTimeout;
  private final boolean verbose;
  @Nullable private final String overrideHeaderValue;
  private final ImmutableMap<String, String> headers;
  private final ImmutableList<Cookie> cookies;

  private OpaClientConfig(Builder builder) {
    this.clientKind = builder.clientKind;
    this.address = builder.address;
    this.permissionQueryPath = builder.permissionQueryPath;
    this.permissionFilterPath = builder.permissionFilterPath;
    this.requestTimeout = builder.requestTimeout;
    this.verbose = builder.verbose;
    this.overrideHeaderValue = builder.overrideHeaderValue;
    this.headers = builder.headers.build();
    this.cookies = builder.cookies.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ClientKind getClientKind() {
    return clientKind;
  }

  @Nullable
  public String getAddress() {
    return address;
  }

  public String getPermissionQueryPath() {
    return permissionQueryPath;
  }

  public String getPermissionFilterPath() {
    return permissionFilterPath;
  }

  public Duration getRequestTimeout() {
    return requestTimeout;
  }

  public boolean isVerbose() {
    return verbose;
  }

  @Nullable
  public String getOverrideHeaderValue() {
    return overrideHeaderValue;
  }

  /** Extra headers sent with every policy query, e.g., for authenticating to the service. */
  public ImmutableMap<String, String> getHeaders() {
    return headers;
  }

  public ImmutableList<Cookie> getCookies() {
    return cookies;
  }

  public static class Builder {
    private ClientKind clientKind = ClientKind.HTTP;
    private String address;
    private String permissionQueryPath = OpaConstants.DEFAULT_PERMISSION_QUERY_PATH;
    private String permissionFilterPath = OpaConstants.DEFAULT_PERMISSION_FILTER_PATH;
    private Duration requestTimeout = OpaConstants.DEFAULT_REQUEST_TIMEOUT;
    private boolean verbose;
    private String overrideHeaderValue;
    private final ImmutableMap.Builder<String, String> headers = ImmutableMap.builder();
    private final ImmutableList.Builder<Cookie> cookies = ImmutableList.builder();

    private Builder() {}

    public Builder setClientKind(ClientKind clientKind) {
      this.clientKind = Preconditions.checkNotNull(clientKind);
      return this;
    }

    public Builder setAddress(String address) {
      this.address = address;
      return this;
    }

    public Builder setPermissionQueryPath(String permissionQueryPath) {
      this.permissionQueryPath = permissionQueryPath;
      return this;
    }

    public Builder setPermissionFilterPath(String permissionFilterPath) {
      this.permissionFilterPath = permissionFilterPath;
      return this;
    }

    public Builder setRequestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder setVerbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder setOverrideHeaderValue(@Nullable String overrideHeaderValue) {
      this.overrideHeaderValue = overrideHeaderValue;
      return this;
    }

    public Builder addHeader(String name, String value) {
      headers.put(name, value);
      return this;
    }

    public Builder addCookie(Cookie cookie) {
      cookies.add(cookie);
      return this;
    }

    public OpaClientConfig build() {
      if (clientKind == ClientKind.HTTP && Strings.isNullOrEmpty(address)) {
        throw new IllegalArgumentException("Address not set for the HTTP client!");
      }
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(permissionQueryPath), "Permission query path not set!");
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(permissionFilterPath), "Permission filter path not set!");
      Preconditions.checkArgument(
          requestTimeout != null && !requestTimeout.isNegative() && !requestTimeout.isZero(),
          "Request timeout must be positive!");
      return new OpaClientConfig(this);
    }
  }
}
