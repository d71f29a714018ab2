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

import java.util.Locale;

/** Selects which {@link com.google.opa.client.interfaces.OpaClient} variant is created. */
public enum ClientKind {
  /** Queries a remote policy service over HTTP. */
  HTTP,
  /** Allows everything; for deployments where authorization is disabled. */
  NOP,
  /** A controllable stand-in for tests of calling code. */
  MOCK;

  static ClientKind fromString(String value) {
    try {
      return ClientKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format("Unknown client kind %s; expected one of http, nop, mock", value), e);
    }
  }
}
