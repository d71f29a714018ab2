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

import javax.annotation.Nullable;
import org.slf4j.Logger;

/** Log-then-throw helpers; callers write {@code throw ExceptionUtil.xyz(...)}. */
class ExceptionUtil {

  private ExceptionUtil() {}

  static IllegalArgumentException logAndCreateIllegalArgument(
      Logger logger, String errorMessage, @Nullable Exception origException) {
    logError(logger, errorMessage, origException);
    return new IllegalArgumentException(errorMessage, origException);
  }

  static PermissionQueryException logAndCreateQueryException(
      Logger logger, String errorMessage, @Nullable Exception origException) {
    logError(logger, errorMessage, origException);
    return origException == null
        ? new PermissionQueryException(errorMessage)
        : new PermissionQueryException(errorMessage, origException);
  }

  private static void logError(
      Logger logger, String errorMessage, @Nullable Exception origException) {
    // logging the error message followed by the stack trace.
    if (origException == null) {
      logger.error(errorMessage, new Exception("stack-trace"));
    } else {
      logger.error(errorMessage, origException);
    }
  }
}
