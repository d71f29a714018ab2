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
package com.google.opa.client.interfaces;

import com.google.gson.annotations.SerializedName;

/** The operation a permission query asks about; serialized with its lowercase wire value. */
public enum Action {
  @SerializedName("read")
  READ("read"),
  @SerializedName("create")
  CREATE("create"),
  @SerializedName("update")
  UPDATE("update"),
  @SerializedName("delete")
  DELETE("delete"),
  @SerializedName("write")
  WRITE("write"),
  @SerializedName("list")
  LIST("list");

  private final String value;

  Action(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
