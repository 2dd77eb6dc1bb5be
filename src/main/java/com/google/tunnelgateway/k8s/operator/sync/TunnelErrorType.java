// Copyright (C) 2023 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.tunnelgateway.k8s.operator.sync;

import java.util.Locale;

/** Classification of tunnel configuration API failures, used as metric label. */
public enum TunnelErrorType {
  AUTH("auth"),
  RATE_LIMIT("rate_limit"),
  SERVER_ERROR("server_error"),
  CLIENT_ERROR("client_error"),
  TIMEOUT("timeout"),
  NETWORK("network"),
  UNKNOWN("unknown");

  private final String label;

  TunnelErrorType(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public static TunnelErrorType fromStatusCode(int statusCode) {
    if (statusCode == 401 || statusCode == 403) {
      return AUTH;
    }
    if (statusCode == 429) {
      return RATE_LIMIT;
    }
    if (statusCode >= 500 && statusCode < 600) {
      return SERVER_ERROR;
    }
    if (statusCode >= 400 && statusCode < 500) {
      return CLIENT_ERROR;
    }
    return UNKNOWN;
  }

  /** Classifies failures that did not produce an HTTP response. */
  public static TunnelErrorType fromMessage(String message) {
    if (message == null) {
      return UNKNOWN;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("timeout") || lower.contains("deadline") || lower.contains("timed out")) {
      return TIMEOUT;
    }
    if (lower.contains("connection refused") || lower.contains("no such host")) {
      return NETWORK;
    }
    return UNKNOWN;
  }
}
