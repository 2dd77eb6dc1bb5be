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

import java.util.OptionalInt;

/** Reading or writing the tunnel configuration failed. */
public class TunnelConfigurationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Integer statusCode;

  public TunnelConfigurationException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = null;
  }

  public TunnelConfigurationException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /** HTTP status code of the API response, if the API responded. */
  public OptionalInt getStatusCode() {
    return statusCode == null ? OptionalInt.empty() : OptionalInt.of(statusCode);
  }

  public TunnelErrorType getErrorType() {
    if (statusCode != null) {
      return TunnelErrorType.fromStatusCode(statusCode);
    }
    String message = getCause() != null ? getCause().getMessage() : getMessage();
    return TunnelErrorType.fromMessage(message);
  }
}
