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

/** How a freshly compiled rule list is merged into the live tunnel configuration. */
public enum SyncStrategy {
  /**
   * Writes the compiled rules verbatim whenever the live rules differ in membership or order.
   * Keeps the live configuration otherwise.
   */
  REPLACE_ON_CHANGE,

  /**
   * Removes stale rules and appends new ones, keeping the order of the live rules that are still
   * wanted. Does not reorder rules whose relative order changed.
   */
  MINIMAL_PATCH
}
