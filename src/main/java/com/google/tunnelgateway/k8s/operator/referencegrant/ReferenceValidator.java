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

package com.google.tunnelgateway.k8s.operator.referencegrant;

/** Decides whether an object may reference an object in another namespace. */
public interface ReferenceValidator {
  /** Validator used when cross-namespace validation is disabled. Allows every reference. */
  ReferenceValidator ALLOW_ALL = (from, to) -> true;

  boolean isReferenceAllowed(Reference from, Reference to) throws ReferenceValidationException;
}
