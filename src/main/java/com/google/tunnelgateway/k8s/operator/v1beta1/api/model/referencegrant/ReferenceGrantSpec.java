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

package com.google.tunnelgateway.k8s.operator.v1beta1.api.model.referencegrant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ReferenceGrantSpec {
  private List<ReferenceGrantFrom> from = new ArrayList<>();
  private List<ReferenceGrantTo> to = new ArrayList<>();

  public List<ReferenceGrantFrom> getFrom() {
    return from;
  }

  public void setFrom(List<ReferenceGrantFrom> from) {
    this.from = from;
  }

  public List<ReferenceGrantTo> getTo() {
    return to;
  }

  public void setTo(List<ReferenceGrantTo> to) {
    this.to = to;
  }
}
