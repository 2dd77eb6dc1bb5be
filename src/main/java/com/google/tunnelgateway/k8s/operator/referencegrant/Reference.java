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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** Identifies one side of a cross-namespace reference. */
public final class Reference {
  private final String group;
  private final String kind;
  private final String namespace;
  private final String name;

  public Reference(String group, String kind, String namespace, String name) {
    this.group = group == null ? "" : group;
    this.kind = checkNotNull(kind, "kind");
    this.namespace = checkNotNull(namespace, "namespace");
    this.name = checkNotNull(name, "name");
  }

  public String getGroup() {
    return group;
  }

  public String getKind() {
    return kind;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Reference)) {
      return false;
    }
    Reference other = (Reference) o;
    return group.equals(other.group)
        && kind.equals(other.kind)
        && namespace.equals(other.namespace)
        && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(group, kind, namespace, name);
  }

  @Override
  public String toString() {
    return String.format("%s/%s %s/%s", group, kind, namespace, name);
  }
}
