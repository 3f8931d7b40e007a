// Copyright 2026 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package gpu.arbiter.common;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * @class ServiceType
 * @brief The families of workloads that compete for the gpu.
 * @details Text generation is the default service that stays resident between requests. Image
 *     generation preempts it. Each value carries the name the process control plane uses for it.
 */
public enum ServiceType {
  TEXT_GENERATION("ollama"),
  IMAGE_GENERATION("comfyui"),
  OTHER("other");

  private final String serviceName;

  ServiceType(String serviceName) {
    this.serviceName = serviceName;
  }

  /** The name used on the wire with the process control plane. */
  public String getServiceName() {
    return serviceName;
  }

  public static Optional<ServiceType> fromName(@Nullable String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (ServiceType type : values()) {
      if (type.serviceName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return serviceName;
  }
}
