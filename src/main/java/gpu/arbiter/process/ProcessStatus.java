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

package gpu.arbiter.process;

import com.google.common.collect.ImmutableMap;
import gpu.arbiter.common.ServiceType;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * @class ProcessStatus
 * @brief What the control plane reports about the gpu service processes.
 * @details Services the control plane did not mention are reported as not running.
 */
public record ProcessStatus(
    ImmutableMap<ServiceType, ServiceState> services, Optional<ServiceType> currentService) {
  public record ServiceState(boolean running, OptionalLong pid) {
    public static final ServiceState STOPPED = new ServiceState(false, OptionalLong.empty());
  }

  public ServiceState get(ServiceType serviceType) {
    return services.getOrDefault(serviceType, ServiceState.STOPPED);
  }

  public boolean isRunning(ServiceType serviceType) {
    return get(serviceType).running();
  }
}
