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

import gpu.arbiter.common.ServiceType;
import java.util.Optional;

/**
 * @class ProcessSwitcher
 * @brief Makes one gpu service the running process and stops its competitor.
 * @details All operations are best effort. Failure is reported as false rather than thrown so that
 *     the resource manager always has a defined fallback. Implementations are not expected to be
 *     called concurrently; the resource manager serializes switches.
 */
public interface ProcessSwitcher {
  /**
   * @brief Ensure the service is the active process.
   * @details Idempotent: an active, healthy service is left alone unless a restart is forced.
   * @param serviceType The service to activate.
   * @param forceRestart Restart the service even if it is already active.
   * @return Whether the service is believed active afterward.
   */
  boolean switchTo(ServiceType serviceType, boolean forceRestart);

  default boolean switchTo(ServiceType serviceType) {
    return switchTo(serviceType, /* forceRestart= */ false);
  }

  /** Short, non-mutating health probe of the service itself. */
  boolean checkAvailable(ServiceType serviceType);

  /** Whether the control plane that starts and stops processes can be reached. */
  boolean isControlPlaneAvailable();

  boolean stop(ServiceType serviceType);

  /** Reactivates the service that was active before the last switch, if it is not already. */
  boolean restorePrevious();

  Optional<ServiceType> getCurrentService();

  Optional<ProcessStatus> getStatus();
}
