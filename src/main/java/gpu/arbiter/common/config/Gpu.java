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

package gpu.arbiter.common.config;

import gpu.arbiter.common.ServiceType;
import java.time.Duration;
import lombok.Data;

/**
 * @class Gpu
 * @brief Scheduling settings of the gpu resource manager.
 * @details All durations are configured in seconds.
 */
@Data
public class Gpu {
  private int priorityImageGeneration = 10;
  private int priorityTextGeneration = 5;
  private int priorityOther = 1;

  /** How long an acquire may wait when the caller does not provide a timeout. */
  private long waitTimeout = 300;

  // budgets used by callers for short chat turns and for grouped/heavy requests
  private long lightRequestTimeout = 60;
  private long heavyRequestTimeout = 120;

  /** How long queue promotion waits for a service that is not answering its health probe. */
  private long serviceAvailabilityTimeout = 60;

  private double servicePollInterval = 2;

  /** Pause after a process switch so the stopped process can hand back its memory. */
  private double vramSettleDelay = 2;

  /** Period of the background queue sweep. Zero disables it. */
  private long queueCheckInterval = 5;

  private boolean alwaysRestoreDefaultAfterSecondary = true;

  public int getPriority(ServiceType serviceType) {
    switch (serviceType) {
      case IMAGE_GENERATION:
        return priorityImageGeneration;
      case TEXT_GENERATION:
        return priorityTextGeneration;
      default:
        return priorityOther;
    }
  }

  public Duration getWaitTimeoutDuration() {
    return Duration.ofSeconds(waitTimeout);
  }

  public Duration getLightRequestTimeoutDuration() {
    return Duration.ofSeconds(lightRequestTimeout);
  }

  public Duration getHeavyRequestTimeoutDuration() {
    return Duration.ofSeconds(heavyRequestTimeout);
  }

  public Duration getServiceAvailabilityTimeoutDuration() {
    return Duration.ofSeconds(serviceAvailabilityTimeout);
  }

  public Duration getServicePollIntervalDuration() {
    return Duration.ofMillis((long) (servicePollInterval * 1000));
  }

  public Duration getVramSettleDelayDuration() {
    return Duration.ofMillis((long) (vramSettleDelay * 1000));
  }

  public Duration getQueueCheckIntervalDuration() {
    return Duration.ofSeconds(queueCheckInterval);
  }
}
