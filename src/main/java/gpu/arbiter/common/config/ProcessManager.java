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

import com.google.common.base.Strings;
import gpu.arbiter.common.Retrier;
import gpu.arbiter.common.Retrier.Backoff;
import java.time.Duration;
import lombok.Data;

/**
 * @class ProcessManager
 * @brief Settings for the control plane that starts and stops the gpu services.
 * @details An empty apiUrl disables process switching; the services are then only probed.
 */
@Data
public class ProcessManager {
  private String apiUrl = "";

  /** Read timeout of a switch call, the control plane blocks until the process is up. */
  private long switchTimeout = 60;

  private long pingTimeout = 5;

  /** How long a freshly switched service may take to pass its health check. */
  private long startupWait = 30;

  private long healthPollInterval = 2;
  private long healthCheckTimeout = 2;
  private boolean restoreOnRelease = true;

  private int retryAttempts = 3;
  private double retryInitialDelay = 2;
  private double retryMaxDelay = 8;
  private double retryMultiplier = 2;

  private ServiceEndpoint textGeneration =
      new ServiceEndpoint("http://127.0.0.1:11434", "/api/tags");
  private ServiceEndpoint imageGeneration =
      new ServiceEndpoint("http://127.0.0.1:8188", "/system_stats");

  public boolean isEnabled() {
    return !Strings.isNullOrEmpty(apiUrl);
  }

  public Duration getSwitchTimeoutDuration() {
    return Duration.ofSeconds(switchTimeout);
  }

  public Duration getPingTimeoutDuration() {
    return Duration.ofSeconds(pingTimeout);
  }

  public Duration getStartupWaitDuration() {
    return Duration.ofSeconds(startupWait);
  }

  public Duration getHealthPollIntervalDuration() {
    return Duration.ofSeconds(healthPollInterval);
  }

  public Duration getHealthCheckTimeoutDuration() {
    return Duration.ofSeconds(healthCheckTimeout);
  }

  public Retrier createRetrier() {
    if (retryAttempts <= 0) {
      return Retrier.NO_RETRIES;
    }
    return new Retrier(
        Backoff.exponential(
            Duration.ofMillis((long) (retryInitialDelay * 1000)),
            Duration.ofMillis((long) (retryMaxDelay * 1000)),
            retryMultiplier,
            /* jitter= */ 0.0,
            retryAttempts),
        Retrier.RETRY_IO);
  }
}
