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

import java.time.Duration;
import lombok.Data;

@Data
public class Vram {
  private boolean enabled = true;
  private double pollInterval = 2;

  /** Usage percentage at or above which the gpu is considered saturated. */
  private double usageThreshold = 90.0;

  /** Free memory required when a request does not state its own need. */
  private int minFreeMb = 2048;

  private int deviceIndex = 0;
  private long queryTimeout = 2;
  private String nvidiaSmiPath = "nvidia-smi";

  public Duration getPollIntervalDuration() {
    return Duration.ofMillis((long) (pollInterval * 1000));
  }

  public Duration getQueryTimeoutDuration() {
    return Duration.ofSeconds(queryTimeout);
  }
}
