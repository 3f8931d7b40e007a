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

package gpu.arbiter.resources;

import com.google.common.collect.ImmutableList;
import gpu.arbiter.common.ServiceType;
import gpu.arbiter.vram.UsageSnapshot;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * @class QueueStatus
 * @brief Point-in-time view of the gpu lease, the queue and the running totals.
 * @details Only the head of the queue is listed; queueLength always counts every waiting request.
 */
public record QueueStatus(
    boolean locked,
    Optional<ServiceType> activeService,
    Optional<String> activeLeaseId,
    int queueLength,
    ImmutableList<Entry> queue,
    UsageSnapshot vram,
    Totals totals) {
  public static final int MAX_LISTED_ENTRIES = 10;

  /** One waiting request. */
  public record Entry(
      String shortId,
      ServiceType serviceType,
      int priority,
      @Nullable String requesterId,
      double waitingSeconds) {}

  public record Totals(
      long totalRequests,
      long totalTimeouts,
      double timeoutRate,
      double averageWaitSeconds,
      double averageUsageSeconds,
      boolean fallbackMode) {}
}
