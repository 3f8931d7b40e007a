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

package gpu.arbiter.vram;

/**
 * @class UsageSnapshot
 * @brief Gpu memory usage at one point in time.
 * @details When available is false no telemetry backend answered and the numeric fields are
 *     meaningless. The method names the backend that produced the numbers.
 */
public record UsageSnapshot(
    long usedMb, long totalMb, long freeMb, double usagePercent, boolean available, String method) {
  public static final String METHOD_DISABLED = "disabled";
  public static final String METHOD_UNAVAILABLE = "unavailable";

  public static UsageSnapshot disabled() {
    return new UsageSnapshot(0, 0, 0, 0.0, true, METHOD_DISABLED);
  }

  public static UsageSnapshot unavailable() {
    return new UsageSnapshot(0, 0, 0, 0.0, false, METHOD_UNAVAILABLE);
  }

  public static UsageSnapshot of(MemoryInfo memory, String method) {
    double usagePercent =
        memory.totalMb() > 0 ? Math.round(memory.usedMb() * 10000.0 / memory.totalMb()) / 100.0 : 0;
    return new UsageSnapshot(
        memory.usedMb(), memory.totalMb(), memory.freeMb(), usagePercent, true, method);
  }
}
