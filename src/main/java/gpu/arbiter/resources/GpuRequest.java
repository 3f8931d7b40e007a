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

import static com.google.common.base.Preconditions.checkNotNull;

import gpu.arbiter.common.ServiceType;
import java.time.Instant;
import java.util.Comparator;
import java.util.UUID;
import javax.annotation.Nullable;

/**
 * @class GpuRequest
 * @brief A caller's demand for exclusive use of the gpu.
 * @details Priority is derived from the service type when the request is created and never changes.
 *     Requests order by priority descending, then by creation time, then by sequence so that two
 *     requests created within the same clock tick still have a strict order.
 */
public record GpuRequest(
    String id,
    ServiceType serviceType,
    int priority,
    @Nullable String requesterId,
    @Nullable Integer requiredMemoryMb,
    long createdAtNanos,
    Instant createdAt,
    long sequence) {
  public static final Comparator<GpuRequest> ORDER =
      Comparator.comparingInt(GpuRequest::priority)
          .reversed()
          .thenComparingLong(GpuRequest::createdAtNanos)
          .thenComparingLong(GpuRequest::sequence);

  public GpuRequest {
    checkNotNull(id);
    checkNotNull(serviceType);
    checkNotNull(createdAt);
  }

  public static GpuRequest create(
      ServiceType serviceType,
      int priority,
      @Nullable String requesterId,
      @Nullable Integer requiredMemoryMb,
      long sequence) {
    return new GpuRequest(
        UUID.randomUUID().toString(),
        serviceType,
        priority,
        requesterId,
        requiredMemoryMb,
        System.nanoTime(),
        Instant.now(),
        sequence);
  }

  public String shortId() {
    return id.substring(0, 8);
  }
}
