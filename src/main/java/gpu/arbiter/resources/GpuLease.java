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

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * @class GpuLease
 * @brief Proof that the holder has exclusive use of the gpu.
 * @details Closing the lease releases it back to the manager exactly once, so it may be used in a
 *     try-with-resources block and still be released explicitly beforehand.
 */
public class GpuLease implements AutoCloseable {
  private final ResourceManager manager;
  private final GpuRequest request;
  private final long acquiredAtNanos;
  private final Instant acquiredAt;
  private final AtomicBoolean released = new AtomicBoolean(false);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  GpuLease(ResourceManager manager, GpuRequest request) {
    this.manager = manager;
    this.request = request;
    acquiredAtNanos = System.nanoTime();
    acquiredAt = Instant.now();
  }

  public String getId() {
    return request.id();
  }

  public GpuRequest getRequest() {
    return request;
  }

  public long getAcquiredAtNanos() {
    return acquiredAtNanos;
  }

  public Instant getAcquiredAt() {
    return acquiredAt;
  }

  public boolean isReleased() {
    return released.get();
  }

  // only the manager flips the flag, under its lock
  boolean markReleased() {
    return released.compareAndSet(false, true);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true) && !released.get()) {
      manager.release(getId());
    }
  }

  @Override
  public String toString() {
    return String.format("GpuLease(%s, %s)", request.shortId(), request.serviceType());
  }
}
