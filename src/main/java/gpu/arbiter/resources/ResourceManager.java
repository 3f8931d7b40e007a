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
import static com.google.common.base.Preconditions.checkState;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import gpu.arbiter.common.ServiceType;
import gpu.arbiter.common.config.Gpu;
import gpu.arbiter.process.ProcessSwitcher;
import gpu.arbiter.vram.UsageSnapshot;
import gpu.arbiter.vram.VramMonitor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import lombok.extern.java.Log;

/**
 * @class ResourceManager
 * @brief Grants exclusive use of the single gpu to one request at a time.
 * @details Waiting requests are served by priority, then in arrival order. Before a lease is
 *     granted the gpu is switched to the requested service and its memory is checked; both happen
 *     outside the lock while the slot stays reserved for the request being admitted. A release
 *     keeps the slot reserved until the restoration policy has run and the next waiter has been
 *     promoted, so requests arriving meanwhile queue up and compete with the existing waiters.
 */
@Log
public class ResourceManager {
  private final Gpu settings;
  private final ProcessSwitcher switcher;
  private final VramMonitor vram;

  private final AtomicLong sequence = new AtomicLong();
  private final ReentrantLock lock = new ReentrantLock();

  @GuardedBy("lock")
  private final PriorityQueue<Waiter> queue =
      new PriorityQueue<>(Comparator.comparing(Waiter::getRequest, GpuRequest.ORDER));

  @GuardedBy("lock")
  private GpuLease currentLease = null;

  // request whose switch and vram check are in flight
  @GuardedBy("lock")
  private Waiter admitting = null;

  // restoration and promotion after a release
  @GuardedBy("lock")
  private boolean transitioning = false;

  @GuardedBy("lock")
  private long totalRequests = 0;

  @GuardedBy("lock")
  private long totalTimeouts = 0;

  @GuardedBy("lock")
  private long totalWaitNanos = 0;

  @GuardedBy("lock")
  private long totalUsageNanos = 0;

  private volatile boolean fallbackMode;

  @Nullable private ScheduledExecutorService sweeper = null;

  /** A request that has not been granted yet, and the condition its caller waits on. */
  private static class Waiter {
    private final GpuRequest request;
    private final Condition granted;
    private GpuLease lease = null;
    private boolean abandoned = false;

    Waiter(GpuRequest request, Condition granted) {
      this.request = request;
      this.granted = granted;
    }

    GpuRequest getRequest() {
      return request;
    }
  }

  public ResourceManager(Gpu settings, ProcessSwitcher switcher, VramMonitor vram) {
    this.settings = settings;
    this.switcher = switcher;
    this.vram = vram;
    refreshFallbackMode();
    log.info(String.format("resource manager initialized (fallback mode: %s)", fallbackMode));
  }

  public GpuLease acquire(ServiceType serviceType)
      throws ResourceTimeoutException, ResourceUnavailableException, InterruptedException {
    return acquire(serviceType, null, null, null);
  }

  /**
   * @brief Blocks until the gpu is granted to this caller.
   * @details The gpu is switched to the requested service before the lease is returned. Release
   *     the lease with {@link #release} or by closing it.
   * @param serviceType The service that will use the gpu.
   * @param requesterId Identifies the caller in logs and status reports.
   * @param requiredMemoryMb Free memory the workload needs, or null for the configured minimum.
   * @param timeout How long to wait, or null for the configured wait timeout.
   * @return The granted lease.
   * @throws ResourceUnavailableException Neither the control plane nor the service answer.
   * @throws ResourceTimeoutException The gpu was not granted within the timeout.
   */
  public GpuLease acquire(
      ServiceType serviceType,
      @Nullable String requesterId,
      @Nullable Integer requiredMemoryMb,
      @Nullable Duration timeout)
      throws ResourceTimeoutException, ResourceUnavailableException, InterruptedException {
    checkNotNull(serviceType);
    Duration waitTimeout = timeout != null ? timeout : settings.getWaitTimeoutDuration();
    long deadlineNanos = System.nanoTime() + waitTimeout.toNanos();
    GpuRequest request =
        GpuRequest.create(
            serviceType,
            settings.getPriority(serviceType),
            requesterId,
            requiredMemoryMb,
            sequence.getAndIncrement());

    lock.lock();
    try {
      totalRequests++;
    } finally {
      lock.unlock();
    }
    ResourceManagerMetrics.requestsMetric.labels(serviceType.getServiceName()).inc();
    log.info(
        String.format(
            "gpu requested for %s (id: %s, priority: %d, requester: %s)",
            serviceType, request.shortId(), request.priority(), requesterId));

    if (!switcher.isControlPlaneAvailable() && !switcher.checkAvailable(serviceType)) {
      ResourceManagerMetrics.unavailableMetric.labels(serviceType.getServiceName()).inc();
      throw new ResourceUnavailableException(
          String.format("%s is unavailable and the process manager is unreachable", serviceType));
    }

    Waiter waiter = new Waiter(request, lock.newCondition());
    boolean admitNow;
    boolean promote = false;
    lock.lock();
    try {
      // queued requests that failed admission are tried first when the gpu is idle
      admitNow = isIdle() && queue.isEmpty();
      if (admitNow) {
        admitting = waiter;
      } else {
        enqueue(waiter);
        if (isIdle()) {
          transitioning = true;
          promote = true;
        }
      }
    } finally {
      lock.unlock();
    }

    if (admitNow) {
      GpuLease lease = admitImmediately(waiter);
      if (lease != null) {
        return lease;
      }
    } else if (promote) {
      promoteReserved();
    }
    return awaitGrant(waiter, deadlineNanos, waitTimeout);
  }

  @Nullable
  private GpuLease admitImmediately(Waiter waiter) throws InterruptedException {
    boolean admitted;
    try {
      admitted = admit(waiter.request);
    } catch (InterruptedException | RuntimeException e) {
      // hand the reservation to the next waiter before giving up
      lock.lock();
      try {
        admitting = null;
        transitioning = true;
      } finally {
        lock.unlock();
      }
      promoteReserved();
      throw e;
    }
    lock.lock();
    try {
      admitting = null;
      if (admitted) {
        grant(waiter);
      } else {
        enqueue(waiter);
      }
    } finally {
      lock.unlock();
    }
    if (admitted) {
      GpuRequest request = waiter.request;
      log.info(
          String.format("gpu granted to %s (id: %s)", request.serviceType(), request.shortId()));
      return waiter.lease;
    }
    log.info(
        String.format(
            "vram is not available after switching to %s, queueing %s",
            waiter.request.serviceType(), waiter.request.shortId()));
    return null;
  }

  private GpuLease awaitGrant(Waiter waiter, long deadlineNanos, Duration waitTimeout)
      throws ResourceTimeoutException, InterruptedException {
    GpuRequest request = waiter.request;
    GpuLease grantedWhileInterrupted = null;
    lock.lock();
    try {
      while (waiter.lease == null) {
        long remainingNanos = deadlineNanos - System.nanoTime();
        if (remainingNanos <= 0) {
          abandon(waiter);
          totalTimeouts++;
          ResourceManagerMetrics.timeoutsMetric
              .labels(request.serviceType().getServiceName())
              .inc();
          double waitSeconds = waitTimeout.toMillis() / 1000.0;
          log.warning(
              String.format(
                  "timed out waiting %.1fs for the gpu for %s (id: %s, timeouts: %d)",
                  waitSeconds, request.serviceType(), request.shortId(), totalTimeouts));
          throw new ResourceTimeoutException(
              String.format(
                  "timed out waiting %.1fs for the gpu for %s",
                  waitSeconds, request.serviceType()));
        }
        try {
          waiter.granted.awaitNanos(remainingNanos);
        } catch (InterruptedException e) {
          if (waiter.lease != null) {
            grantedWhileInterrupted = waiter.lease;
          } else {
            abandon(waiter);
          }
          throw e;
        }
      }
      long waitedNanos = System.nanoTime() - request.createdAtNanos();
      totalWaitNanos += waitedNanos;
      ResourceManagerMetrics.waitSecondsMetric
          .labels(request.serviceType().getServiceName())
          .observe(waitedNanos / 1e9);
      log.info(
          String.format(
              "gpu granted from queue to %s after %.1fs (id: %s)",
              request.serviceType(), waitedNanos / 1e9, request.shortId()));
      return waiter.lease;
    } finally {
      lock.unlock();
      if (grantedWhileInterrupted != null) {
        release(grantedWhileInterrupted.getId());
      }
    }
  }

  /**
   * @brief Returns the gpu held by a lease.
   * @details Unknown, stale and repeated ids are logged and ignored. The restoration policy runs
   *     and the next waiter is promoted before this returns.
   * @param leaseId The id of the lease to release.
   */
  public void release(@Nullable String leaseId) {
    GpuLease lease;
    lock.lock();
    try {
      if (leaseId == null || currentLease == null || !currentLease.getId().equals(leaseId)) {
        log.warning(String.format("release of a lease that is not active: %s", leaseId));
        return;
      }
      lease = currentLease;
      checkState(lease.markReleased());
      currentLease = null;
      transitioning = true;
      long usageNanos = System.nanoTime() - lease.getAcquiredAtNanos();
      totalUsageNanos += usageNanos;
      ResourceManagerMetrics.usageSecondsMetric
          .labels(lease.getRequest().serviceType().getServiceName())
          .observe(usageNanos / 1e9);
      ResourceManagerMetrics.lockedMetric.set(0);
      log.info(
          String.format(
              "gpu released by %s after %.1fs (id: %s)",
              lease.getRequest().serviceType(), usageNanos / 1e9, lease.getRequest().shortId()));
    } finally {
      lock.unlock();
    }

    try {
      restoreAfter(lease.getRequest().serviceType());
    } catch (RuntimeException e) {
      log.log(WARNING, "error restoring services after release", e);
    }
    promoteReserved();
  }

  private void restoreAfter(ServiceType released) {
    if (released == ServiceType.IMAGE_GENERATION
        && settings.isAlwaysRestoreDefaultAfterSecondary()) {
      log.info(
          String.format(
              "%s released, switching back to %s", released, ServiceType.TEXT_GENERATION));
      if (!switcher.switchTo(ServiceType.TEXT_GENERATION)) {
        log.warning(String.format("could not restore %s", ServiceType.TEXT_GENERATION));
      }
    } else if (released != ServiceType.TEXT_GENERATION) {
      log.info(String.format("%s released, restoring the previous service", released));
      if (!switcher.restorePrevious()) {
        log.warning("could not restore the previous service");
      }
    }
  }

  /** Promotes the next waiter if the gpu is idle. */
  @VisibleForTesting
  void promoteNext() {
    lock.lock();
    try {
      if (!isIdle() || queue.isEmpty()) {
        return;
      }
      transitioning = true;
    } finally {
      lock.unlock();
    }
    promoteReserved();
  }

  // the caller has set transitioning; this clears it
  private void promoteReserved() {
    while (true) {
      Waiter next;
      lock.lock();
      try {
        next = pollLive();
        transitioning = false;
        if (next == null) {
          return;
        }
        admitting = next;
      } finally {
        lock.unlock();
      }

      GpuRequest request = next.request;
      boolean admitted = false;
      try {
        if (awaitService(request.serviceType())) {
          admitted = admit(request);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.log(WARNING, "interrupted while promoting " + request.shortId(), e);
      } catch (RuntimeException e) {
        log.log(SEVERE, "error promoting " + request.shortId(), e);
      }

      lock.lock();
      try {
        admitting = null;
        if (next.abandoned) {
          log.info(String.format("%s gave up while being promoted", request.shortId()));
          transitioning = true;
        } else if (admitted) {
          grant(next);
          next.granted.signal();
          return;
        } else {
          enqueue(next);
          log.fine(
              String.format(
                  "%s could not be promoted yet, returned to the queue", request.shortId()));
          return;
        }
      } finally {
        lock.unlock();
      }
    }
  }

  private boolean awaitService(ServiceType serviceType) throws InterruptedException {
    if (switcher.checkAvailable(serviceType)) {
      return true;
    }
    if (!switcher.isControlPlaneAvailable()) {
      log.warning(String.format("process manager is unavailable, %s stays queued", serviceType));
      return false;
    }
    log.info(String.format("%s is not answering, waiting for it to start", serviceType));
    long deadlineNanos =
        System.nanoTime() + settings.getServiceAvailabilityTimeoutDuration().toNanos();
    long pollMillis = settings.getServicePollIntervalDuration().toMillis();
    while (true) {
      long remainingMillis = (deadlineNanos - System.nanoTime()) / 1_000_000;
      if (remainingMillis <= 0) {
        log.warning(String.format("%s did not become available, it stays queued", serviceType));
        return false;
      }
      MILLISECONDS.sleep(Math.min(pollMillis, remainingMillis));
      if (switcher.checkAvailable(serviceType)) {
        return true;
      }
    }
  }

  /** Switches to the service and checks that its workload fits in memory. */
  private boolean admit(GpuRequest request) throws InterruptedException {
    if (!switcher.switchTo(request.serviceType())) {
      log.warning(
          String.format("could not switch to %s, continuing anyway", request.serviceType()));
    }
    long settleMillis = settings.getVramSettleDelayDuration().toMillis();
    if (settleMillis > 0) {
      MILLISECONDS.sleep(settleMillis);
    }
    return fallbackMode || vram.isAvailable(request.requiredMemoryMb());
  }

  @GuardedBy("lock")
  private boolean isIdle() {
    return currentLease == null && admitting == null && !transitioning;
  }

  @GuardedBy("lock")
  private void enqueue(Waiter waiter) {
    queue.add(waiter);
    ResourceManagerMetrics.queueLengthMetric.set(queue.size());
    log.info(
        String.format(
            "%s queued for %s (position: %d)",
            waiter.request.shortId(), waiter.request.serviceType(), queue.size()));
  }

  @GuardedBy("lock")
  @Nullable
  private Waiter pollLive() {
    Waiter next = queue.poll();
    while (next != null && next.abandoned) {
      next = queue.poll();
    }
    ResourceManagerMetrics.queueLengthMetric.set(queue.size());
    return next;
  }

  @GuardedBy("lock")
  private void grant(Waiter waiter) {
    GpuLease lease = new GpuLease(this, waiter.request);
    waiter.lease = lease;
    currentLease = lease;
    ResourceManagerMetrics.lockedMetric.set(1);
  }

  // a request mid-admission is not in the queue, so it is flagged for the promoter instead
  @GuardedBy("lock")
  private void abandon(Waiter waiter) {
    if (!queue.remove(waiter)) {
      waiter.abandoned = true;
    }
    ResourceManagerMetrics.queueLengthMetric.set(queue.size());
  }

  /** Promotes a waiter if the gpu sits idle and refreshes fallback mode. */
  public void processQueue() {
    refreshFallbackMode();
    promoteNext();
  }

  public boolean isFallbackMode() {
    return fallbackMode;
  }

  public void refreshFallbackMode() {
    boolean unavailable = !vram.getUsage().available();
    if (unavailable && !fallbackMode) {
      log.warning("vram monitoring is unavailable, admitting without memory checks");
    }
    fallbackMode = unavailable;
    ResourceManagerMetrics.fallbackModeMetric.set(unavailable ? 1 : 0);
  }

  /** Starts the periodic queue sweep, unless its interval is zero. */
  public synchronized void start() {
    long intervalMillis = settings.getQueueCheckIntervalDuration().toMillis();
    if (sweeper != null || intervalMillis <= 0) {
      return;
    }
    sweeper =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setDaemon(true).setNameFormat("gpu-queue-sweep-%d").build());
    sweeper.scheduleWithFixedDelay(
        () -> {
          try {
            processQueue();
          } catch (RuntimeException e) {
            log.log(SEVERE, "error sweeping the gpu queue", e);
          }
        },
        intervalMillis,
        intervalMillis,
        MILLISECONDS);
    log.info(String.format("queue sweep started every %dms", intervalMillis));
  }

  public synchronized void stop() throws InterruptedException {
    if (sweeper == null) {
      return;
    }
    sweeper.shutdownNow();
    if (!sweeper.awaitTermination(10, TimeUnit.SECONDS)) {
      log.warning("queue sweep did not terminate");
    }
    sweeper = null;
  }

  public QueueStatus getQueueStatus() {
    UsageSnapshot usage = vram.getUsage();
    lock.lock();
    try {
      List<Waiter> ordered = new ArrayList<>(queue);
      ordered.sort(Comparator.comparing(Waiter::getRequest, GpuRequest.ORDER));
      long now = System.nanoTime();
      ImmutableList.Builder<QueueStatus.Entry> entries = ImmutableList.builder();
      int listed = Math.min(ordered.size(), QueueStatus.MAX_LISTED_ENTRIES);
      for (Waiter waiter : ordered.subList(0, listed)) {
        GpuRequest request = waiter.request;
        entries.add(
            new QueueStatus.Entry(
                request.shortId(),
                request.serviceType(),
                request.priority(),
                request.requesterId(),
                (now - request.createdAtNanos()) / 1e9));
      }
      long served = Math.max(1, totalRequests - totalTimeouts);
      return new QueueStatus(
          currentLease != null,
          Optional.ofNullable(currentLease).map(lease -> lease.getRequest().serviceType()),
          Optional.ofNullable(currentLease).map(GpuLease::getId),
          queue.size(),
          entries.build(),
          usage,
          new QueueStatus.Totals(
              totalRequests,
              totalTimeouts,
              (double) totalTimeouts / Math.max(1, totalRequests),
              totalWaitNanos / 1e9 / served,
              totalUsageNanos / 1e9 / served,
              fallbackMode));
    } finally {
      lock.unlock();
    }
  }
}
