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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import gpu.arbiter.common.config.Vram;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/**
 * @class VramMonitor
 * @brief Reports gpu memory usage and predicts whether an allocation fits.
 * @details A read-only probe. When no backend can observe the device the monitor fails open: it
 *     reports the gpu as available so that a missing telemetry dependency never blocks admission.
 */
@Log
public class VramMonitor {
  private static final long PROGRESS_LOG_INTERVAL_MILLIS = 10_000;

  private final Vram settings;
  private final List<VramProbe> probes;

  public VramMonitor(Vram settings, List<VramProbe> probes) {
    this.settings = settings;
    this.probes = ImmutableList.copyOf(probes);
  }

  /** Creates a monitor backed by nvml, falling back to nvidia-smi. */
  public static VramMonitor create(Vram settings) {
    return new VramMonitor(
        settings,
        ImmutableList.of(
            new NvmlProbe(settings.getDeviceIndex()),
            new NvidiaSmiProbe(settings.getNvidiaSmiPath(), settings.getQueryTimeoutDuration())));
  }

  public boolean isEnabled() {
    return settings.isEnabled();
  }

  public UsageSnapshot getUsage() {
    if (!settings.isEnabled()) {
      return UsageSnapshot.disabled();
    }
    for (VramProbe probe : probes) {
      if (!probe.isSupported()) {
        continue;
      }
      try {
        return UsageSnapshot.of(probe.query(), probe.name());
      } catch (IOException | RuntimeException e) {
        log.log(Level.SEVERE, "error reading vram through " + probe.name(), e);
      }
    }
    log.warning("vram monitoring is unavailable");
    return UsageSnapshot.unavailable();
  }

  public List<GpuProcess> getGpuProcesses() {
    if (!settings.isEnabled()) {
      return ImmutableList.of();
    }
    for (VramProbe probe : probes) {
      if (!probe.isSupported()) {
        continue;
      }
      try {
        List<GpuProcess> processes = probe.processes();
        if (!processes.isEmpty()) {
          return processes;
        }
      } catch (IOException | RuntimeException e) {
        log.log(Level.FINE, "error listing gpu processes through " + probe.name(), e);
      }
    }
    return ImmutableList.of();
  }

  /**
   * @brief Whether a new task fits on the gpu right now.
   * @details Unobservable memory counts as available.
   * @param requiredMb Memory the task needs, or null to require the configured minimum.
   * @return False when usage is at or above the threshold or free memory is short.
   */
  public boolean isAvailable(@Nullable Integer requiredMb) {
    if (!settings.isEnabled()) {
      return true;
    }
    UsageSnapshot usage = getUsage();
    if (!usage.available()) {
      log.warning("vram monitoring is unavailable, allowing gpu use");
      return true;
    }
    if (usage.usagePercent() >= settings.getUsageThreshold()) {
      log.warning(
          String.format(
              "vram is saturated: %.1f%% >= %.1f%%",
              usage.usagePercent(), settings.getUsageThreshold()));
      return false;
    }
    long minRequired = requiredMb != null ? requiredMb : settings.getMinFreeMb();
    if (usage.freeMb() < minRequired) {
      log.warning(
          String.format("not enough free vram: %dMB < %dMB", usage.freeMb(), minRequired));
      return false;
    }
    return true;
  }

  /**
   * Polls {@link #isAvailable} until it holds or the timeout passes.
   *
   * @return false on timeout.
   */
  public boolean waitForAvailable(Duration timeout, @Nullable Integer requiredMb)
      throws InterruptedException {
    if (!settings.isEnabled()) {
      return true;
    }
    Stopwatch stopwatch = Stopwatch.createStarted();
    long lastProgressMillis = 0;
    while (true) {
      if (isAvailable(requiredMb)) {
        log.info(
            String.format(
                "vram became available after %.1fs", stopwatch.elapsed(MILLISECONDS) / 1000.0));
        return true;
      }
      long elapsedMillis = stopwatch.elapsed(MILLISECONDS);
      if (elapsedMillis >= timeout.toMillis()) {
        log.warning(String.format("timed out waiting for vram (%ds)", timeout.getSeconds()));
        return false;
      }
      if (elapsedMillis - lastProgressMillis >= PROGRESS_LOG_INTERVAL_MILLIS) {
        lastProgressMillis = elapsedMillis;
        log.info(
            String.format(
                "waiting for vram... (%ds/%ds, usage: %.1f%%)",
                elapsedMillis / 1000, timeout.getSeconds(), getUsage().usagePercent()));
      }
      long remainingMillis = timeout.toMillis() - elapsedMillis;
      MILLISECONDS.sleep(Math.min(settings.getPollIntervalDuration().toMillis(), remainingMillis));
    }
  }
}
