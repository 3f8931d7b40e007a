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

package gpu.arbiter.server;

import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

import gpu.arbiter.common.config.ArbiterConfigs;
import gpu.arbiter.metrics.prometheus.PrometheusPublisher;
import gpu.arbiter.process.ProcessManagerSwitcher;
import gpu.arbiter.process.ProcessSwitcher;
import gpu.arbiter.resources.QueueStatus;
import gpu.arbiter.resources.ResourceManager;
import gpu.arbiter.vram.UsageSnapshot;
import gpu.arbiter.vram.VramMonitor;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.naming.ConfigurationException;
import lombok.extern.java.Log;

/**
 * @class GpuArbiter
 * @brief Owns the single resource manager of this process.
 * @details Callers in the same jvm obtain the manager through {@link #getResourceManager} and
 *     acquire leases from it. The arbiter runs until the jvm shuts down.
 */
@Log
public class GpuArbiter {
  private final ArbiterConfigs configs;
  private final VramMonitor vramMonitor;
  private final ProcessSwitcher switcher;
  private final ResourceManager resourceManager;
  private final AtomicBoolean released = new AtomicBoolean(false);

  public GpuArbiter(ArbiterConfigs configs) {
    this(
        configs,
        VramMonitor.create(configs.getVram()),
        ProcessManagerSwitcher.create(configs.getProcessManager()));
  }

  GpuArbiter(ArbiterConfigs configs, VramMonitor vramMonitor, ProcessSwitcher switcher) {
    this.configs = configs;
    this.vramMonitor = vramMonitor;
    this.switcher = switcher;
    resourceManager = new ResourceManager(configs.getGpu(), switcher, vramMonitor);
  }

  public ResourceManager getResourceManager() {
    return resourceManager;
  }

  public void start() {
    UsageSnapshot usage = vramMonitor.getUsage();
    log.info(
        String.format(
            "vram: %dMB used of %dMB (%.1f%%) via %s",
            usage.usedMb(), usage.totalMb(), usage.usagePercent(), usage.method()));
    if (switcher.isControlPlaneAvailable()) {
      log.info(
          "active gpu service: "
              + switcher.getCurrentService().map(Object::toString).orElse("none"));
    } else {
      log.warning("process manager is not reachable, services will be probed directly");
    }
    PrometheusPublisher.startHttpServer(configs.getPrometheusPort());
    resourceManager.start();
    log.info("gpu arbiter started");
  }

  private synchronized void awaitRelease() throws InterruptedException {
    while (!released.get()) {
      wait();
    }
  }

  public synchronized void stop() throws InterruptedException {
    try {
      shutdown();
    } finally {
      released.set(true);
      notify();
    }
  }

  private void shutdown() throws InterruptedException {
    log.info("*** shutting down gpu arbiter since JVM is shutting down");
    QueueStatus status = resourceManager.getQueueStatus();
    if (status.locked() || status.queueLength() > 0) {
      log.warning(
          String.format(
              "shutting down with the gpu %s and %d queued requests",
              status.locked() ? "leased" : "idle", status.queueLength()));
    }
    try {
      resourceManager.stop();
    } finally {
      PrometheusPublisher.stopHttpServer();
    }
    log.info("*** gpu arbiter shut down");
  }

  public static void main(String[] args) throws Exception {
    ArbiterConfigs configs;
    try {
      configs = ArbiterConfigs.loadArbiterConfigs(args);
    } catch (ConfigurationException e) {
      log.log(SEVERE, "invalid configuration", e);
      return;
    }
    GpuArbiter arbiter = new GpuArbiter(configs);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  try {
                    arbiter.stop();
                  } catch (InterruptedException e) {
                    log.log(WARNING, "interrupted while stopping", e);
                  }
                },
                "gpu-arbiter-shutdown"));
    try {
      arbiter.start();
      arbiter.awaitRelease();
    } catch (InterruptedException e) {
      log.log(WARNING, "interrupted", e);
    } catch (Exception e) {
      log.log(SEVERE, "Error running application", e);
    }
  }
}
