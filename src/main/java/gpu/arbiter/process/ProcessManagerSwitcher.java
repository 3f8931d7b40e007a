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

package gpu.arbiter.process;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.INFO;
import static java.util.logging.Level.SEVERE;
import static java.util.logging.Level.WARNING;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import gpu.arbiter.common.Retrier;
import gpu.arbiter.common.ServiceType;
import gpu.arbiter.common.config.ProcessManager;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import lombok.extern.java.Log;

/**
 * @class ProcessManagerSwitcher
 * @brief Switches gpu services through the process control plane.
 * @details Control plane calls are retried with exponential backoff. When the control plane cannot
 *     be reached, or a switch finally fails, the target service is probed directly and adopted if
 *     it answers; a service may still be usable even though the explicit switch signal was lost.
 */
@Log
public class ProcessManagerSwitcher implements ProcessSwitcher {
  private final ProcessManager settings;
  @Nullable private final ProcessManagerClient client;
  private final Map<ServiceType, ServiceProbe> probes;
  private final Retrier retrier;

  @GuardedBy("this")
  private ServiceType currentService = null;

  @GuardedBy("this")
  private ServiceType previousService = null;

  // what the control plane ran before we first switched it, restored on release
  @GuardedBy("this")
  private ServiceType serviceBeforeRequest = null;

  public ProcessManagerSwitcher(
      ProcessManager settings,
      @Nullable ProcessManagerClient client,
      Map<ServiceType, ServiceProbe> probes,
      Retrier retrier) {
    this.settings = settings;
    this.client = client;
    this.probes = ImmutableMap.copyOf(probes);
    this.retrier = retrier;
  }

  public static ProcessManagerSwitcher create(ProcessManager settings) {
    ProcessManagerClient client = null;
    if (settings.isEnabled()) {
      client =
          new ProcessManagerClient(
              settings.getApiUrl(),
              settings.getSwitchTimeoutDuration(),
              settings.getPingTimeoutDuration());
      log.info("process manager api configured: " + settings.getApiUrl());
    } else {
      log.warning("process manager api url is not set, process switching is disabled");
    }
    Duration healthCheckTimeout = settings.getHealthCheckTimeoutDuration();
    return new ProcessManagerSwitcher(
        settings,
        client,
        ImmutableMap.of(
            ServiceType.TEXT_GENERATION,
            new HttpServiceProbe(settings.getTextGeneration().getHealthUrl(), healthCheckTimeout),
            ServiceType.IMAGE_GENERATION,
            new HttpServiceProbe(settings.getImageGeneration().getHealthUrl(), healthCheckTimeout)),
        settings.createRetrier());
  }

  @Override
  public boolean isControlPlaneAvailable() {
    return client != null && client.ping();
  }

  @Override
  public boolean checkAvailable(ServiceType serviceType) {
    ServiceProbe probe = probes.get(serviceType);
    return probe != null && probe.isAvailable();
  }

  @Override
  public synchronized boolean switchTo(ServiceType serviceType, boolean forceRestart) {
    if (!isControlPlaneAvailable()) {
      log.warning(
          String.format(
              "process manager is unavailable, probing %s directly instead of switching",
              serviceType));
      return checkAvailable(serviceType);
    }

    if (serviceBeforeRequest == null) {
      serviceBeforeRequest = getCurrentService().orElse(null);
    }

    if (currentService == serviceType && !forceRestart) {
      if (checkAvailable(serviceType) || probes.get(serviceType) == null) {
        log.log(FINE, String.format("already switched to %s", serviceType));
        return true;
      }
      log.warning(String.format("%s is active but not answering, switching again", serviceType));
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    log.info(
        String.format(
            "switching to %s%s", serviceType, forceRestart ? " (forced restart)" : ""));
    try {
      SwitchResult result = retrier.execute(() -> client.switchService(serviceType, forceRestart));
      log.info(
          String.format(
              "switched to %s in %dms (control plane reported %dms)",
              serviceType, stopwatch.elapsed(MILLISECONDS), result.switchTimeMs()));
      previousService = currentService;
      currentService = serviceType;
      if (!waitForReady(serviceType, settings.getStartupWaitDuration())) {
        // the service may still be initializing, the switch itself succeeded
        log.warning(String.format("%s switched but not ready after waiting", serviceType));
      }
      return true;
    } catch (IOException e) {
      log.log(SEVERE, String.format("error switching to %s", serviceType), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.log(WARNING, String.format("interrupted while switching to %s", serviceType), e);
      return false;
    }

    if (checkAvailable(serviceType)) {
      log.info(String.format("%s is available anyway, using it", serviceType));
      currentService = serviceType;
      return true;
    }
    return false;
  }

  private boolean waitForReady(ServiceType serviceType, Duration maxWait)
      throws InterruptedException {
    if (probes.get(serviceType) == null) {
      return true;
    }
    Stopwatch stopwatch = Stopwatch.createStarted();
    long intervalMillis = settings.getHealthPollIntervalDuration().toMillis();
    while (true) {
      if (checkAvailable(serviceType)) {
        log.info(
            String.format(
                "%s ready (waited %.1fs)", serviceType, stopwatch.elapsed(MILLISECONDS) / 1000.0));
        return true;
      }
      long remainingMillis = maxWait.toMillis() - stopwatch.elapsed(MILLISECONDS);
      if (remainingMillis <= 0) {
        log.warning(String.format("timed out waiting for %s to become ready", serviceType));
        return false;
      }
      MILLISECONDS.sleep(Math.min(intervalMillis, remainingMillis));
    }
  }

  @Override
  public synchronized boolean stop(ServiceType serviceType) {
    if (client == null) {
      log.warning(String.format("process manager is not configured, cannot stop %s", serviceType));
      return false;
    }
    try {
      retrier.execute(
          () -> {
            client.stop(serviceType);
            return null;
          });
      log.info(String.format("stopped %s", serviceType));
      if (currentService == serviceType) {
        currentService = null;
      }
      return true;
    } catch (IOException e) {
      log.log(SEVERE, String.format("error stopping %s", serviceType), e);
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public synchronized boolean restorePrevious() {
    if (!settings.isRestoreOnRelease() || serviceBeforeRequest == null) {
      return true;
    }
    if (currentService == serviceBeforeRequest) {
      serviceBeforeRequest = null;
      return true;
    }

    ServiceType restore = serviceBeforeRequest;
    log.log(INFO, String.format("restoring previous service %s", restore));
    if (switchTo(restore, /* forceRestart= */ false)) {
      serviceBeforeRequest = null;
      return true;
    }
    log.warning(String.format("could not restore %s", restore));
    return false;
  }

  @Override
  public Optional<ServiceType> getCurrentService() {
    return getStatus().flatMap(ProcessStatus::currentService);
  }

  @Override
  public Optional<ProcessStatus> getStatus() {
    if (client == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(client.status());
    } catch (IOException e) {
      log.log(SEVERE, "error reading process status", e);
      return Optional.empty();
    }
  }

  /** The service this switcher last activated, without asking the control plane. */
  public synchronized Optional<ServiceType> getActiveService() {
    return Optional.ofNullable(currentService);
  }

  public synchronized Optional<ServiceType> getPreviousService() {
    return Optional.ofNullable(previousService);
  }
}
