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

import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * @class ResourceManagerMetrics
 * @brief Tracks how the gpu is contended.
 * @details Answers how many requests arrive per service, how long they wait, how long they hold the
 *     gpu, and how many give up waiting.
 */
public class ResourceManagerMetrics {
  public static final Counter requestsMetric =
      Counter.build()
          .name("gpu_requests_total")
          .labelNames("service")
          .help("Gpu acquire requests.")
          .register();

  public static final Counter timeoutsMetric =
      Counter.build()
          .name("gpu_request_timeouts_total")
          .labelNames("service")
          .help("Gpu acquire requests that timed out waiting in the queue.")
          .register();

  public static final Counter unavailableMetric =
      Counter.build()
          .name("gpu_request_unavailable_total")
          .labelNames("service")
          .help("Gpu acquire requests rejected because the service could not be reached.")
          .register();

  public static final Histogram waitSecondsMetric =
      Histogram.build()
          .name("gpu_wait_seconds")
          .labelNames("service")
          .buckets(0.1, 1, 5, 15, 30, 60, 120, 300)
          .help("Time queued requests waited for the gpu.")
          .register();

  public static final Histogram usageSecondsMetric =
      Histogram.build()
          .name("gpu_usage_seconds")
          .labelNames("service")
          .buckets(1, 5, 15, 30, 60, 120, 300, 600)
          .help("Time leases held the gpu.")
          .register();

  public static final Gauge queueLengthMetric =
      Gauge.build().name("gpu_queue_length").help("Requests waiting for the gpu.").register();

  public static final Gauge lockedMetric =
      Gauge.build().name("gpu_locked").help("1 while a lease holds the gpu.").register();

  public static final Gauge fallbackModeMetric =
      Gauge.build()
          .name("gpu_fallback_mode")
          .help("1 while vram telemetry is unavailable and admission ignores it.")
          .register();
}
