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

package gpu.arbiter.metrics.prometheus;

import io.prometheus.client.exporter.HTTPServer;
import io.prometheus.client.hotspot.DefaultExports;
import java.io.IOException;
import java.util.logging.Level;
import lombok.extern.java.Log;

/** Serves the arbiter's metrics registry over http for scraping. */
@Log
public class PrometheusPublisher {
  private static HTTPServer server;

  public static synchronized boolean startHttpServer(int port) {
    if (port <= 0) {
      log.info("prometheus port is not configured, metrics will not be served");
      return false;
    }
    if (server != null) {
      log.warning("prometheus http server is already running");
      return false;
    }
    try {
      DefaultExports.initialize();
      server = new HTTPServer(port);
      log.info("started prometheus http server on port " + port);
      return true;
    } catch (IOException e) {
      log.log(Level.SEVERE, "could not start prometheus http server on port " + port, e);
      return false;
    }
  }

  public static synchronized void stopHttpServer() {
    if (server != null) {
      server.close();
      server = null;
    }
  }
}
