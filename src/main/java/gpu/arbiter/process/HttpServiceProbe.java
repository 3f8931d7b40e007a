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

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * @class HttpServiceProbe
 * @brief Considers a service up when its health url answers 200.
 * @details Connection failures and timeouts mean the service is down; they are not errors.
 */
@Log
public class HttpServiceProbe implements ServiceProbe {
  private final String healthUrl;
  private final int timeoutMillis;

  public HttpServiceProbe(String healthUrl, Duration timeout) {
    this.healthUrl = healthUrl;
    this.timeoutMillis = (int) timeout.toMillis();
  }

  @Override
  public boolean isAvailable() {
    HttpURLConnection connection = null;
    try {
      connection = (HttpURLConnection) new URL(healthUrl).openConnection();
      connection.setConnectTimeout(timeoutMillis);
      connection.setReadTimeout(timeoutMillis);
      return connection.getResponseCode() == HttpURLConnection.HTTP_OK;
    } catch (IOException e) {
      log.log(Level.FINE, healthUrl + " is not answering", e);
      return false;
    } finally {
      if (connection != null) {
        connection.disconnect();
      }
    }
  }

  @Override
  public String toString() {
    return healthUrl;
  }
}
