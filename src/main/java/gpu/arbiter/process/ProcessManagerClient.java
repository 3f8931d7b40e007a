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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import gpu.arbiter.common.ServiceType;
import gpu.arbiter.process.ProcessStatus.ServiceState;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import javax.annotation.Nullable;
import lombok.extern.java.Log;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * @class ProcessManagerClient
 * @brief Client of the control plane that starts and stops the gpu service processes.
 * @details Every response is parsed into a typed result at this boundary. Transport errors,
 *     non-200 statuses and malformed bodies are all reported as IOException.
 */
@Log
public class ProcessManagerClient {
  private final String apiUrl;
  private final Duration requestTimeout;
  private final Duration pingTimeout;

  public ProcessManagerClient(String apiUrl, Duration requestTimeout, Duration pingTimeout) {
    this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
    this.requestTimeout = requestTimeout;
    this.pingTimeout = pingTimeout;
  }

  public String getApiUrl() {
    return apiUrl;
  }

  /** Checks that the control plane answers on its root endpoint. */
  public boolean ping() {
    try {
      request("GET", "/", null, pingTimeout);
      return true;
    } catch (IOException e) {
      log.warning(String.format("process manager at %s is unreachable: %s", apiUrl, e));
      return false;
    }
  }

  public ProcessStatus status() throws IOException {
    return parseStatus(request("GET", "/process/status", null, pingTimeout));
  }

  public SwitchResult switchService(ServiceType serviceType, boolean forceRestart)
      throws IOException {
    String query = "service=" + encode(serviceType.getServiceName());
    if (forceRestart) {
      query += "&force_restart=true";
    }
    return parseSwitchResult(request("POST", "/process/switch", query, requestTimeout));
  }

  public void stop(ServiceType serviceType) throws IOException {
    checkSuccess(
        request(
            "POST",
            "/process/stop",
            "service=" + encode(serviceType.getServiceName()),
            requestTimeout));
  }

  public void start(ServiceType serviceType) throws IOException {
    checkSuccess(
        request(
            "POST",
            "/process/start",
            "service=" + encode(serviceType.getServiceName()),
            requestTimeout));
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private JSONObject request(String method, String path, @Nullable String query, Duration timeout)
      throws IOException {
    URL url = new URL(apiUrl + path + (query == null ? "" : "?" + query));
    HttpURLConnection connection = (HttpURLConnection) url.openConnection();
    try {
      connection.setRequestMethod(method);
      connection.setConnectTimeout((int) timeout.toMillis());
      connection.setReadTimeout((int) timeout.toMillis());
      connection.setRequestProperty("Accept", "application/json");
      if (method.equals("POST")) {
        connection.setDoOutput(true);
        connection.setFixedLengthStreamingMode(0);
      }
      int status = connection.getResponseCode();
      if (status != HttpURLConnection.HTTP_OK) {
        String message = readError(connection);
        throw new IOException(
            String.format("%s %s failed with HTTP %d: %s", method, path, status, message));
      }
      String body;
      try (InputStream in = connection.getInputStream()) {
        body = new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8);
      }
      return parseObject(body);
    } finally {
      connection.disconnect();
    }
  }

  private static String readError(HttpURLConnection connection) {
    try (InputStream in = connection.getErrorStream()) {
      if (in == null) {
        return connection.getResponseMessage();
      }
      return new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8);
    } catch (IOException e) {
      return e.getMessage();
    }
  }

  @VisibleForTesting
  static JSONObject parseObject(String body) throws IOException {
    Object parsed;
    try {
      parsed = new JSONParser().parse(body);
    } catch (ParseException e) {
      throw new IOException("malformed process manager response: " + body, e);
    }
    if (!(parsed instanceof JSONObject)) {
      throw new IOException("expected a json object from the process manager: " + body);
    }
    return (JSONObject) parsed;
  }

  private static void checkSuccess(JSONObject response) throws IOException {
    Object success = response.get("success");
    if (success instanceof Boolean && !(Boolean) success) {
      throw new IOException("process manager reported failure: " + response.get("message"));
    }
  }

  @VisibleForTesting
  static SwitchResult parseSwitchResult(JSONObject response) throws IOException {
    checkSuccess(response);
    Object switchTime = response.get("switch_time");
    long switchTimeMs =
        switchTime instanceof Number ? (long) (((Number) switchTime).doubleValue() * 1000) : 0;
    return new SwitchResult(
        !Boolean.FALSE.equals(response.get("success")),
        stringOrEmpty(response.get("message")),
        serviceOf(response.get("previous_service")),
        serviceOf(response.get("current_service")),
        switchTimeMs);
  }

  @VisibleForTesting
  static ProcessStatus parseStatus(JSONObject response) {
    ImmutableMap.Builder<ServiceType, ServiceState> services = ImmutableMap.builder();
    for (ServiceType serviceType : ServiceType.values()) {
      Object state = response.get(serviceType.getServiceName());
      if (state instanceof Map) {
        services.put(serviceType, parseState((Map<?, ?>) state));
      }
    }
    return new ProcessStatus(services.build(), serviceOf(response.get("current_service")));
  }

  private static ServiceState parseState(Map<?, ?> state) {
    boolean running = Boolean.TRUE.equals(state.get("running"));
    Object pid = state.get("pid");
    return new ServiceState(
        running,
        pid instanceof Number ? OptionalLong.of(((Number) pid).longValue()) : OptionalLong.empty());
  }

  private static Optional<ServiceType> serviceOf(Object value) {
    return value instanceof String ? ServiceType.fromName((String) value) : Optional.empty();
  }

  private static String stringOrEmpty(Object value) {
    return value == null ? "" : value.toString();
  }
}
