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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import gpu.arbiter.common.ServiceType;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * @class ProcessManagerClientTest
 * @brief tests The control plane client against a mock web server.
 * @details Responses are looked up by request path; unknown paths answer 404.
 */
@RunWith(JUnit4.class)
public class ProcessManagerClientTest {
  private final Map<String, MockResponse> responses = new ConcurrentHashMap<>();
  private MockWebServer server;
  private ProcessManagerClient client;

  @Before
  public void setUp() throws Exception {
    server = new MockWebServer();
    server.setDispatcher(
        new Dispatcher() {
          @Override
          public MockResponse dispatch(RecordedRequest request) {
            MockResponse response = responses.get(request.getRequestUrl().encodedPath());
            if (response == null) {
              return new MockResponse().setResponseCode(404).setBody("{\"detail\":\"Not Found\"}");
            }
            return response;
          }
        });
    server.start();
    respond("/", 200, "{\"status\":\"ok\"}");
    client =
        new ProcessManagerClient(
            server.url("/").toString(), Duration.ofSeconds(5), Duration.ofSeconds(2));
  }

  @After
  public void tearDown() throws IOException {
    server.shutdown();
  }

  private void respond(String path, int status, String body) {
    responses.put(
        path,
        new MockResponse()
            .setResponseCode(status)
            .setHeader("Content-Type", "application/json")
            .setBody(body));
  }

  private String takeRequest() throws InterruptedException {
    RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
    assertThat(request).isNotNull();
    return request.getMethod() + " " + request.getPath();
  }

  @Test
  public void pingReachesRoot() throws Exception {
    assertThat(client.ping()).isTrue();
    assertThat(takeRequest()).isEqualTo("GET /");
    assertThat(server.getRequestCount()).isEqualTo(1);
  }

  // Function under test: ping
  // Reason for testing: an unreachable control plane is reported, not thrown
  // Failure explanation: ping threw or claimed success
  @Test
  public void pingFailsWhenServerIsDown() throws IOException {
    server.shutdown();

    assertThat(client.ping()).isFalse();
  }

  // Function under test: switchService
  // Reason for testing: the switch request and its response are mapped to typed values
  // Failure explanation: the wrong request was sent or the result was misparsed
  @Test
  public void switchServiceSendsServiceName() throws Exception {
    respond(
        "/process/switch",
        200,
        "{\"success\":true,\"message\":\"switched\",\"previous_service\":\"ollama\","
            + "\"current_service\":\"comfyui\",\"switch_time\":1.5}");

    SwitchResult result = client.switchService(ServiceType.IMAGE_GENERATION, true);

    assertThat(takeRequest()).isEqualTo("POST /process/switch?service=comfyui&force_restart=true");
    assertThat(result.success()).isTrue();
    assertThat(result.previousService()).isEqualTo(Optional.of(ServiceType.TEXT_GENERATION));
    assertThat(result.currentService()).isEqualTo(Optional.of(ServiceType.IMAGE_GENERATION));
    assertThat(result.switchTimeMs()).isEqualTo(1500);
  }

  @Test
  public void switchServiceFailsOnHttpError() {
    respond("/process/switch", 500, "{\"detail\":\"ComfyUI failed to start\"}");

    IOException e =
        assertThrows(
            IOException.class, () -> client.switchService(ServiceType.IMAGE_GENERATION, false));

    assertThat(e).hasMessageThat().contains("HTTP 500");
    assertThat(e).hasMessageThat().contains("ComfyUI failed to start");
  }

  @Test
  public void switchServiceFailsWhenControlPlaneReportsFailure() {
    respond("/process/switch", 200, "{\"success\":false,\"message\":\"port busy\"}");

    IOException e =
        assertThrows(
            IOException.class, () -> client.switchService(ServiceType.TEXT_GENERATION, false));

    assertThat(e).hasMessageThat().contains("port busy");
  }

  @Test
  public void malformedResponseIsAnIoError() {
    respond("/process/status", 200, "<html>gateway</html>");

    assertThrows(IOException.class, () -> client.status());
  }

  @Test
  public void statusReportsServices() throws Exception {
    respond(
        "/process/status",
        200,
        "{\"ollama\":{\"running\":true,\"pid\":4242},\"comfyui\":{\"running\":false,\"pid\":null},"
            + "\"current_service\":\"ollama\"}");

    ProcessStatus status = client.status();

    assertThat(status.currentService()).isEqualTo(Optional.of(ServiceType.TEXT_GENERATION));
    assertThat(status.isRunning(ServiceType.TEXT_GENERATION)).isTrue();
    assertThat(status.get(ServiceType.TEXT_GENERATION).pid().getAsLong()).isEqualTo(4242);
    assertThat(status.isRunning(ServiceType.IMAGE_GENERATION)).isFalse();
    assertThat(status.get(ServiceType.IMAGE_GENERATION).pid().isPresent()).isFalse();
    assertThat(status.isRunning(ServiceType.OTHER)).isFalse();
  }

  @Test
  public void stopAndStartPostServiceName() throws Exception {
    respond("/process/stop", 200, "{\"success\":true}");
    respond("/process/start", 200, "{\"success\":true}");

    client.stop(ServiceType.TEXT_GENERATION);
    client.start(ServiceType.IMAGE_GENERATION);

    assertThat(takeRequest()).isEqualTo("POST /process/stop?service=ollama");
    assertThat(takeRequest()).isEqualTo("POST /process/start?service=comfyui");
  }
}
