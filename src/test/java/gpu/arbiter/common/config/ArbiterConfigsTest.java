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

package gpu.arbiter.common.config;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import gpu.arbiter.common.Retrier;
import gpu.arbiter.common.ServiceType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ArbiterConfigsTest {
  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private Path write(String name, String content) throws IOException {
    Path path = tempFolder.getRoot().toPath().resolve(name);
    Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    return path;
  }

  // Function under test: loadConfigs
  // Reason for testing: settings missing from the file keep their defaults
  // Failure explanation: a partial file reset or misread the sections
  @Test
  public void loadConfigsKeepsDefaults() throws IOException {
    Path configFile =
        write(
            "partial.yml",
            "gpu:\n"
                + "  waitTimeout: 120\n"
                + "  vramSettleDelay: 0.5\n"
                + "processManager:\n"
                + "  apiUrl: http://10.0.0.2:8000\n"
                + "vram:\n"
                + "  enabled: false\n");

    ArbiterConfigs configs = ArbiterConfigs.loadConfigs(configFile);

    assertThat(configs.getGpu().getWaitTimeoutDuration()).isEqualTo(Duration.ofSeconds(120));
    assertThat(configs.getGpu().getVramSettleDelayDuration()).isEqualTo(Duration.ofMillis(500));
    assertThat(configs.getGpu().getPriority(ServiceType.IMAGE_GENERATION)).isEqualTo(10);
    assertThat(configs.getProcessManager().isEnabled()).isTrue();
    assertThat(configs.getProcessManager().getTextGeneration().getHealthUrl())
        .isEqualTo("http://127.0.0.1:11434/api/tags");
    assertThat(configs.getVram().isEnabled()).isFalse();
    assertThat(configs.getVram().getMinFreeMb()).isEqualTo(2048);
    assertThat(configs.getPrometheusPort()).isEqualTo(9090);
  }

  @Test
  public void loadConfigsReadsBundledDefaults() throws Exception {
    Path bundled = Path.of(getClass().getResource("/config.minimal.yml").toURI());

    ArbiterConfigs configs = ArbiterConfigs.loadConfigs(bundled);

    Gpu gpu = configs.getGpu();
    assertThat(gpu.getPriority(ServiceType.TEXT_GENERATION)).isEqualTo(5);
    assertThat(gpu.getPriority(ServiceType.OTHER)).isEqualTo(1);
    assertThat(gpu.getLightRequestTimeoutDuration()).isEqualTo(Duration.ofSeconds(60));
    assertThat(gpu.getHeavyRequestTimeoutDuration()).isEqualTo(Duration.ofSeconds(120));
    assertThat(gpu.isAlwaysRestoreDefaultAfterSecondary()).isTrue();
    assertThat(configs.getProcessManager().getImageGeneration().getHealthUrl())
        .isEqualTo("http://127.0.0.1:8188/system_stats");
    assertThat(configs.getVram().getUsageThreshold()).isWithin(1e-9).of(90.0);
  }

  @Test
  public void loadConfigsRejectsEmptyFile() throws IOException {
    Path configFile = write("empty.yml", "");

    assertThrows(RuntimeException.class, () -> ArbiterConfigs.loadConfigs(configFile));
  }

  @Test
  public void loadConfigsRejectsUnknownSettings() throws IOException {
    Path configFile = write("unknown.yml", "gpu:\n  preemptible: true\n");

    assertThrows(RuntimeException.class, () -> ArbiterConfigs.loadConfigs(configFile));
  }

  @Test
  public void loadConfigsRejectsMissingFile() {
    Path missing = tempFolder.getRoot().toPath().resolve("missing.yml");

    assertThrows(NoSuchFileException.class, () -> ArbiterConfigs.loadConfigs(missing));
  }

  // Function under test: adjustConfigs
  // Reason for testing: the environment overrides service locations
  // Failure explanation: an environment override was ignored
  @Test
  public void adjustConfigsAppliesEnvironment() {
    ArbiterConfigs configs = new ArbiterConfigs();
    Map<String, String> env =
        ImmutableMap.of(
            "PROCESS_MANAGER_API_URL", "http://pm:8000",
            "OLLAMA_URL", "http://ollama:11434",
            "COMFYUI_URL", "http://comfyui:8188");

    ArbiterConfigs.adjustConfigs(configs, env::get);

    ProcessManager processManager = configs.getProcessManager();
    assertThat(processManager.getApiUrl()).isEqualTo("http://pm:8000");
    assertThat(processManager.getTextGeneration().getHealthUrl())
        .isEqualTo("http://ollama:11434/api/tags");
    assertThat(processManager.getImageGeneration().getHealthUrl())
        .isEqualTo("http://comfyui:8188/system_stats");
  }

  @Test
  public void adjustConfigsIgnoresEmptyEnvironment() {
    ArbiterConfigs configs = new ArbiterConfigs();

    ArbiterConfigs.adjustConfigs(configs, ImmutableMap.of("OLLAMA_URL", "")::get);

    assertThat(configs.getProcessManager().isEnabled()).isFalse();
    assertThat(configs.getProcessManager().getTextGeneration().getUrl())
        .isEqualTo("http://127.0.0.1:11434");
  }

  @Test
  public void createRetrierWithoutAttemptsNeverRetries() {
    ProcessManager processManager = new ProcessManager();
    processManager.setRetryAttempts(0);

    assertThat(processManager.createRetrier()).isSameInstanceAs(Retrier.NO_RETRIES);
  }
}
