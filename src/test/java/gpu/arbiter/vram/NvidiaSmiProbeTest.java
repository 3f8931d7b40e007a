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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NvidiaSmiProbeTest {
  @Rule public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void parseMemoryReadsFirstDevice() throws Exception {
    MemoryInfo memory = NvidiaSmiProbe.parseMemory("5321, 24576\n100, 8192\n");

    assertThat(memory).isEqualTo(new MemoryInfo(5321, 24576, 19255));
  }

  @Test
  public void parseMemoryRejectsEmptyOutput() {
    assertThrows(IOException.class, () -> NvidiaSmiProbe.parseMemory("\n"));
  }

  @Test
  public void parseMemoryRejectsMalformedOutput() {
    assertThrows(IOException.class, () -> NvidiaSmiProbe.parseMemory("[N/A], [N/A]"));
    assertThrows(IOException.class, () -> NvidiaSmiProbe.parseMemory("5321"));
  }

  @Test
  public void parseProcessesSkipsUnreadableLines() {
    assertThat(
            NvidiaSmiProbe.parseProcesses(
                "1234, /usr/bin/ollama, 5120\n5678, python, [N/A]\nbogus\n91, ComfyUI, 8000\n"))
        .containsExactly(
            new GpuProcess(1234, "/usr/bin/ollama", 5120), new GpuProcess(91, "ComfyUI", 8000))
        .inOrder();
  }

  // Function under test: isSupported
  // Reason for testing: a missing executable leaves the probe unsupported
  // Failure explanation: the probe claimed support without nvidia-smi
  @Test
  public void missingExecutableIsUnsupported() {
    NvidiaSmiProbe probe =
        new NvidiaSmiProbe("/nonexistent/nvidia-smi-for-tests", Duration.ofSeconds(2));

    assertThat(probe.isSupported()).isFalse();
  }

  // Function under test: isSupported
  // Reason for testing: a tool that appears after a failed check is picked up on a later check
  // Failure explanation: the first unsupported answer was kept for good
  @Test
  public void executableInstalledLaterBecomesSupported() throws Exception {
    Path executable = tmp.getRoot().toPath().resolve("nvidia-smi");
    NvidiaSmiProbe probe =
        new NvidiaSmiProbe(executable.toString(), Duration.ofSeconds(2), Duration.ofMillis(1));
    assertThat(probe.isSupported()).isFalse();

    Files.write(executable, "#!/bin/sh\nexit 0\n".getBytes(StandardCharsets.UTF_8));
    assertThat(executable.toFile().setExecutable(true)).isTrue();
    Thread.sleep(20);

    assertThat(probe.isSupported()).isTrue();
  }
}
