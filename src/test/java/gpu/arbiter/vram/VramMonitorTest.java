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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import gpu.arbiter.common.config.Vram;
import java.io.IOException;
import java.time.Duration;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * @class VramMonitorTest
 * @brief tests Gpu memory usage reporting and the admission prediction built on it.
 * @details Hardware backends are mocked.
 */
@RunWith(JUnit4.class)
public class VramMonitorTest {
  private Vram settings;
  private VramProbe nvml;
  private VramProbe smi;

  @Before
  public void setUp() {
    settings = new Vram();
    settings.setPollInterval(0.01);
    nvml = mock(VramProbe.class);
    when(nvml.name()).thenReturn("nvml");
    smi = mock(VramProbe.class);
    when(smi.name()).thenReturn("nvidia-smi");
  }

  private VramMonitor newMonitor() {
    return new VramMonitor(settings, ImmutableList.of(nvml, smi));
  }

  // Function under test: getUsage
  // Reason for testing: disabled monitoring reports zeros and never touches hardware
  // Failure explanation: a backend was queried or the snapshot was not marked disabled
  @Test
  public void getUsageWhenDisabled() throws Exception {
    settings.setEnabled(false);

    UsageSnapshot usage = newMonitor().getUsage();

    assertThat(usage.available()).isTrue();
    assertThat(usage.method()).isEqualTo(UsageSnapshot.METHOD_DISABLED);
    assertThat(usage.totalMb()).isEqualTo(0);
    verify(nvml, never()).query();
    assertThat(newMonitor().isAvailable(100_000)).isTrue();
  }

  // Function under test: getUsage
  // Reason for testing: the first supported backend is used
  // Failure explanation: an unsupported backend was queried
  @Test
  public void getUsageSkipsUnsupportedBackends() throws Exception {
    when(nvml.isSupported()).thenReturn(false);
    when(smi.isSupported()).thenReturn(true);
    when(smi.query()).thenReturn(MemoryInfo.ofUsedAndTotal(6000, 24000));

    UsageSnapshot usage = newMonitor().getUsage();

    assertThat(usage.method()).isEqualTo("nvidia-smi");
    assertThat(usage.freeMb()).isEqualTo(18000);
    assertThat(usage.usagePercent()).isWithin(1e-9).of(25.0);
    verify(nvml, never()).query();
  }

  // Function under test: getUsage
  // Reason for testing: a failing backend falls through to the next one
  // Failure explanation: an io error was not tolerated
  @Test
  public void getUsageFallsThroughFailingBackend() throws Exception {
    when(nvml.isSupported()).thenReturn(true);
    when(nvml.query()).thenThrow(new IOException("NVML_ERROR_GPU_IS_LOST"));
    when(smi.isSupported()).thenReturn(true);
    when(smi.query()).thenReturn(MemoryInfo.ofUsedAndTotal(1000, 8000));

    assertThat(newMonitor().getUsage().method()).isEqualTo("nvidia-smi");
  }

  // Function under test: isAvailable
  // Reason for testing: unobservable memory counts as available
  // Failure explanation: missing telemetry blocked admission
  @Test
  public void isAvailableFailsOpenWithoutTelemetry() {
    when(nvml.isSupported()).thenReturn(false);
    when(smi.isSupported()).thenReturn(false);
    VramMonitor monitor = newMonitor();

    assertThat(monitor.getUsage().available()).isFalse();
    assertThat(monitor.getUsage().method()).isEqualTo(UsageSnapshot.METHOD_UNAVAILABLE);
    assertThat(monitor.isAvailable(8192)).isTrue();
    assertThat(monitor.getGpuProcesses()).isEmpty();
  }

  // Function under test: isAvailable
  // Reason for testing: usage at the threshold blocks admission
  // Failure explanation: a saturated gpu was reported available
  @Test
  public void isAvailableFalseWhenSaturated() throws Exception {
    when(nvml.isSupported()).thenReturn(true);
    when(nvml.query()).thenReturn(MemoryInfo.ofUsedAndTotal(22000, 24000));

    assertThat(newMonitor().isAvailable(1)).isFalse();
  }

  // Function under test: isAvailable
  // Reason for testing: free memory is compared to the request, or to the configured minimum
  // Failure explanation: the wrong memory requirement was applied
  @Test
  public void isAvailableComparesFreeMemory() throws Exception {
    when(nvml.isSupported()).thenReturn(true);
    when(nvml.query()).thenReturn(MemoryInfo.ofUsedAndTotal(10000, 12000));
    VramMonitor monitor = newMonitor();

    assertThat(monitor.isAvailable(null)).isFalse();
    assertThat(monitor.isAvailable(1024)).isTrue();
    assertThat(monitor.isAvailable(4096)).isFalse();
  }

  // Function under test: waitForAvailable
  // Reason for testing: polling stops as soon as memory frees
  // Failure explanation: the wait did not observe the freed memory
  @Test
  public void waitForAvailableReturnsOnceFree() throws Exception {
    when(nvml.isSupported()).thenReturn(true);
    when(nvml.query())
        .thenReturn(MemoryInfo.ofUsedAndTotal(23000, 24000))
        .thenReturn(MemoryInfo.ofUsedAndTotal(23000, 24000))
        .thenReturn(MemoryInfo.ofUsedAndTotal(2000, 24000));

    assertThat(newMonitor().waitForAvailable(Duration.ofSeconds(10), null)).isTrue();
  }

  // Function under test: waitForAvailable
  // Reason for testing: the wait is bounded
  // Failure explanation: the wait did not report the timeout
  @Test
  public void waitForAvailableTimesOut() throws Exception {
    when(nvml.isSupported()).thenReturn(true);
    when(nvml.query()).thenReturn(MemoryInfo.ofUsedAndTotal(23000, 24000));

    assertThat(newMonitor().waitForAvailable(Duration.ofMillis(50), null)).isFalse();
  }

  @Test
  public void getGpuProcessesUsesFirstBackendThatListsThem() throws Exception {
    when(nvml.isSupported()).thenReturn(true);
    when(smi.isSupported()).thenReturn(true);
    when(nvml.processes()).thenReturn(ImmutableList.of());
    when(smi.processes()).thenReturn(ImmutableList.of(new GpuProcess(4242, "ollama", 5120)));

    assertThat(newMonitor().getGpuProcesses())
        .containsExactly(new GpuProcess(4242, "ollama", 5120));
  }
}
