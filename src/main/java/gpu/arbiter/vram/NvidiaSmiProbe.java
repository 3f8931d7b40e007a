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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import gpu.arbiter.common.ProcessUtils;
import gpu.arbiter.common.ProcessUtils.CommandOutput;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * @class NvidiaSmiProbe
 * @brief Reads gpu memory through the nvidia-smi command line tool.
 * @details Only the first line of output is used, which is the device at index 0. A failed
 *     availability check is repeated after the recheck interval, a successful one is kept.
 */
@Log
public class NvidiaSmiProbe implements VramProbe {
  private static final Splitter CSV = Splitter.on(',').trimResults();
  private static final Splitter LINES = Splitter.on('\n').trimResults().omitEmptyStrings();

  private static final Duration DEFAULT_RECHECK_INTERVAL = Duration.ofMinutes(1);

  private final String executable;
  private final Duration timeout;
  private final Supplier<Boolean> versionCheck;
  private volatile boolean supported = false;

  public NvidiaSmiProbe(String executable, Duration timeout) {
    this(executable, timeout, DEFAULT_RECHECK_INTERVAL);
  }

  public NvidiaSmiProbe(String executable, Duration timeout, Duration recheckInterval) {
    this.executable = executable;
    this.timeout = timeout;
    this.versionCheck =
        Suppliers.memoizeWithExpiration(
            this::checkVersion, recheckInterval.toMillis(), MILLISECONDS);
  }

  @Override
  public String name() {
    return "nvidia-smi";
  }

  @Override
  public boolean isSupported() {
    if (!supported) {
      supported = versionCheck.get();
    }
    return supported;
  }

  private boolean checkVersion() {
    try {
      if (ProcessUtils.run(ImmutableList.of(executable, "--version"), timeout).succeeded()) {
        log.info("nvidia-smi is available for vram monitoring");
        return true;
      }
    } catch (IOException e) {
      log.log(Level.FINE, "nvidia-smi could not be run", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.warning("nvidia-smi is unavailable, vram monitoring will be limited");
    return false;
  }

  @Override
  public MemoryInfo query() throws IOException {
    return parseMemory(
        runQuery("--query-gpu=memory.used,memory.total", "--format=csv,noheader,nounits"));
  }

  @Override
  public List<GpuProcess> processes() throws IOException {
    return parseProcesses(
        runQuery(
            "--query-compute-apps=pid,process_name,used_memory", "--format=csv,noheader,nounits"));
  }

  private String runQuery(String query, String format) throws IOException {
    CommandOutput output;
    try {
      output = ProcessUtils.run(ImmutableList.of(executable, query, format), timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while running nvidia-smi", e);
    }
    if (!output.succeeded()) {
      throw new IOException("nvidia-smi exited with " + output.exitCode());
    }
    return output.stdout();
  }

  @VisibleForTesting
  static MemoryInfo parseMemory(String stdout) throws IOException {
    List<String> lines = LINES.splitToList(stdout);
    if (lines.isEmpty()) {
      throw new IOException("nvidia-smi reported no devices");
    }
    List<String> parts = CSV.splitToList(lines.get(0));
    if (parts.size() < 2) {
      throw new IOException("unexpected nvidia-smi output: " + lines.get(0));
    }
    try {
      return MemoryInfo.ofUsedAndTotal(Long.parseLong(parts.get(0)), Long.parseLong(parts.get(1)));
    } catch (NumberFormatException e) {
      throw new IOException("unexpected nvidia-smi output: " + lines.get(0), e);
    }
  }

  @VisibleForTesting
  static List<GpuProcess> parseProcesses(String stdout) {
    ImmutableList.Builder<GpuProcess> processes = ImmutableList.builder();
    for (String line : LINES.split(stdout)) {
      List<String> parts = CSV.splitToList(line);
      if (parts.size() < 3) {
        continue;
      }
      try {
        processes.add(
            new GpuProcess(
                Long.parseLong(parts.get(0)), parts.get(1), Long.parseLong(parts.get(2))));
      } catch (NumberFormatException e) {
        // "[N/A]" memory on some drivers
        log.log(Level.FINE, "skipping gpu process line: " + line);
      }
    }
    return processes.build();
  }
}
