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

package gpu.arbiter.common;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeoutException;

/**
 * @class ProcessUtils
 * @brief Utilities for running short-lived helper commands.
 * @details Used for hardware query tools whose output is read in full and whose runtime is bounded.
 */
public class ProcessUtils {
  /** Result of a command that ran to completion. */
  public record CommandOutput(int exitCode, String stdout) {
    public boolean succeeded() {
      return exitCode == 0;
    }
  }

  // Forks are serialized, see JavaSubprocessFactory in bazel for the ETXTBSY race this avoids.
  public static synchronized Process threadSafeStart(ProcessBuilder builder) throws IOException {
    return builder.start();
  }

  /**
   * @brief Run a command and collect its standard output.
   * @details Standard error is discarded. The process is destroyed if it does not exit within the
   *     timeout.
   * @param command The program and its arguments.
   * @param timeout Upper bound on the runtime of the command.
   * @return The exit code and standard output of the command.
   */
  public static CommandOutput run(ImmutableList<String> command, Duration timeout)
      throws IOException, InterruptedException {
    ProcessBuilder builder =
        new ProcessBuilder(command).redirectError(ProcessBuilder.Redirect.DISCARD);
    Process process = threadSafeStart(builder);
    long deadlineNanos = System.nanoTime() + timeout.toNanos();
    try {
      // stdout is drained while the command runs so a full pipe cannot stall it
      FutureTask<byte[]> stdout =
          new FutureTask<>(
              () -> {
                try (InputStream in = process.getInputStream()) {
                  return ByteStreams.toByteArray(in);
                }
              });
      Thread reader = new Thread(stdout, command.get(0) + "-stdout");
      reader.setDaemon(true);
      reader.start();
      if (!process.waitFor(timeout.toNanos(), NANOSECONDS)) {
        throw new IOException(
            String.format("%s did not exit within %dms", command.get(0), timeout.toMillis()));
      }
      byte[] output;
      try {
        output = stdout.get(Math.max(0, deadlineNanos - System.nanoTime()), NANOSECONDS);
      } catch (ExecutionException e) {
        Throwables.throwIfInstanceOf(e.getCause(), IOException.class);
        throw new IOException("error reading the output of " + command.get(0), e.getCause());
      } catch (TimeoutException e) {
        throw new IOException(
            String.format(
                "%s did not close its output within %dms", command.get(0), timeout.toMillis()),
            e);
      }
      return new CommandOutput(process.exitValue(), new String(output, StandardCharsets.UTF_8));
    } finally {
      process.destroyForcibly();
    }
  }
}
