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

import com.google.devtools.common.options.Option;
import com.google.devtools.common.options.OptionsBase;

/** Command-line options definition for the gpu arbiter. */
public class ArbiterOptions extends OptionsBase {
  @Option(
      name = "prometheus_port",
      help = "Port for the prometheus metrics endpoint.",
      defaultValue = "-1")
  public int prometheusPort;

  @Option(
      name = "process_manager_url",
      help = "Base url of the process control plane.",
      defaultValue = "")
  public String processManagerUrl;

  @Option(
      name = "disable_vram_monitor",
      help = "Skip hardware telemetry and admit requests on mutual exclusion alone.",
      defaultValue = "false")
  public boolean disableVramMonitor;
}
