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

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.List;

/**
 * @class VramProbe
 * @brief A hardware query mechanism for gpu memory.
 * @details Probes are asked in order; an unsupported probe is never queried.
 */
public interface VramProbe {
  String name();

  boolean isSupported();

  MemoryInfo query() throws IOException;

  /** Compute processes on the device, when the backend can list them. */
  default List<GpuProcess> processes() throws IOException {
    return ImmutableList.of();
  }
}
