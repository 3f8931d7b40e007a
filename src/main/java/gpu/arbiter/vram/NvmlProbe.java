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

import static java.util.concurrent.TimeUnit.MINUTES;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.io.IOException;
import java.util.Optional;
import java.util.logging.Level;
import jnr.ffi.LibraryLoader;
import jnr.ffi.byref.PointerByReference;
import lombok.extern.java.Log;

/**
 * @class NvmlProbe
 * @brief Reads gpu memory directly from the nvidia management library.
 * @details The library is loaded and initialized once it succeeds. Hosts without the driver
 *     report the probe as unsupported and retry initialization every minute, so a driver that
 *     comes up late is picked up.
 */
@Log
public class NvmlProbe implements VramProbe {
  private static final long BYTES_PER_MB = 1024 * 1024;

  private final int deviceIndex;
  private final Supplier<Optional<Nvml>> loader =
      Suppliers.memoizeWithExpiration(NvmlProbe::initialize, 1, MINUTES);
  private volatile Nvml nvml;

  public NvmlProbe(int deviceIndex) {
    this.deviceIndex = deviceIndex;
  }

  private static Optional<Nvml> initialize() {
    try {
      Nvml nvml = LibraryLoader.create(Nvml.class).load("nvidia-ml");
      int result = nvml.nvmlInit_v2();
      if (result != Nvml.NVML_SUCCESS) {
        log.warning("nvmlInit failed with " + result);
        return Optional.empty();
      }
      log.info("nvml initialized for vram monitoring");
      return Optional.of(nvml);
    } catch (UnsatisfiedLinkError e) {
      log.log(Level.FINE, "nvidia-ml is not installed, nvidia-smi will be used", e);
      return Optional.empty();
    }
  }

  private Optional<Nvml> nvml() {
    Nvml library = nvml;
    if (library == null) {
      library = loader.get().orElse(null);
      nvml = library;
    }
    return Optional.ofNullable(library);
  }

  @Override
  public String name() {
    return "nvml";
  }

  @Override
  public boolean isSupported() {
    return nvml().isPresent();
  }

  @Override
  public MemoryInfo query() throws IOException {
    Nvml library = nvml().orElseThrow(() -> new IOException("nvml is not available"));
    PointerByReference device = new PointerByReference();
    int result = library.nvmlDeviceGetHandleByIndex_v2(deviceIndex, device);
    if (result != Nvml.NVML_SUCCESS) {
      throw new IOException(
          String.format("nvmlDeviceGetHandleByIndex(%d) failed with %d", deviceIndex, result));
    }
    long[] memory = new long[3];
    result = library.nvmlDeviceGetMemoryInfo(device.getValue(), memory);
    if (result != Nvml.NVML_SUCCESS) {
      throw new IOException("nvmlDeviceGetMemoryInfo failed with " + result);
    }
    long total = memory[0];
    long free = memory[1];
    long used = memory[2];
    return new MemoryInfo(used / BYTES_PER_MB, total / BYTES_PER_MB, free / BYTES_PER_MB);
  }
}
