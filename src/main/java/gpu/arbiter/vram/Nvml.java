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

import jnr.ffi.Pointer;
import jnr.ffi.annotations.Out;
import jnr.ffi.byref.PointerByReference;

/* in order to call nvml functions directly using ffi,
   we must specify the routines here in an nvml interface.
   nvmlMemory_t is three unsigned 64 bit counters: total, free, used.
*/
public interface Nvml {
  int NVML_SUCCESS = 0;

  int nvmlInit_v2();

  int nvmlDeviceGetHandleByIndex_v2(int index, @Out PointerByReference device);

  int nvmlDeviceGetMemoryInfo(Pointer device, @Out long[] memory);
}
