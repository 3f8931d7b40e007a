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

import gpu.arbiter.common.ServiceType;
import java.util.Optional;

/** The control plane's answer to a switch request. */
public record SwitchResult(
    boolean success,
    String message,
    Optional<ServiceType> previousService,
    Optional<ServiceType> currentService,
    long switchTimeMs) {}
