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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @class ServiceEndpoint
 * @brief Where a gpu service answers its health check.
 * @details The service is considered up when a GET of url + healthPath returns 200.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceEndpoint {
  private String url;
  private String healthPath;

  public String getHealthUrl() {
    String base = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    return healthPath == null ? base : base + healthPath;
  }
}
