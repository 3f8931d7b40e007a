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

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ServiceTypeTest {
  @Test
  public void fromNameAcceptsWireAndEnumNames() {
    assertThat(ServiceType.fromName("ollama")).isEqualTo(Optional.of(ServiceType.TEXT_GENERATION));
    assertThat(ServiceType.fromName("ComfyUI"))
        .isEqualTo(Optional.of(ServiceType.IMAGE_GENERATION));
    assertThat(ServiceType.fromName("image_generation"))
        .isEqualTo(Optional.of(ServiceType.IMAGE_GENERATION));
    assertThat(ServiceType.fromName("other")).isEqualTo(Optional.of(ServiceType.OTHER));
  }

  @Test
  public void fromNameRejectsUnknownNames() {
    assertThat(ServiceType.fromName("stable-diffusion")).isEqualTo(Optional.empty());
    assertThat(ServiceType.fromName(null)).isEqualTo(Optional.empty());
  }

  @Test
  public void toStringIsWireName() {
    assertThat(ServiceType.TEXT_GENERATION.toString()).isEqualTo("ollama");
  }
}
