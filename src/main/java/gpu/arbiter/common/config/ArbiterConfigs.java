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

import com.google.common.base.Strings;
import com.google.devtools.common.options.OptionsParser;
import com.google.devtools.common.options.OptionsParsingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import javax.naming.ConfigurationException;
import lombok.Data;
import lombok.extern.java.Log;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * @class ArbiterConfigs
 * @brief Root of the yaml configuration.
 * @details Values missing from the file keep the defaults of the individual sections. A handful of
 *     environment variables override the file, which is convenient for containerized deployment.
 */
@Data
@Log
public final class ArbiterConfigs {
  private int prometheusPort = 9090;
  private Gpu gpu = new Gpu();
  private ProcessManager processManager = new ProcessManager();
  private Vram vram = new Vram();

  public ArbiterConfigs() {}

  public static ArbiterConfigs loadConfigs(Path configLocation) throws IOException {
    try (InputStream inputStream = Files.newInputStream(configLocation)) {
      Yaml yaml = new Yaml(new Constructor(ArbiterConfigs.class, new LoaderOptions()));
      ArbiterConfigs configs = yaml.load(inputStream);
      if (configs == null) {
        throw new RuntimeException("Could not load configs from path: " + configLocation);
      }
      log.info(configs.toString());
      return configs;
    }
  }

  public static ArbiterConfigs loadArbiterConfigs(String[] args) throws ConfigurationException {
    OptionsParser parser = getOptionsParser(args);
    ArbiterOptions options = parser.getOptions(ArbiterOptions.class);
    ArbiterConfigs configs;
    try {
      configs = loadConfigs(getConfigurationPath(parser));
    } catch (IOException e) {
      log.severe("Could not parse yml configuration file." + e);
      throw new RuntimeException(e);
    }
    if (options.prometheusPort >= 0) {
      configs.setPrometheusPort(options.prometheusPort);
    }
    if (!Strings.isNullOrEmpty(options.processManagerUrl)) {
      configs.getProcessManager().setApiUrl(options.processManagerUrl);
    }
    if (options.disableVramMonitor) {
      configs.getVram().setEnabled(false);
    }
    adjustConfigs(configs, System::getenv);
    return configs;
  }

  private static OptionsParser getOptionsParser(String[] args) {
    OptionsParser parser = OptionsParser.newOptionsParser(ArbiterOptions.class);
    try {
      parser.parse(args);
    } catch (OptionsParsingException e) {
      log.severe("Could not parse options provided." + e);
      throw new RuntimeException(e);
    }
    return parser;
  }

  private static Path getConfigurationPath(OptionsParser parser) throws ConfigurationException {
    // source config from env variable
    if (!Strings.isNullOrEmpty(System.getenv("CONFIG_PATH"))) {
      return Path.of(System.getenv("CONFIG_PATH"));
    }

    // source config from cli
    List<String> residue = parser.getResidue();
    if (residue.isEmpty()) {
      log.info("Usage: CONFIG_PATH");
      log.info(parser.describeOptions(Collections.emptyMap(), OptionsParser.HelpVerbosity.LONG));
      throw new ConfigurationException("A valid path to a configuration file must be provided.");
    }

    return Path.of(residue.get(0));
  }

  static void adjustConfigs(ArbiterConfigs configs, Function<String, String> env) {
    String apiUrl = env.apply("PROCESS_MANAGER_API_URL");
    if (!Strings.isNullOrEmpty(apiUrl)) {
      configs.getProcessManager().setApiUrl(apiUrl);
      log.info(String.format("process manager url overwritten to %s", apiUrl));
    }
    String textGenerationUrl = env.apply("OLLAMA_URL");
    if (!Strings.isNullOrEmpty(textGenerationUrl)) {
      configs.getProcessManager().getTextGeneration().setUrl(textGenerationUrl);
      log.info(String.format("text generation url overwritten to %s", textGenerationUrl));
    }
    String imageGenerationUrl = env.apply("COMFYUI_URL");
    if (!Strings.isNullOrEmpty(imageGenerationUrl)) {
      configs.getProcessManager().getImageGeneration().setUrl(imageGenerationUrl);
      log.info(String.format("image generation url overwritten to %s", imageGenerationUrl));
    }
    if (!configs.getProcessManager().isEnabled()) {
      log.warning("process manager url is not set, gpu services will be probed but not switched");
    }
  }
}
