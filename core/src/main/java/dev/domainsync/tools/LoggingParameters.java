// Copyright 2026 The DomainSync Authors. All Rights Reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package dev.domainsync.tools;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.base.Joiner;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import com.google.common.io.Resources;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import javax.annotation.Nullable;

/** Parameter delegate class to handle logging configuration for {@link DomainSyncCli}. */
@Parameters(separators = " =")
final class LoggingParameters {

  @Nullable
  @Parameter(
      names = "--log_level",
      description = "Default level at which to log messages",
      converter = LevelConverter.class)
  private Level logLevel;

  @Parameter(
      names = "--logging_configs",
      description =
          "Comma-delimited list of logging properties to add to the logging.properties "
              + "file, e.g. dev.domainsync.level=FINE,okhttp3.level=INFO")
  private List<String> configLines = new ArrayList<>();

  @Nullable
  @Parameter(
      names = "--logging_properties_file",
      description = "File from which to read custom logging properties")
  private Path configFile;

  private static final ByteSource DEFAULT_LOG_CONFIG =
      Resources.asByteSource(Resources.getResource(LoggingParameters.class, "logging.properties"));

  void configureLogging() throws IOException {
    ByteSource baseConfig =
        (configFile != null) ? MoreFiles.asByteSource(configFile) : DEFAULT_LOG_CONFIG;
    List<String> lines = new ArrayList<>(configLines);
    if (logLevel != null) {
      lines.add(".level = " + logLevel);
    }
    // Leading newline in case the base properties file does not end in one.
    String customProperties = "\n" + Joiner.on('\n').join(lines);
    ByteSource logConfig =
        ByteSource.concat(baseConfig, ByteSource.wrap(customProperties.getBytes(UTF_8)));
    try (InputStream input = logConfig.openStream()) {
      LogManager.getLogManager().readConfiguration(input);
    }
  }

  /** Parses a {@link Level} name such as INFO or FINE. */
  public static final class LevelConverter implements IStringConverter<Level> {
    @Override
    public Level convert(String value) {
      try {
        return Level.parse(value);
      } catch (IllegalArgumentException e) {
        throw new ParameterException("Unknown log level: " + value);
      }
    }
  }
}
