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

import static dev.domainsync.tools.Injector.injectReflectively;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.beust.jcommander.ParametersDelegate;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.flogger.FluentLogger;
import dev.domainsync.config.ConfigurationException;
import dev.domainsync.config.DomainSyncConfig;
import java.util.Map;
import java.util.function.Supplier;
import javax.annotation.Nullable;

/** Container class to parse and run DomainSync commands. */
@Parameters(
    separators = " =",
    commandDescription = "Keeps DNS and hosting in sync for a set of domains")
final class DomainSyncCli {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_CONFIGURATION_ERROR = 2;

  @Parameter(
      names = {"-c", "--commands"},
      description = "Returns all command names.")
  private boolean showAllCommands;

  @Nullable
  @Parameter(
      names = "--config",
      description =
          "YAML configuration file to merge over the defaults. "
              + "Falls back to the DOMAINSYNC_CONFIG environment variable.")
  private String configFile;

  // Do not make this final - compile-time constant inlining may interfere with JCommander.
  @ParametersDelegate private LoggingParameters loggingParams = new LoggingParameters();

  private final String programName;
  private final ImmutableMap<String, ? extends Class<? extends Command>> commands;
  private final Supplier<DomainSyncComponent> componentFactory;

  DomainSyncCli(
      String programName, ImmutableMap<String, ? extends Class<? extends Command>> commands) {
    this(programName, commands, DaggerDomainSyncComponent::create);
  }

  @VisibleForTesting
  DomainSyncCli(
      String programName,
      ImmutableMap<String, ? extends Class<? extends Command>> commands,
      Supplier<DomainSyncComponent> componentFactory) {
    this.programName = programName;
    this.commands = commands;
    this.componentFactory = componentFactory;
  }

  /** Parses and runs one command, returning the process exit code. */
  int run(String[] args) throws Exception {
    JCommander jcommander = new JCommander(this);
    jcommander.setProgramName(programName);
    try {
      for (Map.Entry<String, ? extends Class<? extends Command>> entry : commands.entrySet()) {
        Command command = entry.getValue().getDeclaredConstructor().newInstance();
        jcommander.addCommand(entry.getKey(), command);
      }
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(e);
    }

    try {
      jcommander.parse(args);
    } catch (ParameterException e) {
      System.err.println(e.getMessage());
      if (jcommander.getParsedCommand() != null) {
        jcommander.getUsageFormatter().usage(jcommander.getParsedCommand());
      } else {
        jcommander.usage();
      }
      return EXIT_CONFIGURATION_ERROR;
    }
    String parsedCommand = jcommander.getParsedCommand();
    if (showAllCommands || parsedCommand == null) {
      if (!showAllCommands) {
        System.out.println("The list of available subcommands is:");
      }
      commands.keySet().forEach(System.out::println);
      return parsedCommand == null && !showAllCommands ? EXIT_CONFIGURATION_ERROR : EXIT_SUCCESS;
    }

    if (configFile != null) {
      System.setProperty(DomainSyncConfig.CONFIG_PATH_PROPERTY, configFile);
    }
    loggingParams.configureLogging(); // Must be called after parameters are parsed.

    Command command =
        (Command)
            Iterables.getOnlyElement(jcommander.getCommands().get(parsedCommand).getObjects());
    try {
      injectReflectively(DomainSyncComponent.class, componentFactory.get(), command);
      command.run();
    } catch (ConfigurationException | IllegalArgumentException e) {
      logger.atSevere().withCause(e).log("%s aborted.", parsedCommand);
      System.err.println("Error: " + e.getMessage());
      return EXIT_CONFIGURATION_ERROR;
    }
    if (command instanceof BatchCommand) {
      return ((BatchCommand) command).getExitCode();
    }
    if (command instanceof ScheduleCommand) {
      return ((ScheduleCommand) command).getExitCode();
    }
    return EXIT_SUCCESS;
  }
}
