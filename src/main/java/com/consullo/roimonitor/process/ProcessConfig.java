package com.consullo.roimonitor.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration for running an external command to completion.
 *
 * @param command command and arguments (e.g., ["grim", "-"])
 * @param workingDirectory working directory, null for the current directory
 * @param environment environment variables to add/override (may be null)
 * @param timeout upper bound on the run time; the process is killed when it elapses
 * @since 1.0
 */
public record ProcessConfig(
    List<String> command,
    Path workingDirectory,
    Map<String, String> environment,
    Duration timeout) {

  /**
   * Creates a configuration that inherits directory and environment.
   *
   * @param timeout run time bound
   * @param command command and arguments
   * @return configuration
   */
  public static ProcessConfig of(Duration timeout, String... command) {
    return new ProcessConfig(List.of(command), null, null, timeout);
  }
}
