package com.consullo.roimonitor.process;

import java.util.concurrent.TimeoutException;

/**
 * Runs an external command and collects its output.
 *
 * <p>Implementations must:
 * - capture standard output as raw bytes (it may be binary image data)
 * - enforce {@link ProcessConfig#timeout()} and kill the process when it elapses
 * - honour thread interruption
 *
 * @since 1.0
 */
public interface ProcessRunner {

  /**
   * Runs the command to completion.
   *
   * @param config command configuration
   * @return result
   * @throws java.io.IOException if the process cannot be started or its output cannot be read
   * @throws TimeoutException if the process did not finish in time
   * @throws InterruptedException if the calling thread was interrupted
   */
  ProcessResult run(final ProcessConfig config) throws java.io.IOException, TimeoutException, InterruptedException;

  /**
   * Returns true if an executable with the given name is found on the search path.
   *
   * @param executable executable name
   * @return true if found
   */
  boolean isOnPath(final String executable);
}
