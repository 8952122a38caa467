package com.consullo.roimonitor.process;

/**
 * Outcome of a completed external command.
 *
 * @param exitCode process exit code
 * @param stdout raw standard output
 * @param stderr standard error decoded as UTF-8
 * @since 1.0
 */
public record ProcessResult(int exitCode, byte[] stdout, String stderr) {

  public boolean isSuccess() {
    return exitCode == 0;
  }
}
