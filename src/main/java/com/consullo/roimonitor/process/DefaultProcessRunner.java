package com.consullo.roimonitor.process;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Standard output and error are drained on daemon threads so that a chatty process cannot block on a full
 * pipe while the caller waits for it to exit.
 *
 * @since 1.0
 */
public final class DefaultProcessRunner implements ProcessRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultProcessRunner.class);

  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

  private final Map<String, String> baseEnvironment;

  private final ExecutorService drainExecutor = Executors.newCachedThreadPool(r -> {
    final Thread t = new Thread(r, "process-output-drain-" + THREAD_COUNTER.incrementAndGet());
    t.setDaemon(true);
    return t;
  });

  /**
   * Creates a runner resolving executables against the given environment's {@code PATH}.
   *
   * @param baseEnvironment environment used for path lookup
   */
  public DefaultProcessRunner(final Map<String, String> baseEnvironment) {
    Validate.notNull(baseEnvironment, "baseEnvironment must not be null");
    this.baseEnvironment = Map.copyOf(baseEnvironment);
  }

  @Override
  public ProcessResult run(final ProcessConfig config) throws IOException, TimeoutException, InterruptedException {
    Validate.notNull(config, "config must not be null");
    Validate.notNull(config.command(), "command must not be null");
    Validate.isTrue(!config.command().isEmpty(), "command must not be empty");
    Validate.notNull(config.timeout(), "timeout must not be null");

    final ProcessBuilder builder = new ProcessBuilder(config.command());
    if (config.workingDirectory() != null) {
      builder.directory(config.workingDirectory().toFile());
    }
    if (config.environment() != null) {
      builder.environment().putAll(config.environment());
    }

    LOGGER.debug("run: {}", config.command().get(0));
    final Process process = builder.start();
    final CompletableFuture<byte[]> stdout = drain(process.getInputStream());
    final CompletableFuture<byte[]> stderr = drain(process.getErrorStream());
    process.getOutputStream().close();

    try {
      if (!process.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
        throw new TimeoutException(config.command().get(0) + " did not finish within " + config.timeout());
      }
      return new ProcessResult(
              process.exitValue(),
              stdout.get(),
              new String(stderr.get(), StandardCharsets.UTF_8).trim());
    } catch (final ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof UncheckedIOException) {
        throw ((UncheckedIOException) cause).getCause();
      }
      throw new IOException("Failed reading output of " + config.command().get(0), cause);
    } finally {
      if (process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  @Override
  public boolean isOnPath(final String executable) {
    Validate.notBlank(executable, "executable must not be blank");
    final String path = baseEnvironment.get("PATH");
    if (path == null || path.isEmpty()) {
      return false;
    }
    for (final String dir : path.split(File.pathSeparator)) {
      if (dir.isEmpty()) {
        continue;
      }
      final Path candidate = Path.of(dir, executable);
      if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
        return true;
      }
    }
    return false;
  }

  private CompletableFuture<byte[]> drain(final InputStream in) {
    return CompletableFuture.supplyAsync(() -> {
      try (InputStream stream = in) {
        return stream.readAllBytes();
      } catch (final IOException e) {
        throw new UncheckedIOException(e);
      }
    }, drainExecutor);
  }
}
