package org.cbombench;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * Runs external commands for command-line adapters.
 *
 * <p>
 * Standard error is merged into standard output and captured on a thread owned by the
 * process. If the calling thread is interrupted while waiting, the process and every
 * process it started are destroyed before the interruption is reported, so a cancelled
 * invocation never leaves a scanner running.
 */
public class ProcessExecutor {

	private static final Logger logger = LoggerFactory.getLogger(ProcessExecutor.class);

	/**
	 * Exit code and combined output of a finished process.
	 *
	 * @param exitCode process exit code
	 * @param output combined standard output and standard error
	 */
	public record ProcessResult(int exitCode, String output) {

		public boolean succeeded() {
			return exitCode == 0;
		}

	}

	/**
	 * Run a command to completion.
	 * @param command command and arguments
	 * @param workingDirectory directory to run in
	 * @return exit code and output
	 * @throws IOException if the process cannot be started
	 * @throws InterruptedException if the calling thread is interrupted; the process has
	 * been destroyed by then
	 */
	public ProcessResult run(List<String> command, Path workingDirectory) throws IOException, InterruptedException {
		logger.debug("Running {} in {}", command, workingDirectory);
		Process process = new ProcessBuilder(command).directory(workingDirectory.toFile())
			.redirectErrorStream(true)
			.start();

		FutureTask<String> output = new FutureTask<>(() -> drain(process.getInputStream()));
		Thread drainer = new Thread(output, "cbombench-output-" + process.pid());
		drainer.setDaemon(true);
		drainer.start();
		try {
			int exitCode = process.waitFor();
			return new ProcessResult(exitCode, output.get());
		}
		catch (InterruptedException e) {
			logger.debug("Interrupted, destroying {} and its child processes", command.get(0));
			destroyTree(process);
			throw e;
		}
		catch (ExecutionException e) {
			throw new IOException("Failed to read the output of " + command.get(0), e.getCause());
		}
	}

	/**
	 * Forcibly destroy a process and all of its descendants. Descendants are collected
	 * first, since they are re-parented once the process itself is gone.
	 */
	static void destroyTree(Process process) {
		List<ProcessHandle> descendants = process.descendants().toList();
		process.destroyForcibly();
		for (ProcessHandle descendant : descendants) {
			descendant.destroyForcibly();
		}
	}

	private static String drain(InputStream stream) {
		try (InputStream in = stream) {
			ByteArrayOutputStream buffer = new ByteArrayOutputStream();
			in.transferTo(buffer);
			return buffer.toString(StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

}
