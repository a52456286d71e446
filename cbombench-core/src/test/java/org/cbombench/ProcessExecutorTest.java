package org.cbombench;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProcessExecutor} against real shell processes.
 */
@DisplayName("ProcessExecutor Tests")
@EnabledOnOs({ OS.LINUX, OS.MAC })
class ProcessExecutorTest {

	@TempDir
	Path tempDir;

	private ProcessExecutor executor;

	@BeforeEach
	void setUp() {
		executor = new ProcessExecutor();
	}

	@Test
	@DisplayName("Should capture the exit code and the merged output")
	void shouldCaptureExitCodeAndOutput() throws Exception {
		ProcessExecutor.ProcessResult result = executor
			.run(List.of("sh", "-c", "echo scanned; echo failed >&2; exit 3"), tempDir);

		assertThat(result.exitCode()).isEqualTo(3);
		assertThat(result.succeeded()).isFalse();
		assertThat(result.output()).contains("scanned", "failed");
	}

	@Test
	@DisplayName("Should read output larger than the pipe buffer without blocking")
	void shouldDrainLargeOutput() throws Exception {
		ProcessExecutor.ProcessResult result = executor
			.run(List.of("sh", "-c", "i=0; while [ $i -lt 20000 ]; do echo line-$i; i=$((i+1)); done"), tempDir);

		assertThat(result.succeeded()).isTrue();
		assertThat(result.output().lines()).hasSize(20000).endsWith("line-19999");
	}

	@Test
	@DisplayName("Should destroy the process and its children when the caller is interrupted")
	void shouldDestroyProcessTreeOnInterrupt() throws Exception {
		AtomicReference<Throwable> failure = new AtomicReference<>();
		Thread caller = new Thread(() -> {
			try {
				executor.run(List.of("sh", "-c", "sleep 60 & sleep 60 & wait"), tempDir);
			}
			catch (Throwable e) {
				failure.set(e);
			}
		});
		caller.start();

		List<ProcessHandle> tree = awaitProcessTree(3);
		caller.interrupt();
		caller.join(TimeUnit.SECONDS.toMillis(10));

		assertThat(caller.isAlive()).isFalse();
		assertThat(failure.get()).isInstanceOf(InterruptedException.class);
		for (ProcessHandle handle : tree) {
			handle.onExit().get(10, TimeUnit.SECONDS);
			assertThat(handle.isAlive()).as("process %d", handle.pid()).isFalse();
		}
	}

	/**
	 * Wait until a child of this JVM has started the given number of processes,
	 * including itself.
	 */
	private static List<ProcessHandle> awaitProcessTree(int size) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
		while (System.nanoTime() < deadline) {
			Optional<ProcessHandle> shell = ProcessHandle.current()
				.children()
				.filter(child -> child.descendants().count() >= size - 1)
				.findFirst();
			if (shell.isPresent()) {
				List<ProcessHandle> tree = new ArrayList<>();
				tree.add(shell.get());
				shell.get().descendants().forEach(tree::add);
				return tree;
			}
			Thread.sleep(50);
		}
		throw new AssertionError("Shell did not start its child processes in time");
	}

}
