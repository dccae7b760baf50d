package markbridge.repair;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs a shell command as the repair process. The request goes to the command's
 * stdin as one JSON object; whatever it prints on stdout is the candidate.
 */
public final class ExternalCommandRepairProcess implements RepairProcess {
	private static final Logger log = LoggerFactory.getLogger(ExternalCommandRepairProcess.class);
	public static final String COMMAND_VARIABLE = "MARKBRIDGE_REPAIR_CMD";

	private final String command;
	private final Duration timeout;
	private final ObjectMapper mapper = new ObjectMapper();

	public ExternalCommandRepairProcess(String command, Duration timeout) {
		if (command == null || command.isBlank()) {
			throw new IllegalArgumentException("repair command must not be empty");
		}
		this.command = command;
		this.timeout = timeout;
	}

	/** The process configured by {@code MARKBRIDGE_REPAIR_CMD}, if the variable is set. */
	public static Optional<RepairProcess> fromEnvironment(Duration timeout) {
		String command = System.getenv(COMMAND_VARIABLE);
		if (command == null || command.isBlank()) {
			return Optional.empty();
		}
		return Optional.of(new ExternalCommandRepairProcess(command, timeout));
	}

	@Override
	public String repair(RepairRequest request) throws IOException {
		byte[] input = mapper.writeValueAsBytes(request);
		Path stdout = Files.createTempFile("markbridge-repair", ".out");
		Path stderr = Files.createTempFile("markbridge-repair", ".err");
		try {
			ProcessBuilder processBuilder = new ProcessBuilder("sh", "-c", command);
			processBuilder.redirectOutput(stdout.toFile());
			processBuilder.redirectError(stderr.toFile());
			Process process = processBuilder.start();

			Thread writer = new Thread(() -> writeRequest(process, input), "repair-stdin");
			writer.setDaemon(true);
			writer.start();

			if (!waitFor(process)) {
				process.destroyForcibly();
				throw new IOException("repair command timed out after " + timeout.toMillis() + " ms");
			}
			int exitCode = process.exitValue();
			if (exitCode != 0) {
				log.warn("repair command failed: {}", Files.readString(stderr, StandardCharsets.UTF_8).strip());
				throw new IOException("repair command exited with code " + exitCode);
			}
			return Files.readString(stdout, StandardCharsets.UTF_8);
		} finally {
			Files.deleteIfExists(stdout);
			Files.deleteIfExists(stderr);
		}
	}

	private boolean waitFor(Process process) throws IOException {
		try {
			return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			process.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new IOException("interrupted while waiting for the repair command", e);
		}
	}

	/** A command that exits without reading its input closes the pipe early; that is not an error. */
	private static void writeRequest(Process process, byte[] input) {
		try (OutputStream os = process.getOutputStream()) {
			os.write(input);
			os.flush();
		} catch (IOException e) {
			log.debug("repair command closed its input: {}", e.getMessage());
		}
	}
}
