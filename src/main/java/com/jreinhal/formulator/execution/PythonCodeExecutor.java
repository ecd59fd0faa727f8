package com.jreinhal.formulator.execution;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes generated programs as a child process.
 *
 * The program is written to a temporary file and handed to the configured
 * interpreter command. Output streams are redirected to temporary files so a
 * chatty program can never block on a full pipe. On timeout the process and
 * all of its descendants are killed.
 */
public class PythonCodeExecutor implements CodeExecutor {

    private static final Logger log = LoggerFactory.getLogger(PythonCodeExecutor.class);

    static final String TIMEOUT_MESSAGE = "Execution timed out";

    private static final String PYTHON_FENCE = "```python";
    private static final String FENCE = "```";

    private final List<String> command;
    private final Duration timeout;

    public PythonCodeExecutor(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Interpreter command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
    }

    @Override
    public ExecutionResult execute(String source) {
        String program = stripFences(source);
        Path script = null;
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            script = Files.createTempFile("formulation-", ".py");
            stdoutFile = Files.createTempFile("formulation-", ".out");
            stderrFile = Files.createTempFile("formulation-", ".err");
            Files.writeString(script, program, StandardCharsets.UTF_8);

            List<String> cmd = new ArrayList<>(command);
            cmd.add(script.toString());
            Process process = new ProcessBuilder(cmd)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile())
                    .start();
            // programs that read stdin see end of input
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                log.warn("Generated program exceeded {}s and was killed", timeout.toSeconds());
                return ExecutionResult.failure(TIMEOUT_MESSAGE);
            }

            int exitCode = process.exitValue();
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String stderr = Files.readString(stderrFile, StandardCharsets.UTF_8);
            log.debug("Generated program exited with code {} ({} bytes stdout)", exitCode, stdout.length());
            return new ExecutionResult(exitCode == 0, stdout, stderr);
        } catch (IOException e) {
            log.warn("Failed to run generated program: {}", e.getMessage());
            return ExecutionResult.failure("Execution failed to start: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Execution interrupted");
        } finally {
            deleteIfPresent(script);
            deleteIfPresent(stdoutFile);
            deleteIfPresent(stderrFile);
        }
    }

    /**
     * Remove a surrounding markdown code fence, as models often wrap code in one.
     */
    static String stripFences(String source) {
        if (source == null) {
            return "";
        }
        String code = source.strip();
        if (code.startsWith(PYTHON_FENCE)) {
            code = code.substring(PYTHON_FENCE.length());
        }
        if (code.startsWith(FENCE)) {
            code = code.substring(FENCE.length());
        }
        if (code.endsWith(FENCE)) {
            code = code.substring(0, code.length() - FENCE.length());
        }
        return code.strip();
    }

    private static void deleteIfPresent(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
