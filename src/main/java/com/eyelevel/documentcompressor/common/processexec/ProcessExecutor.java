package com.eyelevel.documentcompressor.common.processexec;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Serial;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

@Component
@Slf4j
public class ProcessExecutor {

    /**
     * A safe limit for the amount of stdout/stderr to capture in memory.
     */
    private static final int MAX_CAPTURE_BYTES = 16 * 1024;

    /**
     * Executes a command-line process with a timeout and memory-safe stream handling.
     * If the calling thread is interrupted while waiting, the process is destroyed.
     *
     * @param command        The command and its arguments to execute.
     * @param contextInfo    A string for logging context (e.g., the document file name).
     * @param timeoutMinutes The maximum time to wait for the process to complete.
     * @param processName    A descriptive name for the process (e.g., "gs").
     * @return A ProcessResult containing the exit code and a truncated portion of stdout and stderr.
     * @throws ProcessTimeoutException if the process does not finish in time.
     * @throws IOException             if the process cannot be started.
     * @throws InterruptedException    if the waiting thread is interrupted.
     */
    public ProcessResult execute(List<String> command, String contextInfo, long timeoutMinutes, String processName)
            throws IOException, InterruptedException {

        Process process = new ProcessBuilder(command).start();
        StringBuffer stdoutCapture = new StringBuffer();
        StringBuffer stderrCapture = new StringBuffer();

        ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, processName + "-stream");
            thread.setDaemon(true);
            return thread;
        });
        try {
            executor.submit(new StreamConsumer(process.getInputStream(), stdoutCapture, null));
            executor.submit(new StreamConsumer(process.getErrorStream(), stderrCapture,
                    line -> log.warn("[{}] [{}-stderr] {}", contextInfo, processName, line)));

            if (!process.waitFor(timeoutMinutes, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(
                        processName + " process timed out after " + timeoutMinutes + " minutes.");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            executor.shutdown();
        }
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("[{}] {} output streams did not drain within 5 seconds.", contextInfo, processName);
        }

        return new ProcessResult(process.exitValue(), stdoutCapture.toString().trim(),
                stderrCapture.toString().trim());
    }

    /**
     * Consumes an InputStream, captures its content up to a limit, and optionally logs each line.
     */
    private static class StreamConsumer implements Runnable {
        private final InputStream inputStream;
        private final StringBuffer capture;
        private final Consumer<String> lineLogger;
        private int bytesCaptured = 0;

        StreamConsumer(InputStream inputStream, StringBuffer capture, Consumer<String> lineLogger) {
            this.inputStream = inputStream;
            this.capture = capture;
            this.lineLogger = lineLogger;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (lineLogger != null) {
                        lineLogger.accept(line);
                    }
                    if (bytesCaptured < MAX_CAPTURE_BYTES) {
                        String lineWithNewline = line + "\n";
                        capture.append(lineWithNewline);
                        bytesCaptured += lineWithNewline.getBytes(StandardCharsets.UTF_8).length;
                    }
                }
            } catch (IOException e) {
                log.error("Error reading process stream.", e);
            }
        }
    }

    /**
     * Raised when an external process exceeds its time limit and has been destroyed.
     */
    public static class ProcessTimeoutException extends IOException {
        @Serial
        private static final long serialVersionUID = -7356107935466728213L;

        public ProcessTimeoutException(String message) {
            super(message);
        }
    }

    /**
     * A record to hold the result of an external process execution.
     *
     * @param exitCode The exit code of the process. 0 typically means success.
     * @param stdout   The captured standard output (truncated to a safe limit).
     * @param stderr   The captured standard error output (truncated to a safe limit).
     */
    public record ProcessResult(int exitCode, String stdout, String stderr) {
    }
}
