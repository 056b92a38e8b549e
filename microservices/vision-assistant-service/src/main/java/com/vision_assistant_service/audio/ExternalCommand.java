package com.vision_assistant_service.audio;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs a speech engine as a child process with a bounded wait.
 */
final class ExternalCommand {

    private ExternalCommand() {
    }

    /**
     * @return everything the process wrote to stdout
     */
    static String run(List<String> command, Duration timeout) throws SpeechException {
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new SpeechException("Could not start " + command.get(0), e);
        }
        try {
            process.getOutputStream().close();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new SpeechException(command.get(0) + " timed out after " + timeout.toMillis() + " ms");
            }
            String output;
            try (InputStream stdout = process.getInputStream()) {
                output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (process.exitValue() != 0) {
                throw new SpeechException(command.get(0) + " exited with status " + process.exitValue());
            }
            return output;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new SpeechException(command.get(0) + " interrupted", e);
        } catch (IOException e) {
            throw new SpeechException("Could not read output of " + command.get(0), e);
        }
    }
}
