package com.vision_assistant_service.audio;

import java.time.Duration;
import java.util.List;

/**
 * Runs a speech-to-text program that records one utterance and prints the transcript.
 */
public class CommandLineSpeechRecognizer implements SpeechRecognizer {

    private final List<String> command;
    private final Duration timeout;

    public CommandLineSpeechRecognizer(List<String> command, Duration timeout) {
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public String listen() throws SpeechException {
        if (command.isEmpty()) {
            throw new SpeechException("No speech recognition command configured");
        }
        String transcript = ExternalCommand.run(command, timeout).trim();
        if (transcript.isEmpty()) {
            throw new SpeechException("Nothing recognised");
        }
        return transcript;
    }
}
