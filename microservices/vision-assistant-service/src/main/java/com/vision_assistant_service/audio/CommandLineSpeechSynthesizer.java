package com.vision_assistant_service.audio;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Speaks through a text-to-speech program such as {@code espeak}; the text is passed as
 * the last argument.
 */
public class CommandLineSpeechSynthesizer implements SpeechSynthesizer {

    private final List<String> command;
    private final Duration timeout;

    public CommandLineSpeechSynthesizer(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("synthesis command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public void speak(String text) throws SpeechException {
        List<String> invocation = new ArrayList<>(command);
        invocation.add(text);
        ExternalCommand.run(invocation, timeout);
    }
}
