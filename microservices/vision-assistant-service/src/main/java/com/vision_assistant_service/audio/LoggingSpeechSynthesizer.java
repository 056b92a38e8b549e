package com.vision_assistant_service.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(LoggingSpeechSynthesizer.class);

    @Override
    public void speak(String text) {
        log.info("SAY: {}", text);
    }
}
