package com.vision_assistant_service.audio;

/**
 * A speech engine could not produce or recognise an utterance.
 */
public class SpeechException extends Exception {

    public SpeechException(String message) {
        super(message);
    }

    public SpeechException(String message, Throwable cause) {
        super(message, cause);
    }
}
