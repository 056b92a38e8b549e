package com.vision_assistant_service.audio;

public interface SpeechSynthesizer {

    /**
     * Speaks the text and returns once the utterance has finished.
     */
    void speak(String text) throws SpeechException;
}
