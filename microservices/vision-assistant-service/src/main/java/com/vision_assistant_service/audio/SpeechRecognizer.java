package com.vision_assistant_service.audio;

public interface SpeechRecognizer {

    /**
     * Listens for one utterance and returns its transcript. May block for several seconds.
     */
    String listen() throws SpeechException;
}
