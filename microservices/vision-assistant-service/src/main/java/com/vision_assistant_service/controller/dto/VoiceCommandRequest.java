package com.vision_assistant_service.controller.dto;

public class VoiceCommandRequest {

    private String command;

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }
}
