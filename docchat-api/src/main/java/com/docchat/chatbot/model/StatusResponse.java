package com.docchat.chatbot.model;

public record StatusResponse(String status, String message) {
}
