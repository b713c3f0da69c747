package com.docchat.chatbot.model;

import jakarta.validation.constraints.NotBlank;

public record ChatRequest(@NotBlank String query) {
}
