package com.finsolve.assistant.model;

import jakarta.validation.constraints.NotBlank;

public record ConversationTitleUpdate(@NotBlank String title) {
}
