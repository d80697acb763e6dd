package com.finsolve.assistant.model;

public enum ChatMessageRole {
    USER,
    ASSISTANT
}
