package com.finsolve.assistant.model;

import com.finsolve.assistant.access.Role;

public record TurnRequest(
        String conversationId,
        String userId,
        Role role,
        String message,
        boolean includeSources
) {
}
