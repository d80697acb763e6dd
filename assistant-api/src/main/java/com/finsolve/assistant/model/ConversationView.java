package com.finsolve.assistant.model;

import java.util.List;

public record ConversationView(
        ConversationSummary conversation,
        List<ConversationTurn> turns
) {
}
