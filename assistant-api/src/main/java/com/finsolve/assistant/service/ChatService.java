package com.finsolve.assistant.service;

import com.finsolve.assistant.model.ChatResponse;
import com.finsolve.assistant.model.TurnRequest;
import reactor.core.publisher.Mono;

public interface ChatService {

    /**
     * Answers one user message. The turn pair is stored only if an answer is
     * produced; failures and cancellations leave the conversation untouched.
     */
    Mono<ChatResponse> submitTurn(TurnRequest request);
}
