package com.finsolve.assistant.controller;

import com.finsolve.assistant.model.ChatResponse;
import com.finsolve.assistant.model.ChatSubmission;
import com.finsolve.assistant.model.TurnRequest;
import com.finsolve.assistant.security.CallerIdentity;
import com.finsolve.assistant.service.ChatService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final ChatService chatService;

    public ChatController(ChatService chatService) {
        this.chatService = chatService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChatResponse> chat(@Valid @RequestBody ChatSubmission submission, Authentication authentication) {
        return Mono.fromCallable(() -> CallerIdentity.from(authentication))
                .map(caller -> new TurnRequest(
                        submission.conversationId(),
                        caller.userId(),
                        caller.role(),
                        submission.message(),
                        submission.includeSourcesOrDefault()))
                .flatMap(chatService::submitTurn);
    }
}
