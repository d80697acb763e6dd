package com.finsolve.assistant.controller;

import com.finsolve.assistant.model.ConversationStats;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationTitleUpdate;
import com.finsolve.assistant.model.ConversationView;
import com.finsolve.assistant.security.CallerIdentity;
import com.finsolve.assistant.service.conversation.ConversationService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final ConversationService conversationService;

    public ConversationController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @GetMapping
    public Mono<List<ConversationSummary>> list(Authentication authentication) {
        return Mono.fromCallable(() -> conversationService.listConversations(CallerIdentity.from(authentication).userId()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/stats")
    public Mono<ConversationStats> stats(Authentication authentication) {
        return Mono.fromCallable(() -> conversationService.statsFor(CallerIdentity.from(authentication).userId()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{conversationId}")
    public Mono<ConversationView> view(@PathVariable String conversationId, Authentication authentication) {
        return Mono.fromCallable(() -> conversationService.viewConversation(
                        conversationId, CallerIdentity.from(authentication).userId()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PatchMapping("/{conversationId}/title")
    public Mono<ConversationSummary> rename(@PathVariable String conversationId,
                                            @Valid @RequestBody ConversationTitleUpdate update,
                                            Authentication authentication) {
        return Mono.fromCallable(() -> conversationService.renameConversation(
                        conversationId, CallerIdentity.from(authentication).userId(), update.title()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{conversationId}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String conversationId, Authentication authentication) {
        return Mono.fromRunnable(() -> conversationService.deleteConversation(
                        conversationId, CallerIdentity.from(authentication).userId()))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
