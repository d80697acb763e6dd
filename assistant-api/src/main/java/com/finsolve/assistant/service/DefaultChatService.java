package com.finsolve.assistant.service;

import com.finsolve.assistant.access.AccessScope;
import com.finsolve.assistant.access.AccessScopeResolver;
import com.finsolve.assistant.config.RagProperties;
import com.finsolve.assistant.exception.ChatPipelineException;
import com.finsolve.assistant.exception.UnknownRoleException;
import com.finsolve.assistant.model.ChatResponse;
import com.finsolve.assistant.model.ConversationContext;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationTurn;
import com.finsolve.assistant.model.GeneratedAnswer;
import com.finsolve.assistant.model.PipelineWarning;
import com.finsolve.assistant.model.RankedResult;
import com.finsolve.assistant.model.RetrievalQuery;
import com.finsolve.assistant.model.TurnRequest;
import com.finsolve.assistant.service.augmentation.QueryAugmenter;
import com.finsolve.assistant.service.conversation.ConversationContextManager;
import com.finsolve.assistant.service.conversation.ConversationService;
import com.finsolve.assistant.service.conversation.ConversationStore;
import com.finsolve.assistant.service.conversation.MessageValidator;
import com.finsolve.assistant.service.generation.GenerationFatalException;
import com.finsolve.assistant.service.generation.GenerationService;
import com.finsolve.assistant.service.generation.GenerationTransientException;
import com.finsolve.assistant.service.postprocess.ResponsePostProcessor;
import com.finsolve.assistant.service.prompt.ComposedPrompt;
import com.finsolve.assistant.service.prompt.PromptComposer;
import com.finsolve.assistant.service.retrieval.AccessControlledRetriever;
import com.finsolve.assistant.service.retrieval.ChunkRanker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Service
public class DefaultChatService implements ChatService {

    private static final Logger log = LoggerFactory.getLogger(DefaultChatService.class);
    private static final String TURN_LATENCY_METRIC = "assistant.turn.latency";
    private static final String DEGRADED_RETRIEVAL_METRIC = "assistant.retrieval.degraded";
    private static final String ANSWERS_METRIC = "assistant.answers";
    private static final int LOG_PREVIEW_LENGTH = 50;

    private final MessageValidator messageValidator;
    private final AccessScopeResolver accessScopeResolver;
    private final ConversationService conversationService;
    private final ConversationStore conversationStore;
    private final ConversationContextManager contextManager;
    private final QueryAugmenter queryAugmenter;
    private final AccessControlledRetriever retriever;
    private final ChunkRanker ranker;
    private final PromptComposer promptComposer;
    private final GenerationService generationService;
    private final ResponsePostProcessor postProcessor;
    private final RagProperties properties;
    private final MeterRegistry meterRegistry;

    public DefaultChatService(MessageValidator messageValidator,
                              AccessScopeResolver accessScopeResolver,
                              ConversationService conversationService,
                              ConversationStore conversationStore,
                              ConversationContextManager contextManager,
                              QueryAugmenter queryAugmenter,
                              AccessControlledRetriever retriever,
                              ChunkRanker ranker,
                              PromptComposer promptComposer,
                              GenerationService generationService,
                              ResponsePostProcessor postProcessor,
                              RagProperties properties,
                              MeterRegistry meterRegistry) {
        this.messageValidator = messageValidator;
        this.accessScopeResolver = accessScopeResolver;
        this.conversationService = conversationService;
        this.conversationStore = conversationStore;
        this.contextManager = contextManager;
        this.queryAugmenter = queryAugmenter;
        this.retriever = retriever;
        this.ranker = ranker;
        this.promptComposer = promptComposer;
        this.generationService = generationService;
        this.postProcessor = postProcessor;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Mono<ChatResponse> submitTurn(TurnRequest request) {
        String roleTag = request.role() == null ? "unknown" : request.role().tag();
        return Mono.defer(() -> {
                    Timer.Sample sample = Timer.start(meterRegistry);
                    if (request.role() == null) {
                        throw new UnknownRoleException(request.userId());
                    }
                    String message = messageValidator.validate(request.message());
                    AccessScope scope = accessScopeResolver.accessScope(request.role());
                    OffsetDateTime startedAt = OffsetDateTime.now();
                    log.info("Turn started for user {} as {} on conversation {}: \"{}\"",
                            request.userId(), roleTag, request.conversationId(), preview(message));
                    return openTurn(request, message)
                            .flatMap(turn -> answer(turn, message, scope)
                                    .flatMap(answer -> commit(turn.conversation(), message, startedAt, answer)
                                            .thenReturn(toResponse(request, turn.conversation(), answer))))
                            .doOnSuccess(response -> sample.stop(turnTimer(roleTag, "answered")))
                            .doOnError(error -> {
                                sample.stop(turnTimer(roleTag, "failed"));
                                log.error("Turn failed for user {} on conversation {}: {}",
                                        request.userId(), request.conversationId(), error.getMessage());
                            });
                });
    }

    private Mono<OpenTurn> openTurn(TurnRequest request, String message) {
        return Mono.fromCallable(() -> {
                    ConversationSummary conversation = conversationService.openConversation(
                            request.conversationId(), request.userId(), message);
                    List<ConversationTurn> turns = conversationStore.loadHistory(
                            conversation.conversationId(), properties.getChunkHistoryLimit());
                    ConversationContext history = ConversationContext.bounded(
                            conversation.conversationId(), turns, properties.getChunkHistoryLimit());
                    return new OpenTurn(conversation, history);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<GeneratedAnswer> answer(OpenTurn turn, String message, AccessScope scope) {
        Set<PipelineWarning> warnings = EnumSet.noneOf(PipelineWarning.class);
        return contextManager.buildStandaloneQuery(turn.history(), message)
                .flatMap(standalone -> {
                    if (standalone.fallback()) {
                        warnings.add(PipelineWarning.CONTEXTUALIZATION_FALLBACK);
                    }
                    return queryAugmenter.augment(standalone.text())
                            .map(augmentation -> {
                                if (augmentation.fallback()) {
                                    warnings.add(PipelineWarning.AUGMENTATION_FALLBACK);
                                }
                                return new RetrievalQuery(message, standalone.text(), augmentation.variants());
                            });
                })
                .flatMap(query -> retriever.retrieve(query.variants(), scope)
                        .map(outcome -> {
                            if (outcome.degraded()) {
                                warnings.add(PipelineWarning.DEGRADED_RETRIEVAL);
                                meterRegistry.counter(DEGRADED_RETRIEVAL_METRIC, "role", scope.role().tag()).increment();
                            }
                            return new Ranked(query, ranker.merge(outcome.hits()));
                        }))
                .flatMap(ranked -> {
                    ComposedPrompt prompt = promptComposer.compose(
                            ranked.query().standalone(), ranked.result(), turn.history(), scope);
                    if (prompt.truncated()) {
                        warnings.add(PipelineWarning.CONTEXT_TRUNCATED);
                    }
                    if (prompt.included().isEmpty()) {
                        warnings.add(PipelineWarning.NO_CONTEXT);
                    }
                    return generationService.generate(prompt.text(), properties.getAnswerMaxTokens())
                            .onErrorMap(this::toPipelineError)
                            .map(generation -> postProcessor.process(generation, prompt));
                })
                .map(answer -> {
                    meterRegistry.counter(ANSWERS_METRIC, "role", scope.role().tag(),
                            "context", warnings.contains(PipelineWarning.NO_CONTEXT) ? "none" : "present").increment();
                    return answer.withWarnings(warnings);
                });
    }

    private Mono<Void> commit(ConversationSummary conversation, String message, OffsetDateTime startedAt,
                              GeneratedAnswer answer) {
        return Mono.<Void>fromRunnable(() -> conversationStore.appendTurns(conversation, List.of(
                        ConversationTurn.user(message, startedAt),
                        ConversationTurn.assistant(answer.text(), OffsetDateTime.now()))))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnSuccess(ignored -> log.info("Turn completed on conversation {}: {} sources, confidence {}, warnings {}",
                        conversation.conversationId(), answer.citations().size(), answer.confidence(), answer.warnings()));
    }

    private ChatResponse toResponse(TurnRequest request, ConversationSummary conversation, GeneratedAnswer answer) {
        return new ChatResponse(
                conversation.conversationId(),
                answer.text(),
                request.includeSources() ? answer.citations() : null,
                answer.confidence(),
                answer.tokenCount(),
                answer.warnings(),
                OffsetDateTime.now()
        );
    }

    private Throwable toPipelineError(Throwable error) {
        if (error instanceof GenerationTransientException) {
            return ChatPipelineException.generationUnavailable(error);
        }
        if (error instanceof GenerationFatalException) {
            return ChatPipelineException.generationFailed(error);
        }
        return error;
    }

    private Timer turnTimer(String role, String outcome) {
        return Timer.builder(TURN_LATENCY_METRIC)
                .tag("role", role)
                .tag("outcome", outcome)
                .register(meterRegistry);
    }

    private String preview(String message) {
        return message.length() <= LOG_PREVIEW_LENGTH ? message : message.substring(0, LOG_PREVIEW_LENGTH) + "...";
    }

    private record OpenTurn(ConversationSummary conversation, ConversationContext history) {}

    private record Ranked(RetrievalQuery query, RankedResult result) {}
}
