package com.finsolve.assistant.security;

import com.finsolve.assistant.access.Role;
import com.finsolve.assistant.controller.ChatController;
import com.finsolve.assistant.controller.ConversationController;
import com.finsolve.assistant.controller.GlobalExceptionHandler;
import com.finsolve.assistant.exception.ConversationAccessDeniedException;
import com.finsolve.assistant.model.ChatResponse;
import com.finsolve.assistant.model.ChatSubmission;
import com.finsolve.assistant.model.ConversationStats;
import com.finsolve.assistant.model.ConversationSummary;
import com.finsolve.assistant.model.ConversationTitleUpdate;
import com.finsolve.assistant.model.TurnRequest;
import com.finsolve.assistant.service.ChatService;
import com.finsolve.assistant.service.conversation.ConversationService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;

@WebFluxTest(controllers = {ChatController.class, ConversationController.class})
@Import({SecurityConfig.class, JwtRoleConverter.class, GlobalExceptionHandler.class})
@TestPropertySource(properties = {
        "chat.security.static-token=test-token",
        "chat.security.static-user=test-user",
        "chat.security.static-role=Finance"
})
class StaticTokenSecurityIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ChatService chatService;

    @MockBean
    private ConversationService conversationService;

    @Test
    void rejectsChatWithoutToken() {
        webTestClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(submission("How do I file expenses?"))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void rejectsChatWithWrongToken() {
        webTestClient.post()
                .uri("/api/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer wrong")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(submission("How do I file expenses?"))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void answersChatWithConfiguredToken() {
        Mockito.when(chatService.submitTurn(any())).thenReturn(Mono.just(new ChatResponse(
                "conv-1", "Use the expense portal.", List.of(), 0.81, 120, Set.of(), OffsetDateTime.now())));

        webTestClient.post()
                .uri("/api/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(submission("How do I file expenses?"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.conversationId").isEqualTo("conv-1")
                .jsonPath("$.message").isEqualTo("Use the expense portal.");

        ArgumentCaptor<TurnRequest> request = ArgumentCaptor.forClass(TurnRequest.class);
        Mockito.verify(chatService).submitTurn(request.capture());
        assertThat(request.getValue().userId()).isEqualTo("test-user");
        assertThat(request.getValue().role()).isEqualTo(Role.FINANCE);
    }

    @Test
    void blankMessageIsRejectedBeforeTheService() {
        webTestClient.post()
                .uri("/api/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(submission(" "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_FAILED");

        Mockito.verifyNoInteractions(chatService);
    }

    @Test
    void messageLengthIsLeftToTheConfiguredValidator() {
        Mockito.when(chatService.submitTurn(any())).thenReturn(Mono.just(new ChatResponse(
                "conv-2", "Noted.", List.of(), 0.0, 900, Set.of(), OffsetDateTime.now())));

        webTestClient.post()
                .uri("/api/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(submission("expense question ".repeat(150)))
                .exchange()
                .expectStatus().isOk();

        Mockito.verify(chatService).submitTurn(any());
    }

    @Test
    void foreignConversationIsForbidden() {
        Mockito.when(conversationService.viewConversation("conv-bob", "test-user"))
                .thenThrow(new ConversationAccessDeniedException("conv-bob"));

        webTestClient.get()
                .uri("/api/conversations/conv-bob")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.code").isEqualTo("CONVERSATION_ACCESS_DENIED");
    }

    @Test
    void deletesOwnConversation() {
        webTestClient.delete()
                .uri("/api/conversations/conv-1")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isNoContent();

        Mockito.verify(conversationService).deleteConversation("conv-1", "test-user");
    }

    @Test
    void renamesOwnConversation() {
        OffsetDateTime now = OffsetDateTime.now();
        Mockito.when(conversationService.renameConversation("conv-1", "test-user", "Q3 forecast"))
                .thenReturn(new ConversationSummary("conv-1", "test-user", "Q3 forecast", now.minusDays(1), now));

        webTestClient.patch()
                .uri("/api/conversations/conv-1/title")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ConversationTitleUpdate("Q3 forecast"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.conversationId").isEqualTo("conv-1")
                .jsonPath("$.title").isEqualTo("Q3 forecast");
    }

    @Test
    void blankTitleIsRejectedBeforeTheService() {
        webTestClient.patch()
                .uri("/api/conversations/conv-1/title")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ConversationTitleUpdate(""))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_FAILED");

        Mockito.verifyNoInteractions(conversationService);
    }

    @Test
    void renamingRequiresToken() {
        webTestClient.patch()
                .uri("/api/conversations/conv-1/title")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ConversationTitleUpdate("Q3 forecast"))
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    void returnsCallersStats() {
        Mockito.when(conversationService.statsFor("test-user"))
                .thenReturn(ConversationStats.of(4, 3, 3));

        webTestClient.get()
                .uri("/api/conversations/stats")
                .header(HttpHeaders.AUTHORIZATION, "Bearer test-token")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalMessages").isEqualTo(7)
                .jsonPath("$.totalConversations").isEqualTo(3)
                .jsonPath("$.averageMessagesPerConversation").isEqualTo(2.3);

        Mockito.verify(conversationService, Mockito.never()).viewConversation(any(), any());
    }

    private ChatSubmission submission(String message) {
        return new ChatSubmission(null, message, true);
    }
}
