package com.finsolve.assistant.service.retrieval;

import com.finsolve.assistant.access.DocumentCollection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QdrantVectorIndexClientTest {

    private final EmbeddingsClient embeddingsClient = mock(EmbeddingsClient.class);
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        when(embeddingsClient.embed(anyList())).thenReturn(Mono.just(
                new EmbeddingsClient.EmbeddingBatch(List.of(List.of(0.1, 0.2, 0.3)), "test-model", 3)));
    }

    @Test
    void mapsPayloadToHitsAndClampsScores() {
        QdrantVectorIndexClient client = client(HttpStatus.OK, """
                {"result": [
                  {"id": 1, "score": 1.2, "payload": {"document_id": "doc-1", "chunk_index": 3,
                    "document_name": "Handbook.pdf", "uploaded_by_role": "HR", "text": "Leave accrues monthly."}},
                  {"id": 2, "score": 0.71, "payload": {"document_id": "doc-2", "chunk_index": 0,
                    "document_name": "Benefits.md", "uploaded_by_role": "HR", "text": "Health cover."}},
                  {"id": 3, "score": 0.9, "payload": null}
                ]}
                """);

        StepVerifier.create(client.similaritySearch(DocumentCollection.HR, "leave", 5))
                .assertNext(hits -> {
                    assertThat(hits).hasSize(2);
                    assertThat(hits.get(0)).isEqualTo(new IndexHit("doc-1", 3, "Leave accrues monthly.", 1.0, "Handbook.pdf", "HR"));
                    assertThat(hits.get(1).score()).isEqualTo(0.71);
                })
                .verifyComplete();

        assertThat(lastRequest.get().url().getPath()).isEqualTo("/collections/kb_hr_dept/points/search");
    }

    @Test
    void pointsWithoutChunkIndexAreSkipped() {
        QdrantVectorIndexClient client = client(HttpStatus.OK, """
                {"result": [
                  {"id": 1, "score": 0.9, "payload": {"document_id": "doc-1",
                    "document_name": "Policy.pdf", "text": "First part."}},
                  {"id": 2, "score": 0.8, "payload": {"document_id": "doc-1",
                    "document_name": "Policy.pdf", "text": "Second part."}},
                  {"id": 3, "score": 0.75, "payload": {"document_id": "doc-1", "chunk_index": 2,
                    "document_name": "Policy.pdf", "text": "Third part."}}
                ]}
                """);

        StepVerifier.create(client.similaritySearch(DocumentCollection.GENERAL, "policy", 5))
                .assertNext(hits -> assertThat(hits)
                        .extracting(IndexHit::text)
                        .containsExactly("Third part."))
                .verifyComplete();
    }

    @Test
    void missingCollectionIsEmpty() {
        QdrantVectorIndexClient client = client(HttpStatus.NOT_FOUND, "{\"status\":{\"error\":\"Not found\"}}");

        StepVerifier.create(client.similaritySearch(DocumentCollection.FINANCE, "revenue", 5))
                .assertNext(hits -> assertThat(hits).isEmpty())
                .verifyComplete();
    }

    @Test
    void serverErrorsPropagate() {
        QdrantVectorIndexClient client = client(HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(client.similaritySearch(DocumentCollection.FINANCE, "revenue", 5))
                .expectError(WebClientResponseException.class)
                .verify();
    }

    private QdrantVectorIndexClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new QdrantVectorIndexClient(webClient, embeddingsClient, "kb_");
    }
}
