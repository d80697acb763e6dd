package com.finsolve.assistant.service.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.finsolve.assistant.access.DocumentCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

@Component
public class QdrantVectorIndexClient implements VectorIndexClient {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndexClient.class);

    private final WebClient qdrantWebClient;
    private final EmbeddingsClient embeddingsClient;
    private final String collectionPrefix;

    public QdrantVectorIndexClient(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                   EmbeddingsClient embeddingsClient,
                                   @Value("${chat.qdrant.collection-prefix:}") String collectionPrefix) {
        this.qdrantWebClient = qdrantWebClient;
        this.embeddingsClient = embeddingsClient;
        this.collectionPrefix = Objects.requireNonNullElse(collectionPrefix, "");
    }

    @Override
    public Mono<List<IndexHit>> similaritySearch(DocumentCollection collection, String queryText, int k) {
        String indexName = collectionPrefix + collection.indexName();
        return embeddingsClient.embed(List.of(queryText))
                .map(batch -> batch.vectors().get(0))
                .flatMap(vector -> search(indexName, vector, k));
    }

    private Mono<List<IndexHit>> search(String indexName, List<Double> vector, int k) {
        return qdrantWebClient.post()
                .uri("/collections/{collection}/points/search", indexName)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new SearchPayload(vector, k, true))
                .retrieve()
                .bodyToMono(QdrantResponse.class)
                .map(QdrantResponse::toHits)
                .onErrorResume(WebClientResponseException.NotFound.class, notFound -> {
                    log.debug("Qdrant collection {} does not exist yet, treating as empty", indexName);
                    return Mono.just(Collections.emptyList());
                });
    }

    private record SearchPayload(List<Double> vector,
                                 int limit,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    private record QdrantResponse(List<Result> result) {
        List<IndexHit> toHits() {
            return result == null ? Collections.emptyList() : result.stream()
                    .filter(hit -> hit.payload() != null
                            && hit.payload().documentId() != null
                            && hit.payload().chunkIndex() != null)
                    .map(Result::toHit)
                    .toList();
        }
    }

    private record Result(double score, Payload payload) {
        IndexHit toHit() {
            double clamped = Math.max(0.0, Math.min(1.0, score));
            return new IndexHit(payload.documentId(), payload.chunkIndex(), payload.text(), clamped,
                    payload.documentName(), payload.uploadedByRole());
        }
    }

    private record Payload(@JsonProperty("document_id") String documentId,
                           @JsonProperty("chunk_index") Integer chunkIndex,
                           @JsonProperty("document_name") String documentName,
                           @JsonProperty("uploaded_by_role") String uploadedByRole,
                           String text) {}
}
