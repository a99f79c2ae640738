package uk.gegc.mcqgen.features.retrieval.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.stereotype.Component;
import uk.gegc.mcqgen.features.mcq.config.McqGenerationProperties;
import uk.gegc.mcqgen.features.retrieval.application.ContextRetriever;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.List;
import java.util.Map;

/**
 * Retrieves fragments from a Spring AI vector store, keeping only matches whose
 * similarity reaches the configured threshold.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VectorStoreContextRetriever implements ContextRetriever {

    static final String FRAGMENT_ID_KEY = "chunk_id";
    static final String FILENAME_KEY = "filename";
    static final String SOURCE_KEY = "source";

    private final VectorStore vectorStore;
    private final McqGenerationProperties properties;

    @Override
    public List<ContextFragment> retrieve(String query, int topK) {
        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(topK)
                .similarityThreshold(properties.getRetrieval().getScoreThreshold())
                .build();

        List<Document> documents = vectorStore.similaritySearch(request);
        if (documents == null || documents.isEmpty()) {
            log.debug("No fragments found for query='{}'", query);
            return List.of();
        }

        List<ContextFragment> fragments = documents.stream()
                .map(this::toFragment)
                .toList();
        log.debug("Retrieved {} fragments for query='{}'", fragments.size(), query);
        return fragments;
    }

    private ContextFragment toFragment(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        Object fragmentId = metadata.getOrDefault(FRAGMENT_ID_KEY, document.getId());
        Object source = metadata.containsKey(FILENAME_KEY) ? metadata.get(FILENAME_KEY) : metadata.get(SOURCE_KEY);
        double score = document.getScore() != null ? document.getScore() : 0.0;

        return new ContextFragment(
                document.getText(),
                source != null ? source.toString() : null,
                fragmentId != null ? fragmentId.toString() : null,
                score
        );
    }
}
