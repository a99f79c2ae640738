package uk.gegc.mcqgen.features.retrieval.application;

import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;

import java.util.List;

/**
 * Looks up indexed fragments relevant to a query. Results are expected to be
 * already filtered by relevance; their order carries no meaning downstream.
 */
public interface ContextRetriever {

    /**
     * @param query topic or question to retrieve context for
     * @param topK  maximum number of fragments to return
     * @return relevant fragments, empty when nothing passes the relevance threshold
     */
    List<ContextFragment> retrieve(String query, int topK);
}
