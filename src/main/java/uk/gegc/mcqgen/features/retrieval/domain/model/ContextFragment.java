package uk.gegc.mcqgen.features.retrieval.domain.model;

/**
 * A unit of indexed source text with its provenance, as returned by retrieval.
 *
 * @param text       fragment text
 * @param source     source file name the fragment was cut from
 * @param fragmentId identifier of the fragment inside the index
 * @param score      relevance score assigned by the retriever
 */
public record ContextFragment(
        String text,
        String source,
        String fragmentId,
        double score
) {
    public ContextFragment {
        text = (text == null) ? "" : text;
    }

    public static ContextFragment of(String fragmentId, String source, String text) {
        return new ContextFragment(text, source, fragmentId, 1.0);
    }
}
