package uk.gegc.mcqgen.features.ai.infra.parser;

/**
 * Tagged outcome of a structured completion: either a parsed value or the kind
 * of failure that prevented it.
 *
 * @param kind  what happened
 * @param value the parsed value, present only for {@link Kind#OK}
 * @param error failure description, present only for the error kinds
 */
public record StructuredCompletion<T>(Kind kind, T value, String error) {

    public enum Kind {
        OK,
        PARSE_ERROR,
        SERVICE_ERROR
    }

    public static <T> StructuredCompletion<T> ok(T value) {
        return new StructuredCompletion<>(Kind.OK, value, null);
    }

    public static <T> StructuredCompletion<T> parseError(String error) {
        return new StructuredCompletion<>(Kind.PARSE_ERROR, null, error);
    }

    public static <T> StructuredCompletion<T> serviceError(String error) {
        return new StructuredCompletion<>(Kind.SERVICE_ERROR, null, error);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }
}
