package uk.gegc.mcqgen.features.mcq.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.ai.application.PromptTemplateService;
import uk.gegc.mcqgen.features.ai.application.StructuredCompletionService;
import uk.gegc.mcqgen.features.ai.infra.parser.StructuredCompletion;
import uk.gegc.mcqgen.features.mcq.application.McqCritiqueService;
import uk.gegc.mcqgen.features.mcq.config.McqGenerationProperties;
import uk.gegc.mcqgen.features.mcq.domain.model.CritiqueResult;
import uk.gegc.mcqgen.features.mcq.domain.model.Difficulty;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;
import uk.gegc.mcqgen.shared.exception.AIResponseParseException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class McqCritiqueServiceImpl implements McqCritiqueService {

    static final double MISSING_SCORE = 5.0;
    static final double MIN_SCORE = 0.0;
    static final double MAX_SCORE = 10.0;

    private final StructuredCompletionService completionService;
    private final PromptTemplateService promptTemplateService;
    private final McqGenerationProperties properties;

    @Override
    public List<CritiqueResult> critique(List<Mcq> mcqs, List<ContextFragment> fragments) {
        List<CritiqueResult> critiques = new ArrayList<>(mcqs.size());
        for (int i = 0; i < mcqs.size(); i++) {
            CritiqueResult critique = critiqueOne(i, mcqs.get(i), fragments);
            log.debug("MCQ {}: overall score {}", i + 1, String.format("%.1f", critique.getOverallScore()));
            critiques.add(critique);
        }
        return critiques;
    }

    private CritiqueResult critiqueOne(int index, Mcq mcq, List<ContextFragment> fragments) {
        Optional<ContextFragment> source = findSourceFragment(mcq, fragments);
        if (source.isEmpty()) {
            log.warn("No context available to verify MCQ {}", index);
            return CritiqueResult.unverifiable(index, mcq);
        }

        String prompt = buildPrompt(mcq, source.get());
        StructuredCompletion<JsonNode> completion =
                completionService.completeObject(prompt, properties.getCritique().getTemperature());

        return switch (completion.kind()) {
            case OK -> toCritique(index, mcq, completion.value());
            case PARSE_ERROR, SERVICE_ERROR -> {
                log.warn("Error critiquing MCQ {} ({}): {}", index, completion.kind(), completion.error());
                yield CritiqueResult.neutral(index, mcq);
            }
        };
    }

    /**
     * The fragment whose id matches the question's, else the first fragment, else none.
     */
    Optional<ContextFragment> findSourceFragment(Mcq mcq, List<ContextFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fragments.stream()
                .filter(fragment -> fragment.fragmentId() != null && fragment.fragmentId().equals(mcq.fragmentId()))
                .findFirst()
                .orElse(fragments.get(0)));
    }

    String buildPrompt(Mcq mcq, ContextFragment source) {
        String options = mcq.options().stream()
                .map(option -> option.label() + ". " + option.text())
                .collect(Collectors.joining("\n"));

        return promptTemplateService.render(properties.getCritique().getTemplate(), Map.of(
                "context", source.text(),
                "question", mcq.question(),
                "options", options,
                "correctAnswer", mcq.correctAnswer(),
                "explanation", mcq.explanation()
        ));
    }

    private CritiqueResult toCritique(int index, Mcq mcq, JsonNode node) {
        try {
            return new CritiqueResult(
                    index,
                    mcq.id(),
                    score(node, "clarity_score"),
                    score(node, "correctness_score"),
                    score(node, "grounding_score"),
                    difficultyAssessment(node.get("difficulty_assessment")),
                    strings(node.get("issues")),
                    strings(node.get("suggestions"))
            );
        } catch (AIResponseParseException e) {
            log.warn("Malformed critique for MCQ {}: {}", index, e.getMessage());
            return CritiqueResult.neutral(index, mcq);
        }
    }

    private static double score(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return MISSING_SCORE;
        }

        double raw;
        if (value.isNumber()) {
            raw = value.asDouble();
        } else if (value.isTextual()) {
            try {
                raw = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new AIResponseParseException("Score '" + field + "' is not a number: " + value.asText(), e);
            }
        } else {
            throw new AIResponseParseException("Score '" + field + "' is not a number");
        }

        if (Double.isNaN(raw)) {
            throw new AIResponseParseException("Score '" + field + "' is not a number");
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));
    }

    // Missing defaults to medium; an unrecognised value makes the critique malformed
    private static Difficulty difficultyAssessment(JsonNode value) {
        if (value == null || value.isNull()) {
            return Difficulty.MEDIUM;
        }
        Difficulty difficulty = Difficulty.fromValue(value.asText());
        if (difficulty == null) {
            throw new AIResponseParseException("Unknown difficulty assessment '" + value.asText() + "'");
        }
        return difficulty;
    }

    private static List<String> strings(JsonNode value) {
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (value.isTextual()) {
            return value.asText().isBlank() ? List.of() : List.of(value.asText());
        }
        if (!value.isArray()) {
            throw new AIResponseParseException("Expected a list of strings but got " + value.getNodeType());
        }

        List<String> strings = new ArrayList<>();
        value.forEach(element -> {
            if (!element.isNull()) {
                strings.add(element.asText());
            }
        });
        return strings;
    }
}
