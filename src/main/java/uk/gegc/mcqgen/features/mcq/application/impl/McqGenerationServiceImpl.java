package uk.gegc.mcqgen.features.mcq.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mcqgen.features.ai.application.PromptTemplateService;
import uk.gegc.mcqgen.features.ai.application.StructuredCompletionService;
import uk.gegc.mcqgen.features.ai.infra.parser.StructuredCompletion;
import uk.gegc.mcqgen.features.mcq.application.McqGenerationService;
import uk.gegc.mcqgen.features.mcq.config.McqGenerationProperties;
import uk.gegc.mcqgen.features.mcq.domain.model.Difficulty;
import uk.gegc.mcqgen.features.mcq.domain.model.Mcq;
import uk.gegc.mcqgen.features.mcq.domain.model.McqOption;
import uk.gegc.mcqgen.features.retrieval.domain.model.ContextFragment;
import uk.gegc.mcqgen.shared.exception.AIResponseParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Service
@RequiredArgsConstructor
@Slf4j
public class McqGenerationServiceImpl implements McqGenerationService {

    static final String UNKNOWN_SOURCE = "unknown";
    static final String GENERATION_ORDER_KEY = "generation_order";
    static final String REQUESTED_DIFFICULTY_KEY = "requested_difficulty";

    private final StructuredCompletionService completionService;
    private final PromptTemplateService promptTemplateService;
    private final McqGenerationProperties properties;

    @Override
    public List<Mcq> generate(List<ContextFragment> fragments, int count, Difficulty difficulty) {
        if (fragments == null || fragments.isEmpty()) {
            log.debug("No context fragments supplied, skipping generation");
            return List.of();
        }
        if (count < 1) {
            throw new IllegalArgumentException("Question count must be at least 1");
        }

        String prompt = buildPrompt(fragments, count, difficulty);
        log.debug("Requesting {} questions from {} fragments", count, fragments.size());

        StructuredCompletion<JsonNode> completion =
                completionService.completeArray(prompt, properties.getGeneration().getTemperature());

        return switch (completion.kind()) {
            case OK -> toMcqs(completion.value(), fragments, difficulty);
            case PARSE_ERROR -> {
                log.error("Generation response could not be parsed, discarding all candidates: {}", completion.error());
                yield List.of();
            }
            case SERVICE_ERROR -> {
                log.error("Generation call failed, no candidates produced: {}", completion.error());
                yield List.of();
            }
        };
    }

    String buildPrompt(List<ContextFragment> fragments, int count, Difficulty difficulty) {
        String contextBlock = IntStream.range(0, fragments.size())
                .mapToObj(i -> "[Chunk " + (i + 1) + " from " + fragments.get(i).source() + "]:\n"
                        + fragments.get(i).text())
                .collect(Collectors.joining("\n\n"));

        String difficultyInstruction = difficulty != null
                ? "Generate " + difficulty.getValue() + " difficulty questions. "
                : "";

        return promptTemplateService.render(properties.getGeneration().getTemplate(), Map.of(
                "count", String.valueOf(count),
                "context", contextBlock,
                "difficultyInstruction", difficultyInstruction
        ));
    }

    // One malformed item discards the whole batch
    private List<Mcq> toMcqs(JsonNode items, List<ContextFragment> fragments, Difficulty requested) {
        List<Mcq> mcqs = new ArrayList<>();
        try {
            for (int i = 0; i < items.size(); i++) {
                mcqs.add(toMcq(items.get(i), i, fragments, requested));
            }
        } catch (AIResponseParseException e) {
            log.error("Malformed question in generation response, discarding all candidates: {}", e.getMessage());
            return List.of();
        }

        log.info("Generated {} candidate questions", mcqs.size());
        return mcqs;
    }

    private Mcq toMcq(JsonNode item, int order, List<ContextFragment> fragments, Difficulty requested) {
        if (item == null || !item.isObject()) {
            throw new AIResponseParseException("Question " + order + " is not a JSON object");
        }

        String correctAnswer = requiredText(item, "correct_answer", order).trim();
        ContextFragment source = resolveFragment(item.get("chunk_index"), fragments);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(GENERATION_ORDER_KEY, order);
        if (requested != null) {
            metadata.put(REQUESTED_DIFFICULTY_KEY, requested.getValue());
        }

        return Mcq.builder()
                .question(requiredText(item, "question", order))
                .options(toOptions(item.get("options"), correctAnswer, order))
                .correctAnswer(correctAnswer)
                .explanation(requiredText(item, "explanation", order))
                .difficulty(parseDifficulty(item.get("difficulty"), order))
                .fragmentId(isBlank(source.fragmentId()) ? String.valueOf(order) : source.fragmentId())
                .sourceFilename(isBlank(source.source()) ? UNKNOWN_SOURCE : source.source())
                .contextSnippet(snippet(source.text()))
                .metadata(metadata)
                .build();
    }

    private List<McqOption> toOptions(JsonNode optionsNode, String correctAnswer, int order) {
        if (optionsNode == null || !optionsNode.isArray()) {
            throw new AIResponseParseException("Question " + order + " has no 'options' array");
        }

        List<McqOption> options = new ArrayList<>();
        for (JsonNode optionNode : optionsNode) {
            if (!optionNode.isObject()) {
                throw new AIResponseParseException("Question " + order + " has an option that is not an object");
            }
            String label = requiredText(optionNode, "label", order).trim();
            String text = requiredText(optionNode, "text", order);
            options.add(new McqOption(label, text, label.equals(correctAnswer)));
        }
        return options;
    }

    private Difficulty parseDifficulty(JsonNode node, int order) {
        if (node == null || node.isNull()) {
            return Difficulty.MEDIUM;
        }
        Difficulty difficulty = Difficulty.fromValue(node.asText());
        if (difficulty == null) {
            throw new AIResponseParseException("Question " + order + " has unknown difficulty '" + node.asText() + "'");
        }
        return difficulty;
    }

    /**
     * Missing, non-integral or out-of-range references fall back to the first fragment.
     */
    private ContextFragment resolveFragment(JsonNode chunkIndex, List<ContextFragment> fragments) {
        if (chunkIndex != null && chunkIndex.canConvertToInt() && chunkIndex.isIntegralNumber()) {
            int index = chunkIndex.asInt();
            if (index >= 0 && index < fragments.size()) {
                return fragments.get(index);
            }
        }
        return fragments.get(0);
    }

    private String snippet(String text) {
        int length = properties.getGeneration().getSnippetLength();
        String head = text.length() > length ? text.substring(0, length) : text;
        return head + "...";
    }

    private static String requiredText(JsonNode node, String field, int order) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new AIResponseParseException("Question " + order + " is missing '" + field + "'");
        }
        return value.asText();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
