package com.williamcallahan.videochat.service.quiz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.videochat.domain.QuestionType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Parses the model's quiz JSON into validated questions.
 *
 * <p>Accepts {@code {"questions": [...]}} optionally wrapped in a markdown code fence. Each question
 * needs text, options and a correct answer naming one of the options; anything else is rejected
 * with {@link QuizGenerationException}.</p>
 */
@Component
public class QuizResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Map<String, String> YES_NO_OPTIONS = yesNoOptions();
    private static final int MIN_CHOICE_OPTIONS = 2;

    private final ObjectMapper objectMapper;

    public QuizResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * A validated question before it is stored.
     *
     * @param sourceIndex one-based source number the model attributed it to, or null
     * @param videoId video the model attributed it to, or null
     */
    public record ParsedQuestion(
            String question,
            Map<String, String> options,
            String correctAnswer,
            String explanation,
            Integer sourceIndex,
            String videoId) {}

    /**
     * Parses raw model output.
     *
     * @param rawResponse model output, possibly fenced
     * @param questionType expected question kind
     * @return questions in model order
     * @throws QuizGenerationException when the output is not a usable quiz
     */
    public List<ParsedQuestion> parse(String rawResponse, QuestionType questionType) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new QuizGenerationException("Model returned an empty quiz");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFences(rawResponse));
        } catch (JsonProcessingException parseFailure) {
            throw new QuizGenerationException("Model returned malformed quiz JSON", parseFailure);
        }
        JsonNode questionNodes = root == null ? null : root.get("questions");
        if (questionNodes == null || !questionNodes.isArray() || questionNodes.isEmpty()) {
            throw new QuizGenerationException("Model quiz output has no questions");
        }

        List<ParsedQuestion> parsed = new ArrayList<>(questionNodes.size());
        int position = 0;
        for (JsonNode node : questionNodes) {
            position++;
            parsed.add(parseQuestion(node, questionType, position));
        }
        return List.copyOf(parsed);
    }

    static String stripFences(String rawResponse) {
        String trimmed = rawResponse.trim();
        Matcher fenced = FENCED_BLOCK.matcher(trimmed);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        return trimmed;
    }

    private ParsedQuestion parseQuestion(JsonNode node, QuestionType questionType, int position) {
        String question = text(node, "question");
        if (question.isEmpty()) {
            throw new QuizGenerationException("Question " + position + " has no text");
        }
        String answer = text(node, "correct_answer");
        if (answer.isEmpty()) {
            throw new QuizGenerationException("Question " + position + " has no correct answer");
        }

        Map<String, String> options;
        String correctAnswer;
        if (questionType == QuestionType.YES_NO) {
            options = YES_NO_OPTIONS;
            correctAnswer = normalizeYesNo(answer, position);
        } else {
            options = choiceOptions(node.get("options"), position);
            correctAnswer = matchOptionKey(options, answer, position);
        }

        JsonNode sourceIndexNode = node.get("source_index");
        Integer sourceIndex = sourceIndexNode != null && sourceIndexNode.canConvertToInt() ? sourceIndexNode.asInt() : null;
        String videoId = text(node, "video_id");
        return new ParsedQuestion(
                question, options, correctAnswer, text(node, "explanation"), sourceIndex, videoId.isEmpty() ? null : videoId);
    }

    private static Map<String, String> choiceOptions(JsonNode optionsNode, int position) {
        if (optionsNode == null || !optionsNode.isObject()) {
            throw new QuizGenerationException("Question " + position + " has no options");
        }
        Map<String, String> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = optionsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey().trim().toUpperCase(Locale.ROOT);
            String value = field.getValue().asText("").trim();
            if (!key.isEmpty() && !value.isEmpty()) {
                options.put(key, value);
            }
        }
        if (options.size() < MIN_CHOICE_OPTIONS) {
            throw new QuizGenerationException("Question " + position + " needs at least two options");
        }
        return options;
    }

    private static String matchOptionKey(Map<String, String> options, String answer, int position) {
        String candidate = answer.trim();
        // models sometimes answer "B) text" or "B. text"
        if (candidate.length() > 1 && !options.containsKey(candidate.toUpperCase(Locale.ROOT))) {
            candidate = candidate.substring(0, 1);
        }
        String key = candidate.toUpperCase(Locale.ROOT);
        if (!options.containsKey(key)) {
            throw new QuizGenerationException(
                    "Question " + position + " answer '" + answer + "' is not one of its options");
        }
        return key;
    }

    private static String normalizeYesNo(String answer, int position) {
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("yes")) {
            return "Yes";
        }
        if (normalized.startsWith("no")) {
            return "No";
        }
        throw new QuizGenerationException("Question " + position + " answer '" + answer + "' is not Yes or No");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText("").trim();
    }

    private static Map<String, String> yesNoOptions() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("Yes", "Yes");
        options.put("No", "No");
        return Collections.unmodifiableMap(options);
    }
}
