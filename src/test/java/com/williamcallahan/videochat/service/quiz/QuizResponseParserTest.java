package com.williamcallahan.videochat.service.quiz;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.videochat.domain.QuestionType;
import com.williamcallahan.videochat.service.quiz.QuizResponseParser.ParsedQuestion;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Verifies parsing and validation of model quiz output.
 */
class QuizResponseParserTest {

    private final QuizResponseParser parser = new QuizResponseParser(new ObjectMapper());

    @Test
    void parsesFencedMultipleChoiceJson() {
        String raw = """
                Here is your quiz:
                ```json
                {"questions": [{
                  "question": "What stops recursion?",
                  "options": {"a": "A loop", "b": "The base case", "c": "A stack", "d": "Nothing"},
                  "correct_answer": "b",
                  "source_index": 2,
                  "explanation": "The base case returns without recursing."
                }]}
                ```
                """;

        List<ParsedQuestion> questions = parser.parse(raw, QuestionType.MCQ);

        assertEquals(1, questions.size());
        ParsedQuestion question = questions.get(0);
        assertEquals("What stops recursion?", question.question());
        assertEquals("B", question.correctAnswer());
        assertEquals("The base case", question.options().get("B"));
        assertEquals(2, question.sourceIndex());
        assertNull(question.videoId());
    }

    @Test
    void acceptsAnswerWithOptionTextSuffix() {
        String raw = """
                {"questions": [{"question": "Q?", "options": {"A": "x", "B": "y"}, "correct_answer": "A) x"}]}
                """;

        assertEquals("A", parser.parse(raw, QuestionType.MCQ).get(0).correctAnswer());
    }

    @Test
    void normalizesYesNoQuestions() {
        String raw = """
                {"questions": [
                  {"question": "Is a base case required?", "correct_answer": "yes, always"},
                  {"question": "Is recursion always faster?", "correct_answer": "NO"}
                ]}
                """;

        List<ParsedQuestion> questions = parser.parse(raw, QuestionType.YES_NO);

        assertEquals("Yes", questions.get(0).correctAnswer());
        assertEquals("No", questions.get(1).correctAnswer());
        assertEquals(Map.of("Yes", "Yes", "No", "No"), questions.get(0).options());
    }

    @Test
    void stripFencesLeavesPlainJsonAlone() {
        assertEquals("{\"questions\":[]}", QuizResponseParser.stripFences("  {\"questions\":[]}  "));
        assertEquals("{}", QuizResponseParser.stripFences("```\n{}\n```"));
    }

    @Test
    void rejectsMalformedOutput() {
        assertThrows(QuizGenerationException.class, () -> parser.parse("not json at all", QuestionType.MCQ));
        assertThrows(QuizGenerationException.class, () -> parser.parse("", QuestionType.MCQ));
        assertThrows(QuizGenerationException.class, () -> parser.parse("{\"questions\": []}", QuestionType.MCQ));
    }

    @Test
    void rejectsAnswerThatIsNotAnOption() {
        String raw = """
                {"questions": [{"question": "Q?", "options": {"A": "x", "B": "y"}, "correct_answer": "E"}]}
                """;

        assertThrows(QuizGenerationException.class, () -> parser.parse(raw, QuestionType.MCQ));
    }

    @Test
    void rejectsSingleOptionQuestions() {
        String raw = """
                {"questions": [{"question": "Q?", "options": {"A": "x"}, "correct_answer": "A"}]}
                """;

        assertThrows(QuizGenerationException.class, () -> parser.parse(raw, QuestionType.MCQ));
    }
}
