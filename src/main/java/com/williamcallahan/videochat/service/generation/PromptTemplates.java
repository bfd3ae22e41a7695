package com.williamcallahan.videochat.service.generation;

/**
 * Prompt text for every generation task.
 *
 * <p>User templates are {@link String#formatted(Object...)} patterns; the placeholders are listed on
 * each constant.</p>
 */
public final class PromptTemplates {

    private PromptTemplates() {}

    public static final String QA_SYSTEM_PROMPT = """
            You are an assistant that answers questions about YouTube videos using only their transcripts.

            Rules:
            1. Cite sources with [1], [2], [3]... right after each piece of information taken from them.
            2. Answer only from the sources. If the answer is not there, say "I couldn't find this information in the provided videos."
            3. Explain clearly, using concrete examples from the sources when they help.
            4. Reply in the language of the question and keep technical terms as they are.
            5. Structure longer answers with markdown: bullet points and **bold** key terms.

            Each citation [N] points to a timestamped transcript segment the user can jump to.
            """;

    /** Placeholders: sources, question. */
    public static final String QA_USER_TEMPLATE = """
            Answer the question using the following sources from YouTube videos.

            # SOURCES:

            %s

            ---

            # QUESTION:
            %s

            # ANSWER:
            (Give a clear, detailed answer and cite the sources [1], [2], ... after each important point.)
            """;

    /** Placeholders: history, sources, question. */
    public static final String FOLLOWUP_USER_TEMPLATE = """
            Answer the follow-up question using the conversation history and the new video sources.

            # CONVERSATION HISTORY:
            %s

            # NEW SOURCES:
            %s

            # FOLLOW-UP QUESTION:
            %s

            ---

            Use the history for context and cite the new sources with [1], [2], ... Keep the answer clear.
            """;

    public static final String VIDEO_SUMMARY_SYSTEM_PROMPT = """
            You are an assistant that summarizes YouTube videos from their transcripts.

            Rules:
            1. Cite transcript segments with [1], [2], [3]... after every statement. Each number is a timestamped segment.
            2. Use only what the transcript says. Do not add outside information.
            3. Summarize in enough detail that the reader does not need to rewatch the video.
            4. Reply in the language of the video and keep technical terms as they are.
            5. Use markdown headers, bullet points and **bold** to show structure.
            """;

    /** Placeholders: title, duration, transcript. */
    public static final String DETAILED_SUMMARY_USER_TEMPLATE = """
            Write a detailed, structured summary of the ENTIRE video from the segments below.

            **Video Title**: %s
            **Video Duration**: %s

            # VIDEO SEGMENTS (ORDERED BY TIME):

            %s

            ---

            Structure:
            ## 1. Introduction
            The goals of the video and the concepts it covers.
            ## 2. Main Points
            One subsection per topic, with technical details and formulas where the video gives them.
            ## 3. Examples & Applications
            Examples shown in the video and where they apply.
            ## 4. Conclusion
            The key takeaways.

            Every statement needs at least one citation [n]. Cover all segments.
            """;

    /** Placeholders: title, transcript. */
    public static final String QUICK_SUMMARY_USER_TEMPLATE = """
            Write a brief summary of the following YouTube video.

            **Title**: %s

            # TRANSCRIPT:

            %s

            ---

            Give 3-5 bullet points with the most important takeaways. Each bullet needs at least one citation [n].

            # QUICK SUMMARY:
            """;

    public static final String QUIZ_SYSTEM_PROMPT = """
            You write quiz questions from YouTube video transcripts.

            Rules:
            1. Test understanding of the main concepts, not trivia.
            2. Every question must be answerable from the sources alone.
            3. Questions must be clear and unambiguous, with exactly one correct answer.
            4. Respond with valid JSON only, no prose around it.
            """;

    /** Placeholders: question count, sources, question count. */
    public static final String MCQ_QUIZ_USER_TEMPLATE = """
            Create %d multiple choice questions from the following video sources.

            # SOURCES:

            %s

            ---

            Each question has exactly four options A, B, C and D with one correct answer. Wrong options
            must be plausible. Set "source_index" to the number of the source the question comes from.

            Return JSON in this shape:
            {
              "questions": [
                {
                  "question": "What is the main purpose of dropout in neural networks?",
                  "options": {"A": "Speed up training", "B": "Prevent overfitting", "C": "Reduce parameters", "D": "Increase accuracy"},
                  "correct_answer": "B",
                  "source_index": 1,
                  "explanation": "Dropout randomly disables neurons during training so the network cannot overfit."
                }
              ]
            }

            Generate %d questions now.
            """;

    /** Placeholders: question count, sources, question count. */
    public static final String YES_NO_QUIZ_USER_TEMPLATE = """
            Create %d yes/no questions from the following video sources.

            # SOURCES:

            %s

            ---

            Each question is answered with "Yes" or "No". Mix both answers. Set "source_index" to the
            number of the source the question comes from.

            Return JSON in this shape:
            {
              "questions": [
                {
                  "question": "Does the video describe dropout as a way to prevent overfitting?",
                  "options": {"Yes": "Yes", "No": "No"},
                  "correct_answer": "Yes",
                  "source_index": 1,
                  "explanation": "The speaker introduces dropout as a regularization technique."
                }
              ]
            }

            Generate %d questions now.
            """;
}
