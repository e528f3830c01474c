package com.phillippitts.classmate.service.analysis;

/**
 * Prompt templates for the analyzers. Every template asks for a bare JSON object.
 */
final class Prompts {

    private static final String SYSTEM = """
            You are a classroom assistant and an exceptionally strong student, helping the user \
            follow a live lecture in real time. You read the running transcript and:
            1. detect questions asked by the lecturer (direct, rhetorical, guiding),
            2. answer them accurately and concisely,
            3. suggest good questions to raise in class,
            4. summarize key content,
            5. propose ideas and directions for further study.
            Be concise. Reply in %s.""";

    private Prompts() {
    }

    static String system(String outputLanguage) {
        return SYSTEM.formatted(outputLanguage);
    }

    static String questionDetection(String transcript) {
        return """
                Decide whether the lecturer is asking a question in the latest transcript lines.

                Transcript (most recent lines):
                ---
                %s
                ---

                Reply with JSON only:
                {"is_question": true|false,
                 "question_text": "the lecturer's question as asked",
                 "question_type": "direct|rhetorical|guiding|exercise",
                 "confidence": 0.0-1.0}
                Only set is_question to true when you are sure the lecturer is asking.""".formatted(transcript);
    }

    static String answer(String question, String transcript, String materials) {
        return """
                The lecturer asked: "%s"

                Recent lecture transcript:
                ---
                %s
                ---
                %s
                Reply with JSON only:
                {"answer": "the best complete, accurate and concise answer",
                 "explanation": "short reasoning"}""".formatted(question, transcript, materialsBlock(materials));
    }

    static String summary(String transcript, String materials, String span) {
        return """
                Summarize this part of the lecture (%s).

                Transcript:
                ---
                %s
                ---
                %s
                Reply with JSON only:
                {"title": "topic of this part",
                 "key_points": ["..."],
                 "important_concepts": ["..."],
                 "summary": "one paragraph"}""".formatted(span, transcript, materialsBlock(materials));
    }

    static String suggestion(String transcript, String materials) {
        return """
                Based on the lecture so far, propose one insightful question the student could ask in \
                class. It should show understanding, invite discussion and stay on topic.

                Transcript:
                ---
                %s
                ---
                %s
                Reply with JSON only:
                {"question": "...", "rationale": "...", "timing": "...", "expected_impact": "..."}"""
                .formatted(transcript, materialsBlock(materials));
    }

    static String ideas(String transcript, String materials) {
        return """
                Based on the lecture, propose creative ideas and directions for deeper study.

                Transcript:
                ---
                %s
                ---
                %s
                Reply with JSON only:
                {"creative_ideas": [{"idea": "...", "connection": "..."}],
                 "deep_learning": [{"topic": "...", "reason": "..."}],
                 "cross_discipline": [{"field": "...", "connection": "..."}]}"""
                .formatted(transcript, materialsBlock(materials));
    }

    private static String materialsBlock(String materials) {
        if (materials == null || materials.isBlank()) {
            return "";
        }
        return "Lecture materials:\n" + materials + "\n";
    }
}
