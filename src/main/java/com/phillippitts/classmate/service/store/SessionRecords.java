package com.phillippitts.classmate.service.store;

import com.phillippitts.classmate.domain.AnalysisFailureEvent;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.IdeaEvent;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.Session;
import com.phillippitts.classmate.domain.SuggestionEvent;
import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON shapes of the persisted session records.
 */
final class SessionRecords {

    private SessionRecords() {
    }

    static JSONObject meta(Session session, int segmentCount) {
        return new JSONObject()
                .put("id", session.id().toString())
                .put("name", session.name())
                .put("description", session.description())
                .put("created_at", session.createdAt().toString())
                .put("state", session.state().name())
                .put("materials", new JSONArray(session.materialsRefs()))
                .put("segment_count", segmentCount);
    }

    static JSONObject segment(TranscriptSegment segment) {
        return new JSONObject()
                .put("id", segment.id())
                .put("start_ms", segment.startMs())
                .put("end_ms", segment.endMs())
                .put("text", segment.text())
                .put("language", segment.language())
                .put("speaker_id", segment.speakerId());
    }

    static JSONObject question(QuestionEvent question) {
        return new JSONObject()
                .put("id", question.id())
                .put("segment_id", question.segmentId())
                .put("question", question.questionText())
                .put("kind", question.kind().name())
                .put("confidence", question.confidence())
                .put("detected_at", question.detectedAt().toString())
                .put("covered_segment_ids", new JSONArray(question.coveredSegmentIds()))
                .put("answer", JSONObject.NULL);
    }

    static JSONObject answer(AnswerEvent answer) {
        return new JSONObject()
                .put("text", answer.answerText())
                .put("revision", answer.revision())
                .put("fallback", answer.fallback())
                .put("latency_ms", answer.modelLatencyMs())
                .put("generated_at", answer.generatedAt().toString());
    }

    static JSONObject summary(SummaryEvent summary) {
        return new JSONObject()
                .put("window_start_ms", summary.windowStartMs())
                .put("window_end_ms", summary.windowEndMs())
                .put("title", summary.title())
                .put("summary", summary.text())
                .put("key_points", new JSONArray(summary.keyPoints()))
                .put("concepts", new JSONArray(summary.concepts()))
                .put("segment_count", summary.segmentCount())
                .put("fallback", summary.fallback())
                .put("generated_at", summary.generatedAt().toString());
    }

    static JSONObject suggestion(SuggestionEvent suggestion) {
        return new JSONObject()
                .put("question", suggestion.question())
                .put("rationale", suggestion.rationale())
                .put("timing", suggestion.timing())
                .put("expected_impact", suggestion.expectedImpact())
                .put("generated_at", suggestion.generatedAt().toString());
    }

    static JSONObject ideas(IdeaEvent ideas) {
        return new JSONObject()
                .put("ideas", new JSONArray(ideas.ideas()))
                .put("deep_learning", new JSONArray(ideas.deepLearning()))
                .put("cross_discipline", new JSONArray(ideas.crossDiscipline()))
                .put("generated_at", ideas.generatedAt().toString());
    }

    static JSONObject lifecycle(LifecycleEvent event) {
        return new JSONObject()
                .put("type", "lifecycle")
                .put("kind", event.kind().name())
                .put("detail", event.detail())
                .put("at", event.at().toString());
    }

    static JSONObject failure(AnalysisFailureEvent event) {
        return new JSONObject()
                .put("type", "analysis_failed")
                .put("analyzer", event.analyzer())
                .put("related_id", event.relatedId())
                .put("message", event.message())
                .put("at", event.at().toString());
    }
}
