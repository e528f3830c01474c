package com.phillippitts.classmate.service.bus;

import com.phillippitts.classmate.domain.AnalysisFailureEvent;
import com.phillippitts.classmate.domain.AnswerEvent;
import com.phillippitts.classmate.domain.AudioFrame;
import com.phillippitts.classmate.domain.IdeaEvent;
import com.phillippitts.classmate.domain.LifecycleEvent;
import com.phillippitts.classmate.domain.QuestionEvent;
import com.phillippitts.classmate.domain.SuggestionEvent;
import com.phillippitts.classmate.domain.SummaryEvent;
import com.phillippitts.classmate.domain.TranscriptSegment;

import java.util.List;
import java.util.Objects;

/**
 * Typed key of an event bus topic. Only the constants below exist; the type parameter ties
 * each topic to the event it carries so that publish and subscribe are checked at compile time.
 *
 * @param <T> event type carried on this topic
 */
public final class Topic<T> {

    public static final Topic<AudioFrame> AUDIO_FRAME = new Topic<>("audio.frame", AudioFrame.class);
    public static final Topic<TranscriptSegment> TRANSCRIPT_SEGMENT =
            new Topic<>("transcript.segment", TranscriptSegment.class);
    public static final Topic<QuestionEvent> QUESTION_DETECTED =
            new Topic<>("question.detected", QuestionEvent.class);
    public static final Topic<AnswerEvent> ANSWER_GENERATED = new Topic<>("answer.generated", AnswerEvent.class);
    public static final Topic<SummaryEvent> SUMMARY_GENERATED =
            new Topic<>("summary.generated", SummaryEvent.class);
    public static final Topic<SuggestionEvent> SUGGESTION_GENERATED =
            new Topic<>("suggestion.generated", SuggestionEvent.class);
    public static final Topic<IdeaEvent> IDEA_GENERATED = new Topic<>("idea.generated", IdeaEvent.class);
    public static final Topic<LifecycleEvent> SESSION_LIFECYCLE =
            new Topic<>("session.lifecycle", LifecycleEvent.class);
    public static final Topic<AnalysisFailureEvent> ANALYSIS_FAILED =
            new Topic<>("analysis.failed", AnalysisFailureEvent.class);

    private static final List<Topic<?>> ALL = List.of(AUDIO_FRAME, TRANSCRIPT_SEGMENT, QUESTION_DETECTED,
            ANSWER_GENERATED, SUMMARY_GENERATED, SUGGESTION_GENERATED, IDEA_GENERATED, SESSION_LIFECYCLE,
            ANALYSIS_FAILED);

    private final String name;
    private final Class<T> eventType;

    private Topic(String name, Class<T> eventType) {
        this.name = name;
        this.eventType = eventType;
    }

    public String name() {
        return name;
    }

    public Class<T> eventType() {
        return eventType;
    }

    public static List<Topic<?>> all() {
        return ALL;
    }

    /**
     * Looks up a topic by its wire name.
     *
     * @throws IllegalArgumentException if no topic has that name
     */
    public static Topic<?> byName(String name) {
        Objects.requireNonNull(name, "name");
        for (Topic<?> topic : ALL) {
            if (topic.name.equals(name)) {
                return topic;
            }
        }
        throw new IllegalArgumentException("Unknown topic: " + name);
    }

    @Override
    public String toString() {
        return name;
    }
}
