package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.domain.TranscriptSegment;
import com.phillippitts.classmate.exception.NothingToAnalyzeException;
import com.phillippitts.classmate.exception.UnknownQuestionException;
import com.phillippitts.classmate.service.bus.EventBus;
import com.phillippitts.classmate.service.bus.Subscription;
import com.phillippitts.classmate.service.bus.Topic;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * The analyzers of one session, wired to the event bus. Created by {@link AnalysisEngine#open}.
 *
 * <p>Final segments are fed, in order, to the transcript context, the question detector and
 * the summarizer; redelivered segment ids are ignored. Detected questions are fed to the
 * answer generator.
 */
public final class AnalysisSession {

    private static final Logger LOG = LogManager.getLogger(AnalysisSession.class);

    private final UUID sessionId;
    private final EventBus bus;
    private final TranscriptContext context;
    private final QuestionDetector questions;
    private final AnswerGenerator answers;
    private final Summarizer summarizer;
    private final SuggestionGenerator suggestions;
    private final IdeaGenerator ideas;
    private final AnalysisLane questionLane;
    private final AnalysisLane answerLane;
    private final AnalysisLane summaryLane;
    private final AnalysisLane suggestionLane;
    private final AnalysisLane ideaLane;
    private final boolean summariesEnabled;
    private final boolean ideasOnEnd;

    private Subscription segmentSubscription;
    private Subscription questionSubscription;
    private volatile boolean finished;

    AnalysisSession(UUID sessionId,
                    EventBus bus,
                    TranscriptContext context,
                    QuestionDetector questions,
                    AnswerGenerator answers,
                    Summarizer summarizer,
                    SuggestionGenerator suggestions,
                    IdeaGenerator ideas,
                    List<AnalysisLane> lanes,
                    boolean summariesEnabled,
                    boolean ideasOnEnd) {
        this.sessionId = sessionId;
        this.bus = bus;
        this.context = context;
        this.questions = questions;
        this.answers = answers;
        this.summarizer = summarizer;
        this.suggestions = suggestions;
        this.ideas = ideas;
        this.questionLane = lanes.get(0);
        this.answerLane = lanes.get(1);
        this.summaryLane = lanes.get(2);
        this.suggestionLane = lanes.get(3);
        this.ideaLane = lanes.get(4);
        this.summariesEnabled = summariesEnabled;
        this.ideasOnEnd = ideasOnEnd;
    }

    void attach() {
        segmentSubscription = bus.subscribe(Topic.TRANSCRIPT_SEGMENT, "analysis", this::onSegment);
        questionSubscription = bus.subscribe(Topic.QUESTION_DETECTED, "answers", answers::onQuestion);
    }

    private void onSegment(TranscriptSegment segment) {
        if (!segment.isFinal() || !context.add(segment)) {
            return;
        }
        questions.onFinal(segment);
        if (summariesEnabled) {
            summarizer.onFinal(segment);
        }
    }

    /** Drops queued analyzer work; running calls finish. */
    public void pause() {
        int cancelled = questionLane.cancelPending() + answerLane.cancelPending() + summaryLane.cancelPending()
                + suggestionLane.cancelPending() + ideaLane.cancelPending();
        LOG.info("Analysis paused ({} pending entries cancelled)", cancelled);
    }

    /**
     * Cuts the current summary window now.
     *
     * @return false once the session has finished
     * @throws NothingToAnalyzeException if summaries are disabled or there is no new transcript
     */
    public boolean requestSummary() {
        if (finished) {
            return false;
        }
        if (!summariesEnabled) {
            throw new NothingToAnalyzeException("Summaries are disabled", AnalyzerKind.SUMMARY.label());
        }
        if (!summarizer.requestSummary()) {
            throw new NothingToAnalyzeException("No new transcript since the last summary",
                    AnalyzerKind.SUMMARY.label());
        }
        return true;
    }

    public boolean requestSuggestion() {
        return !finished && suggestions.request();
    }

    public boolean requestIdeas() {
        return !finished && ideas.request();
    }

    /**
     * @throws UnknownQuestionException if no question with this id was detected
     */
    public boolean regenerateAnswer(String questionId) {
        return !finished && answers.regenerate(questionId);
    }

    public void onSummaryStallTick() {
        if (!finished && summariesEnabled) {
            summarizer.onStallTick();
        }
    }

    public void onSuggestionTick() {
        if (!finished) {
            suggestions.onTick();
        }
    }

    /**
     * Stops the analyzers at session end: cancels queued work, lets running calls finish,
     * summarizes the remaining transcript window, optionally generates ideas from the whole
     * lecture and waits for everything to settle.
     *
     * @param timeout upper bound for the whole shutdown
     * @return true if all analyzer work completed within the timeout
     */
    public boolean finish(Duration timeout) {
        if (finished) {
            return true;
        }
        finished = true;
        long deadline = System.nanoTime() + timeout.toNanos();
        bus.unsubscribe(segmentSubscription);
        questionLane.cancelPending();
        suggestionLane.cancelPending();
        ideaLane.cancelPending();
        boolean idle = questionLane.awaitIdle(remaining(deadline));
        // In-flight detections may still publish questions that the answer lane must see
        idle &= bus.awaitQuiescence(remaining(deadline));
        if (summariesEnabled) {
            summarizer.flush();
        }
        if (ideasOnEnd && !ideas.request()) {
            LOG.warn("End-of-session ideas could not be queued");
        }
        idle &= answerLane.awaitIdle(remaining(deadline));
        idle &= summaryLane.awaitIdle(remaining(deadline));
        idle &= suggestionLane.awaitIdle(remaining(deadline));
        idle &= ideaLane.awaitIdle(remaining(deadline));
        bus.unsubscribe(questionSubscription);
        if (!idle) {
            LOG.warn("Analysis for session {} did not settle within {} ms", sessionId, timeout.toMillis());
        }
        return idle;
    }

    public int finalSegmentCount() {
        return context.size();
    }

    public UUID sessionId() {
        return sessionId;
    }

    private static Duration remaining(long deadlineNanos) {
        return Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime()));
    }
}
