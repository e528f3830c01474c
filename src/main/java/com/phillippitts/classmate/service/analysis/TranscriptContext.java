package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.domain.TranscriptSegment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Final segments of one session in arrival order, used as prompt context. Thread-safe.
 */
public final class TranscriptContext {

    private final List<TranscriptSegment> finals = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();

    /**
     * Records a final segment.
     *
     * @return false if a segment with the same id was already recorded
     */
    public synchronized boolean add(TranscriptSegment segment) {
        if (!segment.isFinal() || !ids.add(segment.id())) {
            return false;
        }
        finals.add(segment);
        return true;
    }

    public synchronized List<TranscriptSegment> recent(int count) {
        int from = Math.max(0, finals.size() - count);
        return List.copyOf(finals.subList(from, finals.size()));
    }

    public synchronized List<TranscriptSegment> all() {
        return List.copyOf(finals);
    }

    public synchronized int size() {
        return finals.size();
    }

    public static String text(List<TranscriptSegment> segments) {
        return segments.stream()
                .map(TranscriptSegment::text)
                .filter(t -> !t.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
