package com.phillippitts.classmate.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Creative ideas and further-study directions derived from the lecture so far.
 *
 * @param ideas            creative ideas connected to the lecture content
 * @param deepLearning     topics worth studying further
 * @param crossDiscipline  links to other fields
 * @param generatedAt      generation timestamp
 */
public record IdeaEvent(
        List<String> ideas,
        List<String> deepLearning,
        List<String> crossDiscipline,
        Instant generatedAt
) {

    public IdeaEvent {
        ideas = ideas == null ? List.of() : List.copyOf(ideas);
        deepLearning = deepLearning == null ? List.of() : List.copyOf(deepLearning);
        crossDiscipline = crossDiscipline == null ? List.of() : List.copyOf(crossDiscipline);
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
    }
}
