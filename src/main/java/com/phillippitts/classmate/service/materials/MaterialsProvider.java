package com.phillippitts.classmate.service.materials;

import java.util.List;

/**
 * Turns imported lecture materials into plain text used as prompt context.
 */
public interface MaterialsProvider {

    /**
     * Loads the given material references.
     *
     * @param refs file paths as supplied at session creation
     * @return concatenated text of every readable material; empty when none are readable
     */
    String load(List<String> refs);
}
