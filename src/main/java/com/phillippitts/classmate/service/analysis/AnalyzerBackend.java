package com.phillippitts.classmate.service.analysis;

import com.phillippitts.classmate.exception.AnalysisException;

/**
 * Language-model completion used by every analyzer.
 */
public interface AnalyzerBackend {

    String name();

    /**
     * Returns the model's reply text for a prompt. Blocking.
     *
     * @throws AnalysisException on transport, authentication or provider errors
     */
    String complete(CompletionRequest request);
}
