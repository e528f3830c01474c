/**
 * Language-model analysis of the live transcript: question detection, answers, windowed
 * summaries, suggested questions and ideas. Each analyzer runs behind its own bounded
 * {@link com.phillippitts.classmate.service.analysis.AnalysisLane}.
 */
package com.phillippitts.classmate.service.analysis;
