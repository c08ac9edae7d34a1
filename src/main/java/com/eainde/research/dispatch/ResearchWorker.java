package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.ResearchAssignment;

/**
 * Researches one subtopic and returns a structured findings document.
 *
 * <p>Implementations own all fetching. They must not share mutable state with other
 * workers, and should stop promptly when their thread is interrupted.</p>
 */
@FunctionalInterface
public interface ResearchWorker {

    FindingsDocument research(ResearchAssignment assignment) throws ResearchWorkerException;
}
