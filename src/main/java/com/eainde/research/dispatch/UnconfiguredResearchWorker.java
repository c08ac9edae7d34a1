package com.eainde.research.dispatch;

import com.eainde.research.model.FindingsDocument;
import com.eainde.research.model.ResearchAssignment;

/**
 * Installed when no chat model is configured. Every assignment fails at the fetch layer,
 * so runs still finish with a degraded report that explains why.
 */
public class UnconfiguredResearchWorker implements ResearchWorker {

    @Override
    public FindingsDocument research(ResearchAssignment assignment) throws ResearchWorkerException {
        throw new WorkerFetchException("no chat model is configured (set research.llm.api-key)");
    }
}
