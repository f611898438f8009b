package com.purchasingpower.salesgraph.service.session;

import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.model.ingest.TurnRole;

import java.util.List;

/**
 * Collects dialogue turns per session until the session is turned into graph knowledge.
 */
public interface SessionTranscriptService {

    /**
     * @return Number of turns in the session after appending
     */
    int appendTurn(String sessionId, TurnRole role, String text);

    /**
     * @return Copy of the session's turns, empty for an unknown session
     */
    List<TranscriptTurn> getTranscript(String sessionId);

    void clearAll();
}
