package com.purchasingpower.salesgraph.service.session.impl;

import com.purchasingpower.salesgraph.exception.InvalidInputException;
import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.model.ingest.TurnRole;
import com.purchasingpower.salesgraph.service.session.SessionTranscriptService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
public class InMemorySessionTranscriptService implements SessionTranscriptService {

    private final ConcurrentHashMap<String, List<TranscriptTurn>> sessions = new ConcurrentHashMap<>();

    @Override
    public int appendTurn(String sessionId, TurnRole role, String text) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidInputException("Session id is required");
        }
        if (role == null) {
            throw new InvalidInputException("Turn role is required");
        }
        TranscriptTurn turn = TranscriptTurn.builder()
                .role(role)
                .text(text == null ? "" : text)
                .at(Instant.now())
                .build();

        List<TranscriptTurn> turns = sessions.computeIfAbsent(sessionId, id -> Collections.synchronizedList(new ArrayList<>()));
        turns.add(turn);
        log.debug("Session {}: {} turn appended ({} total)", sessionId, role, turns.size());
        return turns.size();
    }

    @Override
    public List<TranscriptTurn> getTranscript(String sessionId) {
        List<TranscriptTurn> turns = sessionId == null ? null : sessions.get(sessionId);
        if (turns == null) {
            return List.of();
        }
        synchronized (turns) {
            return new ArrayList<>(turns);
        }
    }

    @Override
    public void clearAll() {
        log.info("Clearing {} session transcripts", sessions.size());
        sessions.clear();
    }
}
