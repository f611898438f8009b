package com.purchasingpower.salesgraph.model.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A single utterance in a customer/agent dialogue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptTurn {

    private TurnRole role;
    private String text;

    @Builder.Default
    private Instant at = Instant.now();

    public static TranscriptTurn customer(String text) {
        return TranscriptTurn.builder().role(TurnRole.CUSTOMER).text(text).build();
    }

    public static TranscriptTurn agent(String text) {
        return TranscriptTurn.builder().role(TurnRole.AGENT).text(text).build();
    }
}
