package com.purchasingpower.salesgraph.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Grounding handed to a dialogue composer: facts it may state and actions it may offer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphContext {

    private String question;

    @Builder.Default
    private List<String> facts = new ArrayList<>();

    @Builder.Default
    private List<SuggestedAction> actions = new ArrayList<>();

    private double confidence;
    private String reason;

    public static GraphContext from(String question, QaResult result) {
        List<String> facts = new ArrayList<>();
        if (result.getAnswer() != null) {
            facts.add(result.getAnswer());
        }
        return GraphContext.builder()
            .question(question)
            .facts(facts)
            .actions(new ArrayList<>(result.getActions()))
            .confidence(result.getConfidence())
            .reason(result.getReason())
            .build();
    }
}
