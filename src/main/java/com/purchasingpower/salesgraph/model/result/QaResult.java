package com.purchasingpower.salesgraph.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Answer resolved from the graph for one question.
 *
 * <p>"No answer" is a normal result: {@code answer} is null, {@code confidence} is 0 and
 * {@code reason} says why.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QaResult {

    public static final String REASON_EMPTY_QUESTION = "Empty question";
    public static final String REASON_NOT_ROUTED = "No matching question in graph";
    public static final String REASON_UNKNOWN_QUESTION = "No matching question node";
    public static final String REASON_NO_ANSWER_EDGE = "Question has no answer node";
    public static final String REASON_ANSWER_MISSING = "Answer node missing";

    private String matchedQuestionId;
    private String matchedQuestion;

    /**
     * The {@code answers} edge used, so callers can send feedback on it.
     */
    private String answerEdgeId;

    private String answer;
    private double confidence;

    @Builder.Default
    private List<SuggestedAction> actions = new ArrayList<>();

    private String reason;

    public boolean isAnswered() {
        return answer != null;
    }

    public static QaResult unanswered(String reason) {
        return QaResult.builder()
            .reason(reason)
            .build();
    }

    public static QaResult unanswered(String questionId, String questionText, String reason) {
        return QaResult.builder()
            .matchedQuestionId(questionId)
            .matchedQuestion(questionText)
            .reason(reason)
            .build();
    }
}
