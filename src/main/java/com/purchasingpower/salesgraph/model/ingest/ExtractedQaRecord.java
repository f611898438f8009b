package com.purchasingpower.salesgraph.model.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One question/answer pair produced by a knowledge extractor, with optional topic and
 * follow-up action labels.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedQaRecord {

    private String topicLabel;
    private String question;
    private String answer;
    private String actionLabel;
}
