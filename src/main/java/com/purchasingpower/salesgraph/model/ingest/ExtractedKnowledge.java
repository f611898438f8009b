package com.purchasingpower.salesgraph.model.ingest;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a knowledge extractor: an optional explicit topic list plus Q&amp;A records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedKnowledge {

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    @Builder.Default
    private List<ExtractedQaRecord> records = new ArrayList<>();
}
