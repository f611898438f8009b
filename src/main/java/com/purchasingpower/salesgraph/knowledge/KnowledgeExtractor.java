package com.purchasingpower.salesgraph.knowledge;

import com.purchasingpower.salesgraph.model.ingest.ExtractedKnowledge;

/**
 * Turns a corpus (for example crawled website content) into topic and Q&amp;A records.
 *
 * @since 1.0.0
 */
public interface KnowledgeExtractor {

    ExtractedKnowledge extract(String corpus);
}
