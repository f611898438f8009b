package com.purchasingpower.salesgraph.service.graph;

import com.purchasingpower.salesgraph.model.ingest.ExtractedKnowledge;
import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.model.result.BuildSummary;
import com.purchasingpower.salesgraph.model.result.IngestSummary;

import java.util.List;

/**
 * Writes dialogue transcripts and extracted knowledge into the graph.
 */
public interface GraphBuilderService {

    String FALLBACK_TOPIC = "General";

    String SOURCE_SESSION = "customer_session";
    String SOURCE_WEBSITE = "website_ingest";
    String SOURCE_REPAIR = "auto_repair";

    /**
     * Pair each customer question with the next agent reply.
     *
     * <p>Only one question is pending at a time: a second customer turn before any agent reply
     * replaces the first, which is then dropped. Each pair gets an {@code answers} edge and a
     * {@code describes_context} edge from a keyword-inferred topic.
     *
     * @param turns Dialogue in order
     * @param intentId Intent scope for created nodes and edges
     * @return Counts after the build
     */
    BuildSummary buildFromTranscript(List<TranscriptTurn> turns, String intentId);

    /**
     * Replace the whole graph with extracted knowledge.
     *
     * <p>The graph is reset and reseeded first. Records without a topic get one from keyword
     * inference over question and answer, or else a shared {@value #FALLBACK_TOPIC} topic linked
     * at lower confidence. Action labels only link to existing action nodes.
     *
     * @param knowledge Extractor output
     * @param intentId Intent scope
     * @param website Where the knowledge came from, recorded on edges when given
     * @return Topic and Q&amp;A counts
     */
    IngestSummary ingestExtraction(ExtractedKnowledge knowledge, String intentId, String website);

    /**
     * Link every question to a {@value #FALLBACK_TOPIC} topic when the graph has questions
     * but no {@code describes_context} edge at all. Running it twice changes nothing.
     *
     * @param intentId Intent scope
     * @return Number of links created
     */
    int repairOrphanQuestions(String intentId);
}
