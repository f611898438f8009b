package com.purchasingpower.salesgraph.knowledge.impl;

import com.purchasingpower.salesgraph.configuration.AppProperties;
import com.purchasingpower.salesgraph.exception.GraphPersistenceException;
import com.purchasingpower.salesgraph.exception.InvalidInputException;
import com.purchasingpower.salesgraph.exception.NotFoundException;
import com.purchasingpower.salesgraph.knowledge.GraphManager;
import com.purchasingpower.salesgraph.knowledge.GraphSeeder;
import com.purchasingpower.salesgraph.knowledge.GraphStore;
import com.purchasingpower.salesgraph.knowledge.KnowledgeExtractor;
import com.purchasingpower.salesgraph.knowledge.QuestionRouter;
import com.purchasingpower.salesgraph.model.graph.EdgeType;
import com.purchasingpower.salesgraph.model.graph.GraphEdge;
import com.purchasingpower.salesgraph.model.graph.GraphNode;
import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;
import com.purchasingpower.salesgraph.model.ingest.ExtractedKnowledge;
import com.purchasingpower.salesgraph.model.ingest.TranscriptTurn;
import com.purchasingpower.salesgraph.model.ingest.TurnRole;
import com.purchasingpower.salesgraph.model.result.BuildSummary;
import com.purchasingpower.salesgraph.model.result.GraphContext;
import com.purchasingpower.salesgraph.model.result.IngestSummary;
import com.purchasingpower.salesgraph.model.result.QaResult;
import com.purchasingpower.salesgraph.model.result.ReviewTask;
import com.purchasingpower.salesgraph.service.graph.EdgeFeedbackService;
import com.purchasingpower.salesgraph.service.graph.GraphBuilderService;
import com.purchasingpower.salesgraph.service.graph.GraphPersistenceService;
import com.purchasingpower.salesgraph.service.graph.QaResolverService;
import com.purchasingpower.salesgraph.service.graph.ReviewTaskService;
import com.purchasingpower.salesgraph.service.session.SessionTranscriptService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Implementation of GraphManager guarding the store with a read/write lock.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphManagerImpl implements GraphManager {

    private final GraphStore graphStore;
    private final GraphSeeder seeder;
    private final GraphPersistenceService persistenceService;
    private final QuestionRouter questionRouter;
    private final KnowledgeExtractor knowledgeExtractor;
    private final QaResolverService qaResolver;
    private final EdgeFeedbackService feedbackService;
    private final GraphBuilderService graphBuilder;
    private final ReviewTaskService reviewTaskService;
    private final SessionTranscriptService sessionTranscripts;
    private final AppProperties appProperties;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    @PostConstruct
    public void init() {
        write(() -> {
            if (appProperties.getGraph().isLoadOnStartup()) {
                persistenceService.load().ifPresent(graphStore::restore);
            }
            seeder.seed(graphStore);
            log.info("Graph ready: {} nodes, {} edges (intent {})",
                    graphStore.nodeCount(), graphStore.edgeCount(), intentId());
            return null;
        });
    }

    // ================================================================
    // QUESTION ANSWERING
    // ================================================================

    @Override
    public QaResult ask(String question) {
        if (question == null || question.isBlank()) {
            return QaResult.unanswered(QaResult.REASON_EMPTY_QUESTION);
        }
        return read(() -> {
            Optional<String> questionId = questionRouter.route(question.strip());
            if (questionId.isEmpty()) {
                log.info("No graph question matches '{}'", question);
                return QaResult.unanswered(QaResult.REASON_NOT_ROUTED);
            }
            return qaResolver.resolve(questionId.get());
        });
    }

    @Override
    public QaResult resolve(String questionId) {
        return read(() -> qaResolver.resolve(questionId));
    }

    @Override
    public GraphContext graphContext(String question) {
        return GraphContext.from(question, ask(question));
    }

    // ================================================================
    // FEEDBACK AND REVIEW
    // ================================================================

    @Override
    public GraphEdge applyFeedback(String edgeId, int value) {
        return mutate(() -> feedbackService.applyFeedback(edgeId, value).copy());
    }

    @Override
    public GraphNode updateAnswer(String edgeId, String newAnswer) {
        if (newAnswer == null || newAnswer.isBlank()) {
            throw new InvalidInputException("Corrected answer is empty");
        }
        return mutate(() -> {
            GraphEdge edge = graphStore.getEdge(edgeId)
                    .orElseThrow(() -> new NotFoundException("Edge not found: " + edgeId));
            if (!edge.is(EdgeType.ANSWERS)) {
                throw new InvalidInputException("Edge " + edgeId + " is not an answers edge");
            }
            return graphStore.correctAnswer(edge.getTarget(), newAnswer).copy();
        });
    }

    @Override
    public List<ReviewTask> listReviewTasks() {
        return read(reviewTaskService::listTasks);
    }

    // ================================================================
    // BUILDING
    // ================================================================

    @Override
    public int appendSessionTurn(String sessionId, TurnRole role, String text) {
        return sessionTranscripts.appendTurn(sessionId, role, text);
    }

    @Override
    public BuildSummary buildFromSession(String sessionId) {
        List<TranscriptTurn> transcript = sessionTranscripts.getTranscript(sessionId);
        log.info("Building graph from session {} ({} turns)", sessionId, transcript.size());
        return mutate(() -> graphBuilder.buildFromTranscript(transcript, intentId()));
    }

    @Override
    public IngestSummary ingestCorpus(String corpus, String website) {
        ExtractedKnowledge knowledge = knowledgeExtractor.extract(corpus);
        return ingest(knowledge, website);
    }

    @Override
    public IngestSummary ingest(ExtractedKnowledge knowledge, String website) {
        if (knowledge == null) {
            throw new InvalidInputException("Extracted knowledge is required");
        }
        return mutate(() -> graphBuilder.ingestExtraction(knowledge, intentId(), website));
    }

    @Override
    public int repairOrphanQuestions() {
        return mutate(() -> graphBuilder.repairOrphanQuestions(intentId()));
    }

    // ================================================================
    // LIFECYCLE
    // ================================================================

    @Override
    public void reset() {
        mutate(() -> {
            graphStore.reset();
            sessionTranscripts.clearAll();
            return null;
        });
    }

    @Override
    public GraphSnapshot snapshot() {
        return read(graphStore::snapshot);
    }

    // ================================================================
    // LOCKING
    // ================================================================

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs a mutation and, with autosave on, persists the result before releasing the lock.
     * A failed save is logged; the in-memory graph stays as mutated and the next save retries.
     */
    private <T> T mutate(Supplier<T> mutation) {
        return write(() -> {
            T result = mutation.get();
            if (appProperties.getGraph().isAutosave()) {
                try {
                    persistenceService.save(graphStore.snapshot());
                } catch (GraphPersistenceException e) {
                    log.error("Graph snapshot not saved to {}", e.getLocation(), e);
                }
            }
            return result;
        });
    }

    private String intentId() {
        return appProperties.getGraph().getIntentId();
    }
}
