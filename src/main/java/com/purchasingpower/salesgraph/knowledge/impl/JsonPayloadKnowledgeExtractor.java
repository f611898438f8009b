package com.purchasingpower.salesgraph.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.salesgraph.exception.InvalidInputException;
import com.purchasingpower.salesgraph.knowledge.KnowledgeExtractor;
import com.purchasingpower.salesgraph.model.ingest.ExtractedKnowledge;
import com.purchasingpower.salesgraph.model.ingest.ExtractedQaRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON an upstream extraction model produced for a website.
 *
 * <p>Expected shape:
 * <pre>
 * {
 *   "clues": ["Delivery Area", {"label": "Pricing"}],
 *   "qas": [
 *     {"clue_label": "Pricing", "question": "...", "answer": "...", "action": "Take order"}
 *   ]
 * }
 * </pre>
 * Extractors are inconsistent about key names, so topics may also arrive as {@code topics}
 * and a record's topic under {@code topic}, {@code category}, {@code section} or {@code clue}.
 * The payload may be wrapped in a markdown code fence or surrounded by prose.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonPayloadKnowledgeExtractor implements KnowledgeExtractor {

    private static final List<String> TOPIC_LIST_KEYS = List.of("clues", "topics");
    private static final List<String> RECORD_LIST_KEYS = List.of("qas", "records");
    private static final List<String> TOPIC_LABEL_KEYS = List.of("clue_label", "topic", "category", "section", "clue");

    private final ObjectMapper objectMapper;

    @Override
    public ExtractedKnowledge extract(String corpus) {
        if (corpus == null || corpus.isBlank()) {
            throw new InvalidInputException("Extraction payload is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(corpus));
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Extraction payload is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidInputException("Extraction payload must be a JSON object");
        }

        List<String> topics = new ArrayList<>();
        for (JsonNode topic : firstArray(root, TOPIC_LIST_KEYS)) {
            String label = topic.isObject() ? firstText(topic, List.of("label", "text")) : topic.asText("");
            if (!label.isBlank()) {
                topics.add(label.trim());
            }
        }

        List<ExtractedQaRecord> records = new ArrayList<>();
        for (JsonNode item : firstArray(root, RECORD_LIST_KEYS)) {
            if (!item.isObject()) {
                continue;
            }
            records.add(ExtractedQaRecord.builder()
                    .topicLabel(firstText(item, TOPIC_LABEL_KEYS))
                    .question(firstText(item, List.of("question")))
                    .answer(firstText(item, List.of("answer")))
                    .actionLabel(firstText(item, List.of("action")))
                    .build());
        }

        log.info("Parsed extraction payload: {} topics, {} Q&A records", topics.size(), records.size());
        return ExtractedKnowledge.builder()
                .topics(topics)
                .records(records)
                .build();
    }

    /**
     * Strip markdown fences and any prose around the outermost JSON object.
     */
    String extractJson(String response) {
        String cleaned = response.trim();

        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        cleaned = cleaned.trim();

        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            cleaned = cleaned.substring(start, end + 1);
        }
        return cleaned;
    }

    private static Iterable<JsonNode> firstArray(JsonNode root, List<String> keys) {
        for (String key : keys) {
            JsonNode candidate = root.get(key);
            if (candidate != null && candidate.isArray()) {
                return candidate;
            }
        }
        return List.of();
    }

    private static String firstText(JsonNode item, List<String> keys) {
        for (String key : keys) {
            JsonNode value = item.get(key);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return "";
    }
}
