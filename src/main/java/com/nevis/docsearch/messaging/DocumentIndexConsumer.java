package com.nevis.docsearch.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.docsearch.job.IndexingTaskService;
import com.nevis.docsearch.model.IndexAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns queue messages into indexing tasks. Each record is handled on its own; a bad record
 * is logged and the rest of the batch still goes through. No deduplication happens here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentIndexConsumer {

    private final ObjectMapper objectMapper;
    private final IndexingTaskService indexingTaskService;

    @KafkaListener(
        id = "document-index-consumer",
        topics = {Topics.DOCUMENT_INDEX, Topics.DOCUMENT_DELETE},
        groupId = "${app.kafka.consumer-group}",
        containerFactory = "batchListenerContainerFactory"
    )
    public void consume(List<ConsumerRecord<String, String>> records) {
        log.debug("Received batch of {} messages", records.size());

        int enqueued = 0;
        for (ConsumerRecord<String, String> record : records) {
            try {
                if (handle(record)) {
                    enqueued++;
                }
            } catch (JsonProcessingException e) {
                log.error("Malformed message at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getOriginalMessage());
            } catch (RuntimeException e) {
                log.error("Failed to enqueue message at {}-{}@{}: {}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            }
        }

        log.debug("Enqueued {}/{} messages", enqueued, records.size());
    }

    private boolean handle(ConsumerRecord<String, String> record) throws JsonProcessingException {
        if (record.value() == null) {
            log.warn("Empty message at {}-{}@{}, skipping", record.topic(), record.partition(), record.offset());
            return false;
        }

        JsonNode payload = objectMapper.readTree(record.value());
        Long documentId = longOrNull(payload, "document_id");
        Long tenantId = longOrNull(payload, "tenant_id");

        IndexAction action = IndexAction.fromWire(payload.path("action").asText(null));
        if (action == null) {
            action = IndexAction.fromTopic(record.topic());
        }
        if (action == null) {
            log.warn("Cannot tell the action of message at {}-{}@{}, skipping",
                record.topic(), record.partition(), record.offset());
            return false;
        }

        indexingTaskService.enqueue(action, documentId, tenantId);
        return true;
    }

    private static Long longOrNull(JsonNode payload, String field) {
        JsonNode value = payload.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return value.asLong();
        }
        if (value.isTextual() && value.asText().trim().matches("\\d{1,18}")) {
            return Long.valueOf(value.asText().trim());
        }
        return null;
    }
}
