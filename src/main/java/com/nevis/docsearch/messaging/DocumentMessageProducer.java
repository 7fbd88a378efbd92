package com.nevis.docsearch.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.docsearch.job.IndexingTaskService;
import com.nevis.docsearch.model.IndexAction;
import com.nevis.docsearch.model.IndexMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Fire-and-forget publisher for document intents. When a document message cannot be handed
 * to the broker, the task is enqueued directly so indexing is not lost. Messages for other
 * topics are dropped with a warning.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentMessageProducer {

    public static final String SOURCE = "document-search-api";
    public static final String TIMESTAMP_HEADER = "timestamp";
    public static final String SOURCE_HEADER = "source";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final IndexingTaskService indexingTaskService;
    private final Clock clock;

    public void publish(String topic, Object payload, String key) {
        try {
            ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, objectMapper.writeValueAsString(payload));
            record.headers().add(TIMESTAMP_HEADER, OffsetDateTime.now(clock).toString().getBytes(StandardCharsets.UTF_8));
            record.headers().add(SOURCE_HEADER, SOURCE.getBytes(StandardCharsets.UTF_8));

            kafkaTemplate.send(record).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Kafka delivery to {} failed: {}", topic, ex.getMessage());
                    fallback(topic, payload);
                } else {
                    log.debug("Published to {}-{}@{}", topic,
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                }
            });
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize payload for {}: {}", topic, e.getMessage());
            fallback(topic, payload);
        } catch (RuntimeException e) {
            log.error("Kafka publish to {} failed: {}", topic, e.getMessage());
            fallback(topic, payload);
        }
    }

    private void fallback(String topic, Object payload) {
        IndexAction action = IndexAction.fromTopic(topic);
        if (action == null || !(payload instanceof IndexMessage message)) {
            log.warn("No fallback for topic {}, message dropped: {}", topic, payload);
            return;
        }

        log.warn("Enqueuing {} of document {} directly, bypassing Kafka", action, message.documentId());
        try {
            indexingTaskService.enqueue(action, message.documentId(), message.tenantId());
        } catch (RuntimeException e) {
            log.error("Fallback enqueue for document {} failed, intent lost: {}", message.documentId(), e.getMessage());
        }
    }
}
