package com.nevis.docsearch.config;

import com.nevis.docsearch.messaging.Topics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

@Slf4j
@Configuration
public class KafkaConfig {

    @Bean
    @ConditionalOnProperty(name = "app.kafka.create-topics", havingValue = "true", matchIfMissing = true)
    public KafkaAdmin.NewTopics documentTopics(
        @Value("${app.kafka.partitions:6}") int partitions,
        @Value("${app.kafka.replicas:1}") short replicas
    ) {
        return new KafkaAdmin.NewTopics(
            TopicBuilder.name(Topics.DOCUMENT_INDEX).partitions(partitions).replicas(replicas).build(),
            TopicBuilder.name(Topics.DOCUMENT_DELETE).partitions(partitions).replicas(replicas).build()
        );
    }

    /**
     * Batch listener factory for the indexing consumer. A failed batch is logged and skipped
     * without redelivery; per-record failures are handled inside the listener.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<Object, Object> batchListenerContainerFactory(
        ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
        ConsumerFactory<Object, Object> consumerFactory,
        @Value("${app.kafka.concurrency:5}") int concurrency,
        @Value("${app.kafka.listeners-enabled:true}") boolean autoStartup
    ) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> factory = new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(factory, consumerFactory);
        factory.setBatchListener(true);
        factory.setConcurrency(concurrency);
        factory.setAutoStartup(autoStartup);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(
            (record, e) -> log.error("Skipping record {}-{}@{} after batch failure: {}",
                record.topic(), record.partition(), record.offset(), e.getMessage()),
            new FixedBackOff(0L, 0L));
        factory.setCommonErrorHandler(errorHandler);
        return factory;
    }
}
