package com.tazifor.elevations.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.elevations.service.KafkaPopulationRequester;
import com.tazifor.elevations.service.PopulationRequester;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Properties;

/**
 * Kafka producer for population requests
 *
 * Population requests are small and rare (deduplicated per cell), so the
 * producer favours bounded blocking over throughput: a send never blocks the
 * request thread for more than max.block.ms.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${kafka.population-topic:elevations.population-requests}")
    private String populationTopic;

    @Value("${kafka.max-block-ms:2000}")
    private int maxBlockMs;

    @Bean(destroyMethod = "close")
    public Producer<String, String> populationProducer() {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "elevations-api");
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);

        log.info("Population requests go to topic {} on {}", populationTopic, bootstrapServers);
        return new KafkaProducer<>(props);
    }

    @Bean
    public PopulationRequester populationRequester(Producer<String, String> populationProducer, ObjectMapper objectMapper) {
        return new KafkaPopulationRequester(populationProducer, populationTopic, objectMapper);
    }
}
