package com.tazifor.elevations.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tazifor.elevations.geo.model.CellId;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * KafkaPopulationRequester - asks the elevations populator to fill missing cells
 *
 * MESSAGE:
 * One record per request on the population topic, JSON value
 * {@code {"h3_cells": [630949280220400639, ...]}}, no key.
 *
 * FIRE AND FORGET:
 * The send is asynchronous; delivery failures are only logged from the
 * producer callback. The producer's max.block.ms bounds how long a send may
 * block waiting for metadata or buffer space.
 */
@Slf4j
public class KafkaPopulationRequester implements PopulationRequester {

    static final String CELLS_FIELD = "h3_cells";

    private final Producer<String, String> producer;
    private final String topic;
    private final ObjectMapper objectMapper;

    public KafkaPopulationRequester(Producer<String, String> producer, String topic, ObjectMapper objectMapper) {
        this.producer = producer;
        this.topic = topic;
        this.objectMapper = objectMapper;
    }

    @Override
    public void requestPopulation(Set<CellId> cells) {
        if (cells.isEmpty()) {
            return;
        }
        String payload = toPayload(cells);
        producer.send(new ProducerRecord<>(topic, payload), (metadata, exception) -> {
            if (exception != null) {
                log.error("Population request for {} cells was not delivered to {}", cells.size(), topic, exception);
            } else {
                log.info("Requested population of {} cells ({}-{}@{})",
                    cells.size(), metadata.topic(), metadata.partition(), metadata.offset());
            }
        });
    }

    String toPayload(Set<CellId> cells) {
        List<Long> ids = cells.stream().map(CellId::value).collect(Collectors.toList());
        try {
            return objectMapper.writeValueAsString(Map.of(CELLS_FIELD, ids));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize population request", e);
        }
    }
}
