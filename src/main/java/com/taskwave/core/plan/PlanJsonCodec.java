package com.taskwave.core.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.taskwave.core.model.ExecutionPlan;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the plan document handed to executors.
 * <p>
 * Output is pretty-printed with a fixed property order, so identical plans serialize
 * to identical bytes.
 */
@Component
public class PlanJsonCodec {

    private final ObjectMapper mapper;

    public PlanJsonCodec() {
        this(new ObjectMapper());
    }

    @Autowired
    public PlanJsonCodec(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String write(ExecutionPlan plan) {
        try {
            return mapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution plan", e);
        }
    }

    public ExecutionPlan read(String json) {
        try {
            return mapper.readValue(json, ExecutionPlan.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid execution plan document: " + e.getOriginalMessage(), e);
        }
    }
}
