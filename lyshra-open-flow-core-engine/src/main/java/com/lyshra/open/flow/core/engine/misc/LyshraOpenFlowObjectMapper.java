package com.lyshra.open.flow.core.engine.misc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class LyshraOpenFlowObjectMapper {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private LyshraOpenFlowObjectMapper() {}

    public <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    private static final class SingletonHolder {
        private static final LyshraOpenFlowObjectMapper INSTANCE = new LyshraOpenFlowObjectMapper();
    }

    public static LyshraOpenFlowObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
