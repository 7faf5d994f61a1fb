package com.eyelevel.jobrelay.common.json.jackson;

import com.eyelevel.jobrelay.common.json.JsonParser;
import com.eyelevel.jobrelay.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.type.CollectionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Implementation of the {@link JsonParser} interface using the Jackson library.
 *
 * <p>Status records, registry entries and ledger records are all read through this class, so every
 * malformed document surfaces as a {@link JsonParsingException} whatever its origin.
 */
@Component("jacksonJsonParser")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonParser implements JsonParser {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T parseObject(String json, Class<T> valueType) {
        log.debug("Parsing JSON string to object of type: {}", valueType.getName());
        return parseJson(json.getBytes(StandardCharsets.UTF_8), valueType);
    }

    @Override
    public <T> T parseObject(byte[] jsonBytes, Class<T> valueType) {
        log.debug("Parsing JSON byte array to object of type: {}", valueType.getName());
        return parseJson(jsonBytes, valueType);
    }

    @Override
    public <T> List<T> parseList(String json, Class<T> elementType) {
        log.debug("Parsing JSON array to list of type: {}", elementType.getName());
        CollectionType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            List<T> result = objectMapper.readValue(json, listType);
            log.trace("Parsed {} element(s) of type {}", result.size(), elementType.getSimpleName());
            return result;
        } catch (IOException e) {
            log.warn("Error parsing JSON array of type {}: {}", elementType.getName(), e.getMessage());
            throw new JsonParsingException("Error parsing JSON array", e);
        }
    }

    private <T> T parseJson(byte[] jsonBytes, Class<T> valueType) {
        try {
            T result = objectMapper.readValue(jsonBytes, valueType);
            log.trace("Parsing JSON successful: {}", result);
            return result;
        } catch (IOException e) {
            log.warn("Error parsing JSON with Class {}: {}", valueType.getName(), e.getMessage());
            throw new JsonParsingException("Error parsing JSON with Class " + valueType.getSimpleName(), e);
        }
    }
}
