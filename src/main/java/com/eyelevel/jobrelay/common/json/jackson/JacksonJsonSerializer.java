package com.eyelevel.jobrelay.common.json.jackson;

import com.eyelevel.jobrelay.common.json.JsonSerializer;
import com.eyelevel.jobrelay.exception.json.JsonParsingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("jacksonJsonSerializer")
@RequiredArgsConstructor
@Slf4j
public class JacksonJsonSerializer implements JsonSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> String serialize(T object) {
        return serialize(object, false);
    }

    /**
     * Serializes a Java object, optionally pretty printed. Documents that workers or operators read
     * (status records, registry entries, merge summaries) are written pretty printed.
     *
     * @throws JsonParsingException if an error occurs during JSON serialization.
     */
    @Override
    public <T> String serialize(T object, boolean prettyPrint) {
        log.debug("Serializing Java object to JSON string (prettyPrint: {}): {}", prettyPrint,
                  object.getClass().getName());
        try {
            String json = prettyPrint
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(object)
                    : objectMapper.writeValueAsString(object);
            log.trace("Java object has been serialized to JSON: {}", json);
            return json;
        } catch (JsonProcessingException e) {
            log.error("Error serializing Java object to JSON", e);
            throw new JsonParsingException("Error serializing Java object to JSON", e);
        }
    }
}
