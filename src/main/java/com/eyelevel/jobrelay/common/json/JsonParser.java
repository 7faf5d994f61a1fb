package com.eyelevel.jobrelay.common.json;

import java.util.List;

/**
 * Defines the contract for parsing JSON data.
 *
 * <p>Implementations handle the details of JSON parsing using a specific JSON library and report
 * failures as {@link com.eyelevel.jobrelay.exception.json.JsonParsingException}.
 */
public interface JsonParser {

    /**
     * Parses JSON data from a string into a Java object of the specified type.
     *
     * @param json      The JSON data as a string.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     */
    <T> T parseObject(String json, Class<T> valueType);

    /**
     * Parses JSON data from a byte array into a Java object of the specified type.
     *
     * @param jsonBytes The JSON data as a byte array.
     * @param valueType The class of the Java object to parse the JSON into.
     * @param <T>       The type of the Java object.
     *
     * @return The parsed Java object.
     */
    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);

    /**
     * Parses a JSON array into a list of elements of the specified type.
     *
     * @param json        The JSON array as a string.
     * @param elementType The class of each element.
     * @param <T>         The element type.
     *
     * @return The parsed elements, in document order.
     */
    <T> List<T> parseList(String json, Class<T> elementType);
}
