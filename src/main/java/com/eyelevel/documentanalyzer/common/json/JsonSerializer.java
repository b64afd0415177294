package com.eyelevel.documentanalyzer.common.json;

/**
 * Defines the contract for serializing Java objects into JSON, used to persist job results.
 */
public interface JsonSerializer {

    /**
     * Serializes a Java object into its compact JSON representation.
     *
     * @param object The Java object to serialize.
     * @param <T>    The type of the Java object.
     *
     * @return The JSON representation of the object as a string.
     *
     * @throws com.eyelevel.documentanalyzer.exception.json.JsonParsingException if serialization fails.
     */
    <T> String serialize(T object);
}
