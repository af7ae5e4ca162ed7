package com.demoPayroll.taxEngine.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Utility class for loading JSON documents from the classpath.
 * Used for statutory limit tables and for decoded declaration records.
 */
public class JsonFileLoader {
    
    private static final ObjectMapper objectMapper = new ObjectMapper();
    
    private JsonFileLoader() {}
    
    /**
     * Loads a JSON file from the classpath as a String.
     * 
     * @param resourcePath The path to the JSON file (e.g., "limits/2024-2025.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
    
    /**
     * Loads a JSON file from the classpath and deserializes it to the specified type.
     * 
     * @param resourcePath The path to the JSON file
     * @param clazz The class to deserialize the JSON into
     * @param <T> The type to deserialize to
     * @return An instance of the specified type
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> T loadAsObject(String resourcePath, Class<T> clazz) throws IOException {
        String jsonString = loadAsString(resourcePath);
        return objectMapper.readValue(jsonString, clazz);
    }
    
    /**
     * Loads a JSON object from the classpath as a plain nested map, the same
     * shape a remote API client hands over after decoding a response body.
     * 
     * @param resourcePath The path to the JSON file containing a JSON object
     * @return Decoded map (nested objects are maps, arrays are lists)
     * @throws IOException if the file cannot be read, doesn't exist, or is not a JSON object
     */
    public static Map<String, Object> loadAsMap(String resourcePath) throws IOException {
        String jsonString = loadAsString(resourcePath);
        return readMap(jsonString);
    }
    
    /**
     * Decodes a JSON object string into a plain nested map.
     */
    public static Map<String, Object> readMap(String json) throws IOException {
        return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
    }
}
