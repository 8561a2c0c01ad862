package com.demoBank.swapPremium.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Utility class for loading JSON files from the classpath.
 * Files are expected to hold a single JSON array of objects.
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {}

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file (e.g., "data/sample-disclosures.json")
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
     * Loads a JSON array from the classpath and deserializes each element to {@code clazz}.
     *
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> List<T> loadAsList(String resourcePath, Class<T> clazz) throws IOException {
        String jsonString = loadAsString(resourcePath);
        return objectMapper.readValue(jsonString,
                objectMapper.getTypeFactory().constructCollectionType(List.class, clazz));
    }

    /**
     * As {@link #loadAsList(String, Class)}, returning an empty list when the file is missing
     * or cannot be parsed.
     */
    public static <T> List<T> loadAsListOrEmpty(String resourcePath, Class<T> clazz) {
        try {
            return loadAsList(resourcePath, clazz);
        } catch (IOException e) {
            log.warn("Failed to load JSON file from classpath: {}", resourcePath, e);
            return List.of();
        }
    }
}
