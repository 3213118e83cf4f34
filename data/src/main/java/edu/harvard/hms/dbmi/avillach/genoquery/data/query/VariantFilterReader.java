package edu.harvard.hms.dbmi.avillach.genoquery.data.query;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads filters from their JSON form. Unknown keys are rejected rather than ignored.
 */
public class VariantFilterReader {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public static VariantFilter read(String json) throws IOException {
        return objectMapper.readValue(json, VariantFilter.class);
    }

    public static VariantFilter read(InputStream json) throws IOException {
        return objectMapper.readValue(json, VariantFilter.class);
    }

    public static String write(VariantFilter filter) throws IOException {
        return objectMapper.writeValueAsString(filter);
    }
}
