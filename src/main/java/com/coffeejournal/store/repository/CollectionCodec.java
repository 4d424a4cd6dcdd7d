package com.coffeejournal.store.repository;

import com.coffeejournal.store.model.EntityRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of a collection file: a top-level array of objects, pretty-printed UTF-8.
 */
public final class CollectionCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.USE_LONG_FOR_INTS);

    private static final TypeReference<List<EntityRecord>> RECORDS = new TypeReference<>() {
    };

    private CollectionCodec() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static List<EntityRecord> decode(byte[] content) throws IOException {
        if (content.length == 0 || new String(content, StandardCharsets.UTF_8).isBlank()) {
            return new ArrayList<>();
        }
        List<EntityRecord> records = MAPPER.readValue(content, RECORDS);
        if (records == null) {
            return new ArrayList<>();
        }
        List<EntityRecord> mutable = new ArrayList<>(records.size());
        for (EntityRecord record : records) {
            if (record == null) {
                throw new IOException("Collection contains a null entry");
            }
            mutable.add(record);
        }
        return mutable;
    }

    public static byte[] encode(List<EntityRecord> records) {
        try {
            return MAPPER.writeValueAsBytes(records);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode collection", e);
        }
    }
}
