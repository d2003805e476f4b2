/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.campaign;

import com.drip.rules.api.model.Campaign;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads and writes campaigns (with their nested rules) as JSON.
 *
 * <p>The file holds an array of campaigns in snake_case:
 * <pre>
 * [
 *   {
 *     "name": "welcome",
 *     "enabled": true,
 *     "rules": [
 *       {"field_name": "date_joined", "lookup_type": "gte", "field_value": "now-1 day"}
 *     ]
 *   }
 * ]
 * </pre>
 * Unknown properties are ignored; timestamps are ISO-8601 strings.
 */
public class CampaignLoader {
    private static final Logger logger = Logger.getLogger(CampaignLoader.class.getName());

    private static final TypeReference<List<Campaign>> CAMPAIGN_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CampaignLoader() {
        this(defaultObjectMapper());
    }

    public CampaignLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Loads campaigns from a JSON file.
     *
     * @throws IOException if the file cannot be read or is not a valid campaign list
     */
    public List<Campaign> load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            List<Campaign> campaigns = read(is);
            logger.info("Loaded " + campaigns.size() + " campaigns from " + path);
            return campaigns;
        }
    }

    /**
     * Loads campaigns from a classpath resource.
     *
     * @throws IOException if the resource is missing or invalid
     */
    public List<Campaign> loadResource(String resourcePath) throws IOException {
        try (InputStream is = CampaignLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            List<Campaign> campaigns = read(is);
            logger.info("Loaded " + campaigns.size() + " campaigns from classpath: " + resourcePath);
            return campaigns;
        }
    }

    /**
     * Parses campaigns from a JSON string.
     */
    public List<Campaign> parse(String json) throws IOException {
        List<Campaign> campaigns = objectMapper.readValue(json, CAMPAIGN_LIST);
        return campaigns == null ? List.of() : campaigns;
    }

    private List<Campaign> read(InputStream is) throws IOException {
        List<Campaign> campaigns = objectMapper.readValue(is, CAMPAIGN_LIST);
        return campaigns == null ? List.of() : campaigns;
    }

    /**
     * Writes campaigns to a JSON file, replacing it.
     */
    public void write(List<Campaign> campaigns, Path path) throws IOException {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), campaigns);
        logger.info("Wrote " + campaigns.size() + " campaigns to " + path);
    }

    public String toJson(List<Campaign> campaigns) throws IOException {
        return objectMapper.writeValueAsString(campaigns);
    }
}
