/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.compiler.config;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration of the rule compiler's syntax conventions.
 *
 * <p><b>Environment Variable Override:</b>
 * Every property can be overridden via environment variables (or JVM system properties
 * of the same name):
 * <pre>
 * DRIP_LOOKUP_SEPARATOR=__
 * DRIP_COUNT_MARKER=count
 * DRIP_ANNOTATION_PREFIX=num_
 * DRIP_FIELD_REFERENCE_PREFIX=F_
 * DRIP_STRICT_METHOD_TYPE=false
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * // Defaults plus environment overrides
 * DripConfig config = DripConfig.fromEnvironment();
 *
 * // From drip.properties on the classpath
 * DripConfig config = DripConfig.loadDefault();
 *
 * // Explicit
 * DripConfig config = DripConfig.builder()
 *     .strictMethodType(true)
 *     .build();
 * }</pre>
 */
public final class DripConfig {

    private static final Logger logger = Logger.getLogger(DripConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_LOOKUP_SEPARATOR = "DRIP_LOOKUP_SEPARATOR";
    static final String ENV_COUNT_MARKER = "DRIP_COUNT_MARKER";
    static final String ENV_ANNOTATION_PREFIX = "DRIP_ANNOTATION_PREFIX";
    static final String ENV_FIELD_REFERENCE_PREFIX = "DRIP_FIELD_REFERENCE_PREFIX";
    static final String ENV_STRICT_METHOD_TYPE = "DRIP_STRICT_METHOD_TYPE";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    /** Path separator of the store's field addressing, also joins field and lookup. */
    private final String lookupSeparator;

    /** Final path segment that marks a related-collection count, e.g. {@code orders__count}. */
    private final String countMarker;

    /** Prefix of the alias under which a count annotation is exposed. */
    private final String annotationPrefix;

    /** Prefix of a field value that references another field of the same row. */
    private final String fieldReferencePrefix;

    /** Whether an unknown method type fails instead of falling back to filter. */
    private final boolean strictMethodType;

    private DripConfig(Builder builder) {
        this.lookupSeparator = builder.lookupSeparator;
        this.countMarker = builder.countMarker;
        this.annotationPrefix = builder.annotationPrefix;
        this.fieldReferencePrefix = builder.fieldReferencePrefix;
        this.strictMethodType = builder.strictMethodType;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Built-in defaults, ignoring the environment.
     */
    public static DripConfig defaults() {
        return new Builder(false).build();
    }

    /**
     * Defaults with environment variable overrides applied.
     */
    public static DripConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Loads {@code drip.properties} from the classpath root, falling back to defaults.
     */
    public static DripConfig loadDefault() {
        return loadFromProperties("drip.properties");
    }

    /**
     * Loads configuration from a properties file, searched on the classpath first and
     * then on the file system. Environment variables override file values.
     *
     * <p><b>Example drip.properties:</b>
     * <pre>
     * drip.lookup.separator=__
     * drip.count.marker=count
     * drip.annotation.prefix=num_
     * drip.field.reference.prefix=F_
     * drip.strict.method.type=false
     * </pre>
     *
     * @param propertiesPath classpath resource or file path
     * @return configuration loaded from the properties file
     */
    public static DripConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading drip configuration from: " + propertiesPath);

        Properties props = new Properties();

        try (InputStream is = DripConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        return builderFromProperties(props).build();
    }

    /**
     * Creates a builder from properties; environment variables still take precedence.
     */
    static Builder builderFromProperties(Properties props) {
        Builder builder = new Builder(false);

        String separator = props.getProperty("drip.lookup.separator");
        if (separator != null) {
            builder.lookupSeparator = separator;
        }

        String marker = props.getProperty("drip.count.marker");
        if (marker != null) {
            builder.countMarker = marker;
        }

        String prefix = props.getProperty("drip.annotation.prefix");
        if (prefix != null) {
            builder.annotationPrefix = prefix;
        }

        String referencePrefix = props.getProperty("drip.field.reference.prefix");
        if (referencePrefix != null) {
            builder.fieldReferencePrefix = referencePrefix;
        }

        String strict = props.getProperty("drip.strict.method.type");
        if (strict != null) {
            builder.strictMethodType = Boolean.parseBoolean(strict);
        }

        builder.applyEnvironmentVariables();
        return builder;
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    private void validate() {
        if (lookupSeparator == null || lookupSeparator.isEmpty()) {
            throw new IllegalArgumentException("lookupSeparator must not be empty");
        }
        if (countMarker == null || countMarker.isBlank()) {
            throw new IllegalArgumentException("countMarker must not be blank");
        }
        if (annotationPrefix == null || annotationPrefix.isBlank()) {
            throw new IllegalArgumentException("annotationPrefix must not be blank");
        }
        if (fieldReferencePrefix == null || fieldReferencePrefix.isEmpty()) {
            throw new IllegalArgumentException("fieldReferencePrefix must not be empty");
        }
        if (countMarker.contains(lookupSeparator)) {
            throw new IllegalArgumentException(
                    "countMarker '" + countMarker + "' must not contain the separator '" + lookupSeparator + "'");
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public String getLookupSeparator() {
        return lookupSeparator;
    }

    public String getCountMarker() {
        return countMarker;
    }

    /**
     * Returns the full suffix of a count field, e.g. {@code __count}.
     */
    public String getCountSuffix() {
        return lookupSeparator + countMarker;
    }

    public String getAnnotationPrefix() {
        return annotationPrefix;
    }

    public String getFieldReferencePrefix() {
        return fieldReferencePrefix;
    }

    public boolean isStrictMethodType() {
        return strictMethodType;
    }

    @Override
    public String toString() {
        return "DripConfig{" +
                "lookupSeparator='" + lookupSeparator + '\'' +
                ", countMarker='" + countMarker + '\'' +
                ", annotationPrefix='" + annotationPrefix + '\'' +
                ", fieldReferencePrefix='" + fieldReferencePrefix + '\'' +
                ", strictMethodType=" + strictMethodType +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder(true);
    }

    /**
     * Creates a builder initialized with this configuration's values, without
     * re-reading the environment.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.lookupSeparator = this.lookupSeparator;
        builder.countMarker = this.countMarker;
        builder.annotationPrefix = this.annotationPrefix;
        builder.fieldReferencePrefix = this.fieldReferencePrefix;
        builder.strictMethodType = this.strictMethodType;
        return builder;
    }

    public static class Builder {
        private String lookupSeparator = "__";
        private String countMarker = "count";
        private String annotationPrefix = "num_";
        private String fieldReferencePrefix = "F_";
        private boolean strictMethodType = false;

        private Builder(boolean loadEnvironment) {
            if (loadEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnv(ENV_LOOKUP_SEPARATOR).ifPresent(val -> this.lookupSeparator = val);
            getEnv(ENV_COUNT_MARKER).ifPresent(val -> this.countMarker = val);
            getEnv(ENV_ANNOTATION_PREFIX).ifPresent(val -> this.annotationPrefix = val);
            getEnv(ENV_FIELD_REFERENCE_PREFIX).ifPresent(val -> this.fieldReferencePrefix = val);
            getEnv(ENV_STRICT_METHOD_TYPE).ifPresent(val -> this.strictMethodType = Boolean.parseBoolean(val));
        }

        public Builder lookupSeparator(String separator) {
            this.lookupSeparator = separator;
            return this;
        }

        public Builder countMarker(String marker) {
            this.countMarker = marker;
            return this;
        }

        public Builder annotationPrefix(String prefix) {
            this.annotationPrefix = prefix;
            return this;
        }

        public Builder fieldReferencePrefix(String prefix) {
            this.fieldReferencePrefix = prefix;
            return this;
        }

        public Builder strictMethodType(boolean strict) {
            this.strictMethodType = strict;
            return this;
        }

        public DripConfig build() {
            return new DripConfig(this);
        }
    }

    // ========================================================================
    // ENVIRONMENT HELPERS
    // ========================================================================

    private static Optional<String> getEnv(String key) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return Optional.ofNullable(value).filter(v -> !v.isEmpty());
    }
}
