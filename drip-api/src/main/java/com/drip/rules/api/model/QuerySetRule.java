/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * One field/lookup/value/method tuple narrowing a campaign's candidate records.
 *
 * <p>The method and lookup are kept as the raw stored codes so that an unrecognized
 * value reaches rule validation instead of failing deserialization. Use
 * {@link #method()} and {@link #lookup()} for the typed view.
 *
 * <h2>Field values</h2>
 * <p>{@code fieldValue} can be anything from a number to a string, or one of:
 * <ul>
 *   <li>{@code now-7 days}, {@code now+1:00:00}: an instant relative to the current time</li>
 *   <li>{@code today+3 days}: a calendar date relative to today</li>
 *   <li>{@code F_other_field}: the value of another field on the same record</li>
 *   <li>{@code True} / {@code False}: booleans</li>
 * </ul>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuerySetRule(
        @JsonProperty("id") Long id,
        @JsonProperty("campaign_id") Long campaignId,
        @JsonProperty("sort_order") Integer sortOrder,
        @JsonProperty("method_type") String methodType,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("lookup_type") String lookupType,
        @JsonProperty("field_value") String fieldValue,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_changed_at") Instant lastChangedAt
) {
    public static final int MAX_FIELD_NAME_LENGTH = 128;
    public static final int MAX_FIELD_VALUE_LENGTH = 255;

    /** Ascending sort order, then id; rules without an id sort last among equals. */
    public static final Comparator<QuerySetRule> APPLICATION_ORDER =
            Comparator.comparing(QuerySetRule::sortOrder)
                    .thenComparing(QuerySetRule::id, Comparator.nullsLast(Comparator.naturalOrder()));

    public QuerySetRule {
        if (sortOrder == null) sortOrder = 0;
        if (methodType == null) methodType = MethodType.FILTER.code();
        if (lookupType == null) lookupType = LookupType.EXACT.code();
        if (fieldValue == null) fieldValue = "";
    }

    /**
     * Creates an unsaved rule with the given definition.
     */
    public static QuerySetRule of(int sortOrder, MethodType method, String fieldName,
                                  LookupType lookup, String fieldValue) {
        return new QuerySetRule(null, null, sortOrder, method.code(), fieldName,
                lookup.code(), fieldValue, null, null);
    }

    @JsonIgnore
    public Optional<MethodType> method() {
        return MethodType.fromCode(methodType);
    }

    @JsonIgnore
    public Optional<LookupType> lookup() {
        return LookupType.fromCode(lookupType);
    }

    public QuerySetRule withId(Long newId) {
        return new QuerySetRule(newId, campaignId, sortOrder, methodType, fieldName,
                lookupType, fieldValue, createdAt, lastChangedAt);
    }

    public QuerySetRule withCampaignId(Long newCampaignId) {
        return new QuerySetRule(id, newCampaignId, sortOrder, methodType, fieldName,
                lookupType, fieldValue, createdAt, lastChangedAt);
    }

    public QuerySetRule withTimestamps(Instant created, Instant changed) {
        return new QuerySetRule(id, campaignId, sortOrder, methodType, fieldName,
                lookupType, fieldValue, created, changed);
    }

    /**
     * Short human-readable form used in logs and validation messages.
     */
    public String describe() {
        return String.format("#%s %s %s__%s=%s", id, methodType, fieldName, lookupType, fieldValue);
    }
}
