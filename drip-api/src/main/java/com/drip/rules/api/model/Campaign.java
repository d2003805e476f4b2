/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A drip campaign: a named, one-time message sent to every record its rules select.
 *
 * <p>The campaign exclusively owns its rules. Campaigns are edited by an operator and
 * never changed by rule evaluation; the enabled flag decides whether a dispatcher
 * considers the campaign at all.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Campaign(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("from_email") String fromEmail,
        @JsonProperty("from_email_name") String fromEmailName,
        @JsonProperty("reply_to") String replyTo,
        @JsonProperty("subject_template") String subjectTemplate,
        @JsonProperty("body_html_template") String bodyHtmlTemplate,
        @JsonProperty("message_class") String messageClass,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_changed_at") Instant lastChangedAt,
        @JsonProperty("rules") List<QuerySetRule> rules
) {
    public static final int MAX_NAME_LENGTH = 255;
    public static final String DEFAULT_MESSAGE_CLASS = "default";

    public Campaign {
        Objects.requireNonNull(name, "Campaign name cannot be null");
        if (enabled == null) enabled = false;
        if (messageClass == null || messageClass.isBlank()) messageClass = DEFAULT_MESSAGE_CLASS;
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Creates a disabled campaign with no sender overrides, templates or rules.
     */
    public static Campaign named(String name) {
        return new Campaign(null, name, false, null, null, null, null, null,
                null, null, null, List.of());
    }

    /**
     * Returns the rules in the order they are applied.
     */
    @JsonIgnore
    public List<QuerySetRule> orderedRules() {
        return rules.stream().sorted(QuerySetRule.APPLICATION_ORDER).toList();
    }

    public Campaign withId(Long newId) {
        return new Campaign(newId, name, enabled, fromEmail, fromEmailName, replyTo,
                subjectTemplate, bodyHtmlTemplate, messageClass, createdAt, lastChangedAt, rules);
    }

    public Campaign withEnabled(boolean newEnabled) {
        return new Campaign(id, name, newEnabled, fromEmail, fromEmailName, replyTo,
                subjectTemplate, bodyHtmlTemplate, messageClass, createdAt, lastChangedAt, rules);
    }

    public Campaign withRules(List<QuerySetRule> newRules) {
        return new Campaign(id, name, enabled, fromEmail, fromEmailName, replyTo,
                subjectTemplate, bodyHtmlTemplate, messageClass, createdAt, lastChangedAt, newRules);
    }

    public Campaign withTimestamps(Instant created, Instant changed) {
        return new Campaign(id, name, enabled, fromEmail, fromEmailName, replyTo,
                subjectTemplate, bodyHtmlTemplate, messageClass, created, changed, rules);
    }

    public Campaign withSender(String email, String emailName, String replyToAddress) {
        return new Campaign(id, name, enabled, email, emailName, replyToAddress,
                subjectTemplate, bodyHtmlTemplate, messageClass, createdAt, lastChangedAt, rules);
    }

    public Campaign withTemplates(String subject, String bodyHtml) {
        return new Campaign(id, name, enabled, fromEmail, fromEmailName, replyTo,
                subject, bodyHtml, messageClass, createdAt, lastChangedAt, rules);
    }
}
