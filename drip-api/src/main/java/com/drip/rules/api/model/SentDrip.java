/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of a drip that has been sent to one user.
 *
 * <p>There is at most one per (campaign, user) pair; its presence keeps the user out of
 * later runs of the same campaign.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentDrip(
        @JsonProperty("id") Long id,
        @JsonProperty("campaign_id") Long campaignId,
        @JsonProperty("user_id") Object userId,
        @JsonProperty("subject") String subject,
        @JsonProperty("body") String body,
        @JsonProperty("from_email") String fromEmail,
        @JsonProperty("from_email_name") String fromEmailName,
        @JsonProperty("reply_to") String replyTo,
        @JsonProperty("name") String name,
        @JsonProperty("sent_at") Instant sentAt
) {
    public SentDrip {
        Objects.requireNonNull(campaignId, "Campaign id cannot be null");
        Objects.requireNonNull(userId, "User id cannot be null");
        if (subject == null) subject = "";
        if (body == null) body = "";
    }

    public SentDrip withId(Long newId) {
        return new SentDrip(newId, campaignId, userId, subject, body, fromEmail,
                fromEmailName, replyTo, name, sentAt);
    }
}
