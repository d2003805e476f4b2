/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import com.drip.rules.api.model.SentDrip;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Record of which users have already received which campaign.
 *
 * <p>User ids are compared by their text form, so {@code 7}, {@code 7L} and {@code "7"}
 * name the same user.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 */
public interface SentDripLog {

    /**
     * Records a sent drip, assigning its id and sent timestamp if missing.
     *
     * @return the record as stored
     */
    SentDrip record(SentDrip sent);

    /**
     * Returns the ids (as {@link #userKey text}) of every user that received the campaign.
     */
    Set<String> recipients(long campaignId);

    default boolean hasReceived(long campaignId, Object userId) {
        return recipients(campaignId).contains(userKey(userId));
    }

    /**
     * Returns the drips sent for a campaign, oldest first.
     */
    List<SentDrip> findByCampaign(long campaignId);

    /**
     * Forgets every drip sent for a campaign.
     *
     * @return the number of records removed
     */
    int deleteByCampaign(long campaignId);

    /**
     * Normalizes a user id to the key used for comparisons.
     */
    static String userKey(Object userId) {
        if (userId instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().toPlainString();
        }
        return String.valueOf(userId);
    }
}
