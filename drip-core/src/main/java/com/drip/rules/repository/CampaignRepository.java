/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.QuerySetRule;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for campaign persistence.
 *
 * <p>A campaign owns its rules: saving a campaign replaces its rule list, and deleting it
 * deletes its rules.
 *
 * <p><b>Thread Safety:</b> Implementations must be thread-safe.
 */
public interface CampaignRepository {

    /**
     * Saves a new campaign or updates an existing one, together with its rules.
     *
     * <p>Missing ids are assigned, rules are linked to the campaign, and creation and
     * last-change timestamps are maintained.
     *
     * @param campaign the campaign to save
     * @return the campaign as stored
     * @throws IllegalArgumentException if another campaign already uses the name
     */
    Campaign save(Campaign campaign);

    /**
     * Finds a campaign by id.
     *
     * @param id the campaign id
     * @return the campaign with its rules, or empty if not found
     */
    Optional<Campaign> findById(long id);

    /**
     * Finds a campaign by its unique name.
     */
    Optional<Campaign> findByName(String name);

    /**
     * Returns all campaigns, ordered by id.
     */
    List<Campaign> findAll();

    /**
     * Returns the campaigns that are switched on, ordered by id.
     */
    List<Campaign> findEnabled();

    /**
     * Finds a single rule by id.
     */
    Optional<QuerySetRule> findRule(long ruleId);

    /**
     * Deletes a campaign and its rules.
     *
     * @param id the campaign id
     * @return true if the campaign was deleted, false if it didn't exist
     */
    boolean delete(long id);

    /**
     * Returns the total number of campaigns.
     */
    long count();
}
