/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.QuerySetRule;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * In-memory implementation of CampaignRepository.
 *
 * <p>Campaigns are kept in a ConcurrentHashMap with their rules nested inside, so deleting
 * a campaign drops its rules with it. Contents are lost on restart.
 *
 * <p><b>Thread Safety:</b> Reads are lock-free; writes are serialized so that name
 * uniqueness and id assignment stay consistent.
 */
public class InMemoryCampaignRepository implements CampaignRepository {
    private static final Logger logger = Logger.getLogger(InMemoryCampaignRepository.class.getName());

    private final ConcurrentMap<Long, Campaign> campaigns = new ConcurrentHashMap<>();
    private final AtomicLong campaignIds = new AtomicLong();
    private final AtomicLong ruleIds = new AtomicLong();
    private final Clock clock;

    public InMemoryCampaignRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryCampaignRepository(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized Campaign save(Campaign campaign) {
        Objects.requireNonNull(campaign, "campaign");
        Instant now = clock.instant();

        long id = campaign.id() != null ? campaign.id() : campaignIds.incrementAndGet();
        campaignIds.accumulateAndGet(id, Math::max);

        findByName(campaign.name())
                .filter(other -> other.id() != id)
                .ifPresent(other -> {
                    throw new IllegalArgumentException("Campaign name already exists: " + campaign.name());
                });

        Campaign existing = campaigns.get(id);
        Instant createdAt = existing != null
                ? existing.createdAt()
                : Objects.requireNonNullElse(campaign.createdAt(), now);

        List<QuerySetRule> rules = new ArrayList<>(campaign.rules().size());
        for (QuerySetRule rule : campaign.rules()) {
            long ruleId = rule.id() != null ? rule.id() : ruleIds.incrementAndGet();
            ruleIds.accumulateAndGet(ruleId, Math::max);
            Instant ruleCreatedAt = previousRule(existing, ruleId)
                    .map(QuerySetRule::createdAt)
                    .orElse(Objects.requireNonNullElse(rule.createdAt(), now));
            rules.add(rule.withId(ruleId).withCampaignId(id).withTimestamps(ruleCreatedAt, now));
        }

        Campaign stored = campaign.withId(id)
                .withTimestamps(createdAt, now)
                .withRules(rules);
        campaigns.put(id, stored);

        logger.fine(() -> (existing == null ? "Created" : "Updated") + " campaign '" + stored.name()
                + "' (#" + id + ") with " + rules.size() + " rule(s)");
        return stored;
    }

    private static Optional<QuerySetRule> previousRule(Campaign existing, long ruleId) {
        if (existing == null) {
            return Optional.empty();
        }
        return existing.rules().stream()
                .filter(r -> r.id() != null && r.id() == ruleId)
                .findFirst();
    }

    @Override
    public Optional<Campaign> findById(long id) {
        return Optional.ofNullable(campaigns.get(id));
    }

    @Override
    public Optional<Campaign> findByName(String name) {
        return campaigns.values().stream()
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    @Override
    public List<Campaign> findAll() {
        return campaigns.values().stream()
                .sorted(Comparator.comparing(Campaign::id))
                .toList();
    }

    @Override
    public List<Campaign> findEnabled() {
        return campaigns.values().stream()
                .filter(Campaign::enabled)
                .sorted(Comparator.comparing(Campaign::id))
                .toList();
    }

    @Override
    public Optional<QuerySetRule> findRule(long ruleId) {
        return campaigns.values().stream()
                .flatMap(c -> c.rules().stream())
                .filter(r -> r.id() != null && r.id() == ruleId)
                .findFirst();
    }

    @Override
    public synchronized boolean delete(long id) {
        Campaign removed = campaigns.remove(id);
        if (removed == null) {
            return false;
        }
        logger.info("Deleted campaign '" + removed.name() + "' and " + removed.rules().size() + " rule(s)");
        return true;
    }

    @Override
    public long count() {
        return campaigns.size();
    }

    /**
     * Replaces the repository contents, e.g. with campaigns read by a loader.
     *
     * @param campaignList campaigns to store
     */
    public synchronized void loadCampaigns(List<Campaign> campaignList) {
        campaigns.clear();
        for (Campaign campaign : campaignList) {
            save(campaign);
        }
        logger.info("Loaded " + campaignList.size() + " campaigns");
    }
}
