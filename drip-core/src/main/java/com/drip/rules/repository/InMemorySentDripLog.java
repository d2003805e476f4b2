/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import com.drip.rules.api.model.SentDrip;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of SentDripLog, keyed by campaign id.
 */
public class InMemorySentDripLog implements SentDripLog {

    private static final Comparator<SentDrip> OLDEST_FIRST =
            Comparator.comparing(SentDrip::sentAt).thenComparing(SentDrip::id);

    private final ConcurrentMap<Long, List<SentDrip>> sentByCampaign = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Clock clock;

    public InMemorySentDripLog() {
        this(Clock.systemUTC());
    }

    public InMemorySentDripLog(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SentDrip record(SentDrip sent) {
        Objects.requireNonNull(sent, "sent");
        SentDrip stored = new SentDrip(
                sent.id() != null ? sent.id() : ids.incrementAndGet(),
                sent.campaignId(),
                sent.userId(),
                sent.subject(),
                sent.body(),
                sent.fromEmail(),
                sent.fromEmailName(),
                sent.replyTo(),
                sent.name(),
                sent.sentAt() != null ? sent.sentAt() : clock.instant());
        sentByCampaign.computeIfAbsent(stored.campaignId(), k -> new CopyOnWriteArrayList<>()).add(stored);
        return stored;
    }

    @Override
    public Set<String> recipients(long campaignId) {
        Set<String> recipients = new HashSet<>();
        for (SentDrip sent : sentByCampaign.getOrDefault(campaignId, List.of())) {
            recipients.add(SentDripLog.userKey(sent.userId()));
        }
        return recipients;
    }

    @Override
    public List<SentDrip> findByCampaign(long campaignId) {
        List<SentDrip> sent = new ArrayList<>(sentByCampaign.getOrDefault(campaignId, List.of()));
        sent.sort(OLDEST_FIRST);
        return sent;
    }

    @Override
    public int deleteByCampaign(long campaignId) {
        List<SentDrip> removed = sentByCampaign.remove(campaignId);
        return removed == null ? 0 : removed.size();
    }
}
