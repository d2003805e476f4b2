/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.campaign;

import com.drip.rules.api.exceptions.RuleCompilationException;
import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.api.validation.ValidationResult;
import com.drip.rules.compiler.PredicateCompiler;
import com.drip.rules.compiler.RuleSet;
import com.drip.rules.repository.CampaignRepository;
import com.drip.rules.repository.SentDripLog;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Chooses the users a campaign goes to: its rules applied to the user collection, minus
 * everyone who already received it.
 *
 * <p>Disabled campaigns select nobody. Rows are identified by the {@code userIdField}
 * column (default {@code id}).
 */
public class CampaignSelector {
    private static final Logger logger = Logger.getLogger(CampaignSelector.class.getName());

    public static final String DEFAULT_USER_ID_FIELD = "id";

    private final PredicateCompiler compiler;
    private final SentDripLog sentLog;
    private final Tracer tracer;
    private final String userIdField;

    public CampaignSelector(PredicateCompiler compiler, SentDripLog sentLog, Tracer tracer) {
        this(compiler, sentLog, tracer, DEFAULT_USER_ID_FIELD);
    }

    public CampaignSelector(PredicateCompiler compiler, SentDripLog sentLog, Tracer tracer, String userIdField) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.sentLog = Objects.requireNonNull(sentLog, "sentLog");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.userIdField = Objects.requireNonNull(userIdField, "userIdField");
    }

    /**
     * Selects the recipients of one campaign.
     *
     * @param campaign the campaign
     * @param users    the full user collection
     * @param clock    source of "now" for relative date rules
     * @return the selection; empty for a disabled campaign
     * @throws RuleCompilationException if one of the campaign's rules cannot be applied
     */
    public CampaignSelection select(Campaign campaign, Queryable<Map<String, Object>> users, Clock clock) {
        Objects.requireNonNull(campaign, "campaign");
        Objects.requireNonNull(users, "users");
        Objects.requireNonNull(clock, "clock");

        if (!campaign.enabled()) {
            logger.fine(() -> "Campaign '" + campaign.name() + "' is disabled, selecting nobody");
            return CampaignSelection.empty(campaign);
        }

        Span span = tracer.spanBuilder("select-campaign").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("campaign", campaign.name());
            span.setAttribute("ruleCount", campaign.rules().size());

            RuleSet ruleSet = RuleSet.of(campaign, compiler, tracer);
            List<Map<String, Object>> matched = ruleSet.apply(users, clock).fetch();

            Set<String> alreadySent = campaign.id() == null ? Set.of() : sentLog.recipients(campaign.id());
            List<Map<String, Object>> recipients = new ArrayList<>(matched.size());
            for (Map<String, Object> row : matched) {
                Object userId = row.get(userIdField);
                if (userId == null) {
                    throw new IllegalStateException(
                            "Row matched by campaign '" + campaign.name() + "' has no '" + userIdField + "' value");
                }
                if (!alreadySent.contains(SentDripLog.userKey(userId))) {
                    recipients.add(row);
                }
            }

            int skipped = matched.size() - recipients.size();
            span.setAttribute("matched", matched.size());
            span.setAttribute("recipients", recipients.size());
            logger.info("Campaign '" + campaign.name() + "': " + matched.size() + " matched, "
                    + skipped + " already sent, " + recipients.size() + " to send");
            return new CampaignSelection(campaign, recipients, skipped);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Selects recipients for every enabled campaign in the repository.
     *
     * <p>A campaign that fails, whether in its rules or in the store, is logged and left
     * out; the others are still selected.
     *
     * @return one selection per enabled campaign that could be applied, in id order
     */
    public List<CampaignSelection> selectAll(CampaignRepository repository,
                                             Queryable<Map<String, Object>> users, Clock clock) {
        List<CampaignSelection> selections = new ArrayList<>();
        for (Campaign campaign : repository.findEnabled()) {
            try {
                selections.add(select(campaign, users, clock));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Skipping campaign '" + campaign.name() + "': " + e.getMessage(), e);
            }
        }
        return selections;
    }

    /**
     * Checks a campaign's rules against a sample of users without sending anything.
     */
    public ValidationResult validate(Campaign campaign, Queryable<Map<String, Object>> sample, Clock clock) {
        return RuleSet.of(campaign, compiler, tracer).validate(sample, clock);
    }

    public String getUserIdField() {
        return userIdField;
    }
}
