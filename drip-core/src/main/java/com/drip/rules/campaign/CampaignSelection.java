/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.campaign;

import com.drip.rules.api.model.Campaign;

import java.util.List;
import java.util.Map;

/**
 * The users a campaign should be sent to right now.
 *
 * @param campaign    the campaign
 * @param recipients  rows matched by the campaign's rules that have not received it yet
 * @param alreadySent number of matched rows dropped because they already received it
 */
public record CampaignSelection(Campaign campaign, List<Map<String, Object>> recipients, int alreadySent) {

    public CampaignSelection {
        recipients = List.copyOf(recipients);
    }

    public static CampaignSelection empty(Campaign campaign) {
        return new CampaignSelection(campaign, List.of(), 0);
    }

    public boolean isEmpty() {
        return recipients.isEmpty();
    }

    public int size() {
        return recipients.size();
    }
}
