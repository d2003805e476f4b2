/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import com.drip.rules.api.model.SentDrip;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC-based implementation of SentDripLog over the {@code drip_sent} table.
 *
 * <p>User ids are stored in their {@link SentDripLog#userKey text form}. The table is
 * created by {@link JdbcCampaignRepository#initializeSchema()}.
 */
public class JdbcSentDripLog implements SentDripLog {

    private static final Logger logger = Logger.getLogger(JdbcSentDripLog.class.getName());

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcSentDripLog(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcSentDripLog(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public SentDrip record(SentDrip sent) {
        Objects.requireNonNull(sent, "sent");
        Instant sentAt = sent.sentAt() != null ? sent.sentAt() : clock.instant();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     JdbcCampaignRepository.SQL.get("insert_sent"), Statement.RETURN_GENERATED_KEYS)) {
            int idx = 1;
            stmt.setLong(idx++, sent.campaignId());
            stmt.setString(idx++, SentDripLog.userKey(sent.userId()));
            stmt.setString(idx++, sent.subject());
            stmt.setString(idx++, sent.body());
            stmt.setString(idx++, sent.fromEmail());
            stmt.setString(idx++, sent.fromEmailName());
            stmt.setString(idx++, sent.replyTo());
            stmt.setString(idx++, sent.name());
            stmt.setTimestamp(idx, Timestamp.from(sentAt));
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned");
                }
                return new SentDrip(keys.getLong(1), sent.campaignId(), sent.userId(), sent.subject(),
                        sent.body(), sent.fromEmail(), sent.fromEmailName(), sent.replyTo(), sent.name(), sentAt);
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to record sent drip for campaign #" + sent.campaignId(), e);
            throw new IllegalStateException("Failed to record sent drip", e);
        }
    }

    @Override
    public Set<String> recipients(long campaignId) {
        Set<String> recipients = new HashSet<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     JdbcCampaignRepository.SQL.get("select_recipients_by_campaign"))) {
            stmt.setLong(1, campaignId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    recipients.add(rs.getString(1));
                }
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to read recipients of campaign #" + campaignId, e);
            throw new IllegalStateException("Failed to read recipients", e);
        }
        return recipients;
    }

    @Override
    public boolean hasReceived(long campaignId, Object userId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     JdbcCampaignRepository.SQL.get("count_sent_by_campaign_user"))) {
            stmt.setLong(1, campaignId);
            stmt.setString(2, SentDripLog.userKey(userId));
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to check sent drip for campaign #" + campaignId, e);
            throw new IllegalStateException("Failed to check sent drip", e);
        }
    }

    @Override
    public List<SentDrip> findByCampaign(long campaignId) {
        List<SentDrip> sent = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     JdbcCampaignRepository.SQL.get("select_sent_by_campaign"))) {
            stmt.setLong(1, campaignId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sent.add(mapSent(rs));
                }
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to read sent drips of campaign #" + campaignId, e);
            throw new IllegalStateException("Failed to read sent drips", e);
        }
        return sent;
    }

    @Override
    public int deleteByCampaign(long campaignId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     JdbcCampaignRepository.SQL.get("delete_sent_by_campaign"))) {
            stmt.setLong(1, campaignId);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to delete sent drips of campaign #" + campaignId, e);
            throw new IllegalStateException("Failed to delete sent drips", e);
        }
    }

    private static SentDrip mapSent(ResultSet rs) throws SQLException {
        return new SentDrip(
                rs.getLong("id"),
                rs.getLong("campaign_id"),
                rs.getString("user_id"),
                rs.getString("subject"),
                rs.getString("body"),
                rs.getString("from_email"),
                rs.getString("from_email_name"),
                rs.getString("reply_to"),
                rs.getString("name"),
                rs.getTimestamp("sent_at").toInstant()
        );
    }
}
