/*
 * Copyright (c) 2025 Drip Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.drip.rules.repository;

import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.QuerySetRule;

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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC-based implementation of CampaignRepository using H2 or PostgreSQL.
 *
 * <p>Statements live in {@code sql/drip-queries.sql}, the DDL in
 * {@code sql/drip-schema.sql}. Rules reference their campaign with
 * {@code ON DELETE CASCADE}. Ids are generated by the database; a campaign or rule
 * carrying an id that is not stored yet is inserted under a new id.
 *
 * <p><b>Thread Safety:</b> All operations are thread-safe through database ACID properties.
 */
public class JdbcCampaignRepository implements CampaignRepository {

    private static final Logger logger = Logger.getLogger(JdbcCampaignRepository.class.getName());

    static final Map<String, String> SQL = SqlLoader.loadQueries("sql/drip-queries.sql");
    static final String SCHEMA_RESOURCE = "sql/drip-schema.sql";

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcCampaignRepository(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcCampaignRepository(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the campaign, rule and sent-drip tables if they don't exist.
     */
    public void initializeSchema() {
        logger.info("Initializing drip database schema...");
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : SqlLoader.loadStatements(SCHEMA_RESOURCE)) {
                stmt.execute(sql);
            }
            logger.info("Drip database schema initialized successfully");
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to initialize database schema", e);
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public Campaign save(Campaign campaign) {
        Objects.requireNonNull(campaign, "campaign");
        Instant now = clock.instant();

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                Optional<Campaign> byName = findCampaign(conn, "select_campaign_by_name", campaign.name());
                Optional<Campaign> existing = campaign.id() == null
                        ? Optional.empty()
                        : findCampaign(conn, "select_campaign_by_id", campaign.id());
                if (byName.isPresent() && (existing.isEmpty() || !byName.get().id().equals(existing.get().id()))) {
                    throw new IllegalArgumentException("Campaign name already exists: " + campaign.name());
                }

                long id;
                Instant createdAt;
                if (existing.isPresent()) {
                    id = existing.get().id();
                    createdAt = existing.get().createdAt();
                    updateCampaign(conn, campaign, id, now);
                } else {
                    createdAt = Objects.requireNonNullElse(campaign.createdAt(), now);
                    id = insertCampaign(conn, campaign, createdAt, now);
                }

                List<QuerySetRule> rules = saveRules(conn, id, campaign.rules(), now);
                conn.commit();

                logger.fine(() -> "Saved campaign '" + campaign.name() + "' (#" + id + ") with "
                        + rules.size() + " rule(s)");
                return campaign.withId(id).withTimestamps(createdAt, now).withRules(rules);
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to save campaign: " + campaign.name(), e);
            throw new IllegalStateException("Failed to save campaign", e);
        }
    }

    private long insertCampaign(Connection conn, Campaign campaign, Instant createdAt, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_campaign"), Statement.RETURN_GENERATED_KEYS)) {
            int idx = setCampaignColumns(stmt, campaign);
            stmt.setTimestamp(idx++, Timestamp.from(createdAt));
            stmt.setTimestamp(idx, Timestamp.from(now));
            stmt.executeUpdate();
            return generatedKey(stmt);
        }
    }

    private void updateCampaign(Connection conn, Campaign campaign, long id, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_campaign"))) {
            int idx = setCampaignColumns(stmt, campaign);
            stmt.setTimestamp(idx++, Timestamp.from(now));
            stmt.setLong(idx, id);
            stmt.executeUpdate();
        }
    }

    private static int setCampaignColumns(PreparedStatement stmt, Campaign campaign) throws SQLException {
        int idx = 1;
        stmt.setString(idx++, campaign.name());
        stmt.setBoolean(idx++, campaign.enabled());
        stmt.setString(idx++, campaign.fromEmail());
        stmt.setString(idx++, campaign.fromEmailName());
        stmt.setString(idx++, campaign.replyTo());
        stmt.setString(idx++, campaign.subjectTemplate());
        stmt.setString(idx++, campaign.bodyHtmlTemplate());
        stmt.setString(idx++, campaign.messageClass());
        return idx;
    }

    private List<QuerySetRule> saveRules(Connection conn, long campaignId, List<QuerySetRule> rules, Instant now)
            throws SQLException {
        List<QuerySetRule> previous = findRules(conn, campaignId);
        Set<Long> kept = new HashSet<>();
        List<QuerySetRule> saved = new ArrayList<>(rules.size());

        for (QuerySetRule rule : rules) {
            Optional<QuerySetRule> match = previous.stream()
                    .filter(p -> rule.id() != null && p.id().equals(rule.id()))
                    .findFirst();
            if (match.isPresent()) {
                updateRule(conn, campaignId, rule, now);
                kept.add(rule.id());
                saved.add(rule.withCampaignId(campaignId).withTimestamps(match.get().createdAt(), now));
            } else {
                Instant createdAt = Objects.requireNonNullElse(rule.createdAt(), now);
                long ruleId = insertRule(conn, campaignId, rule, createdAt, now);
                saved.add(rule.withId(ruleId).withCampaignId(campaignId).withTimestamps(createdAt, now));
            }
        }

        for (QuerySetRule old : previous) {
            if (!kept.contains(old.id())) {
                try (PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_rule"))) {
                    stmt.setLong(1, old.id());
                    stmt.executeUpdate();
                }
            }
        }
        return saved;
    }

    private long insertRule(Connection conn, long campaignId, QuerySetRule rule, Instant createdAt, Instant now)
            throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("insert_rule"), Statement.RETURN_GENERATED_KEYS)) {
            int idx = 1;
            stmt.setLong(idx++, campaignId);
            stmt.setInt(idx++, rule.sortOrder());
            stmt.setString(idx++, rule.methodType());
            stmt.setString(idx++, rule.fieldName());
            stmt.setString(idx++, rule.lookupType());
            stmt.setString(idx++, rule.fieldValue());
            stmt.setTimestamp(idx++, Timestamp.from(createdAt));
            stmt.setTimestamp(idx, Timestamp.from(now));
            stmt.executeUpdate();
            return generatedKey(stmt);
        }
    }

    private void updateRule(Connection conn, long campaignId, QuerySetRule rule, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("update_rule"))) {
            int idx = 1;
            stmt.setInt(idx++, rule.sortOrder());
            stmt.setString(idx++, rule.methodType());
            stmt.setString(idx++, rule.fieldName());
            stmt.setString(idx++, rule.lookupType());
            stmt.setString(idx++, rule.fieldValue());
            stmt.setTimestamp(idx++, Timestamp.from(now));
            stmt.setLong(idx++, rule.id());
            stmt.setLong(idx, campaignId);
            stmt.executeUpdate();
        }
    }

    private static long generatedKey(PreparedStatement stmt) throws SQLException {
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Override
    public Optional<Campaign> findById(long id) {
        try (Connection conn = dataSource.getConnection()) {
            return findCampaign(conn, "select_campaign_by_id", id);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to find campaign: " + id, e);
            throw new IllegalStateException("Failed to find campaign", e);
        }
    }

    @Override
    public Optional<Campaign> findByName(String name) {
        try (Connection conn = dataSource.getConnection()) {
            return findCampaign(conn, "select_campaign_by_name", name);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to find campaign: " + name, e);
            throw new IllegalStateException("Failed to find campaign", e);
        }
    }

    @Override
    public List<Campaign> findAll() {
        return findCampaigns("select_all_campaigns");
    }

    @Override
    public List<Campaign> findEnabled() {
        return findCampaigns("select_enabled_campaigns");
    }

    private List<Campaign> findCampaigns(String queryName) {
        List<Campaign> campaigns = new ArrayList<>();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement stmt = conn.prepareStatement(SQL.get(queryName));
                 ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    campaigns.add(mapCampaign(rs));
                }
            }
            List<Campaign> withRules = new ArrayList<>(campaigns.size());
            for (Campaign campaign : campaigns) {
                withRules.add(campaign.withRules(findRules(conn, campaign.id())));
            }
            return withRules;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to list campaigns (" + queryName + ")", e);
            throw new IllegalStateException("Failed to list campaigns", e);
        }
    }

    private Optional<Campaign> findCampaign(Connection conn, String queryName, Object key) throws SQLException {
        Campaign campaign = null;
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get(queryName))) {
            stmt.setObject(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    campaign = mapCampaign(rs);
                }
            }
        }
        if (campaign == null) {
            return Optional.empty();
        }
        return Optional.of(campaign.withRules(findRules(conn, campaign.id())));
    }

    private List<QuerySetRule> findRules(Connection conn, long campaignId) throws SQLException {
        List<QuerySetRule> rules = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SQL.get("select_rules_by_campaign"))) {
            stmt.setLong(1, campaignId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rules.add(mapRule(rs));
                }
            }
        }
        return rules;
    }

    @Override
    public Optional<QuerySetRule> findRule(long ruleId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("select_rule_by_id"))) {
            stmt.setLong(1, ruleId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRule(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to find rule: " + ruleId, e);
            throw new IllegalStateException("Failed to find rule", e);
        }
    }

    @Override
    public boolean delete(long id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("delete_campaign"))) {
            stmt.setLong(1, id);
            int rowsAffected = stmt.executeUpdate();
            if (rowsAffected > 0) {
                logger.info("Deleted campaign #" + id + " and its rules");
            }
            return rowsAffected > 0;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to delete campaign: " + id, e);
            throw new IllegalStateException("Failed to delete campaign", e);
        }
    }

    @Override
    public long count() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SQL.get("count_campaigns"));
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to count campaigns", e);
            throw new IllegalStateException("Failed to count campaigns", e);
        }
    }

    // Mapping helpers
    private static Campaign mapCampaign(ResultSet rs) throws SQLException {
        return new Campaign(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getBoolean("enabled"),
                rs.getString("from_email"),
                rs.getString("from_email_name"),
                rs.getString("reply_to"),
                rs.getString("subject_template"),
                rs.getString("body_html_template"),
                rs.getString("message_class"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("last_changed_at").toInstant(),
                List.of()
        );
    }

    private static QuerySetRule mapRule(ResultSet rs) throws SQLException {
        return new QuerySetRule(
                rs.getLong("id"),
                rs.getLong("campaign_id"),
                rs.getInt("sort_order"),
                rs.getString("method_type"),
                rs.getString("field_name"),
                rs.getString("lookup_type"),
                rs.getString("field_value"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("last_changed_at").toInstant()
        );
    }
}
