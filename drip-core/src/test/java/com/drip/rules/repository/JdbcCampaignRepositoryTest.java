package com.drip.rules.repository;

import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.model.MethodType;
import com.drip.rules.api.model.QuerySetRule;
import com.drip.rules.api.model.SentDrip;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcCampaignRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private JdbcDataSource dataSource;
    private JdbcCampaignRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:campaigns_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        repository = new JdbcCampaignRepository(dataSource, Clock.fixed(NOW, ZoneOffset.UTC));
        repository.initializeSchema();
    }

    private static Campaign welcome() {
        return Campaign.named("welcome")
                .withEnabled(true)
                .withSender("hello@example.com", "Example", null)
                .withTemplates("Welcome {{ user.first_name }}", "<p>Hi</p>")
                .withRules(List.of(
                        QuerySetRule.of(0, MethodType.FILTER, "date_joined", LookupType.GTE, "now-1 day"),
                        QuerySetRule.of(1, MethodType.EXCLUDE, "orders__count", LookupType.GT, "0")));
    }

    @Test
    @DisplayName("Schema initialization should be repeatable")
    void initializeTwice() {
        repository.initializeSchema();

        assertThat(repository.count()).isZero();
    }

    @Test
    @DisplayName("A saved campaign should read back with its rules")
    void saveAndFind() {
        Campaign saved = repository.save(welcome());

        Campaign found = repository.findById(saved.id()).orElseThrow();

        assertThat(found.name()).isEqualTo("welcome");
        assertThat(found.enabled()).isTrue();
        assertThat(found.fromEmail()).isEqualTo("hello@example.com");
        assertThat(found.subjectTemplate()).isEqualTo("Welcome {{ user.first_name }}");
        assertThat(found.messageClass()).isEqualTo(Campaign.DEFAULT_MESSAGE_CLASS);
        assertThat(found.createdAt()).isEqualTo(NOW);
        assertThat(found.rules()).extracting(QuerySetRule::fieldName).containsExactly("date_joined", "orders__count");
        assertThat(found.rules()).extracting(QuerySetRule::campaignId).containsOnly(saved.id());
        assertThat(found.rules()).isEqualTo(saved.rules());
    }

    @Test
    @DisplayName("Saving again should update, insert and delete rules by id")
    void updateRules() {
        Campaign saved = repository.save(welcome());
        QuerySetRule first = saved.rules().get(0);
        QuerySetRule changed = new QuerySetRule(first.id(), first.campaignId(), 5, "filter", "date_joined",
                "lt", "now", first.createdAt(), first.lastChangedAt());
        QuerySetRule added = QuerySetRule.of(2, MethodType.FILTER, "is_active", LookupType.EXACT, "True");

        repository.save(saved.withEnabled(false).withRules(List.of(changed, added)));

        Campaign found = repository.findById(saved.id()).orElseThrow();
        assertThat(found.enabled()).isFalse();
        assertThat(found.rules()).extracting(QuerySetRule::fieldName).containsExactly("is_active", "date_joined");
        assertThat(repository.findRule(first.id()).orElseThrow().lookupType()).isEqualTo("lt");
        assertThat(repository.findRule(saved.rules().get(1).id())).isEmpty();
    }

    @Test
    @DisplayName("Duplicate names should be rejected and leave nothing behind")
    void duplicateName() {
        repository.save(welcome());

        assertThatThrownBy(() -> repository.save(Campaign.named("welcome")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Campaign name already exists: welcome");
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Deleting a campaign should cascade to its rules and sent drips")
    void deleteCascades() {
        Campaign saved = repository.save(welcome());
        JdbcSentDripLog sentLog = new JdbcSentDripLog(dataSource);
        sentLog.record(new SentDrip(null, saved.id(), 7L, "s", "b", null, null, null, null, null));

        assertThat(repository.delete(saved.id())).isTrue();

        assertThat(repository.findRule(saved.rules().get(0).id())).isEmpty();
        assertThat(sentLog.recipients(saved.id())).isEmpty();
        assertThat(repository.delete(saved.id())).isFalse();
    }

    @Test
    @DisplayName("findEnabled should skip disabled campaigns")
    void findEnabled() {
        repository.save(welcome());
        repository.save(Campaign.named("dormant"));

        assertThat(repository.findAll()).extracting(Campaign::name).containsExactly("welcome", "dormant");
        assertThat(repository.findEnabled()).extracting(Campaign::name).containsExactly("welcome");
        assertThat(repository.findByName("missing")).isEmpty();
    }
}
