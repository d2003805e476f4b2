package com.drip.rules.integration;

import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.LookupType;
import com.drip.rules.api.model.MethodType;
import com.drip.rules.api.model.QuerySetRule;
import com.drip.rules.api.model.SentDrip;
import com.drip.rules.api.query.Queryable;
import com.drip.rules.api.validation.ErrorCategory;
import com.drip.rules.api.validation.ValidationResult;
import com.drip.rules.campaign.CampaignLoader;
import com.drip.rules.campaign.CampaignSelection;
import com.drip.rules.campaign.CampaignSelector;
import com.drip.rules.compiler.PredicateCompiler;
import com.drip.rules.compiler.RuleSet;
import com.drip.rules.repository.JdbcCampaignRepository;
import com.drip.rules.repository.JdbcSentDripLog;
import com.drip.rules.store.UserFixtures;
import com.drip.rules.store.memory.InMemoryQueryable;
import com.drip.rules.store.schema.FieldType;
import com.drip.rules.store.schema.RecordSchema;
import com.drip.rules.store.sql.SqlDialect;
import com.drip.rules.store.sql.SqlQueryable;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end: campaigns loaded from JSON, stored over JDBC, applied to both stores.
 */
class RulePipelineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC);

    private Tracer tracer;
    private PredicateCompiler compiler;
    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws SQLException {
        tracer = OpenTelemetry.noop().getTracer("test");
        compiler = new PredicateCompiler(tracer);
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:pipeline_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        UserFixtures.createTables(dataSource);
    }

    private static List<Object> ids(List<Map<String, Object>> rows) {
        return rows.stream().map(row -> row.get("id")).toList();
    }

    private static Map<String, Object> person(long id, int age) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("age", age);
        return row;
    }

    @Test
    @DisplayName("Filter and exclude on age should split the people between them")
    void filterAndExcludeSplitRows() {
        RecordSchema people = RecordSchema.builder("people").field("age", FieldType.INTEGER).build();
        Queryable<Map<String, Object>> base = new InMemoryQueryable(people,
                List.of(person(1, 15), person(2, 18), person(3, 21)));
        QuerySetRule adult = QuerySetRule.of(0, MethodType.FILTER, "age", LookupType.GTE, "18");
        QuerySetRule minor = QuerySetRule.of(0, MethodType.EXCLUDE, "age", LookupType.GTE, "18");

        assertThat(ids(compiler.apply(adult, base, CLOCK).fetch())).containsExactly(2L, 3L);
        assertThat(ids(compiler.apply(minor, base, CLOCK).fetch())).containsExactly(1L);
        assertThat(base.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Both stores should select the same users for the same rules")
    void storesAgree() {
        RuleSet rules = new RuleSet("buyers", List.of(
                QuerySetRule.of(0, MethodType.FILTER, "orders__count", LookupType.GTE, "1"),
                QuerySetRule.of(1, MethodType.FILTER, "orders__count", LookupType.LT, "5"),
                QuerySetRule.of(2, MethodType.EXCLUDE, "email", LookupType.IENDSWITH, ".ORG"),
                QuerySetRule.of(3, MethodType.FILTER, "date_joined", LookupType.GTE, "today-7 days"),
                QuerySetRule.of(4, MethodType.FILTER, "age", LookupType.LTE, "F_min_age")), compiler, tracer);

        List<Map<String, Object>> inMemory = rules.apply(
                new InMemoryQueryable(UserFixtures.USERS, UserFixtures.users()), CLOCK).fetch();
        List<Map<String, Object>> sql = rules.apply(
                new SqlQueryable(dataSource, SqlDialect.H2, UserFixtures.USERS), CLOCK).fetch();

        assertThat(ids(inMemory)).containsExactly(1L);
        assertThat(ids(sql)).isEqualTo(ids(inMemory));
        assertThat(sql.get(0)).containsEntry("num_orders", 2L);
    }

    @Test
    @DisplayName("Validation against a real store should report unknown fields")
    void validationWithRealStore() {
        RuleSet rules = new RuleSet("typo", List.of(
                QuerySetRule.of(0, MethodType.FILTER, "agee", LookupType.GTE, "18").withId(1L),
                QuerySetRule.of(1, MethodType.FILTER, "orders__count", LookupType.GT, "0").withId(2L)), compiler, tracer);

        ValidationResult result = rules.validate(new SqlQueryable(dataSource, SqlDialect.H2, UserFixtures.USERS), CLOCK);

        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.getRuleId()).isEqualTo(1L);
            assertThat(failure.getCategory()).isEqualTo(ErrorCategory.UNKNOWN_FIELD);
        });
    }

    @Test
    @DisplayName("A loaded campaign should be stored, selected and not sent twice")
    void loadStoreSelectRecord() throws Exception {
        JdbcCampaignRepository repository = new JdbcCampaignRepository(dataSource, CLOCK);
        repository.initializeSchema();
        JdbcSentDripLog sentLog = new JdbcSentDripLog(dataSource, CLOCK);
        CampaignSelector selector = new CampaignSelector(compiler, sentLog, tracer);
        SqlQueryable users = new SqlQueryable(dataSource, SqlDialect.H2, UserFixtures.USERS);

        for (Campaign campaign : new CampaignLoader().loadResource("campaigns/sample-campaigns.json")) {
            repository.save(campaign.withId(null));
        }

        List<CampaignSelection> first = selector.selectAll(repository, users, CLOCK);
        assertThat(first).extracting(s -> s.campaign().name()).containsExactly("welcome");
        assertThat(ids(first.get(0).recipients())).isEmpty();

        Campaign adults = repository.findByName("adults").orElseThrow().withEnabled(true);
        repository.save(adults);
        CampaignSelection selection = selector.select(repository.findByName("adults").orElseThrow(), users, CLOCK);
        assertThat(ids(selection.recipients())).containsExactly(2L, 3L);

        sentLog.record(new SentDrip(null, adults.id(), selection.recipients().get(0).get("id"),
                "Hi", "", null, null, null, adults.name(), null));

        CampaignSelection again = selector.select(repository.findByName("adults").orElseThrow(), users, CLOCK);
        assertThat(ids(again.recipients())).containsExactly(3L);
        assertThat(again.alreadySent()).isEqualTo(1);
    }
}
