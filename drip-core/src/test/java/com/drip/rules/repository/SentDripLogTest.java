package com.drip.rules.repository;

import com.drip.rules.api.model.Campaign;
import com.drip.rules.api.model.SentDrip;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class SentDripLogTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static SentDrip sent(long campaignId, Object userId) {
        return new SentDrip(null, campaignId, userId, "Welcome", "<p>Hi</p>", "hello@example.com",
                null, null, "welcome", null);
    }

    private static SentDrip sentAt(long campaignId, Object userId, Instant sentAt) {
        return new SentDrip(null, campaignId, userId, "Welcome", "<p>Hi</p>", "hello@example.com",
                null, null, "welcome", sentAt);
    }

    @Test
    @DisplayName("User keys should treat numeric and text ids alike")
    void userKey() {
        assertThat(SentDripLog.userKey(7)).isEqualTo("7");
        assertThat(SentDripLog.userKey(7L)).isEqualTo("7");
        assertThat(SentDripLog.userKey(new BigDecimal("7.00"))).isEqualTo("7");
        assertThat(SentDripLog.userKey("abc")).isEqualTo("abc");
    }

    abstract static class Contract {

        abstract SentDripLog log();

        abstract long campaignId();

        @Test
        void recordsAndFindsRecipients() {
            SentDrip stored = log().record(sent(campaignId(), 7L));

            assertThat(stored.id()).isNotNull();
            assertThat(stored.sentAt()).isEqualTo(NOW);
            assertThat(log().recipients(campaignId())).containsExactly("7");
            assertThat(log().hasReceived(campaignId(), 7)).isTrue();
            assertThat(log().hasReceived(campaignId(), "7")).isTrue();
            assertThat(log().hasReceived(campaignId(), 8L)).isFalse();
        }

        @Test
        void findsAndDeletesByCampaign() {
            log().record(sent(campaignId(), 1L));
            log().record(sent(campaignId(), 2L));

            assertThat(log().findByCampaign(campaignId())).extracting(SentDrip::subject).containsOnly("Welcome");
            assertThat(log().deleteByCampaign(campaignId())).isEqualTo(2);
            assertThat(log().recipients(campaignId())).isEmpty();
        }

        @Test
        void findsOldestFirstRegardlessOfRecordingOrder() {
            log().record(sent(campaignId(), 1L));
            log().record(sentAt(campaignId(), 2L, NOW.minusSeconds(3600)));
            log().record(sentAt(campaignId(), 3L, NOW.plusSeconds(60)));

            assertThat(log().findByCampaign(campaignId()))
                    .extracting(s -> SentDripLog.userKey(s.userId()))
                    .containsExactly("2", "1", "3");
        }
    }

    @Nested
    @DisplayName("In memory")
    class InMemory extends Contract {
        private final InMemorySentDripLog log = new InMemorySentDripLog(CLOCK);

        @Override
        SentDripLog log() {
            return log;
        }

        @Override
        long campaignId() {
            return 1L;
        }
    }

    @Nested
    @DisplayName("JDBC")
    class Jdbc extends Contract {
        private final JdbcSentDripLog log;
        private final long campaignId;

        Jdbc() {
            JdbcDataSource dataSource = new JdbcDataSource();
            dataSource.setURL("jdbc:h2:mem:sent_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
            JdbcCampaignRepository repository = new JdbcCampaignRepository(dataSource, CLOCK);
            repository.initializeSchema();
            campaignId = repository.save(Campaign.named("welcome")).id();
            log = new JdbcSentDripLog(dataSource, CLOCK);
        }

        @Override
        SentDripLog log() {
            return log;
        }

        @Override
        long campaignId() {
            return campaignId;
        }
    }
}
