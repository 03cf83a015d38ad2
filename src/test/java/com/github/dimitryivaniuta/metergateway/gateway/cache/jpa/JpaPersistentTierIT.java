package com.github.dimitryivaniuta.metergateway.gateway.cache.jpa;

import com.github.dimitryivaniuta.metergateway.gateway.cache.PersistentTier;
import com.github.dimitryivaniuta.metergateway.gateway.cache.StoredEntry;
import com.github.dimitryivaniuta.metergateway.infra.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
class JpaPersistentTierIT extends BaseIntegrationTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired PersistentTier tier;

    private final AtomicLong seq = new AtomicLong();

    @Test
    void put_shouldUpsertAndFindLiveEntriesOnly() {
        tier.put(entry("meter:42:unit", "17.5", T0, T0.plus(1, ChronoUnit.HOURS)));
        tier.put(entry("meter:42:unit", "18.0", T0.plusSeconds(5), T0.plus(2, ChronoUnit.HOURS)));

        assertThat(tier.count()).isEqualTo(1);
        assertThat(tier.find("meter:42:unit", T0.plusSeconds(10)))
                .hasValueSatisfying(e -> {
                    assertThat(e.payload()).isEqualTo("18.0");
                    assertThat(e.expiresAt()).isEqualTo(T0.plus(2, ChronoUnit.HOURS));
                });
        assertThat(tier.find("meter:42:unit", T0.plus(2, ChronoUnit.HOURS))).isEmpty();
    }

    @Test
    void put_shouldKeepTheRowWithTheHigherWriteSequence() {
        tier.put(new StoredEntry("meter:42:unit", "\"B\"", T0.plusSeconds(1), T0.plusSeconds(600), 20));
        tier.put(new StoredEntry("meter:42:unit", "\"A\"", T0, T0.plusSeconds(600), 10));

        assertThat(tier.find("meter:42:unit", T0)).hasValueSatisfying(e -> {
            assertThat(e.payload()).isEqualTo("\"B\"");
            assertThat(e.writeSeq()).isEqualTo(20);
        });

        tier.put(new StoredEntry("meter:42:unit", "\"C\"", T0.plusSeconds(2), T0.plusSeconds(600), 21));
        assertThat(tier.find("meter:42:unit", T0)).hasValueSatisfying(e -> assertThat(e.payload()).isEqualTo("\"C\""));
    }

    @Test
    void put_shouldStoreJsonObjectsAsJsonb() {
        tier.put(entry("meter:42:summary", "{\"meterId\":\"42\",\"credit\":17.5}", T0, T0.plusSeconds(60)));

        String type = jdbc.queryForObject(
                "select jsonb_typeof(payload) from tier_cache_entry where cache_key = ?", String.class, "meter:42:summary");
        assertThat(type).isEqualTo("object");
        assertThat(tier.find("meter:42:summary", T0)).isPresent();
    }

    @Test
    void deleteByPrefix_shouldTreatLikeMetacharactersLiterally() {
        tier.put(entry("meter:4_:unit", "1", T0, T0.plusSeconds(60)));
        tier.put(entry("meter:42:unit", "2", T0, T0.plusSeconds(60)));
        tier.put(entry("meter:4_", "3", T0, T0.plusSeconds(60)));

        int removed = tier.deleteByPrefix("meter:4_:");

        assertThat(removed).isEqualTo(1);
        assertThat(tier.find("meter:42:unit", T0)).isPresent();
        assertThat(tier.find("meter:4_", T0)).isPresent();
    }

    @Test
    void deleteExpired_shouldRespectBatchLimit() {
        for (int i = 0; i < 5; i++) {
            tier.put(entry("old:" + i, "1", T0, T0.plusSeconds(i)));
        }
        tier.put(entry("fresh:1", "1", T0, T0.plusSeconds(3600)));

        assertThat(tier.deleteExpired(T0.plusSeconds(10), 3)).isEqualTo(3);
        assertThat(tier.deleteExpired(T0.plusSeconds(10), 3)).isEqualTo(2);
        assertThat(tier.deleteExpired(T0.plusSeconds(10), 3)).isZero();
        assertThat(tier.count()).isEqualTo(1);
    }

    @Test
    void cullOldest_shouldKeepNewestEntries() {
        for (int i = 0; i < 5; i++) {
            tier.put(entry("k:" + i, "1", T0.plusSeconds(i), T0.plusSeconds(3600)));
        }

        assertThat(tier.cullOldest(2, 100)).isEqualTo(3);
        assertThat(tier.cullOldest(2, 100)).isZero();
        assertThat(tier.find("k:3", T0)).isPresent();
        assertThat(tier.find("k:4", T0)).isPresent();
        assertThat(tier.find("k:0", T0)).isEmpty();
    }

    @Test
    void delete_andClear_shouldRemoveRows() {
        tier.put(entry("a:1", "1", T0, T0.plusSeconds(60)));
        tier.put(entry("a:2", "2", T0, T0.plusSeconds(60)));

        assertThat(tier.delete("a:1")).isTrue();
        assertThat(tier.delete("a:1")).isFalse();
        tier.clear();
        assertThat(tier.count()).isZero();
    }

    private StoredEntry entry(String key, String payload, Instant createdAt, Instant expiresAt) {
        return new StoredEntry(key, payload, createdAt, expiresAt, seq.incrementAndGet());
    }
}
