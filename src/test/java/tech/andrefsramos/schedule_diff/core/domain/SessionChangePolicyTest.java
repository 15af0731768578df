package tech.andrefsramos.schedule_diff.core.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionChangePolicy")
class SessionChangePolicyTest {

    private static final Instant START = Instant.parse("2015-05-28T09:30:00Z");

    private static SessionRecord.Builder keynote() {
        return SessionRecord.builder()
                .title("Keynote")
                .startTime(START)
                .endTime(START.plusSeconds(7200))
                .tags(List.of("FLAG_KEYNOTE"))
                .filters(Map.of("Live streamed", true));
    }

    @Nested
    @DisplayName("tags e speakers")
    class CollectionFields {

        @Test
        @DisplayName("speakers nulo equivale a speakers vazio")
        void nullSpeakersEqualsEmpty() {
            SessionRecord a = keynote().build();
            SessionRecord b = keynote().speakers(List.of()).build();

            assertThat(SessionChangePolicy.recordsEqual(a, b)).isTrue();
            assertThat(SessionChangePolicy.recordsEqual(b, a)).isTrue();
        }

        @Test
        @DisplayName("ordem e repetições não importam")
        void orderAndDuplicatesIgnored() {
            SessionRecord a = keynote().tags(List.of("A", "B")).speakers(List.of("s1", "s2")).build();
            SessionRecord b = keynote().tags(List.of("B", "A", "A")).speakers(List.of("s2", "s1", "s2")).build();

            assertThat(SessionChangePolicy.recordsEqual(a, b)).isTrue();
        }

        @Test
        void differentMembersAreDifferent() {
            SessionRecord a = keynote().tags(List.of("A")).build();
            SessionRecord b = keynote().tags(List.of("A", "B")).build();

            assertThat(SessionChangePolicy.recordsEqual(a, b)).isFalse();
            assertThat(SessionChangePolicy.recordsEqual(keynote().speakers(List.of("x")).build(), keynote().build())).isFalse();
        }
    }

    @Nested
    @DisplayName("filters")
    class Filters {

        @Test
        @DisplayName("chave ausente é diferente de false")
        void absentKeyIsNotFalse() {
            SessionRecord a = keynote().filters(Map.of("Live streamed", true)).build();
            SessionRecord b = keynote().filters(Map.of("Live streamed", true, "Android", false)).build();

            assertThat(SessionChangePolicy.recordsEqual(a, b)).isFalse();
        }

        @Test
        void differentValueIsDifferent() {
            SessionRecord a = keynote().filters(Map.of("Live streamed", true)).build();
            SessionRecord b = keynote().filters(Map.of("Live streamed", false)).build();

            assertThat(SessionChangePolicy.recordsEqual(a, b)).isFalse();
        }

        @Test
        @DisplayName("mapa ausente equivale a mapa vazio")
        void nullMapEqualsEmptyMap() {
            SessionRecord a = keynote().filters(null).build();
            SessionRecord b = keynote().filters(Map.of()).build();

            assertThat(SessionChangePolicy.recordsEqual(a, b)).isTrue();
        }
    }

    @Nested
    @DisplayName("campos escalares")
    class ScalarFields {

        @Test
        void titleTimesLiveAndVideoAreExact() {
            SessionRecord base = keynote().build();

            assertThat(SessionChangePolicy.recordsEqual(base, keynote().title("Keynote!").build())).isFalse();
            assertThat(SessionChangePolicy.recordsEqual(base, keynote().startTime(START.plusSeconds(1)).build())).isFalse();
            assertThat(SessionChangePolicy.recordsEqual(base, keynote().endTime(START).build())).isFalse();
            assertThat(SessionChangePolicy.recordsEqual(base, keynote().live(true).build())).isFalse();
            assertThat(SessionChangePolicy.recordsEqual(base, keynote().videoId("abc").build())).isFalse();
        }

        @Test
        @DisplayName("detailsEqual ignora apenas isLive e videoId")
        void detailsIgnoreLiveState() {
            SessionRecord base = keynote().build();

            assertThat(SessionChangePolicy.detailsEqual(base, keynote().live(true).videoId("abc").build())).isTrue();
            assertThat(SessionChangePolicy.detailsEqual(base, keynote().title("Other").build())).isFalse();
        }

        @Test
        @DisplayName("UpdateKind não participa da comparação")
        void updateKindIgnored() {
            SessionRecord base = keynote().build();

            assertThat(SessionChangePolicy.recordsEqual(base, base.withUpdateKind(UpdateKind.VIDEO))).isTrue();
        }

        @Test
        void nullHandling() {
            assertThat(SessionChangePolicy.recordsEqual(null, null)).isTrue();
            assertThat(SessionChangePolicy.recordsEqual(keynote().build(), null)).isFalse();
            assertThat(SessionChangePolicy.recordsEqual(null, keynote().build())).isFalse();
        }
    }
}
