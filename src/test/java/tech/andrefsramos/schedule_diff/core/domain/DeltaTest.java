package tech.andrefsramos.schedule_diff.core.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Delta")
class DeltaTest {

    private static final Instant T1 = Instant.parse("2015-05-28T10:00:00Z");
    private static final Instant T2 = Instant.parse("2015-05-28T11:00:00Z");

    private static SessionRecord titled(String title) {
        return SessionRecord.builder().title(title).build();
    }

    @Test
    @DisplayName("entradas do delta mais novo prevalecem")
    void newerEntriesWin() {
        Delta older = new Delta(T1, Map.of("a", titled("A1"), "b", titled("B1")), List.of());
        Delta newer = new Delta(T2, Map.of("a", titled("A2")), List.of());

        Delta merged = older.mergedWith(newer);

        assertThat(merged.changedAt()).isEqualTo(T2);
        assertThat(merged.sessions()).containsOnlyKeys("a", "b");
        assertThat(merged.sessions().get("a").title()).isEqualTo("A2");
        assertThat(merged.sessions().get("b").title()).isEqualTo("B1");
    }

    @Test
    @DisplayName("id removido no delta novo sai de sessions")
    void removalInNewerDropsSession() {
        Delta older = new Delta(T1, Map.of("a", titled("A1")), List.of("z"));
        Delta newer = new Delta(T2, Map.of(), List.of("a", "z"));

        Delta merged = older.mergedWith(newer);

        assertThat(merged.sessions()).isEmpty();
        assertThat(merged.removed()).containsExactly("a", "z");
    }

    @Test
    @DisplayName("id que reaparece no delta novo sai de removed")
    void reappearanceClearsRemoval() {
        Delta older = new Delta(T1, Map.of(), List.of("a", "b"));
        Delta newer = new Delta(T2, Map.of("a", titled("back")), List.of());

        Delta merged = older.mergedWith(newer);

        assertThat(merged.sessions()).containsOnlyKeys("a");
        assertThat(merged.removed()).containsExactly("b");
    }

    @Test
    void mergeKeepsLatestTimestampAndDoesNotMutateInputs() {
        Delta older = new Delta(T2, Map.of("a", titled("A")), List.of());
        Delta newer = new Delta(T1, Map.of("b", titled("B")), List.of());

        Delta merged = older.mergedWith(newer);

        assertThat(merged.changedAt()).isEqualTo(T2);
        assertThat(older.sessions()).containsOnlyKeys("a");
        assertThat(newer.sessions()).containsOnlyKeys("b");
        assertThat(older.mergedWith(null)).isSameAs(older);
    }

    @Test
    @DisplayName("coleções do delta são imutáveis")
    void collectionsAreUnmodifiable() {
        Delta d = new Delta(T1, Map.of("a", titled("A")), List.of("b"));

        assertThatThrownBy(() -> d.sessions().put("x", titled("X"))).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> d.removed().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThat(Delta.empty(T1).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("merge preserva tipos de update desconhecidos")
    void mergeKeepsUnknownKinds() {
        UpdateKind details = UpdateKind.of("details");
        Delta older = new Delta(T1, Map.of("a", SessionRecord.builder().title("A").updateKind(details).build()), List.of());
        Delta newer = new Delta(T2, Map.of("b", titled("B").withUpdateKind(UpdateKind.VIDEO)), List.of());

        Delta merged = older.mergedWith(newer);

        assertThat(merged.sessions().get("a").updateKind()).isEqualTo(details);
        assertThat(merged.sessions().get("a").updateKind().value()).isEqualTo("details");
        assertThat(merged.sessions().get("b").updateKind()).isSameAs(UpdateKind.VIDEO);
        assertThat(UpdateKind.of("")).isSameAs(UpdateKind.NONE);
        assertThat(UpdateKind.of(null).isNone()).isTrue();
    }
}
