package tech.andrefsramos.schedule_diff.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Finalidade

 * Conjunto de mudanças entre dois snapshots:
 *  - sessions: sessões novas ou alteradas (registro atual, anotado com UpdateKind).
 *  - removed:  ids presentes apenas no snapshot anterior, ordenados.
 * Uma sessão ausente de ambos é considerada inalterada.
 */
public record Delta(
        @JsonProperty("changed") Instant changedAt,
        @JsonProperty("sessions") Map<String, SessionRecord> sessions,
        @JsonProperty("removed") List<String> removed
) {
    public Delta {
        sessions = sessions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sessions));
        removed = removed == null ? List.of() : List.copyOf(removed);
    }

    public static Delta empty(Instant changedAt) {
        return new Delta(changedAt, Map.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sessions.isEmpty() && removed.isEmpty();
    }

    /**
     * Acumula {@code newer} sobre este delta, para consumidores que perderam sincronizações
     * intermediárias. Entradas de {@code newer} prevalecem por id; um id removido em {@code newer}
     * sai de {@code sessions}, e um id presente em {@code newer.sessions} sai de {@code removed}.
     */
    public Delta mergedWith(Delta newer) {
        if (newer == null) return this;

        Map<String, SessionRecord> merged = new LinkedHashMap<>(sessions);
        merged.putAll(newer.sessions());
        newer.removed().forEach(merged::remove);

        List<String> allRemoved = new ArrayList<>(removed.size() + newer.removed().size());
        allRemoved.addAll(removed);
        allRemoved.addAll(newer.removed());
        List<String> mergedRemoved = StringSets.subtract(
                StringSets.unique(allRemoved),
                newer.sessions().keySet().toArray(new String[0]));
        Collections.sort(mergedRemoved);

        return new Delta(latest(changedAt, newer.changedAt()), merged, mergedRemoved);
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
