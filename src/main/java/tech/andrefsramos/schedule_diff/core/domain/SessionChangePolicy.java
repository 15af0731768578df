package tech.andrefsramos.schedule_diff.core.domain;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public final class SessionChangePolicy {

    private SessionChangePolicy() {}

    /*
     * Listas (tags, speakers) comparam como conjuntos, com ausente == vazio.
     * Filters compara chave a chave: chave ausente != false.
     * UpdateKind é derivado e não participa da comparação.
     */
    public static boolean recordsEqual(SessionRecord a, SessionRecord b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        return liveStateEqual(a, b) && detailsEqual(a, b);
    }

    /** Igualdade de todos os campos exceto o par (isLive, videoId), que pertence à regra de vídeo. */
    public static boolean detailsEqual(SessionRecord a, SessionRecord b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        return Objects.equals(a.title(), b.title())
                && Objects.equals(a.startTime(), b.startTime())
                && Objects.equals(a.endTime(), b.endTime())
                && sameSet(a, b, SessionRecord::tags)
                && sameSet(a, b, SessionRecord::speakers)
                && sameFilters(a.filters(), b.filters());
    }

    public static boolean liveStateEqual(SessionRecord a, SessionRecord b) {
        return a.isLive() == b.isLive() && Objects.equals(a.videoId(), b.videoId());
    }

    private static boolean sameSet(SessionRecord a, SessionRecord b, Function<SessionRecord, List<String>> field) {
        return StringSets.asSet(field.apply(a)).equals(StringSets.asSet(field.apply(b)));
    }

    private static boolean sameFilters(Map<String, Boolean> a, Map<String, Boolean> b) {
        final Map<String, Boolean> left = a == null ? Map.of() : a;
        final Map<String, Boolean> right = b == null ? Map.of() : b;
        if (left.size() != right.size()) return false;
        for (Map.Entry<String, Boolean> e : left.entrySet()) {
            if (!right.containsKey(e.getKey())) return false;
            if (!Objects.equals(e.getValue(), right.get(e.getKey()))) return false;
        }
        return true;
    }
}
