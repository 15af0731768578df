package tech.andrefsramos.schedule_diff.core.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*
 * Operações de conjunto sobre listas de strings, preservando a ordem original.
 * Sempre retornam uma nova lista (nunca a instância de entrada, nunca null).
 */
public final class StringSets {

    private StringSets() {}

    /** Elementos de {@code source} que não estão em {@code exclude}, por igualdade exata. */
    public static List<String> subtract(Collection<String> source, String... exclude) {
        if (source == null || source.isEmpty()) return new ArrayList<>();
        if (exclude == null || exclude.length == 0) return new ArrayList<>(source);

        final Set<String> skip = new HashSet<>(Arrays.asList(exclude));
        final List<String> out = new ArrayList<>(source.size());
        for (String s : source) {
            if (!skip.contains(s)) out.add(s);
        }
        return out;
    }

    /** Remove repetições mantendo a primeira ocorrência de cada valor. */
    public static List<String> unique(Collection<String> source) {
        if (source == null || source.isEmpty()) return new ArrayList<>();

        final Set<String> seen = new HashSet<>(source.size() * 2);
        final List<String> out = new ArrayList<>(source.size());
        for (String s : source) {
            if (seen.add(s)) out.add(s);
        }
        return out;
    }

    static Set<String> asSet(Collection<String> source) {
        return source == null ? Set.of() : new HashSet<>(source);
    }
}
