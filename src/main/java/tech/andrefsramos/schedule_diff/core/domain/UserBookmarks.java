package tech.andrefsramos.schedule_diff.core.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/*
 * Sessões marcadas por um usuário. Sem repetições, na ordem em que foram adicionadas.
 */
public final class UserBookmarks {

    private final List<String> ids;
    private final Set<String> lookup;

    private UserBookmarks(List<String> ids) {
        this.ids = List.copyOf(ids);
        this.lookup = new HashSet<>(this.ids);
    }

    public static UserBookmarks of(List<String> ids) {
        return new UserBookmarks(StringSets.unique(StringSets.subtract(ids, (String) null)));
    }

    public UserBookmarks add(String... more) {
        if (more == null || more.length == 0) return this;
        final List<String> all = new ArrayList<>(ids);
        all.addAll(Arrays.asList(more));
        return of(all);
    }

    public UserBookmarks remove(String... gone) {
        if (gone == null || gone.length == 0) return this;
        return new UserBookmarks(StringSets.subtract(ids, gone));
    }

    public boolean contains(String id) {
        return lookup.contains(id);
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public List<String> ids() {
        return ids;
    }

    @Override
    public String toString() {
        return "UserBookmarks" + ids;
    }
}
