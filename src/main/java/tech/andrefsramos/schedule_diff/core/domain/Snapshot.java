package tech.andrefsramos.schedule_diff.core.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record Snapshot(Map<String, SessionRecord> sessions) {

    private static final Snapshot EMPTY = new Snapshot(Map.of());

    public Snapshot {
        if (sessions == null) {
            sessions = Map.of();
        } else {
            Map<String, SessionRecord> copy = new LinkedHashMap<>(sessions.size() * 2);
            for (Map.Entry<String, SessionRecord> e : sessions.entrySet()) {
                if (e.getKey() == null) {
                    throw new IllegalArgumentException("Snapshot contém sessão sem id.");
                }
                if (e.getValue() == null) {
                    throw new IllegalArgumentException("Snapshot contém sessão sem dados: id=" + e.getKey());
                }
                copy.put(e.getKey(), e.getValue());
            }
            sessions = Collections.unmodifiableMap(copy);
        }
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    public static Snapshot of(Map<String, SessionRecord> sessions) {
        return new Snapshot(sessions);
    }

    public SessionRecord get(String id) {
        return sessions.get(id);
    }

    public boolean contains(String id) {
        return sessions.containsKey(id);
    }

    public int size() {
        return sessions.size();
    }
}
