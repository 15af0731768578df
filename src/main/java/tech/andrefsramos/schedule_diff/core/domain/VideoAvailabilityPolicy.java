package tech.andrefsramos.schedule_diff.core.domain;

import java.time.Instant;
import java.util.Objects;

public final class VideoAvailabilityPolicy {

    private static final SessionRecord NO_VIDEO = SessionRecord.builder().build();

    private VideoAvailabilityPolicy() {}

    /*
     * VIDEO somente para sessões encerradas (endTime <= now) cujo estado atual é
     * "não ao vivo com vídeo" e cujo par (isLive, videoId) mudou em relação ao anterior.
     * endTime nulo equivale ao instante zero, ou seja, sessão encerrada.
     */
    public static UpdateKind computeUpdateKind(SessionRecord previous, SessionRecord current, Instant now) {
        Objects.requireNonNull(now, "now is required");
        if (current == null) return UpdateKind.NONE;
        if (!isConcluded(current, now)) return UpdateKind.NONE;
        if (current.isLive() || !current.hasVideo()) return UpdateKind.NONE;

        final SessionRecord before = previous == null ? NO_VIDEO : previous;
        final boolean moved = before.isLive() != current.isLive()
                || !Objects.equals(before.videoId(), current.videoId());
        return moved ? UpdateKind.VIDEO : UpdateKind.NONE;
    }

    public static boolean isConcluded(SessionRecord s, Instant now) {
        Objects.requireNonNull(now, "now is required");
        return s.endTime() == null || !s.endTime().isAfter(now);
    }
}
