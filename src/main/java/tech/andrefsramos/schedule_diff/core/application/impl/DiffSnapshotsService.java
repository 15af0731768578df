package tech.andrefsramos.schedule_diff.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.schedule_diff.core.application.DiffSnapshotsUseCase;
import tech.andrefsramos.schedule_diff.core.domain.Delta;
import tech.andrefsramos.schedule_diff.core.domain.SessionChangePolicy;
import tech.andrefsramos.schedule_diff.core.domain.SessionRecord;
import tech.andrefsramos.schedule_diff.core.domain.Snapshot;
import tech.andrefsramos.schedule_diff.core.domain.UpdateKind;
import tech.andrefsramos.schedule_diff.core.domain.VideoAvailabilityPolicy;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/*
 * Finalidade

 * Compara dois snapshots do catálogo (anterior e atual) e monta o {@link Delta}:
 *  1) Para cada sessão do snapshot atual, busca a correspondente no anterior.
 *  2) Se não existir: sessão NOVA, sempre incluída.
 *  3) Se existir: aplica a comparação de campos e
 *     {@link VideoAvailabilityPolicy#computeUpdateKind}:
 *     - iguais e sem UpdateKind -> omitida (sem notificação).
 *     - caso contrário          -> incluída com o registro atual anotado.
 *  4) Sessões presentes apenas no anterior vão para a lista "removed".

 * Comparação de campos
 *  - trackLiveState=false (padrão): {@link SessionChangePolicy#detailsEqual}. O par
 *    (isLive, videoId) só gera entrada quando a regra de vídeo dispara.
 *  - trackLiveState=true: {@link SessionChangePolicy#recordsEqual}, qualquer mudança
 *    de isLive/videoId também gera entrada (sem UpdateKind).

 * O serviço não guarda estado entre chamadas e nunca altera os snapshots recebidos.
 * Catálogos com pelo menos {@code parallelThreshold} sessões são comparados em paralelo.
 */
public class DiffSnapshotsService implements DiffSnapshotsUseCase {

    private static final Logger log = LoggerFactory.getLogger(DiffSnapshotsService.class);

    private final Clock clock;
    private final int parallelThreshold;
    private final boolean trackLiveState;

    public DiffSnapshotsService(Clock clock, int parallelThreshold) {
        this(clock, parallelThreshold, false);
    }

    public DiffSnapshotsService(Clock clock, int parallelThreshold, boolean trackLiveState) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.parallelThreshold = parallelThreshold;
        this.trackLiveState = trackLiveState;
    }

    @Override
    public Delta diff(Snapshot previous, Snapshot current) {
        return diff(previous, current, clock.instant());
    }

    @Override
    public Delta diff(Snapshot previous, Snapshot current, Instant now) {
        final long t0 = System.nanoTime();
        final Snapshot prev = previous == null ? Snapshot.empty() : previous;
        final Snapshot curr = current == null ? Snapshot.empty() : current;
        final Instant at = now == null ? clock.instant() : now;

        if (prev.size() == 0 && curr.size() == 0) {
            log.info("[Diff] Snapshots vazios — nada a comparar.");
            return Delta.empty(at);
        }

        final boolean parallel = curr.size() >= parallelThreshold;
        Stream<Map.Entry<String, SessionRecord>> entries = curr.sessions().entrySet().stream();
        if (parallel) {
            entries = entries.parallel();
        }

        final Map<String, SessionRecord> changed = entries
                .map(e -> compare(e.getKey(), prev.get(e.getKey()), e.getValue(), at))
                .flatMap(Optional::stream)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

        final List<String> removed = new ArrayList<>();
        for (String id : prev.sessions().keySet()) {
            if (!curr.contains(id)) removed.add(id);
        }
        Collections.sort(removed);

        final Delta delta = new Delta(at, changed, removed);

        if (log.isDebugEnabled()) {
            removed.forEach(id -> log.debug("[Diff] REMOVED id={}", id));
        }
        log.info("[Diff] Concluído: previous={}, current={}, changed={}, removed={}, parallel={}, duração={} ms",
                prev.size(), curr.size(), changed.size(), removed.size(), parallel, durMs(t0, System.nanoTime()));

        return delta;
    }

    private Optional<Map.Entry<String, SessionRecord>> compare(
            String id, SessionRecord before, SessionRecord after, Instant now) {

        final UpdateKind kind = VideoAvailabilityPolicy.computeUpdateKind(before, after, now);

        if (before == null) {
            if (log.isDebugEnabled()) {
                log.debug("[Diff] NEW id={} título='{}' kind='{}'", id, after.title(), kind.value());
            }
            return Optional.of(Map.entry(id, after.withUpdateKind(kind)));
        }

        if (kind.isNone() && sameFields(before, after)) {
            return Optional.empty();
        }

        if (log.isDebugEnabled()) {
            log.debug("[Diff] UPDATE id={} título='{}' kind='{}'", id, after.title(), kind.value());
        }
        return Optional.of(Map.entry(id, after.withUpdateKind(kind)));
    }

    private boolean sameFields(SessionRecord before, SessionRecord after) {
        return trackLiveState
                ? SessionChangePolicy.recordsEqual(before, after)
                : SessionChangePolicy.detailsEqual(before, after);
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
