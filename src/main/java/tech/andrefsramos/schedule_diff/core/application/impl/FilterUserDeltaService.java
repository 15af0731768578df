package tech.andrefsramos.schedule_diff.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.schedule_diff.core.application.FilterUserDeltaUseCase;
import tech.andrefsramos.schedule_diff.core.domain.Delta;
import tech.andrefsramos.schedule_diff.core.domain.SessionRecord;
import tech.andrefsramos.schedule_diff.core.domain.UserBookmarks;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Finalidade

 * Restringe um {@link Delta} às sessões marcadas por um usuário, para que a notificação
 * enviada a ele contenha apenas o que o interessa. Sessões e ids removidos fora dos
 * bookmarks são descartados; "changed" é preservado.
 */
public class FilterUserDeltaService implements FilterUserDeltaUseCase {

    private static final Logger log = LoggerFactory.getLogger(FilterUserDeltaService.class);

    @Override
    public Delta filter(Delta delta, UserBookmarks bookmarks) {
        if (delta == null) {
            log.warn("[UserDelta] Delta nulo recebido — retornando delta vazio.");
            return Delta.empty(null);
        }
        if (bookmarks == null || bookmarks.isEmpty()) {
            log.debug("[UserDelta] Usuário sem bookmarks — delta vazio.");
            return Delta.empty(delta.changedAt());
        }

        final Map<String, SessionRecord> kept = new LinkedHashMap<>();
        delta.sessions().forEach((id, s) -> {
            if (bookmarks.contains(id)) kept.put(id, s);
        });
        final List<String> removed = delta.removed().stream()
                .filter(bookmarks::contains)
                .toList();

        log.info("[UserDelta] Filtrado: bookmarks={}, sessions={}->{}, removed={}->{}",
                bookmarks.ids().size(), delta.sessions().size(), kept.size(),
                delta.removed().size(), removed.size());

        return new Delta(delta.changedAt(), kept, removed);
    }
}
