package tech.andrefsramos.schedule_diff.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.schedule_diff.adapters.inbound.api.dto.DiffRequest;
import tech.andrefsramos.schedule_diff.adapters.inbound.api.dto.MergeRequest;
import tech.andrefsramos.schedule_diff.adapters.inbound.api.dto.UserDeltaRequest;
import tech.andrefsramos.schedule_diff.core.application.DiffSnapshotsUseCase;
import tech.andrefsramos.schedule_diff.core.application.FilterUserDeltaUseCase;
import tech.andrefsramos.schedule_diff.core.domain.Delta;
import tech.andrefsramos.schedule_diff.core.domain.Snapshot;
import tech.andrefsramos.schedule_diff.core.domain.UserBookmarks;

/**
 * DeltaController
 *
 * Descrição geral:
 * - Controlador REST (versão v1) que expõe o cálculo de deltas entre snapshots do catálogo.
 *
 * Responsabilidades:
 * - Validar o corpo recebido (snapshot atual obrigatório; anterior ausente = catálogo vazio).
 * - Invocar {@link DiffSnapshotsUseCase} e {@link FilterUserDeltaUseCase}.
 * - Retornar 400 para entradas inválidas e 500 para erros inesperados.
 */
@RestController
@RequestMapping("/api/v1/delta")
@Tag(name = "01 - Delta")
public class DeltaController {

    private static final Logger log = LoggerFactory.getLogger(DeltaController.class);

    private final DiffSnapshotsUseCase diff;
    private final FilterUserDeltaUseCase userFilter;

    public DeltaController(DiffSnapshotsUseCase diff, FilterUserDeltaUseCase userFilter) {
        this.diff = diff;
        this.userFilter = userFilter;
    }

    @PostMapping
    @Operation(
            summary = "Calcula o delta entre dois snapshots",
            description = """
        Compara cada sessão do snapshot `current` com a correspondente em `previous` e retorna
        apenas as sessões novas ou alteradas (`sessions`) e os ids que deixaram de existir (`removed`).

        Sessões encerradas cujo vídeo gravado acabou de ficar disponível recebem `update = "video"`.
        Quando `now` é omitido, o relógio do servidor é usado.
        """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Delta calculado (possivelmente vazio)."),
                    @ApiResponse(responseCode = "400", description = "Snapshot `current` ausente ou com sessões sem dados."),
                    @ApiResponse(responseCode = "500", description = "Erro inesperado ao calcular o delta.")
            }
    )
    public ResponseEntity<Delta> diff(@RequestBody DiffRequest request) {
        long t0 = System.nanoTime();

        if (request == null || request.current() == null) {
            log.warn("DeltaController: snapshot 'current' ausente no corpo da requisição");
            return ResponseEntity.badRequest().build();
        }
        log.info("DeltaController: diff recebido previous={}, current={}, now={}",
                request.previous() == null ? 0 : request.previous().size(), request.current().size(), request.now());

        final Snapshot previous;
        final Snapshot current;
        try {
            previous = Snapshot.of(request.previous());
            current = Snapshot.of(request.current());
        } catch (IllegalArgumentException iae) {
            log.warn("DeltaController: snapshot inválido: {}", iae.getMessage());
            return ResponseEntity.badRequest().build();
        }

        try {
            Delta delta = request.now() == null
                    ? diff.diff(previous, current)
                    : diff.diff(previous, current, request.now());
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("DeltaController: diff concluído (sessions={}, removed={}, elapsedMs={})",
                    delta.sessions().size(), delta.removed().size(), elapsedMs);
            return ResponseEntity.ok(delta);
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
            log.error("DeltaController: erro ao calcular delta (elapsedMs={})", elapsedMs, ex);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/merge")
    @Operation(
            summary = "Acumula dois deltas consecutivos",
            description = """
        Combina `older` e `newer` em um único delta, para clientes que perderam sincronizações
        intermediárias. Entradas de `newer` prevalecem; ids removidos em `newer` saem de `sessions`
        e ids reaparecidos saem de `removed`.
        """
    )
    public ResponseEntity<Delta> merge(@RequestBody MergeRequest request) {
        if (request == null || request.older() == null || request.newer() == null) {
            log.warn("DeltaController: merge exige 'older' e 'newer'");
            return ResponseEntity.badRequest().build();
        }

        try {
            Delta merged = request.older().mergedWith(request.newer());
            log.info("DeltaController: merge concluído (sessions={}, removed={})",
                    merged.sessions().size(), merged.removed().size());
            return ResponseEntity.ok(merged);
        } catch (Exception ex) {
            log.error("DeltaController: erro ao acumular deltas", ex);
            return ResponseEntity.internalServerError().build();
        }
    }

    @PostMapping("/user")
    @Operation(
            summary = "Restringe um delta aos bookmarks de um usuário",
            description = "Mantém apenas sessões e ids removidos presentes em `bookmarks`."
    )
    public ResponseEntity<Delta> forUser(@RequestBody UserDeltaRequest request) {
        if (request == null || request.delta() == null) {
            log.warn("DeltaController: filtro de usuário exige 'delta'");
            return ResponseEntity.badRequest().build();
        }

        try {
            Delta filtered = userFilter.filter(request.delta(), UserBookmarks.of(request.bookmarks()));
            return ResponseEntity.ok(filtered);
        } catch (Exception ex) {
            log.error("DeltaController: erro ao filtrar delta por usuário", ex);
            return ResponseEntity.internalServerError().build();
        }
    }
}
