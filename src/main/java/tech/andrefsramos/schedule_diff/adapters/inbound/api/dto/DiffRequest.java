package tech.andrefsramos.schedule_diff.adapters.inbound.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.andrefsramos.schedule_diff.core.domain.SessionRecord;

import java.time.Instant;
import java.util.Map;

@Schema(description = "Snapshots anterior e atual do catálogo (id da sessão -> sessão).")
public record DiffRequest(
        Map<String, SessionRecord> previous,
        Map<String, SessionRecord> current,
        @Schema(description = "Instante de comparação; quando omitido, usa o relógio do servidor.")
        Instant now
) {}
