package tech.andrefsramos.schedule_diff.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.andrefsramos.schedule_diff.core.application.*;
import tech.andrefsramos.schedule_diff.core.application.impl.*;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/*
 * Finalidade

 * Orquestra a composição dos casos de uso (UseCases), criando beans Spring com dependências
 * explicitadas via construtor. Centraliza parâmetros de execução obtidos via propriedades
 * (application.yml / env).

 * Visão Geral dos Beans

 * - Clock: relógio usado como "agora" na regra de disponibilidade de vídeo (app.diff.zone).
 * - DiffSnapshotsUseCase: compara snapshots anterior/atual e produz o Delta
 *   (app.diff.parallelThreshold define a partir de quantas sessões a comparação é paralela;
 *   app.diff.trackLiveState inclui no delta qualquer mudança de isLive/videoId).
 * - FilterUserDeltaUseCase: restringe um Delta aos bookmarks de um usuário.
 * - ResolveThumbnailUseCase: resolve URLs de miniaturas responsivas.
 */

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /* ============================= Clock ============================= */

    @Bean
    Clock clock(@Value("${app.diff.zone:UTC}") String zone) {
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("[AppConfig] app.diff.zone='{}' inválido. Usando UTC.", zone, e);
            zoneId = ZoneOffset.UTC;
        }
        log.info("[AppConfig] Clock inicializado (zone={})", zoneId);
        return Clock.system(zoneId);
    }

    /* ============================= DiffSnapshotsUseCase ============================= */

    @Bean
    DiffSnapshotsUseCase diffSnapshotsUseCase(
            Clock clock,
            @Value("${app.diff.parallelThreshold:5000}") int parallelThreshold,
            @Value("${app.diff.trackLiveState:false}") boolean trackLiveState
    ) {
        final long t0 = System.nanoTime();
        try {
            Objects.requireNonNull(clock, "clock is required");

            if (parallelThreshold < 1) {
                log.warn("[AppConfig] app.diff.parallelThreshold={} inválido. Ajustando para 1.", parallelThreshold);
                parallelThreshold = 1;
            }

            DiffSnapshotsUseCase bean = new DiffSnapshotsService(clock, parallelThreshold, trackLiveState);
            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] DiffSnapshotsUseCase inicializado (parallelThreshold={}, trackLiveState={}) tookMs={}ms",
                    parallelThreshold, trackLiveState, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar DiffSnapshotsUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= FilterUserDeltaUseCase ============================= */

    @Bean
    FilterUserDeltaUseCase filterUserDeltaUseCase() {
        final long t0 = System.nanoTime();
        FilterUserDeltaUseCase bean = new FilterUserDeltaService();
        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.info("[AppConfig] FilterUserDeltaUseCase inicializado (tookMs={}ms)", tookMs);
        return bean;
    }

    /* ============================= ResolveThumbnailUseCase ============================= */

    @Bean
    ResolveThumbnailUseCase resolveThumbnailUseCase() {
        final long t0 = System.nanoTime();
        ResolveThumbnailUseCase bean = new ResolveThumbnailService();
        long tookMs = (System.nanoTime() - t0) / 1_000_000;
        log.info("[AppConfig] ResolveThumbnailUseCase inicializado (tookMs={}ms)", tookMs);
        return bean;
    }
}
