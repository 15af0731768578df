package tech.andrefsramos.schedule_diff.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.schedule_diff.adapters.inbound.api.dto.ThumbnailResponse;
import tech.andrefsramos.schedule_diff.core.application.ResolveThumbnailUseCase;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "02 - Miniaturas")
public class ThumbnailController {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailController.class);

    private final ResolveThumbnailUseCase thumbnails;

    @GetMapping("/thumbnail")
    @Operation(
            summary = "Resolve a URL de uma miniatura responsiva",
            description = """
        Substitui o segmento `__w-<largura>-<largura>...` pela primeira largura listada (`w<largura>`).
        URLs sem placeholder, com `__w` sem larguras ou com larguras malformadas são devolvidas inalteradas.
        """
    )
    public ResponseEntity<ThumbnailResponse> resolve(
            @Parameter(description = "URL com (ou sem) placeholder de largura.",
                    example = "http://example.org/images/__w-400-600/img.jpg")
            @RequestParam(required = false) String url
    ) {
        if (url == null || url.isBlank()) {
            log.warn("ThumbnailController: parâmetro 'url' ausente ou vazio");
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(new ThumbnailResponse(thumbnails.resolve(url)));
    }
}
