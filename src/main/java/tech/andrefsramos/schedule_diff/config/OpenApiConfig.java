package tech.andrefsramos.schedule_diff.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Schedule Diff - API de mudanças do catálogo de sessões",
                version = "v1",
                description = """
                                ---

                                ## 🎯 Visão Geral

                                A API **Schedule Diff** calcula o conjunto de mudanças (*delta*) entre dois snapshots
                                do catálogo de sessões de um evento, para que notificadores e telas reajam apenas ao
                                que realmente mudou.

                                ---

                                ## ⚙️ Como funciona

                                - Cada sessão do snapshot atual é comparada com a do snapshot anterior, campo a campo.
                                - `tags` e `speakers` são comparados como conjuntos (ausente = vazio).
                                - `filters` é comparado chave a chave (chave ausente é diferente de `false`).
                                - Sessões encerradas cujo vídeo acabou de ficar disponível recebem `update = "video"`.
                                - Sessões que sumiram do snapshot atual aparecem em `removed`.

                                ---

                                ## 🗂️ Endpoints

                                 - `POST /api/v1/delta` — calcula o delta entre dois snapshots
                                 - `POST /api/v1/delta/merge` — acumula dois deltas consecutivos
                                 - `POST /api/v1/delta/user` — restringe um delta aos bookmarks de um usuário
                                 - `GET /api/v1/thumbnail` — resolve a URL de uma miniatura responsiva

                                ### 📌 Tratamento de erros resumido
                                | **Código** | **Significado** |
                                |--------|-------------|
                                | **200** |	Sucesso |
                                | **400** | Parâmetros ou corpo inválidos |
                                | **500** | Erro interno |

                                ---
                                """
        )
)
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI(@Value("${app.api.baseUrl:}") String apiBaseUrl) {
        OpenAPI api = new OpenAPI();
        if (apiBaseUrl != null && !apiBaseUrl.isBlank()) {
            api.addServersItem(new Server().url(apiBaseUrl));
        }
        return api;
    }
}
