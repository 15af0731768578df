package tech.andrefsramos.schedule_diff.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Resolve o placeholder de imagem responsiva "__w-<largura>-<largura>..." de uma URL
 * em um caminho concreto "w<largura>", usando a primeira largura listada.

 * Regras
 *  - Sem placeholder, ou "__w" sem larguras: URL inalterada (não há largura padrão).
 *  - Placeholder malformado (token não numérico, zero, overflow): URL inalterada.
 *  - Apenas o primeiro segmento de caminho que casa exatamente com o placeholder é reescrito;
 *    esquema e host nunca são avaliados.
 */
public final class ThumbnailUrl {

    private static final Logger log = LoggerFactory.getLogger(ThumbnailUrl.class);

    private static final String PLACEHOLDER = "__w";
    private static final Pattern WIDTHS = Pattern.compile("__w((?:-[^-/]*)*)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private ThumbnailUrl() {}

    public static String resolve(String url) {
        if (url == null || !url.contains(PLACEHOLDER)) return url;

        final String[] segments = url.split("/", -1);
        for (int i = firstPathSegment(url, segments); i < segments.length; i++) {
            final Matcher m = WIDTHS.matcher(segments[i]);
            if (!m.matches()) continue;

            final String list = m.group(1);
            if (list.isEmpty()) {
                return url;
            }

            final String first = list.substring(1).split("-", -1)[0];
            final Integer width = parseWidth(first);
            if (width == null || !allNumeric(list)) {
                log.debug("[Thumb] Placeholder malformado em url='{}' — mantida inalterada.", url);
                return url;
            }

            segments[i] = "w" + width;
            return String.join("/", segments);
        }
        return url;
    }

    /* Pula esquema e autoridade ("http:", "", "host") para que só segmentos de caminho sejam avaliados. */
    private static int firstPathSegment(String url, String[] segments) {
        if (url.startsWith("//")) return 3;
        if (segments.length > 2 && segments[0].endsWith(":") && segments[1].isEmpty()) return 3;
        return 0;
    }

    private static boolean allNumeric(String list) {
        for (String token : list.substring(1).split("-", -1)) {
            if (!DIGITS.matcher(token).matches()) return false;
        }
        return true;
    }

    private static Integer parseWidth(String token) {
        if (!DIGITS.matcher(token).matches()) return null;
        try {
            final int w = Integer.parseInt(token);
            return w > 0 ? w : null;
        } catch (NumberFormatException e) {
            log.debug("[Thumb] Largura fora do intervalo: '{}'", token, e);
            return null;
        }
    }
}
