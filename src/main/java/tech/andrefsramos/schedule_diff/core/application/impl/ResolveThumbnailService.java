package tech.andrefsramos.schedule_diff.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.schedule_diff.core.application.ResolveThumbnailUseCase;
import tech.andrefsramos.schedule_diff.core.domain.ThumbnailUrl;

public class ResolveThumbnailService implements ResolveThumbnailUseCase {

    private static final Logger log = LoggerFactory.getLogger(ResolveThumbnailService.class);

    @Override
    public String resolve(String url) {
        final String out = ThumbnailUrl.resolve(url);
        if (log.isDebugEnabled()) {
            log.debug("[Thumb] url='{}' -> '{}' (alterada={})", url, out, !String.valueOf(url).equals(out));
        }
        return out;
    }
}
