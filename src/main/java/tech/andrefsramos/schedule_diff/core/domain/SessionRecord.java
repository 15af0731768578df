package tech.andrefsramos.schedule_diff.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/*
 * Uma sessão do catálogo. Listas/mapas nulos significam "ausente" e são preservados como nulos;
 * quando presentes, são copiados para valores imutáveis (elementos nulos das listas são descartados).
 */
public record SessionRecord(
        @JsonProperty("title") String title,
        @JsonProperty("startTimestamp") Instant startTime,
        @JsonProperty("endTimestamp") Instant endTime,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("filters") Map<String, Boolean> filters,
        @JsonProperty("speakers") List<String> speakers,
        @JsonProperty("isLivestream") boolean isLive,
        @JsonProperty("youtubeUrl") String videoId,
        @JsonProperty("update") UpdateKind updateKind
) {
    public SessionRecord {
        title = title == null ? "" : title;
        videoId = videoId == null ? "" : videoId;
        updateKind = updateKind == null ? UpdateKind.NONE : updateKind;
        tags = tags == null ? null : List.copyOf(StringSets.subtract(tags, (String) null));
        speakers = speakers == null ? null : List.copyOf(StringSets.subtract(speakers, (String) null));
        filters = filters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public boolean hasVideo() {
        return !videoId.isEmpty();
    }

    public SessionRecord withUpdateKind(UpdateKind kind) {
        return new SessionRecord(title, startTime, endTime, tags, filters, speakers, isLive, videoId, kind);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private Instant startTime;
        private Instant endTime;
        private List<String> tags;
        private Map<String, Boolean> filters;
        private List<String> speakers;
        private boolean isLive;
        private String videoId;
        private UpdateKind updateKind;

        private Builder() {}

        public Builder title(String title) { this.title = title; return this; }
        public Builder startTime(Instant startTime) { this.startTime = startTime; return this; }
        public Builder endTime(Instant endTime) { this.endTime = endTime; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder filters(Map<String, Boolean> filters) { this.filters = filters; return this; }
        public Builder speakers(List<String> speakers) { this.speakers = speakers; return this; }
        public Builder live(boolean isLive) { this.isLive = isLive; return this; }
        public Builder videoId(String videoId) { this.videoId = videoId; return this; }
        public Builder updateKind(UpdateKind updateKind) { this.updateKind = updateKind; return this; }

        public SessionRecord build() {
            return new SessionRecord(title, startTime, endTime, tags, filters, speakers, isLive, videoId, updateKind);
        }
    }
}
