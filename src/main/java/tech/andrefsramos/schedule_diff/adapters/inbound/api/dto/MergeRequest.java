package tech.andrefsramos.schedule_diff.adapters.inbound.api.dto;

import tech.andrefsramos.schedule_diff.core.domain.Delta;

public record MergeRequest(Delta older, Delta newer) {}
