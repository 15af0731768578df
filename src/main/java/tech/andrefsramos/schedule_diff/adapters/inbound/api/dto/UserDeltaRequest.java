package tech.andrefsramos.schedule_diff.adapters.inbound.api.dto;

import tech.andrefsramos.schedule_diff.core.domain.Delta;

import java.util.List;

public record UserDeltaRequest(Delta delta, List<String> bookmarks) {}
