package tech.andrefsramos.schedule_diff.adapters.inbound.api.dto;

public record ThumbnailResponse(String url) {}
