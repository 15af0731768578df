package tech.andrefsramos.schedule_diff.core.application;

public interface ResolveThumbnailUseCase {
    String resolve(String url);
}
