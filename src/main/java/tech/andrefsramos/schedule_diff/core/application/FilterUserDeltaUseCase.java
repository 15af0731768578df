package tech.andrefsramos.schedule_diff.core.application;

import tech.andrefsramos.schedule_diff.core.domain.Delta;
import tech.andrefsramos.schedule_diff.core.domain.UserBookmarks;

public interface FilterUserDeltaUseCase {
    Delta filter(Delta delta, UserBookmarks bookmarks);
}
