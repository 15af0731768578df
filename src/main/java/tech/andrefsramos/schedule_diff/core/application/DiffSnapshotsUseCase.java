package tech.andrefsramos.schedule_diff.core.application;

import tech.andrefsramos.schedule_diff.core.domain.Delta;
import tech.andrefsramos.schedule_diff.core.domain.Snapshot;

import java.time.Instant;

public interface DiffSnapshotsUseCase {
    Delta diff(Snapshot previous, Snapshot current);
    Delta diff(Snapshot previous, Snapshot current, Instant now);
}
