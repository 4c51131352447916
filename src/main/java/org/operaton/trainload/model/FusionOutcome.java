package org.operaton.trainload.model;

import lombok.Value;
import org.operaton.trainload.model.entity.WorkoutRecord;

/**
 * What importing an external observation did to the local store.
 */
@Value
public class FusionOutcome {

    Action action;
    WorkoutRecord record;

    /** Match confidence when the observation was merged into an existing record. */
    Double matchConfidence;

    public enum Action {
        CREATED,
        MERGED
    }

    public static FusionOutcome created(WorkoutRecord record) {
        return new FusionOutcome(Action.CREATED, record, null);
    }

    public static FusionOutcome merged(WorkoutRecord record, double matchConfidence) {
        return new FusionOutcome(Action.MERGED, record, matchConfidence);
    }
}
