package bbt.tao.reclaim.normalize;

import bbt.tao.reclaim.dto.reclaim.TaskInputData;
import bbt.tao.reclaim.time.ResolvedInstant;

/**
 * @param payload   fields ready for the Reclaim API
 * @param startTime resolved start time, only set for {@link TaskFlow#CREATE_AT_TIME}
 */
public record NormalizedTask(TaskInputData payload, ResolvedInstant startTime) {
}
