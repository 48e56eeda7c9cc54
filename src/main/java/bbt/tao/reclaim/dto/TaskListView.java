package bbt.tao.reclaim.dto;

import bbt.tao.reclaim.dto.reclaim.ReclaimTask;

import java.util.List;

public record TaskListView(List<ReclaimTask> tasks, boolean activeOnly) {
}
