package bbt.tao.reclaim.dto;

import bbt.tao.reclaim.dto.reclaim.ReclaimTask;

public record TaskDetailsView(ReclaimTask task) {
}
