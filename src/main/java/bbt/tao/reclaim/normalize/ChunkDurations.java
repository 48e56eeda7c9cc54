package bbt.tao.reclaim.normalize;

import bbt.tao.reclaim.exception.InvalidInputException;

public final class ChunkDurations {

    public static final int CHUNK_MINUTES = 15;

    private ChunkDurations() {
    }

    /**
     * Exact conversion; a remainder is rejected rather than rounded.
     *
     * @return chunk count, or {@code null} when {@code minutes} is {@code null}
     */
    public static Integer toChunks(Integer minutes, String field) {
        if (minutes == null) {
            return null;
        }
        if (minutes <= 0) {
            throw new InvalidInputException(field + " must be a positive number of minutes.");
        }
        if (minutes % CHUNK_MINUTES != 0) {
            throw new InvalidInputException(String.format(
                    "%s must be a multiple of %d minutes. Example: 60 minutes = 4 chunks.", field, CHUNK_MINUTES));
        }
        return minutes / CHUNK_MINUTES;
    }

    public static long toMinutes(int chunks) {
        return (long) chunks * CHUNK_MINUTES;
    }

    static Integer requirePositive(Integer chunks, String field) {
        if (chunks != null && chunks <= 0) {
            throw new InvalidInputException(field + " must be a positive integer.");
        }
        return chunks;
    }
}
