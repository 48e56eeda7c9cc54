package bbt.tao.reclaim.exception;

public class ChunkSizeConflictException extends TaskInputException {

    public ChunkSizeConflictException(int minChunkSize, int maxChunkSize) {
        super("minChunkSize (" + minChunkSize + ") cannot be greater than maxChunkSize (" + maxChunkSize + ").");
    }
}
