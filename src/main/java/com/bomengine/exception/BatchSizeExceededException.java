package com.bomengine.exception;

public class BatchSizeExceededException extends BomEngineException {
    public BatchSizeExceededException(int size, int max) {
        super("BATCH_SIZE_EXCEEDED",
              "Batch size " + size + " exceeds the maximum allowed size of " + max + ".");
    }
}
