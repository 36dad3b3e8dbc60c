package me.golemcore.substrate.domain.exception;

public class UnknownCheckpointException extends KernelException {

    private static final long serialVersionUID = 1L;

    public UnknownCheckpointException(String reason, Long ledgerSequence) {
        super(ErrorKind.UNKNOWN_CHECKPOINT, reason, ledgerSequence);
    }

    public UnknownCheckpointException(String checkpointId) {
        this("unknown checkpoint: " + checkpointId, null);
    }
}
