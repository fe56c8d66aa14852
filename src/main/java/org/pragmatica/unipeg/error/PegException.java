package org.pragmatica.unipeg.error;

/**
 * Unchecked carrier of a {@link PegError}, thrown while derivations are being enumerated.
 */
public final class PegException extends RuntimeException {
    private final PegError error;

    public PegException(PegError error) {
        super(error.message());
        this.error = error;
    }

    public PegException(PegError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public PegError error() {
        return error;
    }
}
