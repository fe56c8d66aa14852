package org.pragmatica.unipeg.error;

/**
 * Errors in a grammar or pattern definition. These are not parse failures (which are simply the
 * absence of derivations); they surface at the point of use as a {@link PegException}.
 */
public sealed interface PegError {

    String message();

    default PegException asException() {
        return new PegException(this);
    }

    /**
     * A grammar symbol was referenced but never defined.
     */
    record UndefinedSymbol(String symbol) implements PegError {
        @Override
        public String message() {
            return "Undefined symbol: '" + symbol + "'";
        }
    }

    /**
     * A factory was invoked with a missing, unknown or ill-typed named argument.
     */
    record FactoryArgumentError(String argument, String reason) implements PegError {
        @Override
        public String message() {
            return "Factory argument '" + argument + "': " + reason;
        }
    }
}
