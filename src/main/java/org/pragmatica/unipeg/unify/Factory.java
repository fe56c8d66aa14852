package org.pragmatica.unipeg.unify;

/**
 * Builds an application object from named arguments, see {@link Make}.
 */
@FunctionalInterface
public interface Factory {

    Object create(Arguments arguments);

    /**
     * Factory invoking the canonical constructor of a record, matching argument names to
     * record component names. Missing or unknown names are reported as
     * {@link org.pragmatica.unipeg.error.PegError.FactoryArgumentError}.
     */
    static <R extends Record> Factory ofRecord(Class<R> type) {
        return RecordFactory.create(type);
    }
}
