package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.error.PegError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Arguments passed to a {@link Factory}: the incoming value plus the named values read from
 * bound variables. Names whose variable was unbound are absent.
 */
public final class Arguments {
    private final Map<String, Object> named;
    private final Object value;

    private Arguments(Map<String, Object> named, Object value) {
        this.named = named;
        this.value = value;
    }

    public static Arguments of(Map<String, Object> named, Object value) {
        return new Arguments(Collections.unmodifiableMap(new LinkedHashMap<>(named)), value);
    }

    public static Arguments of(Object value) {
        return new Arguments(Map.of(), value);
    }

    /**
     * The incoming value, unpacked.
     */
    public Object value() {
        return value;
    }

    public boolean has(String name) {
        return named.containsKey(name);
    }

    /**
     * Named argument value.
     *
     * @throws org.pragmatica.unipeg.error.PegException with {@link PegError.FactoryArgumentError}
     *         if the argument is absent
     */
    public Object get(String name) {
        if (!has(name)) {
            throw new PegError.FactoryArgumentError(name, "missing argument").asException();
        }
        return named.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        var argument = get(name);
        if (argument != null && !type.isInstance(argument)) {
            throw new PegError.FactoryArgumentError(name,
                                                    "expected " + type.getSimpleName() + " but got "
                                                    + argument.getClass().getSimpleName()).asException();
        }
        return type.cast(argument);
    }

    public Set<String> names() {
        return named.keySet();
    }

    public int size() {
        return named.size();
    }

    public boolean isEmpty() {
        return named.isEmpty();
    }

    public Map<String, Object> asMap() {
        return named;
    }

    @Override
    public String toString() {
        return "Arguments" + named;
    }
}
