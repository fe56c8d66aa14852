package org.pragmatica.unipeg.unify;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.unipeg.lazy.LazySequence;
import org.pragmatica.unipeg.result.Instance;

import java.util.LinkedHashMap;
import java.util.function.Function;

/**
 * Pattern that turns a parse result into an application object.
 *
 * <p>Without bindings the factory sees only the incoming value. With bindings it also receives,
 * by name, the current value of every bound variable; unbound variables are left out, so a factory
 * requiring them fails with a {@link org.pragmatica.unipeg.error.PegError.FactoryArgumentError}.
 *
 * <pre>{@code
 * var left = Variable.variable();
 * var right = Variable.variable();
 * var add = digit.unify(left).then(item('+')).then(digit.unify(right))
 *                .unify(Make.record(BinaryAdd.class).bind("left", left).bind("right", right));
 * }</pre>
 */
public final class Make implements Unifiable {
    private final Factory factory;
    private final ImmutableMap<String, Variable> bindings;

    private Make(Factory factory, ImmutableMap<String, Variable> bindings) {
        this.factory = factory;
        this.bindings = bindings;
    }

    /**
     * Apply a conversion to the unpacked incoming value.
     */
    public static Make from(Function<Object, ?> converter) {
        return new Make(arguments -> converter.apply(arguments.value()), ImmutableMap.of());
    }

    public static Make with(Factory factory) {
        return new Make(factory, ImmutableMap.of());
    }

    public static <R extends Record> Make record(Class<R> type) {
        return with(Factory.ofRecord(type));
    }

    /**
     * Pass the value of {@code variable} to the factory as argument {@code name}.
     */
    public Make bind(String name, Variable variable) {
        return new Make(factory,
                        ImmutableMap.<String, Variable>builder()
                                    .putAll(bindings)
                                    .put(name, variable)
                                    .buildOrThrow());
    }

    public ImmutableMap<String, Variable> bindings() {
        return bindings;
    }

    @Override
    public LazySequence<Object> unify(Object value) {
        return LazySequence.defer(() -> LazySequence.of(factory.create(arguments(value))));
    }

    private Arguments arguments(Object value) {
        var unpacked = Instance.unpackValue(value);
        if (bindings.isEmpty()) {
            return Arguments.of(unpacked);
        }
        var named = new LinkedHashMap<String, Object>();
        bindings.forEach((name, variable) -> {
            if (variable.isBound()) {
                named.put(name, variable.unpack());
            }
        });
        return Arguments.of(named, unpacked);
    }

    @Override
    public String toString() {
        return "Make" + bindings.keySet();
    }
}
