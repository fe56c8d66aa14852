package org.pragmatica.unipeg.unify;

import org.pragmatica.unipeg.error.PegError;
import org.pragmatica.unipeg.error.PegException;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;

final class RecordFactory<R extends Record> implements Factory {
    private final Class<R> type;
    private final RecordComponent[] components;
    private final Constructor<R> constructor;

    private RecordFactory(Class<R> type, RecordComponent[] components, Constructor<R> constructor) {
        this.type = type;
        this.components = components;
        this.constructor = constructor;
    }

    static <R extends Record> RecordFactory<R> create(Class<R> type) {
        var components = type.getRecordComponents();
        var parameterTypes = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            parameterTypes[i] = components[i].getType();
        }
        try {
            var constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return new RecordFactory<>(type, components, constructor);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("No canonical constructor in " + type.getName(), e);
        }
    }

    @Override
    public Object create(Arguments arguments) {
        for (var name : arguments.names()) {
            if (!hasComponent(name)) {
                throw new PegError.FactoryArgumentError(name, "unknown argument for " + type.getSimpleName())
                    .asException();
            }
        }
        var values = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            var component = components[i];
            var value = arguments.get(component.getName());
            if (value == null && component.getType().isPrimitive()) {
                throw new PegError.FactoryArgumentError(component.getName(),
                                                        "null for primitive " + component.getType())
                    .asException();
            }
            values[i] = value;
        }
        try {
            return constructor.newInstance(values);
        } catch (IllegalArgumentException e) {
            throw new PegException(new PegError.FactoryArgumentError(type.getSimpleName(), "argument type mismatch"), e);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Constructor of " + type.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Unable to instantiate " + type.getName(), e);
        }
    }

    private boolean hasComponent(String name) {
        for (var component : components) {
            if (component.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }
}
