/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter values frozen at the start of an assembly.
 * <p>
 * Each parameter's {@link Parameter#value()} is read exactly once, so a
 * {@link CallbackParam} fires once per assembly and later updates do not leak
 * into an assembly already in progress.
 * </p>
 */
public final class ParameterSnapshot {

    private final Map<Parameter, Matrix> values;

    private ParameterSnapshot(Map<Parameter, Matrix> values) {
        this.values = values;
    }

    /**
     * Reads the current value of every parameter.
     * <p>
     * A parameter standing for a constant subexpression is evaluated from the
     * captured values of the parameters inside it, which are read at most
     * once like any other.
     * </p>
     * @param parameters Parameters to capture
     * @return Snapshot
     * @throws AssemblyException if a parameter has no value
     * @throws ValidationException if a callback produces an invalid value
     */
    public static ParameterSnapshot capture(Collection<? extends Parameter> parameters) {
        Map<Parameter, Matrix> values = new IdentityHashMap<>();
        List<CallbackParam> derived = new ArrayList<>();
        for (Parameter parameter : parameters) {
            if (parameter instanceof CallbackParam && ((CallbackParam) parameter).getSource() != null) {
                derived.add((CallbackParam) parameter);
            } else {
                read(parameter, values);
            }
        }
        for (CallbackParam parameter : derived) {
            if (!values.containsKey(parameter)) {
                Matrix value = parameter.getSource().evaluate(p -> read(p, values));
                values.put(parameter, parameter.validate(value));
            }
        }
        return new ParameterSnapshot(Collections.unmodifiableMap(values));
    }

    private static Matrix read(Parameter parameter, Map<Parameter, Matrix> values) {
        Matrix value = values.get(parameter);
        if (value == null) {
            value = parameter.value();
            if (value == null) {
                throw new AssemblyException("Parameter " + parameter.getName() + " has no value");
            }
            values.put(parameter, value);
        }
        return value;
    }

    public static ParameterSnapshot empty() {
        return new ParameterSnapshot(Collections.emptyMap());
    }

    /**
     * Gets the captured value of a parameter.
     * @param parameter Parameter
     * @return Value
     * @throws AssemblyException if the parameter was not captured
     */
    public Matrix get(Parameter parameter) {
        Matrix value = values.get(parameter);
        if (value == null) {
            throw new AssemblyException("Parameter " + parameter.getName() + " is not in the snapshot");
        }
        return value;
    }

    public boolean contains(Parameter parameter) {
        return values.containsKey(parameter);
    }

    public int size() {
        return values.size();
    }
}
