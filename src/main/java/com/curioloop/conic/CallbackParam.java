/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.conic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Parameter whose value is produced by a callback on every read.
 * <p>
 * The value is never cached: each {@link #value()} call invokes the callback
 * and validates the result against the declared shape and sign, since the
 * callback's source may change between calls. During assembly the callback is
 * invoked once, when the parameter snapshot is taken.
 * </p>
 */
public final class CallbackParam extends Parameter {

    private final Supplier<Matrix> callback;
    private final Expression source;

    CallbackParam(int id, ModelContext context, Supplier<Matrix> callback, Shape shape, String name,
                  Sign declaredSign) {
        this(id, context, callback, null, shape, name, declaredSign);
    }

    /**
     * Creates a parameter whose value is that of a constant subexpression.
     */
    CallbackParam(int id, ModelContext context, Expression source) {
        this(id, context, source::value, source, source.getShape(), null, Sign.UNKNOWN);
    }

    private CallbackParam(int id, ModelContext context, Supplier<Matrix> callback, Expression source,
                          Shape shape, String name, Sign declaredSign) {
        super(id, context, shape, name, declaredSign);
        if (callback == null) {
            throw new ValidationException("Callback must not be null");
        }
        this.callback = callback;
        this.source = source;
    }

    public Supplier<Matrix> getCallback() {
        return callback;
    }

    /**
     * Gets the constant subexpression this parameter stands for.
     * @return Source expression, or null for a user callback
     */
    Expression getSource() {
        return source;
    }

    /**
     * Invokes the callback and validates its result.
     * @return Fresh value
     * @throws ValidationException if the callback result does not conform
     */
    @Override
    public Matrix value() {
        return validate(callback.get());
    }

    @Override
    public boolean hasValue() {
        return true;
    }

    /**
     * Not supported; the value always comes from the callback.
     * @throws UnsupportedOperationException always
     */
    @Override
    public void setValue(Matrix newValue) {
        throw new UnsupportedOperationException("Value of " + getName() + " is computed by its callback");
    }

    @Override
    public Map<String, Object> getData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("callback", callback);
        data.put("rows", getShape().getRows());
        data.put("cols", getShape().getCols());
        data.put("name", getName());
        data.put("sign", getDeclaredSign());
        return Collections.unmodifiableMap(data);
    }
}
