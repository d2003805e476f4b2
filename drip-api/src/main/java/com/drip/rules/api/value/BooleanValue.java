package com.drip.rules.api.value;

public record BooleanValue(Boolean value) implements TypedValue {
    public static final BooleanValue TRUE = new BooleanValue(true);
    public static final BooleanValue FALSE = new BooleanValue(false);

    public static BooleanValue of(boolean b) {
        return b ? TRUE : FALSE;
    }
}
