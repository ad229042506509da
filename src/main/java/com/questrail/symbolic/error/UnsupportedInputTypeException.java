package com.questrail.symbolic.error;

/**
 * A value of a runtime type the normalizer or the encoder cannot translate.
 */
public final class UnsupportedInputTypeException extends BridgeException
{
    private final Class<?> inputType;

    public UnsupportedInputTypeException(String context, Class<?> inputType) {
        super(context + " cannot accept an object of class " + inputType.getName());
        this.inputType = inputType;
    }

    public Class<?> inputType() {
        return inputType;
    }
}
