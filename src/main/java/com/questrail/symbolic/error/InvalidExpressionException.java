package com.questrail.symbolic.error;

/**
 * Engine syntax that did not parse to exactly one expression.
 */
public final class InvalidExpressionException extends BridgeException
{
    private final String text;

    public InvalidExpressionException(String text, String reason) {
        super("Invalid expression: " + text + " (" + reason + ")");
        this.text = text;
    }

    public String text() {
        return text;
    }
}
