package org.sentential.parsing;

import org.sentential.errors.ParserError;

public enum  ParserErrors {
    MissingLeftParen(1, "Missing left parenthesis"),
    MissingRightParen(2, "Missing right parenthesis"),
    MalFormedExpression(3, "Malformed expression"),
    UnknownToken(4, "Unknown token '%s'");

    public final int value;
    private final String message;

    ParserErrors(int value, String message){
        this.value = value;
        this.message = message;
    }

    public ParserError toError(Object... args){
        return new ParserError(String.format(message, args));
    }
}
