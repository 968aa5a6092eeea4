package com.codeveil.infrastructure.obfuscation.scanner;

/**
 * Token inside a span sequence. Literal and comment spans yield exactly one token each;
 * code spans are lexed into names, numbers, operators and layout tokens.
 *
 * @param type      token class
 * @param text      exact token text
 * @param spanIndex index of the span holding the token
 * @param offset    offset of the token within that span's text
 */
public record PythonToken(Type type, String text, int spanIndex, int offset) {

    public enum Type {
        NAME,
        NUMBER,
        OP,
        STRING,
        INTERPOLATED,
        COMMENT,
        NEWLINE,
        CONTINUATION,
        WHITESPACE
    }

    public Position start() {
        return new Position(spanIndex, offset);
    }

    public Position end() {
        return new Position(spanIndex, offset + text.length());
    }

    public boolean isSignificant() {
        return type != Type.NEWLINE && type != Type.CONTINUATION
                && type != Type.WHITESPACE && type != Type.COMMENT;
    }

    public boolean isLiteral() {
        return type == Type.STRING || type == Type.INTERPOLATED || type == Type.NUMBER;
    }

    public boolean isStringLike() {
        return type == Type.STRING || type == Type.INTERPOLATED;
    }

    public boolean is(String op) {
        return type == Type.OP && text.equals(op);
    }

    public boolean isName(String name) {
        return type == Type.NAME && text.equals(name);
    }

    public boolean isOpening() {
        return type == Type.OP && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isClosing() {
        return type == Type.OP && (text.equals(")") || text.equals("]") || text.equals("}"));
    }
}
