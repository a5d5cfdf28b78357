package com.example.templatefiller;

/** A placeholder found in a container: its name (without braces) and where it sits. */
public final class TokenMatch {
    public final String name;
    public final TokenSpan span;

    public TokenMatch(String name, TokenSpan span) {
        this.name = name; this.span = span;
    }

    @Override
    public String toString() { return "{{" + name + "}}" + span; }
}
