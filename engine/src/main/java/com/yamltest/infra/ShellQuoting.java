package com.yamltest.infra;

/**
 * POSIX single-quote escaping for text that ends up inside {@code sh -c}.
 */
public final class ShellQuoting {

    private ShellQuoting() {
    }

    /** {@code it's} becomes {@code 'it'\''s'}. */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }
}
