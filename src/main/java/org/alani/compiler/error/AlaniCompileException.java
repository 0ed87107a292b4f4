package org.alani.compiler.error;

/**
 * Thrown when Alani source cannot be compiled; the cause is described by {@link #error()}.
 */
public class AlaniCompileException extends Exception {
    private final CompilerError error;

    public AlaniCompileException(CompilerError error) {
        super(error.message());
        this.error = error;
    }

    public AlaniCompileException(CompilerError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public CompilerError error() {
        return error;
    }
}
