package io.quadc.core.engine;

import io.quadc.core.error.FormCompileException;
import java.util.Objects;

/**
 * Outcome of compiling one form. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Type#SUCCESS}: {@code code} holds the generated form code.
 *   <li>{@link Type#REJECTED}: {@code error} holds the failure; the form produced no code.
 * </ul>
 */
public final class CompilationResult {

    /** The type of compilation outcome. */
    public enum Type {
        SUCCESS,
        REJECTED
    }

    private final Type type;
    private final String formName;
    private final FormCode code;
    private final FormCompileException error;

    private CompilationResult(Type type, String formName, FormCode code, FormCompileException error) {
        this.type = type;
        this.formName = formName;
        this.code = code;
        this.error = error;
    }

    public static CompilationResult success(FormCode code) {
        Objects.requireNonNull(code, "code must not be null for SUCCESS");
        return new CompilationResult(Type.SUCCESS, code.formName(), code, null);
    }

    public static CompilationResult rejected(String formName, FormCompileException error) {
        Objects.requireNonNull(error, "error must not be null for REJECTED");
        return new CompilationResult(Type.REJECTED, formName, null, error);
    }

    public Type type() {
        return type;
    }

    public String formName() {
        return formName;
    }

    /** Returns the generated code. Only valid when {@code type() == SUCCESS}. */
    public FormCode code() {
        return code;
    }

    /** Returns the failure. Only valid when {@code type() == REJECTED}. */
    public FormCompileException error() {
        return error;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isRejected() {
        return type == Type.REJECTED;
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "CompilationResult[SUCCESS, form=" + formName + ", entries=" + code.entryCount() + "]";
            case REJECTED -> "CompilationResult[REJECTED, form=" + formName + ", error="
                    + error.getClass().getSimpleName() + "]";
        };
    }
}
