package com.luascript.ir.pass;

import com.luascript.compiler.CompileException;

import java.util.List;

/**
 * 管线校验失败，携带完整的错误列表。
 */
public class ValidationException extends CompileException {
    private final ValidationResult result;

    public ValidationException(ValidationResult result) {
        super(summary(result.getErrors()), null);
        this.result = result;
    }

    public ValidationResult getResult() {
        return result;
    }

    public List<String> getErrors() {
        return result.getErrors();
    }

    private static String summary(List<String> errors) {
        StringBuilder sb = new StringBuilder("IR validation failed with ")
                .append(errors.size()).append(errors.size() == 1 ? " error" : " errors");
        for (String e : errors) {
            sb.append("\n  - ").append(e);
        }
        return sb.toString();
    }
}
