package com.luascript.ir.pass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果：全部错误按发现顺序排列。
 */
public final class ValidationResult {

    private final List<String> errors;

    public ValidationResult(List<String> errors) {
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public boolean isOk() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult)) return false;
        return errors.equals(((ValidationResult) o).errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    @Override
    public String toString() {
        return isOk() ? "ValidationResult{ok}" : "ValidationResult" + errors;
    }
}
