package com.luascript.compiler.ast;

/**
 * 源码中的一个位置（行、列、字节偏移）。
 *
 * <p>数值使用 double 保存：IR 文档可能来自外部 JSON，
 * 非有限值需要保留下来交给校验器报告。</p>
 */
public final class SourcePosition {
    private final double line;
    private final double column;
    private final double offset;

    public SourcePosition(double line, double column, double offset) {
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public double getLine() {
        return line;
    }

    public double getColumn() {
        return column;
    }

    public double getOffset() {
        return offset;
    }

    /** 三个分量均为有限且非负的数 */
    public boolean isWellFormed() {
        return isValid(line) && isValid(column) && isValid(offset);
    }

    private static boolean isValid(double v) {
        return !Double.isNaN(v) && !Double.isInfinite(v) && v >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition that = (SourcePosition) o;
        return Double.compare(line, that.line) == 0
                && Double.compare(column, that.column) == 0
                && Double.compare(offset, that.offset) == 0;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(line);
        h = 31 * h + Double.hashCode(column);
        h = 31 * h + Double.hashCode(offset);
        return h;
    }

    @Override
    public String toString() {
        return format(line) + ":" + format(column);
    }

    private static String format(double v) {
        if (v == Math.rint(v) && !Double.isInfinite(v)) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }
}
