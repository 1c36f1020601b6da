package com.luascript.ir.lowering;

import com.luascript.compiler.ast.SourceSpan;
import com.luascript.compiler.compiler.CompileOptions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * ESTree → IR 降级上下文。
 * 跟踪作用域链、当前函数（异步标记与挂起点计数）以及循环/switch 嵌套深度。
 */
public class LoweringContext {

    private final IrBuilder builder;
    private final CompileOptions options;
    private Scope scope;
    private final Deque<FunctionFrame> functions = new ArrayDeque<>();

    public LoweringContext(IrBuilder builder, CompileOptions options) {
        this.builder = builder;
        this.options = options;
    }

    public IrBuilder builder() { return builder; }

    public CompileOptions options() { return options; }

    // ========== 作用域 ==========

    public void enterFunction(boolean async) {
        functions.push(new FunctionFrame(async));
        scope = new Scope(Scope.Kind.FUNCTION, scope);
    }

    /**
     * 离开函数作用域。
     *
     * @return 该函数中被提升的 var 名称
     */
    public List<String> exitFunction() {
        List<String> hoisted = scope.functionScope().getHoisted();
        scope = scope.functionScope().getParent();
        functions.pop();
        return hoisted;
    }

    public void enterBlock() {
        scope = new Scope(Scope.Kind.BLOCK, scope);
    }

    public void exitBlock() {
        scope = scope.getParent();
    }

    /**
     * 在合适的作用域登记一个绑定。
     * var 登记到函数作用域并提升；let/const/function 登记到当前块作用域。
     *
     * @throws UnsupportedConstructException 同一作用域内重复声明 let/const
     */
    public void declare(String name, String declKind, SourceSpan span) {
        if ("var".equals(declKind)) {
            Scope s = scope;
            while (true) {
                String existing = s.lookupLocal(name);
                if (isLexical(existing)) {
                    throw redeclared(name, span);
                }
                if (s.isFunctionScope()) break;
                s = s.getParent();
            }
            if (s.lookupLocal(name) == null) {
                s.put(name, declKind);
            }
            s.hoist(name);
            return;
        }
        if ("param".equals(declKind)) {
            scope.functionScope().put(name, declKind);
            return;
        }
        String existing = scope.lookupLocal(name);
        if (existing != null && (isLexical(declKind) || isLexical(existing))) {
            throw redeclared(name, span);
        }
        scope.put(name, declKind);
    }

    private static boolean isLexical(String declKind) {
        return "let".equals(declKind) || "const".equals(declKind);
    }

    private static UnsupportedConstructException redeclared(String name, SourceSpan span) {
        return new UnsupportedConstructException(
                "Identifier '" + name + "' has already been declared", "Redeclaration", span);
    }

    // ========== 函数帧 ==========

    public boolean isAsync() {
        return !functions.isEmpty() && functions.peek().async;
    }

    /** 分配当前函数的下一个挂起点序号（从 0 开始） */
    public int nextSuspensionIndex() {
        return functions.peek().suspensionCount++;
    }

    public int getSuspensionCount() {
        return functions.peek().suspensionCount;
    }

    public void enterLoop() {
        functions.peek().loopDepth++;
        functions.peek().breakableDepth++;
    }

    public void exitLoop() {
        functions.peek().loopDepth--;
        functions.peek().breakableDepth--;
    }

    public void enterSwitch() {
        functions.peek().breakableDepth++;
    }

    public void exitSwitch() {
        functions.peek().breakableDepth--;
    }

    /**
     * 进入 try 块或 catch 子句。二者在生成代码中是 {@code pcall} 包裹的函数体，
     * 外层循环与 switch 对其中的 break/continue 不可见。
     */
    public void enterTry() {
        FunctionFrame frame = functions.peek();
        frame.savedDepths.push(new int[]{frame.loopDepth, frame.breakableDepth});
        frame.loopDepth = 0;
        frame.breakableDepth = 0;
    }

    public void exitTry() {
        FunctionFrame frame = functions.peek();
        int[] saved = frame.savedDepths.pop();
        frame.loopDepth = saved[0];
        frame.breakableDepth = saved[1];
    }

    /** break 的目标是否被 try 块或 catch 子句隔开 */
    public boolean breakCrossesTry() {
        for (int[] saved : functions.peek().savedDepths) {
            if (saved[1] > 0) return true;
        }
        return false;
    }

    /** continue 的目标循环是否被 try 块或 catch 子句隔开 */
    public boolean continueCrossesTry() {
        for (int[] saved : functions.peek().savedDepths) {
            if (saved[0] > 0) return true;
        }
        return false;
    }

    public boolean canBreak() {
        return functions.peek().breakableDepth > 0;
    }

    public boolean canContinue() {
        return functions.peek().loopDepth > 0;
    }

    private static final class FunctionFrame {
        final boolean async;
        int suspensionCount;
        int loopDepth;
        int breakableDepth;
        final Deque<int[]> savedDepths = new ArrayDeque<>();

        FunctionFrame(boolean async) {
            this.async = async;
        }
    }
}
