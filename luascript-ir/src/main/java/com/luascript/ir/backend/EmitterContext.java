package com.luascript.ir.backend;

import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Lua 生成上下文，跟踪输出缓冲区、缩进层级、用到的辅助函数，
 * 以及函数边界内的循环/switch 嵌套（决定 break/continue 的去向）。
 */
public class EmitterContext {

    private final IrDocument document;
    private final EmitConfig config;
    private final List<String> lines = new ArrayList<>();
    private final Set<LuaHelper> helpers;
    private final Deque<Frame> frames;
    private int indentLevel = 0;

    public EmitterContext(IrDocument document, EmitConfig config) {
        this.document = document;
        this.config = config;
        this.helpers = EnumSet.noneOf(LuaHelper.class);
        this.frames = new ArrayDeque<>();
        this.frames.push(new Frame(false));
    }

    private EmitterContext(EmitterContext parent) {
        this.document = parent.document;
        this.config = parent.config;
        this.helpers = parent.helpers;
        this.frames = parent.frames;
        this.indentLevel = parent.indentLevel;
    }

    /**
     * 共享状态、独立输出的子上下文（用于函数表达式体和内联到表达式中的语句序列），
     * 缩进层级从父上下文继承。
     */
    EmitterContext fork() {
        return new EmitterContext(this);
    }

    public EmitConfig getConfig() {
        return config;
    }

    // ========== 输出 ==========

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /** 当前缩进对应的前导空白 */
    String indentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(config.getIndentString());
        }
        return sb.toString();
    }

    /**
     * 追加一行（自动加缩进）。以 '(' 开头的语句前置 ';'，避免被解析为上一行的调用。
     */
    public void line(String text) {
        StringBuilder sb = new StringBuilder(indentString());
        if (text.startsWith("(")) {
            sb.append(';');
        }
        sb.append(text);
        lines.add(sb.toString());
    }

    public List<String> getLines() {
        return lines;
    }

    /** 把全部行压成一行，语句间用 "; " 分隔 */
    String inline() {
        StringBuilder sb = new StringBuilder();
        for (String l : lines) {
            if (sb.length() > 0) sb.append("; ");
            sb.append(l.trim());
        }
        return sb.toString();
    }

    public String getOutput() {
        StringBuilder sb = new StringBuilder();
        for (String l : lines) {
            sb.append(l).append('\n');
        }
        return sb.toString();
    }

    // ========== 辅助函数 ==========

    void useHelper(LuaHelper helper) {
        helpers.add(helper);
    }

    Set<LuaHelper> getHelpers() {
        return helpers;
    }

    // ========== 函数与循环 ==========

    /**
     * 进入一个 Lua 函数体。
     *
     * @param tryBody 是否为 try 语句引入的 pcall 函数体（其中的 return 需要装箱）
     */
    void enterFunction(boolean tryBody) {
        frames.push(new Frame(tryBody));
    }

    void exitFunction() {
        frames.pop();
    }

    boolean inTryBody() {
        return frames.peek().tryBody;
    }

    void enterLoop(String continueLabel) {
        frames.peek().loops.push(new Loop(continueLabel));
    }

    void enterSwitch() {
        frames.peek().loops.push(new Loop(null));
    }

    void exitLoop() {
        frames.peek().loops.pop();
    }

    /** 当前函数体内是否有可 break 的结构 */
    boolean canBreak() {
        return !frames.peek().loops.isEmpty();
    }

    /**
     * 最近一层循环的 continue 标签（跳过 switch）；当前函数体内没有循环时返回 null。
     */
    String continueLabel() {
        Iterator<Loop> it = frames.peek().loops.iterator();
        while (it.hasNext()) {
            Loop loop = it.next();
            if (loop.continueLabel != null) {
                return loop.continueLabel;
            }
        }
        return null;
    }

    IrNode node(String id) {
        return document.getNode(id);
    }

    private static final class Frame {
        final boolean tryBody;
        final Deque<Loop> loops = new ArrayDeque<>();

        Frame(boolean tryBody) {
            this.tryBody = tryBody;
        }
    }

    private static final class Loop {
        /** switch 为 null */
        final String continueLabel;

        Loop(String continueLabel) {
            this.continueLabel = continueLabel;
        }
    }
}
