package com.luascript.ir.backend;

import com.google.gson.JsonElement;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 解构模式展开。
 *
 * <p>每一层模式把来源存入一个以模式节点 ID 命名的临时变量，再逐个读取：
 * 数组按 1 起始下标（空位跳过），对象按字段名。默认值只在读到 nil 时生效。</p>
 */
final class PatternEmitter {

    private final LuaEmitter emitter;

    PatternEmitter(LuaEmitter emitter) {
        this.emitter = emitter;
    }

    /**
     * @param source 来源表达式（已生成的 Lua 代码）
     * @param local  叶子变量是否以 {@code local} 声明
     */
    void emit(IrNode target, String source, boolean local, EmitterContext ctx) {
        switch (target.getKind()) {
            case IDENTIFIER:
                ctx.line(prefix(local) + emitter.identifierName(target) + " = " + source);
                break;
            case MEMBER_EXPRESSION:
                ctx.line(emitter.lvalue(target, ctx) + " = " + source);
                break;
            case ASSIGNMENT_PATTERN:
                emitDefault(target, source, local, ctx);
                break;
            case ARRAY_PATTERN:
                emitArray(target, source, local, ctx);
                break;
            case OBJECT_PATTERN:
                emitObject(target, source, local, ctx);
                break;
            default:
                throw new EmissionException("Cannot destructure into " + target.getTag(),
                        target.getId(), target.getSpan());
        }
    }

    private void emitDefault(IrNode pattern, String source, boolean local, EmitterContext ctx) {
        IrNode target = emitter.requireRef(pattern, "target", ctx);
        String dflt = emitter.expression(emitter.requireRef(pattern, "defaultValue", ctx), ctx).code;
        if (target.is(IrKind.IDENTIFIER)) {
            String name = emitter.identifierName(target);
            ctx.line(prefix(local) + name + " = " + source);
            ctx.line("if " + name + " == nil then " + name + " = " + dflt + " end");
            return;
        }
        String temp = LuaNames.temp(pattern.getId());
        ctx.line("local " + temp + " = " + source);
        ctx.line("if " + temp + " == nil then " + temp + " = " + dflt + " end");
        emit(target, temp, local, ctx);
    }

    private void emitArray(IrNode pattern, String source, boolean local, EmitterContext ctx) {
        String temp = LuaNames.temp(pattern.getId());
        ctx.line("local " + temp + " = " + source);
        List<String> elements = pattern.getRefs("elements");
        for (int i = 0; i < elements.size(); i++) {
            String id = elements.get(i);
            if (id == null) continue;
            IrNode element = emitter.require(id, ctx);
            if (element.is(IrKind.REST_ELEMENT)) {
                emitArrayRest(element, temp, i + 1, local, ctx);
            } else {
                emit(element, temp + "[" + (i + 1) + "]", local, ctx);
            }
        }
    }

    private void emitArrayRest(IrNode rest, String table, int from, boolean local, EmitterContext ctx) {
        IrNode argument = emitter.requireRef(rest, "argument", ctx);
        String collected = restVariable(rest, argument, local, ctx);
        ctx.line("for __i = " + from + ", #" + table + " do "
                + collected + "[#" + collected + " + 1] = " + table + "[__i] end");
        if (!argument.is(IrKind.IDENTIFIER)) {
            emit(argument, collected, local, ctx);
        }
    }

    private void emitObject(IrNode pattern, String source, boolean local, EmitterContext ctx) {
        String temp = LuaNames.temp(pattern.getId());
        ctx.line("local " + temp + " = " + source);
        // 已取出的键，供对象 rest 排除
        List<String> taken = new ArrayList<>();
        for (String id : pattern.getRefs("properties")) {
            IrNode prop = emitter.require(id, ctx);
            if (prop.is(IrKind.REST_ELEMENT)) {
                emitObjectRest(prop, temp, taken, local, ctx);
                continue;
            }
            IrNode key = emitter.requireRef(prop, "key", ctx);
            IrNode value = emitter.requireRef(prop, "value", ctx);
            String access;
            if (prop.getBoolean("computed")) {
                String keyTemp = LuaNames.temp(key.getId());
                ctx.line("local " + keyTemp + " = " + emitter.expression(key, ctx).code);
                access = temp + "[" + keyTemp + "]";
                taken.add(keyTemp);
            } else if (isNumberLiteral(key)) {
                String index = LuaEmitter.formatNumber(key.getValue().getAsDouble());
                access = temp + "[" + index + "]";
                taken.add(index);
            } else {
                String name = key.is(IrKind.IDENTIFIER) ? key.getString("name") : key.getValue().getAsString();
                access = LuaNames.field(temp, name);
                taken.add(LuaNames.quote(name));
            }
            emit(value, access, local, ctx);
        }
    }

    private void emitObjectRest(IrNode rest, String table, List<String> taken, boolean local, EmitterContext ctx) {
        IrNode argument = emitter.requireRef(rest, "argument", ctx);
        String collected = restVariable(rest, argument, local, ctx);
        if (taken.isEmpty()) {
            ctx.line("for __k, __v in pairs(" + table + ") do " + collected + "[__k] = __v end");
        } else {
            List<String> checks = new ArrayList<>();
            for (String k : taken) {
                checks.add("__k ~= " + k);
            }
            ctx.line("for __k, __v in pairs(" + table + ") do if " + String.join(" and ", checks)
                    + " then " + collected + "[__k] = __v end end");
        }
        if (!argument.is(IrKind.IDENTIFIER)) {
            emit(argument, collected, local, ctx);
        }
    }

    /** rest 收集表：标识符直接使用，成员目标先收集到临时表 */
    private String restVariable(IrNode rest, IrNode argument, boolean local, EmitterContext ctx) {
        if (argument.is(IrKind.IDENTIFIER)) {
            String name = emitter.identifierName(argument);
            ctx.line(prefix(local) + name + " = {}");
            return name;
        }
        String temp = LuaNames.temp(rest.getId());
        ctx.line("local " + temp + " = {}");
        return temp;
    }

    private static boolean isNumberLiteral(IrNode key) {
        if (!key.is(IrKind.LITERAL)) return false;
        JsonElement v = key.getValue();
        return v != null && v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber();
    }

    private static String prefix(boolean local) {
        return local ? "local " : "";
    }
}
