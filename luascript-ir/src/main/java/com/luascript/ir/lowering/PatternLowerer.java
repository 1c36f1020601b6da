package com.luascript.ir.lowering;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;

import java.util.ArrayList;
import java.util.List;

import static com.luascript.ir.lowering.IrLowerer.bool;
import static com.luascript.ir.lowering.IrLowerer.child;
import static com.luascript.ir.lowering.IrLowerer.list;
import static com.luascript.ir.lowering.IrLowerer.span;
import static com.luascript.ir.lowering.IrLowerer.str;
import static com.luascript.ir.lowering.IrLowerer.type;
import static com.luascript.ir.lowering.IrLowerer.unsupported;

/**
 * 解构模式降级。
 *
 * <p>模式保持结构化：数组空位为 null 槽位，rest 为尾部的 RestElement，
 * 默认值以 AssignmentPattern 包装且不求值。绑定模式下每个叶子名称
 * 在所属作用域中登记一次；赋值模式（如 {@code [a, b] = [b, a]}）不登记绑定。</p>
 */
final class PatternLowerer {

    private final IrLowerer lowerer;

    PatternLowerer(IrLowerer lowerer) {
        this.lowerer = lowerer;
    }

    /**
     * 声明位置的模式。
     *
     * @param declKind var/let/const
     * @param names    按出现顺序收集绑定的叶子名称
     */
    String lowerBinding(JsonObject node, String declKind, List<String> names, LoweringContext ctx) {
        return lowerPattern(node, declKind, names, ctx);
    }

    /**
     * 赋值目标：标识符、成员表达式或解构模式。
     */
    String lowerAssignmentTarget(JsonObject node, LoweringContext ctx) {
        String t = type(node);
        switch (t) {
            case "Identifier":
            case "MemberExpression":
            case "ArrayPattern":
            case "ObjectPattern":
                return lowerPattern(node, null, new ArrayList<String>(), ctx);
            default:
                throw unsupported(node, "Invalid assignment target '" + t + "'");
        }
    }

    private String lowerPattern(JsonObject node, String declKind, List<String> names, LoweringContext ctx) {
        String t = type(node);
        switch (t) {
            case "Identifier": {
                String name = str(node, "name");
                if (declKind != null) {
                    ctx.declare(name, declKind, span(node));
                    names.add(name);
                }
                return ctx.builder().identifier(name, span(node)).getId();
            }
            case "MemberExpression":
                if (declKind != null) {
                    throw unsupported(node, "Member expression is not a valid binding target");
                }
                return lowerer.lowerMember(node, ctx);
            case "ArrayPattern":
                return lowerArrayPattern(node, declKind, names, ctx);
            case "ObjectPattern":
                return lowerObjectPattern(node, declKind, names, ctx);
            case "AssignmentPattern": {
                IrNode pattern = lowerer.create(IrKind.ASSIGNMENT_PATTERN, node, ctx);
                pattern.setRef("target", lowerPattern(child(node, "left"), declKind, names, ctx));
                pattern.setRef("defaultValue", lowerer.lowerExpression(child(node, "right"), ctx));
                return pattern.getId();
            }
            default:
                throw unsupported(node, "Unsupported pattern '" + t + "'");
        }
    }

    private String lowerArrayPattern(JsonObject node, String declKind, List<String> names, LoweringContext ctx) {
        IrNode pattern = lowerer.create(IrKind.ARRAY_PATTERN, node, ctx);
        JsonArray elements = list(node, "elements");
        List<String> slots = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            JsonElement e = elements.get(i);
            if (e == null || e.isJsonNull()) {
                // 空位：保留槽位，不产生绑定
                slots.add(null);
                continue;
            }
            JsonObject el = e.getAsJsonObject();
            if ("RestElement".equals(type(el))) {
                if (i != elements.size() - 1) {
                    throw unsupported(el, "Rest element must be last element");
                }
                slots.add(lowerRest(el, declKind, names, ctx));
            } else {
                slots.add(lowerPattern(el, declKind, names, ctx));
            }
        }
        pattern.setRefs("elements", slots);
        return pattern.getId();
    }

    private String lowerObjectPattern(JsonObject node, String declKind, List<String> names, LoweringContext ctx) {
        IrNode pattern = lowerer.create(IrKind.OBJECT_PATTERN, node, ctx);
        JsonArray properties = list(node, "properties");
        List<String> out = new ArrayList<>();
        for (int i = 0; i < properties.size(); i++) {
            JsonObject p = properties.get(i).getAsJsonObject();
            String t = type(p);
            if ("RestElement".equals(t)) {
                if (i != properties.size() - 1) {
                    throw unsupported(p, "Rest element must be last element");
                }
                out.add(lowerRest(p, declKind, names, ctx));
                continue;
            }
            if (!"Property".equals(t)) {
                throw unsupported(p, "Unsupported object pattern member '" + t + "'");
            }
            IrNode prop = lowerer.create(IrKind.PROPERTY, p, ctx);
            prop.setRef("key", lowerer.lowerPropertyKey(p, ctx));
            prop.setRef("value", lowerPattern(child(p, "value"), declKind, names, ctx));
            prop.setBoolean("computed", bool(p, "computed"));
            prop.setBoolean("shorthand", bool(p, "shorthand"));
            out.add(prop.getId());
        }
        pattern.setRefs("properties", out);
        return pattern.getId();
    }

    /** rest 目标只接受标识符（赋值模式下也可以是成员表达式） */
    private String lowerRest(JsonObject node, String declKind, List<String> names, LoweringContext ctx) {
        JsonObject arg = child(node, "argument");
        String at = type(arg);
        if (!"Identifier".equals(at) && !(declKind == null && "MemberExpression".equals(at))) {
            throw unsupported(node, "Rest element target must be an identifier");
        }
        IrNode rest = lowerer.create(IrKind.REST_ELEMENT, node, ctx);
        rest.setRef("argument", lowerPattern(arg, declKind, names, ctx));
        return rest.getId();
    }
}
