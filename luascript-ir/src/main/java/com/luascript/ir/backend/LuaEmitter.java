package com.luascript.ir.backend;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;
import com.luascript.ir.node.Operators;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * IR → Lua 源码生成器。
 *
 * <p>输出顺序：用到的辅助函数、顶层 var 提升的 {@code local} 声明、模块体。
 * 生成结果只依赖 IR 本身，同一文档多次生成的文本完全一致。</p>
 */
public class LuaEmitter {

    private static final Logger LOG = Logger.getLogger(LuaEmitter.class.getName());

    private final EmitConfig config;
    private final PatternEmitter patterns = new PatternEmitter(this);

    public LuaEmitter() {
        this(new EmitConfig());
    }

    public LuaEmitter(EmitConfig config) {
        this.config = config;
    }

    public String emit(IrDocument document) {
        IrNode program = document.getProgram();
        if (program == null || !program.is(IrKind.PROGRAM)) {
            throw new EmissionException("Module '" + document.getModuleId() + "' has no Program node",
                    document.getModuleId(), null);
        }
        // 先生成模块体，才知道需要哪些辅助函数
        EmitterContext body = new EmitterContext(document, config);
        emitHoisted(program, Collections.<String>emptySet(), body);
        emitStatements(program.getRefs("body"), body);

        StringBuilder sb = new StringBuilder();
        for (LuaHelper helper : body.getHelpers()) {
            for (String l : helper.getLines()) {
                sb.append(l).append('\n');
            }
            sb.append('\n');
        }
        sb.append(body.getOutput());
        LOG.fine("Emitted " + document.getNodeCount() + " nodes, helpers=" + body.getHelpers());
        return sb.toString();
    }

    // ========== 语句 ==========

    void emitStatements(List<String> ids, EmitterContext ctx) {
        for (int i = 0; i < ids.size(); i++) {
            emitStatement(require(ids.get(i), ctx), i == ids.size() - 1, ctx);
        }
    }

    /**
     * @param last 是否为所在块的最后一条语句（决定 return 是否需要 {@code do ... end} 包裹）
     */
    private void emitStatement(IrNode node, boolean last, EmitterContext ctx) {
        switch (node.getKind()) {
            case VARIABLE_DECLARATION:
                for (String id : node.getRefs("declarations")) {
                    emitDeclarator(require(id, ctx), ctx);
                }
                break;
            case FUNCTION_DECLARATION:
                emitFunctionDeclaration(node, ctx);
                break;
            case BLOCK_STATEMENT:
                ctx.line("do");
                emitBlockBody(node, ctx);
                ctx.line("end");
                break;
            case EXPRESSION_STATEMENT:
                emitExpressionStatement(requireRef(node, "expression", ctx), ctx);
                break;
            case IF_STATEMENT:
                emitIf(node, ctx);
                break;
            case WHILE_STATEMENT:
                ctx.line("while " + expression(requireRef(node, "test", ctx), ctx).code + " do");
                ctx.indent();
                emitLoopBody(node, null, ctx);
                ctx.dedent();
                ctx.line("end");
                break;
            case DO_WHILE_STATEMENT:
                ctx.line("repeat");
                ctx.indent();
                emitLoopBody(node, null, ctx);
                ctx.dedent();
                ctx.line("until not (" + expression(requireRef(node, "test", ctx), ctx).code + ")");
                break;
            case FOR_STATEMENT:
                emitFor(node, ctx);
                break;
            case FOR_IN_STATEMENT:
            case FOR_OF_STATEMENT:
                emitForEach(node, ctx);
                break;
            case SWITCH_STATEMENT:
                emitSwitch(node, ctx);
                break;
            case RETURN_STATEMENT:
                emitReturn(node, last, ctx);
                break;
            case BREAK_STATEMENT:
                if (!ctx.canBreak()) {
                    throw new EmissionException("'break' cannot cross the function boundary of a try block",
                            node.getId(), node.getSpan());
                }
                ctx.line("break");
                break;
            case CONTINUE_STATEMENT: {
                String label = ctx.continueLabel();
                if (label == null) {
                    throw new EmissionException("'continue' cannot cross the function boundary of a try block",
                            node.getId(), node.getSpan());
                }
                ctx.line("goto " + label);
                break;
            }
            case THROW_STATEMENT:
                ctx.line("error(" + expression(requireRef(node, "argument", ctx), ctx).code + ", 0)");
                break;
            case TRY_STATEMENT:
                emitTry(node, ctx);
                break;
            default:
                throw new EmissionException("Cannot emit " + node.getTag() + " as a statement",
                        node.getId(), node.getSpan());
        }
    }

    /** 块体缩进一级输出；非块语句当作单语句块 */
    private void emitBlockBody(IrNode node, EmitterContext ctx) {
        ctx.indent();
        if (node.is(IrKind.BLOCK_STATEMENT)) {
            emitStatements(node.getRefs("body"), ctx);
        } else {
            emitStatement(node, true, ctx);
        }
        ctx.dedent();
    }

    private void emitDeclarator(IrNode declarator, EmitterContext ctx) {
        // var 已在函数顶部提升为 local，这里只赋值
        boolean local = !"var".equals(declarator.getString("declarationKind"));
        IrNode target = requireRef(declarator, "target", ctx);
        String initId = declarator.getRef("init");
        if (target.is(IrKind.IDENTIFIER)) {
            String name = identifierName(target);
            if (initId == null) {
                if (local) {
                    ctx.line("local " + name);
                }
                return;
            }
            String value = expression(require(initId, ctx), ctx).code;
            ctx.line((local ? "local " : "") + name + " = " + value);
            return;
        }
        String source = initId == null ? "nil" : expression(require(initId, ctx), ctx).code;
        patterns.emit(target, source, local, ctx);
    }

    private void emitExpressionStatement(IrNode expr, EmitterContext ctx) {
        switch (expr.getKind()) {
            case ASSIGNMENT_EXPRESSION:
                emitAssignment(expr, ctx);
                break;
            case UPDATE_EXPRESSION: {
                String target = lvalue(requireRef(expr, "argument", ctx), ctx);
                String op = "++".equals(expr.getString("operator")) ? " + 1" : " - 1";
                ctx.line(target + " = " + target + op);
                break;
            }
            case CALL_EXPRESSION:
            case NEW_EXPRESSION:
            case AWAIT_EXPRESSION:
                ctx.line(expression(expr, ctx).code);
                break;
            case OPTIONAL_CALL_EXPRESSION:
            case OPTIONAL_MEMBER_EXPRESSION:
                emitOptionalChainStatement(expr, ctx);
                break;
            default:
                // Lua 不允许裸表达式作为语句
                ctx.line("local __ = " + expression(expr, ctx).code);
        }
    }

    private void emitAssignment(IrNode node, EmitterContext ctx) {
        IrNode left = requireRef(node, "left", ctx);
        IrNode right = requireRef(node, "right", ctx);
        if (left.getKind().isPattern()) {
            patterns.emit(left, expression(right, ctx).code, false, ctx);
            return;
        }
        String target = lvalue(left, ctx);
        ctx.line(target + " = " + assignedValue(node, left, right, ctx).code);
    }

    /** 赋值右侧的值；复合赋值展开为 {@code t = t op (v)} */
    private LuaExpr assignedValue(IrNode node, IrNode left, IrNode right, EmitterContext ctx) {
        String op = node.getString("operator");
        if ("=".equals(op)) {
            return expression(right, ctx);
        }
        return binary(Operators.compoundBase(op), left, right, ctx);
    }

    private void emitIf(IrNode node, EmitterContext ctx) {
        ctx.line("if " + expression(requireRef(node, "test", ctx), ctx).code + " then");
        emitBlockBody(requireRef(node, "consequent", ctx), ctx);
        String altId = node.getRef("alternate");
        while (altId != null) {
            IrNode alt = require(altId, ctx);
            IrNode elseIf = asElseIf(alt, ctx);
            if (elseIf == null) {
                ctx.line("else");
                emitBlockBody(alt, ctx);
                break;
            }
            ctx.line("elseif " + expression(requireRef(elseIf, "test", ctx), ctx).code + " then");
            emitBlockBody(requireRef(elseIf, "consequent", ctx), ctx);
            altId = elseIf.getRef("alternate");
        }
        ctx.line("end");
    }

    private IrNode asElseIf(IrNode alt, EmitterContext ctx) {
        if (alt.is(IrKind.IF_STATEMENT)) {
            return alt;
        }
        if (alt.is(IrKind.BLOCK_STATEMENT)) {
            List<String> body = alt.getRefs("body");
            if (body.size() == 1) {
                IrNode only = require(body.get(0), ctx);
                if (only.is(IrKind.IF_STATEMENT)) {
                    return only;
                }
            }
        }
        return null;
    }

    private void emitFor(IrNode node, EmitterContext ctx) {
        ctx.line("do");
        ctx.indent();
        String initId = node.getRef("init");
        if (initId != null) {
            IrNode init = require(initId, ctx);
            if (init.is(IrKind.VARIABLE_DECLARATION)) {
                emitStatement(init, false, ctx);
            } else {
                emitExpressionStatement(init, ctx);
            }
        }
        String testId = node.getRef("test");
        String test = testId == null ? "true" : expression(require(testId, ctx), ctx).code;
        ctx.line("while " + test + " do");
        ctx.indent();
        String updateId = node.getRef("update");
        emitLoopBody(node, updateId == null ? null : require(updateId, ctx), ctx);
        ctx.dedent();
        ctx.line("end");
        ctx.dedent();
        ctx.line("end");
    }

    private void emitForEach(IrNode node, EmitterContext ctx) {
        IrNode left = requireRef(node, "left", ctx);
        String right = expression(requireRef(node, "right", ctx), ctx).code;
        IrNode binding = null;
        boolean declared = false;
        if (left.is(IrKind.VARIABLE_DECLARATION)) {
            List<String> decls = left.getRefs("declarations");
            if (decls.size() != 1) {
                throw new EmissionException("Loop declaration must declare exactly one binding",
                        left.getId(), left.getSpan());
            }
            binding = requireRef(require(decls.get(0), ctx), "target", ctx);
            declared = true;
        } else {
            binding = left;
        }

        String loopVar = declared && binding.is(IrKind.IDENTIFIER)
                ? identifierName(binding) : LuaNames.temp(left.getId());
        if (node.is(IrKind.FOR_IN_STATEMENT)) {
            ctx.line("for " + loopVar + " in pairs(" + right + ") do");
        } else {
            ctx.line("for __, " + loopVar + " in ipairs(" + right + ") do");
        }
        ctx.indent();
        if (!declared || !binding.is(IrKind.IDENTIFIER)) {
            if (binding.getKind().isPattern()) {
                patterns.emit(binding, loopVar, declared, ctx);
            } else {
                ctx.line(lvalue(binding, ctx) + " = " + loopVar);
            }
        }
        emitLoopBody(node, null, ctx);
        ctx.dedent();
        ctx.line("end");
    }

    /**
     * 循环体。有 continue 指向本循环时体外包 {@code do ... end} 并在其后放标签；
     * 有 update 时同样包一层，保证体内 return 处于块尾。
     */
    private void emitLoopBody(IrNode loop, IrNode update, EmitterContext ctx) {
        IrNode body = requireRef(loop, "body", ctx);
        String label = "continue_" + loop.getId();
        boolean continued = usesContinue(body, ctx);
        ctx.enterLoop(label);
        if (continued || update != null) {
            ctx.line("do");
            emitBlockBody(body, ctx);
            ctx.line("end");
        } else if (body.is(IrKind.BLOCK_STATEMENT)) {
            emitStatements(body.getRefs("body"), ctx);
        } else {
            emitStatement(body, true, ctx);
        }
        ctx.exitLoop();
        if (continued) {
            ctx.line("::" + label + "::");
        }
        if (update != null) {
            emitExpressionStatement(update, ctx);
        }
    }

    private void emitSwitch(IrNode node, EmitterContext ctx) {
        String value = LuaNames.temp(node.getId());
        String matched = value + "_matched";
        ctx.line("repeat");
        ctx.indent();
        ctx.line("local " + value + " = " + expression(requireRef(node, "discriminant", ctx), ctx).code);
        ctx.line("local " + matched + " = false");

        List<IrNode> cases = new ArrayList<>();
        for (String id : node.getRefs("cases")) {
            cases.add(require(id, ctx));
        }
        ctx.enterSwitch();
        for (IrNode c : cases) {
            String cond;
            if (c.getRef("test") != null) {
                cond = matched + " or " + caseMatch(value, c, ctx);
            } else {
                // default：此前未匹配且没有任何 case 能匹配时进入
                List<String> others = new ArrayList<>();
                for (IrNode other : cases) {
                    if (other.getRef("test") != null) {
                        others.add(caseMatch(value, other, ctx));
                    }
                }
                cond = others.isEmpty() ? "true" : matched + " or not (" + String.join(" or ", others) + ")";
            }
            ctx.line("if " + cond + " then");
            ctx.indent();
            ctx.line(matched + " = true");
            emitStatements(c.getRefs("consequent"), ctx);
            ctx.dedent();
            ctx.line("end");
        }
        ctx.exitLoop();
        ctx.dedent();
        ctx.line("until true");
    }

    private String caseMatch(String value, IrNode switchCase, EmitterContext ctx) {
        LuaExpr test = expression(requireRef(switchCase, "test", ctx), ctx);
        return value + " == " + LuaPrecedence.wrap(test, "==", true);
    }

    private void emitReturn(IrNode node, boolean last, EmitterContext ctx) {
        String argId = node.getRef("argument");
        String value = argId == null ? null : expression(require(argId, ctx), ctx).code;
        String stmt;
        if (ctx.inTryBody()) {
            // pcall 体内装箱，区分“没有 return”与“return undefined”
            stmt = "return {" + (value == null ? "" : value) + "}";
        } else {
            stmt = value == null ? "return" : "return " + value;
        }
        ctx.line(last ? stmt : "do " + stmt + " end");
    }

    private void emitTry(IrNode node, EmitterContext ctx) {
        String base = LuaNames.temp(node.getId());
        String ok = base + "_ok";
        String res = base + "_res";
        IrNode block = requireRef(node, "block", ctx);
        String handlerId = node.getRef("handler");
        String finalizerId = node.getRef("finalizer");
        IrNode handler = handlerId == null ? null : require(handlerId, ctx);
        boolean returns = containsReturn(block, ctx)
                || (handler != null && containsReturn(requireRef(handler, "body", ctx), ctx));

        ctx.line("do");
        ctx.indent();
        ctx.line("local " + ok + ", " + res + " = pcall(function()");
        ctx.indent();
        ctx.enterFunction(true);
        emitStatements(block.getRefs("body"), ctx);
        ctx.exitFunction();
        ctx.dedent();
        ctx.line("end)");

        if (handler != null) {
            IrNode param = handler.getRef("param") == null ? null : requireRef(handler, "param", ctx);
            String paramName;
            if (param == null) {
                paramName = "__";
            } else if (param.is(IrKind.IDENTIFIER)) {
                paramName = identifierName(param);
            } else {
                paramName = LuaNames.temp(param.getId());
            }
            ctx.line("if not " + ok + " then");
            ctx.indent();
            ctx.line(ok + ", " + res + " = pcall(function(" + paramName + ")");
            ctx.indent();
            ctx.enterFunction(true);
            if (param != null && !param.is(IrKind.IDENTIFIER)) {
                patterns.emit(param, paramName, true, ctx);
            }
            emitStatements(requireRef(handler, "body", ctx).getRefs("body"), ctx);
            ctx.exitFunction();
            ctx.dedent();
            ctx.line("end, " + res + ")");
            ctx.dedent();
            ctx.line("end");
        }

        if (finalizerId != null) {
            ctx.line("do");
            emitBlockBody(require(finalizerId, ctx), ctx);
            ctx.line("end");
        }

        ctx.line("if not " + ok + " then");
        ctx.indent();
        ctx.line("error(" + res + ", 0)");
        ctx.dedent();
        ctx.line("end");

        if (returns) {
            ctx.line("if " + res + " ~= nil then");
            ctx.indent();
            // 外层也是 try 体时原样继续上抛装箱值
            ctx.line(ctx.inTryBody() ? "return " + res : "return " + res + "[1]");
            ctx.dedent();
            ctx.line("end");
        }
        ctx.dedent();
        ctx.line("end");
    }

    // ========== 函数 ==========

    private void emitFunctionDeclaration(IrNode fn, EmitterContext ctx) {
        String name = LuaNames.mangle(fn.getString("name"));
        ctx.line("local function " + name + "(" + parameterList(fn, ctx) + ")");
        ctx.indent();
        emitFunctionBody(fn, ctx);
        ctx.dedent();
        ctx.line("end");
    }

    private LuaExpr functionExpression(IrNode fn, EmitterContext ctx) {
        EmitterContext inner = ctx.fork();
        inner.indent();
        emitFunctionBody(fn, inner);
        StringBuilder sb = new StringBuilder("function(").append(parameterList(fn, ctx)).append(")\n");
        for (String l : inner.getLines()) {
            sb.append(l).append('\n');
        }
        sb.append(ctx.indentString()).append("end");
        String name = fn.getString("name");
        if (name != null && !fn.getBoolean("arrow")) {
            // 具名函数表达式在自身体内可见
            String local = LuaNames.mangle(name);
            return LuaExpr.prefix("(function() local " + local + "; " + local + " = " + sb
                    + "; return " + local + " end)()");
        }
        return LuaExpr.atom(sb.toString());
    }

    private String parameterList(IrNode fn, EmitterContext ctx) {
        List<String> names = new ArrayList<>();
        if (!fn.getBoolean("arrow") && usesThis(fn, ctx)) {
            // Lua 方法约定：调用方以 obj:m(...) 传入 self
            names.add("self");
        }
        for (String id : fn.getRefs("params")) {
            IrNode p = require(id, ctx);
            if (p.is(IrKind.REST_ELEMENT)) {
                names.add("...");
            } else {
                names.add(identifierName(parameterIdentifier(p, ctx)));
            }
        }
        return String.join(", ", names);
    }

    private IrNode parameterIdentifier(IrNode param, EmitterContext ctx) {
        IrNode target = param;
        if (param.is(IrKind.ASSIGNMENT_PATTERN)) {
            target = requireRef(param, "target", ctx);
        } else if (param.is(IrKind.REST_ELEMENT)) {
            target = requireRef(param, "argument", ctx);
        }
        if (!target.is(IrKind.IDENTIFIER)) {
            throw new EmissionException("Unsupported parameter " + target.getTag(), target.getId(), target.getSpan());
        }
        return target;
    }

    private void emitFunctionBody(IrNode fn, EmitterContext ctx) {
        Set<String> params = new LinkedHashSet<>();
        for (String id : fn.getRefs("params")) {
            IrNode p = require(id, ctx);
            IrNode ident = parameterIdentifier(p, ctx);
            String name = identifierName(ident);
            params.add(ident.getString("name"));
            if (p.is(IrKind.REST_ELEMENT)) {
                ctx.line("local " + name + " = {...}");
            } else if (p.is(IrKind.ASSIGNMENT_PATTERN)) {
                String dflt = expression(requireRef(p, "defaultValue", ctx), ctx).code;
                ctx.line("if " + name + " == nil then " + name + " = " + dflt + " end");
            }
        }
        boolean async = fn.getBoolean("async");
        if (async) {
            ctx.line("return coroutine.create(function()");
            ctx.indent();
        }
        ctx.enterFunction(false);
        emitHoisted(fn, params, ctx);
        emitStatements(requireRef(fn, "body", ctx).getRefs("body"), ctx);
        ctx.exitFunction();
        if (async) {
            ctx.dedent();
            ctx.line("end)");
        }
    }

    private void emitHoisted(IrNode owner, Set<String> params, EmitterContext ctx) {
        JsonObject meta = owner.getMeta();
        if (meta == null || !meta.has("hoisted") || !meta.get("hoisted").isJsonArray()) {
            return;
        }
        List<String> names = new ArrayList<>();
        for (JsonElement e : meta.getAsJsonArray("hoisted")) {
            String name = e.getAsString();
            if (!params.contains(name)) {
                names.add(LuaNames.mangle(name));
            }
        }
        if (!names.isEmpty()) {
            ctx.line("local " + String.join(", ", names));
        }
    }

    // ========== 表达式 ==========

    LuaExpr expression(IrNode node, EmitterContext ctx) {
        switch (node.getKind()) {
            case IDENTIFIER:
                return identifier(node);
            case LITERAL:
                return literal(node);
            case BINARY_EXPRESSION:
                return binary(node.getString("operator"),
                        requireRef(node, "left", ctx), requireRef(node, "right", ctx), ctx);
            case LOGICAL_EXPRESSION:
                return logical(node, ctx);
            case UNARY_EXPRESSION:
                return unary(node, ctx);
            case CONDITIONAL_EXPRESSION:
                return conditional(node, ctx);
            case ASSIGNMENT_EXPRESSION:
                return assignmentExpression(node, ctx);
            case UPDATE_EXPRESSION:
                return updateExpression(node, ctx);
            case CALL_EXPRESSION:
                return call(node, ctx);
            case NEW_EXPRESSION:
                return LuaExpr.prefix(expression(requireRef(node, "callee", ctx), ctx).asPrefix()
                        + ".new(" + arguments(node, ctx) + ")");
            case MEMBER_EXPRESSION:
                return member(node, true, ctx);
            case OPTIONAL_MEMBER_EXPRESSION:
            case OPTIONAL_CALL_EXPRESSION:
                return optionalChain(node, ctx);
            case ARRAY_EXPRESSION:
                return arrayLiteral(node, ctx);
            case THIS_EXPRESSION:
                return LuaExpr.prefix("self");
            case TEMPLATE_LITERAL:
                return template(node, ctx);
            case SPREAD_ELEMENT:
                throw new EmissionException("SpreadElement can only appear in argument lists and array literals",
                        node.getId(), node.getSpan());
            case OBJECT_EXPRESSION:
                return object(node, ctx);
            case FUNCTION_EXPRESSION:
                return functionExpression(node, ctx);
            case AWAIT_EXPRESSION:
                ctx.useHelper(LuaHelper.AWAIT);
                return LuaExpr.prefix("__await(" + expression(requireRef(node, "argument", ctx), ctx).code + ")");
            default:
                throw new EmissionException("Cannot emit " + node.getTag() + " as an expression",
                        node.getId(), node.getSpan());
        }
    }

    private LuaExpr identifier(IrNode node) {
        String name = node.getString("name");
        if ("undefined".equals(name)) {
            return LuaExpr.atom("nil");
        }
        if ("NaN".equals(name)) {
            return LuaExpr.prefix("(0/0)");
        }
        if ("Infinity".equals(name)) {
            return LuaExpr.prefix("math.huge");
        }
        return LuaExpr.prefix(LuaNames.mangle(name));
    }

    String identifierName(IrNode node) {
        return LuaNames.mangle(node.getString("name"));
    }

    private LuaExpr literal(IrNode node) {
        JsonElement value = node.getValue();
        if (value == null || value.isJsonNull()) {
            return LuaExpr.atom("nil");
        }
        JsonPrimitive p = value.getAsJsonPrimitive();
        if (p.isBoolean()) {
            return LuaExpr.atom(p.getAsBoolean() ? "true" : "false");
        }
        if (p.isNumber()) {
            String code = formatNumber(p.getAsDouble());
            return code.startsWith("-") ? LuaExpr.unary(code) : LuaExpr.atom(code);
        }
        return LuaExpr.atom(LuaNames.quote(p.getAsString()));
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) {
            return "(0/0)";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "math.huge" : "-math.huge";
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return Double.toString(d);
    }

    private LuaExpr binary(String jsOp, IrNode left, IrNode right, EmitterContext ctx) {
        switch (jsOp) {
            case "in":
                return LuaExpr.binary(expression(right, ctx).asPrefix()
                        + "[" + expression(left, ctx).code + "] ~= nil", "~=");
            case "instanceof":
                ctx.useHelper(LuaHelper.INSTANCEOF);
                return LuaExpr.prefix("__instanceof(" + expression(left, ctx).code
                        + ", " + expression(right, ctx).code + ")");
            default:
                break;
        }
        String op = luaBinaryOperator(jsOp);
        if ("+".equals(jsOp) && (isStringLike(left, ctx) || isStringLike(right, ctx))) {
            op = "..";
        }
        return combine(op, expression(left, ctx), expression(right, ctx));
    }

    private static LuaExpr combine(String luaOp, LuaExpr left, LuaExpr right) {
        return LuaExpr.binary(LuaPrecedence.wrap(left, luaOp, false) + " " + luaOp + " "
                + LuaPrecedence.wrap(right, luaOp, true), luaOp);
    }

    static String luaBinaryOperator(String jsOp) {
        switch (jsOp) {
            case "===":
            case "==":
                return "==";
            case "!==":
            case "!=":
                return "~=";
            case "**":
                return "^";
            case "^":
                return "~";
            case ">>>":
                return ">>";
            default:
                return jsOp;
        }
    }

    private LuaExpr logical(IrNode node, EmitterContext ctx) {
        String op = "&&".equals(node.getString("operator")) ? "and" : "or";
        return combine(op, expression(requireRef(node, "left", ctx), ctx),
                expression(requireRef(node, "right", ctx), ctx));
    }

    private LuaExpr unary(IrNode node, EmitterContext ctx) {
        LuaExpr operand = expression(requireRef(node, "argument", ctx), ctx);
        String op = node.getString("operator");
        switch (op) {
            case "!":
                return LuaExpr.unary("not " + LuaPrecedence.wrapUnaryOperand(operand));
            case "-": {
                String code = LuaPrecedence.wrapUnaryOperand(operand);
                // "--" 在 Lua 中是注释
                if (code.startsWith("-")) {
                    code = "(" + code + ")";
                }
                return LuaExpr.unary("-" + code);
            }
            case "+":
                return LuaExpr.prefix("tonumber(" + operand.code + ")");
            case "~":
                return LuaExpr.unary("~" + LuaPrecedence.wrapUnaryOperand(operand));
            case "typeof":
                return LuaExpr.prefix("type(" + operand.code + ")");
            default:
                throw new EmissionException("Unsupported unary operator '" + op + "'", node.getId(), node.getSpan());
        }
    }

    private LuaExpr conditional(IrNode node, EmitterContext ctx) {
        IrNode consequentNode = requireRef(node, "consequent", ctx);
        LuaExpr test = expression(requireRef(node, "test", ctx), ctx);
        LuaExpr consequent = expression(consequentNode, ctx);
        LuaExpr alternate = expression(requireRef(node, "alternate", ctx), ctx);
        if (isTruthyLiteral(consequentNode)) {
            return combine("or", combine("and", test, consequent), alternate);
        }
        return LuaExpr.prefix("(function() if " + test.code + " then return " + consequent.code
                + " else return " + alternate.code + " end end)()");
    }

    /** nil 和 false 以外的字面量在 Lua 中恒为真，可用 and/or 形式 */
    private static boolean isTruthyLiteral(IrNode node) {
        if (!node.is(IrKind.LITERAL)) {
            return false;
        }
        JsonElement v = node.getValue();
        if (v == null || v.isJsonNull()) {
            return false;
        }
        return !(v.getAsJsonPrimitive().isBoolean() && !v.getAsBoolean());
    }

    /**
     * 嵌套赋值改写为立即调用的函数，返回赋入的值。
     */
    private LuaExpr assignmentExpression(IrNode node, EmitterContext ctx) {
        IrNode left = requireRef(node, "left", ctx);
        IrNode right = requireRef(node, "right", ctx);
        String temp = LuaNames.temp(node.getId());
        EmitterContext inner = ctx.fork();
        inner.line("local " + temp + " = " + assignedValue(node, left, right, ctx).code);
        if (left.getKind().isPattern()) {
            patterns.emit(left, temp, false, inner);
        } else {
            inner.line(lvalue(left, ctx) + " = " + temp);
        }
        return LuaExpr.prefix("(function() " + inner.inline() + "; return " + temp + " end)()");
    }

    private LuaExpr updateExpression(IrNode node, EmitterContext ctx) {
        String target = lvalue(requireRef(node, "argument", ctx), ctx);
        String delta = "++".equals(node.getString("operator")) ? " + 1" : " - 1";
        if (node.getBoolean("prefix")) {
            return LuaExpr.prefix("(function() " + target + " = " + target + delta
                    + "; return " + target + " end)()");
        }
        String temp = LuaNames.temp(node.getId());
        return LuaExpr.prefix("(function() local " + temp + " = " + target + "; " + target + " = "
                + temp + delta + "; return " + temp + " end)()");
    }

    private LuaExpr call(IrNode node, EmitterContext ctx) {
        IrNode callee = requireRef(node, "callee", ctx);
        String target = isConsoleLog(callee, ctx) ? "print" : expression(callee, ctx).asPrefix();
        return LuaExpr.prefix(target + "(" + arguments(node, ctx) + ")");
    }

    private boolean isConsoleLog(IrNode callee, EmitterContext ctx) {
        if (!callee.is(IrKind.MEMBER_EXPRESSION) || callee.getBoolean("computed")) {
            return false;
        }
        IrNode object = requireRef(callee, "object", ctx);
        IrNode property = requireRef(callee, "property", ctx);
        return object.is(IrKind.IDENTIFIER) && "console".equals(object.getString("name"))
                && property.is(IrKind.IDENTIFIER) && "log".equals(property.getString("name"));
    }

    private String arguments(IrNode node, EmitterContext ctx) {
        List<String> ids = node.getRefs("arguments");
        if (needsSpreadHelper(ids, ctx)) {
            return "table.unpack(" + spreadTable(ids, ctx) + ")";
        }
        return expressionList(ids, ctx);
    }

    private LuaExpr arrayLiteral(IrNode node, EmitterContext ctx) {
        List<String> ids = node.getRefs("elements");
        if (needsSpreadHelper(ids, ctx)) {
            return LuaExpr.prefix(spreadTable(ids, ctx));
        }
        return LuaExpr.atom("{" + expressionList(ids, ctx) + "}");
    }

    /**
     * 逗号分隔的表达式列表，空位写作 nil。
     * 最后一项是展开时写作 {@code table.unpack(xs)}，由 Lua 在列表末尾展开全部值。
     */
    private String expressionList(List<String> ids, EmitterContext ctx) {
        List<String> items = new ArrayList<>();
        for (String id : ids) {
            if (id == null) {
                items.add("nil");
                continue;
            }
            IrNode item = require(id, ctx);
            if (item.is(IrKind.SPREAD_ELEMENT)) {
                items.add("table.unpack(" + expression(requireRef(item, "argument", ctx), ctx).code + ")");
            } else {
                items.add(expression(item, ctx).code);
            }
        }
        return String.join(", ", items);
    }

    /** 展开不在末尾时，table.unpack 只会取第一个值，需要先拼成一张表 */
    private boolean needsSpreadHelper(List<String> ids, EmitterContext ctx) {
        for (int i = 0; i < ids.size() - 1; i++) {
            String id = ids.get(i);
            if (id != null && require(id, ctx).is(IrKind.SPREAD_ELEMENT)) {
                return true;
            }
        }
        return false;
    }

    /** {@code __spread({a, b}, xs, {c})}：相邻的普通项合成一段 */
    private String spreadTable(List<String> ids, EmitterContext ctx) {
        ctx.useHelper(LuaHelper.SPREAD);
        List<String> segments = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        for (String id : ids) {
            IrNode item = id == null ? null : require(id, ctx);
            if (item != null && item.is(IrKind.SPREAD_ELEMENT)) {
                if (!pending.isEmpty()) {
                    segments.add("{" + String.join(", ", pending) + "}");
                    pending.clear();
                }
                segments.add(expression(requireRef(item, "argument", ctx), ctx).code);
            } else {
                pending.add(item == null ? "nil" : expression(item, ctx).code);
            }
        }
        if (!pending.isEmpty()) {
            segments.add("{" + String.join(", ", pending) + "}");
        }
        return "__spread(" + String.join(", ", segments) + ")";
    }

    /** {@code `a${x}b`} → {@code "a" .. tostring(x) .. "b"}，空段省略 */
    private LuaExpr template(IrNode node, EmitterContext ctx) {
        List<String> quasis = node.getStrings("quasis");
        List<String> expressions = node.getRefs("expressions");
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < quasis.size(); i++) {
            if (!quasis.get(i).isEmpty()) {
                parts.add(LuaNames.quote(quasis.get(i)));
            }
            if (i < expressions.size()) {
                parts.add("tostring(" + expression(require(expressions.get(i), ctx), ctx).code + ")");
            }
        }
        if (parts.isEmpty()) {
            return LuaExpr.atom("\"\"");
        }
        if (parts.size() == 1) {
            String only = parts.get(0);
            return only.startsWith("\"") ? LuaExpr.atom(only) : LuaExpr.prefix(only);
        }
        return LuaExpr.binary(String.join(" .. ", parts), "..");
    }

    // ========== 可选链 ==========

    /**
     * 表达式位置的可选链：立即调用的函数里逐层 {@code if t ~= nil then}，任一守卫不成立时返回 nil。
     */
    private LuaExpr optionalChain(IrNode node, EmitterContext ctx) {
        List<String[]> guards = new ArrayList<>();
        LuaExpr value = chainValue(node, guards, ctx);
        if (guards.isEmpty()) {
            return value;
        }
        StringBuilder sb = new StringBuilder("(function() ");
        for (String[] guard : guards) {
            sb.append("local ").append(guard[0]).append(" = ").append(guard[1])
                    .append("; if ").append(guard[0]).append(" ~= nil then ");
        }
        sb.append("return ").append(value.code);
        for (int i = 0; i < guards.size(); i++) {
            sb.append(" end");
        }
        return LuaExpr.prefix(sb.append(" end)()").toString());
    }

    /** 语句位置的可选链直接展开为嵌套的 if */
    private void emitOptionalChainStatement(IrNode node, EmitterContext ctx) {
        List<String[]> guards = new ArrayList<>();
        LuaExpr value = chainValue(node, guards, ctx);
        for (String[] guard : guards) {
            ctx.line("local " + guard[0] + " = " + guard[1]);
            ctx.line("if " + guard[0] + " ~= nil then");
            ctx.indent();
        }
        ctx.line(node.is(IrKind.OPTIONAL_CALL_EXPRESSION) ? value.code : "local __ = " + value.code);
        for (int i = 0; i < guards.size(); i++) {
            ctx.dedent();
            ctx.line("end");
        }
    }

    /**
     * 链上一环的取值表达式。带 ?. 的一环先把左侧存入临时变量并登记守卫 {@code {temp, value}}，
     * 之后的访问都基于该临时变量。
     */
    private LuaExpr chainValue(IrNode node, List<String[]> guards, EmitterContext ctx) {
        if (node.is(IrKind.OPTIONAL_MEMBER_EXPRESSION)) {
            LuaExpr object = chainOperand(requireRef(node, "object", ctx), guards, ctx);
            if (node.getBoolean("optional")) {
                object = guard(node, object, guards);
            }
            return memberAccess(object.asPrefix(), node, true, ctx);
        }
        LuaExpr callee = chainOperand(requireRef(node, "callee", ctx), guards, ctx);
        if (node.getBoolean("optional")) {
            callee = guard(node, callee, guards);
        }
        return LuaExpr.prefix(callee.asPrefix() + "(" + arguments(node, ctx) + ")");
    }

    private LuaExpr chainOperand(IrNode operand, List<String[]> guards, EmitterContext ctx) {
        if (operand.getKind().isOptionalChain()) {
            return chainValue(operand, guards, ctx);
        }
        return expression(operand, ctx);
    }

    private static LuaExpr guard(IrNode link, LuaExpr value, List<String[]> guards) {
        String temp = LuaNames.temp(link.getId());
        guards.add(new String[]{temp, value.code});
        return LuaExpr.prefix(temp);
    }

    /**
     * @param readLength 非计算属性 {@code length} 是否改写为 {@code #x}（赋值目标不改写）
     */
    private LuaExpr member(IrNode node, boolean readLength, EmitterContext ctx) {
        return memberAccess(expression(requireRef(node, "object", ctx), ctx).asPrefix(), node, readLength, ctx);
    }

    private LuaExpr memberAccess(String object, IrNode node, boolean readLength, EmitterContext ctx) {
        IrNode property = requireRef(node, "property", ctx);
        if (node.getBoolean("computed")) {
            return LuaExpr.prefix(object + "[" + expression(property, ctx).code + "]");
        }
        String name = propertyName(property);
        if (readLength && "length".equals(name)) {
            return LuaExpr.unary("#" + object);
        }
        return LuaExpr.prefix(LuaNames.field(object, name));
    }

    private static String propertyName(IrNode key) {
        if (key.is(IrKind.IDENTIFIER)) {
            return key.getString("name");
        }
        JsonElement v = key.getValue();
        return v == null || v.isJsonNull() ? "nil" : v.getAsString();
    }

    private LuaExpr object(IrNode node, EmitterContext ctx) {
        List<String> entries = new ArrayList<>();
        for (String id : node.getRefs("properties")) {
            IrNode prop = require(id, ctx);
            String value = expression(requireRef(prop, "value", ctx), ctx).code;
            entries.add(tableKey(prop, ctx) + " = " + value);
        }
        return LuaExpr.atom(entries.isEmpty() ? "{}" : "{" + String.join(", ", entries) + "}");
    }

    private String tableKey(IrNode prop, EmitterContext ctx) {
        IrNode key = requireRef(prop, "key", ctx);
        if (prop.getBoolean("computed")) {
            return "[" + expression(key, ctx).code + "]";
        }
        if (key.is(IrKind.LITERAL)) {
            JsonElement v = key.getValue();
            if (v != null && v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber()) {
                return "[" + formatNumber(v.getAsDouble()) + "]";
            }
        }
        return LuaNames.tableKey(propertyName(key));
    }

    /** 赋值目标：标识符或成员访问 */
    String lvalue(IrNode target, EmitterContext ctx) {
        if (target.is(IrKind.IDENTIFIER)) {
            return identifierName(target);
        }
        if (target.is(IrKind.MEMBER_EXPRESSION)) {
            return member(target, false, ctx).code;
        }
        throw new EmissionException("Invalid assignment target " + target.getTag(), target.getId(), target.getSpan());
    }

    /**
     * 是否为字符串类表达式，决定 {@code +} 生成 {@code ..} 还是算术加法。
     */
    boolean isStringLike(IrNode node, EmitterContext ctx) {
        switch (node.getKind()) {
            case LITERAL: {
                JsonElement v = node.getValue();
                return v != null && v.isJsonPrimitive() && v.getAsJsonPrimitive().isString();
            }
            case BINARY_EXPRESSION:
                return "+".equals(node.getString("operator"))
                        && (isStringLike(requireRef(node, "left", ctx), ctx)
                        || isStringLike(requireRef(node, "right", ctx), ctx));
            case UNARY_EXPRESSION:
                return "typeof".equals(node.getString("operator"));
            case TEMPLATE_LITERAL:
                return true;
            case CONDITIONAL_EXPRESSION:
                return isStringLike(requireRef(node, "consequent", ctx), ctx)
                        && isStringLike(requireRef(node, "alternate", ctx), ctx);
            default:
                return false;
        }
    }

    // ========== 遍历辅助 ==========

    /** 子树中是否有指向当前循环的 continue（不进入嵌套循环与函数） */
    private boolean usesContinue(IrNode body, EmitterContext ctx) {
        Deque<IrNode> stack = new ArrayDeque<>();
        stack.push(body);
        while (!stack.isEmpty()) {
            IrNode n = stack.pop();
            if (n.is(IrKind.CONTINUE_STATEMENT)) {
                return true;
            }
            for (String id : n.children()) {
                IrNode c = ctx.node(id);
                if (c == null || c.getKind() == null || c.getKind().isLoop() || c.getKind().isFunction()) continue;
                stack.push(c);
            }
        }
        return false;
    }

    /** 函数自身（含其中的箭头函数）是否用到 this；普通嵌套函数有自己的 this */
    private boolean usesThis(IrNode fn, EmitterContext ctx) {
        Deque<IrNode> stack = new ArrayDeque<>();
        stack.push(fn);
        while (!stack.isEmpty()) {
            IrNode n = stack.pop();
            if (n.is(IrKind.THIS_EXPRESSION)) {
                return true;
            }
            for (String id : n.children()) {
                IrNode c = ctx.node(id);
                if (c == null || c.getKind() == null) continue;
                if (c.getKind().isFunction() && !c.getBoolean("arrow")) continue;
                stack.push(c);
            }
        }
        return false;
    }

    private boolean containsReturn(IrNode root, EmitterContext ctx) {
        Deque<IrNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            IrNode n = stack.pop();
            if (n.is(IrKind.RETURN_STATEMENT)) {
                return true;
            }
            for (String id : n.children()) {
                IrNode c = ctx.node(id);
                if (c == null || c.getKind() == null || c.getKind().isFunction()) continue;
                stack.push(c);
            }
        }
        return false;
    }

    IrNode require(String id, EmitterContext ctx) {
        IrNode node = ctx.node(id);
        if (node == null) {
            throw new EmissionException("Missing node '" + id + "'", id, null);
        }
        if (node.getKind() == null) {
            throw new EmissionException("Unknown node kind '" + node.getTag() + "'", id, node.getSpan());
        }
        return node;
    }

    IrNode requireRef(IrNode owner, String field, EmitterContext ctx) {
        String id = owner.getRef(field);
        if (id == null) {
            throw new EmissionException(owner.getTag() + " '" + owner.getId() + "' is missing '" + field + "'",
                    owner.getId(), owner.getSpan());
        }
        return require(id, ctx);
    }
}
