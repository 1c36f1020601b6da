package com.luascript.ir.lowering;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.luascript.compiler.ast.SourceSpan;
import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.node.IdGenerator;
import com.luascript.ir.node.IrDocument;
import com.luascript.ir.node.IrKind;
import com.luascript.ir.node.IrNode;
import com.luascript.ir.node.Operators;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 规范化 ESTree → 扁平 IR 降级。
 *
 * <p>控制结构映射到专用节点种类并以 ID 引用子块；非块语句体包装为
 * BlockStatement；解构模式保持结构化，由后端展开。
 * 遇到不支持的节点种类或运算符时抛出 {@link UnsupportedConstructException}。</p>
 */
public class IrLowerer {

    private static final Logger LOG = Logger.getLogger(IrLowerer.class.getName());

    private final PatternLowerer patterns = new PatternLowerer(this);

    // ========== 公共入口 ==========

    /**
     * 将规范化后的 Program 降级为 IR 文档。
     */
    public IrDocument lower(JsonObject program, CompileOptions options) {
        CompileOptions opts = options != null ? options : CompileOptions.defaults();
        if (program == null || !"Program".equals(type(program))) {
            throw new UnsupportedConstructException("Expected a Program root but found "
                    + (program == null ? "null" : type(program)),
                    program == null ? null : type(program), program == null ? null : span(program));
        }
        IrDocument doc = new IrDocument(opts.getSchemaVersion());
        doc.setIdGenerator(new IdGenerator());
        LoweringContext ctx = new LoweringContext(new IrBuilder(doc), opts);

        IrNode root = ctx.builder().create(IrKind.PROGRAM, span(program));
        ctx.enterFunction(false);
        List<String> body = lowerStatements(list(program, "body"), ctx);
        List<String> hoisted = ctx.exitFunction();
        root.setRefs("body", body);
        if (!hoisted.isEmpty()) {
            root.meta().add("hoisted", strings(hoisted));
        }

        doc.setModuleId(root.getId());
        doc.getModuleBody().addAll(body);
        doc.setMetadata(moduleMetadata(opts));
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Lowered " + opts.getSourcePath() + " into " + doc.getNodeCount() + " nodes");
        }
        return doc;
    }

    private static JsonObject moduleMetadata(CompileOptions opts) {
        JsonObject meta = new JsonObject();
        JsonObject source = new JsonObject();
        source.addProperty("path", opts.getSourcePath());
        source.addProperty("hash", opts.getSourceHash());
        meta.add("source", source);
        JsonObject toolchain = new JsonObject();
        for (Map.Entry<String, String> e : opts.getToolchain().entrySet()) {
            toolchain.addProperty(e.getKey(), e.getValue());
        }
        meta.add("toolchain", toolchain);
        return meta;
    }

    // ========== 语句 ==========

    List<String> lowerStatements(JsonArray statements, LoweringContext ctx) {
        List<String> out = new ArrayList<>();
        for (JsonElement e : statements) {
            if (e == null || e.isJsonNull()) continue;
            JsonObject stmt = e.getAsJsonObject();
            if ("EmptyStatement".equals(type(stmt))) continue;
            out.add(lowerStatement(stmt, ctx));
        }
        return out;
    }

    String lowerStatement(JsonObject node, LoweringContext ctx) {
        String t = type(node);
        switch (t) {
            case "VariableDeclaration":
                return lowerVariableDeclaration(node, ctx).getId();
            case "FunctionDeclaration":
                return lowerFunction(node, IrKind.FUNCTION_DECLARATION, ctx);
            case "BlockStatement":
                return lowerBlock(node, ctx);
            case "EmptyStatement":
                return ctx.builder().block(Collections.<String>emptyList(), span(node)).getId();
            case "ExpressionStatement": {
                IrNode stmt = create(IrKind.EXPRESSION_STATEMENT, node, ctx);
                stmt.setRef("expression", lowerExpression(child(node, "expression"), ctx));
                return stmt.getId();
            }
            case "IfStatement":
                return lowerIf(node, ctx);
            case "WhileStatement":
            case "DoWhileStatement":
                return lowerWhile(node, t.equals("WhileStatement")
                        ? IrKind.WHILE_STATEMENT : IrKind.DO_WHILE_STATEMENT, ctx);
            case "ForStatement":
                return lowerFor(node, ctx);
            case "ForInStatement":
            case "ForOfStatement":
                return lowerForEach(node, ctx);
            case "SwitchStatement":
                return lowerSwitch(node, ctx);
            case "ReturnStatement": {
                IrNode stmt = create(IrKind.RETURN_STATEMENT, node, ctx);
                JsonObject arg = child(node, "argument");
                stmt.setRef("argument", arg == null ? null : lowerExpression(arg, ctx));
                return stmt.getId();
            }
            case "BreakStatement":
                rejectLabel(node);
                if (!ctx.canBreak()) {
                    if (ctx.breakCrossesTry()) {
                        throw unsupported(node, "'break' cannot cross a try block");
                    }
                    throw unsupported(node, "'break' outside of a loop or switch");
                }
                return create(IrKind.BREAK_STATEMENT, node, ctx).getId();
            case "ContinueStatement":
                rejectLabel(node);
                if (!ctx.canContinue()) {
                    if (ctx.continueCrossesTry()) {
                        throw unsupported(node, "'continue' cannot cross a try block");
                    }
                    throw unsupported(node, "'continue' outside of a loop");
                }
                return create(IrKind.CONTINUE_STATEMENT, node, ctx).getId();
            case "ThrowStatement": {
                IrNode stmt = create(IrKind.THROW_STATEMENT, node, ctx);
                stmt.setRef("argument", lowerExpression(child(node, "argument"), ctx));
                return stmt.getId();
            }
            case "TryStatement":
                return lowerTry(node, ctx);
            case "LabeledStatement":
                throw unsupported(node, "Labeled statements are not supported");
            default:
                throw unsupported(node, "Unsupported statement '" + t + "'");
        }
    }

    String lowerBlock(JsonObject node, LoweringContext ctx) {
        IrNode block = create(IrKind.BLOCK_STATEMENT, node, ctx);
        ctx.enterBlock();
        block.setRefs("body", lowerStatements(list(node, "body"), ctx));
        ctx.exitBlock();
        return block.getId();
    }

    /** 语句体：非块语句包装为只含一条语句的块 */
    private String lowerBody(JsonObject node, LoweringContext ctx) {
        if ("BlockStatement".equals(type(node))) {
            return lowerBlock(node, ctx);
        }
        IrNode block = create(IrKind.BLOCK_STATEMENT, node, ctx);
        ctx.enterBlock();
        List<String> body = new ArrayList<>();
        if (!"EmptyStatement".equals(type(node))) {
            body.add(lowerStatement(node, ctx));
        }
        ctx.exitBlock();
        block.setRefs("body", body);
        return block.getId();
    }

    IrNode lowerVariableDeclaration(JsonObject node, LoweringContext ctx) {
        String kind = str(node, "kind");
        IrNode decl = create(IrKind.VARIABLE_DECLARATION, node, ctx);
        decl.setString("declarationKind", kind);
        List<String> declarators = new ArrayList<>();
        for (JsonElement e : list(node, "declarations")) {
            JsonObject d = e.getAsJsonObject();
            if (!"VariableDeclarator".equals(type(d))) {
                throw unsupported(d, "Unexpected '" + type(d) + "' in variable declaration");
            }
            IrNode declarator = create(IrKind.VARIABLE_DECLARATOR, d, ctx);
            declarator.setString("declarationKind", kind);
            List<String> names = new ArrayList<>();
            declarator.setRef("target", patterns.lowerBinding(child(d, "id"), kind, names, ctx));
            JsonObject init = child(d, "init");
            declarator.setRef("init", init == null ? null : lowerExpression(init, ctx));
            declarator.meta().add("bindings", strings(names));
            declarators.add(declarator.getId());
        }
        decl.setRefs("declarations", declarators);
        return decl;
    }

    private String lowerIf(JsonObject node, LoweringContext ctx) {
        IrNode stmt = create(IrKind.IF_STATEMENT, node, ctx);
        stmt.setRef("test", lowerExpression(child(node, "test"), ctx));
        stmt.setRef("consequent", lowerBody(child(node, "consequent"), ctx));
        JsonObject alternate = child(node, "alternate");
        stmt.setRef("alternate", alternate == null ? null : lowerBody(alternate, ctx));
        return stmt.getId();
    }

    private String lowerWhile(JsonObject node, IrKind kind, LoweringContext ctx) {
        IrNode stmt = create(kind, node, ctx);
        String test;
        String body;
        ctx.enterLoop();
        if (kind == IrKind.DO_WHILE_STATEMENT) {
            body = lowerBody(child(node, "body"), ctx);
            test = lowerExpression(child(node, "test"), ctx);
        } else {
            test = lowerExpression(child(node, "test"), ctx);
            body = lowerBody(child(node, "body"), ctx);
        }
        ctx.exitLoop();
        stmt.setRef("test", test);
        stmt.setRef("body", body);
        return stmt.getId();
    }

    private String lowerFor(JsonObject node, LoweringContext ctx) {
        IrNode stmt = create(IrKind.FOR_STATEMENT, node, ctx);
        ctx.enterBlock();
        JsonObject init = child(node, "init");
        String initId = null;
        if (init != null) {
            initId = "VariableDeclaration".equals(type(init))
                    ? lowerVariableDeclaration(init, ctx).getId()
                    : lowerExpression(init, ctx);
        }
        JsonObject test = child(node, "test");
        JsonObject update = child(node, "update");
        stmt.setRef("init", initId);
        stmt.setRef("test", test == null ? null : lowerExpression(test, ctx));
        stmt.setRef("update", update == null ? null : lowerExpression(update, ctx));
        ctx.enterLoop();
        stmt.setRef("body", lowerBody(child(node, "body"), ctx));
        ctx.exitLoop();
        ctx.exitBlock();
        return stmt.getId();
    }

    private String lowerForEach(JsonObject node, LoweringContext ctx) {
        boolean forOf = "ForOfStatement".equals(type(node));
        if (forOf && bool(node, "await")) {
            throw unsupported(node, "'for await' loops are not supported");
        }
        IrNode stmt = create(forOf ? IrKind.FOR_OF_STATEMENT : IrKind.FOR_IN_STATEMENT, node, ctx);
        ctx.enterBlock();
        JsonObject left = child(node, "left");
        String leftId;
        if ("VariableDeclaration".equals(type(left))) {
            JsonArray declarations = list(left, "declarations");
            if (declarations.size() != 1 || child(declarations.get(0).getAsJsonObject(), "init") != null) {
                throw unsupported(left, "Loop variable declaration must declare exactly one binding without initializer");
            }
            leftId = lowerVariableDeclaration(left, ctx).getId();
        } else {
            leftId = patterns.lowerAssignmentTarget(left, ctx);
        }
        stmt.setRef("left", leftId);
        stmt.setRef("right", lowerExpression(child(node, "right"), ctx));
        ctx.enterLoop();
        stmt.setRef("body", lowerBody(child(node, "body"), ctx));
        ctx.exitLoop();
        ctx.exitBlock();
        return stmt.getId();
    }

    private String lowerSwitch(JsonObject node, LoweringContext ctx) {
        IrNode stmt = create(IrKind.SWITCH_STATEMENT, node, ctx);
        stmt.setRef("discriminant", lowerExpression(child(node, "discriminant"), ctx));
        ctx.enterSwitch();
        ctx.enterBlock();
        List<String> cases = new ArrayList<>();
        for (JsonElement e : list(node, "cases")) {
            JsonObject c = e.getAsJsonObject();
            IrNode clause = create(IrKind.SWITCH_CASE, c, ctx);
            JsonObject test = child(c, "test");
            clause.setRef("test", test == null ? null : lowerExpression(test, ctx));
            clause.setRefs("consequent", lowerStatements(list(c, "consequent"), ctx));
            cases.add(clause.getId());
        }
        ctx.exitBlock();
        ctx.exitSwitch();
        stmt.setRefs("cases", cases);
        return stmt.getId();
    }

    private String lowerTry(JsonObject node, LoweringContext ctx) {
        IrNode stmt = create(IrKind.TRY_STATEMENT, node, ctx);
        ctx.enterTry();
        stmt.setRef("block", lowerBlock(child(node, "block"), ctx));
        ctx.exitTry();
        JsonObject handler = child(node, "handler");
        String handlerId = null;
        if (handler != null) {
            IrNode clause = create(IrKind.CATCH_CLAUSE, handler, ctx);
            ctx.enterBlock();
            JsonObject param = child(handler, "param");
            clause.setRef("param", param == null ? null
                    : patterns.lowerBinding(param, "let", new ArrayList<String>(), ctx));
            ctx.enterTry();
            clause.setRef("body", lowerBlock(child(handler, "body"), ctx));
            ctx.exitTry();
            ctx.exitBlock();
            handlerId = clause.getId();
        }
        stmt.setRef("handler", handlerId);
        JsonObject finalizer = child(node, "finalizer");
        stmt.setRef("finalizer", finalizer == null ? null : lowerBlock(finalizer, ctx));
        return stmt.getId();
    }

    private void rejectLabel(JsonObject node) {
        if (child(node, "label") != null) {
            throw unsupported(node, "Labeled " + ("BreakStatement".equals(type(node)) ? "break" : "continue")
                    + " is not supported");
        }
    }

    // ========== 函数 ==========

    private String lowerFunction(JsonObject node, IrKind kind, LoweringContext ctx) {
        if (bool(node, "generator")) {
            throw unsupported(node, "Generator functions are not supported");
        }
        boolean async = bool(node, "async");
        boolean arrow = "ArrowFunctionExpression".equals(type(node));
        IrNode fn = create(kind, node, ctx);
        JsonObject id = child(node, "id");
        String name = id == null ? null : str(id, "name");
        fn.setString("name", name);
        if (kind == IrKind.FUNCTION_DECLARATION) {
            ctx.declare(name, "function", span(node));
        }

        ctx.enterFunction(async);
        if (kind == IrKind.FUNCTION_EXPRESSION && name != null) {
            ctx.declare(name, "function", span(node));
        }
        fn.setRefs("params", lowerParams(list(node, "params"), ctx));
        JsonObject body = child(node, "body");
        if ("BlockStatement".equals(type(body))) {
            fn.setRef("body", lowerBlock(body, ctx));
        } else {
            // 箭头函数的表达式体：{ return <expr>; }
            IrNode block = create(IrKind.BLOCK_STATEMENT, body, ctx);
            IrNode ret = create(IrKind.RETURN_STATEMENT, body, ctx);
            ret.setRef("argument", lowerExpression(body, ctx));
            block.setRefs("body", Collections.singletonList(ret.getId()));
            fn.setRef("body", block.getId());
        }
        int suspensions = ctx.getSuspensionCount();
        List<String> hoisted = ctx.exitFunction();

        fn.setBoolean("async", async);
        if (kind == IrKind.FUNCTION_EXPRESSION) {
            fn.setBoolean("arrow", arrow);
        }
        if (!hoisted.isEmpty()) {
            fn.meta().add("hoisted", strings(hoisted));
        }
        if (async) {
            fn.meta().addProperty("suspensionPoints", suspensions);
        }
        JsonObject overrides = ctx.options().getFunctionMeta();
        if (overrides != null) {
            for (Map.Entry<String, JsonElement> e : overrides.entrySet()) {
                fn.meta().add(e.getKey(), e.getValue().deepCopy());
            }
        }
        return fn.getId();
    }

    private List<String> lowerParams(JsonArray params, LoweringContext ctx) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            JsonObject p = params.get(i).getAsJsonObject();
            String t = type(p);
            switch (t) {
                case "Identifier":
                    out.add(paramIdentifier(p, ctx));
                    break;
                case "AssignmentPattern": {
                    JsonObject left = child(p, "left");
                    if (!"Identifier".equals(type(left))) {
                        throw unsupported(p, "Destructuring parameters are not supported");
                    }
                    IrNode node = create(IrKind.ASSIGNMENT_PATTERN, p, ctx);
                    node.setRef("target", paramIdentifier(left, ctx));
                    node.setRef("defaultValue", lowerExpression(child(p, "right"), ctx));
                    out.add(node.getId());
                    break;
                }
                case "RestElement": {
                    JsonObject arg = child(p, "argument");
                    if (!"Identifier".equals(type(arg))) {
                        throw unsupported(p, "Destructuring parameters are not supported");
                    }
                    if (i != params.size() - 1) {
                        throw unsupported(p, "Rest parameter must be last formal parameter");
                    }
                    IrNode node = create(IrKind.REST_ELEMENT, p, ctx);
                    node.setRef("argument", paramIdentifier(arg, ctx));
                    out.add(node.getId());
                    break;
                }
                case "ArrayPattern":
                case "ObjectPattern":
                    throw unsupported(p, "Destructuring parameters are not supported");
                default:
                    throw unsupported(p, "Unsupported parameter '" + t + "'");
            }
        }
        return out;
    }

    private String paramIdentifier(JsonObject id, LoweringContext ctx) {
        String name = str(id, "name");
        ctx.declare(name, "param", span(id));
        return ctx.builder().identifier(name, span(id)).getId();
    }

    // ========== 表达式 ==========

    String lowerExpression(JsonObject node, LoweringContext ctx) {
        String t = type(node);
        switch (t) {
            case "Identifier":
                return ctx.builder().identifier(str(node, "name"), span(node)).getId();
            case "Literal":
                return lowerLiteral(node, ctx);
            case "BinaryExpression":
                return lowerOperator(node, IrKind.BINARY_EXPRESSION, Operators.BINARY, ctx);
            case "LogicalExpression":
                return lowerOperator(node, IrKind.LOGICAL_EXPRESSION, Operators.LOGICAL, ctx);
            case "AssignmentExpression": {
                String op = checkOperator(node, Operators.ASSIGNMENT);
                JsonObject left = child(node, "left");
                String lt = type(left);
                if (("ArrayPattern".equals(lt) || "ObjectPattern".equals(lt)) && !"=".equals(op)) {
                    throw unsupported(node, "Invalid destructuring assignment with '" + op + "'");
                }
                IrNode expr = create(IrKind.ASSIGNMENT_EXPRESSION, node, ctx);
                expr.setString("operator", op);
                expr.setRef("left", patterns.lowerAssignmentTarget(left, ctx));
                expr.setRef("right", lowerExpression(child(node, "right"), ctx));
                return expr.getId();
            }
            case "UpdateExpression": {
                String op = checkOperator(node, Operators.UPDATE);
                JsonObject arg = child(node, "argument");
                if (!"Identifier".equals(type(arg)) && !"MemberExpression".equals(type(arg))) {
                    throw unsupported(node, "Invalid update target '" + type(arg) + "'");
                }
                if (hasOptionalLink(arg)) {
                    throw unsupported(arg, "Optional chaining is not a valid update target");
                }
                IrNode expr = create(IrKind.UPDATE_EXPRESSION, node, ctx);
                expr.setString("operator", op);
                expr.setRef("argument", lowerExpression(arg, ctx));
                expr.setBoolean("prefix", bool(node, "prefix"));
                return expr.getId();
            }
            case "UnaryExpression": {
                String op = checkOperator(node, Operators.UNARY);
                IrNode expr = create(IrKind.UNARY_EXPRESSION, node, ctx);
                expr.setString("operator", op);
                expr.setRef("argument", lowerExpression(child(node, "argument"), ctx));
                return expr.getId();
            }
            case "ConditionalExpression": {
                IrNode expr = create(IrKind.CONDITIONAL_EXPRESSION, node, ctx);
                expr.setRef("test", lowerExpression(child(node, "test"), ctx));
                expr.setRef("consequent", lowerExpression(child(node, "consequent"), ctx));
                expr.setRef("alternate", lowerExpression(child(node, "alternate"), ctx));
                return expr.getId();
            }
            case "CallExpression":
            case "NewExpression": {
                if (hasOptionalLink(node)) {
                    if ("NewExpression".equals(t)) {
                        throw unsupported(node, "Optional chaining cannot be used with 'new'");
                    }
                    return lowerChainLink(node, ctx);
                }
                IrNode expr = create("CallExpression".equals(t)
                        ? IrKind.CALL_EXPRESSION : IrKind.NEW_EXPRESSION, node, ctx);
                expr.setRef("callee", lowerExpression(child(node, "callee"), ctx));
                expr.setRefs("arguments", lowerArguments(list(node, "arguments"), ctx));
                return expr.getId();
            }
            case "MemberExpression":
                if (hasOptionalLink(node)) {
                    return lowerChainLink(node, ctx);
                }
                return lowerMember(node, ctx);
            case "ChainExpression": {
                JsonObject inner = child(node, "expression");
                String it = type(inner);
                if (!"MemberExpression".equals(it) && !"CallExpression".equals(it)) {
                    throw unsupported(inner, "Unsupported optional chain '" + it + "'");
                }
                return lowerChainLink(inner, ctx);
            }
            case "ArrayExpression": {
                IrNode expr = create(IrKind.ARRAY_EXPRESSION, node, ctx);
                List<String> elements = new ArrayList<>();
                for (JsonElement e : list(node, "elements")) {
                    if (e == null || e.isJsonNull()) {
                        elements.add(null);
                        continue;
                    }
                    elements.add(lowerSpreadable(e.getAsJsonObject(), ctx));
                }
                expr.setRefs("elements", elements);
                return expr.getId();
            }
            case "ObjectExpression":
                return lowerObject(node, ctx);
            case "FunctionExpression":
            case "ArrowFunctionExpression":
                return lowerFunction(node, IrKind.FUNCTION_EXPRESSION, ctx);
            case "ThisExpression":
                return create(IrKind.THIS_EXPRESSION, node, ctx).getId();
            case "TemplateLiteral":
                return lowerTemplate(node, ctx);
            case "AwaitExpression": {
                if (!ctx.isAsync()) {
                    throw unsupported(node, "'await' is only valid inside async functions");
                }
                IrNode expr = create(IrKind.AWAIT_EXPRESSION, node, ctx);
                expr.setRef("argument", lowerExpression(child(node, "argument"), ctx));
                expr.setInt("suspensionIndex", ctx.nextSuspensionIndex());
                return expr.getId();
            }
            default:
                throw unsupported(node, "Unsupported expression '" + t + "'");
        }
    }

    private String lowerLiteral(JsonObject node, LoweringContext ctx) {
        if (child(node, "regex") != null) {
            throw new UnsupportedConstructException("Regular expression literals are not supported",
                    "RegExpLiteral", span(node));
        }
        if (node.has("bigint") && !node.get("bigint").isJsonNull()) {
            throw new UnsupportedConstructException("BigInt literals are not supported",
                    "BigIntLiteral", span(node));
        }
        JsonElement value = node.get("value");
        if (value != null && !value.isJsonNull() && !value.isJsonPrimitive()) {
            throw unsupported(node, "Literal value must be a primitive");
        }
        IrNode lit = create(IrKind.LITERAL, node, ctx);
        lit.setField("value", value == null ? JsonNull.INSTANCE : value.deepCopy());
        lit.setString("raw", str(node, "raw"));
        return lit.getId();
    }

    private String lowerOperator(JsonObject node, IrKind kind, Set<String> allowed, LoweringContext ctx) {
        String op = checkOperator(node, allowed);
        IrNode expr = create(kind, node, ctx);
        expr.setString("operator", op);
        expr.setRef("left", lowerExpression(child(node, "left"), ctx));
        expr.setRef("right", lowerExpression(child(node, "right"), ctx));
        return expr.getId();
    }

    private String checkOperator(JsonObject node, Set<String> allowed) {
        String op = str(node, "operator");
        if (op == null || !allowed.contains(op)) {
            throw new UnsupportedConstructException("Unsupported operator '" + op + "' in " + type(node),
                    op, span(node));
        }
        return op;
    }

    String lowerMember(JsonObject node, LoweringContext ctx) {
        if (hasOptionalLink(node)) {
            throw unsupported(node, "Optional chaining is not a valid assignment target");
        }
        boolean computed = bool(node, "computed");
        JsonObject property = memberProperty(node);
        IrNode expr = create(IrKind.MEMBER_EXPRESSION, node, ctx);
        expr.setRef("object", lowerExpression(child(node, "object"), ctx));
        expr.setRef("property", lowerExpression(property, ctx));
        expr.setBoolean("computed", computed);
        return expr.getId();
    }

    private static JsonObject memberProperty(JsonObject node) {
        JsonObject property = child(node, "property");
        if (!bool(node, "computed") && !"Identifier".equals(type(property))) {
            throw unsupported(property, "Unsupported member property '" + type(property) + "'");
        }
        return property;
    }

    // ========== 可选链 ==========

    /** 沿 object/callee 向下，链上是否有 ?. */
    static boolean hasOptionalLink(JsonObject node) {
        JsonObject current = node;
        while (true) {
            String t = type(current);
            if ("MemberExpression".equals(t)) {
                if (bool(current, "optional")) return true;
                current = child(current, "object");
            } else if ("CallExpression".equals(t)) {
                if (bool(current, "optional")) return true;
                current = child(current, "callee");
            } else {
                return false;
            }
        }
    }

    /**
     * 可选链中的一环。链上的成员访问与调用全部降级为可选种类，
     * 遇到链以外的节点（包括括号隔开的 ChainExpression）时回到普通降级。
     */
    private String lowerChainLink(JsonObject node, LoweringContext ctx) {
        String t = type(node);
        if ("MemberExpression".equals(t)) {
            boolean computed = bool(node, "computed");
            JsonObject property = memberProperty(node);
            IrNode expr = create(IrKind.OPTIONAL_MEMBER_EXPRESSION, node, ctx);
            expr.setRef("object", lowerChainOperand(child(node, "object"), ctx));
            expr.setRef("property", lowerExpression(property, ctx));
            expr.setBoolean("computed", computed);
            expr.setBoolean("optional", bool(node, "optional"));
            return expr.getId();
        }
        IrNode expr = create(IrKind.OPTIONAL_CALL_EXPRESSION, node, ctx);
        expr.setRef("callee", lowerChainOperand(child(node, "callee"), ctx));
        expr.setRefs("arguments", lowerArguments(list(node, "arguments"), ctx));
        expr.setBoolean("optional", bool(node, "optional"));
        return expr.getId();
    }

    private String lowerChainOperand(JsonObject node, LoweringContext ctx) {
        String t = type(node);
        if ("MemberExpression".equals(t) || "CallExpression".equals(t)) {
            return lowerChainLink(node, ctx);
        }
        return lowerExpression(node, ctx);
    }

    // ========== 模板字符串与展开 ==========

    private String lowerTemplate(JsonObject node, LoweringContext ctx) {
        JsonArray quasis = list(node, "quasis");
        JsonArray expressions = list(node, "expressions");
        if (quasis.size() != expressions.size() + 1) {
            throw unsupported(node, "TemplateLiteral needs one more quasi than expressions");
        }
        IrNode expr = create(IrKind.TEMPLATE_LITERAL, node, ctx);
        List<String> cooked = new ArrayList<>();
        for (JsonElement e : quasis) {
            JsonObject quasi = e.getAsJsonObject();
            JsonObject value = child(quasi, "value");
            JsonElement text = value == null ? null : value.get("cooked");
            if (text == null || !text.isJsonPrimitive()) {
                throw unsupported(quasi, "Template element has no cooked text");
            }
            cooked.add(text.getAsString());
        }
        List<String> parts = new ArrayList<>();
        for (JsonElement e : expressions) {
            parts.add(lowerExpression(e.getAsJsonObject(), ctx));
        }
        expr.setStrings("quasis", cooked);
        expr.setRefs("expressions", parts);
        return expr.getId();
    }

    /** 调用参数或数组元素：允许 SpreadElement */
    private String lowerSpreadable(JsonObject node, LoweringContext ctx) {
        if (!"SpreadElement".equals(type(node))) {
            return lowerExpression(node, ctx);
        }
        IrNode spread = create(IrKind.SPREAD_ELEMENT, node, ctx);
        spread.setRef("argument", lowerExpression(child(node, "argument"), ctx));
        return spread.getId();
    }

    private String lowerObject(JsonObject node, LoweringContext ctx) {
        IrNode expr = create(IrKind.OBJECT_EXPRESSION, node, ctx);
        List<String> properties = new ArrayList<>();
        for (JsonElement e : list(node, "properties")) {
            JsonObject p = e.getAsJsonObject();
            if (!"Property".equals(type(p))) {
                throw unsupported(p, "Unsupported object member '" + type(p) + "'");
            }
            if (!"init".equals(str(p, "kind"))) {
                throw unsupported(p, "Getters and setters are not supported");
            }
            IrNode prop = create(IrKind.PROPERTY, p, ctx);
            prop.setRef("key", lowerPropertyKey(p, ctx));
            prop.setRef("value", lowerExpression(child(p, "value"), ctx));
            prop.setBoolean("computed", bool(p, "computed"));
            prop.setBoolean("shorthand", bool(p, "shorthand"));
            properties.add(prop.getId());
        }
        expr.setRefs("properties", properties);
        return expr.getId();
    }

    /** 属性键：非计算键只接受标识符与字面量 */
    String lowerPropertyKey(JsonObject property, LoweringContext ctx) {
        JsonObject key = child(property, "key");
        if (!bool(property, "computed")) {
            String kt = type(key);
            if (!"Identifier".equals(kt) && !"Literal".equals(kt)) {
                throw unsupported(key, "Unsupported property key '" + kt + "'");
            }
        }
        return lowerExpression(key, ctx);
    }

    private List<String> lowerArguments(JsonArray args, LoweringContext ctx) {
        List<String> out = new ArrayList<>();
        for (JsonElement e : args) {
            out.add(lowerSpreadable(e.getAsJsonObject(), ctx));
        }
        return out;
    }

    // ========== 辅助方法 ==========

    IrNode create(IrKind kind, JsonObject source, LoweringContext ctx) {
        return ctx.builder().create(kind, span(source));
    }

    static UnsupportedConstructException unsupported(JsonObject node, String message) {
        return new UnsupportedConstructException(message, type(node), span(node));
    }

    static String type(JsonObject node) {
        JsonElement t = node == null ? null : node.get("type");
        return t == null || t.isJsonNull() ? null : t.getAsString();
    }

    static SourceSpan span(JsonObject node) {
        return node == null ? null : SourceSpan.fromJson(node.get("span"));
    }

    static JsonObject child(JsonObject node, String key) {
        JsonElement e = node.get(key);
        return e == null || !e.isJsonObject() ? null : e.getAsJsonObject();
    }

    static JsonArray list(JsonObject node, String key) {
        JsonElement e = node.get(key);
        return e == null || !e.isJsonArray() ? new JsonArray() : e.getAsJsonArray();
    }

    static String str(JsonObject node, String key) {
        JsonElement e = node.get(key);
        return e == null || e.isJsonNull() ? null : e.getAsString();
    }

    static boolean bool(JsonObject node, String key) {
        JsonElement e = node.get(key);
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isBoolean() && e.getAsBoolean();
    }

    private static JsonArray strings(List<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) {
            arr.add(v);
        }
        return arr;
    }
}
