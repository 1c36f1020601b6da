package com.luascript.ir.node;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.luascript.ir.node.FieldSpec.bool;
import static com.luascript.ir.node.FieldSpec.integer;
import static com.luascript.ir.node.FieldSpec.node;
import static com.luascript.ir.node.FieldSpec.nodes;
import static com.luascript.ir.node.FieldSpec.optionalNode;
import static com.luascript.ir.node.FieldSpec.optionalString;
import static com.luascript.ir.node.FieldSpec.sparseNodes;
import static com.luascript.ir.node.FieldSpec.string;
import static com.luascript.ir.node.FieldSpec.strings;
import static com.luascript.ir.node.FieldSpec.value;

/**
 * IR 节点种类（固定词表）及每种节点的负载结构。
 */
public enum IrKind {
    // 模块与声明
    PROGRAM("Program", NodeCategory.MODULE, nodes("body")),
    FUNCTION_DECLARATION("FunctionDeclaration", NodeCategory.DECLARATION,
            string("name"), nodes("params"), node("body"), bool("async")),
    FUNCTION_EXPRESSION("FunctionExpression", NodeCategory.EXPRESSION,
            optionalString("name"), nodes("params"), node("body"), bool("async"), bool("arrow")),
    VARIABLE_DECLARATION("VariableDeclaration", NodeCategory.DECLARATION,
            string("declarationKind"), nodes("declarations")),
    VARIABLE_DECLARATOR("VariableDeclarator", NodeCategory.DECLARATION,
            string("declarationKind"), node("target"), optionalNode("init")),

    // 语句
    BLOCK_STATEMENT("BlockStatement", NodeCategory.STATEMENT, nodes("body")),
    EXPRESSION_STATEMENT("ExpressionStatement", NodeCategory.STATEMENT, node("expression")),
    IF_STATEMENT("IfStatement", NodeCategory.STATEMENT,
            node("test"), node("consequent"), optionalNode("alternate")),
    WHILE_STATEMENT("WhileStatement", NodeCategory.STATEMENT, node("test"), node("body")),
    DO_WHILE_STATEMENT("DoWhileStatement", NodeCategory.STATEMENT, node("test"), node("body")),
    FOR_STATEMENT("ForStatement", NodeCategory.STATEMENT,
            optionalNode("init"), optionalNode("test"), optionalNode("update"), node("body")),
    FOR_IN_STATEMENT("ForInStatement", NodeCategory.STATEMENT, node("left"), node("right"), node("body")),
    FOR_OF_STATEMENT("ForOfStatement", NodeCategory.STATEMENT, node("left"), node("right"), node("body")),
    SWITCH_STATEMENT("SwitchStatement", NodeCategory.STATEMENT, node("discriminant"), nodes("cases")),
    SWITCH_CASE("SwitchCase", NodeCategory.CLAUSE, optionalNode("test"), nodes("consequent")),
    RETURN_STATEMENT("ReturnStatement", NodeCategory.STATEMENT, optionalNode("argument")),
    BREAK_STATEMENT("BreakStatement", NodeCategory.STATEMENT),
    CONTINUE_STATEMENT("ContinueStatement", NodeCategory.STATEMENT),
    THROW_STATEMENT("ThrowStatement", NodeCategory.STATEMENT, node("argument")),
    TRY_STATEMENT("TryStatement", NodeCategory.STATEMENT,
            node("block"), optionalNode("handler"), optionalNode("finalizer")),
    CATCH_CLAUSE("CatchClause", NodeCategory.CLAUSE, optionalNode("param"), node("body")),

    // 表达式
    BINARY_EXPRESSION("BinaryExpression", NodeCategory.EXPRESSION,
            string("operator"), node("left"), node("right")),
    LOGICAL_EXPRESSION("LogicalExpression", NodeCategory.EXPRESSION,
            string("operator"), node("left"), node("right")),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", NodeCategory.EXPRESSION,
            string("operator"), node("left"), node("right")),
    UPDATE_EXPRESSION("UpdateExpression", NodeCategory.EXPRESSION,
            string("operator"), node("argument"), bool("prefix")),
    UNARY_EXPRESSION("UnaryExpression", NodeCategory.EXPRESSION, string("operator"), node("argument")),
    CONDITIONAL_EXPRESSION("ConditionalExpression", NodeCategory.EXPRESSION,
            node("test"), node("consequent"), node("alternate")),
    CALL_EXPRESSION("CallExpression", NodeCategory.EXPRESSION, node("callee"), nodes("arguments")),
    NEW_EXPRESSION("NewExpression", NodeCategory.EXPRESSION, node("callee"), nodes("arguments")),
    MEMBER_EXPRESSION("MemberExpression", NodeCategory.EXPRESSION,
            node("object"), node("property"), bool("computed")),
    ARRAY_EXPRESSION("ArrayExpression", NodeCategory.EXPRESSION, sparseNodes("elements")),
    OBJECT_EXPRESSION("ObjectExpression", NodeCategory.EXPRESSION, nodes("properties")),
    PROPERTY("Property", NodeCategory.CLAUSE,
            node("key"), node("value"), bool("computed"), bool("shorthand")),
    IDENTIFIER("Identifier", NodeCategory.EXPRESSION, string("name")),
    LITERAL("Literal", NodeCategory.EXPRESSION, value("value"), optionalString("raw")),
    AWAIT_EXPRESSION("AwaitExpression", NodeCategory.EXPRESSION, node("argument"), integer("suspensionIndex")),
    THIS_EXPRESSION("ThisExpression", NodeCategory.EXPRESSION),
    /** 只出现在调用参数与数组元素中 */
    SPREAD_ELEMENT("SpreadElement", NodeCategory.EXPRESSION, node("argument")),
    /** quasis 为各段的转义后文本，比 expressions 多一段 */
    TEMPLATE_LITERAL("TemplateLiteral", NodeCategory.EXPRESSION, strings("quasis"), nodes("expressions")),

    // 可选链：链上每一环都用可选种类，optional 标出 ?. 所在位置，最外层一环是短路边界
    OPTIONAL_MEMBER_EXPRESSION("OptionalMemberExpression", NodeCategory.EXPRESSION,
            node("object"), node("property"), bool("computed"), bool("optional")),
    OPTIONAL_CALL_EXPRESSION("OptionalCallExpression", NodeCategory.EXPRESSION,
            node("callee"), nodes("arguments"), bool("optional")),

    // 解构模式
    ARRAY_PATTERN("ArrayPattern", NodeCategory.PATTERN, sparseNodes("elements")),
    OBJECT_PATTERN("ObjectPattern", NodeCategory.PATTERN, nodes("properties")),
    REST_ELEMENT("RestElement", NodeCategory.PATTERN, node("argument")),
    ASSIGNMENT_PATTERN("AssignmentPattern", NodeCategory.PATTERN, node("target"), node("defaultValue"));

    private static final Map<String, IrKind> BY_TAG = new HashMap<>();

    static {
        for (IrKind k : values()) {
            BY_TAG.put(k.tag, k);
        }
    }

    private final String tag;
    private final NodeCategory category;
    private final List<FieldSpec> fields;

    IrKind(String tag, NodeCategory category, FieldSpec... fields) {
        this.tag = tag;
        this.category = category;
        this.fields = Collections.unmodifiableList(Arrays.asList(fields));
    }

    /** 序列化时使用的标签 */
    public String getTag() {
        return tag;
    }

    public NodeCategory getCategory() {
        return category;
    }

    public List<FieldSpec> getFields() {
        return fields;
    }

    public FieldSpec getField(String name) {
        for (FieldSpec f : fields) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    /** 按标签查找；未知标签返回 null */
    public static IrKind fromTag(String tag) {
        return tag == null ? null : BY_TAG.get(tag);
    }

    public boolean isFunction() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION;
    }

    public boolean isLoop() {
        return this == WHILE_STATEMENT || this == DO_WHILE_STATEMENT || this == FOR_STATEMENT
                || this == FOR_IN_STATEMENT || this == FOR_OF_STATEMENT;
    }

    /** 可选链中的一环 */
    public boolean isOptionalChain() {
        return this == OPTIONAL_MEMBER_EXPRESSION || this == OPTIONAL_CALL_EXPRESSION;
    }

    public boolean isPattern() {
        return category == NodeCategory.PATTERN;
    }
}
