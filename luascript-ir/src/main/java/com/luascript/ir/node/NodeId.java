package com.luascript.ir.node;

import java.util.Comparator;
import java.util.regex.Pattern;

/**
 * 节点 ID 工具：{@code <category>_<digits>}，digits 为平衡三进制。
 */
public final class NodeId {

    public static final Pattern PATTERN = Pattern.compile("^[A-Za-z]+_[T01]+$");

    /** 规范顺序：先按类别，再按解码后的数值 */
    public static final Comparator<String> ORDER = NodeId::compare;

    private NodeId() {}

    public static String format(String category, long value) {
        if (category == null || category.isEmpty() || !category.chars().allMatch(Character::isLetter)) {
            throw new FormatException("Invalid id category: " + category, category);
        }
        return category + "_" + BalancedTernary.encode(value);
    }

    public static String format(NodeCategory category, long value) {
        return format(category.getPrefix(), value);
    }

    public static boolean isValid(String id) {
        return id != null && PATTERN.matcher(id).matches();
    }

    /**
     * 解析 ID。
     *
     * @throws FormatException 格式不符或数值越界
     */
    public static Parsed parse(String id) {
        if (!isValid(id)) {
            throw new FormatException("Malformed node id: " + id, id);
        }
        int sep = id.indexOf('_');
        String category = id.substring(0, sep);
        return new Parsed(category, BalancedTernary.decode(id.substring(sep + 1)));
    }

    public static int compare(String a, String b) {
        Parsed pa = parse(a);
        Parsed pb = parse(b);
        int c = pa.getCategory().compareTo(pb.getCategory());
        if (c != 0) return c;
        return Long.compare(pa.getValue(), pb.getValue());
    }

    /**
     * 解析结果。
     */
    public static final class Parsed {
        private final String category;
        private final long value;

        Parsed(String category, long value) {
            this.category = category;
            this.value = value;
        }

        public String getCategory() {
            return category;
        }

        public long getValue() {
            return value;
        }
    }
}
