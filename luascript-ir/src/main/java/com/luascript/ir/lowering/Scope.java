package com.luascript.ir.lowering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 词法作用域。函数作用域额外记录被提升的 var 名称。
 */
final class Scope {

    enum Kind { FUNCTION, BLOCK }

    private final Kind kind;
    private final Scope parent;
    /** 名称 → 声明种类（var/let/const/function/param） */
    private final Map<String, String> bindings = new LinkedHashMap<>();
    private final List<String> hoisted = new ArrayList<>();

    Scope(Kind kind, Scope parent) {
        this.kind = kind;
        this.parent = parent;
    }

    Kind getKind() { return kind; }

    Scope getParent() { return parent; }

    boolean isFunctionScope() { return kind == Kind.FUNCTION; }

    String lookupLocal(String name) {
        return bindings.get(name);
    }

    void put(String name, String declKind) {
        bindings.put(name, declKind);
    }

    void hoist(String name) {
        if (!hoisted.contains(name)) {
            hoisted.add(name);
        }
    }

    List<String> getHoisted() { return hoisted; }

    /** 最近的函数作用域 */
    Scope functionScope() {
        Scope s = this;
        while (!s.isFunctionScope()) {
            s = s.parent;
        }
        return s;
    }
}
