package com.luascript.ir.pass;

import com.luascript.compiler.compiler.CompileOptions;
import com.luascript.ir.node.IrDocument;

/**
 * IR pass 接口。
 */
public interface IrPass {

    /**
     * Pass 名称（用于日志/调试）。
     */
    String getName();

    /**
     * 当前编译选项下是否执行。
     */
    default boolean isEnabled(CompileOptions options) {
        return true;
    }

    /**
     * 对 IR 文档执行变换，可原地修改。
     */
    IrDocument run(IrDocument document);
}
