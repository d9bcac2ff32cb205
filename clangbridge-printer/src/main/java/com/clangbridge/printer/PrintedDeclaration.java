package com.clangbridge.printer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一条打印完成的声明。
 * <p>
 * 含无法表示的类型时文本中带占位注释，{@link #isUsable()} 为 false，
 * 由上层决定省略、告警还是原样输出。
 */
public final class PrintedDeclaration {

    private final OutputLanguageMode mode;
    private final String text;
    private final List<String> unrepresentableTypes;
    private final boolean droppedOptionality;

    public PrintedDeclaration(OutputLanguageMode mode, String text,
                              List<String> unrepresentableTypes, boolean droppedOptionality) {
        this.mode = mode;
        this.text = text;
        this.unrepresentableTypes = unrepresentableTypes == null || unrepresentableTypes.isEmpty()
                ? Collections.<String>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(unrepresentableTypes));
        this.droppedOptionality = droppedOptionality;
    }

    public OutputLanguageMode getMode() {
        return mode;
    }

    public String getText() {
        return text;
    }

    /** 所有无法表示的类型描述，按出现顺序（返回值在前） */
    public List<String> getUnrepresentableTypes() {
        return unrepresentableTypes;
    }

    public boolean isUsable() {
        return unrepresentableTypes.isEmpty();
    }

    /** 是否有可选性因目标类型无法标注而被丢弃 */
    public boolean hasDroppedOptionality() {
        return droppedOptionality;
    }

    @Override
    public String toString() {
        return text;
    }
}
