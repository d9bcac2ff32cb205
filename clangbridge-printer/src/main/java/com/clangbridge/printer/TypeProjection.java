package com.clangbridge.printer;

import java.util.Objects;

/**
 * 单个类型的投影结果：目标方言文本，或 "无法表示" 及其源类型描述。
 */
public final class TypeProjection {

    private final String text;
    private final String unrepresentableDescription;
    private final boolean optionalityDropped;

    private TypeProjection(String text, String unrepresentableDescription, boolean optionalityDropped) {
        this.text = text;
        this.unrepresentableDescription = unrepresentableDescription;
        this.optionalityDropped = optionalityDropped;
    }

    public static TypeProjection ok(String text) {
        return new TypeProjection(Objects.requireNonNull(text, "text"), null, false);
    }

    /** 可选性因目标类型无法承载而被丢弃 */
    public static TypeProjection okDroppingOptionality(String text) {
        return new TypeProjection(Objects.requireNonNull(text, "text"), null, true);
    }

    public static TypeProjection unrepresentable(String description) {
        return new TypeProjection(null, Objects.requireNonNull(description, "description"), false);
    }

    public boolean isRepresentable() {
        return text != null;
    }

    /** 可表示时的文本；不可表示时返回 null */
    public String getText() {
        return text;
    }

    /** 不可表示时的源类型描述；可表示时返回 null */
    public String getUnrepresentableDescription() {
        return unrepresentableDescription;
    }

    public boolean isOptionalityDropped() {
        return optionalityDropped;
    }

    /** 写出文本，不可表示时写出占位注释 */
    public void printTo(StringBuilder os) {
        if (text != null) {
            os.append(text);
        } else {
            ClangSyntaxPrinter.printPlaceholderComment(os, unrepresentableDescription);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        printTo(sb);
        return sb.toString();
    }
}
