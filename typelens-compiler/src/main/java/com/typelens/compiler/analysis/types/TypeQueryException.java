package com.typelens.compiler.analysis.types;

/**
 * 类型查询的输入不合法（Malformed-Input）。
 *
 * <p>由分类器与工具类型在边界处抛出；检查器在调用处将其转换为 ERROR 诊断。</p>
 */
public class TypeQueryException extends RuntimeException {

    public enum Kind {
        /** 目标形状中不存在的键 */
        UNKNOWN_KEY,
        /** 需要对象形状的位置给出了其他类型 */
        NOT_AN_OBJECT_SHAPE,
        /** 需要单个数值字面量类型的位置给出了其他类型 */
        NOT_A_NUMERIC_LITERAL,
        /** 键集合参数不是字符串字面量（或其联合） */
        NOT_A_KEY_SET,
        /** 值类别与形状的任何成员都不兼容 */
        INCOMPATIBLE_CATEGORY,
        /** 工具类型参数个数或种类不正确 */
        BAD_ARGUMENT
    }

    private final Kind kind;

    public TypeQueryException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    static TypeQueryException unknownKey(ObjectLensType shape, String key) {
        return new TypeQueryException(Kind.UNKNOWN_KEY,
                "类型 '" + shape.toDisplayString() + "' 中不存在键 '" + key + "'");
    }
}
