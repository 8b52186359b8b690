package com.typelens.compiler.analysis.types;

import java.util.Iterator;
import java.util.List;

/**
 * 类型相同性判断：两个类型是否表示完全相同的类型。
 *
 * <p>比双向可赋值更严格：对象成员必须有相同的值类型、相同的 readonly 标记和相同的可选标记。
 * 例如 {@code { readonly a: number }} 与 {@code { a: number }} 可以互相赋值，但并不相同。</p>
 */
public final class TypeEquality {

    private TypeEquality() {}

    public static boolean isIdentical(LensType a, LensType b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a.getClass() != b.getClass()) return false;
        return a.accept(new IdentityVisitor(b));
    }

    private static final class IdentityVisitor implements LensTypeVisitor<Boolean> {

        private final LensType other;

        IdentityVisitor(LensType other) {
            this.other = other;
        }

        @Override
        public Boolean visitPrimitive(PrimitiveLensType type) {
            return type.equals(other);
        }

        @Override
        public Boolean visitLiteral(LiteralLensType type) {
            return type.equals(other);
        }

        @Override
        public Boolean visitObject(ObjectLensType type) {
            ObjectLensType that = (ObjectLensType) other;
            List<String> keys = type.keys();
            if (keys.size() != that.keys().size()) return false;
            for (String key : keys) {
                MemberSignature left = type.getMember(key);
                MemberSignature right = that.getMember(key);
                if (right == null) return false;
                if (left.isReadonly() != right.isReadonly()) return false;
                if (left.isOptional() != right.isOptional()) return false;
                if (!isIdentical(left.getReadType(), right.getReadType())) return false;
            }
            if (type.hasIndexSignature() != that.hasIndexSignature()) return false;
            return !type.hasIndexSignature() || isIdentical(type.getIndexType(), that.getIndexType());
        }

        @Override
        public Boolean visitFunction(FunctionLensType type) {
            FunctionLensType that = (FunctionLensType) other;
            if (type.isConstructor() != that.isConstructor()) return false;
            if (type.getParams().size() != that.getParams().size()) return false;
            for (int i = 0; i < type.getParams().size(); i++) {
                FunctionLensType.Param left = type.getParams().get(i);
                FunctionLensType.Param right = that.getParams().get(i);
                if (left.isOptional() != right.isOptional() || left.isRest() != right.isRest()) return false;
                if (!isIdentical(left.getType(), right.getType())) return false;
            }
            return isIdentical(type.getReturnType(), that.getReturnType());
        }

        @Override
        public Boolean visitArray(ArrayLensType type) {
            ArrayLensType that = (ArrayLensType) other;
            return type.isReadonly() == that.isReadonly()
                    && isIdentical(type.getElementType(), that.getElementType());
        }

        @Override
        public Boolean visitUnion(UnionLensType type) {
            UnionLensType that = (UnionLensType) other;
            if (type.getAlternatives().size() != that.getAlternatives().size()) return false;
            Iterator<LensType> it = type.getAlternatives().iterator();
            while (it.hasNext()) {
                if (!containsIdentical(that, it.next())) return false;
            }
            return true;
        }

        @Override
        public Boolean visitAny(AnyType type) {
            return type == other;
        }

        @Override
        public Boolean visitNever(NeverType type) {
            return true;
        }

        @Override
        public Boolean visitError(ErrorType type) {
            return true;
        }

        private static boolean containsIdentical(UnionLensType union, LensType candidate) {
            for (LensType alt : union.getAlternatives()) {
                if (isIdentical(alt, candidate)) return true;
            }
            return false;
        }
    }
}
