package com.typelens.compiler.analysis.types;

import java.util.List;

/**
 * 类型兼容性判断：判断 source 是否可以赋值给 target（严格空检查下的结构化规则）。
 *
 * <p>成员的 readonly 修饰不影响可赋值性，因此双向可赋值不等于类型相同，
 * 相同性判断见 {@link TypeEquality}。</p>
 */
public final class TypeCompatibility {

    private TypeCompatibility() {}

    /**
     * 判断 source 类型是否可以赋值给 target 类型。
     */
    public static boolean isAssignable(LensType target, LensType source) {
        if (target == null || source == null) return true;

        // ErrorType 与任何类型兼容
        if (target instanceof ErrorType || source instanceof ErrorType) return true;

        // never 是所有类型的子类型
        if (source instanceof NeverType) return true;

        // any / unknown 接受所有类型
        if (target instanceof AnyType) return true;

        // any 可赋给除 never 外的任何类型，unknown 只能赋给顶类型
        if (source instanceof AnyType) {
            return !((AnyType) source).isUnknown() && !(target instanceof NeverType);
        }
        if (target instanceof NeverType) return false;

        // 联合源：每个成员都必须可赋值
        if (source instanceof UnionLensType) {
            for (LensType alt : ((UnionLensType) source).getAlternatives()) {
                if (!isAssignable(target, alt)) return false;
            }
            return true;
        }

        // 联合目标：至少一个成员接受
        if (target instanceof UnionLensType) {
            for (LensType alt : ((UnionLensType) target).getAlternatives()) {
                if (isAssignable(alt, source)) return true;
            }
            return false;
        }

        if (target instanceof LiteralLensType) {
            return target.equals(source);
        }

        if (target instanceof PrimitiveLensType) {
            return isPrimitiveAssignable((PrimitiveLensType) target, source);
        }

        if (target instanceof ObjectLensType) {
            ObjectLensType objTarget = (ObjectLensType) target;
            if (source instanceof ObjectLensType) {
                return isObjectAssignable(objTarget, (ObjectLensType) source);
            }
            // 原始值、函数、数组只能赋给空形状 {}（null/undefined/void 除外）
            if (source instanceof PrimitiveLensType && ((PrimitiveLensType) source).isNullish()) return false;
            return objTarget.isEmpty();
        }

        if (target instanceof FunctionLensType && source instanceof FunctionLensType) {
            return isFunctionAssignable((FunctionLensType) target, (FunctionLensType) source);
        }

        if (target instanceof ArrayLensType && source instanceof ArrayLensType) {
            ArrayLensType arrTarget = (ArrayLensType) target;
            ArrayLensType arrSource = (ArrayLensType) source;
            // 只读数组不能赋给可变数组
            if (arrSource.isReadonly() && !arrTarget.isReadonly()) return false;
            return isAssignable(arrTarget.getElementType(), arrSource.getElementType());
        }

        return false;
    }

    /**
     * 双向可赋值（日常意义上的"等价"），比 {@link TypeEquality#isIdentical} 宽松。
     */
    public static boolean isMutuallyAssignable(LensType a, LensType b) {
        return isAssignable(a, b) && isAssignable(b, a);
    }

    private static boolean isPrimitiveAssignable(PrimitiveLensType target, LensType source) {
        if (source instanceof LiteralLensType) {
            return target.equals(((LiteralLensType) source).widen());
        }
        if (source instanceof PrimitiveLensType) {
            if (target.equals(source)) return true;
            // undefined 可赋给 void
            if (LensTypes.VOID.equals(target) && LensTypes.UNDEFINED.equals(source)) return true;
            // Function 也是 object
            return LensTypes.OBJECT.equals(target) && LensTypes.FUNCTION.equals(source);
        }
        if (LensTypes.FUNCTION.equals(target)) {
            return source instanceof FunctionLensType;
        }
        if (LensTypes.OBJECT.equals(target)) {
            return source instanceof ObjectLensType
                    || source instanceof FunctionLensType
                    || source instanceof ArrayLensType;
        }
        return false;
    }

    private static boolean isObjectAssignable(ObjectLensType target, ObjectLensType source) {
        for (MemberSignature targetMember : target.getMembers()) {
            MemberSignature sourceMember = source.getMember(targetMember.getName());
            if (sourceMember == null) {
                // 缺失的成员只有在目标中可选时才允许
                if (!targetMember.isOptional()) return false;
                continue;
            }
            if (sourceMember.isOptional() && !targetMember.isOptional()) return false;
            if (!isAssignable(targetMember.getReadType(), sourceMember.getReadType())) return false;
        }

        LensType indexType = target.getIndexType();
        if (indexType != null) {
            for (MemberSignature sourceMember : source.getMembers()) {
                if (!isAssignable(indexType, sourceMember.getReadType())) return false;
            }
            if (source.hasIndexSignature() && !isAssignable(indexType, source.getIndexType())) return false;
        }
        return true;
    }

    private static boolean isFunctionAssignable(FunctionLensType target, FunctionLensType source) {
        if (target.isConstructor() != source.isConstructor()) return false;

        // 源可以少声明参数，但必需参数不能多于目标能提供的参数
        List<FunctionLensType.Param> targetParams = target.getParams();
        List<FunctionLensType.Param> sourceParams = source.getParams();
        if (source.requiredParamCount() > targetParams.size() && !target.hasRest()) return false;

        int shared = Math.min(targetParams.size(), sourceParams.size());
        for (int i = 0; i < shared; i++) {
            // 参数逆变
            if (!isAssignable(sourceParams.get(i).getType(), targetParams.get(i).getType())) {
                return false;
            }
        }

        // 返回 void 的目标接受任何返回值
        if (LensTypes.VOID.equals(target.getReturnType())) return true;
        return isAssignable(target.getReturnType(), source.getReturnType());
    }
}
