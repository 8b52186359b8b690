package com.typelens.compiler.analysis.types;

import com.typelens.compiler.analysis.SemanticDiagnostic;
import com.typelens.compiler.analysis.classify.KeySet;
import com.typelens.compiler.analysis.classify.KeySetExtractor;
import com.typelens.compiler.analysis.classify.ShapeTransforms;
import com.typelens.compiler.ast.AstNode;
import com.typelens.compiler.ast.decl.TypeAliasDecl;
import com.typelens.compiler.ast.expr.Literal;
import com.typelens.compiler.ast.type.*;

import java.util.*;

/**
 * 将 AST TypeRef 求值为结构化 LensType。
 *
 * <p>维护别名环境与类型参数作用域栈（实例化泛型别名时 push，结束时 pop）。
 * 非泛型别名只求值一次并缓存；正在求值的别名再次被引用即为循环别名。</p>
 *
 * <p>工具类型抛出的 {@link TypeQueryException} 在调用处转换为 ERROR 诊断，
 * 结果变为 {@link ErrorType}。任一操作数已是 ErrorType 时直接返回 ErrorType，不再重复报告。</p>
 */
public final class TypeResolver implements TypeRefVisitor<LensType> {

    private final UtilityTypes utilities;
    private final List<SemanticDiagnostic> diagnostics;

    // 类型别名注册：name → 声明
    private final Map<String, TypeAliasDecl> aliases = new LinkedHashMap<String, TypeAliasDecl>();
    // 非泛型别名求值缓存
    private final Map<String, LensType> aliasCache = new HashMap<String, LensType>();
    // 正在求值的别名
    private final Set<String> resolving = new LinkedHashSet<String>();

    // 类型参数作用域栈；只有栈顶可见（别名体不能看到调用方的类型参数）
    private final Deque<Map<String, LensType>> typeParamStack = new ArrayDeque<Map<String, LensType>>();

    public TypeResolver(UtilityTypes utilities, List<SemanticDiagnostic> diagnostics) {
        this.utilities = utilities;
        this.diagnostics = diagnostics;
    }

    // ============ 别名注册 ============

    /**
     * 注册类型别名
     *
     * @return false 表示已存在同名别名
     */
    public boolean registerAlias(TypeAliasDecl decl) {
        if (aliases.containsKey(decl.getName())) return false;
        aliases.put(decl.getName(), decl);
        return true;
    }

    public boolean hasAlias(String name) {
        return aliases.containsKey(name);
    }

    /**
     * 求值非泛型别名（带缓存）。
     */
    public LensType resolveAlias(String name, AstNode site) {
        TypeAliasDecl decl = aliases.get(name);
        if (decl == null) {
            error("未知类型 '" + name + "'", site);
            return LensTypes.ERROR;
        }
        LensType cached = aliasCache.get(name);
        if (cached != null) return cached;

        if (!resolving.add(name)) {
            error("类型别名 '" + name + "' 循环引用自身", site);
            return LensTypes.ERROR;
        }
        typeParamStack.push(Collections.<String, LensType>emptyMap());
        try {
            LensType result = resolve(decl.getAliasedType());
            aliasCache.put(name, result);
            return result;
        } finally {
            typeParamStack.pop();
            resolving.remove(name);
        }
    }

    // ============ 求值 ============

    /**
     * 将 TypeRef AST 节点求值为 LensType。
     */
    public LensType resolve(TypeRef ref) {
        LensType type = ref.accept(this);
        if (typeParamStack.size() <= 1 && currentScope().isEmpty()) {
            ref.setResolvedType(type);
        }
        return type;
    }

    @Override
    public LensType visitSimple(SimpleType type) {
        String name = type.getName();

        LensType param = currentScope().get(name);
        if (param != null) return param;

        LensType builtin = LensTypes.fromName(name);
        if (builtin != null) return builtin;

        TypeAliasDecl alias = aliases.get(name);
        if (alias != null) {
            if (alias.isGeneric()) {
                error("泛型类型 '" + name + "' 需要 " + alias.getTypeParams().size() + " 个类型参数", type);
                return LensTypes.ERROR;
            }
            return resolveAlias(name, type);
        }

        if (UtilityTypes.isUtility(name)) {
            return applyUtility(name, Collections.<TypeRef>emptyList(), type);
        }

        error("未知类型 '" + name + "'", type);
        return LensTypes.ERROR;
    }

    @Override
    public LensType visitGeneric(GenericType type) {
        String name = type.getName();
        TypeAliasDecl alias = aliases.get(name);
        if (alias != null) {
            return instantiate(alias, type);
        }
        if (UtilityTypes.isUtility(name)) {
            return applyUtility(name, type.getTypeArgs(), type);
        }
        if (currentScope().containsKey(name) || LensTypes.fromName(name) != null) {
            error("类型 '" + name + "' 不是泛型", type);
        } else {
            error("未知类型 '" + name + "'", type);
        }
        return LensTypes.ERROR;
    }

    private LensType instantiate(TypeAliasDecl alias, GenericType site) {
        List<String> params = alias.getTypeParams();
        List<TypeRef> argRefs = site.getTypeArgs();
        if (params.size() != argRefs.size()) {
            error("类型 '" + alias.getName() + "' 需要 " + params.size() + " 个类型参数，实际为 "
                    + argRefs.size(), site);
            return LensTypes.ERROR;
        }
        List<LensType> args = resolveAll(argRefs);
        if (containsError(args)) return LensTypes.ERROR;

        if (!resolving.add(alias.getName())) {
            error("类型别名 '" + alias.getName() + "' 循环引用自身", site);
            return LensTypes.ERROR;
        }
        Map<String, LensType> scope = new HashMap<String, LensType>();
        for (int i = 0; i < params.size(); i++) {
            scope.put(params.get(i), args.get(i));
        }
        typeParamStack.push(scope);
        try {
            return resolve(alias.getAliasedType());
        } finally {
            typeParamStack.pop();
            resolving.remove(alias.getName());
        }
    }

    private LensType applyUtility(String name, List<TypeRef> argRefs, TypeRef site) {
        int min = UtilityTypes.minArity(name);
        int max = UtilityTypes.maxArity(name);
        if (argRefs.size() < min || argRefs.size() > max) {
            String expected = min == max ? String.valueOf(min) : min + ".." + max;
            error("工具类型 '" + name + "' 需要 " + expected + " 个类型参数，实际为 " + argRefs.size(), site);
            return LensTypes.ERROR;
        }
        List<LensType> args = resolveAll(argRefs);
        if (containsError(args)) return LensTypes.ERROR;
        try {
            return utilities.apply(name, args);
        } catch (TypeQueryException e) {
            error(name + ": " + e.getMessage(), site);
            return LensTypes.ERROR;
        }
    }

    @Override
    public LensType visitLiteral(LiteralType type) {
        return literalType(type.getLiteral());
    }

    @Override
    public LensType visitObject(ObjectType type) {
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        boolean failed = false;
        for (PropertySignature prop : type.getMembers()) {
            LensType memberType = resolve(prop.getType());
            if (memberType instanceof ErrorType) failed = true;
            members.add(new MemberSignature(prop.getName(), memberType,
                    prop.isReadonly(), prop.isOptional(), prop.isMethod()));
        }
        LensType indexType = type.hasIndexSignature() ? resolve(type.getIndexType()) : null;
        if (failed || indexType instanceof ErrorType) return LensTypes.ERROR;
        return new ObjectLensType(members, indexType);
    }

    @Override
    public LensType visitFunction(FunctionType type) {
        List<FunctionLensType.Param> params = new ArrayList<FunctionLensType.Param>();
        boolean failed = false;
        for (Parameter p : type.getParams()) {
            LensType paramType = resolve(p.getType());
            if (paramType instanceof ErrorType) failed = true;
            params.add(new FunctionLensType.Param(p.getName(), paramType, p.isOptional(), p.isRest()));
        }
        LensType ret = resolve(type.getReturnType());
        if (failed || ret instanceof ErrorType) return LensTypes.ERROR;
        return new FunctionLensType(params, ret, type.isConstructor());
    }

    @Override
    public LensType visitArray(ArrayType type) {
        LensType element = resolve(type.getElementType());
        if (element instanceof ErrorType) return element;
        return new ArrayLensType(element, type.isReadonly());
    }

    @Override
    public LensType visitUnion(UnionType type) {
        return LensTypes.union(resolveAll(type.getAlternatives()));
    }

    /**
     * A &amp; B：仅支持对象形状；成员冲突时结果为 never。
     */
    @Override
    public LensType visitIntersection(IntersectionType type) {
        List<LensType> parts = resolveAll(type.getParts());
        if (containsError(parts)) return LensTypes.ERROR;
        try {
            ObjectLensType result = LensTypes.requireShape(parts.get(0));
            for (int i = 1; i < parts.size(); i++) {
                result = ShapeTransforms.intersect(result, LensTypes.requireShape(parts.get(i)));
                if (result == null) return LensTypes.NEVER;
            }
            return result;
        } catch (TypeQueryException e) {
            error("交叉类型: " + e.getMessage(), type);
            return LensTypes.ERROR;
        }
    }

    /**
     * keyof T：字符串键的联合；带索引签名时为 string。
     */
    @Override
    public LensType visitKeyof(KeyofType type) {
        LensType target = resolve(type.getTarget());
        if (target instanceof ErrorType) return target;
        try {
            ObjectLensType shape = LensTypes.requireShape(target);
            LensType keys = KeySetExtractor.allKeys(shape).toType();
            return shape.hasIndexSignature() ? LensTypes.union(LensTypes.STRING, keys) : keys;
        } catch (TypeQueryException e) {
            error("keyof: " + e.getMessage(), type);
            return LensTypes.ERROR;
        }
    }

    /**
     * T["k"]、T["a" | "b"]、T[string]（索引签名）、A[number]（数组元素）。
     */
    @Override
    public LensType visitIndexedAccess(IndexedAccessType type) {
        LensType object = resolve(type.getObjectType());
        LensType index = resolve(type.getIndexType());
        if (object instanceof ErrorType || index instanceof ErrorType) return LensTypes.ERROR;
        try {
            return indexedAccess(object, index);
        } catch (TypeQueryException e) {
            error(e.getMessage(), type);
            return LensTypes.ERROR;
        }
    }

    private static LensType indexedAccess(LensType object, LensType index) {
        if (object instanceof ArrayLensType) {
            if (TypeCompatibility.isAssignable(LensTypes.NUMBER, index)) {
                return ((ArrayLensType) object).getElementType();
            }
            throw new TypeQueryException(TypeQueryException.Kind.BAD_ARGUMENT,
                    "数组只能用 number 索引，实际为 '" + index.toDisplayString() + "'");
        }
        ObjectLensType shape = LensTypes.requireShape(object);
        if (shape.hasIndexSignature() && LensTypes.STRING.equals(index)) {
            return shape.getIndexType();
        }
        List<LensType> parts = new ArrayList<LensType>();
        for (String key : KeySet.fromType(index)) {
            MemberSignature member = shape.getMember(key);
            if (member != null) {
                parts.add(member.getReadType());
            } else if (shape.hasIndexSignature()) {
                parts.add(shape.getIndexType());
            } else {
                throw TypeQueryException.unknownKey(shape, key);
            }
        }
        return LensTypes.union(parts);
    }

    // ============ 名称检查 ============

    /**
     * 检查泛型别名体中引用的名称与参数个数（不求值）。
     * 泛型别名只在实例化时求值，未被使用的泛型别名依靠这里报告错误。
     */
    public void checkReferences(TypeAliasDecl decl) {
        final Set<String> params = new HashSet<String>(decl.getTypeParams());
        decl.getAliasedType().accept(new ReferenceChecker(params));
    }

    private final class ReferenceChecker implements TypeRefVisitor<Void> {
        private final Set<String> params;

        ReferenceChecker(Set<String> params) {
            this.params = params;
        }

        @Override
        public Void visitSimple(SimpleType type) {
            String name = type.getName();
            if (params.contains(name) || LensTypes.fromName(name) != null) return null;
            TypeAliasDecl alias = aliases.get(name);
            if (alias != null) {
                if (alias.isGeneric()) {
                    error("泛型类型 '" + name + "' 需要 " + alias.getTypeParams().size() + " 个类型参数", type);
                }
                return null;
            }
            if (UtilityTypes.isUtility(name)) {
                checkUtilityArity(name, 0, type);
                return null;
            }
            error("未知类型 '" + name + "'", type);
            return null;
        }

        @Override
        public Void visitGeneric(GenericType type) {
            String name = type.getName();
            int count = type.getTypeArgs().size();
            TypeAliasDecl alias = aliases.get(name);
            if (alias != null) {
                if (alias.getTypeParams().size() != count) {
                    error("类型 '" + name + "' 需要 " + alias.getTypeParams().size() + " 个类型参数，实际为 "
                            + count, type);
                }
            } else if (UtilityTypes.isUtility(name)) {
                checkUtilityArity(name, count, type);
            } else if (params.contains(name) || LensTypes.fromName(name) != null) {
                error("类型 '" + name + "' 不是泛型", type);
            } else {
                error("未知类型 '" + name + "'", type);
            }
            for (TypeRef arg : type.getTypeArgs()) arg.accept(this);
            return null;
        }

        private void checkUtilityArity(String name, int count, TypeRef site) {
            int min = UtilityTypes.minArity(name);
            int max = UtilityTypes.maxArity(name);
            if (count < min || count > max) {
                String expected = min == max ? String.valueOf(min) : min + ".." + max;
                error("工具类型 '" + name + "' 需要 " + expected + " 个类型参数，实际为 " + count, site);
            }
        }

        @Override
        public Void visitLiteral(LiteralType type) {
            return null;
        }

        @Override
        public Void visitObject(ObjectType type) {
            for (PropertySignature prop : type.getMembers()) prop.getType().accept(this);
            if (type.hasIndexSignature()) type.getIndexType().accept(this);
            return null;
        }

        @Override
        public Void visitFunction(FunctionType type) {
            for (Parameter p : type.getParams()) p.getType().accept(this);
            type.getReturnType().accept(this);
            return null;
        }

        @Override
        public Void visitArray(ArrayType type) {
            return type.getElementType().accept(this);
        }

        @Override
        public Void visitUnion(UnionType type) {
            for (TypeRef alt : type.getAlternatives()) alt.accept(this);
            return null;
        }

        @Override
        public Void visitIntersection(IntersectionType type) {
            for (TypeRef part : type.getParts()) part.accept(this);
            return null;
        }

        @Override
        public Void visitKeyof(KeyofType type) {
            return type.getTarget().accept(this);
        }

        @Override
        public Void visitIndexedAccess(IndexedAccessType type) {
            type.getObjectType().accept(this);
            return type.getIndexType().accept(this);
        }
    }

    // ============ 辅助 ============

    /**
     * 值字面量（或字面量类型）对应的 LensType
     */
    public static LensType literalType(Literal literal) {
        switch (literal.getKind()) {
            case NUMBER:
                return LensTypes.numberLiteral(literal.getText());
            case STRING:
                return LensTypes.stringLiteral(literal.getText());
            case BOOLEAN:
                return LensTypes.booleanLiteral("true".equals(literal.getText()));
            case NULL:
                return LensTypes.NULL;
            case UNDEFINED:
                return LensTypes.UNDEFINED;
            default:
                throw new IllegalStateException("Unknown literal kind: " + literal.getKind());
        }
    }

    private List<LensType> resolveAll(List<TypeRef> refs) {
        List<LensType> result = new ArrayList<LensType>(refs.size());
        for (TypeRef ref : refs) {
            result.add(resolve(ref));
        }
        return result;
    }

    private static boolean containsError(List<LensType> types) {
        for (LensType t : types) {
            if (t instanceof ErrorType) return true;
        }
        return false;
    }

    private Map<String, LensType> currentScope() {
        Map<String, LensType> top = typeParamStack.peek();
        return top != null ? top : Collections.<String, LensType>emptyMap();
    }

    /** 报告错误；同一位置的相同消息只报告一次（泛型别名体每次实例化都会重新求值） */
    private void error(String message, AstNode node) {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.sameAs(SemanticDiagnostic.Severity.ERROR, message, node.getLocation())) return;
        }
        diagnostics.add(new SemanticDiagnostic(SemanticDiagnostic.Severity.ERROR, message, node.getLocation()));
    }
}
