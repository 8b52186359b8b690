package com.typelens.compiler.analysis.classify;

import com.typelens.compiler.analysis.types.LensType;
import com.typelens.compiler.analysis.types.MemberSignature;
import com.typelens.compiler.analysis.types.ObjectLensType;

import java.util.ArrayList;
import java.util.List;

/**
 * 键集合提取：对形状的每个键应用单键谓词，收集满足的键。
 *
 * <p>每一对（只读/可写、可选/必需、函数/非函数）都是同一个谓词与其否定，
 * 因此两者不相交且并集恰好是全部键。</p>
 */
public final class KeySetExtractor {

    private KeySetExtractor() {}

    /** 全部键 (keyof) */
    public static KeySet allKeys(ObjectLensType shape) {
        return new KeySet(shape.keys());
    }

    public static KeySet readonlyKeys(ObjectLensType shape) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (MutabilityClassifier.isReadonly(shape, key)) keys.add(key);
        }
        return new KeySet(keys);
    }

    public static KeySet writableKeys(ObjectLensType shape) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (MutabilityClassifier.isWritable(shape, key)) keys.add(key);
        }
        return new KeySet(keys);
    }

    public static KeySet optionalKeys(ObjectLensType shape) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (PresenceClassifier.isOptional(shape, key)) keys.add(key);
        }
        return new KeySet(keys);
    }

    public static KeySet requiredKeys(ObjectLensType shape) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (PresenceClassifier.isRequired(shape, key)) keys.add(key);
        }
        return new KeySet(keys);
    }

    public static KeySet functionKeys(ObjectLensType shape) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (ValueCategoryClassifier.isFunctionValued(shape, key)) keys.add(key);
        }
        return new KeySet(keys);
    }

    public static KeySet nonFunctionKeys(ObjectLensType shape) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (ValueCategoryClassifier.isNonFunctionValued(shape, key)) keys.add(key);
        }
        return new KeySet(keys);
    }

    /** 值类型可以赋给 category 的键 (KeysWithValueType) */
    public static KeySet keysWithValueType(ObjectLensType shape, LensType category) {
        List<String> keys = new ArrayList<String>();
        for (String key : shape.keys()) {
            if (ValueCategoryClassifier.matchesCategory(shape, key, category)) keys.add(key);
        }
        return new KeySet(keys);
    }

    /**
     * 只保留必需成员的子形状，成员签名不变。
     */
    public static ObjectLensType pickRequired(ObjectLensType shape) {
        KeySet required = requiredKeys(shape);
        List<MemberSignature> members = new ArrayList<MemberSignature>();
        for (MemberSignature member : shape.getMembers()) {
            if (required.contains(member.getName())) members.add(member);
        }
        return new ObjectLensType(members);
    }
}
