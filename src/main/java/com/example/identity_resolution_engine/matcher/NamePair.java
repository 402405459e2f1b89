package com.example.identity_resolution_engine.matcher;

import com.example.identity_resolution_engine.model.NameParts;
import com.example.identity_resolution_engine.util.StringSimilarity;

/**
 * 一次比对中的两个规范化姓名，完整姓名相似度按需计算并缓存。
 */
public final class NamePair {

    private final NameParts a;
    private final NameParts b;
    private Double fullSimilarity;

    public NamePair(NameParts a, NameParts b) {
        this.a = a;
        this.b = b;
    }

    public NameParts a() {
        return a;
    }

    public NameParts b() {
        return b;
    }

    public boolean sameLast() {
        return a.hasLast() && a.getLast().equals(b.getLast());
    }

    public boolean bothHaveFirst() {
        return a.hasFirst() && b.hasFirst();
    }

    /**
     * 两侧都同时具备名和姓（姓名顺序互换类规则的前提）
     */
    public boolean bothComplete() {
        return bothHaveFirst() && a.hasLast() && b.hasLast();
    }

    public double fullSimilarity() {
        if (fullSimilarity == null) {
            fullSimilarity = StringSimilarity.compare(a.getFull(), b.getFull());
        }
        return fullSimilarity;
    }
}
