package com.example.identity_resolution_engine.util;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于字符二元组的Dice相似度（忽略空白），取值0-1。
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    public static double compare(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        String first = a.replaceAll("\\s+", "");
        String second = b.replaceAll("\\s+", "");

        if (first.equals(second)) return 1.0;
        if (first.length() < 2 || second.length() < 2) return 0.0;

        Map<String, Integer> firstBigrams = new HashMap<>();
        for (int i = 0; i < first.length() - 1; i++) {
            firstBigrams.merge(first.substring(i, i + 2), 1, Integer::sum);
        }

        int intersectionSize = 0;
        for (int i = 0; i < second.length() - 1; i++) {
            String bigram = second.substring(i, i + 2);
            Integer count = firstBigrams.get(bigram);
            if (count != null && count > 0) {
                firstBigrams.put(bigram, count - 1);
                intersectionSize++;
            }
        }

        return (2.0 * intersectionSize) / (first.length() + second.length() - 2);
    }
}
