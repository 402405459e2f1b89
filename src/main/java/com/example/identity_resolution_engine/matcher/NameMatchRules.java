package com.example.identity_resolution_engine.matcher;

import com.example.identity_resolution_engine.model.MatchType;
import com.example.identity_resolution_engine.util.NameVariants;

import java.util.List;

/**
 * 按优先级排列的姓名匹配规则表，从上到下依次判断，命中第一条即返回。
 */
public final class NameMatchRules {

    static final double HIGH_SIMILARITY_THRESHOLD = 0.9;
    static final int LAST_NAME_ONLY_MAX_LENGTH_DIFF = 3;

    public static final List<NameMatchRule> DEFAULT = List.of(
            new NameMatchRule("1", 100, MatchType.EXACT,
                    p -> p.a().getFull().equals(p.b().getFull())),
            new NameMatchRule("2", 95, MatchType.FIRST_LAST_EXACT,
                    p -> p.sameLast() && p.a().getFirst().equals(p.b().getFirst())),
            new NameMatchRule("2.5", 90, MatchType.NAME_VARIANT,
                    p -> p.sameLast() && p.bothHaveFirst()
                            && NameVariants.areVariants(p.a().getFirst(), p.b().getFirst())),
            new NameMatchRule("3", 85, MatchType.LAST_FIRST_INITIAL,
                    NameMatchRules::initialOfEachOther),
            new NameMatchRule("3.5", 85, MatchType.NAME_ORDER_SWAP,
                    p -> p.bothComplete()
                            && p.a().getFirst().equals(p.b().getLast())
                            && p.a().getLast().equals(p.b().getFirst())),
            new NameMatchRule("4", 80, MatchType.HIGH_SIMILARITY,
                    p -> p.sameLast() && p.fullSimilarity() > HIGH_SIMILARITY_THRESHOLD),
            new NameMatchRule("5", 75, MatchType.FULL_SIMILARITY,
                    p -> p.fullSimilarity() > HIGH_SIMILARITY_THRESHOLD),
            new NameMatchRule("5.5", 75, MatchType.NAME_ORDER_SWAP_VARIANT,
                    p -> p.bothComplete()
                            && p.a().getLast().equals(p.b().getFirst())
                            && NameVariants.areVariants(p.a().getFirst(), p.b().getLast())),
            new NameMatchRule("6", 60, MatchType.PARTIAL_FIRST,
                    p -> p.sameLast() && p.bothHaveFirst()
                            && (p.a().getFirst().startsWith(p.b().getFirst())
                            || p.b().getFirst().startsWith(p.a().getFirst()))),
            // 两侧都有名字却走到这里，说明名字互相冲突（如 Will 与 Helen），不再按姓氏认定
            new NameMatchRule("7", 50, MatchType.LAST_NAME_ONLY,
                    p -> p.sameLast() && !p.bothHaveFirst()
                            && Math.abs(p.a().getFull().length() - p.b().getFull().length())
                            <= LAST_NAME_ONLY_MAX_LENGTH_DIFF)
    );

    private NameMatchRules() {
    }

    private static boolean initialOfEachOther(NamePair p) {
        if (!p.sameLast() || !p.bothHaveFirst()) {
            return false;
        }
        String first1 = p.a().getFirst();
        String first2 = p.b().getFirst();
        return first1.charAt(0) == first2.charAt(0)
                && (first1.length() == 1 || first2.length() == 1);
    }
}
