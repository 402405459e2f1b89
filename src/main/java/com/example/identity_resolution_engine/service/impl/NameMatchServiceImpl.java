package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.matcher.NameMatchRule;
import com.example.identity_resolution_engine.matcher.NameMatchRules;
import com.example.identity_resolution_engine.matcher.NamePair;
import com.example.identity_resolution_engine.model.AuthorMatch;
import com.example.identity_resolution_engine.model.ConfidenceLevel;
import com.example.identity_resolution_engine.model.MatchResult;
import com.example.identity_resolution_engine.model.NameParts;
import com.example.identity_resolution_engine.service.NameMatchService;
import com.example.identity_resolution_engine.util.InstitutionNormalizer;
import com.example.identity_resolution_engine.util.NameNormalizer;
import com.example.identity_resolution_engine.util.NameVariants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 姓名分层匹配实现类，规则表见 {@link NameMatchRules#DEFAULT}。
 */
@Service
@Slf4j
public class NameMatchServiceImpl implements NameMatchService {

    // 重名率高、误报风险大的姓名
    private static final Set<String> COMMON_NAMES = Set.of(
            // 英文
            "john smith", "james johnson", "robert williams", "michael brown", "david jones",
            "william davis", "richard miller", "joseph wilson", "thomas moore", "charles taylor",
            "mary johnson", "patricia williams", "jennifer brown", "elizabeth jones", "linda davis",
            // 中文拼音
            "wei wang", "jing zhang", "li wang", "wei zhang", "lei wang", "jian liu",
            "wei liu", "yang li", "fang chen", "min li", "xin wang", "yu wang",
            "bin wang", "hai zhang", "lei zhang", "yong wang", "lin chen", "jun liu",
            // 韩文
            "kim lee", "lee kim", "park kim", "jin park",
            // 印度
            "amit kumar", "raj kumar", "sanjay sharma", "priya sharma",
            // 日文
            "takashi yamamoto", "yuki tanaka", "hiroshi suzuki"
    );

    private static final Set<String> INSTITUTION_STOP_WORDS = Set.of(
            "of", "the", "and", "at", "in", "for", "university", "college", "institute");

    private final List<NameMatchRule> rules;

    public NameMatchServiceImpl() {
        this(NameMatchRules.DEFAULT);
    }

    public NameMatchServiceImpl(List<NameMatchRule> rules) {
        this.rules = rules;
    }

    @Override
    public MatchResult match(String nameA, String nameB) {
        NameParts a = NameNormalizer.normalize(nameA);
        NameParts b = NameNormalizer.normalize(nameB);
        if (a.isEmpty() || b.isEmpty()) {
            return MatchResult.noMatch();
        }

        NamePair pair = new NamePair(a, b);
        for (NameMatchRule rule : rules) {
            if (rule.appliesTo(pair)) {
                log.debug("姓名匹配 [{}] vs [{}] 命中 {}", nameA, nameB, rule);
                return rule.toResult();
            }
        }
        return MatchResult.noMatch();
    }

    @Override
    public int adjustForInstitution(int baseConfidence, String institutionA, String institutionB) {
        String normA = InstitutionNormalizer.normalize(institutionA);
        String normB = InstitutionNormalizer.normalize(institutionB);
        if (normA.isEmpty() || normB.isEmpty()) {
            return baseConfidence;
        }

        if (normA.equals(normB)) {
            return raise(baseConfidence, 15);
        }
        if (normA.contains(normB) || normB.contains(normA)) {
            return raise(baseConfidence, 10);
        }

        Set<String> wordsA = significantWords(normA);
        Set<String> wordsB = significantWords(normB);
        long overlap = wordsA.stream().filter(wordsB::contains).count();
        if (overlap >= 2) {
            return raise(baseConfidence, 10);
        }
        return baseConfidence;
    }

    @Override
    public boolean isCommonName(String name) {
        NameParts parts = NameNormalizer.normalize(name);
        if (parts.isEmpty()) {
            return false;
        }
        if (COMMON_NAMES.contains(parts.getFull())) {
            return true;
        }
        // 去掉中间名再查一次
        return parts.hasFirst() && COMMON_NAMES.contains(parts.getFirst() + " " + parts.getLast());
    }

    @Override
    public ConfidenceLevel confidenceLevel(int confidence) {
        return ConfidenceLevel.of(confidence);
    }

    @Override
    public List<AuthorMatch> findMatchesInAuthors(String name, String institution, List<String> authors,
                                                  int minConfidence) {
        if (authors == null || authors.isEmpty()) {
            return Collections.emptyList();
        }
        // 作者名单不带各自的机构，机构加分由调用方按记录级机构处理
        log.debug("在{}位作者中查找 {}（{}）", authors.size(), name, institution);
        List<AuthorMatch> matches = new ArrayList<>();
        for (String author : authors) {
            MatchResult result = match(name, author);
            if (result.isMatches() && result.getConfidence() >= minConfidence) {
                matches.add(new AuthorMatch(author, result.getConfidence(), result.getMatchType()));
            }
        }
        return matches;
    }

    @Override
    public List<String> buildSearchTerms(String name) {
        NameParts parts = NameNormalizer.normalize(name);
        if (parts.isEmpty()) {
            return Collections.emptyList();
        }
        Set<String> terms = new LinkedHashSet<>();
        terms.add(parts.getFull());
        terms.add(parts.getLast());

        if (parts.hasFirst()) {
            String first = parts.getFirst();
            String last = parts.getLast();
            terms.add(first + " " + last);
            terms.add(first.charAt(0) + " " + last);
            // "Smith, John" 及东亚姓名顺序
            terms.add(last + " " + first);

            for (String variant : NameVariants.variantsOf(first)) {
                if (!variant.equals(first)) {
                    terms.add(variant + " " + last);
                    terms.add(last + " " + variant);
                    terms.add(variant.charAt(0) + " " + last);
                }
            }
        }
        return new ArrayList<>(terms);
    }

    @Override
    public List<String> buildTextSearchPatterns(String name) {
        NameParts parts = NameNormalizer.normalize(name);
        if (!parts.hasFirst()) {
            return parts.hasLast() ? List.of("%" + parts.getLast() + "%") : Collections.emptyList();
        }
        String first = parts.getFirst();
        String last = parts.getLast();
        Set<String> patterns = new LinkedHashSet<>();
        patterns.add("%" + first + "%" + last + "%");
        patterns.add("%" + last + "%" + first + "%");
        for (String variant : NameVariants.variantsOf(first)) {
            if (!variant.equals(first)) {
                patterns.add("%" + variant + "%" + last + "%");
                patterns.add("%" + last + "%" + variant + "%");
            }
        }
        return new ArrayList<>(patterns);
    }

    private static int raise(int base, int bonus) {
        return Math.max(base, Math.min(100, base + bonus));
    }

    private static Set<String> significantWords(String normalized) {
        return Arrays.stream(normalized.split(" "))
                .filter(w -> w.length() > 2 && !INSTITUTION_STOP_WORDS.contains(w))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
