package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.service.InstitutionMatchService;
import com.example.identity_resolution_engine.util.InstitutionNormalizer;
import com.example.identity_resolution_engine.util.StringSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 机构等价判断实现类。
 * 关键词规则用于区分 "University of Michigan" 与 "Michigan State University" 这类共享词汇的不同机构。
 */
@Service
@Slf4j
public class InstitutionMatchServiceImpl implements InstitutionMatchService {

    private static final Set<String> STOP_WORDS = Set.of("of", "the", "and", "at", "in", "for");
    // A&M 规范化后只剩 "am"
    private static final Set<String> SIGNIFICANT_SHORT_WORDS = Set.of("am");
    private static final Set<String> CONFLICTING_WORDS =
            Set.of("state", "tech", "polytechnic", "community", "medical", "health", "am");

    private static final Set<String> MISMATCH_STOP_WORDS = Set.of(
            "of", "the", "at", "in", "and", "for", "school", "department", "dept", "center", "centre");

    // 同一机构的常见写法，判断单位是否与声称机构一致时使用
    private static final List<List<String>> INSTITUTION_ALIASES = List.of(
            List.of("massachusetts institute of technology", "mit"),
            List.of("california institute of technology", "caltech"),
            List.of("university of california berkeley", "uc berkeley", "ucb", "berkeley"),
            List.of("university of california los angeles", "ucla"),
            List.of("university of california san francisco", "ucsf"),
            List.of("university of california san diego", "ucsd"),
            List.of("university of california davis", "uc davis", "ucd"),
            List.of("university of california irvine", "uc irvine", "uci"),
            List.of("stanford university", "stanford"),
            List.of("harvard university", "harvard medical school", "harvard"),
            List.of("yale university", "yale school of medicine", "yale"),
            List.of("princeton university", "princeton"),
            List.of("columbia university", "columbia"),
            List.of("cornell university", "weill cornell", "cornell"),
            List.of("university of pennsylvania", "upenn", "penn", "perelman school"),
            List.of("brandeis university", "brandeis"),
            List.of("rockefeller university", "rockefeller"),
            List.of("howard hughes medical institute", "hhmi", "janelia"),
            List.of("national institutes of health", "nih", "niehs", "nimh", "nci"),
            List.of("washington university", "wustl", "wash u", "washington university in st. louis"),
            List.of("university of michigan", "umich", "u-m", "michigan"),
            List.of("university of washington", "uw", "u washington"),
            List.of("university of wisconsin", "uw-madison", "wisconsin"),
            List.of("johns hopkins", "jhu", "hopkins"),
            List.of("duke university", "duke"),
            List.of("university of north carolina", "unc", "unc-chapel hill"),
            List.of("emory university", "emory"),
            List.of("vanderbilt university", "vanderbilt"),
            List.of("northwestern university", "northwestern"),
            List.of("university of chicago", "uchicago", "u chicago"),
            List.of("new york university", "nyu"),
            List.of("boston university", "bu"),
            List.of("boston college", "bc"),
            List.of("university of pittsburgh", "pitt"),
            List.of("ohio state university", "osu", "ohio state"),
            List.of("penn state", "pennsylvania state university", "psu"),
            List.of("michigan state university", "msu", "michigan state"),
            List.of("university of virginia", "uva"),
            List.of("georgia tech", "georgia institute of technology"),
            List.of("university of texas at austin", "ut austin", "texas"),
            List.of("university of california santa barbara", "ucsb"),
            List.of("university of california santa cruz", "ucsc"),
            List.of("scripps research", "scripps institute", "scripps"),
            List.of("salk institute", "salk"),
            List.of("broad institute", "broad"),
            List.of("whitehead institute", "whitehead"),
            List.of("cold spring harbor", "cshl"),
            List.of("marine biological laboratory", "mbl", "woods hole")
    );

    // 按顺序尝试，取第一个命中
    private static final List<Pattern> INSTITUTION_PATTERNS = List.of(
            Pattern.compile("university of [\\w\\s]+"),
            Pattern.compile("[\\w\\s]+ university"),
            Pattern.compile("[\\w\\s]+ institute of technology"),
            Pattern.compile("[\\w\\s]+ institute"),
            Pattern.compile("[\\w\\s]+ college"),
            Pattern.compile("[\\w\\s]+ school of medicine"),
            Pattern.compile("[\\w\\s]+ medical school"),
            Pattern.compile("[\\w\\s]+ medical center")
    );

    private static final double SIMILARITY_THRESHOLD = 0.9;

    @Override
    public boolean institutionsMatch(String a, String b) {
        if (StringUtils.isBlank(a) || StringUtils.isBlank(b)) {
            return false;
        }
        if (a.equals(b)) {
            return true;
        }

        String normA = InstitutionNormalizer.normalize(InstitutionNormalizer.expandAbbreviations(a));
        String normB = InstitutionNormalizer.normalize(InstitutionNormalizer.expandAbbreviations(b));
        if (normA.isEmpty() || normB.isEmpty()) {
            return false;
        }
        if (normA.equals(normB)) {
            return true;
        }
        // 如 "University of Michigan, Ann Arbor" 与 "University of Michigan"
        if (normA.contains(normB) || normB.contains(normA)) {
            return true;
        }

        List<String> wordsA = keyWords(normA);
        List<String> wordsB = keyWords(normB);
        if (wordsA.size() == wordsB.size()) {
            List<String> sortedA = wordsA.stream().sorted().collect(Collectors.toList());
            List<String> sortedB = wordsB.stream().sorted().collect(Collectors.toList());
            if (sortedA.equals(sortedB)) {
                return true;
            }
        }

        List<String> shorter = wordsA.size() <= wordsB.size() ? wordsA : wordsB;
        List<String> longer = wordsA.size() <= wordsB.size() ? wordsB : wordsA;

        boolean longerHasConflict = longer.stream()
                .anyMatch(w -> CONFLICTING_WORDS.contains(w) && !shorter.contains(w));
        if (longerHasConflict) {
            return false;
        }
        if (shorter.size() >= 2 && longer.containsAll(shorter)) {
            return true;
        }

        return StringSimilarity.compare(normA, normB) > SIMILARITY_THRESHOLD;
    }

    @Override
    public boolean institutionMismatch(String affiliation, String claimedInstitution) {
        if (StringUtils.isBlank(affiliation) || StringUtils.isBlank(claimedInstitution)) {
            return false;
        }
        String affiliationLower = affiliation.toLowerCase();
        String claimedLower = claimedInstitution.toLowerCase();

        // "Department of X, University of Michigan" 包含 "University of Michigan"
        if (affiliationLower.contains(claimedLower)) {
            return false;
        }

        for (List<String> aliases : INSTITUTION_ALIASES) {
            boolean affiliationHit = aliases.stream().anyMatch(affiliationLower::contains);
            boolean claimedHit = aliases.stream().anyMatch(claimedLower::contains);
            if (affiliationHit && claimedHit) {
                return false;
            }
        }

        String affiliationInst = extractInstitution(affiliationLower);
        String claimedInst = extractInstitution(claimedLower);
        if (affiliationInst.contains(claimedInst) || claimedInst.contains(affiliationInst)) {
            return false;
        }

        // 共享一个较长的关键词（如 michigan、stanford）即认为一致
        List<String> affiliationWords = mismatchWords(affiliationInst);
        List<String> claimedWords = mismatchWords(claimedInst);
        boolean sharesKeyWord = affiliationWords.stream()
                .filter(claimedWords::contains)
                .anyMatch(w -> w.length() > 4);
        if (sharesKeyWord) {
            return false;
        }

        log.debug("机构不一致: 单位[{}] 声称[{}]", affiliation, claimedInstitution);
        return true;
    }

    @Override
    public String extractInstitution(String text) {
        if (text == null) {
            return "";
        }
        String lower = text.toLowerCase();
        for (Pattern pattern : INSTITUTION_PATTERNS) {
            Matcher m = pattern.matcher(lower);
            if (m.find()) {
                return m.group().trim();
            }
        }
        return lower;
    }

    private static List<String> keyWords(String normalized) {
        return Arrays.stream(normalized.split(" "))
                .filter(w -> (w.length() > 2 || SIGNIFICANT_SHORT_WORDS.contains(w)) && !STOP_WORDS.contains(w))
                .collect(Collectors.toList());
    }

    private static List<String> mismatchWords(String text) {
        List<String> words = new ArrayList<>();
        for (String w : text.split("\\s+")) {
            if (w.length() > 2 && !MISMATCH_STOP_WORDS.contains(w)) {
                words.add(w.replaceAll("[^a-z]", ""));
            }
        }
        return words;
    }
}
