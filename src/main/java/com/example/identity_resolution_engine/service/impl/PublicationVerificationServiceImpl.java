package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.config.IdentityProperties;
import com.example.identity_resolution_engine.dto.ReviewerSuggestion;
import com.example.identity_resolution_engine.dto.VerificationBatchResult;
import com.example.identity_resolution_engine.model.Author;
import com.example.identity_resolution_engine.model.ExpertiseMismatchResult;
import com.example.identity_resolution_engine.model.Publication;
import com.example.identity_resolution_engine.model.VerificationResult;
import com.example.identity_resolution_engine.search.PublicationSearch;
import com.example.identity_resolution_engine.service.InstitutionMatchService;
import com.example.identity_resolution_engine.service.PublicationVerificationService;
import com.example.identity_resolution_engine.util.NameNormalizer;
import com.example.identity_resolution_engine.util.NameVariants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 基于发表论文的研究者核验实现类。
 * 每个姓名变体依次做普通检索与带专业方向的检索，请求之间按限流间隔暂停。
 */
@Service
@Slf4j
public class PublicationVerificationServiceImpl implements PublicationVerificationService {

    static final String SELECTION_DISAMBIGUATED = "disambiguated";
    static final String SELECTION_RELEVANT_SIMPLE = "relevant_simple";
    static final String SELECTION_SIMPLE = "simple";
    static final String SELECTION_FALLBACK = "fallback";

    private static final int MIN_AFFILIATION_LENGTH = 10;

    private static final Pattern EXPERTISE_SPLIT = Pattern.compile("[\\s,]+");
    private static final Pattern EXPERTISE_PART_SPLIT = Pattern.compile("[,;/]+");
    private static final Pattern EMAIL = Pattern.compile("\\s*\\.\\s*\\S+@\\S+");
    private static final Pattern AFFILIATION_COUNTRY =
            Pattern.compile(",?\\s*(usa|united states|uk|france|germany|canada)\\.?$");
    private static final Pattern AFFILIATION_INSTITUTION = Pattern.compile(
            "(university of [^,]+|[^,]+ university|[^,]+ institute of technology|[^,]+ institute)");

    // 常见科研术语的近义词，用于计算专业方向匹配度
    private static final Map<String, List<String>> SYNONYMS = Map.ofEntries(
            Map.entry("viral", List.of("virus", "virology", "viruses", "phage", "bacteriophage")),
            Map.entry("virus", List.of("viral", "virology", "viruses", "phage")),
            Map.entry("virology", List.of("viral", "virus", "viruses")),
            Map.entry("ecology", List.of("ecological", "ecosystem")),
            Map.entry("ecological", List.of("ecology", "ecosystem")),
            Map.entry("marine", List.of("ocean", "oceanic", "aquatic", "sea")),
            Map.entry("ocean", List.of("marine", "oceanic", "aquatic", "sea")),
            Map.entry("microbial", List.of("microbe", "microbiome", "bacterial", "bacteria")),
            Map.entry("microbe", List.of("microbial", "microbiome", "bacterial")),
            Map.entry("bacteria", List.of("bacterial", "microbial", "microbe")),
            Map.entry("bacterial", List.of("bacteria", "microbial", "microbe")),
            Map.entry("evolution", List.of("evolutionary", "evolve", "evolved")),
            Map.entry("evolutionary", List.of("evolution", "evolve")),
            Map.entry("phage", List.of("bacteriophage", "viral", "virus")),
            Map.entry("bacteriophage", List.of("phage", "viral", "virus")),
            Map.entry("population", List.of("populations", "community", "communities")),
            Map.entry("community", List.of("communities", "population", "populations")),
            Map.entry("dynamics", List.of("dynamic", "interactions", "interaction")),
            Map.entry("modeling", List.of("model", "models", "mathematical", "computational")),
            Map.entry("model", List.of("modeling", "models", "mathematical")),
            Map.entry("quantitative", List.of("mathematical", "computational", "modeling"))
    );

    // 过于宽泛、无法区分研究方向的词
    private static final Set<String> GENERIC_TERMS = Set.of(
            "biology", "research", "science", "study", "analysis", "methods",
            "molecular", "cellular", "genetic", "genomic", "protein", "proteins",
            "mechanism", "mechanisms", "function", "regulation", "development",
            "evolution", "evolutionary", "structure", "structural", "model", "models");

    private final IdentityProperties properties;
    private final InstitutionMatchService institutionMatchService;
    private final Clock clock;

    @Autowired
    public PublicationVerificationServiceImpl(IdentityProperties properties,
                                              InstitutionMatchService institutionMatchService,
                                              Clock clock) {
        this.properties = properties;
        this.institutionMatchService = institutionMatchService;
        this.clock = clock;
    }

    @Override
    public VerificationResult verify(String claimedName, List<String> claimedExpertise, String claimedInstitution,
                                     PublicationSearch search) {
        Objects.requireNonNull(search, "search");
        IdentityProperties.Verification config = properties.getVerification();
        int minPublications = config.getMinPublications();

        if (StringUtils.isBlank(claimedName)) {
            return VerificationResult.rejected(claimedName, "No publications found matching expertise");
        }
        List<String> expertise = claimedExpertise == null ? Collections.emptyList() : claimedExpertise;

        List<String> nameVariants = generateNameVariants(claimedName);
        List<Publication> allSimple = new ArrayList<>();
        List<Publication> allDisambiguated = new ArrayList<>();
        long delayMs = properties.getSearch().getEffectiveRequestDelayMs();

        for (String variant : nameVariants) {
            List<Publication> simple = searchQuietly(search, buildAuthorQuery(variant),
                    config.getSimpleMaxResults(), claimedName);
            log.debug("[核验] {}: 变体\"{}\"普通检索返回{}篇", claimedName, variant, simple.size());
            allSimple.addAll(simple);
            if (!pause(delayMs)) {
                break;
            }

            List<Publication> disambiguated = searchQuietly(search, buildDisambiguatedQuery(variant, expertise),
                    config.getDisambiguatedMaxResults(), claimedName);
            log.debug("[核验] {}: 变体\"{}\"限定方向检索返回{}篇", claimedName, variant, disambiguated.size());
            allDisambiguated.addAll(disambiguated);
            if (!pause(delayMs)) {
                break;
            }
        }

        // 检索结果中常混入同姓不同名的作者（如 Helen Harcombe 之于 Will Harcombe），必须按作者再过滤
        List<Publication> simpleSet = dedupeByPmid(filterToMatchingAuthor(allSimple, nameVariants));
        List<Publication> disambiguatedSet = dedupeByPmid(filterToMatchingAuthor(allDisambiguated, nameVariants));
        log.debug("[核验] {}: 过滤去重后 simple={}, disambiguated={}",
                claimedName, simpleSet.size(), disambiguatedSet.size());

        List<Publication> finalSet;
        String selection;
        if (disambiguatedSet.size() >= minPublications) {
            finalSet = disambiguatedSet;
            selection = SELECTION_DISAMBIGUATED;
        } else if (simpleSet.size() >= minPublications) {
            List<Publication> relevant = filterByExpertiseRelevance(simpleSet, expertise);
            if (relevant.size() >= minPublications) {
                finalSet = relevant;
                selection = SELECTION_RELEVANT_SIMPLE;
            } else {
                finalSet = simpleSet;
                selection = SELECTION_SIMPLE;
            }
        } else {
            finalSet = simpleSet.size() > disambiguatedSet.size() ? simpleSet : disambiguatedSet;
            selection = SELECTION_FALLBACK;
        }

        if (finalSet.size() < minPublications) {
            String reason = finalSet.isEmpty()
                    ? "No publications found matching expertise"
                    : "Only " + finalSet.size() + " relevant publications (minimum: " + minPublications + ")";
            log.info("[核验] {}: 未通过 - {}", claimedName, reason);
            VerificationResult rejected = VerificationResult.rejected(claimedName, reason);
            rejected.setSelection(selection);
            return rejected;
        }

        String affiliation = extractBestAffiliation(finalSet, nameVariants);
        double confidence = calculateExpertiseMatch(finalSet, expertise);
        boolean institutionMismatch = institutionMatchService.institutionMismatch(affiliation, claimedInstitution);
        ExpertiseMismatchResult expertiseMismatch = checkExpertiseMismatch(finalSet, expertise);

        VerificationResult result = new VerificationResult();
        result.setClaimedName(claimedName);
        result.setVerified(true);
        result.setConfidence(confidence);
        result.setAffiliation(affiliation);
        result.setInstitutionMismatch(institutionMismatch);
        result.setExpertiseMismatch(expertiseMismatch.isMismatch());
        result.setExpertiseMismatchDetails(expertiseMismatch.isMismatch() ? expertiseMismatch : null);
        result.setPublicationCount5yr(countRecentPublications(finalSet));
        result.setSelection(selection);
        result.setPublications(new ArrayList<>(
                finalSet.subList(0, Math.min(config.getKeptPublications(), finalSet.size()))));

        log.info("[核验] {}: 通过，{}篇论文（{}），专业匹配度{}%",
                claimedName, finalSet.size(), selection, Math.round(confidence * 100));
        if (institutionMismatch) {
            log.warn("[核验] {}: 机构不一致 - 声称\"{}\"，论文单位\"{}\"", claimedName, claimedInstitution, affiliation);
        }
        if (expertiseMismatch.isMismatch()) {
            log.warn("[核验] {}: 专业方向不一致 - 声称{}，论文中均未出现", claimedName, expertiseMismatch.getClaimedTerms());
        }
        return result;
    }

    @Override
    public VerificationBatchResult verifyAll(List<ReviewerSuggestion> suggestions, PublicationSearch search) {
        Objects.requireNonNull(search, "search");
        VerificationBatchResult batch = new VerificationBatchResult();
        if (suggestions == null || suggestions.isEmpty()) {
            return batch;
        }
        log.info("[核验] 开始核验{}位候选人", suggestions.size());
        for (ReviewerSuggestion suggestion : suggestions) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("[核验] 线程被中断，停止后续核验");
                break;
            }
            VerificationResult result = verify(suggestion.getName(), suggestion.getExpertiseAreas(),
                    suggestion.getSuggestedInstitution(), search);
            if (result.isVerified()) {
                if (result.getAffiliation() == null) {
                    result.setAffiliation(suggestion.getAffiliation());
                }
                batch.getVerified().add(result);
            } else {
                batch.getUnverified().add(result);
            }
        }
        log.info("[核验] 完成: 通过{}位，未通过{}位", batch.getVerified().size(), batch.getUnverified().size());
        return batch;
    }

    @Override
    public List<String> generateNameVariants(String name) {
        String cleanName = NameNormalizer.stripLeadingTitle(name);
        String[] parts = StringUtils.split(cleanName);
        if (parts == null || parts.length < 2) {
            return cleanName.isEmpty() ? Collections.emptyList() : List.of(cleanName);
        }
        String firstName = parts[0];
        String restOfName = String.join(" ", Arrays.copyOfRange(parts, 1, parts.length));

        Set<String> variants = new LinkedHashSet<>();
        variants.add(String.join(" ", parts));

        // 昵称换成正式名（Will -> William）
        String formal = NameVariants.formalNameOf(firstName);
        if (formal != null) {
            variants.add(StringUtils.capitalize(formal) + " " + restOfName);
        }
        // 首字母形式，文献库中很常见
        if (firstName.length() > 1) {
            variants.add(firstName.charAt(0) + " " + restOfName);
        }
        return new ArrayList<>(variants);
    }

    @Override
    public String buildAuthorQuery(String name) {
        return NameNormalizer.stripLeadingTitle(name) + "[Author] AND " + dateFilter();
    }

    @Override
    public String buildDisambiguatedQuery(String name, List<String> expertiseAreas) {
        String cleanName = NameNormalizer.stripLeadingTitle(name);
        List<String> terms = new ArrayList<>();
        if (expertiseAreas != null) {
            for (String area : expertiseAreas.subList(0, Math.min(2, expertiseAreas.size()))) {
                if (area == null) continue;
                String[] words = EXPERTISE_SPLIT.split(area.trim());
                String term = String.join(" ", Arrays.copyOfRange(words, 0, Math.min(2, words.length)));
                if (term.length() > 2) {
                    terms.add(term);
                }
            }
        }
        if (terms.isEmpty()) {
            return buildAuthorQuery(cleanName);
        }
        String expertiseQuery = terms.stream()
                .map(t -> "(" + t + "[Title/Abstract])")
                .collect(Collectors.joining(" OR "));
        return cleanName + "[Author] AND (" + expertiseQuery + ") AND " + dateFilter();
    }

    @Override
    public boolean namesMatch(String name1, String name2) {
        String n1 = NameNormalizer.normalizeFull(name1);
        String n2 = NameNormalizer.normalizeFull(name2);
        if (n1.isEmpty() || n2.isEmpty()) {
            return false;
        }
        if (n1.equals(n2)) {
            return true;
        }
        String[] parts1 = n1.split(" ");
        String[] parts2 = n2.split(" ");
        if (!parts1[parts1.length - 1].equals(parts2[parts2.length - 1])) {
            return false;
        }

        String first1 = parts1[0];
        String first2 = parts2[0];
        if (first1.equals(first2)) {
            return true;
        }
        // 只有一方确实是缩写（1-2个字符）时才按前缀匹配："W" 可以匹配 "William"，"Will" 不能匹配 "Helen"
        if (first1.length() <= 2 && first2.startsWith(first1)) return true;
        if (first2.length() <= 2 && first1.startsWith(first2)) return true;

        // "W R Harcombe" 与 "William Harcombe"：首字母相同且一方多一个中间名
        if (first1.charAt(0) == first2.charAt(0)) {
            return (parts1.length == 3 && parts2.length == 2) || (parts2.length == 3 && parts1.length == 2);
        }
        return false;
    }

    @Override
    public List<Publication> filterToMatchingAuthor(List<Publication> publications, List<String> nameVariants) {
        if (publications == null || nameVariants == null || nameVariants.isEmpty()) {
            return Collections.emptyList();
        }
        return publications.stream()
                .filter(p -> p.getAuthors() != null && p.getAuthors().stream()
                        .anyMatch(author -> nameVariants.stream()
                                .anyMatch(variant -> namesMatch(variant, author.getName()))))
                .collect(Collectors.toList());
    }

    @Override
    public List<Publication> filterByExpertiseRelevance(List<Publication> publications, List<String> expertiseAreas) {
        if (publications == null) {
            return Collections.emptyList();
        }
        List<String> keywords = expertiseKeywords(expertiseAreas);
        if (keywords.isEmpty()) {
            return publications;
        }
        return publications.stream()
                .filter(p -> {
                    String text = p.getSearchText();
                    return keywords.stream().anyMatch(text::contains);
                })
                .collect(Collectors.toList());
    }

    @Override
    public String extractBestAffiliation(List<Publication> publications, List<String> nameVariants) {
        if (publications == null || publications.isEmpty()) {
            return null;
        }
        if (nameVariants != null) {
            for (String variant : nameVariants) {
                String affiliation = mostCommonAffiliation(publications, variant);
                if (affiliation != null) {
                    return affiliation;
                }
            }
        }
        return anyAffiliationOfMostRecent(publications);
    }

    @Override
    public double calculateExpertiseMatch(List<Publication> publications, List<String> expertiseAreas) {
        if (expertiseAreas == null || expertiseAreas.isEmpty()) {
            return properties.getVerification().getNeutralExpertiseScore();
        }
        if (publications == null || publications.isEmpty()) {
            return 0;
        }

        Set<String> keywords = new LinkedHashSet<>();
        for (String word : expertiseKeywords(expertiseAreas)) {
            keywords.add(word);
            keywords.addAll(SYNONYMS.getOrDefault(word, Collections.emptyList()));
        }

        int matchingPublications = 0;
        int totalKeywordMatches = 0;
        for (Publication publication : publications) {
            String text = publication.getSearchText();
            int hits = (int) keywords.stream().filter(text::contains).count();
            if (hits > 0) {
                matchingPublications++;
                totalKeywordMatches += hits;
            }
        }

        // 命中论文占比 + 平均命中数加成（每个5%，最多20%）
        double base = (double) matchingPublications / publications.size();
        double avgMatches = (double) totalKeywordMatches / publications.size();
        double bonus = Math.min(0.2, avgMatches * 0.05);
        double confidence = Math.min(1, base + bonus);
        return Math.round(confidence * 100) / 100.0;
    }

    @Override
    public ExpertiseMismatchResult checkExpertiseMismatch(List<Publication> publications,
                                                          List<String> claimedExpertise) {
        if (claimedExpertise == null || claimedExpertise.isEmpty()) {
            return ExpertiseMismatchResult.none();
        }
        if (publications == null || publications.isEmpty()) {
            return new ExpertiseMismatchResult(true, new ArrayList<>(claimedExpertise), Collections.emptyList());
        }

        Set<String> claimedTerms = new LinkedHashSet<>();
        for (String area : claimedExpertise) {
            if (area == null) continue;
            for (String part : EXPERTISE_PART_SPLIT.split(area.toLowerCase())) {
                List<String> words = Arrays.stream(part.trim().split("\\s+"))
                        .filter(w -> w.length() > 3)
                        .collect(Collectors.toList());
                claimedTerms.addAll(words);
                // 2-3个词的短语本身也可能是具体方向，如 "hnrnp proteins"
                if (words.size() >= 2 && words.size() <= 3) {
                    claimedTerms.add(String.join(" ", words));
                }
            }
        }
        List<String> specificTerms = claimedTerms.stream()
                .filter(t -> t.length() > 4 && !GENERIC_TERMS.contains(t))
                .collect(Collectors.toList());
        if (specificTerms.isEmpty()) {
            return ExpertiseMismatchResult.none();
        }

        String allText = publications.stream()
                .map(Publication::getSearchText)
                .collect(Collectors.joining(" "));
        List<String> matchedTerms = specificTerms.stream()
                .filter(allText::contains)
                .collect(Collectors.toList());
        return new ExpertiseMismatchResult(matchedTerms.isEmpty(), specificTerms, matchedTerms);
    }

    @Override
    public int countRecentPublications(List<Publication> publications) {
        if (publications == null) {
            return 0;
        }
        int cutoffYear = currentYear() - properties.getVerification().getYearsLookback();
        return (int) publications.stream()
                .filter(p -> p.getYear() != null && p.getYear() >= cutoffYear)
                .count();
    }

    private String mostCommonAffiliation(List<Publication> publications, String authorName) {
        // key为归一化后的机构名，保持首次出现顺序，次数相同时先出现者胜出
        Map<String, AffiliationCount> counts = new LinkedHashMap<>();
        for (Publication publication : publications) {
            if (publication.getAuthors() == null) continue;
            for (Author author : publication.getAuthors()) {
                String affiliation = author.getAffiliation();
                if (affiliation == null || affiliation.length() <= MIN_AFFILIATION_LENGTH
                        || !namesMatch(authorName, author.getName())) {
                    continue;
                }
                counts.computeIfAbsent(normalizeAffiliation(affiliation), k -> new AffiliationCount(affiliation))
                        .count++;
            }
        }

        AffiliationCount best = null;
        for (AffiliationCount entry : counts.values()) {
            if (best == null || entry.count > best.count) {
                best = entry;
            }
        }
        return best == null ? null : best.fullText;
    }

    private String anyAffiliationOfMostRecent(List<Publication> publications) {
        List<Publication> sorted = new ArrayList<>(publications);
        sorted.sort(Comparator.comparing((Publication p) -> p.getYear() == null ? 0 : p.getYear()).reversed());
        for (Publication publication : sorted) {
            if (publication.getAuthors() == null) continue;
            for (Author author : publication.getAuthors()) {
                if (author.getAffiliation() != null && author.getAffiliation().length() > MIN_AFFILIATION_LENGTH) {
                    return author.getAffiliation();
                }
            }
        }
        return null;
    }

    /**
     * 提取单位中的机构名部分用于归并计数（去掉邮箱、国家）
     */
    static String normalizeAffiliation(String affiliation) {
        String normalized = affiliation.toLowerCase();
        normalized = EMAIL.matcher(normalized).replaceAll("");
        normalized = AFFILIATION_COUNTRY.matcher(normalized).replaceFirst("");
        Matcher m = AFFILIATION_INSTITUTION.matcher(normalized);
        if (m.find()) {
            return m.group(1).trim();
        }
        return normalized.substring(0, Math.min(50, normalized.length())).trim();
    }

    private List<Publication> searchQuietly(PublicationSearch search, String query, int maxResults, String name) {
        try {
            List<Publication> result = search.search(query, maxResults);
            return result == null ? Collections.emptyList() : result;
        } catch (RuntimeException e) {
            log.error("[核验] {}: 检索失败: {}", name, query, e);
            return Collections.emptyList();
        }
    }

    private static List<Publication> dedupeByPmid(List<Publication> publications) {
        Set<String> seen = new HashSet<>();
        return publications.stream()
                .filter(p -> StringUtils.isNotBlank(p.getPmid()) && seen.add(p.getPmid()))
                .collect(Collectors.toList());
    }

    private static List<String> expertiseKeywords(List<String> expertiseAreas) {
        if (expertiseAreas == null) {
            return Collections.emptyList();
        }
        return expertiseAreas.stream()
                .filter(Objects::nonNull)
                .flatMap(area -> Arrays.stream(EXPERTISE_SPLIT.split(area.toLowerCase())))
                .filter(w -> w.length() > 3)
                .distinct()
                .collect(Collectors.toList());
    }

    private String dateFilter() {
        int year = currentYear();
        return "(" + (year - properties.getVerification().getYearsLookback()) + ":" + year + "[pdat])";
    }

    private int currentYear() {
        return LocalDate.now(clock).getYear();
    }

    /**
     * 限流暂停，被中断时恢复中断标记并返回false
     */
    private static boolean pause(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("限流等待被中断，停止后续检索");
            return false;
        }
    }

    private static final class AffiliationCount {
        private final String fullText;
        private int count;

        private AffiliationCount(String fullText) {
            this.fullText = fullText;
        }
    }
}
