package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.model.Candidate;
import com.example.identity_resolution_engine.model.MergedResearcher;
import com.example.identity_resolution_engine.service.DeduplicationService;
import com.example.identity_resolution_engine.service.InstitutionMatchService;
import com.example.identity_resolution_engine.service.NameMatchService;
import com.example.identity_resolution_engine.util.NameNormalizer;
import com.example.identity_resolution_engine.util.StringSimilarity;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 候选人去重合并实现类。
 * 分组为O(n²)贪心算法，单个申请书的候选人规模在几十到一两百之间。
 */
@Service
@Slf4j
public class DeduplicationServiceImpl implements DeduplicationService {

    private static final double NAME_SIMILARITY_THRESHOLD = 0.85;
    private static final String CLAUDE_SOURCE = "claude";

    private final NameMatchService nameMatchService;
    private final InstitutionMatchService institutionMatchService;

    @Autowired
    public DeduplicationServiceImpl(NameMatchService nameMatchService,
                                    InstitutionMatchService institutionMatchService) {
        this.nameMatchService = nameMatchService;
        this.institutionMatchService = institutionMatchService;
    }

    @Override
    public List<List<Candidate>> group(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Collections.emptyList();
        }
        List<List<Candidate>> groups = new ArrayList<>();
        boolean[] processed = new boolean[candidates.size()];

        for (int i = 0; i < candidates.size(); i++) {
            if (processed[i]) continue;

            List<Candidate> group = new ArrayList<>();
            group.add(candidates.get(i));
            processed[i] = true;

            for (int j = i + 1; j < candidates.size(); j++) {
                if (processed[j]) continue;
                if (areNamesSimilar(candidates.get(i).getName(), candidates.get(j).getName())) {
                    group.add(candidates.get(j));
                    processed[j] = true;
                }
            }
            groups.add(group);
        }
        log.debug("{}条候选人分为{}组", candidates.size(), groups.size());
        return groups;
    }

    @Override
    public MergedResearcher merge(List<Candidate> group) {
        if (group == null || group.isEmpty()) {
            return null;
        }
        String bestName = selectBest(group, Candidate::getName);
        if (bestName == null) {
            return null;
        }

        MergedResearcher merged = new MergedResearcher();
        merged.setName(bestName);
        merged.setNormalizedName(NameNormalizer.normalizeFull(bestName));
        merged.setAffiliation(selectBest(group, Candidate::getAffiliation));
        merged.setEmail(selectBest(group, Candidate::getEmail));
        merged.setWebsite(selectBest(group, Candidate::getWebsite));
        merged.setClaudeReason(selectBest(group, Candidate::getClaudeReason));

        int hIndex = 0;
        long citations = 0;
        for (Candidate c : group) {
            hIndex = Math.max(hIndex, c.getHIndex() == null ? 0 : c.getHIndex());
            citations = Math.max(citations, c.getCitations() == null ? 0 : c.getCitations());
            if (StringUtils.isNotBlank(c.getSource())) {
                merged.getSources().add(c.getSource());
            }
            // 不在此处按DOI/PMID去重，由下游处理
            if (c.getPublications() != null) {
                merged.getPublications().addAll(c.getPublications());
            }
            if (c.getKeywords() != null) {
                merged.getKeywords().addAll(c.getKeywords());
            }
        }
        merged.setHIndex(hIndex);
        merged.setTotalCitations(citations);
        merged.setClaudeSuggested(group.stream().anyMatch(c -> CLAUDE_SOURCE.equals(c.getSource())));
        return merged;
    }

    @Override
    public List<MergedResearcher> deduplicate(List<Candidate> candidates) {
        return group(candidates).stream()
                .map(this::merge)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    public boolean areNamesSimilar(String name1, String name2) {
        if (StringUtils.isBlank(name1) || StringUtils.isBlank(name2)) {
            return false;
        }
        if (nameMatchService.match(name1, name2).isMatches()) {
            return true;
        }
        String normalized1 = NameNormalizer.normalizeFull(name1);
        String normalized2 = NameNormalizer.normalizeFull(name2);
        if (StringSimilarity.compare(normalized1, normalized2) > NAME_SIMILARITY_THRESHOLD) {
            return true;
        }
        return isInitialsMatch(name1, name2) || isPartialMatch(name1, name2);
    }

    @Override
    public boolean isInitialsMatch(String name1, String name2) {
        String[] parts1 = tokens(name1);
        String[] parts2 = tokens(name2);
        if (parts1.length < 2 || parts2.length < 2 || !sameLastToken(parts1, parts2)) {
            return false;
        }
        String first1 = parts1[0].toLowerCase().replace(".", "");
        String first2 = parts2[0].toLowerCase().replace(".", "");
        if (first1.length() == 1 && first2.startsWith(first1)) return true;
        return first2.length() == 1 && first1.startsWith(first2);
    }

    @Override
    public boolean isPartialMatch(String name1, String name2) {
        String[] parts1 = tokens(name1);
        String[] parts2 = tokens(name2);
        if (parts1.length < 2 || parts2.length < 2 || !sameLastToken(parts1, parts2)) {
            return false;
        }
        String first1 = parts1[0].toLowerCase();
        String first2 = parts2[0].toLowerCase();
        return first1.contains(first2) || first2.contains(first1);
    }

    @Override
    public List<MergedResearcher> filterConflicts(List<MergedResearcher> researchers, String authorInstitution,
                                                  Collection<String> excludeNames) {
        if (researchers == null) {
            return Collections.emptyList();
        }
        Set<String> excluded = excludeNames == null ? Collections.emptySet() : excludeNames.stream()
                .map(NameNormalizer::normalizeFull)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.toSet());
        boolean checkInstitution = StringUtils.isNotBlank(authorInstitution);

        List<MergedResearcher> kept = new ArrayList<>();
        for (MergedResearcher researcher : researchers) {
            if (checkInstitution && StringUtils.isNotBlank(researcher.getAffiliation())
                    && institutionMatchService.institutionsMatch(authorInstitution, researcher.getAffiliation())) {
                log.debug("排除同机构研究者: {} ({})", researcher.getName(), researcher.getAffiliation());
                continue;
            }
            if (excluded.contains(NameNormalizer.normalizeFull(researcher.getName()))) {
                log.debug("排除名单中的研究者: {}", researcher.getName());
                continue;
            }
            kept.add(researcher);
        }
        return kept;
    }

    @Override
    public List<MergedResearcher> rankByRelevance(List<MergedResearcher> researchers, List<String> keywords) {
        if (researchers == null || researchers.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> proposalKeywords = keywords == null ? Collections.emptyList() : keywords;
        for (MergedResearcher researcher : researchers) {
            researcher.setRelevanceScore(score(researcher, proposalKeywords));
        }
        List<MergedResearcher> ranked = new ArrayList<>(researchers);
        // List.sort为稳定排序，同分保持原顺序
        ranked.sort(Comparator.comparing(MergedResearcher::getRelevanceScore).reversed());
        return ranked;
    }

    @Override
    public List<MergedResearcher> filterByMinimumQualifications(List<MergedResearcher> researchers, int minHIndex) {
        if (researchers == null) {
            return Collections.emptyList();
        }
        return researchers.stream()
                .filter(r -> r.getHIndex() >= minHIndex)
                .collect(Collectors.toList());
    }

    private double score(MergedResearcher researcher, List<String> proposalKeywords) {
        double score = 0;

        // 建议名单中的人选是较强的信号
        if (researcher.isClaudeSuggested()) {
            score += 25;
        }

        int pubCount = researcher.getPublications() == null ? 0 : researcher.getPublications().size();
        score += Math.min(pubCount * 5, 20);

        score += Math.min(researcher.getHIndex(), 20);

        long citations = researcher.getTotalCitations();
        if (citations > 0) {
            score += Math.min(Math.log10(citations) * 5, 15);
        }

        if (StringUtils.isNotBlank(researcher.getAffiliation())) {
            score += 10;
        }

        int sourceCount = researcher.getSources() == null || researcher.getSources().isEmpty()
                ? 1 : researcher.getSources().size();
        score += Math.min(sourceCount * 5, 10);

        if (!proposalKeywords.isEmpty() && researcher.getKeywords() != null && !researcher.getKeywords().isEmpty()) {
            long matching = proposalKeywords.stream()
                    .filter(StringUtils::isNotBlank)
                    .map(String::toLowerCase)
                    .filter(kw -> researcher.getKeywords().stream()
                            .filter(Objects::nonNull)
                            .map(String::toLowerCase)
                            .anyMatch(rk -> rk.contains(kw) || kw.contains(rk)))
                    .count();
            score += Math.min(matching * 3, 10);
        }
        return score;
    }

    private static String selectBest(List<Candidate> group, Function<Candidate, String> field) {
        String best = null;
        for (Candidate c : group) {
            String value = field.apply(c);
            if (StringUtils.isNotBlank(value) && (best == null || value.length() > best.length())) {
                best = value;
            }
        }
        return best;
    }

    private static String[] tokens(String name) {
        return name == null ? new String[0] : StringUtils.split(name.trim());
    }

    private static boolean sameLastToken(String[] parts1, String[] parts2) {
        return parts1[parts1.length - 1].equalsIgnoreCase(parts2[parts2.length - 1]);
    }
}
