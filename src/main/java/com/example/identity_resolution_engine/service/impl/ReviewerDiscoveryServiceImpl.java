package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.config.IdentityProperties;
import com.example.identity_resolution_engine.dto.DiscoveryRequest;
import com.example.identity_resolution_engine.dto.DiscoveryResult;
import com.example.identity_resolution_engine.dto.ReviewerSuggestion;
import com.example.identity_resolution_engine.dto.VerificationBatchResult;
import com.example.identity_resolution_engine.model.Candidate;
import com.example.identity_resolution_engine.model.CoauthorshipCheckResult;
import com.example.identity_resolution_engine.model.MergedResearcher;
import com.example.identity_resolution_engine.model.VerificationResult;
import com.example.identity_resolution_engine.search.PublicationSearch;
import com.example.identity_resolution_engine.service.CoauthorshipService;
import com.example.identity_resolution_engine.service.DeduplicationService;
import com.example.identity_resolution_engine.service.PublicationVerificationService;
import com.example.identity_resolution_engine.service.ReviewerDiscoveryService;
import com.example.identity_resolution_engine.util.NameNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 审稿人发现流程实现类：
 * 核验建议名单 -> 剔除与已核验者同名的检出候选人 -> 去重合并 -> 同机构过滤 -> 发表数过滤 -> 合著检查 -> 综合排序
 */
@Service
@Slf4j
public class ReviewerDiscoveryServiceImpl implements ReviewerDiscoveryService {

    private static final String SUGGESTION_SOURCE = "claude";

    private final PublicationVerificationService verificationService;
    private final DeduplicationService deduplicationService;
    private final CoauthorshipService coauthorshipService;
    private final IdentityProperties properties;

    @Autowired
    public ReviewerDiscoveryServiceImpl(PublicationVerificationService verificationService,
                                        DeduplicationService deduplicationService,
                                        CoauthorshipService coauthorshipService,
                                        IdentityProperties properties) {
        this.verificationService = verificationService;
        this.deduplicationService = deduplicationService;
        this.coauthorshipService = coauthorshipService;
        this.properties = properties;
    }

    @Override
    public DiscoveryResult resolve(DiscoveryRequest request, PublicationSearch search) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(search, "search");
        DiscoveryResult result = new DiscoveryResult();
        DiscoveryResult.Stats stats = result.getStats();

        List<ReviewerSuggestion> suggestions = request.getSuggestions();
        stats.setSuggestionsTotal(suggestions.size());
        VerificationBatchResult batch = verificationService.verifyAll(suggestions, search);
        result.setVerified(batch.getVerified());
        result.setUnverified(batch.getUnverified());
        stats.setSuggestionsVerified(batch.getVerified().size());

        List<String> verifiedNames = batch.getVerified().stream()
                .map(VerificationResult::getClaimedName)
                .collect(Collectors.toList());

        List<Candidate> discovered = request.getDiscoveredCandidates();
        stats.setTotalBeforeDedup(discovered.size());
        List<Candidate> newCandidates = discovered.stream()
                .filter(c -> verifiedNames.stream().noneMatch(v -> deduplicationService.areNamesSimilar(c.getName(), v)))
                .collect(Collectors.toList());

        List<MergedResearcher> deduplicated = deduplicationService.deduplicate(newCandidates);
        stats.setTotalAfterDedup(deduplicated.size());

        List<MergedResearcher> filtered = deduplicationService.filterConflicts(
                deduplicated, request.getAuthorInstitution(), request.getExcludeNames());
        stats.setFilteredByCoi(deduplicated.size() - filtered.size());

        int minPublications = properties.getVerification().getMinPublications();
        List<MergedResearcher> qualified = filtered.stream()
                .filter(r -> r.getPublications().size() >= minPublications)
                .collect(Collectors.toList());
        result.setDiscovered(qualified);

        if (request.isCheckCoauthorships() && !request.getProposalAuthors().isEmpty() && !verifiedNames.isEmpty()) {
            List<CoauthorshipCheckResult> coi = coauthorshipService.checkCandidates(
                    verifiedNames, request.getProposalAuthors(), search);
            for (CoauthorshipCheckResult check : coi) {
                result.getCoauthorships().put(check.getCandidateName(), check);
            }
            stats.setCoauthorConflicts((int) coi.stream().filter(CoauthorshipCheckResult::isCoiDetected).count());
        }

        List<MergedResearcher> all = new ArrayList<>();
        Map<String, ReviewerSuggestion> suggestionByName = new HashMap<>();
        suggestions.forEach(s -> suggestionByName.putIfAbsent(s.getName(), s));
        for (VerificationResult verified : batch.getVerified()) {
            all.add(toResearcher(verified, suggestionByName.get(verified.getClaimedName())));
        }
        all.addAll(qualified);
        result.setRanked(deduplicationService.rankByRelevance(all, request.getKeywords()));

        log.info("审稿人发现完成: 核验通过{}位，检出{}位（去重前{}，同机构过滤{}）",
                stats.getSuggestionsVerified(), qualified.size(), stats.getTotalBeforeDedup(), stats.getFilteredByCoi());
        return result;
    }

    private static MergedResearcher toResearcher(VerificationResult verified, ReviewerSuggestion suggestion) {
        MergedResearcher researcher = new MergedResearcher();
        researcher.setName(verified.getClaimedName());
        researcher.setNormalizedName(NameNormalizer.normalizeFull(verified.getClaimedName()));
        researcher.setAffiliation(verified.getAffiliation());
        researcher.setPublications(new ArrayList<>(verified.getPublications()));
        researcher.getSources().add(SUGGESTION_SOURCE);
        researcher.setClaudeSuggested(true);
        if (suggestion != null) {
            researcher.setClaudeReason(suggestion.getReason());
            if (suggestion.getExpertiseAreas() != null) {
                researcher.getKeywords().addAll(suggestion.getExpertiseAreas());
            }
        }
        return researcher;
    }
}
