package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.model.Candidate;
import com.example.identity_resolution_engine.model.MergedResearcher;
import com.example.identity_resolution_engine.model.Publication;
import com.example.identity_resolution_engine.service.impl.DeduplicationServiceImpl;
import com.example.identity_resolution_engine.service.impl.InstitutionMatchServiceImpl;
import com.example.identity_resolution_engine.service.impl.NameMatchServiceImpl;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 候选人去重合并测试
 */
public class DeduplicationServiceTest {

    private DeduplicationService deduplicationService;

    @BeforeEach
    public void setUp() {
        deduplicationService = new DeduplicationServiceImpl(new NameMatchServiceImpl(), new InstitutionMatchServiceImpl());
    }

    @Test
    public void testDeduplicateFixture() throws IOException {
        List<Candidate> candidates = loadCandidates("/fixtures/candidates-smith.json");

        List<MergedResearcher> merged = deduplicationService.deduplicate(candidates);

        assertThat(merged).hasSize(2);
        MergedResearcher smith = merged.get(0);
        assertThat(smith.getName()).isEqualTo("John Smith");
        assertThat(smith.getNormalizedName()).isEqualTo("john smith");
        assertThat(smith.getAffiliation()).isEqualTo("Massachusetts Institute of Technology");
        assertThat(smith.getHIndex()).isEqualTo(25);
        assertThat(smith.getTotalCitations()).isEqualTo(4100);
        assertThat(smith.getSources()).containsExactly("pubmed", "scholar");
        assertThat(smith.getKeywords()).containsExactly("microbiome", "phage");
        assertThat(smith.getPublications()).extracting(Publication::getPmid).containsExactly("34567890");
        assertThat(smith.isClaudeSuggested()).isFalse();

        MergedResearcher doe = merged.get(1);
        assertThat(doe.getName()).isEqualTo("Jane Doe");
        assertThat(doe.isClaudeSuggested()).isTrue();
        assertThat(doe.getClaudeReason()).isEqualTo("Works on phage ecology in marine systems");
    }

    @Test
    public void testGroupingIsGreedyFromFirstMember() {
        List<Candidate> candidates = Arrays.asList(
                new Candidate("Robert Chen", "UCSF", "pubmed"),
                new Candidate("Bob Chen", null, "scholar"),
                new Candidate("R. Chen", "University of California, San Francisco", "arxiv"),
                new Candidate("Rachel Green", "Yale University", "pubmed"));

        List<List<Candidate>> groups = deduplicationService.group(candidates);

        assertThat(groups).hasSize(2);
        assertThat(groups.get(0)).extracting(Candidate::getName)
                .containsExactly("Robert Chen", "Bob Chen", "R. Chen");
        assertThat(groups.get(1)).extracting(Candidate::getName).containsExactly("Rachel Green");
    }

    @Test
    public void testMergeTieKeepsFirstValue() {
        Candidate first = new Candidate("Anna Berg", "Lund University", "pubmed");
        Candidate second = new Candidate("Anna Berg", "Umea University", "arxiv");

        MergedResearcher merged = deduplicationService.merge(List.of(first, second));

        assertThat(merged.getAffiliation()).isEqualTo("Lund University");
        assertThat(merged.getHIndex()).isZero();
        assertThat(merged.getTotalCitations()).isZero();
    }

    @Test
    public void testMergeWithoutNameIsDropped() {
        assertThat(deduplicationService.merge(Collections.emptyList())).isNull();
        assertThat(deduplicationService.merge(List.of(new Candidate(" ", "MIT", "pubmed")))).isNull();
        assertThat(deduplicationService.deduplicate(null)).isEmpty();
    }

    @Test
    public void testNameSimilarityHelpers() {
        assertThat(deduplicationService.isInitialsMatch("J. Smith", "John Smith")).isTrue();
        assertThat(deduplicationService.isInitialsMatch("J. Smith", "Jane Doe")).isFalse();
        assertThat(deduplicationService.isPartialMatch("Chris Lee", "Christopher Lee")).isTrue();
        assertThat(deduplicationService.areNamesSimilar("Smith, John", "John Smith")).isTrue();
        assertThat(deduplicationService.areNamesSimilar("Will Harcombe", "Helen Harcombe")).isFalse();
        assertThat(deduplicationService.areNamesSimilar(null, "John Smith")).isFalse();
    }

    @Test
    public void testFilterConflicts() {
        MergedResearcher sameInstitution = researcher("Alice Wong", "MIT");
        MergedResearcher excluded = researcher("Jane Doe", "Stanford University");
        MergedResearcher kept = researcher("Omar Haddad", "University of Toronto");
        MergedResearcher noAffiliation = researcher("Lena Fischer", null);

        List<MergedResearcher> result = deduplicationService.filterConflicts(
                List.of(sameInstitution, excluded, kept, noAffiliation),
                "Massachusetts Institute of Technology", List.of("Dr. Jane Doe"));

        assertThat(result).extracting(MergedResearcher::getName).containsExactly("Omar Haddad", "Lena Fischer");
    }

    @Test
    public void testExcludedNamesApplyWithoutInstitution() {
        List<MergedResearcher> result = deduplicationService.filterConflicts(
                List.of(researcher("Jane Doe", "MIT"), researcher("Alice Wong", "MIT")), null, Set.of("jane doe"));

        assertThat(result).extracting(MergedResearcher::getName).containsExactly("Alice Wong");
    }

    @Test
    public void testRankByRelevance() {
        MergedResearcher suggested = researcher("Jane Doe", "Stanford University");
        suggested.setClaudeSuggested(true);
        suggested.getSources().add("claude");

        MergedResearcher established = researcher("John Smith", "MIT");
        established.setHIndex(30);
        established.setTotalCitations(1000);
        established.getSources().addAll(List.of("pubmed", "scholar"));
        for (int i = 0; i < 5; i++) {
            established.getPublications().add(new Publication());
        }

        List<MergedResearcher> ranked = deduplicationService.rankByRelevance(
                List.of(suggested, established), Collections.emptyList());

        assertThat(ranked).extracting(MergedResearcher::getName).containsExactly("John Smith", "Jane Doe");
        // 25 建议 + 10 单位 + 5 来源
        assertThat(suggested.getRelevanceScore()).isEqualTo(40.0);
        // 20 论文 + 20 h指数 + 15 引用 + 10 单位 + 10 来源
        assertThat(established.getRelevanceScore()).isEqualTo(75.0);
    }

    @Test
    public void testKeywordOverlapBreaksTies() {
        MergedResearcher a = researcher("Ana Lima", "USP");
        MergedResearcher b = researcher("Ben Okafor", "UCT");
        b.getKeywords().add("Phage ecology");

        List<MergedResearcher> ranked = deduplicationService.rankByRelevance(
                new ArrayList<>(List.of(a, b)), List.of("phage"));

        assertThat(ranked).extracting(MergedResearcher::getName).containsExactly("Ben Okafor", "Ana Lima");
        assertThat(b.getRelevanceScore() - a.getRelevanceScore()).isEqualTo(3.0);
    }

    @Test
    public void testEqualScoresKeepInputOrder() {
        List<MergedResearcher> ranked = deduplicationService.rankByRelevance(
                List.of(researcher("First Person", "X"), researcher("Second Person", "Y")), null);

        assertThat(ranked).extracting(MergedResearcher::getName).containsExactly("First Person", "Second Person");
    }

    @Test
    public void testFilterByMinimumQualifications() {
        MergedResearcher junior = researcher("Junior Researcher", "MIT");
        junior.setHIndex(4);
        MergedResearcher senior = researcher("Senior Researcher", "MIT");
        senior.setHIndex(18);

        assertThat(deduplicationService.filterByMinimumQualifications(List.of(junior, senior),
                DeduplicationService.DEFAULT_MIN_H_INDEX))
                .extracting(MergedResearcher::getName).containsExactly("Senior Researcher");
    }

    private static MergedResearcher researcher(String name, String affiliation) {
        MergedResearcher r = new MergedResearcher();
        r.setName(name);
        r.setAffiliation(affiliation);
        return r;
    }

    private static List<Candidate> loadCandidates(String resource) throws IOException {
        try (InputStream in = DeduplicationServiceTest.class.getResourceAsStream(resource)) {
            return new ObjectMapper().readValue(in, new TypeReference<List<Candidate>>() {
            });
        }
    }
}
