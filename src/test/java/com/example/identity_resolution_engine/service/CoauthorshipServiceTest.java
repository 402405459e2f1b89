package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.config.IdentityProperties;
import com.example.identity_resolution_engine.model.CoauthorshipCheckResult;
import com.example.identity_resolution_engine.model.Publication;
import com.example.identity_resolution_engine.search.PublicationSearch;
import com.example.identity_resolution_engine.service.impl.CoauthorshipServiceImpl;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 合著利益冲突检查测试
 */
public class CoauthorshipServiceTest {

    private IdentityProperties properties;
    private ThreadPoolTaskExecutor executor;
    private CoauthorshipService coauthorshipService;

    @BeforeEach
    public void setUp() {
        properties = new IdentityProperties();
        properties.getSearch().setRequestDelayMs(0);
        properties.getSearch().setCredentialedRequestDelayMs(0);
        properties.getCoi().setCandidateTimeoutMs(5000);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("coi-test-");
        executor.initialize();

        coauthorshipService = new CoauthorshipServiceImpl(properties, executor);
    }

    @AfterEach
    public void tearDown() {
        executor.shutdown();
    }

    @Test
    public void testAuthorSearchFormat() {
        assertThat(coauthorshipService.toAuthorSearchFormat("Forest Rohwer")).isEqualTo("Rohwer F");
        assertThat(coauthorshipService.toAuthorSearchFormat("Dr. William R. Harcombe")).isEqualTo("Harcombe W");
        assertThat(coauthorshipService.toAuthorSearchFormat("Madonna")).isEqualTo("Madonna");
    }

    @Test
    public void testCoauthorshipDetected() {
        List<String> queries = new CopyOnWriteArrayList<>();
        PublicationSearch search = (query, max) -> {
            queries.add(query);
            return query.contains("Smith J[Author]") ? papers(5) : Collections.emptyList();
        };

        CoauthorshipCheckResult result = coauthorshipService.checkCOI("Forest Rohwer",
                List.of("John Smith", "Not specified", " ", "Jane Doe"), search);

        assertThat(result.isCoiDetected()).isTrue();
        assertThat(result.getDetails()).hasSize(1);
        assertThat(result.getDetails().get(0).getOtherName()).isEqualTo("John Smith");
        assertThat(result.getDetails().get(0).getPaperCount()).isEqualTo(5);
        assertThat(result.getDetails().get(0).getSamplePapers()).hasSize(3);
        assertThat(queries).containsExactly(
                "Rohwer F[Author] AND Smith J[Author]",
                "Rohwer F[Author] AND Doe J[Author]");
    }

    @Test
    public void testNoCoauthorship() {
        CoauthorshipCheckResult result = coauthorshipService.checkCOI("Forest Rohwer", List.of("Jane Doe"),
                (query, max) -> Collections.emptyList());

        assertThat(result.isCoiDetected()).isFalse();
        assertThat(result.getDetails()).isEmpty();
        assertThat(coauthorshipService.checkCOI("Forest Rohwer", null, (query, max) -> papers(1)).isCoiDetected())
                .isFalse();
    }

    @Test
    public void testSearchFailureIsNotAConflict() {
        CoauthorshipCheckResult result = coauthorshipService.checkCOI("Forest Rohwer", List.of("Jane Doe"),
                (query, max) -> {
                    throw new IllegalStateException("rate limited");
                });

        assertThat(result.isCoiDetected()).isFalse();
        assertThatThrownBy(() -> coauthorshipService.checkCOI("Forest Rohwer", List.of("Jane Doe"), null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    public void testCheckCandidatesKeepsInputOrder() {
        PublicationSearch search = (query, max) -> query.startsWith("Lovelace A") ? papers(2) : Collections.emptyList();

        List<CoauthorshipCheckResult> results = coauthorshipService.checkCandidates(
                List.of("Grace Hopper", "Ada Lovelace", "Alan Turing", "Edsger Dijkstra", "Barbara Liskov"),
                List.of("John Smith"), search);

        assertThat(results).extracting(CoauthorshipCheckResult::getCandidateName)
                .containsExactly("Grace Hopper", "Ada Lovelace", "Alan Turing", "Edsger Dijkstra", "Barbara Liskov");
        assertThat(results).extracting(CoauthorshipCheckResult::isCoiDetected)
                .containsExactly(false, true, false, false, false);
    }

    @Test
    public void testCheckCandidatesWithoutOtherNames() {
        List<CoauthorshipCheckResult> results = coauthorshipService.checkCandidates(
                List.of("Grace Hopper"), Collections.emptyList(), (query, max) -> papers(1));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).isCoiDetected()).isFalse();
        assertThat(coauthorshipService.checkCandidates(null, List.of("John Smith"), (query, max) -> papers(1)))
                .isEmpty();
    }

    @Test
    public void testSlowCandidateTimesOut() {
        properties.getCoi().setCandidateTimeoutMs(200);
        PublicationSearch search = (query, max) -> {
            if (query.startsWith("Slowpoke S")) {
                try {
                    Thread.sleep(3000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return papers(1);
        };

        List<CoauthorshipCheckResult> results = coauthorshipService.checkCandidates(
                List.of("Sam Slowpoke", "Ada Lovelace"), List.of("John Smith"), search);

        assertThat(results).extracting(CoauthorshipCheckResult::getCandidateName)
                .containsExactly("Sam Slowpoke", "Ada Lovelace");
        assertThat(results.get(0).isCoiDetected()).isFalse();
        assertThat(results.get(1).isCoiDetected()).isTrue();
    }

    private static List<Publication> papers(int count) {
        List<Publication> papers = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Publication p = new Publication();
            p.setPmid(String.valueOf(1000 + i));
            p.setTitle("Joint paper " + i);
            papers.add(p);
        }
        return papers;
    }
}
