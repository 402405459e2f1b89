package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.model.ConfidenceLevel;
import com.example.identity_resolution_engine.model.MatchType;
import com.example.identity_resolution_engine.model.RetractionMatch;
import com.example.identity_resolution_engine.model.RetractionRecord;
import com.example.identity_resolution_engine.service.impl.IntegrityScreeningServiceImpl;
import com.example.identity_resolution_engine.service.impl.NameMatchServiceImpl;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 撤稿记录筛查测试
 */
public class IntegrityScreeningServiceTest {

    private final IntegrityScreeningService screeningService =
            new IntegrityScreeningServiceImpl(new NameMatchServiceImpl());

    @Test
    public void testMatchesSortedByConfidence() {
        List<RetractionRecord> records = List.of(
                record("R2", "J. Smith, A. Patel", "MIT"),
                record("R1", "John Smith; Jane Doe", "Stanford University"),
                record("R1", "John Smith; Jane Doe", "Stanford University"),
                record("R4", "Jane Doe", "Stanford University"));

        List<RetractionMatch> matches = screeningService.screen("John Smith", "Stanford University", records);

        assertThat(matches).extracting(RetractionMatch::getRecord)
                .extracting(RetractionRecord::getRecordId).containsExactly("R1", "R2");
        RetractionMatch exact = matches.get(0);
        assertThat(exact.getMatchedAuthor()).isEqualTo("John Smith");
        assertThat(exact.getConfidence()).isEqualTo(100);
        assertThat(exact.getConfidenceLevel()).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(exact.getMatchType()).isEqualTo(MatchType.EXACT);
        assertThat(exact.isCommonName()).isTrue();

        RetractionMatch initial = matches.get(1);
        assertThat(initial.getMatchedAuthor()).isEqualTo("J. Smith");
        assertThat(initial.getConfidence()).isEqualTo(85);
        assertThat(initial.getConfidenceLevel()).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    public void testRecordInstitutionRaisesConfidence() {
        List<RetractionMatch> matches = screeningService.screen("Forest Rohwer", "San Diego State University",
                List.of(record("R9", "F. Rohwer; B. Knowles", "San Diego State University")));

        assertThat(matches).hasSize(1);
        assertThat(matches.get(0).getConfidence()).isEqualTo(100);
        assertThat(matches.get(0).getMatchType()).isEqualTo(MatchType.LAST_FIRST_INITIAL);
        assertThat(matches.get(0).isCommonName()).isFalse();
    }

    @Test
    public void testNothingToScreen() {
        assertThat(screeningService.screen("", "MIT", List.of(record("R1", "John Smith", "MIT")))).isEmpty();
        assertThat(screeningService.screen("John Smith", "MIT", Collections.emptyList())).isEmpty();
        assertThat(screeningService.screen("John Smith", "MIT", List.of(record("R1", null, "MIT")))).isEmpty();
    }

    private static RetractionRecord record(String id, String authors, String institution) {
        RetractionRecord r = new RetractionRecord();
        r.setRecordId(id);
        r.setAuthors(authors);
        r.setInstitution(institution);
        r.setTitle("Retracted article " + id);
        return r;
    }
}
