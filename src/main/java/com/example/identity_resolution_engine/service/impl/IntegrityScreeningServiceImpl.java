package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.model.AuthorMatch;
import com.example.identity_resolution_engine.model.RetractionMatch;
import com.example.identity_resolution_engine.model.RetractionRecord;
import com.example.identity_resolution_engine.service.IntegrityScreeningService;
import com.example.identity_resolution_engine.service.NameMatchService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 撤稿记录筛查实现类
 */
@Service
@Slf4j
public class IntegrityScreeningServiceImpl implements IntegrityScreeningService {

    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("[;,]");

    private final NameMatchService nameMatchService;

    @Autowired
    public IntegrityScreeningServiceImpl(NameMatchService nameMatchService) {
        this.nameMatchService = nameMatchService;
    }

    @Override
    public List<RetractionMatch> screen(String name, String institution, List<RetractionRecord> records) {
        if (StringUtils.isBlank(name) || records == null || records.isEmpty()) {
            return Collections.emptyList();
        }
        boolean commonName = nameMatchService.isCommonName(name);
        Set<String> seenRecordIds = new HashSet<>();
        List<RetractionMatch> matches = new ArrayList<>();

        for (RetractionRecord record : records) {
            if (StringUtils.isBlank(record.getAuthors())
                    || (record.getRecordId() != null && seenRecordIds.contains(record.getRecordId()))) {
                continue;
            }
            List<String> authors = Arrays.stream(AUTHOR_SEPARATOR.split(record.getAuthors()))
                    .map(String::trim)
                    .filter(StringUtils::isNotEmpty)
                    .collect(Collectors.toList());

            List<AuthorMatch> authorMatches = nameMatchService.findMatchesInAuthors(
                    name, institution, authors, NameMatchService.DEFAULT_MIN_CONFIDENCE);
            if (authorMatches.isEmpty()) {
                continue;
            }

            AuthorMatch best = authorMatches.get(0);
            for (AuthorMatch m : authorMatches) {
                if (m.getConfidence() > best.getConfidence()) {
                    best = m;
                }
            }

            int confidence = nameMatchService.adjustForInstitution(best.getConfidence(), institution,
                    record.getInstitution());

            RetractionMatch match = new RetractionMatch();
            match.setRecord(record);
            match.setMatchedAuthor(best.getMatchedName());
            match.setConfidence(confidence);
            match.setConfidenceLevel(nameMatchService.confidenceLevel(confidence));
            match.setMatchType(best.getMatchType());
            match.setCommonName(commonName);
            matches.add(match);
            if (record.getRecordId() != null) {
                seenRecordIds.add(record.getRecordId());
            }
        }

        matches.sort(Comparator.comparingInt(RetractionMatch::getConfidence).reversed());
        if (!matches.isEmpty()) {
            log.info("撤稿筛查: {} 命中{}条记录{}", name, matches.size(), commonName ? "（常见姓名，需人工复核）" : "");
        }
        return matches;
    }
}
