package com.example.identity_resolution_engine.service.impl;

import com.example.identity_resolution_engine.config.IdentityProperties;
import com.example.identity_resolution_engine.model.Coauthorship;
import com.example.identity_resolution_engine.model.CoauthorshipCheckResult;
import com.example.identity_resolution_engine.model.Publication;
import com.example.identity_resolution_engine.search.PublicationSearch;
import com.example.identity_resolution_engine.service.CoauthorshipService;
import com.example.identity_resolution_engine.util.NameNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 合著利益冲突检查实现类。
 * 单个候选人内部按顺序检索；多个候选人按批提交到coiTaskExecutor并行执行。
 */
@Service
@Slf4j
public class CoauthorshipServiceImpl implements CoauthorshipService {

    private static final int SAMPLE_PAPER_LIMIT = 3;
    private static final String NOT_SPECIFIED = "not specified";

    private final IdentityProperties properties;
    private final AsyncTaskExecutor coiTaskExecutor;

    @Autowired
    public CoauthorshipServiceImpl(IdentityProperties properties,
                                   @Qualifier("coiTaskExecutor") AsyncTaskExecutor coiTaskExecutor) {
        this.properties = properties;
        this.coiTaskExecutor = coiTaskExecutor;
    }

    @Override
    public CoauthorshipCheckResult checkCOI(String candidateName, List<String> otherNames, PublicationSearch search) {
        Objects.requireNonNull(search, "search");
        CoauthorshipCheckResult result = CoauthorshipCheckResult.empty(candidateName);
        if (StringUtils.isBlank(candidateName) || otherNames == null || otherNames.isEmpty()) {
            return result;
        }

        String candidateQueryName = toAuthorSearchFormat(candidateName);
        long delayMs = properties.getSearch().getEffectiveRequestDelayMs();

        for (String otherName : otherNames) {
            String cleanName = NameNormalizer.stripLeadingTitle(otherName);
            if (cleanName.isEmpty() || NOT_SPECIFIED.equalsIgnoreCase(cleanName)) {
                continue;
            }

            String query = candidateQueryName + "[Author] AND " + toAuthorSearchFormat(cleanName) + "[Author]";
            List<Publication> papers;
            try {
                papers = search.search(query, properties.getCoi().getMaxResults());
            } catch (RuntimeException e) {
                log.warn("合著检查失败: {} & {}", candidateName, otherName, e);
                papers = Collections.emptyList();
            }

            if (papers != null && !papers.isEmpty()) {
                Coauthorship coauthorship = new Coauthorship();
                coauthorship.setOtherName(otherName);
                coauthorship.setPaperCount(papers.size());
                coauthorship.setSamplePapers(new ArrayList<>(papers.subList(0, Math.min(SAMPLE_PAPER_LIMIT, papers.size()))));
                result.getDetails().add(coauthorship);
                log.info("发现合著关系: {} 与 {} 共{}篇", candidateName, otherName, papers.size());
            }

            if (!pause(delayMs)) {
                break;
            }
        }
        result.setCoiDetected(!result.getDetails().isEmpty());
        return result;
    }

    @Override
    public List<CoauthorshipCheckResult> checkCandidates(List<String> candidateNames, List<String> otherNames,
                                                         PublicationSearch search) {
        Objects.requireNonNull(search, "search");
        if (candidateNames == null || candidateNames.isEmpty()) {
            return Collections.emptyList();
        }
        List<CoauthorshipCheckResult> results = new ArrayList<>();
        if (otherNames == null || otherNames.isEmpty()) {
            candidateNames.forEach(name -> results.add(CoauthorshipCheckResult.empty(name)));
            return results;
        }

        int batchSize = properties.getEffectiveCoiBatchSize();
        long timeoutMs = properties.getCoi().getCandidateTimeoutMs();
        long batchPauseMs = properties.getSearch().getEffectiveRequestDelayMs() * 2;

        for (int batchStart = 0; batchStart < candidateNames.size(); batchStart += batchSize) {
            int batchEnd = Math.min(batchStart + batchSize, candidateNames.size());
            List<String> batch = candidateNames.subList(batchStart, batchEnd);
            log.debug("检查候选人{}-{}/{}的合著冲突", batchStart + 1, batchEnd, candidateNames.size());

            List<Future<CoauthorshipCheckResult>> futures = new ArrayList<>();
            for (String candidateName : batch) {
                futures.add(coiTaskExecutor.submit(() -> checkCOI(candidateName, otherNames, search)));
            }

            for (int i = 0; i < futures.size(); i++) {
                Future<CoauthorshipCheckResult> future = futures.get(i);
                String candidateName = batch.get(i);
                try {
                    results.add(future.get(timeoutMs, TimeUnit.MILLISECONDS));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("候选人{}的合著检查超时({}ms)，按无冲突处理", candidateName, timeoutMs);
                    results.add(CoauthorshipCheckResult.empty(candidateName));
                } catch (ExecutionException e) {
                    log.error("候选人{}的合著检查异常，按无冲突处理", candidateName, e.getCause());
                    results.add(CoauthorshipCheckResult.empty(candidateName));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(f -> f.cancel(true));
                    log.warn("合著检查被中断，已完成{}/{}", results.size(), candidateNames.size());
                    return results;
                }
            }

            // 最后一批之后不再等待
            if (batchEnd < candidateNames.size() && !pause(batchPauseMs)) {
                log.warn("合著检查被中断，已完成{}/{}", results.size(), candidateNames.size());
                return results;
            }
        }
        long flagged = results.stream().filter(CoauthorshipCheckResult::isCoiDetected).count();
        log.info("合著冲突检查完成: {}位候选人，{}位存在合著", results.size(), flagged);
        return results;
    }

    @Override
    public String toAuthorSearchFormat(String name) {
        String cleanName = NameNormalizer.stripLeadingTitle(name);
        String[] parts = StringUtils.split(cleanName);
        if (parts == null || parts.length < 2) {
            return cleanName;
        }
        String lastName = parts[parts.length - 1];
        char firstInitial = Character.toUpperCase(parts[0].charAt(0));
        return lastName + " " + firstInitial;
    }

    private static boolean pause(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
