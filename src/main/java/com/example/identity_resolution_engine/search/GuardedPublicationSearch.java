package com.example.identity_resolution_engine.search;

import com.example.identity_resolution_engine.model.Publication;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 给检索调用加上超时保护：超时、异常或返回null时一律按空结果处理并记录日志。
 */
@Slf4j
public class GuardedPublicationSearch implements PublicationSearch {

    private final PublicationSearch delegate;
    private final AsyncTaskExecutor executor;
    private final long timeoutMs;

    public GuardedPublicationSearch(PublicationSearch delegate, AsyncTaskExecutor executor, long timeoutMs) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeoutMs = timeoutMs;
    }

    @Override
    public List<Publication> search(String query, int maxResults) {
        if (StringUtils.isBlank(query) || maxResults <= 0) {
            return Collections.emptyList();
        }
        Future<List<Publication>> future = executor.submit(() -> delegate.search(query, maxResults));
        try {
            List<Publication> result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result == null ? Collections.emptyList() : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("文献检索超时({}ms)，按空结果处理: {}", timeoutMs, query);
        } catch (ExecutionException e) {
            log.warn("文献检索失败，按空结果处理: {}", query, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("文献检索被中断: {}", query);
        }
        return Collections.emptyList();
    }
}
