package com.example.identity_resolution_engine.search;

import com.example.identity_resolution_engine.model.Publication;
import com.example.identity_resolution_engine.util.RedisUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * 基于Redis的检索结果缓存。
 * 缓存读写失败时只记日志并直接走下游检索，空结果不写入缓存。
 */
@Slf4j
public class CachingPublicationSearch implements PublicationSearch {

    static final String CACHE_PREFIX = "pubsearch:";

    private final PublicationSearch delegate;
    private final RedisUtil redisUtil;
    private final long ttlHours;

    public CachingPublicationSearch(PublicationSearch delegate, RedisUtil redisUtil, long ttlHours) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.redisUtil = Objects.requireNonNull(redisUtil, "redisUtil");
        this.ttlHours = ttlHours;
    }

    @Override
    public List<Publication> search(String query, int maxResults) {
        String key = cacheKey(query, maxResults);
        try {
            List<Publication> cached = redisUtil.getList(key, Publication.class);
            if (cached != null && !cached.isEmpty()) {
                log.debug("检索缓存命中: {}", key);
                return cached;
            }
        } catch (RuntimeException e) {
            log.warn("读取检索缓存失败，跳过缓存: {}", key, e);
        }

        List<Publication> result = delegate.search(query, maxResults);
        if (result != null && !result.isEmpty()) {
            try {
                redisUtil.setObject(key, result, ttlHours, TimeUnit.HOURS);
            } catch (RuntimeException e) {
                log.warn("写入检索缓存失败: {}", key, e);
            }
        }
        return result;
    }

    /**
     * 清除某个检索式的缓存（例如发现缓存里混入了同姓不同人的结果）
     */
    public void evict(String query, int maxResults) {
        redisUtil.delete(cacheKey(query, maxResults));
    }

    static String cacheKey(String query, int maxResults) {
        String normalized = query == null ? "" : query.trim().toLowerCase().replaceAll("\\s+", " ");
        return CACHE_PREFIX + normalized + ":" + maxResults;
    }
}
