package com.example.identity_resolution_engine.search;

import com.example.identity_resolution_engine.config.IdentityProperties;
import com.example.identity_resolution_engine.util.RedisUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * 为调用方提供的检索实现套上超时保护，并按配置决定是否启用Redis缓存。
 */
@Component
@Slf4j
public class PublicationSearchFactory {

    private final IdentityProperties properties;
    private final AsyncTaskExecutor searchTaskExecutor;
    private final RedisUtil redisUtil;

    @Autowired
    public PublicationSearchFactory(IdentityProperties properties,
                                    @Qualifier("searchTaskExecutor") AsyncTaskExecutor searchTaskExecutor,
                                    RedisUtil redisUtil) {
        this.properties = properties;
        this.searchTaskExecutor = searchTaskExecutor;
        this.redisUtil = redisUtil;
    }

    /**
     * 只加超时保护
     */
    public PublicationSearch guard(PublicationSearch raw) {
        return new GuardedPublicationSearch(raw, searchTaskExecutor, properties.getSearch().getTimeoutMs());
    }

    /**
     * 超时保护 + 缓存（缓存在外层，命中时不占用检索线程）
     */
    public PublicationSearch create(PublicationSearch raw) {
        PublicationSearch guarded = guard(raw);
        IdentityProperties.Search search = properties.getSearch();
        if (!search.isCacheEnabled()) {
            return guarded;
        }
        log.info("启用文献检索缓存，过期时间{}小时", search.getCacheTtlHours());
        return new CachingPublicationSearch(guarded, redisUtil, search.getCacheTtlHours());
    }
}
