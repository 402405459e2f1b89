package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.dto.DiscoveryRequest;
import com.example.identity_resolution_engine.dto.DiscoveryResult;
import com.example.identity_resolution_engine.search.PublicationSearch;

/**
 * 审稿人发现流程：核验建议名单、合并检出候选人、过滤冲突并排序
 */
public interface ReviewerDiscoveryService {

    DiscoveryResult resolve(DiscoveryRequest request, PublicationSearch search);
}
