package com.example.identity_resolution_engine.search;

import com.example.identity_resolution_engine.model.Publication;

import java.util.List;

/**
 * 文献检索协作接口，由调用方提供具体实现（如PubMed客户端）。
 * 无结果时返回空列表；传输失败时应记录日志并返回空列表，不向上抛出。
 */
@FunctionalInterface
public interface PublicationSearch {

    /**
     * 执行检索
     * @param query 检索式，例如 "Smith J[Author] AND (2020:2025[pdat])"
     * @param maxResults 最多返回条数
     * @return 论文列表
     */
    List<Publication> search(String query, int maxResults);
}
