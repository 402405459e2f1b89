package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.model.Candidate;
import com.example.identity_resolution_engine.model.MergedResearcher;

import java.util.Collection;
import java.util.List;

/**
 * 候选人去重、合并、冲突过滤与排序业务接口
 */
public interface DeduplicationService {

    int DEFAULT_MIN_H_INDEX = 5;

    /**
     * 按姓名相似度贪心分组，保持输入顺序
     */
    List<List<Candidate>> group(List<Candidate> candidates);

    /**
     * 将同一组候选人合并为一条研究者记录，空组或组内无姓名时返回null
     */
    MergedResearcher merge(List<Candidate> group);

    /**
     * 分组后逐组合并
     */
    List<MergedResearcher> deduplicate(List<Candidate> candidates);

    boolean areNamesSimilar(String name1, String name2);

    /**
     * 同姓，且一方的名是另一方名的首字母（J. Smith 与 John Smith）
     */
    boolean isInitialsMatch(String name1, String name2);

    /**
     * 同姓，且一方的名包含另一方的名
     */
    boolean isPartialMatch(String name1, String name2);

    /**
     * 过滤与申请人同机构或在排除名单中的研究者
     * @param researchers 研究者列表
     * @param authorInstitution 申请人所在机构，为空时不按机构过滤
     * @param excludeNames 需要排除的姓名
     * @return 过滤后的列表
     */
    List<MergedResearcher> filterConflicts(List<MergedResearcher> researchers, String authorInstitution,
                                           Collection<String> excludeNames);

    /**
     * 计算相关度得分并按得分降序排列（得分相同保持原顺序）
     */
    List<MergedResearcher> rankByRelevance(List<MergedResearcher> researchers, List<String> keywords);

    /**
     * 按h指数下限过滤，默认下限为 {@link #DEFAULT_MIN_H_INDEX}
     */
    List<MergedResearcher> filterByMinimumQualifications(List<MergedResearcher> researchers, int minHIndex);
}
