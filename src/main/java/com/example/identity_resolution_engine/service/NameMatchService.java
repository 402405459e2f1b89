package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.model.AuthorMatch;
import com.example.identity_resolution_engine.model.ConfidenceLevel;
import com.example.identity_resolution_engine.model.MatchResult;

import java.util.List;

/**
 * 姓名分层匹配业务接口，给出两个姓名提及是否为同一人的置信度。
 */
public interface NameMatchService {

    /** 默认最低匹配置信度 */
    int DEFAULT_MIN_CONFIDENCE = 50;

    /**
     * 按层级规则比对两个姓名，命中的第一条规则决定置信度与类型
     * @param nameA 姓名A
     * @param nameB 姓名B
     * @return 匹配结果，任一侧为空时返回no_match
     */
    MatchResult match(String nameA, String nameB);

    /**
     * 根据双方机构的一致程度上调置信度（最高100），机构缺失时不变
     */
    int adjustForInstitution(int baseConfidence, String institutionA, String institutionB);

    /**
     * 是否为高重名风险的常见姓名
     */
    boolean isCommonName(String name);

    ConfidenceLevel confidenceLevel(int confidence);

    /**
     * 在作者名单中查找与目标姓名匹配的作者
     * @param name 目标姓名
     * @param institution 目标所在机构（作者名单没有单独的机构信息时仅作记录）
     * @param authors 作者姓名列表
     * @param minConfidence 最低置信度
     * @return 置信度不低于阈值的匹配
     */
    List<AuthorMatch> findMatchesInAuthors(String name, String institution, List<String> authors, int minConfidence);

    /**
     * 生成用于库内精确查找的姓名组合（全名、姓、名+姓、首字母+姓、姓+名及昵称变体）
     */
    List<String> buildSearchTerms(String name);

    /**
     * 生成LIKE形式的模糊查找模式，如 %john%smith%
     */
    List<String> buildTextSearchPatterns(String name);
}
