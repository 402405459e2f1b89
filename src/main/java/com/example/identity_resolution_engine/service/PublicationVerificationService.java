package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.dto.ReviewerSuggestion;
import com.example.identity_resolution_engine.dto.VerificationBatchResult;
import com.example.identity_resolution_engine.model.ExpertiseMismatchResult;
import com.example.identity_resolution_engine.model.Publication;
import com.example.identity_resolution_engine.model.VerificationResult;
import com.example.identity_resolution_engine.search.PublicationSearch;

import java.util.List;

/**
 * 基于发表论文的研究者核验业务接口
 */
public interface PublicationVerificationService {

    /**
     * 核验声称的研究者是否真实存在且近年活跃
     * @param claimedName 声称的姓名
     * @param claimedExpertise 声称的专业方向
     * @param claimedInstitution 声称的机构，可为空
     * @param search 文献检索实现，不能为null
     * @return 核验结果，未通过时带原因
     */
    VerificationResult verify(String claimedName, List<String> claimedExpertise, String claimedInstitution,
                              PublicationSearch search);

    /**
     * 逐个核验建议名单，分为通过与未通过两组
     */
    VerificationBatchResult verifyAll(List<ReviewerSuggestion> suggestions, PublicationSearch search);

    /**
     * 生成检索用的姓名变体：原名、昵称对应的正式名、首字母形式
     */
    List<String> generateNameVariants(String name);

    String buildAuthorQuery(String name);

    /**
     * 在作者检索式基础上加入专业方向词（最多两个，每个取前两个词）限定标题/摘要
     */
    String buildDisambiguatedQuery(String name, List<String> expertiseAreas);

    /**
     * 宽松的作者姓名匹配：姓相同，且名相同、一方为1-2个字符的前缀、或首字母相同且一方多一个中间名缩写
     */
    boolean namesMatch(String name1, String name2);

    /**
     * 只保留作者列表中确实包含任一姓名变体的论文
     */
    List<Publication> filterToMatchingAuthor(List<Publication> publications, List<String> nameVariants);

    List<Publication> filterByExpertiseRelevance(List<Publication> publications, List<String> expertiseAreas);

    /**
     * 提取出现次数最多的单位（按变体顺序尝试），都没有时退回最新论文中的任一单位
     */
    String extractBestAffiliation(List<Publication> publications, List<String> nameVariants);

    double calculateExpertiseMatch(List<Publication> publications, List<String> expertiseAreas);

    ExpertiseMismatchResult checkExpertiseMismatch(List<Publication> publications, List<String> claimedExpertise);

    int countRecentPublications(List<Publication> publications);
}
