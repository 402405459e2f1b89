package com.example.identity_resolution_engine.service;

/**
 * 机构等价判断业务接口
 */
public interface InstitutionMatchService {

    /**
     * 判断两个机构名称是否指向同一机构
     * 依次检查：原文相等、缩写展开后相等、包含关系、关键词集合相同、子集规则（带冲突词保护）、字符串相似度
     */
    boolean institutionsMatch(String a, String b);

    /**
     * 检索得到的单位与声称的机构是否不一致（任一侧缺失时视为一致）
     * @param affiliation 从论文中提取的单位全称
     * @param claimedInstitution 声称的机构
     * @return true表示可能核验到了同名的另一个人
     */
    boolean institutionMismatch(String affiliation, String claimedInstitution);

    /**
     * 从单位全称中提取机构名部分，如 "university of michigan"
     */
    String extractInstitution(String text);
}
