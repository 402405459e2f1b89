package com.example.identity_resolution_engine.service;

import com.example.identity_resolution_engine.model.CoauthorshipCheckResult;
import com.example.identity_resolution_engine.search.PublicationSearch;

import java.util.List;

/**
 * 合著利益冲突检查业务接口
 */
public interface CoauthorshipService {

    /**
     * 检查候选人与名单中每个人是否有合著论文
     * @param candidateName 候选人姓名
     * @param otherNames 需比对的姓名（如申请书作者）
     * @param search 文献检索实现
     * @return 检查结果
     */
    CoauthorshipCheckResult checkCOI(String candidateName, List<String> otherNames, PublicationSearch search);

    /**
     * 按批并行检查多个候选人，批间暂停以遵守检索限流
     * @return 与candidateNames顺序一致的结果列表（中断时只包含已完成的部分）
     */
    List<CoauthorshipCheckResult> checkCandidates(List<String> candidateNames, List<String> otherNames,
                                                  PublicationSearch search);

    /**
     * 转为 "姓 名首字母" 的检索格式，如 "Dr. Mya Breitbart" -> "Breitbart M"
     */
    String toAuthorSearchFormat(String name);
}
