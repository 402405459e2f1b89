package com.example.identity_resolution_engine.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单个候选人经文献核验后的最终结果
 */
@Data
public class VerificationResult {
    private String claimedName;
    private boolean verified;
    /** 专业方向匹配度，取值0-1 */
    private double confidence;
    private String affiliation;
    private boolean institutionMismatch;
    private boolean expertiseMismatch;
    private ExpertiseMismatchResult expertiseMismatchDetails;
    private int publicationCount5yr;
    /** 未通过核验时的原因 */
    private String reason;
    /** 最终采用的结果集：disambiguated / relevant_simple / simple / fallback */
    private String selection;
    private List<Publication> publications = new ArrayList<>();

    public static VerificationResult rejected(String claimedName, String reason) {
        VerificationResult result = new VerificationResult();
        result.setClaimedName(claimedName);
        result.setVerified(false);
        result.setReason(reason);
        return result;
    }
}
