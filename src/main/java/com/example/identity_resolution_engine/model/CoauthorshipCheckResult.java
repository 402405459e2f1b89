package com.example.identity_resolution_engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 合著利益冲突检查结果
 */
@Data
public class CoauthorshipCheckResult {
    private String candidateName;

    @JsonProperty("hasCOI")
    private boolean coiDetected;

    private List<Coauthorship> details = new ArrayList<>();

    public static CoauthorshipCheckResult empty(String candidateName) {
        CoauthorshipCheckResult result = new CoauthorshipCheckResult();
        result.setCandidateName(candidateName);
        return result;
    }
}
