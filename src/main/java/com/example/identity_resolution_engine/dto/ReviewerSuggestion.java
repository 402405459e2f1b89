package com.example.identity_resolution_engine.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 上游分析给出的审稿人建议（姓名、专业方向、所在机构）
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ReviewerSuggestion {
    private String name;
    private List<String> expertiseAreas = new ArrayList<>();
    private String suggestedInstitution;
    private String affiliation;
    private String reason;

    public ReviewerSuggestion() {
    }

    public ReviewerSuggestion(String name, List<String> expertiseAreas, String suggestedInstitution) {
        this.name = name;
        this.expertiseAreas = expertiseAreas;
        this.suggestedInstitution = suggestedInstitution;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public List<String> getExpertiseAreas() { return expertiseAreas; }
    public void setExpertiseAreas(List<String> expertiseAreas) { this.expertiseAreas = expertiseAreas; }
    public String getSuggestedInstitution() { return suggestedInstitution; }
    public void setSuggestedInstitution(String suggestedInstitution) { this.suggestedInstitution = suggestedInstitution; }
    public String getAffiliation() { return affiliation; }
    public void setAffiliation(String affiliation) { this.affiliation = affiliation; }
    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    @Override
    public String toString() {
        return "ReviewerSuggestion{" +
                "name='" + name + '\'' +
                ", expertiseAreas=" + expertiseAreas +
                ", suggestedInstitution='" + suggestedInstitution + '\'' +
                '}';
    }
}
