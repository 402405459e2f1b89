package com.example.identity_resolution_engine.dto;

import com.example.identity_resolution_engine.model.Candidate;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 审稿人发现请求：待核验的建议名单、各数据源检出的候选人以及申请书信息
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveryRequest {
    // 列表字段传null时按空列表处理
    private List<ReviewerSuggestion> suggestions = new ArrayList<>();
    private List<Candidate> discoveredCandidates = new ArrayList<>();
    private String authorInstitution;
    private List<String> proposalAuthors = new ArrayList<>();
    private List<String> excludeNames = new ArrayList<>();
    private List<String> keywords = new ArrayList<>();
    private boolean checkCoauthorships = true;

    public List<ReviewerSuggestion> getSuggestions() { return suggestions; }
    public void setSuggestions(List<ReviewerSuggestion> suggestions) { this.suggestions = suggestions == null ? new ArrayList<>() : suggestions; }
    public List<Candidate> getDiscoveredCandidates() { return discoveredCandidates; }
    public void setDiscoveredCandidates(List<Candidate> discoveredCandidates) { this.discoveredCandidates = discoveredCandidates == null ? new ArrayList<>() : discoveredCandidates; }
    public String getAuthorInstitution() { return authorInstitution; }
    public void setAuthorInstitution(String authorInstitution) { this.authorInstitution = authorInstitution; }
    public List<String> getProposalAuthors() { return proposalAuthors; }
    public void setProposalAuthors(List<String> proposalAuthors) { this.proposalAuthors = proposalAuthors == null ? new ArrayList<>() : proposalAuthors; }
    public List<String> getExcludeNames() { return excludeNames; }
    public void setExcludeNames(List<String> excludeNames) { this.excludeNames = excludeNames == null ? new ArrayList<>() : excludeNames; }
    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords == null ? new ArrayList<>() : keywords; }
    public boolean isCheckCoauthorships() { return checkCoauthorships; }
    public void setCheckCoauthorships(boolean checkCoauthorships) { this.checkCoauthorships = checkCoauthorships; }

    @Override
    public String toString() {
        return "DiscoveryRequest{" +
                "suggestions=" + suggestions.size() +
                ", discoveredCandidates=" + discoveredCandidates.size() +
                ", authorInstitution='" + authorInstitution + '\'' +
                ", proposalAuthors=" + proposalAuthors +
                '}';
    }
}
