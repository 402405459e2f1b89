package com.example.identity_resolution_engine.dto;

import com.example.identity_resolution_engine.model.CoauthorshipCheckResult;
import com.example.identity_resolution_engine.model.MergedResearcher;
import com.example.identity_resolution_engine.model.VerificationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 审稿人发现结果：核验通过/未通过的建议、去重后的检出候选人、综合排序及统计
 */
public class DiscoveryResult {
    private List<VerificationResult> verified = new ArrayList<>();
    private List<VerificationResult> unverified = new ArrayList<>();
    private List<MergedResearcher> discovered = new ArrayList<>();
    private List<MergedResearcher> ranked = new ArrayList<>();
    // key为候选人姓名
    private Map<String, CoauthorshipCheckResult> coauthorships = new LinkedHashMap<>();
    private Stats stats = new Stats();

    public List<VerificationResult> getVerified() { return verified; }
    public void setVerified(List<VerificationResult> verified) { this.verified = verified; }
    public List<VerificationResult> getUnverified() { return unverified; }
    public void setUnverified(List<VerificationResult> unverified) { this.unverified = unverified; }
    public List<MergedResearcher> getDiscovered() { return discovered; }
    public void setDiscovered(List<MergedResearcher> discovered) { this.discovered = discovered; }
    public List<MergedResearcher> getRanked() { return ranked; }
    public void setRanked(List<MergedResearcher> ranked) { this.ranked = ranked; }
    public Map<String, CoauthorshipCheckResult> getCoauthorships() { return coauthorships; }
    public void setCoauthorships(Map<String, CoauthorshipCheckResult> coauthorships) { this.coauthorships = coauthorships; }
    public Stats getStats() { return stats; }
    public void setStats(Stats stats) { this.stats = stats; }

    public static class Stats {
        private int suggestionsTotal;
        private int suggestionsVerified;
        private int totalBeforeDedup;
        private int totalAfterDedup;
        private int filteredByCoi;
        private int coauthorConflicts;

        public int getSuggestionsTotal() { return suggestionsTotal; }
        public void setSuggestionsTotal(int suggestionsTotal) { this.suggestionsTotal = suggestionsTotal; }
        public int getSuggestionsVerified() { return suggestionsVerified; }
        public void setSuggestionsVerified(int suggestionsVerified) { this.suggestionsVerified = suggestionsVerified; }
        public int getTotalBeforeDedup() { return totalBeforeDedup; }
        public void setTotalBeforeDedup(int totalBeforeDedup) { this.totalBeforeDedup = totalBeforeDedup; }
        public int getTotalAfterDedup() { return totalAfterDedup; }
        public void setTotalAfterDedup(int totalAfterDedup) { this.totalAfterDedup = totalAfterDedup; }
        public int getFilteredByCoi() { return filteredByCoi; }
        public void setFilteredByCoi(int filteredByCoi) { this.filteredByCoi = filteredByCoi; }
        public int getCoauthorConflicts() { return coauthorConflicts; }
        public void setCoauthorConflicts(int coauthorConflicts) { this.coauthorConflicts = coauthorConflicts; }

        @Override
        public String toString() {
            return "Stats{" +
                    "suggestionsTotal=" + suggestionsTotal +
                    ", suggestionsVerified=" + suggestionsVerified +
                    ", totalBeforeDedup=" + totalBeforeDedup +
                    ", totalAfterDedup=" + totalAfterDedup +
                    ", filteredByCoi=" + filteredByCoi +
                    ", coauthorConflicts=" + coauthorConflicts +
                    '}';
        }
    }
}
