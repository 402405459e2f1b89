package com.example.identity_resolution_engine.dto;

import com.example.identity_resolution_engine.model.VerificationResult;

import java.util.ArrayList;
import java.util.List;

public class VerificationBatchResult {
    private List<VerificationResult> verified = new ArrayList<>();
    private List<VerificationResult> unverified = new ArrayList<>();

    public List<VerificationResult> getVerified() { return verified; }
    public void setVerified(List<VerificationResult> verified) { this.verified = verified; }
    public List<VerificationResult> getUnverified() { return unverified; }
    public void setUnverified(List<VerificationResult> unverified) { this.unverified = unverified; }

    @Override
    public String toString() {
        return "VerificationBatchResult{" +
                "verified=" + verified.size() +
                ", unverified=" + unverified.size() +
                '}';
    }
}
