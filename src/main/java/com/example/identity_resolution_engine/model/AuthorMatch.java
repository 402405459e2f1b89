package com.example.identity_resolution_engine.model;

import lombok.Value;

@Value
public class AuthorMatch {
    String matchedName;
    int confidence;
    MatchType matchType;
}
