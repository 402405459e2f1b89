package com.example.identity_resolution_engine.util;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 机构名称规范化：去掉院系前缀、国家后缀和标点，并支持常见缩写展开。
 */
public final class InstitutionNormalizer {

    // 非贪婪匹配到第一个逗号或机构关键词为止，不吞掉机构名本身
    private static final Pattern DEPARTMENT_PREFIX = Pattern.compile(
            "^(department|dept|school|division|center|centre)\\s+(of|for)\\s+[^,]+?"
                    + "(,\\s*|\\s+(?=(university|institute|college|hospital|laboratory)\\b))",
            Pattern.CASE_INSENSITIVE);
    private static final int MAX_PREFIX_STRIPS = 3;
    // 要求前面有逗号或空格，避免把 "Aarhus" 的结尾当成国家名
    private static final Pattern COUNTRY_SUFFIX = Pattern.compile(
            "(,\\s*|\\s+)(usa|united states|u\\.?s\\.?a?\\.?)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> ABBREVIATIONS;
    private static final List<Map.Entry<Pattern, String>> ABBREVIATION_PATTERNS;

    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("mit", "massachusetts institute of technology");
        map.put("caltech", "california institute of technology");
        map.put("ucla", "university of california los angeles");
        map.put("ucsf", "university of california san francisco");
        map.put("ucsd", "university of california san diego");
        map.put("ucsb", "university of california santa barbara");
        map.put("ucsc", "university of california santa cruz");
        map.put("ucb", "university of california berkeley");
        map.put("uci", "university of california irvine");
        map.put("ucr", "university of california riverside");
        map.put("uc davis", "university of california davis");
        map.put("uc berkeley", "university of california berkeley");
        map.put("uc", "university of california");
        map.put("cmu", "carnegie mellon university");
        map.put("jhu", "johns hopkins university");
        map.put("nyu", "new york university");
        map.put("upenn", "university of pennsylvania");
        map.put("umich", "university of michigan");
        map.put("uchicago", "university of chicago");
        map.put("wustl", "washington university in st louis");
        map.put("unc", "university of north carolina");
        map.put("uva", "university of virginia");
        map.put("ut austin", "university of texas at austin");
        map.put("utsw", "university of texas southwestern medical center");
        map.put("osu", "ohio state university");
        map.put("psu", "pennsylvania state university");
        map.put("msu", "michigan state university");
        map.put("asu", "arizona state university");
        map.put("gatech", "georgia institute of technology");
        map.put("georgia tech", "georgia institute of technology");
        map.put("uiuc", "university of illinois urbana champaign");
        map.put("umn", "university of minnesota");
        map.put("uw madison", "university of wisconsin madison");
        map.put("rpi", "rensselaer polytechnic institute");
        map.put("wpi", "worcester polytechnic institute");
        map.put("nih", "national institutes of health");
        map.put("nci", "national cancer institute");
        map.put("hhmi", "howard hughes medical institute");
        map.put("cshl", "cold spring harbor laboratory");
        map.put("mbl", "marine biological laboratory");
        map.put("embl", "european molecular biology laboratory");
        map.put("eth", "eth zurich");
        map.put("epfl", "ecole polytechnique federale de lausanne");
        map.put("ucl", "university college london");
        map.put("kaist", "korea advanced institute of science and technology");
        ABBREVIATIONS = Collections.unmodifiableMap(map);

        // 先替换较长的缩写，避免 "uc" 抢先命中 "uc davis"
        List<String> keys = new ArrayList<>(map.keySet());
        keys.sort((a, b) -> b.length() - a.length());
        List<Map.Entry<Pattern, String>> patterns = new ArrayList<>();
        for (String key : keys) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(key) + "\\b");
            patterns.add(Map.entry(p, map.get(key)));
        }
        ABBREVIATION_PATTERNS = Collections.unmodifiableList(patterns);
    }

    private InstitutionNormalizer() {
    }

    public static String normalize(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String s = raw.toLowerCase().trim();
        // "Division of X, Department of Y, University of Z" 逐层剥离
        for (int i = 0; i < MAX_PREFIX_STRIPS; i++) {
            Matcher m = DEPARTMENT_PREFIX.matcher(s);
            if (!m.find()) {
                break;
            }
            s = s.substring(m.end());
        }
        s = COUNTRY_SUFFIX.matcher(s).replaceFirst("");
        s = NON_LETTER.matcher(s).replaceAll("");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * 展开机构缩写（按词边界替换），返回值需再经 {@link #normalize(String)} 处理
     */
    public static String expandAbbreviations(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String s = raw.toLowerCase();
        // 保留标点，院系前缀的逗号要留给normalize使用
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        for (Map.Entry<Pattern, String> entry : ABBREVIATION_PATTERNS) {
            Matcher m = entry.getKey().matcher(s);
            if (m.find()) {
                s = m.replaceAll(Matcher.quoteReplacement(entry.getValue()));
            }
        }
        return s;
    }

    public static Map<String, String> abbreviations() {
        return ABBREVIATIONS;
    }
}
