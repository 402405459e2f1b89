package com.example.identity_resolution_engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;

/**
 * 身份识别引擎配置（前缀 identity）
 */
@Data
@Validated
@ConfigurationProperties(prefix = "identity")
public class IdentityProperties {

    @Valid
    private Search search = new Search();

    @Valid
    private Verification verification = new Verification();

    @Valid
    private Coi coi = new Coi();

    @Data
    public static class Search {
        /** 是否配置了文献库API Key，决定限流档位（有Key 10次/秒，无Key 3次/秒） */
        private boolean apiKeyConfigured = false;

        @Min(0)
        private long requestDelayMs = 350;

        @Min(0)
        private long credentialedRequestDelayMs = 100;

        /** 单次检索超时，超时按空结果处理 */
        @Min(1)
        private long timeoutMs = 15000;

        private boolean cacheEnabled = false;

        @Min(1)
        private long cacheTtlHours = 24;

        public long getEffectiveRequestDelayMs() {
            return apiKeyConfigured ? credentialedRequestDelayMs : requestDelayMs;
        }
    }

    @Data
    public static class Verification {
        @Min(1)
        private int minPublications = 3;

        @Min(1)
        private int yearsLookback = 5;

        @Min(1)
        private int simpleMaxResults = 30;

        @Min(1)
        private int disambiguatedMaxResults = 20;

        /** 未声明专业方向时的默认匹配度，属于经验值 */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double neutralExpertiseScore = 0.5;

        /** 核验通过后保留的代表论文数量 */
        @Min(0)
        private int keptPublications = 5;
    }

    @Data
    public static class Coi {
        @Min(1)
        private int batchSize = 2;

        @Min(1)
        private int credentialedBatchSize = 5;

        @Min(1)
        private int maxResults = 10;

        /** 单个候选人整体检查的超时时间 */
        @Min(1)
        private long candidateTimeoutMs = 60000;
    }

    public int getEffectiveCoiBatchSize() {
        return search.isApiKeyConfigured() ? coi.getCredentialedBatchSize() : coi.getBatchSize();
    }
}
