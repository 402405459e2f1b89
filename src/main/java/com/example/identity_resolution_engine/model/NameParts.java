package com.example.identity_resolution_engine.model;

import lombok.Value;

/**
 * 规范化后的姓名拆分结果（名、中间名、姓、完整形式），由NameNormalizer生成，不可变。
 */
@Value
public class NameParts {

    public static final NameParts EMPTY = new NameParts("", "", "", "");

    String first;
    String middle;
    String last;
    /** 小写、去重音、去称谓、空白规范化后的完整姓名 */
    String full;

    public boolean hasFirst() {
        return !first.isEmpty();
    }

    public boolean hasLast() {
        return !last.isEmpty();
    }

    public boolean isEmpty() {
        return full.isEmpty();
    }

    /**
     * 按空格拆分后的词元数量
     */
    public int tokenCount() {
        return full.isEmpty() ? 0 : full.split(" ").length;
    }
}
