package com.mentionindex.scan;

public enum ScanStrategy {
    /** 短行：由检索索引的前缀表给出候选姓名 */
    PREFIX_INDEX("prefix-index"),
    /** 中等长度：逐姓名的词边界正则扫描 */
    WORD_BOUNDARY("word-boundary"),
    /** 长行：模糊键剪枝后再精确校验 */
    FUZZY_KEY("fuzzy-key"),
    /** 关闭优化：逐姓名线性子串扫描 */
    LEGACY("legacy");

    private final String label;

    ScanStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
