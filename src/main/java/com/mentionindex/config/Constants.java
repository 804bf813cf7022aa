package com.mentionindex.config;

/**
 * 全局常量定义
 * 
 * 包含检索缓存参数、行扫描策略阈值、模糊键参数和增量扫描参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 检索参数 ====================
    /** 检索结果缓存容量，超出后淘汰最早插入的条目 */
    public static final int SEARCH_CACHE_CAPACITY = 1000;
    /** 前缀与模糊检索的默认返回上限 */
    public static final int DEFAULT_LOOKUP_LIMIT = 10;
    /** 全文检索的默认返回上限 */
    public static final int DEFAULT_FULL_TEXT_LIMIT = 20;
    /** CLI 允许的最大返回条数 */
    public static final int MAX_SEARCH_LIMIT = 1000;
    
    // ==================== 模糊键参数 ====================
    /** 模糊键固定长度 */
    public static final int FUZZY_KEY_LENGTH = 4;
    /** 模糊键不足长度时的填充字符 */
    public static final char FUZZY_KEY_FILLER = '0';
    
    // ==================== 全文评分权重 ====================
    /** 查询词与姓名词完全相同 */
    public static final int SCORE_NAME_WORD_EXACT = 10;
    /** 查询词是姓名词的子串 */
    public static final int SCORE_NAME_WORD_PARTIAL = 5;
    /** 查询词与公司名词完全相同 */
    public static final int SCORE_COMPANY_WORD = 3;
    /** 查询词出现在职位或部门中 */
    public static final int SCORE_POSITION_OR_DEPARTMENT = 2;
    
    // ==================== 行扫描参数 ====================
    /** 短行阈值，低于此长度走索引策略 */
    public static final int SHORT_LINE_THRESHOLD = 200;
    /** 长行阈值，达到此长度走模糊键剪枝策略 */
    public static final int LONG_LINE_THRESHOLD = 1000;
    /** 行结果缓存容量 */
    public static final int LINE_CACHE_CAPACITY = 500;
    /** 行缓存满时一次性淘汰的条目数 */
    public static final int LINE_CACHE_EVICTION_BATCH = 100;
    /** 性能指标保留条数 */
    public static final int METRICS_HISTORY_LIMIT = 1000;
    
    // ==================== 增量扫描参数 ====================
    /** 每批处理的文档数 */
    public static final int INCREMENTAL_BATCH_SIZE = 5;
    /** 队列未清空时重新调度的延迟（毫秒） */
    public static final long INCREMENTAL_RESCHEDULE_DELAY_MS = 100;
    /** 增量扫描队列容量 */
    public static final int SCAN_QUEUE_CAPACITY = 1000;
    
    // ==================== 定义文档参数 ====================
    /** 标记定义文档类型的 frontmatter 键 */
    public static final String DEF_TYPE_KEY = "def-type";
    /** 旧版定义文档类型键 */
    public static final String LEGACY_DEF_TYPE_KEY = "metadata-type";
    /** 破折号分隔行 */
    public static final String DASH_DIVIDER = "---";
    /** 下划线分隔行 */
    public static final String UNDERSCORE_DIVIDER = "___";
}
