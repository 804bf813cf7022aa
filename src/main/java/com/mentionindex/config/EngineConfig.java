package com.mentionindex.config;

import com.mentionindex.model.FileKind;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class EngineConfig {
    private DividerConfig dividerConfig = DividerConfig.defaults();
    private FileKind defaultFileKind = FileKind.CONSOLIDATED;
    private int queryLimit = Constants.DEFAULT_LOOKUP_LIMIT;
    private int searchCacheCapacity = Constants.SEARCH_CACHE_CAPACITY;
    private int shortLineThreshold = Constants.SHORT_LINE_THRESHOLD;
    private int longLineThreshold = Constants.LONG_LINE_THRESHOLD;
    private int lineCacheCapacity = Constants.LINE_CACHE_CAPACITY;
    private int metricsHistoryLimit = Constants.METRICS_HISTORY_LIMIT;
    private boolean optimizedScan = true;
    private int incrementalBatchSize = Constants.INCREMENTAL_BATCH_SIZE;
    private long incrementalDelayMs = Constants.INCREMENTAL_RESCHEDULE_DELAY_MS;
    private int scanQueueCapacity = Constants.SCAN_QUEUE_CAPACITY;
    
    public DividerConfig getDividerConfig() {
        return dividerConfig;
    }
    
    public void setDividerConfig(DividerConfig dividerConfig) {
        this.dividerConfig = dividerConfig;
    }
    
    public FileKind getDefaultFileKind() {
        return defaultFileKind;
    }
    
    public void setDefaultFileKind(FileKind defaultFileKind) {
        this.defaultFileKind = defaultFileKind;
    }
    
    public int getQueryLimit() {
        return queryLimit;
    }
    
    public void setQueryLimit(int queryLimit) {
        this.queryLimit = queryLimit;
    }
    
    public int getSearchCacheCapacity() {
        return searchCacheCapacity;
    }
    
    public void setSearchCacheCapacity(int searchCacheCapacity) {
        this.searchCacheCapacity = searchCacheCapacity;
    }
    
    public int getShortLineThreshold() {
        return shortLineThreshold;
    }
    
    public void setShortLineThreshold(int shortLineThreshold) {
        this.shortLineThreshold = shortLineThreshold;
    }
    
    public int getLongLineThreshold() {
        return longLineThreshold;
    }
    
    public void setLongLineThreshold(int longLineThreshold) {
        this.longLineThreshold = longLineThreshold;
    }
    
    public int getLineCacheCapacity() {
        return lineCacheCapacity;
    }
    
    public void setLineCacheCapacity(int lineCacheCapacity) {
        this.lineCacheCapacity = lineCacheCapacity;
    }
    
    public int getMetricsHistoryLimit() {
        return metricsHistoryLimit;
    }
    
    public void setMetricsHistoryLimit(int metricsHistoryLimit) {
        this.metricsHistoryLimit = metricsHistoryLimit;
    }
    
    public boolean isOptimizedScan() {
        return optimizedScan;
    }
    
    public void setOptimizedScan(boolean optimizedScan) {
        this.optimizedScan = optimizedScan;
    }
    
    public int getIncrementalBatchSize() {
        return incrementalBatchSize;
    }
    
    public void setIncrementalBatchSize(int incrementalBatchSize) {
        this.incrementalBatchSize = incrementalBatchSize;
    }
    
    public long getIncrementalDelayMs() {
        return incrementalDelayMs;
    }
    
    public void setIncrementalDelayMs(long incrementalDelayMs) {
        this.incrementalDelayMs = incrementalDelayMs;
    }
    
    public int getScanQueueCapacity() {
        return scanQueueCapacity;
    }
    
    public void setScanQueueCapacity(int scanQueueCapacity) {
        this.scanQueueCapacity = scanQueueCapacity;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
