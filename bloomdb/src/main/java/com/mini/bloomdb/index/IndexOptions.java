package com.mini.bloomdb.index;

import com.mini.bloomdb.exception.ConfigurationException;

import java.util.Map;

/**
 * 索引构建配置选项
 * 
 * 误判率和范围索引阈值在索引的整个生命周期内固定，会随索引一起持久化。
 */
public class IndexOptions {
    
    public static final String ERROR_RATE = "index.error-rate";
    public static final String RANGE_FILTER_THRESHOLD = "index.range-filter-threshold";
    public static final String PARALLELISM = "index.parallelism";
    
    public static final double DEFAULT_ERROR_RATE = 0.1;
    public static final int DEFAULT_RANGE_FILTER_THRESHOLD = 1000;
    
    /** 布隆过滤器目标误判率，取值 (0, 1) */
    private final double errorRate;
    
    /** 不同值个数达到该阈值时使用范围索引 */
    private final int rangeFilterThreshold;
    
    /** 目录批量构建时的并行度 */
    private final int parallelism;
    
    public IndexOptions() {
        this(DEFAULT_ERROR_RATE, DEFAULT_RANGE_FILTER_THRESHOLD, 
             Runtime.getRuntime().availableProcessors());
    }
    
    public IndexOptions(double errorRate, int rangeFilterThreshold, int parallelism) {
        if (!(errorRate > 0.0 && errorRate < 1.0)) {
            throw new ConfigurationException(
                ERROR_RATE + " must be in (0, 1), got " + errorRate);
        }
        if (rangeFilterThreshold <= 0) {
            throw new ConfigurationException(
                RANGE_FILTER_THRESHOLD + " must be a positive integer, got " + rangeFilterThreshold);
        }
        if (parallelism <= 0) {
            throw new ConfigurationException(
                PARALLELISM + " must be a positive integer, got " + parallelism);
        }
        this.errorRate = errorRate;
        this.rangeFilterThreshold = rangeFilterThreshold;
        this.parallelism = parallelism;
    }
    
    public double getErrorRate() {
        return errorRate;
    }
    
    public int getRangeFilterThreshold() {
        return rangeFilterThreshold;
    }
    
    public int getParallelism() {
        return parallelism;
    }
    
    /**
     * 从字符串配置构建，未配置的项使用默认值
     */
    public static IndexOptions fromMap(Map<String, String> options) {
        Builder builder = builder();
        String value = options.get(ERROR_RATE);
        if (value != null) {
            builder.errorRate(parseDouble(ERROR_RATE, value));
        }
        value = options.get(RANGE_FILTER_THRESHOLD);
        if (value != null) {
            builder.rangeFilterThreshold(parseInt(RANGE_FILTER_THRESHOLD, value));
        }
        value = options.get(PARALLELISM);
        if (value != null) {
            builder.parallelism(parseInt(PARALLELISM, value));
        }
        return builder.build();
    }
    
    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }
    
    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return "IndexOptions{" +
                "errorRate=" + errorRate +
                ", rangeFilterThreshold=" + rangeFilterThreshold +
                ", parallelism=" + parallelism +
                '}';
    }
    
    public static class Builder {
        private double errorRate = DEFAULT_ERROR_RATE;
        private int rangeFilterThreshold = DEFAULT_RANGE_FILTER_THRESHOLD;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        
        public Builder errorRate(double errorRate) {
            this.errorRate = errorRate;
            return this;
        }
        
        public Builder rangeFilterThreshold(int rangeFilterThreshold) {
            this.rangeFilterThreshold = rangeFilterThreshold;
            return this;
        }
        
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }
        
        public IndexOptions build() {
            return new IndexOptions(errorRate, rangeFilterThreshold, parallelism);
        }
    }
}
