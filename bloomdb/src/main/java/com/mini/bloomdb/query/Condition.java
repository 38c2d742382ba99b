package com.mini.bloomdb.query;

/**
 * 规则组的组合方式
 */
public enum Condition {
    AND,
    OR
}
