package com.mini.bloomdb.query;

import com.mini.bloomdb.index.ColumnIndex;
import com.mini.bloomdb.index.FileIndex;
import com.mini.bloomdb.index.MembershipIndex;
import com.mini.bloomdb.index.RangeIndex;

/**
 * 查询求值器
 * 判断文件是否可能满足查询规则
 * 
 * 返回 false 表示文件一定不满足；返回 true 表示可能满足，可能是误判。
 * 求值从左到右短路，无副作用。
 */
public final class QueryEvaluator {
    
    private QueryEvaluator() {
    }
    
    public static boolean evaluate(Rule rule, FileIndex fileIndex) {
        if (rule instanceof Rule.Leaf) {
            return evaluateLeaf((Rule.Leaf) rule, fileIndex);
        } else if (rule instanceof Rule.Group) {
            return evaluateGroup((Rule.Group) rule, fileIndex);
        }
        throw new IllegalArgumentException("Unsupported rule: " + rule);
    }
    
    private static boolean evaluateGroup(Rule.Group group, FileIndex fileIndex) {
        switch (group.getCondition()) {
            case AND:
                for (Rule child : group.getRules()) {
                    if (!evaluate(child, fileIndex)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Rule child : group.getRules()) {
                    if (evaluate(child, fileIndex)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalArgumentException("Unsupported condition: " + group.getCondition());
        }
    }
    
    private static boolean evaluateLeaf(Rule.Leaf leaf, FileIndex fileIndex) {
        // 构建失败的列无法排除文件
        if (fileIndex.isUnindexed(leaf.getColumn())) {
            return true;
        }
        
        ColumnIndex index = fileIndex.getColumnIndex(leaf.getColumn());
        if (index == null) {
            return false;
        }
        
        Object value = leaf.getValue();
        if (!index.getDataType().coerce(value).isPresent()) {
            return false;
        }
        
        if (leaf.getOp() == Operator.EQ) {
            return index.contains(value);
        }
        
        if (index instanceof RangeIndex) {
            RangeIndex range = (RangeIndex) index;
            switch (leaf.getOp()) {
                case GT:
                    return range.mightContainGreater(value, false);
                case GE:
                    return range.mightContainGreater(value, true);
                case LT:
                    return range.mightContainLess(value, false);
                case LE:
                    return range.mightContainLess(value, true);
                default:
                    throw new IllegalArgumentException("Unsupported operator: " + leaf.getOp());
            }
        }
        
        // 布隆过滤器无法回答范围问题，只能排除空列
        if (index instanceof MembershipIndex) {
            return !index.isEmpty();
        }
        return true;
    }
}
