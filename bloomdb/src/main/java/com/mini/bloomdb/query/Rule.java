package com.mini.bloomdb.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * 查询规则树
 * 叶子规则比较一列和一个值，规则组用 AND / OR 组合子规则
 * 
 * 规则不可变，在请求入口处一次性解析和校验。
 */
public abstract class Rule {
    
    private Rule() {
    }
    
    /**
     * 字段比较规则
     */
    public static final class Leaf extends Rule {
        private final String column;
        private final Operator op;
        private final Object value;
        
        public Leaf(String column, Operator op, Object value) {
            this.column = requireNonNull(column, "column is null");
            this.op = requireNonNull(op, "op is null");
            this.value = requireNonNull(value, "value is null");
        }
        
        public String getColumn() {
            return column;
        }
        
        public Operator getOp() {
            return op;
        }
        
        public Object getValue() {
            return value;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Leaf leaf = (Leaf) o;
            return column.equals(leaf.column) && op == leaf.op && value.equals(leaf.value);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(column, op, value);
        }
        
        @Override
        public String toString() {
            return column + " " + op + " " + value;
        }
    }
    
    /**
     * 规则组
     */
    public static final class Group extends Rule {
        private final Condition condition;
        private final List<Rule> rules;
        
        public Group(Condition condition, List<Rule> rules) {
            this.condition = requireNonNull(condition, "condition is null");
            this.rules = Collections.unmodifiableList(new ArrayList<>(requireNonNull(rules, "rules is null")));
        }
        
        public Condition getCondition() {
            return condition;
        }
        
        public List<Rule> getRules() {
            return rules;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Group group = (Group) o;
            return condition == group.condition && rules.equals(group.rules);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(condition, rules);
        }
        
        @Override
        public String toString() {
            return condition + rules.toString();
        }
    }
    
    /**
     * 创建相等规则
     */
    public static Rule equal(String column, Object value) {
        return new Leaf(column, Operator.EQ, value);
    }
    
    public static Rule compare(String column, Operator op, Object value) {
        return new Leaf(column, op, value);
    }
    
    public static Rule and(Rule... rules) {
        return new Group(Condition.AND, Arrays.asList(rules));
    }
    
    public static Rule or(Rule... rules) {
        return new Group(Condition.OR, Arrays.asList(rules));
    }
}
