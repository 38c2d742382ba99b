package com.mini.bloomdb.server.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mini.bloomdb.query.Condition;
import com.mini.bloomdb.query.Operator;
import com.mini.bloomdb.query.Rule;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.server.exception.ProtocolException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 规则树的 JSON 编解码
 * 
 * 规则组：{"condition": "AND"|"OR", "rules": [...]}
 * 叶子规则：{"column": str, "value": str|number|bool, "op"?: "EQ"|"GT"|"GE"|"LT"|"LE"}
 */
public final class RuleJsonCodec {
    
    static final String CONDITION = "condition";
    static final String RULES = "rules";
    static final String COLUMN = "column";
    static final String VALUE = "value";
    static final String OP = "op";
    
    private RuleJsonCodec() {
    }
    
    /**
     * @throws ProtocolException 规则树格式错误
     */
    public static Rule fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Rule must be a JSON object: " + node);
        }
        if (node.has(CONDITION)) {
            return groupFromJson(node);
        }
        if (node.has(COLUMN)) {
            return leafFromJson(node);
        }
        throw new ProtocolException("Rule must have either '" + CONDITION + "' or '" + COLUMN + "': " + node);
    }
    
    private static Rule groupFromJson(JsonNode node) {
        JsonNode conditionNode = node.get(CONDITION);
        if (!conditionNode.isTextual()) {
            throw new ProtocolException("'" + CONDITION + "' must be a string: " + conditionNode);
        }
        Condition condition;
        try {
            condition = Condition.valueOf(conditionNode.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Unknown condition: " + conditionNode.asText());
        }
        
        JsonNode rulesNode = node.get(RULES);
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new ProtocolException("'" + RULES + "' must be an array: " + node);
        }
        List<Rule> rules = new ArrayList<>(rulesNode.size());
        for (JsonNode child : rulesNode) {
            rules.add(fromJson(child));
        }
        return new Rule.Group(condition, rules);
    }
    
    private static Rule leafFromJson(JsonNode node) {
        JsonNode columnNode = node.get(COLUMN);
        if (!columnNode.isTextual() || columnNode.asText().isEmpty()) {
            throw new ProtocolException("'" + COLUMN + "' must be a non-empty string: " + columnNode);
        }
        
        Operator op = Operator.EQ;
        JsonNode opNode = node.get(OP);
        if (opNode != null && !opNode.isNull()) {
            if (!opNode.isTextual()) {
                throw new ProtocolException("'" + OP + "' must be a string: " + opNode);
            }
            try {
                op = Operator.fromName(opNode.asText());
            } catch (IllegalArgumentException e) {
                throw new ProtocolException(e.getMessage());
            }
        }
        
        return new Rule.Leaf(columnNode.asText(), op, valueFromJson(node.get(VALUE)));
    }
    
    private static Object valueFromJson(JsonNode valueNode) {
        if (valueNode == null || valueNode.isNull()) {
            throw new ProtocolException("'" + VALUE + "' is required");
        }
        if (valueNode.isTextual()) {
            return valueNode.asText();
        }
        if (valueNode.isBoolean()) {
            return valueNode.booleanValue();
        }
        if (valueNode.isNumber()) {
            return DataType.normalize(valueNode.numberValue());
        }
        throw new ProtocolException("'" + VALUE + "' must be a string, number or boolean: " + valueNode);
    }
    
    public static JsonNode toJson(Rule rule) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (rule instanceof Rule.Group) {
            Rule.Group group = (Rule.Group) rule;
            node.put(CONDITION, group.getCondition().name());
            ArrayNode rules = node.putArray(RULES);
            for (Rule child : group.getRules()) {
                rules.add(toJson(child));
            }
        } else if (rule instanceof Rule.Leaf) {
            Rule.Leaf leaf = (Rule.Leaf) rule;
            node.put(COLUMN, leaf.getColumn());
            node.set(VALUE, valueToJson(leaf.getValue()));
            if (leaf.getOp() != Operator.EQ) {
                node.put(OP, leaf.getOp().name());
            }
        } else {
            throw new IllegalArgumentException("Unsupported rule: " + rule);
        }
        return node;
    }
    
    private static JsonNode valueToJson(Object value) {
        Object normalized = DataType.normalize(value);
        if (normalized instanceof Long) {
            return JsonNodeFactory.instance.numberNode((Long) normalized);
        }
        if (normalized instanceof Double) {
            return JsonNodeFactory.instance.numberNode((Double) normalized);
        }
        if (normalized instanceof Boolean) {
            return JsonNodeFactory.instance.booleanNode((Boolean) normalized);
        }
        return JsonNodeFactory.instance.textNode(normalized.toString());
    }
}
