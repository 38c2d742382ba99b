package com.mini.bloomdb.server.protocol;

import com.mini.bloomdb.query.Operator;
import com.mini.bloomdb.query.Rule;
import com.mini.bloomdb.server.exception.ProtocolException;
import com.mini.bloomdb.utils.SerializationUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 规则树 JSON 编解码测试
 */
public class RuleJsonCodecTest {
    
    private static Rule parse(String json) throws Exception {
        return RuleJsonCodec.fromJson(SerializationUtils.readTree(json));
    }
    
    @Test
    public void testParseNestedRules() throws Exception {
        Rule rule = parse("{\"condition\": \"AND\", \"rules\": ["
                + "{\"column\": \"account_status\", \"value\": \"Inactive\"},"
                + "{\"condition\": \"or\", \"rules\": ["
                + "  {\"column\": \"age\", \"value\": 42},"
                + "  {\"column\": \"score\", \"value\": 1.5, \"op\": \"ge\"},"
                + "  {\"column\": \"vip\", \"value\": true}"
                + "]}]}");
        
        Rule expected = Rule.and(
            Rule.equal("account_status", "Inactive"),
            Rule.or(
                Rule.equal("age", 42L),
                Rule.compare("score", Operator.GE, 1.5d),
                Rule.equal("vip", true)
            )
        );
        assertEquals(expected, rule);
    }
    
    @Test
    public void testNumbersAreNormalized() throws Exception {
        Rule.Leaf leaf = (Rule.Leaf) parse("{\"column\": \"n\", \"value\": 7}");
        assertEquals(7L, leaf.getValue());
        
        leaf = (Rule.Leaf) parse("{\"column\": \"n\", \"value\": -0.0}");
        assertEquals(0.0d, leaf.getValue());
    }
    
    @Test
    public void testEmptyGroupIsAllowed() throws Exception {
        Rule.Group group = (Rule.Group) parse("{\"condition\": \"OR\", \"rules\": []}");
        assertTrue(group.getRules().isEmpty());
    }
    
    @Test
    public void testMalformedRules() {
        String[] malformed = {
            "[]",
            "{}",
            "{\"condition\": \"XOR\", \"rules\": []}",
            "{\"condition\": 1, \"rules\": []}",
            "{\"condition\": \"AND\"}",
            "{\"condition\": \"AND\", \"rules\": {}}",
            "{\"column\": \"\", \"value\": 1}",
            "{\"column\": 5, \"value\": 1}",
            "{\"column\": \"a\"}",
            "{\"column\": \"a\", \"value\": null}",
            "{\"column\": \"a\", \"value\": [1]}",
            "{\"column\": \"a\", \"value\": 1, \"op\": \"NE\"}",
            "{\"condition\": \"AND\", \"rules\": [{\"column\": \"a\"}]}"
        };
        for (String json : malformed) {
            assertThrows(ProtocolException.class, () -> parse(json), json);
        }
    }
    
    @Test
    public void testToJsonRoundTrip() throws Exception {
        Rule rule = Rule.or(
            Rule.equal("name", "Alice"),
            Rule.and(Rule.compare("age", Operator.LT, 30L), Rule.equal("vip", false))
        );
        assertEquals(rule, RuleJsonCodec.fromJson(RuleJsonCodec.toJson(rule)));
        
        // EQ 不输出 op 字段
        assertFalse(RuleJsonCodec.toJson(Rule.equal("a", "b")).has("op"));
    }
}
