package com.mini.bloomdb.server.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.mini.bloomdb.query.Rule;
import com.mini.bloomdb.server.exception.ProtocolException;
import com.mini.bloomdb.server.exception.SearchException;
import com.mini.bloomdb.utils.SerializationUtils;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 消息编解码测试
 */
public class MessageCodecTest {
    
    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
    
    @Test
    public void testDecodeRequest() {
        SearchRequest request = MessageCodec.decodeRequest(utf8(
            "{\"index_source\": \"apac\", \"file_pattern\": \"APAC_*\","
            + " \"query\": {\"column\": \"account_status\", \"value\": \"Inactive\"}}"));
        
        assertEquals(new SearchRequest("apac", "APAC_*", Rule.equal("account_status", "Inactive")), request);
        assertEquals(request, MessageCodec.decodeRequest(MessageCodec.encodeRequest(request)));
    }
    
    @Test
    public void testMalformedRequest() {
        String[] malformed = {
            "not json",
            "{\"index_source\": \"a\", \"file_pattern\": \"*\"",
            "42",
            "{\"file_pattern\": \"*\", \"query\": {\"column\": \"a\", \"value\": 1}}",
            "{\"index_source\": 1, \"file_pattern\": \"*\", \"query\": {\"column\": \"a\", \"value\": 1}}",
            "{\"index_source\": \"a\", \"file_pattern\": \"*\"}",
            "{\"index_source\": \"a\", \"file_pattern\": \"*\", \"query\": {}}",
            "{\"index_source\": \"a\", \"file_pattern\": \"*\", \"query\": {\"column\": \"a\", \"value\": 1}} {}"
        };
        for (String json : malformed) {
            assertThrows(ProtocolException.class, () -> MessageCodec.decodeRequest(utf8(json)), json);
        }
    }
    
    @Test
    public void testEncodeResult() throws Exception {
        SearchResult result = new SearchResult(
            Arrays.asList("/data/b.csv", "/data/c.csv"),
            Collections.singletonList(new SearchResult.LoadFailure("/idx/d.csv.bidx", "corrupt index data")));
        
        JsonNode node = SerializationUtils.readTree(MessageCodec.encodeResult(result));
        assertEquals("ok", node.get("status").asText());
        assertEquals(2, node.get("files").size());
        assertEquals("/data/b.csv", node.get("files").get(0).asText());
        assertEquals("/idx/d.csv.bidx", node.get("failures").get(0).get("location").asText());
        
        assertEquals(result, MessageCodec.decodeResponse(MessageCodec.encodeResult(result)));
    }
    
    @Test
    public void testErrorResponse() throws Exception {
        byte[] frame = MessageCodec.encodeError(ErrorKind.STORE, "index source not found");
        
        JsonNode node = SerializationUtils.readTree(frame);
        assertEquals("error", node.get("status").asText());
        assertEquals("STORE", node.get("error").get("kind").asText());
        
        SearchException e = assertThrows(SearchException.class, () -> MessageCodec.decodeResponse(frame));
        assertEquals(ErrorKind.STORE, e.getKind());
        assertTrue(e.getMessage().contains("index source not found"));
    }
    
    @Test
    public void testMalformedResponse() {
        assertThrows(ProtocolException.class, () -> MessageCodec.decodeResponse(utf8("{\"status\": \"maybe\"}")));
        assertThrows(ProtocolException.class, () -> MessageCodec.decodeResponse(utf8("{\"status\": \"ok\"}")));
        assertThrows(ProtocolException.class, () -> MessageCodec.decodeResponse(
            utf8("{\"status\": \"error\", \"error\": {\"kind\": \"OOPS\", \"message\": \"x\"}}")));
        
        // 缺少 failures 视为空
        assertTrue(MessageCodec.decodeResponse(utf8("{\"status\": \"ok\", \"files\": []}"))
                .getFailures().isEmpty());
    }
    
    @Test
    public void testPing() throws Exception {
        JsonNode ping = MessageCodec.parseRequest(MessageCodec.encodePing());
        assertTrue(MessageCodec.isPing(ping));
        assertThrows(ProtocolException.class, () -> MessageCodec.decodeRequest(MessageCodec.encodePing()));
        
        JsonNode search = MessageCodec.parseRequest(utf8(
            "{\"type\": \"search\", \"index_source\": \"\", \"file_pattern\": \"*\","
            + " \"query\": {\"column\": \"a\", \"value\": 1}}"));
        assertFalse(MessageCodec.isPing(search));
        assertEquals("*", MessageCodec.decodeRequest(search).getFilePattern());
        
        assertThrows(ProtocolException.class, () -> MessageCodec.parseRequest(utf8("{\"type\": \"drop\"}")));
        assertThrows(ProtocolException.class, () -> MessageCodec.parseRequest(utf8("{\"type\": 1}")));
        
        MessageCodec.decodePong(MessageCodec.encodePong());
        assertThrows(ProtocolException.class, () -> MessageCodec.decodePong(utf8("{\"status\": \"ok\"}")));
        assertThrows(SearchException.class, 
            () -> MessageCodec.decodePong(MessageCodec.encodeError(ErrorKind.INTERNAL, "down")));
    }
}
