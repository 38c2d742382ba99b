package com.mini.bloomdb.server.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mini.bloomdb.server.exception.ProtocolException;
import com.mini.bloomdb.server.exception.SearchException;
import com.mini.bloomdb.utils.SerializationUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 请求和响应消息的 JSON 编解码
 * 
 * 请求：{"type"?: "search", "index_source": str, "file_pattern": str, "query": rule}
 * 存活检测：{"type": "ping"}，响应 {"status": "ok", "alive": true}
 * 成功响应：{"status": "ok", "files": [...], "failures": [{"location", "message"}]}
 * 错误响应：{"status": "error", "error": {"kind", "message"}}
 */
public final class MessageCodec {
    
    static final String TYPE = "type";
    static final String TYPE_SEARCH = "search";
    static final String TYPE_PING = "ping";
    static final String ALIVE = "alive";
    static final String INDEX_SOURCE = "index_source";
    static final String FILE_PATTERN = "file_pattern";
    static final String QUERY = "query";
    static final String STATUS = "status";
    static final String STATUS_OK = "ok";
    static final String STATUS_ERROR = "error";
    static final String FILES = "files";
    static final String FAILURES = "failures";
    static final String LOCATION = "location";
    static final String MESSAGE = "message";
    static final String ERROR = "error";
    static final String KIND = "kind";
    
    private MessageCodec() {
    }
    
    public static byte[] encodeRequest(SearchRequest request) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(INDEX_SOURCE, request.getIndexSource());
        node.put(FILE_PATTERN, request.getFilePattern());
        node.set(QUERY, RuleJsonCodec.toJson(request.getQuery()));
        return toBytes(node);
    }
    
    public static byte[] encodePing() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(TYPE, TYPE_PING);
        return toBytes(node);
    }
    
    /**
     * 解析请求帧
     * @throws ProtocolException JSON 非法、不是对象或请求类型未知
     */
    public static JsonNode parseRequest(byte[] frame) {
        JsonNode node = parse(frame, "request");
        JsonNode type = node.get(TYPE);
        if (type != null && !type.isNull()) {
            if (!type.isTextual() 
                    || !(TYPE_SEARCH.equals(type.asText()) || TYPE_PING.equals(type.asText()))) {
                throw new ProtocolException("Unknown request type: " + type);
            }
        }
        return node;
    }
    
    public static boolean isPing(JsonNode request) {
        JsonNode type = request.get(TYPE);
        return type != null && TYPE_PING.equals(type.asText());
    }
    
    /**
     * @throws ProtocolException JSON 非法或缺少字段
     */
    public static SearchRequest decodeRequest(byte[] frame) {
        return decodeRequest(parseRequest(frame));
    }
    
    /**
     * @throws ProtocolException 缺少字段或规则树格式错误
     */
    public static SearchRequest decodeRequest(JsonNode node) {
        if (isPing(node)) {
            throw new ProtocolException("Expected a search request, got a ping");
        }
        return new SearchRequest(
            requiredText(node, INDEX_SOURCE),
            requiredText(node, FILE_PATTERN),
            RuleJsonCodec.fromJson(required(node, QUERY))
        );
    }
    
    public static byte[] encodePong() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(STATUS, STATUS_OK);
        node.put(ALIVE, true);
        return toBytes(node);
    }
    
    /**
     * @throws ProtocolException 响应格式错误
     * @throws SearchException 服务端返回错误响应
     */
    public static void decodePong(byte[] frame) {
        JsonNode node = parseResponse(frame);
        JsonNode alive = node.get(ALIVE);
        if (alive == null || !alive.isBoolean() || !alive.booleanValue()) {
            throw new ProtocolException("Ping response is missing '" + ALIVE + "'");
        }
    }
    
    public static byte[] encodeResult(SearchResult result) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(STATUS, STATUS_OK);
        ArrayNode files = node.putArray(FILES);
        for (String file : result.getFiles()) {
            files.add(file);
        }
        ArrayNode failures = node.putArray(FAILURES);
        for (SearchResult.LoadFailure failure : result.getFailures()) {
            ObjectNode failureNode = failures.addObject();
            failureNode.put(LOCATION, failure.getLocation());
            failureNode.put(MESSAGE, failure.getMessage());
        }
        return toBytes(node);
    }
    
    public static byte[] encodeError(ErrorKind kind, String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put(STATUS, STATUS_ERROR);
        ObjectNode error = node.putObject(ERROR);
        error.put(KIND, kind.name());
        error.put(MESSAGE, message == null ? "" : message);
        return toBytes(node);
    }
    
    /**
     * @throws ProtocolException 响应格式错误
     * @throws SearchException 服务端返回错误响应
     */
    public static SearchResult decodeResponse(byte[] frame) {
        JsonNode node = parseResponse(frame);
        
        List<String> files = new ArrayList<>();
        for (JsonNode file : requiredArray(node, FILES)) {
            if (!file.isTextual()) {
                throw new ProtocolException("File entry must be a string: " + file);
            }
            files.add(file.asText());
        }
        
        List<SearchResult.LoadFailure> failures = new ArrayList<>();
        JsonNode failuresNode = node.get(FAILURES);
        if (failuresNode != null) {
            if (!failuresNode.isArray()) {
                throw new ProtocolException("'" + FAILURES + "' must be an array");
            }
            for (JsonNode failure : failuresNode) {
                failures.add(new SearchResult.LoadFailure(
                    requiredText(failure, LOCATION), requiredText(failure, MESSAGE)));
            }
        }
        return new SearchResult(files, failures);
    }
    
    /**
     * 解析响应帧，错误响应转为异常
     */
    private static JsonNode parseResponse(byte[] frame) {
        JsonNode node = parse(frame, "response");
        String status = requiredText(node, STATUS);
        
        if (STATUS_ERROR.equals(status)) {
            JsonNode error = required(node, ERROR);
            ErrorKind kind;
            try {
                kind = ErrorKind.valueOf(requiredText(error, KIND));
            } catch (IllegalArgumentException e) {
                throw new ProtocolException("Unknown error kind: " + error.get(KIND));
            }
            throw new SearchException(kind, requiredText(error, MESSAGE));
        }
        if (!STATUS_OK.equals(status)) {
            throw new ProtocolException("Unknown response status: " + status);
        }
        return node;
    }
    
    private static JsonNode parse(byte[] frame, String what) {
        JsonNode node;
        try {
            node = SerializationUtils.readTree(frame);
        } catch (IOException e) {
            throw new ProtocolException("Malformed " + what + ": " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Malformed " + what + ": expected a JSON object");
        }
        return node;
    }
    
    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new ProtocolException("Missing field '" + field + "'");
        }
        return value;
    }
    
    private static String requiredText(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isTextual()) {
            throw new ProtocolException("Field '" + field + "' must be a string");
        }
        return value.asText();
    }
    
    private static JsonNode requiredArray(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isArray()) {
            throw new ProtocolException("Field '" + field + "' must be an array");
        }
        return value;
    }
    
    private static byte[] toBytes(JsonNode node) {
        try {
            return SerializationUtils.toBytes(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
