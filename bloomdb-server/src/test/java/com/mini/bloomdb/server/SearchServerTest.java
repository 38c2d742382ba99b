package com.mini.bloomdb.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.mini.bloomdb.index.FileIndex;
import com.mini.bloomdb.index.FileIndexBuilder;
import com.mini.bloomdb.index.IndexOptions;
import com.mini.bloomdb.io.IndexStore;
import com.mini.bloomdb.query.Rule;
import com.mini.bloomdb.schema.DataType;
import com.mini.bloomdb.server.exception.ConnectionException;
import com.mini.bloomdb.server.exception.SearchException;
import com.mini.bloomdb.server.protocol.ErrorKind;
import com.mini.bloomdb.server.protocol.SearchRequest;
import com.mini.bloomdb.server.protocol.SearchResult;
import com.mini.bloomdb.client.SearchClient;
import com.mini.bloomdb.source.ListTabularSource;
import com.mini.bloomdb.utils.IndexPathFactory;
import com.mini.bloomdb.utils.SerializationUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 搜索服务端到端测试
 */
public class SearchServerTest {
    
    @TempDir
    Path tempDir;
    
    private SearchServer server;
    private SearchClient client;
    
    @BeforeEach
    public void setUp() throws Exception {
        IndexStore store = new IndexStore();
        IndexPathFactory pathFactory = new IndexPathFactory(tempDir.toString());
        write(store, pathFactory, "/data/file1.csv", "Active");
        write(store, pathFactory, "/data/file2.csv", "Inactive");
        write(store, pathFactory, "/data/file3.csv", "Inactive", "Active");
        
        ServerOptions options = ServerOptions.builder()
                .indexRoot(tempDir.toString())
                .port(0)
                .workerThreads(2)
                .build();
        server = new SearchServer(options);
        server.start();
        client = new SearchClient("127.0.0.1", server.getPort(), 10_000L);
    }
    
    @AfterEach
    public void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.close();
        }
    }
    
    private static void write(IndexStore store, IndexPathFactory pathFactory, String sourcePath, String... statuses) {
        FileIndex fileIndex = new FileIndexBuilder(new IndexOptions())
                .build(ListTabularSource.builder(sourcePath)
                        .column("account_status", DataType.STRING, (Object[]) statuses)
                        .build())
                .getFileIndex();
        store.write(fileIndex, pathFactory.indexLocation(sourcePath));
    }
    
    @Test
    public void testSearch() {
        SearchResult result = client.send(new SearchRequest("", "file*.csv", 
            Rule.equal("account_status", "Inactive")));
        assertEquals(Arrays.asList("/data/file2.csv", "/data/file3.csv"), result.getFiles());
        assertTrue(result.getFailures().isEmpty());
        
        // 同一客户端可以发送多个请求
        result = client.send(new SearchRequest("", "file*.csv", Rule.equal("account_status", "Active")));
        assertEquals(Arrays.asList("/data/file1.csv", "/data/file3.csv"), result.getFiles());
    }
    
    @Test
    public void testPing() {
        client.ping();
    }
    
    @Test
    public void testNoMatchingFiles() {
        SearchResult result = client.send(new SearchRequest("", "EMEA_*", Rule.equal("account_status", "Active")));
        assertEquals(Collections.emptyList(), result.getFiles());
    }
    
    @Test
    public void testPartialFailure() throws Exception {
        Files.write(tempDir.resolve("file4.csv.bidx"), new byte[]{1, 2, 3});
        
        SearchResult result = client.send(new SearchRequest("", "*", Rule.equal("account_status", "Inactive")));
        assertEquals(Arrays.asList("/data/file2.csv", "/data/file3.csv"), result.getFiles());
        assertEquals(1, result.getFailures().size());
    }
    
    @Test
    public void testStoreError() {
        SearchException e = assertThrows(SearchException.class, 
            () -> client.send(new SearchRequest("missing", "*", Rule.equal("account_status", "Active"))));
        assertEquals(ErrorKind.STORE, e.getKind());
        
        e = assertThrows(SearchException.class, 
            () -> client.send(new SearchRequest("../up", "*", Rule.equal("account_status", "Active"))));
        assertEquals(ErrorKind.PROTOCOL, e.getKind());
    }
    
    @Test
    public void testMalformedRequest() throws Exception {
        try (Socket socket = new Socket("127.0.0.1", server.getPort())) {
            socket.setSoTimeout(10_000);
            DataOutputStream out = new DataOutputStream(socket.getOutputStream());
            byte[] body = "{\"index_source\": \"\"}".getBytes(StandardCharsets.UTF_8);
            out.writeInt(body.length);
            out.write(body);
            out.flush();
            
            DataInputStream in = new DataInputStream(socket.getInputStream());
            byte[] response = new byte[in.readInt()];
            in.readFully(response);
            
            JsonNode node = SerializationUtils.readTree(response);
            assertEquals("error", node.get("status").asText());
            assertEquals("PROTOCOL", node.get("error").get("kind").asText());
            
            // 响应后服务端关闭连接
            assertEquals(-1, in.read());
        }
    }
    
    @Test
    public void testConnectionRefused() throws Exception {
        int freePort;
        try (ServerSocket socket = new ServerSocket(0)) {
            freePort = socket.getLocalPort();
        }
        try (SearchClient refused = new SearchClient("127.0.0.1", freePort, 5_000L)) {
            assertThrows(ConnectionException.class, 
                () -> refused.send(new SearchRequest("", "*", Rule.equal("account_status", "Active"))));
            assertThrows(ConnectionException.class, refused::ping);
        }
    }
}
