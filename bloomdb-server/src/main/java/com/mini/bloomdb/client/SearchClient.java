package com.mini.bloomdb.client;

import com.mini.bloomdb.server.exception.ConnectionException;
import com.mini.bloomdb.server.protocol.MessageCodec;
import com.mini.bloomdb.server.protocol.SearchRequest;
import com.mini.bloomdb.server.protocol.SearchResult;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 搜索客户端
 * 每次 send 或 ping 建立一个新连接，发送一个请求并等待响应；不重试
 */
public class SearchClient implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(SearchClient.class);
    
    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    
    private static final int LENGTH_FIELD_BYTES = 4;
    private static final int MAX_RESPONSE_BYTES = 64 * 1024 * 1024;
    
    private final String host;
    private final int port;
    private final long timeoutMillis;
    private final EventLoopGroup group;
    
    public SearchClient(String host, int port) {
        this(host, port, DEFAULT_TIMEOUT_MS);
    }
    
    /**
     * @param timeoutMillis 连接加等待响应的总超时
     */
    public SearchClient(String host, int port, long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
        this.host = host;
        this.port = port;
        this.timeoutMillis = timeoutMillis;
        this.group = new NioEventLoopGroup(1);
    }
    
    /**
     * 发送搜索请求
     * @throws ConnectionException 连接失败、响应前连接关闭或超时
     * @throws com.mini.bloomdb.server.exception.ProtocolException 响应格式错误
     * @throws com.mini.bloomdb.server.exception.SearchException 服务端返回错误响应
     */
    public SearchResult send(SearchRequest request) {
        return MessageCodec.decodeResponse(exchange(MessageCodec.encodeRequest(request)));
    }
    
    /**
     * 检测服务端是否存活
     * @throws ConnectionException 连接失败、响应前连接关闭或超时
     * @throws com.mini.bloomdb.server.exception.ProtocolException 响应格式错误
     */
    public void ping() {
        MessageCodec.decodePong(exchange(MessageCodec.encodePing()));
    }
    
    /**
     * 建立连接，发送一帧并等待一帧响应
     */
    private byte[] exchange(byte[] requestBytes) {
        CompletableFuture<byte[]> response = new CompletableFuture<>();
        
        Bootstrap client = new Bootstrap();
        client.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeoutMillis, Integer.MAX_VALUE))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel channel) {
                        channel.pipeline().addLast(
                            new LengthFieldBasedFrameDecoder(MAX_RESPONSE_BYTES + LENGTH_FIELD_BYTES, 
                                0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES),
                            new LengthFieldPrepender(LENGTH_FIELD_BYTES),
                            new SearchClientHandler(requestBytes, response));
                    }
                });
        
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
        ChannelFuture connectFuture = client.connect(host, port);
        failOnConnectError(connectFuture, response);
        Channel channel = connectFuture.channel();
        try {
            return response.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new ConnectionException("Timed out after " + timeoutMillis + " ms waiting for " 
                    + host + ":" + port, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting for " + host + ":" + port, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConnectionException) {
                throw (ConnectionException) cause;
            }
            throw new ConnectionException("Request to " + host + ":" + port + " failed: " 
                    + cause.getMessage(), cause);
        } finally {
            channel.close();
        }
    }
    
    private void failOnConnectError(ChannelFuture connectFuture, CompletableFuture<byte[]> response) {
        connectFuture.addListener(f -> {
            if (!f.isSuccess()) {
                logger.debug("Failed to connect to {}:{}", host, port, f.cause());
                response.completeExceptionally(new ConnectionException(
                    "Failed to connect to " + host + ":" + port + ": " + f.cause().getMessage(), f.cause()));
            }
        });
    }
    
    @Override
    public void close() {
        group.shutdownGracefully();
    }
}
