package com.mini.bloomdb.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.mini.bloomdb.exception.StoreException;
import com.mini.bloomdb.server.exception.ProtocolException;
import com.mini.bloomdb.server.protocol.ErrorKind;
import com.mini.bloomdb.server.protocol.MessageCodec;
import com.mini.bloomdb.server.protocol.SearchRequest;
import com.mini.bloomdb.server.protocol.SearchResult;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * 处理一个连接上的一次搜索请求或存活检测
 * 无论成功或失败都会写回一个响应，然后关闭连接
 * 
 * 每个连接一个实例，不可复用。
 */
public class SearchServerHandler extends ChannelInboundHandlerAdapter {
    
    private static final Logger logger = LoggerFactory.getLogger(SearchServerHandler.class);
    
    private final SearchService searchService;
    
    /** 一个连接只处理第一个请求 */
    private boolean requestReceived;
    
    public SearchServerHandler(SearchService searchService) {
        this.searchService = searchService;
    }
    
    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        byte[] frame;
        try {
            if (requestReceived) {
                logger.debug("Ignoring extra frame from {}", ctx.channel().remoteAddress());
                return;
            }
            requestReceived = true;
            frame = ByteBufUtil.getBytes((ByteBuf) msg);
        } finally {
            ReferenceCountUtil.release(msg);
        }
        
        // 请求已到达，不再需要读超时
        if (ctx.pipeline().get(SearchServerInitializer.READ_TIMEOUT_HANDLER) != null) {
            ctx.pipeline().remove(SearchServerInitializer.READ_TIMEOUT_HANDLER);
        }
        
        handleRequest(ctx, frame);
    }
    
    private void handleRequest(ChannelHandlerContext ctx, byte[] frame) {
        SearchRequest request;
        try {
            JsonNode node = MessageCodec.parseRequest(frame);
            if (MessageCodec.isPing(node)) {
                logger.debug("Ping from {}", ctx.channel().remoteAddress());
                respond(ctx, MessageCodec.encodePong());
                return;
            }
            request = MessageCodec.decodeRequest(node);
        } catch (ProtocolException e) {
            logger.warn("Malformed request from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            respond(ctx, MessageCodec.encodeError(ErrorKind.PROTOCOL, e.getMessage()));
            return;
        }
        
        logger.debug("Received {} from {}", request, ctx.channel().remoteAddress());
        try {
            SearchResult result = searchService.search(request, () -> !ctx.channel().isActive());
            respond(ctx, MessageCodec.encodeResult(result));
        } catch (ProtocolException e) {
            logger.warn("Rejected request {}: {}", request, e.getMessage());
            respond(ctx, MessageCodec.encodeError(ErrorKind.PROTOCOL, e.getMessage()));
        } catch (StoreException e) {
            logger.warn("Store error for request {}: {}", request, e.getMessage());
            respond(ctx, MessageCodec.encodeError(ErrorKind.STORE, e.getMessage()));
        } catch (CancellationException e) {
            logger.info("Client {} closed the connection, discarding request", ctx.channel().remoteAddress());
            ctx.close();
        } catch (RuntimeException e) {
            logger.error("Failed to handle request " + request, e);
            respond(ctx, MessageCodec.encodeError(ErrorKind.INTERNAL, 
                e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }
    
    private void respond(ChannelHandlerContext ctx, byte[] response) {
        ctx.writeAndFlush(Unpooled.wrappedBuffer(response)).addListener(ChannelFutureListener.CLOSE);
    }
    
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            logger.warn("Oversized frame from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
            if (!requestReceived) {
                requestReceived = true;
                respond(ctx, MessageCodec.encodeError(ErrorKind.PROTOCOL, cause.getMessage()));
                return;
            }
        } else if (cause instanceof ReadTimeoutException) {
            logger.warn("Timed out waiting for a request from {}", ctx.channel().remoteAddress());
        } else {
            logger.warn("Connection error from " + ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }
}
