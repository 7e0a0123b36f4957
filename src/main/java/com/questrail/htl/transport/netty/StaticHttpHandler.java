package com.questrail.htl.transport.netty;

import com.questrail.htl.transport.StaticRequestListener;
import com.questrail.htl.transport.StaticResponse;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * StaticHttpHandler
 * -----------------------------------------------------------------------------
 * Translates aggregated Netty HTTP requests into
 * {@link StaticRequestListener#onRequest(String, String)} calls and writes the
 * returned {@link StaticResponse} back.
 *
 * <p>HEAD responses carry the headers of the corresponding GET but no body.
 * Requests Netty could not decode are answered with 400 and the connection is
 * closed.</p>
 */
final class StaticHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest>
{
    private static final Logger log = LoggerFactory.getLogger(StaticHttpHandler.class);

    private final StaticRequestListener listener;

    StaticHttpHandler(StaticRequestListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        if (!request.decoderResult().isSuccess()) {
            FullHttpResponse bad = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.BAD_REQUEST);
            HttpUtil.setContentLength(bad, 0);
            ctx.writeAndFlush(bad).addListener(ChannelFutureListener.CLOSE);
            return;
        }

        String path = new QueryStringDecoder(request.uri()).path();
        StaticResponse answer = listener.onRequest(request.method().name(), path);

        boolean head = HttpMethod.HEAD.equals(request.method());
        ByteBuf body = (head || answer.body().length == 0)
                ? Unpooled.EMPTY_BUFFER
                : Unpooled.wrappedBuffer(answer.body());

        FullHttpResponse response = new DefaultFullHttpResponse(
                request.protocolVersion(),
                HttpResponseStatus.valueOf(answer.status()),
                body);
        if (answer.contentType() != null) {
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, answer.contentType());
        }
        HttpUtil.setContentLength(response, answer.body().length);

        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);

        ChannelFuture written = ctx.writeAndFlush(response);
        if (!keepAlive) {
            written.addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.warn("Closing connection {} after failure", ctx.channel().remoteAddress(), cause);
        ctx.close();
    }
}
