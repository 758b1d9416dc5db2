package com.acme.analytics.collector.transport.http;

import com.acme.analytics.collector.schema.ValidationErrorKind;
import com.acme.analytics.collector.telemetry.CollectorMetrics;
import com.acme.analytics.collector.telemetry.NoopCollectorMetrics;
import com.acme.analytics.collector.transport.api.InboundRequest;
import com.acme.analytics.collector.transport.api.TransportAck;
import com.acme.analytics.collector.transport.api.TransportAdapter;
import com.acme.analytics.collector.transport.api.TransportNack;
import com.acme.analytics.collector.transport.api.TransportResponse;
import com.acme.analytics.collector.util.CollectorDefaults;
import com.acme.analytics.collector.util.CollectorStatusCodes;
import com.acme.analytics.collector.util.IngestContentTypes;
import com.acme.analytics.collector.util.JsonCodec;
import com.acme.analytics.collector.util.RejectReasons;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;

import java.net.InetSocketAddress;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front door of the collector.
 *
 * <ul>
 *   <li>{@code POST /} or {@code POST /{any}}: event ingestion, 202 on success</li>
 *   <li>{@code GET /healthcheck}: 200 while the collector is healthy, 503 otherwise</li>
 * </ul>
 * Content type and body size are checked here; everything else is up to the inbound handler.
 */
public final class NettyIngestHttpAdapter implements TransportAdapter {
    private static final Logger LOG = Logger.getLogger(NettyIngestHttpAdapter.class.getName());
    private static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";
    private static final String APPLICATION_JSON = "application/json";

    private final int port;
    private final int maxBodyBytes;
    private final BooleanSupplier healthCheck;
    private final CollectorMetrics metrics;
    private final AtomicLong requestIds = new AtomicLong(1);

    private volatile InboundHandler inboundHandler = request -> new TransportAck(CollectorStatusCodes.ACCEPTED);

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public NettyIngestHttpAdapter(int port) {
        this(port, CollectorDefaults.DEFAULT_MAX_BODY_BYTES, () -> true, NoopCollectorMetrics.INSTANCE);
    }

    public NettyIngestHttpAdapter(int port,
                                  int maxBodyBytes,
                                  BooleanSupplier healthCheck,
                                  CollectorMetrics metrics) {
        if (maxBodyBytes <= 0 || maxBodyBytes > CollectorDefaults.MAX_AGGREGATED_CONTENT_LENGTH) {
            throw new IllegalArgumentException("maxBodyBytes out of range: " + maxBodyBytes);
        }
        this.port = port;
        this.maxBodyBytes = maxBodyBytes;
        this.healthCheck = Objects.requireNonNull(healthCheck, "healthCheck");
        this.metrics = metrics == null ? NoopCollectorMetrics.INSTANCE : metrics;
    }

    @Override
    public int listenPort() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }

    @Override
    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, CollectorDefaults.DEFAULT_SO_BACKLOG)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(CollectorDefaults.MAX_AGGREGATED_CONTENT_LENGTH));
                        ch.pipeline().addLast(new IngestHttpHandler());
                    }
                });

            serverChannel = bootstrap.bind(port).sync().channel();
            LOG.info(() -> "Ingest HTTP adapter started on port " + listenPort());
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    @Override
    public synchronized void stop() throws Exception {
        Exception first = null;

        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            try {
                ch.close().syncUninterruptibly();
            } catch (Exception e) {
                first = e;
            }
        }

        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully().syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully().syncUninterruptibly();
        }

        LOG.info(() -> "Ingest HTTP adapter stopped");

        if (first != null) {
            throw first;
        }
    }

    @Override
    public void setInboundHandler(InboundHandler handler) {
        this.inboundHandler = Objects.requireNonNull(handler, "handler");
    }

    private final class IngestHttpHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (!req.decoderResult().isSuccess()) {
                writeResponse(ctx, req, HttpResponseStatus.BAD_REQUEST, "bad request", TEXT_PLAIN_UTF8);
                return;
            }

            String path = stripQuery(req.uri());
            if (CollectorDefaults.HEALTHCHECK_PATH.equals(path)
                && (req.method() == HttpMethod.GET || req.method() == HttpMethod.HEAD)) {
                boolean healthy = safeHealthCheck();
                writeResponse(ctx, req, healthy ? HttpResponseStatus.OK : HttpResponseStatus.SERVICE_UNAVAILABLE,
                    healthy ? "ok" : "unavailable", TEXT_PLAIN_UTF8);
                return;
            }
            if (req.method() != HttpMethod.POST) {
                writeResponse(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed", TEXT_PLAIN_UTF8);
                return;
            }

            String contentType = req.headers().get(HttpHeaderNames.CONTENT_TYPE);
            if (contentType == null || contentType.isBlank()) {
                metrics.incRejected(RejectReasons.UNSUPPORTED_CONTENT_TYPE);
                writeResponse(ctx, req, HttpResponseStatus.BAD_REQUEST, "Missing Content-Type header", TEXT_PLAIN_UTF8);
                return;
            }
            if (!IngestContentTypes.isSupported(contentType)) {
                metrics.incRejected(RejectReasons.UNSUPPORTED_CONTENT_TYPE);
                writeResponse(ctx, req, HttpResponseStatus.BAD_REQUEST, "Invalid Content-Type header", TEXT_PLAIN_UTF8);
                return;
            }
            if (req.content().readableBytes() > maxBodyBytes) {
                metrics.incRejected(RejectReasons.PAYLOAD_TOO_LARGE);
                writeResponse(ctx, req, HttpResponseStatus.REQUEST_ENTITY_TOO_LARGE, "Request body too large", TEXT_PLAIN_UTF8);
                return;
            }

            String body;
            try {
                body = decodeUtf8(req.content());
            } catch (CharacterCodingException e) {
                String reason = ValidationErrorKind.MALFORMED_JSON.label();
                metrics.incRejected(reason);
                TransportNack nack = new TransportNack(CollectorStatusCodes.BAD_REQUEST, reason, null,
                    "request body is not valid UTF-8", false);
                writeResponse(ctx, req, HttpResponseStatus.BAD_REQUEST, renderNack(nack), APPLICATION_JSON);
                return;
            }

            try {
                TransportResponse result = inboundHandler.onRequest(new InboundRequest(
                    requestIds.getAndIncrement(),
                    path,
                    contentType,
                    body
                ));

                if (result instanceof TransportNack nack) {
                    writeResponse(ctx, req, HttpResponseStatus.valueOf(nack.statusCode()), renderNack(nack), APPLICATION_JSON);
                } else if (result instanceof TransportAck ack) {
                    int code = ack.statusCode() > 0 ? ack.statusCode() : CollectorStatusCodes.ACCEPTED;
                    writeResponse(ctx, req, HttpResponseStatus.valueOf(code), Unpooled.EMPTY_BUFFER, TEXT_PLAIN_UTF8);
                } else {
                    writeResponse(ctx, req, HttpResponseStatus.ACCEPTED, Unpooled.EMPTY_BUFFER, TEXT_PLAIN_UTF8);
                }
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "HTTP ingest failure", e);
                writeResponse(ctx, req, HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error", TEXT_PLAIN_UTF8);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.SEVERE, "HTTP pipeline failure", cause);
            ctx.close();
        }
    }

    private boolean safeHealthCheck() {
        try {
            return healthCheck.getAsBoolean();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Health check failure", e);
            return false;
        }
    }

    /** Strict decode: malformed or truncated sequences are reported instead of replaced. */
    static String decodeUtf8(ByteBuf content) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(content.nioBuffer())
            .toString();
    }

    static String renderNack(TransportNack nack) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", nack.errorCode());
        if (nack.field() != null) {
            body.put("field", nack.field());
        }
        body.put("message", nack.message());
        try {
            return JsonCodec.writeString(body);
        } catch (JsonProcessingException e) {
            return "{\"error\":\"" + nack.errorCode() + "\"}";
        }
    }

    private static String stripQuery(String uri) {
        int q = uri.indexOf('?');
        return q >= 0 ? uri.substring(0, q) : uri;
    }

    private static void writeResponse(ChannelHandlerContext ctx,
                                      FullHttpRequest req,
                                      HttpResponseStatus status,
                                      String message,
                                      String contentType) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        ByteBuf buf = ctx.alloc().buffer(bytes.length);
        buf.writeBytes(bytes);
        try {
            writeResponse(ctx, req, status, buf, contentType);
        } finally {
            buf.release();
        }
    }

    private static void writeResponse(ChannelHandlerContext ctx,
                                      FullHttpRequest req,
                                      HttpResponseStatus status,
                                      ByteBuf body,
                                      String contentType) {
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, body.retainedDuplicate());
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
