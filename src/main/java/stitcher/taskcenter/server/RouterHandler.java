package stitcher.taskcenter.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import stitcher.taskcenter.api.Controller;
import stitcher.taskcenter.api.Controller.ControllerResponse;
import stitcher.taskcenter.api.ErrorBody;
import stitcher.taskcenter.model.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches every request to the first matching {@link Controller} and maps
 * exceptions to status codes: bad input 400, unknown task 404, anything else 500.
 * Paths outside {@code /api/v1} match no controller and get 404.
 * <p>
 * Holds no per-channel state, so one instance serves all connections.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    private final List<Controller> controllers = new CopyOnWriteArrayList<>();

    /** Controllers are consulted in registration order. */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Controller {} registered", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    /** Mapper used for every request and response body. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = new QueryStringDecoder(req.uri()).path();
        ControllerResponse response;
        try {
            response = dispatch(ctx, req, path);
        } catch (Exception e) {
            response = failure(req, path, e);
        }
        respond(ctx, response);
    }

    private ControllerResponse dispatch(ChannelHandlerContext ctx, FullHttpRequest req, String path)
            throws Exception {
        for (Controller controller : controllers) {
            if (controller.matches(req.method(), path)) {
                return controller.handle(ctx, req, path);
            }
        }
        log.debug("No route for {} {}", req.method(), path);
        return ControllerResponse.notFound("no route for " + req.method() + " " + path);
    }

    private static ControllerResponse failure(FullHttpRequest req, String path, Exception e) {
        if (e instanceof TaskNotFoundException) {
            return ControllerResponse.notFound(e.getMessage());
        }
        if (e instanceof JsonProcessingException json) {
            log.warn("Unreadable body on {} {}: {}", req.method(), path, json.getOriginalMessage());
            return ControllerResponse.json(HttpResponseStatus.BAD_REQUEST,
                    ErrorBody.of("malformed JSON: " + json.getOriginalMessage()));
        }
        // ValidationException and unparsable ids both land here
        if (e instanceof IllegalArgumentException) {
            log.warn("Rejected {} {}: {}", req.method(), path, e.getMessage());
            return ControllerResponse.json(HttpResponseStatus.BAD_REQUEST, ErrorBody.of(e.getMessage()));
        }
        log.error("Request {} {} failed", req.method(), path, e);
        return ControllerResponse.json(HttpResponseStatus.INTERNAL_SERVER_ERROR, ErrorBody.of(e.toString()));
    }

    private static void respond(ChannelHandlerContext ctx, ControllerResponse response) {
        byte[] bytes = response.body() != null ? response.body().getBytes(StandardCharsets.UTF_8) : new byte[0];
        FullHttpResponse http = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        http.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, response.contentType() + "; charset=utf-8")
                .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(http).addListener(future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to write response: {}", future.cause().getMessage());
                ctx.close();
            }
        });
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Closing channel after unhandled error: {}", cause.getMessage(), cause);
        ctx.close();
    }
}
