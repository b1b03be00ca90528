package stitcher.taskcenter.api;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * One group of task center endpoints. The router asks every registered
 * controller in turn and hands the request to the first that claims it.
 */
public interface Controller {

    /**
     * @param path request path, query string stripped
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Serve a request this controller matched. {@code ValidationException},
     * {@code TaskNotFoundException} and malformed JSON may be thrown as is;
     * the router turns them into 400 and 404 answers.
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception;

    record ControllerResponse(HttpResponseStatus status, String contentType, String body) {

        private static final String JSON = "application/json";

        public static ControllerResponse json(String body) {
            return json(HttpResponseStatus.OK, body);
        }

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, JSON, body);
        }

        public static ControllerResponse notFound(String message) {
            return json(HttpResponseStatus.NOT_FOUND, ErrorBody.of(message));
        }
    }
}
