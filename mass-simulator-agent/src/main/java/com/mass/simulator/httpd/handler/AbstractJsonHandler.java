package com.mass.simulator.httpd.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Splitter;
import com.mass.simulator.agent.TransportException;
import com.mass.simulator.device.DuplicateKeyException;
import com.mass.simulator.protocol.FailCode;
import com.mass.simulator.protocol.ValidationException;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static com.google.common.collect.Maps.newHashMap;

/**
 * JSON in, JSON out. Maps failures to status codes: validation 400, duplicate 409, transport
 * down 503, wrong method 405.
 */
public abstract class AbstractJsonHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(AbstractJsonHandler.class);

    protected final ObjectMapper mapper;
    private final String method;

    protected AbstractJsonHandler(ObjectMapper mapper, String method) {
        this.mapper = mapper;
        this.method = method;
    }

    /**
     * @param httpExchange
     * @return the response body
     */
    protected abstract Object process(HttpExchange httpExchange) throws IOException, ValidationException, TransportException;

    @Override
    public void handle(final HttpExchange httpExchange) throws IOException {
        final String requestMethod = httpExchange.getRequestMethod();
        log.debug("{} {}", requestMethod, httpExchange.getRequestURI());
        try {
            if (!method.equalsIgnoreCase(requestMethod)) {
                log.error("Bad request, not supported request method: {}", requestMethod);
                sendError(httpExchange, 405, null, "method " + requestMethod + " not allowed");
                return;
            }
            Object body;
            try {
                body = process(httpExchange);
            } catch (DuplicateKeyException e) {
                sendError(httpExchange, 409, e.getFailCode(), e.getMessage());
                return;
            } catch (ValidationException e) {
                sendError(httpExchange, 400, e.getFailCode(), e.getMessage());
                return;
            } catch (JsonProcessingException e) {
                sendError(httpExchange, 400, FailCode.INVALID_REQUEST, "request body is not valid: " + e.getOriginalMessage());
                return;
            } catch (TransportException e) {
                sendError(httpExchange, 503, null, e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("unable to handle {} {}", requestMethod, httpExchange.getRequestURI(), e);
                sendError(httpExchange, 500, FailCode.INTERNAL_ERROR, "internal error");
                return;
            }
            send(httpExchange, 200, body);
        } finally {
            httpExchange.close();
        }
    }

    protected <T> T readBody(HttpExchange httpExchange, Class<T> type) throws IOException, ValidationException {
        byte[] body;
        try (final InputStream in = httpExchange.getRequestBody()) {
            body = IOUtils.toByteArray(in);
        }
        if (body.length == 0) {
            throw new ValidationException(FailCode.INVALID_REQUEST, "request body is required");
        }
        T value = mapper.readValue(body, type);
        if (value == null) {
            throw new ValidationException(FailCode.INVALID_REQUEST, "request body is required");
        }
        return value;
    }

    protected static Map<String, String> queryParameters(HttpExchange httpExchange) {
        Map<String, String> params = newHashMap();
        String query = httpExchange.getRequestURI().getRawQuery();
        if (query == null) {
            return params;
        }
        for (String pair : Splitter.on('&').omitEmptyStrings().split(query)) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(name, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    protected ObjectNode status(String status) {
        ObjectNode node = mapper.createObjectNode();
        node.put("status", status);
        return node;
    }

    private void sendError(HttpExchange httpExchange, int code, FailCode failCode, String message) throws IOException {
        ObjectNode error = status("error");
        if (failCode != null) {
            error.put("failCode", failCode.getCode());
        }
        error.put("message", message);
        send(httpExchange, code, error);
    }

    private void send(HttpExchange httpExchange, int code, Object body) throws IOException {
        final Headers responseHeaders = httpExchange.getResponseHeaders();
        responseHeaders.set("Content-Type", "application/json");
        byte[] json = mapper.writeValueAsBytes(body);
        httpExchange.sendResponseHeaders(code, json.length);
        try (final OutputStream os = httpExchange.getResponseBody()) {
            os.write(json);
        }
    }
}
