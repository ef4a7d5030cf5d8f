// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.http.MimeTypes;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.eclipse.jetty.http.HttpStatus.OK_200;

/// Static utility methods for working with Jetty handlers and the JSON they send.
public abstract class JettyUtil {

    /// Shared by the HTTP handlers and the event stream. Instants are written as ISO-8601 strings,
    /// which browsers parse directly with new Date().
    public static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static boolean respondServerError (String message, Response response, Callback callback) {
        return respond(HttpStatus.INTERNAL_SERVER_ERROR_500, message, response, callback);
    }

    public static boolean respond (int code, String message, Response response, Callback callback) {
        response.setStatus(code);
        response.getHeaders().add(HttpHeader.CONTENT_TYPE, MimeTypes.Type.TEXT_PLAIN_UTF_8.asString());
        response.write(true, wrapString(message), callback);
        return true;
    }

    /// Respond with an object serialized as JSON, with the proper content type header and a 200 OK
    /// response code.
    public static boolean respondJson (Object object, Response response, Callback callback) {
        try {
            response.setStatus(OK_200);
            response.getHeaders().add(HttpHeader.CONTENT_TYPE, MimeTypes.Type.APPLICATION_JSON_UTF_8.asString());
            byte[] jsonBytes = objectMapper.writeValueAsBytes(object);
            response.write(true, ByteBuffer.wrap(jsonBytes, 0, jsonBytes.length), callback);
            return true;
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    public static String toJson (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Could not convert object to JSON.", e);
        }
    }

    /// Convert a String to a UTF-8 ByteBuffer, typically for writing to an HTTP response body.
    public static ByteBuffer wrapString (String string) {
        return ByteBuffer.wrap(string.getBytes(StandardCharsets.UTF_8));
    }

    static final int KILO = 1024;
    static final int MEGA = KILO * KILO;
    static final int GIGA = MEGA * KILO;

    public static String memString (double bytes) {
        if (bytes >= GIGA) return String.format("%.1f GiB", bytes / GIGA);
        if (bytes >= MEGA) return String.format("%.1f MiB", bytes / MEGA);
        if (bytes >= KILO) return String.format("%.1f kiB", bytes / KILO);
        return (long) bytes + " bytes";
    }

}
