package com.syncnest.accountservice.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Component
public class ErrorResponseWriter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String REQUEST_ID_ATTR = "SYNCNEST_REQUEST_ID";

    private final ObjectMapper objectMapper;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Builds an RFC 7807 body with the common context properties. */
    public ProblemDetail problem(@NonNull HttpServletRequest req,
                                 @NonNull HttpStatus status,
                                 String type,
                                 @NonNull String title,
                                 @NonNull String detail) {
        ProblemDetail pd = ProblemDetail.forStatus(status);
        if (type != null && !type.isBlank()) {
            pd.setType(URI.create(type));
        }
        pd.setTitle(title);
        pd.setDetail(detail);
        pd.setInstance(URI.create(req.getRequestURI()));

        pd.setProperty("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        pd.setProperty("path", req.getRequestURI());
        String requestId = resolveRequestId(req, null);
        if (requestId != null) {
            pd.setProperty("requestId", requestId);
        }
        return pd;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,
                      @NonNull String title,
                      @NonNull String detail) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = problem(req, status, type, title, detail);
        if (!pd.getProperties().containsKey("requestId")) {
            String id = resolveRequestId(req, resp);
            if (id != null) {
                pd.setProperty("requestId", id);
            }
        }

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }

    public String resolveRequestId(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp != null ? resp.getHeader(REQUEST_ID_HEADER) : null;
        if (id == null || id.isBlank()) {
            id = req.getHeader(REQUEST_ID_HEADER);
        }
        if (id == null || id.isBlank()) {
            Object attr = req.getAttribute(REQUEST_ID_ATTR);
            if (attr instanceof String s && !s.isBlank()) {
                id = s;
            }
        }
        return (id == null || id.isBlank()) ? null : id;
    }
}
