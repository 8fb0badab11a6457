package com.syncnest.accountservice.utils;

import com.syncnest.accountservice.model.ApiResponse;
import com.syncnest.accountservice.model.FailureKind;
import com.syncnest.accountservice.model.ServiceResult;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.function.Function;

/**
 * Maps service results to HTTP: success into the {@link ApiResponse} envelope, failure into
 * an RFC 7807 problem with the status of its {@link FailureKind}.
 */
@Component
@RequiredArgsConstructor
public class ResultResponses {

    private final ErrorResponseWriter errorWriter;

    public <T> ResponseEntity<Object> toResponse(ServiceResult<T> result,
                                                 HttpStatus successStatus,
                                                 HttpServletRequest request) {
        return toResponse(result, successStatus, request, Function.identity());
    }

    public <T, R> ResponseEntity<Object> toResponse(ServiceResult<T> result,
                                                    HttpStatus successStatus,
                                                    HttpServletRequest request,
                                                    Function<T, R> body) {
        String requestId = errorWriter.resolveRequestId(request, null);
        return result.fold(
                success -> ResponseEntity.status(successStatus)
                        .body(ApiResponse.of(requestId, success.message(), body.apply(success.data()))),
                failure -> ResponseEntity.status(failure.kind().getStatus())
                        .header(HttpHeaders.CACHE_CONTROL, "no-store")
                        .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                        .body(errorWriter.problem(request, failure.kind().getStatus(),
                                failure.kind().type(), failure.kind().getTitle(), failure.message()))
        );
    }
}
