package com.taskboard.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for requests without a usable bearer token. A token that was sent but failed verification
 * is reported as INVALID_ACCESS_TOKEN, a missing token as UNAUTHORIZED.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String MISSING_TOKEN_CODE = "UNAUTHORIZED";
    static final String INVALID_TOKEN_CODE = "INVALID_ACCESS_TOKEN";

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        if (authException instanceof BadCredentialsException) {
            problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, INVALID_TOKEN_CODE,
                    "Access token is invalid or expired");
            return;
        }
        problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, MISSING_TOKEN_CODE,
                "A bearer access token is required");
    }
}
