package com.codeops.notebook.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Logs each API request on arrival and its status and duration on completion.
 */
@Component
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    public static final String START_TIME_ATTR = "notebook.startTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_TIME_ATTR, System.currentTimeMillis());
        log.debug("-> {} {}", request.getMethod(), request.getRequestURI());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_TIME_ATTR);
        long duration = start instanceof Long startMillis ? System.currentTimeMillis() - startMillis : -1;
        log.info("<- {} {} {} ({} ms)", request.getMethod(), request.getRequestURI(), response.getStatus(), duration);
    }
}
