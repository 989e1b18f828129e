package com.codeops.notebook.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for JWT token validation, bound to the
 * {@code codeops.jwt} prefix in application properties.
 *
 * <p>The Notebook service only validates tokens issued by the account provider.</p>
 *
 * @see com.codeops.notebook.security.JwtTokenValidator
 */
@ConfigurationProperties(prefix = "codeops.jwt")
@Getter
@Setter
public class JwtProperties {
    private String secret;
}
