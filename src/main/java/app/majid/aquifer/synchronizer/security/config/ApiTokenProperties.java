package app.majid.aquifer.synchronizer.security.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Tokens accepted in the {@code Authorization} header and the scopes each one grants.
 */
@Validated
@ConfigurationProperties(prefix = "aquifer.security")
public record ApiTokenProperties(
        @NotNull
        @Valid
        List<ApiToken> tokens
) {
    public ApiTokenProperties {
        if (tokens == null) {
            tokens = List.of();
        }
    }

    /**
     * Finds the token with the given value. Every configured token is compared in constant time.
     */
    public Optional<ApiToken> find(String presented) {
        byte[] candidate = presented.getBytes(StandardCharsets.UTF_8);
        ApiToken match = null;
        for (ApiToken token : tokens) {
            if (MessageDigest.isEqual(token.value().getBytes(StandardCharsets.UTF_8), candidate)) {
                match = token;
            }
        }
        return Optional.ofNullable(match);
    }

    /**
     * @param name shown as the principal in logs, never the secret itself
     */
    public record ApiToken(
            @NotBlank
            String name,

            @NotBlank
            String value,

            @NotEmpty
            Set<ApiScope> scopes
    ) {
        @Override
        public String toString() {
            return "ApiToken[name=" + name + ", scopes=" + scopes + "]";
        }
    }
}
