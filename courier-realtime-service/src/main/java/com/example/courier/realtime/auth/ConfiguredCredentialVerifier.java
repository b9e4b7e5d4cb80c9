package com.example.courier.realtime.auth;

import com.example.courier.shared.config.AppProperties;
import com.example.courier.shared.model.UserIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks tokens up in the {@code courier.auth.tokens} table. Stands in for the
 * platform's token service in standalone deployments and tests.
 */
@Component
@Slf4j
public class ConfiguredCredentialVerifier implements CredentialVerifier {

    private final Map<String, AppProperties.Auth.TokenGrant> grantsByToken;

    public ConfiguredCredentialVerifier(AppProperties appProperties) {
        this.grantsByToken = appProperties.getAuth().getTokens().stream()
                .collect(Collectors.toUnmodifiableMap(AppProperties.Auth.TokenGrant::getToken, Function.identity(),
                        (first, second) -> first));
        log.info("Loaded {} configured connection tokens", grantsByToken.size());
    }

    @Override
    public Optional<UserIdentity> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        AppProperties.Auth.TokenGrant grant = grantsByToken.get(token);
        if (grant == null) {
            return Optional.empty();
        }
        return Optional.of(new UserIdentity(grant.getUserId(), grant.getRole(), grant.isActive()));
    }
}
