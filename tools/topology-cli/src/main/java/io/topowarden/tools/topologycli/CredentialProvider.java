package io.topowarden.tools.topologycli;

import io.topowarden.management.BrokerCredentials;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves management API credentials.
 * Password priority: CLI option → environment variable → broker default ({@code guest}).
 */
public class CredentialProvider {

    public static final String DEFAULT_USERNAME = "guest";
    public static final String DEFAULT_PASSWORD = "guest";
    public static final String DEFAULT_PASSWORD_ENV = "TOPOLOGY_WARDEN_PASSWORD";

    private static final Logger log = LoggerFactory.getLogger(CredentialProvider.class);

    private final Function<String, String> environment;

    public CredentialProvider() {
        this(System::getenv);
    }

    CredentialProvider(Function<String, String> environment) {
        this.environment = environment;
    }

    public BrokerCredentials resolve(String cliUsername, String cliPassword, String passwordEnv) {
        String username = cliUsername == null || cliUsername.isBlank() ? DEFAULT_USERNAME : cliUsername;
        return new BrokerCredentials(username, resolvePassword(cliPassword, passwordEnv));
    }

    private String resolvePassword(String cliPassword, String passwordEnv) {
        if (cliPassword != null && !cliPassword.isEmpty()) {
            return cliPassword;
        }

        if (passwordEnv != null && !passwordEnv.isBlank()) {
            String envPassword = environment.apply(passwordEnv);
            if (envPassword != null && !envPassword.isEmpty()) {
                log.debug("using password from environment variable {}", passwordEnv);
                return envPassword;
            }
        }

        log.debug("no password supplied, falling back to the broker default");
        return DEFAULT_PASSWORD;
    }
}
