package io.switchboard.core.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves credential and endpoint references stored in the registry.
 * <ul>
 *   <li>{@code env:NAME} reads an environment variable</li>
 *   <li>{@code enc:BASE64} decrypts with the configured {@link SecretCipher}</li>
 *   <li>anything else is taken literally</li>
 * </ul>
 */
public final class SecretResolver {
    private static final String ENV_PREFIX = "env:";
    private static final String ENCRYPTED_PREFIX = "enc:";

    private final Map<String, String> environment;
    private final SecretCipher cipher;

    public SecretResolver(Map<String, String> environment, SecretCipher cipher) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
        this.cipher = cipher;
    }

    public static SecretResolver fromSystem(String masterKeyEnv) {
        Map<String, String> env = System.getenv();
        String masterKey = masterKeyEnv == null ? null : env.get(masterKeyEnv);
        SecretCipher cipher = masterKey == null || masterKey.isBlank() ? null : new SecretCipher(masterKey);
        return new SecretResolver(env, cipher);
    }

    /**
     * @return the resolved value, empty when the reference points at nothing
     * @throws IllegalStateException when an encrypted value cannot be decrypted
     */
    public Optional<String> resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String value = reference.trim();
        if (value.startsWith(ENV_PREFIX)) {
            String resolved = environment.get(value.substring(ENV_PREFIX.length()).trim());
            return resolved == null || resolved.isBlank() ? Optional.empty() : Optional.of(resolved);
        }
        if (value.startsWith(ENCRYPTED_PREFIX)) {
            if (cipher == null) {
                throw new IllegalStateException("Encrypted credential found but no master key is configured");
            }
            return Optional.of(cipher.decrypt(value.substring(ENCRYPTED_PREFIX.length())));
        }
        return Optional.of(value);
    }
}
