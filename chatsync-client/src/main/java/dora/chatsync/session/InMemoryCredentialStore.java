package dora.chatsync.session;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Consumer;

/**
 * Keeps the token in memory only. A rejected token is cleared before the callback runs.
 */
@Slf4j
public class InMemoryCredentialStore implements CredentialStore {

    private volatile String token;
    private volatile Consumer<String> onTokenInvalid;

    public InMemoryCredentialStore() {
    }

    public InMemoryCredentialStore(String token) {
        this.token = token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public void clearToken() {
        this.token = null;
    }

    /**
     * Sets the callback invoked with the server's reason when the token is rejected.
     */
    public void setOnTokenInvalid(Consumer<String> callback) {
        this.onTokenInvalid = callback;
    }

    @Override
    public String currentCredential() {
        return token;
    }

    @Override
    public void onAuthenticationFailed(String reason) {
        log.warn("Credential rejected: {}", reason);
        clearToken();
        Consumer<String> callback = onTokenInvalid;
        if (callback != null) {
            callback.accept(reason);
        }
    }
}
