package dora.chatsync.session;

/**
 * Source of the session credential. Token acquisition and storage live outside the sync layer.
 */
public interface CredentialStore {

    /**
     * @return the current session token, or null when signed out
     */
    String currentCredential();

    /**
     * Called when the server rejects a credential. The application is expected to force a new sign-in.
     */
    void onAuthenticationFailed(String reason);
}
