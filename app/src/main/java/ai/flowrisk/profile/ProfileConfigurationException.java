package ai.flowrisk.profile;

/** A language profile table is incomplete or ambiguous. Raised while the profiles are initialized. */
public class ProfileConfigurationException extends RuntimeException {
    public ProfileConfigurationException(String message) {
        super(message);
    }
}
