package com.collectivestrategist.aigateway.error;

public enum ErrorKind {

    CREDENTIAL_DECRYPTION_FAILED(UserAction.CONTACT_SUPPORT),
    CONFIGURATION_INVALID(UserAction.CONTACT_SUPPORT),
    PROVIDER_UNHEALTHY(UserAction.RECONNECT_PROVIDER),
    CAPABILITY_UNSUPPORTED(UserAction.USE_ALTERNATIVE_PROVIDER),
    GENERATION_FAILED(UserAction.RETRY_LATER);

    private final UserAction userAction;

    ErrorKind(UserAction userAction) {
        this.userAction = userAction;
    }

    public UserAction userAction() {
        return userAction;
    }

    public enum UserAction {
        RECONNECT_PROVIDER,
        RETRY_LATER,
        USE_ALTERNATIVE_PROVIDER,
        CONTACT_SUPPORT
    }
}
