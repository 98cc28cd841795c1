package io.codeforesight.reasoning;

/**
 * Stands in when no API key is available. Every call fails with an authentication error,
 * which the stages record as indeterminate.
 */
public class UnconfiguredReasoningClient implements ReasoningClient {

    private final String apiKeyEnv;

    public UnconfiguredReasoningClient(String apiKeyEnv) {
        this.apiKeyEnv = apiKeyEnv;
    }

    @Override
    public String name() {
        return "unconfigured";
    }

    @Override
    public ReasoningResponse analyze(ReasoningRequest request) throws ReasoningServiceException {
        throw new ReasoningServiceException(ReasoningServiceException.Kind.AUTH,
                "Reasoning backend not configured: environment variable " + apiKeyEnv + " is not set");
    }
}
