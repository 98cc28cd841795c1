package io.codeforesight.reasoning;

/**
 * Abstraction over a semantic-reasoning backend.
 * <p>
 * Implementations must be safe to call from several threads.
 */
public interface ReasoningClient {

    /**
     * Short identifier for reports and warnings.
     */
    String name();

    /**
     * Analyzes one request.
     *
     * @throws ReasoningServiceException on timeout, authentication failure, rate limiting,
     *                                   an unavailable backend or an unparseable answer
     */
    ReasoningResponse analyze(ReasoningRequest request) throws ReasoningServiceException;
}
