package io.codeforesight.support;

import io.codeforesight.reasoning.ReasoningClient;
import io.codeforesight.reasoning.ReasoningFinding;
import io.codeforesight.reasoning.ReasoningRequest;
import io.codeforesight.reasoning.ReasoningResponse;
import io.codeforesight.reasoning.ReasoningServiceException;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Deterministic reasoning backend. Scripted outcomes are consumed in order; once the
 * script is empty every call gets the default outcome.
 */
public class FakeReasoningClient implements ReasoningClient {

    @FunctionalInterface
    public interface Responder {
        ReasoningResponse respond(ReasoningRequest request) throws ReasoningServiceException;
    }

    private final String name;
    private final Deque<Responder> script = new ArrayDeque<>();
    private final List<ReasoningRequest> requests = new CopyOnWriteArrayList<>();
    private final Responder defaultResponder;

    public FakeReasoningClient(String name, Responder defaultResponder) {
        this.name = name;
        this.defaultResponder = defaultResponder;
    }

    public static FakeReasoningClient answering(ReasoningFinding... findings) {
        List<ReasoningFinding> list = List.of(findings);
        return new FakeReasoningClient("fake-model", r -> new ReasoningResponse(list, "fake-model"));
    }

    public static FakeReasoningClient silent() {
        return new FakeReasoningClient("fake-model", r -> ReasoningResponse.empty("fake-model"));
    }

    public static FakeReasoningClient failing(ReasoningServiceException.Kind kind) {
        return new FakeReasoningClient("fake-model", r -> {
            throw new ReasoningServiceException(kind, "scripted " + kind.id());
        });
    }

    public static FakeReasoningClient responding(Responder responder) {
        return new FakeReasoningClient("fake-model", responder);
    }

    public synchronized FakeReasoningClient thenFail(ReasoningServiceException.Kind kind) {
        script.add(r -> {
            throw new ReasoningServiceException(kind, "scripted " + kind.id());
        });
        return this;
    }

    public synchronized FakeReasoningClient thenRateLimit(Duration retryAfter) {
        script.add(r -> {
            throw new ReasoningServiceException(ReasoningServiceException.Kind.RATE_LIMIT,
                    "scripted rate limit", retryAfter, null);
        });
        return this;
    }

    public synchronized FakeReasoningClient thenAnswer(ReasoningFinding... findings) {
        List<ReasoningFinding> list = List.of(findings);
        script.add(r -> new ReasoningResponse(list, name));
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ReasoningResponse analyze(ReasoningRequest request) throws ReasoningServiceException {
        requests.add(request);
        Responder next;
        synchronized (this) {
            next = script.isEmpty() ? defaultResponder : script.poll();
        }
        return next.respond(request);
    }

    public int calls() {
        return requests.size();
    }

    public List<ReasoningRequest> requests() {
        return List.copyOf(requests);
    }

    public static ReasoningFinding finding(String issue, String severity, Integer line, String rationale, String fix) {
        return new ReasoningFinding(issue, severity, line, null, fix, rationale, null, null);
    }
}
