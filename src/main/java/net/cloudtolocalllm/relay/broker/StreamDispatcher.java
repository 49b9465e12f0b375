package net.cloudtolocalllm.relay.broker;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import net.cloudtolocalllm.relay.auth.AuthError;
import net.cloudtolocalllm.relay.auth.AuthException;
import net.cloudtolocalllm.relay.auth.BearerTokens;
import net.cloudtolocalllm.relay.auth.Claims;
import net.cloudtolocalllm.relay.health.ConnectionEndpoint;
import net.cloudtolocalllm.relay.http.HttpTarget;
import net.cloudtolocalllm.relay.http.StreamCall;
import net.cloudtolocalllm.relay.supervisor.ProvisionException;
import net.cloudtolocalllm.relay.supervisor.ProvisionFailure;
import net.cloudtolocalllm.relay.supervisor.ProxyInstance;
import net.cloudtolocalllm.relay.supervisor.ProxySupervisor;
import net.cloudtolocalllm.relay.supervisor.StreamLease;
import net.cloudtolocalllm.relay.util.Sleeper;
import net.cloudtolocalllm.relay.util.UserIdHash;

/**
 * Runs a chat stream end to end: route, proxy, upstream, sink.
 * <p>
 * Local requests go straight to the inference server without the user's token. Cloud and tunnel
 * requests require validated claims and run through the user's proxy instance, which is provisioned
 * on demand with bounded retries. {@link #dispatch} blocks while provisioning, so call it off the
 * event loop.
 */
public final class StreamDispatcher {
    private final ConnectionBroker broker;
    private final ProxySupervisor supervisor;
    private final InferenceClient inference;
    private final Sleeper sleeper;
    private final Clock clock;

    public StreamDispatcher(ConnectionBroker broker,
                            ProxySupervisor supervisor,
                            InferenceClient inference,
                            Sleeper sleeper,
                            Clock clock) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.inference = Objects.requireNonNull(inference, "inference");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws NoRouteException when no endpoint is reachable or the proxy cannot be provisioned
     * @throws AuthException    when the route needs a token the request does not carry
     */
    public StreamHandle dispatch(StreamRequest request, StreamSink sink) throws NoRouteException, AuthException {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(sink, "sink");
        ConnectionEndpoint endpoint = broker.resolveRoute(request.userId());
        if (!endpoint.kind().isRemote()) {
            StreamCall call = inference.chat(endpoint.target(), InferenceClient.LOCAL_CHAT_PATH, Map.of(),
                    request.model(), request.message(), sink::onChunk);
            StreamHandle handle = new StreamHandle(endpoint.kind(), call, null);
            call.completion().whenComplete((ignored, error) -> finish(sink, error));
            return handle;
        }
        requireClaims(request);
        StreamLease lease = acquireLease(request.userId(), request.claims());
        HttpTarget forward = lease.instance().resources() == null
                ? null : lease.instance().resources().forwardTarget();
        HttpTarget target = forward == null ? endpoint.target() : forward;
        StreamCall call;
        try {
            call = inference.chat(target, InferenceClient.RELAY_CHAT_PATH,
                    Map.of("Authorization", BearerTokens.header(request.token())),
                    request.model(), request.message(), chunk -> {
                        lease.recordActivity();
                        sink.onChunk(chunk);
                    });
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
        lease.onCancel(call::cancel);
        call.completion().whenComplete((ignored, error) -> {
            if (isCancellation(error)) {
                lease.cancel();
            } else {
                lease.close();
            }
            finish(sink, error);
        });
        return new StreamHandle(endpoint.kind(), call, lease);
    }

    private void requireClaims(StreamRequest request) throws AuthException {
        Claims claims = request.claims();
        if (claims == null || request.token() == null) {
            throw new AuthException(AuthError.MALFORMED, "a bearer token is required for remote routes");
        }
        if (claims.isExpiredAt(clock.instant())) {
            throw new AuthException(AuthError.EXPIRED, "token expired at " + claims.expiresAt());
        }
    }

    private StreamLease acquireLease(String userId, Claims claims) throws NoRouteException, AuthException {
        List<Duration> backoff = supervisor.settings().provisionBackoff();
        ProvisionException last = null;
        for (int attempt = 0; attempt <= backoff.size(); attempt++) {
            if (attempt > 0) {
                pause(backoff.get(attempt - 1));
            }
            try {
                ProxyInstance instance = supervisor.ensureInstance(userId, claims);
                return supervisor.openStream(instance.instanceId());
            } catch (ProvisionException e) {
                if (e.failure() == ProvisionFailure.UNAUTHORIZED) {
                    throw new AuthException(AuthError.MALFORMED, e.getMessage());
                }
                last = e;
                if (!e.failure().retryable()) {
                    break;
                }
                System.err.println("Proxy for user " + UserIdHash.shortHash(userId) + " not ready (attempt "
                        + (attempt + 1) + "): " + e.failure() + " " + e.getMessage());
            }
        }
        throw new NoRouteException("proxy unavailable: " + (last == null ? "unknown" : last.getMessage()), last);
    }

    private void pause(Duration delay) throws NoRouteException {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NoRouteException("interrupted while waiting for the proxy", e);
        }
    }

    private static void finish(StreamSink sink, Throwable error) {
        try {
            if (error == null) {
                sink.onComplete();
            } else {
                sink.onError(unwrap(error));
            }
        } catch (RuntimeException e) {
            System.err.println("Stream sink failed: " + e.getMessage());
        }
    }

    private static boolean isCancellation(Throwable error) {
        return unwrap(error) instanceof CancellationException;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
