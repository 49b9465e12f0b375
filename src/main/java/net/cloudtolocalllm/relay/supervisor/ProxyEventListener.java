package net.cloudtolocalllm.relay.supervisor;

@FunctionalInterface
public interface ProxyEventListener {
    ProxyEventListener NOOP = event -> {
    };

    void onEvent(ProxyEvent event);

    default ProxyEventListener andThen(ProxyEventListener next) {
        return event -> {
            onEvent(event);
            next.onEvent(event);
        };
    }
}
