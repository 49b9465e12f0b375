package net.cloudtolocalllm.relay.broker;

@FunctionalInterface
public interface RouteEventListener {
    RouteEventListener NOOP = event -> {
    };

    void onRouteChange(RouteEvent event);

    default RouteEventListener andThen(RouteEventListener next) {
        return event -> {
            onRouteChange(event);
            next.onRouteChange(event);
        };
    }
}
