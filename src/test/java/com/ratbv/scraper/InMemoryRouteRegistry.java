package com.ratbv.scraper;

import java.util.ArrayList;
import java.util.List;

final class InMemoryRouteRegistry implements RouteRegistryInterface {
    private List<Route> routes = new ArrayList<>();
    int saves;

    InMemoryRouteRegistry(Route... initial) {
        routes.addAll(List.of(initial));
    }

    @Override
    public List<Route> loadRoutes() {
        return new ArrayList<>(routes);
    }

    @Override
    public void saveRoutes(List<Route> updated) {
        saves++;
        routes = new ArrayList<>(updated);
    }

    Route get(String id) {
        return routes.stream().filter(r -> r.id().equals(id)).findFirst().orElse(null);
    }

    List<Route> snapshot() {
        return List.copyOf(routes);
    }
}
