package com.questrail.htl.runtime;

import com.questrail.htl.observability.RecordingObservabilitySink;
import com.questrail.htl.observability.RequestServedEvent;
import com.questrail.htl.observability.ResourceErrorEvent;
import com.questrail.htl.resource.ResourceLoader;
import com.questrail.htl.resource.ResourceRoutes;
import com.questrail.htl.transport.StaticResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RouteDispatcherTest {

    @TempDir
    Path root;

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private RouteDispatcher dispatcher;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("index.htl"), "(h1 hello)", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("bad.htl"), "(h1", StandardCharsets.UTF_8);

        ResourceRoutes routes = ResourceRoutes
            .fromDirectories(List.of(root), true, ResourceLoader.withDefaults())
            .withAlias("/", "/index.htl");
        dispatcher = new RouteDispatcher(routes, sink);
    }

    @Test
    void knownRouteIsServed() {
        StaticResponse response = dispatcher.onRequest("GET", "/index.htl");

        assertEquals(200, response.status());
        assertEquals("text/html", response.contentType());
        assertEquals("<h1>hello</h1>", new String(response.body(), StandardCharsets.UTF_8));
    }

    @Test
    void rootServesIndex() {
        StaticResponse response = dispatcher.onRequest("HEAD", "/");

        assertEquals(200, response.status());
        assertEquals("<h1>hello</h1>", new String(response.body(), StandardCharsets.UTF_8));
    }

    @Test
    void unknownRouteIsNotFound() {
        assertEquals(404, dispatcher.onRequest("GET", "/missing").status());
    }

    @Test
    void unmatchedPathFallsBackToIndex() throws IOException {
        ResourceRoutes routes = ResourceRoutes
            .fromDirectories(List.of(root), true, ResourceLoader.withDefaults())
            .withIndex("/index.htl");
        RouteDispatcher withIndex = new RouteDispatcher(routes, sink);

        StaticResponse response = withIndex.onRequest("GET", "/some/missing");

        assertEquals(200, response.status());
        assertEquals("<h1>hello</h1>", new String(response.body(), StandardCharsets.UTF_8));
        assertEquals(405, withIndex.onRequest("PUT", "/some/missing").status());
    }

    @Test
    void unmatchedPathIsNotFoundWithoutIndex() throws IOException {
        ResourceRoutes routes = ResourceRoutes
            .fromDirectories(List.of(root), true, ResourceLoader.withDefaults())
            .withIndex("/home.htl");
        RouteDispatcher withoutIndex = new RouteDispatcher(routes, sink);

        assertEquals(404, withoutIndex.onRequest("GET", "/some/missing").status());
        assertEquals(404, withoutIndex.onRequest("GET", "/").status());
    }

    @Test
    void otherMethodsAreNotAllowed() {
        assertEquals(405, dispatcher.onRequest("POST", "/index.htl").status());
        assertEquals(405, dispatcher.onRequest("DELETE", "/index.htl").status());
    }

    @Test
    void brokenResourceIsReportedAndServesNothing() {
        StaticResponse response = dispatcher.onRequest("GET", "/bad.htl");

        assertEquals(500, response.status());
        assertEquals(0, response.body().length);

        List<ResourceErrorEvent> errors = sink.getEventsOfType(ResourceErrorEvent.class);
        assertEquals(1, errors.size());
        assertEquals("/bad.htl", errors.get(0).path());
        assertNotNull(errors.get(0).cause());
    }

    @Test
    void everyRequestIsRecorded() {
        dispatcher.onRequest("GET", "/index.htl");
        dispatcher.onRequest("GET", "/missing");

        List<RequestServedEvent> requests = sink.getEventsOfType(RequestServedEvent.class);
        assertEquals(2, requests.size());
        assertEquals(200, requests.get(0).status());
        assertEquals(14, requests.get(0).contentLength());
        assertEquals(404, requests.get(1).status());
    }
}
