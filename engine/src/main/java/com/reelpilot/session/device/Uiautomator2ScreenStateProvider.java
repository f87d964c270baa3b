package com.reelpilot.session.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reelpilot.session.screen.LocatorSet;
import com.reelpilot.session.screen.ScreenElement;
import com.reelpilot.session.screen.ScreenSize;
import com.reelpilot.session.screen.ScreenStateProvider;
import com.reelpilot.session.util.ErrorKind;
import com.reelpilot.session.util.Result;
import com.reelpilot.session.util.Sleeper;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Talks to the uiautomator2 agent on the device over its JSON-RPC endpoint. Element lookups dump
 * the window hierarchy and evaluate XPath locally; text entry and app restarts go through adb.
 */
public class Uiautomator2ScreenStateProvider implements ScreenStateProvider {
    private static final Logger log = LoggerFactory.getLogger(Uiautomator2ScreenStateProvider.class);
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(250);
    private static final int DUMP_MAX_DEPTH = 50;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final AdbShell adb;
    private final String appPackage;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final AtomicLong requestIds = new AtomicLong();

    public Uiautomator2ScreenStateProvider(
        HttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        Duration requestTimeout,
        AdbShell adb,
        String appPackage
    ) {
        this(httpClient, objectMapper, baseUrl, requestTimeout, adb, appPackage, Sleeper.threadSleeper(), DEFAULT_POLL_INTERVAL);
    }

    public Uiautomator2ScreenStateProvider(
        HttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        Duration requestTimeout,
        AdbShell adb,
        String appPackage,
        Sleeper sleeper,
        Duration pollInterval
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.endpoint = URI.create(stripTrailingSlash(baseUrl) + "/jsonrpc/0");
        this.requestTimeout = requestTimeout;
        this.adb = adb;
        this.appPackage = appPackage;
        this.sleeper = sleeper;
        this.pollInterval = pollInterval;
    }

    @Override
    public Result<Boolean> exists(LocatorSet locators, Duration timeout) {
        return find(locators, timeout).map(elements -> !elements.isEmpty());
    }

    @Override
    public Result<Void> click(LocatorSet locators, Duration timeout) {
        Result<List<ScreenElement>> found = find(locators, timeout);
        if (found.isErr()) {
            return found.map(elements -> null);
        }
        for (ScreenElement element : found.value()) {
            if (element.bounds() != null) {
                return tap(element.bounds().centerX(), element.bounds().centerY());
            }
        }
        return Result.notFound(locators.name() + " not on screen");
    }

    @Override
    public Result<String> getText(LocatorSet locators, Duration timeout) {
        Result<List<ScreenElement>> found = find(locators, timeout);
        if (found.isErr()) {
            return found.map(elements -> null);
        }
        if (found.value().isEmpty()) {
            return Result.notFound(locators.name() + " not on screen");
        }
        return Result.ok(found.value().get(0).textOrDescription());
    }

    @Override
    public Result<List<ScreenElement>> findAll(LocatorSet locators) {
        return find(locators, Duration.ZERO);
    }

    @Override
    public Result<Void> tap(int x, int y) {
        return call("click", x, y).map(result -> null);
    }

    @Override
    public Result<Void> swipe(int x1, int y1, int x2, int y2, Duration duration) {
        // one step is roughly 5ms on the device
        long steps = Math.max(2, duration.toMillis() / 5);
        return call("swipe", x1, y1, x2, y2, steps).map(result -> null);
    }

    @Override
    public Result<Void> typeText(String text) {
        if (text == null || text.isEmpty()) {
            return Result.done();
        }
        return adb.shell("input", "text", AdbShell.escapeInputText(text)).map(output -> null);
    }

    @Override
    public Result<Void> pressEnter() {
        return call("pressKey", "enter").map(result -> null);
    }

    @Override
    public Result<Void> pressBack() {
        return call("pressKey", "back").map(result -> null);
    }

    @Override
    public Result<Void> restartApp() {
        Result<String> stopped = adb.shell("am", "force-stop", appPackage);
        if (stopped.isErr()) {
            return stopped.map(output -> null);
        }
        return adb.shell("monkey", "-p", appPackage, "-c", "android.intent.category.LAUNCHER", "1")
            .map(output -> null);
    }

    @Override
    public Result<ScreenSize> screenSize() {
        Result<JsonNode> info = call("deviceInfo");
        if (info.isErr()) {
            return info.map(node -> null);
        }
        int width = info.value().path("displayWidth").asInt(0);
        int height = info.value().path("displayHeight").asInt(0);
        if (width <= 0 || height <= 0) {
            return Result.transientFailure("deviceInfo without display size");
        }
        return Result.ok(new ScreenSize(width, height));
    }

    /**
     * Polls the hierarchy until one of the locator's expressions matches or {@code timeout}
     * passes. A miss is an empty list, not an error.
     */
    Result<List<ScreenElement>> find(LocatorSet locators, Duration timeout) {
        if (locators == null || locators.isEmpty()) {
            return Result.notFound("no locators configured" + (locators == null ? "" : " for " + locators.name()));
        }
        Instant deadline = Instant.now().plus(timeout == null ? Duration.ZERO : timeout);
        while (true) {
            Result<UiHierarchy> dump = dump();
            if (dump.isErr()) {
                return dump.map(hierarchy -> null);
            }
            for (String xpath : locators.xpaths()) {
                try {
                    List<ScreenElement> matches = dump.value().select(xpath);
                    if (!matches.isEmpty()) {
                        return Result.ok(matches);
                    }
                } catch (Selector.SelectorParseException e) {
                    log.warn("Invalid locator for {}: {}", locators.name(), xpath);
                    return Result.err(ErrorKind.FATAL, "invalid xpath for " + locators.name() + ": " + xpath);
                }
            }
            if (!Instant.now().isBefore(deadline)) {
                return Result.ok(List.of());
            }
            if (!sleeper.sleep(pollInterval)) {
                return Result.transientFailure("interrupted while waiting for " + locators.name());
            }
        }
    }

    private Result<UiHierarchy> dump() {
        Result<JsonNode> result = call("dumpWindowHierarchy", false, DUMP_MAX_DEPTH);
        if (result.isErr()) {
            return result.map(node -> null);
        }
        return Result.ok(UiHierarchy.parse(result.value().asText("")));
    }

    Result<JsonNode> call(String method, Object... params) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.set("params", objectMapper.valueToTree(params));

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
                .build();
        } catch (IOException e) {
            return Result.err(ErrorKind.FATAL, "unable to encode " + method + ": " + e.getMessage());
        }

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                return Result.transientFailure(method + " returned HTTP " + response.statusCode());
            }
            JsonNode root = objectMapper.readTree(response.body());
            JsonNode error = root.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                return Result.transientFailure(method + " failed: " + error.path("message").asText(error.toString()));
            }
            return Result.ok(root.path("result"));
        } catch (HttpTimeoutException e) {
            return Result.transientFailure(method + " timed out");
        } catch (IOException e) {
            return Result.transientFailure(method + " io_error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.transientFailure(method + " interrupted");
        }
    }

    private static String stripTrailingSlash(String url) {
        String value = url == null ? "" : url.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
