// file: client/src/main/java/io/scorelite/client/ScoreApiClient.java
package io.scorelite.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed HTTP client for a ScoreLite server.
 *
 * Responsibilities:
 *  - Build requests for each endpoint and decode JSON answers.
 *  - Turn non-2xx answers into {@link ApiException} with the server's error code.
 *  - Follow the optimistic protocol for edits: read the current head first,
 *    then submit the edit against it. A conflict is reported, never retried.
 *  - Resolve pages and annotations through an {@link ObjectCache}, so objects
 *    seen once are never downloaded again.
 */
public class ScoreApiClient {

    static final int DEFAULT_CACHE_SIZE = 4096;

    private final HttpClient http;
    private final String baseUrl;
    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ObjectCache objects;

    public ScoreApiClient(String baseUrl) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), baseUrl);
    }

    public ScoreApiClient(HttpClient http, String baseUrl) {
        this(http, baseUrl, DEFAULT_CACHE_SIZE);
    }

    public ScoreApiClient(HttpClient http, String baseUrl, int cacheSize) {
        this.http = Objects.requireNonNull(http, "http");
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.objects = new ObjectCache(cacheSize, this::fetchObjects);
    }

    // ---------- scores ----------

    public List<ScoreSummaryInfo> listScores(String owner) {
        return read(get("/scores/" + seg(owner)), new TypeReference<List<ScoreSummaryInfo>>() {});
    }

    public ScoreInfo getScore(String owner, String scoreName) {
        return read(get(scorePath(owner, scoreName)), new TypeReference<ScoreInfo>() {});
    }

    public ScoreInfo createScore(String owner, String scoreName, String title, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("title", title);
        property.put("description", description);
        return read(send("POST", scorePath(owner, scoreName), Map.of("property", property)),
                new TypeReference<ScoreInfo>() {});
    }

    /** Removes the score; its objects stay addressable. */
    public void deleteScore(String owner, String scoreName) {
        HttpRequest req = HttpRequest.newBuilder().uri(URI.create(baseUrl + scorePath(owner, scoreName))).DELETE().build();
        HttpResponse<String> resp = exchange(req);
        if (resp.statusCode() / 100 != 2) {
            throw error(resp.statusCode(), resp.body());
        }
    }

    public List<VersionInfo> listVersions(String owner, String scoreName) {
        return read(get(scorePath(owner, scoreName) + "/versions"), new TypeReference<List<VersionInfo>>() {});
    }

    /** Pages of the current head. */
    public List<PageInfo> getPages(String owner, String scoreName) {
        return pages(getScore(owner, scoreName).pages);
    }

    /** Pages as of a recorded version. */
    public List<PageInfo> getPages(String owner, String scoreName, String version) {
        return pages(hashes(objects.get(snapshotAt(owner, scoreName, version)), "pages"));
    }

    /** Annotations of the current head. */
    public List<AnnotationInfo> getAnnotations(String owner, String scoreName) {
        return annotations(getScore(owner, scoreName).annotations);
    }

    /** Annotations as of a recorded version. */
    public List<AnnotationInfo> getAnnotations(String owner, String scoreName, String version) {
        return annotations(hashes(objects.get(snapshotAt(owner, scoreName, version)), "annotations"));
    }

    /**
     * Apply page edits against the head as it is right now.
     *
     * @throws ApiException with {@link ApiException#isConflict()} when another
     *                      writer got in between the read and the commit
     */
    public CommitInfo updatePages(String owner, String scoreName, List<PageOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("no page operations");
        }
        List<Map<String, Object>> commits = new ArrayList<>(operations.size());
        for (PageOperation op : operations) commits.add(op.toCommit());
        return commit(owner, scoreName, commits);
    }

    /** Apply annotation edits against the head as it is right now. */
    public CommitInfo updateAnnotations(String owner, String scoreName, List<AnnotationOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("no annotation operations");
        }
        List<Map<String, Object>> commits = new ArrayList<>(operations.size());
        for (AnnotationOperation op : operations) commits.add(op.toCommit());
        return commit(owner, scoreName, commits);
    }

    private CommitInfo commit(String owner, String scoreName, List<Map<String, Object>> commits) {
        ScoreInfo current = getScore(owner, scoreName);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("parent", current.headHash);
        body.put("commits", commits);

        return read(send("POST", scorePath(owner, scoreName) + "/commits", body),
                new TypeReference<CommitInfo>() {});
    }

    /**
     * Change title and/or description. Only fields that differ from the current
     * property are sent; a null argument leaves that field alone.
     *
     * @return the new property hash
     */
    public String updateProperty(String owner, String scoreName, String title, String description) {
        ScoreInfo current = getScore(owner, scoreName);
        ScoreInfo.Property old = current.property != null ? current.property : new ScoreInfo.Property();

        Map<String, Object> property = new LinkedHashMap<>();
        if (title != null && !title.equals(old.title)) property.put("title", title);
        if (description != null && !description.equals(old.description)) property.put("description", description);
        if (property.isEmpty()) {
            throw new IllegalArgumentException("property is unchanged");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("parent", current.propertyHash);
        body.put("property", property);
        JsonNode resp = read(send("PATCH", scorePath(owner, scoreName) + "/property", body),
                new TypeReference<JsonNode>() {});
        return resp.get("property_hash").asText();
    }

    // ---------- objects ----------

    /** Objects by hash, as the server renders them; served from the cache where possible. */
    public Map<String, JsonNode> getObjects(Collection<String> hashes) {
        return objects.getAll(hashes);
    }

    int cachedObjects() {
        return objects.size();
    }

    private Map<String, JsonNode> fetchObjects(Set<String> hashes) {
        return read(send("POST", "/objects", Map.of("hashes", hashes)), new TypeReference<Map<String, JsonNode>>() {});
    }

    private String snapshotAt(String owner, String scoreName, String version) {
        for (VersionInfo v : listVersions(owner, scoreName)) {
            if (String.valueOf(v.version).equals(version)) return v.hash;
        }
        throw new ApiException(404, "VERSION_NOT_FOUND", "version " + version + " not found for " + owner + "/" + scoreName);
    }

    private static List<String> hashes(JsonNode snapshot, String field) {
        List<String> out = new ArrayList<>();
        JsonNode list = snapshot.get(field);
        if (list != null) list.forEach(h -> out.add(h.asText()));
        return out;
    }

    private List<PageInfo> pages(List<String> hashes) {
        if (hashes == null || hashes.isEmpty()) return List.of();
        Map<String, JsonNode> found = objects.getAll(hashes);
        List<PageInfo> out = new ArrayList<>(hashes.size());
        for (String h : hashes) {
            JsonNode obj = found.get(h);
            var p = new PageInfo();
            p.hash = h;
            p.image = text(obj, "image");
            p.thumbnail = text(obj, "thumbnail");
            p.number = text(obj, "number");
            out.add(p);
        }
        return out;
    }

    private List<AnnotationInfo> annotations(List<String> hashes) {
        if (hashes == null || hashes.isEmpty()) return List.of();
        Map<String, JsonNode> found = objects.getAll(hashes);
        List<AnnotationInfo> out = new ArrayList<>(hashes.size());
        for (int i = 0; i < hashes.size(); i++) {
            var a = new AnnotationInfo();
            a.index = i;
            a.hash = hashes.get(i);
            a.content = text(found.get(a.hash), "content");
            out.add(a);
        }
        return out;
    }

    private static String text(JsonNode obj, String field) {
        return obj.hasNonNull(field) ? obj.get(field).asText() : null;
    }

    // ---------- blobs ----------

    public String putBlob(byte[] content) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/blobs"))
                .header("Content-Type", "application/octet-stream")
                .POST(HttpRequest.BodyPublishers.ofByteArray(content))
                .build();
        JsonNode resp = read(exchange(req), new TypeReference<JsonNode>() {});
        return resp.get("ref").asText();
    }

    public byte[] getBlob(String ref) {
        HttpRequest req = HttpRequest.newBuilder().uri(URI.create(baseUrl + "/blobs/" + seg(ref))).GET().build();
        try {
            HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            if (resp.statusCode() != 200) {
                throw error(resp.statusCode(), new String(resp.body(), StandardCharsets.UTF_8));
            }
            return resp.body();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    // ---------- plumbing ----------

    private static String scorePath(String owner, String scoreName) {
        return "/scores/" + seg(owner) + "/" + seg(scoreName);
    }

    private static String seg(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private HttpResponse<String> get(String path) {
        return exchange(HttpRequest.newBuilder().uri(URI.create(baseUrl + path)).GET().build());
    }

    private HttpResponse<String> send(String method, String path, Object body) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(body)))
                    .build();
            return exchange(req);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private HttpResponse<String> exchange(HttpRequest req) {
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }

    private <T> T read(HttpResponse<String> resp, TypeReference<T> type) {
        if (resp.statusCode() / 100 != 2) {
            throw error(resp.statusCode(), resp.body());
        }
        try {
            return json.readValue(resp.body(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("unexpected response body", e);
        }
    }

    private ApiException error(int status, String body) {
        try {
            JsonNode node = json.readTree(body);
            String code = node.hasNonNull("error") ? node.get("error").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : body;
            return new ApiException(status, code, message);
        } catch (IOException notJson) {
            return new ApiException(status, null, body);
        }
    }
}
