package io.scorelite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scorelite.storage.InMemoryBlobStore;
import io.scorelite.storage.InMemoryObjectStore;
import io.scorelite.storage.InMemoryRefStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP surface over in-memory stores.
 *
 * Focus:
 *  - Score lifecycle through JSON: create, commit, read pages and versions.
 *  - Engine failures map to stable status codes and error codes.
 *  - Invalid JSON -> 400 "invalid JSON"; too-large body -> 413.
 *  - Blobs are stored and served as raw bytes.
 *  - Annotations are listed per head and per version; DELETE removes a score.
 */
class WebServerTest {

    private static final int PORT = 18089; // test-only port
    private final ObjectMapper json = new ObjectMapper();
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var objects = new InMemoryObjectStore();
        var refs = new InMemoryRefStore();
        var locks = new ScoreLocks(2_000);
        var properties = new PropertyService(objects, refs, locks);
        var scores = new ScoreService(objects, refs, locks, properties, 16);

        server = new WebServer(PORT, scores, properties, new InMemoryBlobStore());
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + path))
                .method(method, publisher)
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode create(String owner, String name, String title) throws Exception {
        var resp = send("POST", "/scores/" + owner + "/" + name,
                "{\"property\":{\"title\":\"" + title + "\"}}");
        assertEquals(201, resp.statusCode(), resp.body());
        return json.readTree(resp.body());
    }

    private static String addPage(String n) {
        return "{\"type\":\"add_page\",\"add_page\":{\"image\":\"img-" + n + "\",\"thumbnail\":\"th-" + n
                + "\",\"number\":\"" + n + "\"}}";
    }

    private HttpResponse<String> commit(String path, String parent, String... commits) throws Exception {
        return send("POST", path + "/commits",
                "{\"parent\":\"" + parent + "\",\"commits\":[" + String.join(",", commits) + "]}");
    }

    @Test
    void health_is_ok() throws Exception {
        var resp = send("GET", "/admin/health", null);
        assertEquals(200, resp.statusCode());
        assertEquals("ok", json.readTree(resp.body()).get("status").asText());
    }

    @Test
    void score_lifecycle_over_http() throws Exception {
        JsonNode created = create("u1", "s1", "Sonata");
        assertEquals("Sonata", created.get("property").get("title").asText());
        assertEquals(0, created.get("versions").size());
        String root = created.get("head_hash").asText();

        var c1 = commit("/scores/u1/s1", root, addPage("1"), addPage("2"));
        assertEquals(200, c1.statusCode(), c1.body());
        JsonNode r1 = json.readTree(c1.body());
        assertEquals(1, r1.get("version").asInt());
        assertEquals(2, r1.get("pages").size());

        var stale = commit("/scores/u1/s1", root, addPage("3"));
        assertEquals(409, stale.statusCode());
        assertEquals("CONCURRENCY_CONFLICT", json.readTree(stale.body()).get("error").asText());

        var pages = send("GET", "/scores/u1/s1/pages", null);
        JsonNode list = json.readTree(pages.body());
        assertEquals(2, list.size());
        assertEquals("img-1", list.get(0).get("image").asText());

        var versions = json.readTree(send("GET", "/scores/u1/s1/versions", null).body());
        assertEquals(1, versions.get(0).get("version").asInt());
        assertEquals(r1.get("head_hash").asText(), versions.get(0).get("hash").asText());

        var atV1 = send("GET", "/scores/u1/s1/versions/1/pages", null);
        assertEquals(200, atV1.statusCode());
        assertEquals(2, json.readTree(atV1.body()).size());

        var summaries = json.readTree(send("GET", "/scores/u1", null).body());
        assertEquals("s1", summaries.get(0).get("score_name").asText());
        assertEquals(1, summaries.get(0).get("latest_version").asInt());

        String pageHash = r1.get("pages").get(0).asText();
        var objects = send("POST", "/objects", "{\"hashes\":[\"" + pageHash + "\"]}");
        assertEquals(200, objects.statusCode());
        assertEquals("page", json.readTree(objects.body()).get(pageHash).get("kind").asText());
    }

    @Test
    void property_patch_and_no_change() throws Exception {
        String propertyHash = create("u1", "s1", "Sonata").get("property_hash").asText();

        var ok = send("PATCH", "/scores/u1/s1/property",
                "{\"parent\":\"" + propertyHash + "\",\"property\":{\"description\":\"draft\"}}");
        assertEquals(200, ok.statusCode(), ok.body());
        JsonNode body = json.readTree(ok.body());
        assertEquals("Sonata", body.get("property").get("title").asText());
        assertEquals("draft", body.get("property").get("description").asText());

        String next = body.get("property_hash").asText();
        var same = send("PATCH", "/scores/u1/s1/property",
                "{\"parent\":\"" + next + "\",\"property\":{\"description\":\"draft\"}}");
        assertEquals(422, same.statusCode());
        assertEquals("NO_CHANGE", json.readTree(same.body()).get("error").asText());

        var stale = send("PATCH", "/scores/u1/s1/property",
                "{\"parent\":\"" + propertyHash + "\",\"property\":{\"title\":\"Fugue\"}}");
        assertEquals(409, stale.statusCode());
    }

    @Test
    void engine_errors_map_to_status_codes() throws Exception {
        String root = create("u1", "s1", "Sonata").get("head_hash").asText();

        assertEquals(409, send("POST", "/scores/u1/s1", "{}").statusCode());
        assertEquals(404, send("GET", "/scores/u1/nope", null).statusCode());
        assertEquals(404, send("GET", "/scores/u1/s1/versions/7/pages", null).statusCode());

        var unknownType = commit("/scores/u1/s1", root, "{\"type\":\"rotate_page\"}");
        assertEquals(400, unknownType.statusCode());
        assertEquals("UNSUPPORTED_OPERATION", json.readTree(unknownType.body()).get("error").asText());

        var badIndex = commit("/scores/u1/s1", root, "{\"type\":\"delete_page\",\"delete_page\":{\"index\":0}}");
        assertEquals(400, badIndex.statusCode());
        assertEquals("INVALID_OPERATION", json.readTree(badIndex.body()).get("error").asText());

        var missingField = commit("/scores/u1/s1", root,
                "{\"type\":\"add_page\",\"add_page\":{\"image\":\"i\",\"thumbnail\":\"t\"}}");
        assertEquals(400, missingField.statusCode());

        var empty = commit("/scores/u1/s1", root);
        assertEquals(400, empty.statusCode());

        var nullElement = commit("/scores/u1/s1", root, "null");
        assertEquals(400, nullElement.statusCode(), nullElement.body());
        assertEquals("INVALID_OPERATION", json.readTree(nullElement.body()).get("error").asText());

        var missingObject = send("POST", "/objects", "{\"hashes\":[\"" + "0".repeat(64) + "\"]}");
        assertEquals(404, missingObject.statusCode());
        assertEquals("OBJECT_NOT_FOUND", json.readTree(missingObject.body()).get("error").asText());

        assertEquals(405, send("PUT", "/scores/u1/s1", "{}").statusCode());
        assertEquals(404, send("GET", "/nowhere", null).statusCode());
    }

    @Test
    void annotations_over_http() throws Exception {
        String root = create("u1", "s1", "Sonata").get("head_hash").asText();

        var c1 = commit("/scores/u1/s1", root,
                "{\"type\":\"add_annotation\",\"add_annotation\":{\"content\":\"breathe\"}}",
                "{\"type\":\"add_annotation\",\"add_annotation\":{\"content\":\"forte\"}}");
        assertEquals(200, c1.statusCode(), c1.body());
        JsonNode r1 = json.readTree(c1.body());
        assertEquals(1, r1.get("version").asInt());
        assertEquals(2, r1.get("annotations").size());

        var c2 = commit("/scores/u1/s1", r1.get("head_hash").asText(),
                "{\"type\":\"replace_annotation\",\"replace_annotation\":{\"index\":1,\"content\":\"piano\"}}");
        assertEquals(200, c2.statusCode(), c2.body());

        JsonNode latest = json.readTree(send("GET", "/scores/u1/s1/annotations", null).body());
        assertEquals("piano", latest.get(1).get("content").asText());
        assertEquals(1, latest.get(1).get("index").asInt());
        JsonNode atV1 = json.readTree(send("GET", "/scores/u1/s1/versions/1/annotations", null).body());
        assertEquals("forte", atV1.get(1).get("content").asText());

        String hash = latest.get(0).get("hash").asText();
        JsonNode obj = json.readTree(send("POST", "/objects", "{\"hashes\":[\"" + hash + "\"]}").body());
        assertEquals("annotation", obj.get(hash).get("kind").asText());
        assertEquals("breathe", obj.get(hash).get("content").asText());

        var noContent = commit("/scores/u1/s1", json.readTree(c2.body()).get("head_hash").asText(),
                "{\"type\":\"add_annotation\",\"add_annotation\":{}}");
        assertEquals(400, noContent.statusCode());
    }

    @Test
    void delete_removes_the_score() throws Exception {
        String root = create("u1", "s1", "Sonata").get("head_hash").asText();
        assertEquals(200, commit("/scores/u1/s1", root, addPage("1")).statusCode());

        assertEquals(204, send("DELETE", "/scores/u1/s1", null).statusCode());
        assertEquals(404, send("GET", "/scores/u1/s1", null).statusCode());
        assertEquals(404, send("DELETE", "/scores/u1/s1", null).statusCode());
        assertEquals(0, json.readTree(send("GET", "/scores/u1", null).body()).size());

        JsonNode again = create("u1", "s1", "Sonata II");
        assertEquals(0, again.get("versions").size());
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        create("u1", "s1", "Sonata");
        var resp = send("POST", "/scores/u1/s1/commits", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        // Build a body larger than MAX_BODY_BYTES (10 MiB).
        String big = "x".repeat(11 * 1024 * 1024);
        var resp = send("POST", "/scores/u1/s1/commits", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void blobs_round_trip_as_raw_bytes() throws Exception {
        byte[] png = "fake-png-bytes".getBytes(StandardCharsets.UTF_8);
        HttpRequest put = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + "/blobs"))
                .POST(HttpRequest.BodyPublishers.ofByteArray(png))
                .header("Content-Type", "application/octet-stream")
                .build();
        var created = client.send(put, HttpResponse.BodyHandlers.ofString());
        assertEquals(201, created.statusCode());
        String ref = json.readTree(created.body()).get("ref").asText();

        HttpRequest get = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + PORT + "/blobs/" + ref))
                .GET()
                .build();
        var fetched = client.send(get, HttpResponse.BodyHandlers.ofByteArray());
        assertEquals(200, fetched.statusCode());
        assertArrayEquals(png, fetched.body());

        assertEquals(404, send("GET", "/blobs/" + "f".repeat(64), null).statusCode());
    }
}
