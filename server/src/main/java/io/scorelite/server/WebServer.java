// file: server/src/main/java/io/scorelite/server/WebServer.java
package io.scorelite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.scorelite.core.ErrorKind;
import io.scorelite.core.PropertyPatch;
import io.scorelite.core.ScoreHistoryException;
import io.scorelite.core.ScoreHistoryException.InvalidOperation;
import io.scorelite.core.ScoreId;
import io.scorelite.core.ScoreObject;
import io.scorelite.core.VersionEntry;
import io.scorelite.server.dto.*;
import io.scorelite.storage.BlobStore;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Thin HTTP adapter over ScoreService + PropertyService + BlobStore.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map engine failures to HTTP status codes with a stable error code.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /admin/health
 *   - GET    /scores/{owner}                              Score summaries, by name
 *   - POST   /scores/{owner}/{name}                       Create score (201)
 *   - GET    /scores/{owner}/{name}                       Score detail
 *   - DELETE /scores/{owner}/{name}                       Delete score (204)
 *   - GET    /scores/{owner}/{name}/versions              Version list
 *   - GET    /scores/{owner}/{name}/pages                 Pages of the head
 *   - GET    /scores/{owner}/{name}/versions/{v}/pages    Pages of version v
 *   - GET    /scores/{owner}/{name}/annotations           Annotations of the head
 *   - GET    /scores/{owner}/{name}/versions/{v}/annotations  Annotations of version v
 *   - POST   /scores/{owner}/{name}/commits               Apply a commit batch
 *   - GET    /scores/{owner}/{name}/property              Current property
 *   - PATCH  /scores/{owner}/{name}/property              Partial property update
 *   - POST   /objects                                     Batch object lookup
 *   - POST   /blobs                                       Store raw bytes (201)
 *   - GET    /blobs/{ref}                                 Fetch raw bytes
 *
 * Error body: { "error": CODE, "message": text, "category": text }.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String JSON = "application/json";
    private static final String OCTETS = "application/octet-stream";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ScoreService scores;
    private final PropertyService properties;
    private final BlobStore blobs;

    public WebServer(int port, ScoreService scores, PropertyService properties, BlobStore blobs) {
        this.scores = scores;
        this.properties = properties;
        this.blobs = blobs;

        // engine calls block (locks, fsync): run them on worker threads
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::handle))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop(); // For tests to stop server
    }

    // ---------- dispatch ----------

    /** Status + body of a handled request. A byte[] body is sent raw. */
    private record Reply(int status, Object body) {
        static Reply ok(Object body) { return new Reply(200, body); }
        static Reply created(Object body) { return new Reply(201, body); }
        static Reply noContent() { return new Reply(204, null); }
    }

    /** Routing failure that never reached the engine. */
    private static final class HttpError extends RuntimeException {
        final int status;
        final String code;

        HttpError(int status, String code, String message) {
            super(message);
            this.status = status;
            this.code = code;
        }
    }

    private void handle(HttpServerExchange ex) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status;
        long engineMs = -1L;
        Throwable error = null;

        try {
            byte[] body = ex.getInputStream().readNBytes(MAX_BODY_BYTES + 1);
            if (body.length > MAX_BODY_BYTES) {
                throw new HttpError(413, "PAYLOAD_TOO_LARGE", "request body too large");
            }
            long eStart = System.nanoTime();
            Reply reply = route(method, segments(path), body);
            engineMs = (System.nanoTime() - eStart) / 1_000_000L;
            status = reply.status();
            send(ex, status, reply.body());
        } catch (HttpError http) {
            status = http.status;
            send(ex, status, errorBody(http.code, http.getMessage(), null));
        } catch (ScoreHistoryException engine) {
            status = statusFor(engine.kind());
            error = engine;
            send(ex, status, errorBody(engine.kind().name(), engine.getMessage(), engine.kind().category()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, errorBody("BAD_REQUEST", "invalid JSON", null));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, errorBody("BAD_REQUEST", bad.getMessage(), null));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, errorBody("INTERNAL", e.getClass().getSimpleName() + ": " + e.getMessage(), null));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, ex.getStatusCode(), totalMs, engineMs, error);
        }
    }

    private Reply route(String method, List<String> seg, byte[] body) throws IOException {
        if (seg.equals(List.of("admin", "health"))) {
            requireMethod(method, "GET");
            return Reply.ok(Map.of("status", "ok"));
        }
        if (seg.equals(List.of("objects"))) {
            requireMethod(method, "POST");
            return handleObjects(body);
        }
        if (!seg.isEmpty() && seg.get(0).equals("blobs")) {
            if (seg.size() == 1) {
                requireMethod(method, "POST");
                return Reply.created(Map.of("ref", blobs.put(body)));
            }
            if (seg.size() == 2) {
                requireMethod(method, "GET");
                String ref = seg.get(1);
                return Reply.ok(blobs.get(ref)
                        .orElseThrow(() -> new HttpError(404, "BLOB_NOT_FOUND", "blob not found: " + ref)));
            }
        }
        if (!seg.isEmpty() && seg.get(0).equals("scores")) {
            if (seg.size() == 2) {
                requireMethod(method, "GET");
                return handleListScores(seg.get(1));
            }
            if (seg.size() >= 3) {
                return routeScore(method, ScoreId.of(seg.get(1), seg.get(2)), seg.subList(3, seg.size()), body);
            }
        }
        throw new HttpError(404, "NOT_FOUND", "not found");
    }

    private Reply routeScore(String method, ScoreId id, List<String> rest, byte[] body) throws IOException {
        if (rest.isEmpty()) {
            switch (method) {
                case "GET" -> { return Reply.ok(ScoreResponse.from(scores.getScore(id))); }
                case "POST" -> { return handleCreate(id, body); }
                case "DELETE" -> {
                    scores.deleteScore(id);
                    return Reply.noContent();
                }
                default -> throw methodNotAllowed();
            }
        }
        if (rest.equals(List.of("versions"))) {
            requireMethod(method, "GET");
            List<VersionResponse> out = new ArrayList<>();
            for (VersionEntry v : scores.listVersions(id)) out.add(VersionResponse.from(v));
            return Reply.ok(out);
        }
        if (rest.equals(List.of("pages"))) {
            requireMethod(method, "GET");
            return Reply.ok(pages(scores.getLatestPages(id)));
        }
        if (rest.size() == 3 && rest.get(0).equals("versions") && rest.get(2).equals("pages")) {
            requireMethod(method, "GET");
            return Reply.ok(pages(scores.getPages(id, rest.get(1))));
        }
        if (rest.equals(List.of("annotations"))) {
            requireMethod(method, "GET");
            return Reply.ok(annotations(scores.getLatestAnnotations(id)));
        }
        if (rest.size() == 3 && rest.get(0).equals("versions") && rest.get(2).equals("annotations")) {
            requireMethod(method, "GET");
            return Reply.ok(annotations(scores.getAnnotations(id, rest.get(1))));
        }
        if (rest.equals(List.of("commits"))) {
            requireMethod(method, "POST");
            var req = json.readValue(body, CommitRequestDto.class);
            return Reply.ok(CommitResponse.from(scores.commit(id, req.toCommitRequest())));
        }
        if (rest.equals(List.of("property"))) {
            switch (method) {
                case "GET" -> {
                    var detail = scores.getScore(id);
                    var dto = new UpdatePropertyResponse();
                    dto.propertyHash = detail.propertyHash();
                    dto.property = PropertyDto.from(detail.property());
                    return Reply.ok(dto);
                }
                case "PATCH" -> { return handleUpdateProperty(id, body); }
                default -> throw methodNotAllowed();
            }
        }
        throw new HttpError(404, "NOT_FOUND", "not found");
    }

    // ---------- handlers ----------

    /** POST /scores/{owner}/{name}; an empty body creates a score with an empty property. */
    private Reply handleCreate(ScoreId id, byte[] body) throws IOException {
        var req = body.length == 0 ? new CreateScoreRequest() : json.readValue(body, CreateScoreRequest.class);
        PropertyDto p = req.property != null ? req.property : new PropertyDto();
        return Reply.created(ScoreResponse.from(scores.createScore(id, p.title, p.description)));
    }

    /** PATCH /scores/{owner}/{name}/property */
    private Reply handleUpdateProperty(ScoreId id, byte[] body) throws IOException {
        var req = json.readValue(body, UpdatePropertyRequest.class);
        if (req.property == null) throw new InvalidOperation("property is required");
        PropertyPatch patch = req.property.toPatch();
        PropertyService.Update u = properties.updateProperty(id, req.parent, patch);

        var dto = new UpdatePropertyResponse();
        dto.propertyHash = u.propertyHash();
        dto.property = PropertyDto.from(u.property());
        return Reply.ok(dto);
    }

    /** GET /scores/{owner} */
    private Reply handleListScores(String owner) {
        if (owner.isBlank()) throw new IllegalArgumentException("owner must not be blank");
        List<ScoreSummaryResponse> out = new ArrayList<>();
        for (ScoreService.ScoreSummary s : scores.listScores(owner)) out.add(ScoreSummaryResponse.from(s));
        return Reply.ok(out);
    }

    /** POST /objects: every hash must exist, otherwise 404 with the missing ones. */
    private Reply handleObjects(byte[] body) throws IOException {
        var req = json.readValue(body, ObjectsRequest.class);
        if (req.hashes == null) throw new IllegalArgumentException("hashes is required");
        Map<String, ScoreObject> found = scores.getObjects(new HashSet<>(req.hashes));
        Map<String, ObjectResponse> out = new TreeMap<>();
        found.forEach((hash, obj) -> out.put(hash, ObjectResponse.from(obj)));
        return Reply.ok(out);
    }

    // ---------- helpers ----------

    static int statusFor(ErrorKind kind) {
        return switch (kind) {
            case SCORE_NOT_FOUND, VERSION_NOT_FOUND, OBJECT_NOT_FOUND -> 404;
            case SCORE_ALREADY_EXISTS, CONCURRENCY_CONFLICT -> 409;
            case INVALID_OPERATION, UNSUPPORTED_OPERATION -> 400;
            case NO_CHANGE -> 422;
        };
    }

    private static List<PageResponse> pages(List<ScoreService.StoredPage> pages) {
        List<PageResponse> out = new ArrayList<>(pages.size());
        for (ScoreService.StoredPage p : pages) out.add(PageResponse.from(p));
        return out;
    }

    private static List<AnnotationResponse> annotations(List<ScoreService.StoredAnnotation> annotations) {
        List<AnnotationResponse> out = new ArrayList<>(annotations.size());
        for (int i = 0; i < annotations.size(); i++) out.add(AnnotationResponse.from(i, annotations.get(i)));
        return out;
    }

    private static void requireMethod(String method, String expected) {
        if (!expected.equals(method)) throw methodNotAllowed();
    }

    private static HttpError methodNotAllowed() {
        return new HttpError(405, "METHOD_NOT_ALLOWED", "method not allowed");
    }

    private static List<String> segments(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
        return trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("/", -1));
    }

    private static Map<String, Object> errorBody(String code, String message, String category) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        if (category != null) body.put("category", category);
        return body;
    }

    /** Serialize 'body' as JSON (or raw bytes) and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        if (body == null) {
            ex.setStatusCode(code);
            ex.endExchange();
            return;
        }
        try {
            byte[] bytes;
            if (body instanceof byte[] raw) {
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, OCTETS);
                bytes = raw;
            } else {
                ex.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
                bytes = json.writeValueAsBytes(body);
            }
            ex.setStatusCode(code);
            ex.getResponseSender().send(ByteBuffer.wrap(bytes));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
