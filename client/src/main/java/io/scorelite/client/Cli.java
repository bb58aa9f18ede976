// file: client/src/main/java/io/scorelite/client/Cli.java
package io.scorelite.client;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Simple CLI for interacting with a running ScoreLite server over HTTP.
 *
 * Usage:
 *   scorelite-cli [--base-url http://host:port] <command> ...
 *
 * Examples:
 *   scorelite-cli create u1 s1 "Sonata"
 *   scorelite-cli add-page u1 s1 <image-ref> <thumb-ref> 1
 *   scorelite-cli pages u1 s1 2
 *   scorelite-cli add-annotation u1 s1 "breathe before bar 12"
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final ScoreApiClient api;

    Cli(ScoreApiClient api) {
        this.api = api;
    }

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                usageAndExit("missing command");
            }

            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            String[] rest = parsed.getValue();
            if (rest.length == 0) {
                usageAndExit("missing command");
            }

            new Cli(new ScoreApiClient(parsed.getKey())).run(rest);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (ApiException e) {
            System.err.println("error: " + e.getMessage());
            if (e.isConflict()) System.err.println("the score changed meanwhile; re-run the command");
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    /** Execute one command; output goes to stdout. */
    void run(String[] rest) {
        String cmd = rest[0];
        switch (cmd) {
            case "list" -> {
                arity(rest, 2, "list requires <owner>");
                for (ScoreSummaryInfo s : api.listScores(rest[1])) {
                    System.out.printf("%s\t%s\tv%s%n", s.scoreName, s.title,
                            s.latestVersion == null ? "-" : s.latestVersion);
                }
            }
            case "get" -> {
                arity(rest, 3, "get requires <owner> <name>");
                ScoreInfo s = api.getScore(rest[1], rest[2]);
                System.out.println("title:       " + s.property.title);
                System.out.println("description: " + s.property.description);
                System.out.println("head:        " + s.headHash);
                System.out.println("pages:       " + s.pages.size());
                System.out.println("annotations: " + (s.annotations == null ? 0 : s.annotations.size()));
                System.out.println("versions:    " + String.join(", ", s.versions));
            }
            case "create" -> {
                if (rest.length < 3 || rest.length > 5) throw new CliException("create requires <owner> <name> [title] [description]");
                ScoreInfo s = api.createScore(rest[1], rest[2], opt(rest, 3), opt(rest, 4));
                System.out.println("created " + s.owner + "/" + s.scoreName + " head=" + s.headHash);
            }
            case "pages" -> {
                if (rest.length != 3 && rest.length != 4) throw new CliException("pages requires <owner> <name> [version]");
                List<PageInfo> pages = rest.length == 4
                        ? api.getPages(rest[1], rest[2], rest[3])
                        : api.getPages(rest[1], rest[2]);
                for (int i = 0; i < pages.size(); i++) {
                    PageInfo p = pages.get(i);
                    System.out.printf("%d\t%s\t%s\t%s%n", i, p.number, p.image, p.thumbnail);
                }
            }
            case "add-page" -> {
                arity(rest, 6, "add-page requires <owner> <name> <image> <thumbnail> <number>");
                commit(rest[1], rest[2], new PageOperation.Add(rest[3], rest[4], rest[5]));
            }
            case "insert-page" -> {
                arity(rest, 7, "insert-page requires <owner> <name> <index> <image> <thumbnail> <number>");
                commit(rest[1], rest[2], new PageOperation.Insert(index(rest[3]), rest[4], rest[5], rest[6]));
            }
            case "delete-page" -> {
                arity(rest, 4, "delete-page requires <owner> <name> <index>");
                commit(rest[1], rest[2], new PageOperation.Remove(index(rest[3])));
            }
            case "delete" -> {
                arity(rest, 3, "delete requires <owner> <name>");
                api.deleteScore(rest[1], rest[2]);
                System.out.println("deleted " + rest[1] + "/" + rest[2]);
            }
            case "annotations" -> {
                if (rest.length != 3 && rest.length != 4) throw new CliException("annotations requires <owner> <name> [version]");
                List<AnnotationInfo> annotations = rest.length == 4
                        ? api.getAnnotations(rest[1], rest[2], rest[3])
                        : api.getAnnotations(rest[1], rest[2]);
                for (AnnotationInfo a : annotations) {
                    System.out.printf("%d\t%s%n", a.index, a.content);
                }
            }
            case "add-annotation" -> {
                arity(rest, 4, "add-annotation requires <owner> <name> <content>");
                commit(rest[1], rest[2], new AnnotationOperation.Add(rest[3]));
            }
            case "remove-annotation" -> {
                arity(rest, 4, "remove-annotation requires <owner> <name> <index>");
                commit(rest[1], rest[2], new AnnotationOperation.Remove(index(rest[3])));
            }
            case "replace-annotation" -> {
                arity(rest, 5, "replace-annotation requires <owner> <name> <index> <content>");
                commit(rest[1], rest[2], new AnnotationOperation.Replace(index(rest[3]), rest[4]));
            }
            case "set-property" -> {
                if (rest.length < 3) throw new CliException("set-property requires <owner> <name> [--title t] [--description d]");
                String title = null;
                String description = null;
                for (int i = 3; i < rest.length; i++) {
                    switch (rest[i]) {
                        case "--title" -> title = value(rest, ++i, "--title");
                        case "--description" -> description = value(rest, ++i, "--description");
                        default -> throw new CliException("unknown option: " + rest[i]);
                    }
                }
                if (title == null && description == null) throw new CliException("nothing to set");
                try {
                    System.out.println("property=" + api.updateProperty(rest[1], rest[2], title, description));
                } catch (IllegalArgumentException unchanged) {
                    throw new CliException(unchanged.getMessage());
                }
            }
            default -> throw new CliException("unknown command: " + cmd);
        }
    }

    private void commit(String owner, String name, PageOperation op) {
        CommitInfo c = api.updatePages(owner, name, List.of(op));
        System.out.println("version " + c.version + " head=" + c.headHash + " pages=" + c.pages.size());
    }

    private void commit(String owner, String name, AnnotationOperation op) {
        CommitInfo c = api.updateAnnotations(owner, name, List.of(op));
        System.out.println("version " + c.version + " head=" + c.headHash + " annotations=" + c.annotations.size());
    }

    private static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                usageAndExit("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    private static void arity(String[] rest, int n, String msg) {
        if (rest.length != n) throw new CliException(msg);
    }

    private static String opt(String[] rest, int i) {
        return i < rest.length ? rest[i] : null;
    }

    private static String value(String[] rest, int i, String flag) {
        if (i >= rest.length) throw new CliException(flag + " requires a value");
        return rest[i];
    }

    private static int index(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new CliException("index must be an integer: " + s);
        }
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  scorelite-cli [--base-url http://host:port] list <owner>
                  scorelite-cli [--base-url http://host:port] get <owner> <name>
                  scorelite-cli [--base-url http://host:port] create <owner> <name> [title] [description]
                  scorelite-cli [--base-url http://host:port] pages <owner> <name> [version]
                  scorelite-cli [--base-url http://host:port] add-page <owner> <name> <image> <thumbnail> <number>
                  scorelite-cli [--base-url http://host:port] insert-page <owner> <name> <index> <image> <thumbnail> <number>
                  scorelite-cli [--base-url http://host:port] delete-page <owner> <name> <index>
                  scorelite-cli [--base-url http://host:port] delete <owner> <name>
                  scorelite-cli [--base-url http://host:port] annotations <owner> <name> [version]
                  scorelite-cli [--base-url http://host:port] add-annotation <owner> <name> <content>
                  scorelite-cli [--base-url http://host:port] remove-annotation <owner> <name> <index>
                  scorelite-cli [--base-url http://host:port] replace-annotation <owner> <name> <index> <content>
                  scorelite-cli [--base-url http://host:port] set-property <owner> <name> [--title t] [--description d]
                """);
        System.exit(1);
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
