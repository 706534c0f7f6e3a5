package io.meshlite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.PrintStream;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;

/**
 * Simple CLI for interacting with a running mesh node over HTTP.
 *
 * Usage:
 *   meshlite-cli [--base-url http://host:port] ping
 *   meshlite-cli [--base-url http://host:port] peers
 *   meshlite-cli [--base-url http://host:port] tracks
 *   meshlite-cli [--base-url http://host:port] stats
 *   meshlite-cli [--base-url http://host:port] get <hash> [out-file]
 *   meshlite-cli [--base-url http://host:port] add <file> <title> <artist> [duration]
 *
 * Examples:
 *   meshlite-cli add song.mp3 "Mesh Melody" "Decentralized Artist" 180
 *   meshlite-cli get ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad out.mp3
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private static final String USAGE = """
            Usage:
              meshlite-cli [--base-url http://host:port] ping
              meshlite-cli [--base-url http://host:port] peers
              meshlite-cli [--base-url http://host:port] tracks
              meshlite-cli [--base-url http://host:port] stats
              meshlite-cli [--base-url http://host:port] get <hash> [out-file]
              meshlite-cli [--base-url http://host:port] add <file> <title> <artist> [duration]
            """;

    private final HttpClient http;
    private final ObjectMapper json = new ObjectMapper();
    private final String baseUrl;
    private final PrintStream out;

    Cli(String baseUrl, PrintStream out) {
        this.http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Parse and execute one command.
     *
     * @return process exit code: 0 success, 1 usage or request error, 2 unexpected failure
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            String baseUrl = DEFAULT_BASE_URL;
            String[] rest = args;
            if (rest.length >= 1 && "--base-url".equals(rest[0])) {
                if (rest.length < 2) {
                    throw new CliException("--base-url requires a value");
                }
                baseUrl = rest[1];
                rest = Arrays.copyOfRange(rest, 2, rest.length);
            }
            if (rest.length == 0) {
                throw new CliException("missing command", true);
            }

            Cli cli = new Cli(baseUrl, out);
            String cmd = rest[0];
            switch (cmd) {
                case "ping" -> {
                    expectArgs(rest, 1, 1, "ping takes no arguments");
                    cli.ping();
                }
                case "peers" -> {
                    expectArgs(rest, 1, 1, "peers takes no arguments");
                    cli.printJson("/peers");
                }
                case "tracks" -> {
                    expectArgs(rest, 1, 1, "tracks takes no arguments");
                    cli.printJson("/tracks");
                }
                case "stats" -> {
                    expectArgs(rest, 1, 1, "stats takes no arguments");
                    cli.printJson("/admin/stats");
                }
                case "get" -> {
                    expectArgs(rest, 2, 3, "get requires <hash> [out-file]");
                    cli.get(rest[1], rest.length == 3 ? Path.of(rest[2]) : null);
                }
                case "add" -> {
                    expectArgs(rest, 4, 5, "add requires <file> <title> <artist> [duration]");
                    int duration = rest.length == 5 ? parseDuration(rest[4]) : 0;
                    cli.add(Path.of(rest[1]), rest[2], rest[3], duration);
                }
                case "help", "--help", "-h" -> out.print(USAGE);
                default -> throw new CliException("unknown command: " + cmd, true);
            }
            return 0;
        } catch (CliException e) {
            err.println("error: " + e.getMessage());
            if (e.showUsage) {
                err.print(USAGE);
            }
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    // ---------- commands ----------

    private void ping() throws IOException, InterruptedException {
        JsonNode body = getJson("/ping");
        out.println(body.path("status").asText() + " " + body.path("peer_id").asText());
    }

    private void printJson(String path) throws IOException, InterruptedException {
        JsonNode body = getJson(path);
        out.println(json.writerWithDefaultPrettyPrinter().writeValueAsString(body));
    }

    private void get(String hash, Path outFile) throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = send(HttpRequest.newBuilder(uri("/content/" + hash)).GET().build(),
                HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() == 404) {
            out.println("(not found)");
            return;
        }
        if (resp.statusCode() != 200) {
            throw new CliException("GET failed (" + resp.statusCode() + "): "
                    + new String(resp.body(), StandardCharsets.UTF_8));
        }
        if (outFile == null) {
            out.write(resp.body());
            out.flush();
            return;
        }
        Files.write(outFile, resp.body());
        out.println("wrote " + resp.body().length + " bytes to " + outFile);
    }

    private void add(Path file, String title, String artist, int duration)
            throws IOException, InterruptedException {
        if (!Files.isRegularFile(file)) {
            throw new CliException("not a file: " + file);
        }
        ObjectNode req = json.createObjectNode();
        req.put("title", title);
        req.put("artist", artist);
        req.put("duration", duration);
        req.put("contentBase64", Base64.getEncoder().encodeToString(Files.readAllBytes(file)));

        HttpRequest httpReq = HttpRequest.newBuilder(uri("/admin/tracks"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofByteArray(json.writeValueAsBytes(req)))
                .build();
        HttpResponse<String> resp = send(httpReq, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("add failed (" + resp.statusCode() + "): " + resp.body());
        }
        JsonNode rec = json.readTree(resp.body());
        out.println(rec.path("content_hash").asText());
    }

    // ---------- helpers ----------

    private JsonNode getJson(String path) throws IOException, InterruptedException {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(uri(path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new CliException("GET " + path + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return json.readTree(resp.body());
    }

    private <T> HttpResponse<T> send(HttpRequest req, HttpResponse.BodyHandler<T> handler)
            throws IOException, InterruptedException {
        try {
            return http.send(req, handler);
        } catch (ConnectException e) {
            throw new CliException("cannot reach node at " + baseUrl);
        }
    }

    private URI uri(String path) {
        return URI.create(baseUrl + path);
    }

    private static void expectArgs(String[] args, int min, int max, String message) {
        if (args.length < min || args.length > max) {
            throw new CliException(message, true);
        }
    }

    private static int parseDuration(String s) {
        try {
            int d = Integer.parseInt(s);
            if (d < 0) {
                throw new CliException("duration must be >= 0");
            }
            return d;
        } catch (NumberFormatException e) {
            throw new CliException("duration must be an integer: " + s);
        }
    }

    static final class CliException extends RuntimeException {
        private final boolean showUsage;

        CliException(String msg) {
            this(msg, false);
        }

        CliException(String msg, boolean showUsage) {
            super(msg);
            this.showUsage = showUsage;
        }
    }
}
