package me.golemcore.incident.testsupport.http;

import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * OkHttp interceptor that answers from a queue of planned responses and records
 * every request. No network I/O.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> captured = new ConcurrentLinkedQueue<>();

    public void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body, "application/json", Headers.of(), null));
    }

    public void enqueueJson(int code, String body, Headers headers) {
        planned.add(new Planned(code, body, "application/json", headers, null));
    }

    /**
     * Plans a newline-delimited JSON stream, one event per line.
     */
    public void enqueueNdjson(List<String> lines) {
        planned.add(new Planned(200, String.join("\n", lines) + "\n", "application/x-ndjson", Headers.of(), null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, "", null, Headers.of(), failure));
    }

    public CapturedRequest takeRequest() {
        return captured.poll();
    }

    public int getRequestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new CapturedRequest(request, readBody(request)));

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }

        MediaType mediaType = next.contentType() != null ? MediaType.parse(next.contentType()) : null;
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .headers(next.headers())
                .body(ResponseBody.create(next.body().getBytes(StandardCharsets.UTF_8), mediaType))
                .build();
    }

    private static String readBody(Request request) throws IOException {
        RequestBody body = request.body();
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, String contentType, Headers headers, IOException failure) {
    }

    public record CapturedRequest(Request request, String body) {

        public String method() {
            return request.method();
        }

        public String path() {
            return request.url().encodedPath();
        }

        public String header(String name) {
            return request.header(name);
        }
    }
}
