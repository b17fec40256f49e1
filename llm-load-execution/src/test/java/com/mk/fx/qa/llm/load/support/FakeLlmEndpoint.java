package com.mk.fx.qa.llm.load.support;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted chat completion endpoint on the JDK HTTP server. Queued replies are served first, the
 * fallback reply afterwards.
 */
public final class FakeLlmEndpoint implements AutoCloseable {

  private final HttpServer server;
  private final ExecutorService handlers = Executors.newCachedThreadPool();
  private final Deque<Reply> script = new ConcurrentLinkedDeque<>();
  private final List<String> requestBodies = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger requestCount = new AtomicInteger();
  private final AtomicInteger abandonedReplies = new AtomicInteger();
  private volatile Reply fallback = Reply.ok("Hello from the fake model", 12);

  private FakeLlmEndpoint() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/v1/chat/completions", this::handle);
    server.setExecutor(handlers);
    server.start();
  }

  public static FakeLlmEndpoint start() throws IOException {
    return new FakeLlmEndpoint();
  }

  public String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  public FakeLlmEndpoint enqueue(Reply... replies) {
    for (Reply reply : replies) {
      script.addLast(reply);
    }
    return this;
  }

  public FakeLlmEndpoint fallback(Reply reply) {
    this.fallback = reply;
    return this;
  }

  public int requestCount() {
    return requestCount.get();
  }

  public List<String> requestBodies() {
    synchronized (requestBodies) {
      return List.copyOf(requestBodies);
    }
  }

  private void handle(HttpExchange exchange) {
    try {
      requestBodies.add(
          new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
      requestCount.incrementAndGet();
      var reply = script.pollFirst();
      if (reply == null) {
        reply = fallback;
      }
      if (reply.delayMillis() > 0) {
        try {
          TimeUnit.MILLISECONDS.sleep(reply.delayMillis());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          return;
        }
      }
      var body = reply.body().getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().add("Content-Type", "application/json");
      exchange.sendResponseHeaders(reply.status(), body.length == 0 ? -1 : body.length);
      if (body.length > 0) {
        try (OutputStream os = exchange.getResponseBody()) {
          os.write(body);
        }
      }
    } catch (IOException e) {
      // client gave up (e.g. timed out) before the reply was written
      abandonedReplies.incrementAndGet();
    } finally {
      exchange.close();
    }
  }

  @Override
  public void close() {
    server.stop(0);
    handlers.shutdownNow();
  }

  /** One scripted reply. */
  public record Reply(int status, String body, long delayMillis) {

    public static Reply ok(String content, int completionTokens) {
      return new Reply(200, completion(content, completionTokens), 0);
    }

    public static Reply status(int status, String body) {
      return new Reply(status, body, 0);
    }

    public Reply delayedBy(long millis) {
      return new Reply(status, body, millis);
    }

    public static String completion(String content, int completionTokens) {
      return "{\"id\":\"cmpl-1\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\","
          + "\"content\":\""
          + content
          + "\"}}],\"usage\":{\"prompt_tokens\":10,\"completion_tokens\":"
          + completionTokens
          + "}}";
    }
  }
}
