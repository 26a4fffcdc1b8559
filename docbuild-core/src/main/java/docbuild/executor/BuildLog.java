package docbuild.executor;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Size-bounded build log.
 *
 * <p>Once {@code maxBytes} (UTF-8) have been written, further output is
 * dropped and a single truncation marker is appended. While the build runs the
 * log is handed to a flush sink at most once per {@code flushIntervalMs}, so
 * the stored attempt shows progress.
 *
 * <p>Thread-safe: the sandbox may append from an output-pumping thread.
 */
public final class BuildLog {
  static final String TRUNCATED_MARKER = "\n[log truncated]\n";

  private final long maxBytes;
  private final long flushIntervalMs;
  private final Consumer<String> flushSink;

  private final StringBuilder text = new StringBuilder();
  private long bytes;
  private boolean truncated;
  private long lastFlushMs;

  public BuildLog(long maxBytes) {
    this(maxBytes, Long.MAX_VALUE, snapshot -> { });
  }

  public BuildLog(long maxBytes, long flushIntervalMs, Consumer<String> flushSink) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be > 0");
    }
    this.maxBytes = maxBytes;
    this.flushIntervalMs = flushIntervalMs;
    this.flushSink = Objects.requireNonNull(flushSink, "flushSink");
    this.lastFlushMs = System.currentTimeMillis();
  }

  /** Appends {@code line} followed by a newline. */
  public void line(String line) {
    append(line + "\n");
  }

  public void append(String chunk) {
    String toFlush = null;
    synchronized (this) {
      if (truncated || chunk.isEmpty()) {
        return;
      }
      byte[] encoded = chunk.getBytes(StandardCharsets.UTF_8);
      if (bytes + encoded.length <= maxBytes) {
        text.append(chunk);
        bytes += encoded.length;
      } else {
        int room = (int) (maxBytes - bytes);
        String head = new String(encoded, 0, room, StandardCharsets.UTF_8);
        // a split multi-byte char decodes to U+FFFD; drop it
        if (!head.isEmpty() && head.charAt(head.length() - 1) == '\uFFFD') {
          head = head.substring(0, head.length() - 1);
        }
        text.append(head).append(TRUNCATED_MARKER);
        bytes = maxBytes;
        truncated = true;
      }
      long now = System.currentTimeMillis();
      if (now - lastFlushMs >= flushIntervalMs) {
        lastFlushMs = now;
        toFlush = text.toString();
      }
    }
    if (toFlush != null) {
      flushSink.accept(toFlush);
    }
  }

  public synchronized boolean truncated() {
    return truncated;
  }

  public synchronized String contents() {
    return text.toString();
  }
}
