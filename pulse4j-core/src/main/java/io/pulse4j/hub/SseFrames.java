package io.pulse4j.hub;

/**
 * Text frames of the {@code text/event-stream} wire format.
 */
public final class SseFrames {

    private SseFrames() {
    }

    /**
     * {@code data: <json>\n\n}. Multi-line JSON is split into one data line per line.
     */
    public static String data(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json must not be null");
        }
        StringBuilder sb = new StringBuilder(json.length() + 8);
        for (String line : json.split("\r\n|\r|\n", -1)) {
            sb.append("data: ").append(line).append('\n');
        }
        return sb.append('\n').toString();
    }

    public static String keepalive(long epochMillis) {
        return ":keepalive " + epochMillis + "\n\n";
    }
}
