package io.pulse4j.pipeline;

public record TriggerResponse(
        int status,
        String body
) {
    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
