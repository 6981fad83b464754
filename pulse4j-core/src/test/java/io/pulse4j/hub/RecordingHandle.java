package io.pulse4j.hub;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

class RecordingHandle implements ConnectionHandle {

    final List<String> frames = new CopyOnWriteArrayList<>();
    final AtomicInteger closeCalls = new AtomicInteger();
    final AtomicBoolean broken = new AtomicBoolean();

    static RecordingHandle broken() {
        RecordingHandle handle = new RecordingHandle();
        handle.broken.set(true);
        return handle;
    }

    @Override
    public void send(String frame) throws IOException {
        if (broken.get()) {
            throw new IOException("Broken pipe");
        }
        frames.add(frame);
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
    }

    long keepalives() {
        return frames.stream().filter(f -> f.startsWith(":keepalive")).count();
    }
}
