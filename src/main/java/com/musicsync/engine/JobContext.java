package com.musicsync.engine;

import java.util.function.Consumer;

/**
 * What a running job sees of its controller: the stop token and a progress sink.
 */
public class JobContext {
    private final CancellationToken token;
    private final Consumer<ProgressSnapshot> sink;
    private volatile ProgressSnapshot last = ProgressSnapshot.idle();

    public JobContext(CancellationToken token, Consumer<ProgressSnapshot> sink) {
        this.token = token;
        this.sink = sink;
    }

    public CancellationToken token() {
        return token;
    }

    public void progress(int current, int total, String message, String currentKey) {
        publish(new ProgressSnapshot(current, total, message, currentKey, last.lastUrl()));
    }

    public void lastUrl(String url) {
        publish(new ProgressSnapshot(last.current(), last.total(), last.message(), last.currentKey(), url));
    }

    public void message(String message) {
        publish(new ProgressSnapshot(last.current(), last.total(), message, last.currentKey(), last.lastUrl()));
    }

    public ProgressSnapshot last() {
        return last;
    }

    private void publish(ProgressSnapshot p) {
        last = p;
        sink.accept(p);
    }
}
