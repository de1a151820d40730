package dev.plotkeeper.testutil;

import dev.plotkeeper.daemon.shutdown.HostWindow;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Records what the shutdown sequence asked of the window; the confirmation answer is up to the test. */
public final class RecordingHostWindow implements HostWindow {
    private final List<String> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger confirmations = new AtomicInteger();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private volatile CompletableFuture<Boolean> answer = new CompletableFuture<>();

    /** Subsequent confirmations answer immediately. */
    public void answerWith(boolean confirmed) {
        answer = CompletableFuture.completedFuture(confirmed);
    }

    /** Subsequent confirmations wait on the returned future. */
    public CompletableFuture<Boolean> answerLater() {
        var pending = new CompletableFuture<Boolean>();
        answer = pending;
        return pending;
    }

    @Override
    public CompletableFuture<Boolean> confirmExit() {
        confirmations.incrementAndGet();
        events.add("confirm");
        return answer;
    }

    @Override
    public void showClosingPresentation() {
        events.add("closing");
    }

    @Override
    public void close() {
        events.add("close");
        closed.complete(null);
    }

    /** Lets the sequence record its own steps in between the window's. */
    public void record(String event) {
        events.add(event);
    }

    public List<String> events() {
        return List.copyOf(events);
    }

    public int confirmations() {
        return confirmations.get();
    }

    public CompletableFuture<Void> closed() {
        return closed;
    }
}
