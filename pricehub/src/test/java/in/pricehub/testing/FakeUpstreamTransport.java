package in.pricehub.testing;

import in.pricehub.domain.market.Ticker;
import in.pricehub.infrastructure.upstream.UpstreamConnectionException;
import in.pricehub.infrastructure.upstream.UpstreamListener;
import in.pricehub.infrastructure.upstream.UpstreamSession;
import in.pricehub.infrastructure.upstream.UpstreamTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory upstream. Each open() is recorded as an Attempt the test completes by hand.
 */
public final class FakeUpstreamTransport implements UpstreamTransport {

    private final List<Attempt> attempts = new ArrayList<>();

    @Override
    public CompletableFuture<UpstreamSession> open(UpstreamListener listener) {
        Attempt attempt = new Attempt(listener);
        attempts.add(attempt);
        return attempt.future;
    }

    @Override
    public String describe() {
        return "fake://upstream";
    }

    public List<Attempt> attempts() {
        return attempts;
    }

    public int openCount() {
        return attempts.size();
    }

    public Attempt lastAttempt() {
        if (attempts.isEmpty()) {
            throw new IllegalStateException("open() was never called");
        }
        return attempts.get(attempts.size() - 1);
    }

    /**
     * Complete the latest open() successfully and return its session.
     */
    public FakeSession acceptLast() {
        return lastAttempt().accept();
    }

    public void rejectLast(String reason) {
        lastAttempt().reject(reason);
    }

    /**
     * One open() call.
     */
    public static final class Attempt {
        private final UpstreamListener listener;
        private final CompletableFuture<UpstreamSession> future = new CompletableFuture<>();
        private FakeSession session;

        Attempt(UpstreamListener listener) {
            this.listener = listener;
        }

        public FakeSession accept() {
            session = new FakeSession();
            future.complete(session);
            return session;
        }

        public void reject(String reason) {
            future.completeExceptionally(new UpstreamConnectionException("fake", reason));
        }

        public UpstreamListener listener() {
            return listener;
        }

        public FakeSession session() {
            return session;
        }

        public void deliver(String frame) {
            listener.onFrame(frame);
        }

        public void drop() {
            if (session != null) {
                session.writable = false;
            }
            listener.onClosed(1006, "abnormal closure");
        }
    }

    /**
     * Records every message sent on it.
     */
    public static final class FakeSession implements UpstreamSession {
        public enum Kind { SUBSCRIBE, UNSUBSCRIBE }

        public record Sent(Kind kind, Set<Ticker> tickers) {}

        private final List<Sent> sent = new ArrayList<>();
        private final Set<Ticker> upstream = new TreeSet<>();
        private int pings = 0;
        private boolean closed = false;
        private boolean writable = true;

        @Override
        public void subscribe(Set<Ticker> tickers) {
            checkWritable();
            sent.add(new Sent(Kind.SUBSCRIBE, new TreeSet<>(tickers)));
            upstream.addAll(tickers);
        }

        @Override
        public void unsubscribe(Set<Ticker> tickers) {
            checkWritable();
            sent.add(new Sent(Kind.UNSUBSCRIBE, new TreeSet<>(tickers)));
            upstream.removeAll(tickers);
        }

        @Override
        public void ping() {
            checkWritable();
            pings++;
        }

        @Override
        public void close() {
            closed = true;
            writable = false;
        }

        public void breakWrites() {
            writable = false;
        }

        private void checkWritable() {
            if (!writable) {
                throw new UpstreamConnectionException("fake", "session not writable");
            }
        }

        public List<Sent> sent() {
            return sent;
        }

        /**
         * Tickers this session carries after replaying everything sent on it.
         */
        public Set<Ticker> upstreamTickers() {
            return new TreeSet<>(upstream);
        }

        public int pings() {
            return pings;
        }

        public boolean isClosed() {
            return closed;
        }
    }
}
