package in.pricehub.infrastructure.upstream;

/**
 * Callbacks for one upstream session.
 */
public interface UpstreamListener {

    /**
     * Complete inbound text frame (fragments already joined).
     */
    void onFrame(String text);

    void onPong();

    /**
     * Remote side closed the session.
     */
    void onClosed(int statusCode, String reason);

    /**
     * Transport failure; the session is unusable afterwards.
     */
    void onError(Throwable error);
}
