package in.pricehub.service.core;

/**
 * Registration returned by every on*(callback) method. Closing it detaches the callback;
 * closing twice is harmless.
 */
@FunctionalInterface
public interface ListenerHandle extends AutoCloseable {

    @Override
    void close();
}
